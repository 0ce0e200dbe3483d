package phyloxml;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;

import arbor.tree.AttributeArray;
import arbor.tree.AttributedTree;
import arbor.tree.ValueKind;
import phyloxml.xml.XMLDataElement;

public class CladeWriterTest {

	private static WritePass passFor(AttributedTree tree) {
		return new WritePass(tree, tree.getEdgeData().getArray("weight"), tree.getVertexData().getArray("node name"));
	}

	private static List<XMLDataElement> clades(XMLDataElement e) {
		List<XMLDataElement> found = new ArrayList<XMLDataElement>();
		for (XMLDataElement n : e.getNestedElements()) {
			if (n.getName().equals("clade")) {
				found.add(n);
			}
		}
		return found;
	}

	// checks that the clade under `cladeElement` has the shape of the subtree under `vertex`
	private static void assertSameShape(AttributedTree tree, int vertex, XMLDataElement cladeElement) {
		List<XMLDataElement> childClades = clades(cladeElement);
		assertEquals(tree.getNumberOfChildren(vertex), childClades.size());
		AttributeArray names = tree.getVertexData().getArray("node name");
		assertEquals(names.getVariantValue(vertex).toString(),
				cladeElement.findNestedElementWithName("name").getCharacterData());
		for (int i = 0; i < childClades.size(); i++) {
			assertSameShape(tree, tree.getChild(vertex, i), childClades.get(i));
		}
	}

	@Test
	public void testShapeAndSiblingOrder() {
		AttributedTree tree = new AttributedTree();
		int r = tree.addRoot();
		int a = tree.addChild(r);
		int b = tree.addChild(r);
		int c = tree.addChild(r);
		tree.addChild(a);
		tree.addChild(a);
		tree.addChild(c);
		tree.addChild(b);
		AttributeArray names = new AttributeArray("node name", ValueKind.STRING);
		for (int v = 0; v < tree.getNumberOfVertices(); v++) {
			names.insertNextValue("n" + v);
		}
		tree.getVertexData().addArray(names);

		XMLDataElement phylogeny = new XMLDataElement("phylogeny");
		int written = new CladeWriter(passFor(tree)).writeClade(tree.getRoot(), phylogeny);
		assertEquals(tree.getNumberOfVertices(), written);
		assertEquals(1, phylogeny.getNumberOfNestedElements());
		assertSameShape(tree, r, phylogeny.getNestedElement(0));
	}

	@Test
	public void testRootHasNoBranchLengthButTracksWeights() {
		AttributedTree tree = PhyloXMLTreeWriterTest.threeNodeTree();
		WritePass pass = passFor(tree);
		XMLDataElement phylogeny = new XMLDataElement("phylogeny");
		new CladeWriter(pass).writeClade(tree.getRoot(), phylogeny);
		XMLDataElement root = phylogeny.getNestedElement(0);
		assertNull(root.getAttribute("branch_length"));
		assertEquals("1.5", clades(root).get(0).getAttribute("branch_length"));
		assertTrue(pass.getTracker().contains("weight"));
		assertTrue(pass.getTracker().contains("node name"));
	}

	@Test
	public void testCustomRuleList() {
		AttributedTree tree = PhyloXMLTreeWriterTest.threeNodeTree();
		List<CladeRule> onlyNames = new ArrayList<CladeRule>();
		onlyNames.add(new CladeRule.Name());
		XMLDataElement phylogeny = new XMLDataElement("phylogeny");
		new CladeWriter(passFor(tree), onlyNames).writeClade(tree.getRoot(), phylogeny);
		XMLDataElement leaf = clades(phylogeny.getNestedElement(0)).get(1);
		assertNull(leaf.getAttribute("branch_length"));
		assertEquals("Leaf2", leaf.findNestedElementWithName("name").getCharacterData());
	}

	@Test
	public void testDeepChain() {
		int depth = 100000;
		AttributedTree tree = new AttributedTree();
		int v = tree.addRoot();
		for (int i = 0; i < depth; i++) {
			v = tree.addChild(v);
		}
		double[] weights = new double[depth];
		for (int i = 0; i < depth; i++) {
			weights[i] = i;
		}
		tree.getEdgeData().addArray(AttributeArray.ofDoubles("weight", weights));

		XMLDataElement phylogeny = new XMLDataElement("phylogeny");
		int written = new CladeWriter(passFor(tree)).writeClade(tree.getRoot(), phylogeny);
		assertEquals(depth + 1, written);

		XMLDataElement e = phylogeny.getNestedElement(0);
		int levels = 0;
		while (e.getNumberOfNestedElements() > 0) {
			e = e.getNestedElement(0);
			levels++;
		}
		assertEquals(depth, levels);
		assertEquals(Double.toString(depth - 1), e.getAttribute("branch_length"));
	}
}
