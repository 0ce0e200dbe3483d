package arbor.tree;

import static org.junit.Assert.*;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import arbor.exceptions.DataFormatException;

public class TreeJsonReaderTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	static final String THREE_NODES = "{\"parents\": [-1, 0, 0],"
			+ " \"vertexData\": ["
			+ "  {\"name\": \"node name\", \"values\": [\"Root\", \"Leaf1\", \"Leaf2\"]},"
			+ "  {\"name\": \"color\", \"type\": \"unsigned char\", \"components\": 3,"
			+ "   \"values\": [[0,0,0], [255,0,0], [0,0,255]]},"
			+ "  {\"name\": \"property.height\", \"type\": \"double\", \"values\": [0, 1.25, 3],"
			+ "   \"info\": {\"unit\": \"m\", \"authority\": \"TOL\"}}],"
			+ " \"edgeData\": [{\"name\": \"weight\", \"type\": \"double\", \"values\": [1.5, 2.0]}]}";

	private static AttributedTree read(String json) throws IOException, DataFormatException {
		return TreeJsonReader.read(new StringReader(json));
	}

	@Test
	public void testReadsTopologyAndArrays() throws Exception {
		AttributedTree tree = read(THREE_NODES);
		assertEquals(3, tree.getNumberOfVertices());
		assertArrayEquals(new int[] {1, 2}, tree.getChildren(0));

		DataSetAttributes vd = tree.getVertexData();
		assertEquals(3, vd.getNumberOfArrays());
		assertEquals("node name", vd.getArray(0).getName());
		assertEquals(ValueKind.STRING, vd.getArray(0).getKind());
		assertEquals("Leaf2", vd.getArray("node name").getVariantValue(2).toString());

		AttributeArray color = vd.getArray("color");
		assertEquals(3, color.getNumberOfComponents());
		assertEquals("255", color.getComponent(1, 0).toString());

		AttributeArray height = vd.getArray("property.height");
		assertEquals("1.25", height.getVariantValue(1).toString());
		assertEquals("3.0", height.getVariantValue(2).toString());
		assertEquals("m", height.getInformation("unit"));
		assertEquals("TOL", height.getInformation("authority"));

		AttributeArray weight = tree.getEdgeData().getArray("weight");
		assertEquals(2.0, weight.getVariantValue(tree.getEdgeId(0, 2)).toDouble(), 0.0);
	}

	@Test(expected = DataFormatException.class)
	public void testRootMustComeFirst() throws Exception {
		read("{\"parents\": [1, -1]}");
	}

	@Test(expected = DataFormatException.class)
	public void testForwardParentRejected() throws Exception {
		read("{\"parents\": [-1, 2, 0]}");
	}

	@Test(expected = DataFormatException.class)
	public void testUnknownType() throws Exception {
		read("{\"parents\": [-1], \"vertexData\": [{\"name\": \"x\", \"type\": \"quaternion\", \"values\": [1]}]}");
	}

	@Test(expected = DataFormatException.class)
	public void testValueOfWrongKind() throws Exception {
		read("{\"parents\": [-1], \"vertexData\": [{\"name\": \"x\", \"type\": \"int\", \"values\": [\"many\"]}]}");
	}

	@Test
	public void testOutOfRangeValueRejected() throws Exception {
		try {
			read("{\"parents\": [-1], \"vertexData\": [{\"name\": \"b\", \"type\": \"unsigned char\", \"values\": [300]}]}");
			fail("expected DataFormatException");
		} catch (DataFormatException dfe) {
			assertTrue(dfe.getCause() instanceof NumberFormatException);
		}
	}

	@Test
	public void testFileIsReadAsUtf8() throws Exception {
		File f = tmp.newFile("tree.json");
		FileUtils.writeStringToFile(f, "{\"parents\": [-1], \"vertexData\": [{\"name\": \"node name\", \"values\": [\"Acanthast\u00e9r \u00e6\"]}]}",
				StandardCharsets.UTF_8);
		AttributedTree tree = TreeJsonReader.read(f.getPath());
		assertEquals("Acanthast\u00e9r \u00e6", tree.getVertexData().getArray("node name").getVariantValue(0).toString());
	}

	@Test(expected = FileNotFoundException.class)
	public void testMissingFile() throws Exception {
		TreeJsonReader.read(new File(tmp.getRoot(), "absent.json").getPath());
	}

	@Test(expected = DataFormatException.class)
	public void testWrongTupleWidth() throws Exception {
		read("{\"parents\": [-1], \"vertexData\": [{\"name\": \"color\", \"type\": \"unsigned char\","
				+ " \"components\": 3, \"values\": [[1, 2]]}]}");
	}

	@Test(expected = DataFormatException.class)
	public void testNotJson() throws Exception {
		read("(a,b);");
	}
}
