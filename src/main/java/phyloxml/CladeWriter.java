package phyloxml;

import arbor.tree.AttributeArray;
import arbor.tree.AttributedTree;

import java.util.ArrayList;
import java.util.List;
import java.util.Stack;

import phyloxml.constants.PhyloXMLElement;
import phyloxml.xml.XMLDataElement;

/**
 * Builds the nested clade elements of a tree. Each vertex gets one clade element holding, in order:
 *	the structural parts written by the clade rules (branch_length, name, confidence, color), one
 *	property element for every vertex array not written yet, and the clades of its children.
 *
 * The traversal is a depth first walk with an explicit stack, so tree depth is not limited by the
 *	Java call stack. Vertices are visited in the same preorder a recursive walk would use, which
 *	keeps both the element order and the tracker updates identical.
 */
public class CladeWriter {

	private final WritePass pass;
	private final List<CladeRule> rules;

	public CladeWriter(WritePass pass) {
		this(pass, defaultRules());
	}

	public CladeWriter(WritePass pass, List<CladeRule> rules) {
		this.pass = pass;
		this.rules = rules;
	}

	public static List<CladeRule> defaultRules() {
		List<CladeRule> rules = new ArrayList<CladeRule>();
		rules.add(new CladeRule.BranchLength());
		rules.add(new CladeRule.Name());
		rules.add(new CladeRule.Confidence());
		rules.add(new CladeRule.Color());
		return rules;
	}

	/**
	 * Adds the clade for `vertex` and its whole subtree to `parentElement`.
	 * @return the number of clade elements written
	 */
	public int writeClade(int vertex, XMLDataElement parentElement) {
		AttributedTree tree = this.pass.getTree();
		List<CladeRule> active = new ArrayList<CladeRule>();
		for (CladeRule rule : this.rules) {
			if (rule.appliesTo(this.pass)) {
				active.add(rule);
			}
		}

		int count = 0;
		Stack<PendingClade> todo = new Stack<PendingClade>();
		todo.push(new PendingClade(vertex, parentElement));
		while (!todo.isEmpty()) {
			PendingClade next = todo.pop();
			XMLDataElement cladeElement = new XMLDataElement(PhyloXMLElement.CLADE.elementName);
			for (CladeRule rule : active) {
				rule.write(this.pass, next.vertex, cladeElement);
			}
			writeProperties(next.vertex, cladeElement);
			next.parentElement.addNestedElement(cladeElement);
			count++;

			// pushed in reverse so the first child is written first
			for (int i = tree.getNumberOfChildren(next.vertex) - 1; i >= 0; i--) {
				todo.push(new PendingClade(tree.getChild(next.vertex, i), cladeElement));
			}
		}
		return count;
	}

	private void writeProperties(int vertex, XMLDataElement cladeElement) {
		EmissionTracker tracker = this.pass.getTracker();
		for (AttributeArray array : this.pass.getTree().getVertexData()) {
			if (this.pass.isStructuralSource(array) || tracker.contains(array.getName())) {
				continue;
			}
			PropertyDescriptor property = this.pass.getResolver().resolve(array, vertex);
			cladeElement.addNestedElement(property.toElement());
		}
	}

	private static final class PendingClade {
		final int vertex;
		final XMLDataElement parentElement;

		PendingClade(int vertex, XMLDataElement parentElement) {
			this.vertex = vertex;
			this.parentElement = parentElement;
		}
	}
}
