package phyloxml;

import arbor.tree.AttributeArray;
import arbor.tree.AttributedTree;

/**
 * State of one write pass: the tree being written, the arrays chosen as branch length and name
 *	sources, and the tracker of arrays already written. A pass is used once and then discarded.
 */
public final class WritePass {

	private final AttributedTree tree;
	private final AttributeArray edgeWeightArray;
	private final AttributeArray nodeNameArray;
	private final EmissionTracker tracker;
	private final PropertyResolver resolver;

	/**
	 * @param edgeWeightArray the edge array read as branch length, or null
	 * @param nodeNameArray the vertex array read as clade name, or null
	 */
	public WritePass(AttributedTree tree, AttributeArray edgeWeightArray, AttributeArray nodeNameArray) {
		this.tree = tree;
		this.edgeWeightArray = edgeWeightArray;
		this.nodeNameArray = nodeNameArray;
		this.tracker = new EmissionTracker();
		this.resolver = new PropertyResolver();
	}

	public AttributedTree getTree() {return this.tree;}

	public AttributeArray getEdgeWeightArray() {return this.edgeWeightArray;}

	public AttributeArray getNodeNameArray() {return this.nodeNameArray;}

	public EmissionTracker getTracker() {return this.tracker;}

	public PropertyResolver getResolver() {return this.resolver;}

	/**
	 * @return true for the arrays that feed branch_length and name, which are never properties
	 */
	public boolean isStructuralSource(AttributeArray array) {
		return array == this.nodeNameArray || array == this.edgeWeightArray;
	}
}
