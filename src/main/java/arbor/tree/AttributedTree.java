package arbor.tree;

import gnu.trove.list.array.TIntArrayList;

import java.util.ArrayList;

/**
 * A rooted, ordered tree whose vertices and edges are dense integer ids handed out in insertion
 *	order. Every non-root vertex has exactly one incoming edge, from its parent. Per-vertex and
 *	per-edge data live in two DataSetAttributes, indexed by vertex id and edge id respectively.
 */
public class AttributedTree {

	public static final int NONE = -1;

	private int root;
	private final TIntArrayList parents;       // vertex -> parent vertex
	private final TIntArrayList incomingEdges; // vertex -> edge from its parent
	private final ArrayList<TIntArrayList> children; // vertex -> ordered child vertices
	private final TIntArrayList edgeSources;
	private final TIntArrayList edgeTargets;
	private final DataSetAttributes vertexData;
	private final DataSetAttributes edgeData;

	public AttributedTree() {
		this.root = NONE;
		this.parents = new TIntArrayList();
		this.incomingEdges = new TIntArrayList();
		this.children = new ArrayList<TIntArrayList>();
		this.edgeSources = new TIntArrayList();
		this.edgeTargets = new TIntArrayList();
		this.vertexData = new DataSetAttributes();
		this.edgeData = new DataSetAttributes();
	}

	/**
	 * Creates the root vertex. Only allowed on an empty tree.
	 * @return the id of the root
	 */
	public int addRoot() {
		if (this.root != NONE) {
			throw new IllegalStateException("tree already has a root (vertex " + this.root + ")");
		}
		this.root = newVertex(NONE);
		return this.root;
	}

	/**
	 * Creates a new vertex as the last child of `parent`, along with the edge parent -> child.
	 * @return the id of the new vertex
	 */
	public int addChild(int parent) {
		checkVertex(parent);
		int child = newVertex(parent);
		int edge = this.edgeSources.size();
		this.edgeSources.add(parent);
		this.edgeTargets.add(child);
		this.incomingEdges.set(child, edge);
		this.children.get(parent).add(child);
		return child;
	}

	private int newVertex(int parent) {
		int v = this.parents.size();
		this.parents.add(parent);
		this.incomingEdges.add(NONE);
		this.children.add(new TIntArrayList());
		return v;
	}

	private void checkVertex(int v) {
		if (v < 0 || v >= this.parents.size()) {
			throw new IllegalArgumentException("no vertex " + v + " in a tree of " + this.parents.size() + " vertices");
		}
	}

	/**
	 * @return the root id, or NONE for an empty tree
	 */
	public int getRoot() {return this.root;}

	public boolean hasRoot() {return this.root != NONE;}

	public int getNumberOfVertices() {return this.parents.size();}

	public int getNumberOfEdges() {return this.edgeSources.size();}

	/**
	 * @return the parent of `v`, or NONE for the root
	 */
	public int getParent(int v) {
		checkVertex(v);
		return this.parents.get(v);
	}

	public int getNumberOfChildren(int v) {
		checkVertex(v);
		return this.children.get(v).size();
	}

	/**
	 * @return the i-th child of `v` or throw IndexOutOfBoundsException.
	 */
	public int getChild(int v, int i) throws IndexOutOfBoundsException {
		checkVertex(v);
		return this.children.get(v).get(i);
	}

	/**
	 * @return a copy of the children of `v` in order
	 */
	public int[] getChildren(int v) {
		checkVertex(v);
		return this.children.get(v).toArray();
	}

	public boolean isLeaf(int v) {return getNumberOfChildren(v) == 0;}

	/**
	 * @return the id of the edge parent -> child, or NONE if `child` is not a child of `parent`
	 */
	public int getEdgeId(int parent, int child) {
		checkVertex(parent);
		checkVertex(child);
		if (this.parents.get(child) != parent) {
			return NONE;
		}
		return this.incomingEdges.get(child);
	}

	public int getSourceVertex(int edge) {return this.edgeSources.get(edge);}

	public int getTargetVertex(int edge) {return this.edgeTargets.get(edge);}

	public DataSetAttributes getVertexData() {return this.vertexData;}

	public DataSetAttributes getEdgeData() {return this.edgeData;}
}
