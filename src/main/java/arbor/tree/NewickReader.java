package arbor.tree;

import arbor.exceptions.DataFormatException;
import gnu.trove.map.hash.TIntDoubleHashMap;
import gnu.trove.map.hash.TIntObjectHashMap;

import org.apache.log4j.Logger;

/**
 * Reads a Newick string into an AttributedTree. Labels become the string vertex array
 *	`nodeNameArrayName` (vertices without a label get ""), and branch lengths become the double edge
 *	array `edgeWeightArrayName` (edges without a length get 0.0). The arrays are only added when at
 *	least one label (respectively length) was present. Comments in square brackets are skipped;
 *	quoted labels are not supported.
 */
public class NewickReader {

	static Logger _LOG = Logger.getLogger(NewickReader.class);

	public static final String DEFAULT_NODE_NAME_ARRAY = "node name";
	public static final String DEFAULT_EDGE_WEIGHT_ARRAY = "weight";

	private String nodeNameArrayName;
	private String edgeWeightArrayName;

	public NewickReader() {
		this.nodeNameArrayName = DEFAULT_NODE_NAME_ARRAY;
		this.edgeWeightArrayName = DEFAULT_EDGE_WEIGHT_ARRAY;
	}

	public void setNodeNameArrayName(String name) {this.nodeNameArrayName = name;}

	public String getNodeNameArrayName() {return this.nodeNameArrayName;}

	public void setEdgeWeightArrayName(String name) {this.edgeWeightArrayName = name;}

	public String getEdgeWeightArrayName() {return this.edgeWeightArrayName;}

	public AttributedTree readTree(String treeString) throws DataFormatException {
		if (treeString == null) {
			throw new DataFormatException("no tree string given");
		}
		String pb = treeString.trim();
		if (pb.length() == 0 || pb.charAt(pb.length() - 1) != ';') {
			throw new DataFormatException("tree is missing its concluding semicolon");
		}

		AttributedTree tree = new AttributedTree();
		TIntObjectHashMap<String> labels = new TIntObjectHashMap<String>();
		TIntDoubleHashMap lengths = new TIntDoubleHashMap();
		int curr = AttributedTree.NONE;
		int depth = 0;
		boolean afterClose = false; // the next label belongs to the clade just closed
		int x = 0;
		while (x < pb.length()) {
			char nextChar = pb.charAt(x);
			if (nextChar == '(') {
				if (afterClose) {
					throw new DataFormatException("unexpected '(' at position " + x);
				}
				curr = (curr == AttributedTree.NONE) ? newRoot(tree, x) : tree.addChild(curr);
				depth++;
				x++;
			} else if (nextChar == ',') {
				if (depth == 0) {
					throw new DataFormatException("',' outside of any clade at position " + x);
				}
				char prev = previousSignificant(pb, x);
				if (prev == ',' || prev == '(') {
					curr = tree.addChild(curr);
				}
				curr = tree.getParent(curr);
				afterClose = false;
				x++;
			} else if (nextChar == ')') {
				if (depth == 0) {
					throw new DataFormatException("unbalanced ')' at position " + x);
				}
				// a clade that closed right after ',' or '(' has an unlabelled leaf there
				char prev = previousSignificant(pb, x);
				if (prev == ',' || prev == '(') {
					curr = tree.addChild(curr);
				}
				curr = tree.getParent(curr);
				depth--;
				afterClose = true;
				x++;
			} else if (nextChar == ':') {
				int end = scanToken(pb, x + 1);
				String edgeL = pb.substring(x + 1, end).trim();
				if (curr == AttributedTree.NONE) {
					throw new DataFormatException("branch length before any node at position " + x);
				}
				try {
					lengths.put(curr, Double.parseDouble(edgeL));
				} catch (NumberFormatException nfe) {
					throw new DataFormatException("bad branch length \"" + edgeL + "\" at position " + x, nfe);
				}
				x = end;
			} else if (nextChar == '[') { // note
				int close = pb.indexOf(']', x);
				if (close < 0) {
					throw new DataFormatException("unterminated comment at position " + x);
				}
				x = close + 1;
			} else if (nextChar == ';') {
				if (depth != 0) {
					throw new DataFormatException(depth + " clade(s) left open at end of tree");
				}
				if (x != pb.length() - 1) {
					_LOG.warn("ignoring text after the first tree: " + pb.substring(x + 1));
				}
				break;
			} else if (Character.isWhitespace(nextChar)) {
				x++;
			} else {
				int end = scanToken(pb, x);
				String nam = pb.substring(x, end).trim();
				if (!afterClose) {
					// external named node
					if (curr == AttributedTree.NONE) {
						curr = newRoot(tree, x);
					} else {
						curr = tree.addChild(curr);
					}
				}
				labels.put(curr, nam);
				afterClose = false;
				x = end;
			}
		}
		if (!tree.hasRoot()) {
			throw new DataFormatException("tree string contains no nodes");
		}

		attachArrays(tree, labels, lengths);
		_LOG.debug("read newick tree with " + tree.getNumberOfVertices() + " vertices");
		return tree;
	}

	private int newRoot(AttributedTree tree, int x) throws DataFormatException {
		if (tree.hasRoot()) {
			throw new DataFormatException("more than one root clade at position " + x);
		}
		return tree.addRoot();
	}

	private static char previousSignificant(String s, int x) {
		for (int i = x - 1; i >= 0; i--) {
			if (!Character.isWhitespace(s.charAt(i))) {
				return s.charAt(i);
			}
		}
		return 0;
	}

	// index of the first label/length terminator at or after `from`
	private static int scanToken(String s, int from) {
		int i = from;
		while (i < s.length()) {
			char c = s.charAt(i);
			if (c == ',' || c == ')' || c == '(' || c == ':' || c == ';' || c == '[') {
				break;
			}
			i++;
		}
		return i;
	}

	private void attachArrays(AttributedTree tree, TIntObjectHashMap<String> labels, TIntDoubleHashMap lengths) {
		if (!labels.isEmpty()) {
			AttributeArray names = new AttributeArray(this.nodeNameArrayName, ValueKind.STRING);
			for (int v = 0; v < tree.getNumberOfVertices(); v++) {
				String nam = labels.get(v);
				names.insertNextValue(nam == null ? "" : nam);
			}
			tree.getVertexData().addArray(names);
		}
		boolean anyEdgeLength = false;
		for (int v : lengths.keys()) {
			if (v != tree.getRoot()) {
				anyEdgeLength = true;
			}
		}
		if (anyEdgeLength) {
			double[] weights = new double[tree.getNumberOfEdges()];
			for (int v = 0; v < tree.getNumberOfVertices(); v++) {
				if (v == tree.getRoot() || !lengths.containsKey(v)) {
					continue;
				}
				weights[tree.getEdgeId(tree.getParent(v), v)] = lengths.get(v);
			}
			tree.getEdgeData().addArray(AttributeArray.ofDoubles(this.edgeWeightArrayName, weights));
		}
	}
}
