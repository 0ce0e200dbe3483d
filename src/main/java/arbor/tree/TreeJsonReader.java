package arbor.tree;

import arbor.exceptions.DataFormatException;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.apache.commons.io.FileUtils;

import org.apache.log4j.Logger;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

/**
 * Reads an AttributedTree from a JSON document of the form
 *
 * <pre>
 * {"parents": [-1, 0, 0],
 *  "vertexData": [{"name": "node name", "type": "string", "values": ["Root", "Leaf1", "Leaf2"]},
 *                 {"name": "color", "type": "unsigned char", "components": 3,
 *                  "values": [[0,0,0], [255,0,0], [0,0,255]]},
 *                 {"name": "property.height", "type": "double", "values": [0, 1.2, 3.4],
 *                  "info": {"unit": "m", "authority": "TOL"}}],
 *  "edgeData": [{"name": "weight", "type": "double", "values": [1.5, 2.0]}]}
 * </pre>
 *
 * `parents` lists the parent of every vertex; the root has -1 and must come first, and every other
 *	vertex must name an earlier vertex. Vertices keep their list position as id, so the edge into
 *	vertex i has id i - 1.
 */
public class TreeJsonReader {

	static Logger _LOG = Logger.getLogger(TreeJsonReader.class);

	/**
	 * Reads the UTF-8 encoded JSON file `filename`.
	 */
	public static AttributedTree read(String filename) throws IOException, DataFormatException {
		Reader r = new BufferedReader(new InputStreamReader(FileUtils.openInputStream(new File(filename)), StandardCharsets.UTF_8));
		try {
			return read(r);
		} finally {
			r.close();
		}
	}

	public static AttributedTree read(Reader r) throws IOException, DataFormatException {
		Object all;
		try {
			all = new JSONParser().parse(r);
		} catch (ParseException pe) {
			throw new DataFormatException("not a JSON document: " + pe, pe);
		}
		if (!(all instanceof JSONObject)) {
			throw new DataFormatException("expected a JSON object at the top level");
		}
		JSONObject root = (JSONObject) all;

		AttributedTree tree = buildTopology(root.get("parents"));
		readArrays(root.get("vertexData"), "vertexData", tree.getVertexData());
		readArrays(root.get("edgeData"), "edgeData", tree.getEdgeData());
		_LOG.debug("read JSON tree with " + tree.getNumberOfVertices() + " vertices, "
				+ tree.getVertexData().getNumberOfArrays() + " vertex arrays and "
				+ tree.getEdgeData().getNumberOfArrays() + " edge arrays");
		return tree;
	}

	private static AttributedTree buildTopology(Object parentsObj) throws DataFormatException {
		if (!(parentsObj instanceof JSONArray) || ((JSONArray) parentsObj).isEmpty()) {
			throw new DataFormatException("\"parents\" must be a non-empty array");
		}
		JSONArray parents = (JSONArray) parentsObj;
		AttributedTree tree = new AttributedTree();
		for (int i = 0; i < parents.size(); i++) {
			long p = asLong(parents.get(i), "parents[" + i + "]");
			if (i == 0) {
				if (p != -1) {
					throw new DataFormatException("the first vertex must be the root (parent -1)");
				}
				tree.addRoot();
			} else {
				if (p < 0 || p >= i) {
					throw new DataFormatException("parents[" + i + "] = " + p + " does not name an earlier vertex");
				}
				tree.addChild((int) p);
			}
		}
		return tree;
	}

	private static void readArrays(Object arraysObj, String what, DataSetAttributes into) throws DataFormatException {
		if (arraysObj == null) {
			return;
		}
		if (!(arraysObj instanceof JSONArray)) {
			throw new DataFormatException("\"" + what + "\" must be an array");
		}
		for (Object o : (JSONArray) arraysObj) {
			if (!(o instanceof JSONObject)) {
				throw new DataFormatException("entries of \"" + what + "\" must be objects");
			}
			into.addArray(readArray((JSONObject) o, what));
		}
	}

	private static AttributeArray readArray(JSONObject j, String what) throws DataFormatException {
		Object nameObj = j.get("name");
		if (!(nameObj instanceof String)) {
			throw new DataFormatException("an array in \"" + what + "\" has no name");
		}
		String name = (String) nameObj;
		String typeName = j.containsKey("type") ? String.valueOf(j.get("type")) : ValueKind.STRING.typeName;
		ValueKind kind = ValueKind.forTypeName(typeName);
		if (kind == null || kind == ValueKind.INVALID) {
			throw new DataFormatException("array \"" + name + "\" has unknown type \"" + typeName + "\"");
		}
		int components = j.containsKey("components") ? (int) asLong(j.get("components"), name + ".components") : 1;
		if (components < 1) {
			throw new DataFormatException("array \"" + name + "\" must have at least one component");
		}
		AttributeArray arr = new AttributeArray(name, kind, components);

		Object valuesObj = j.get("values");
		if (!(valuesObj instanceof JSONArray)) {
			throw new DataFormatException("array \"" + name + "\" has no \"values\" list");
		}
		try {
			for (Object v : (JSONArray) valuesObj) {
				if (components == 1) {
					arr.insertNextValue(v);
				} else {
					if (!(v instanceof JSONArray) || ((JSONArray) v).size() != components) {
						throw new DataFormatException("array \"" + name + "\" expects tuples of " + components + " values");
					}
					arr.insertNextTuple(((JSONArray) v).toArray());
				}
			}
		} catch (NumberFormatException nfe) {
			throw new DataFormatException("array \"" + name + "\" holds a value that is not a valid " + kind.typeName + ": " + nfe.getMessage(), nfe);
		}

		Object infoObj = j.get("info");
		if (infoObj instanceof JSONObject) {
			for (Object e : ((JSONObject) infoObj).entrySet()) {
				Map.Entry<?, ?> entry = (Map.Entry<?, ?>) e;
				arr.setInformation(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
			}
		} else if (infoObj != null) {
			throw new DataFormatException("\"info\" of array \"" + name + "\" must be an object");
		}
		return arr;
	}

	private static long asLong(Object o, String where) throws DataFormatException {
		if (o instanceof Number) {
			return ((Number) o).longValue();
		}
		throw new DataFormatException(where + " must be a number, got " + o);
	}
}
