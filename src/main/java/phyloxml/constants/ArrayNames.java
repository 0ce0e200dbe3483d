package phyloxml.constants;

import arbor.tree.NewickReader;

/**
 * Array names, name prefixes and array information keys that decide how an attribute array of the
 *	input tree is represented in phyloXML.
 */
public final class ArrayNames {

	private ArrayNames() {}

	// configurable; the defaults are the arrays NewickReader produces
	public static final String DEFAULT_EDGE_WEIGHT_ARRAY = NewickReader.DEFAULT_EDGE_WEIGHT_ARRAY;
	public static final String DEFAULT_NODE_NAME_ARRAY = NewickReader.DEFAULT_NODE_NAME_ARRAY;

	// vertex arrays with a structural clade element
	public static final String CONFIDENCE = "confidence";
	public static final String COLOR = "color";

	// "phylogeny." + element name: tree level name, description and confidence
	public static final String TREE_LEVEL_PREFIX = "phylogeny.";
	public static final String TREE_PROPERTY_PREFIX = "phylogeny.property.";
	// stripped from an array name to build the property ref
	public static final String PROPERTY_PREFIX = "property.";

	// array information keys
	public static final String INFO_AUTHORITY = "authority";
	public static final String INFO_APPLIES_TO = "applies_to";
	public static final String INFO_UNIT = "unit";
	public static final String INFO_TYPE = "type";

	public static final String DEFAULT_AUTHORITY = "VTK";
	public static final String DEFAULT_APPLIES_TO = "clade";
}
