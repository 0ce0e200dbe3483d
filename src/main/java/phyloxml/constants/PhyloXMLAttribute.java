package phyloxml.constants;

/**
 * XML attributes written on phyloXML elements.
 */
public enum PhyloXMLAttribute {

	ROOTED ("rooted"),
	BRANCH_LENGTH ("branch_length"),
	TYPE ("type"),
	DATATYPE ("datatype"),
	REF ("ref"),
	APPLIES_TO ("applies_to"),
	UNIT ("unit");

	public final String attributeName;

	PhyloXMLAttribute(String attributeName) {
		this.attributeName = attributeName;
	}
}
