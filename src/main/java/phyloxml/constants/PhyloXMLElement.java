package phyloxml.constants;

/**
 * The phyloXML element vocabulary this writer produces.
 */
public enum PhyloXMLElement {

	PHYLOXML ("phyloxml"),
	PHYLOGENY ("phylogeny"), // always written with rooted="true"
	CLADE ("clade"),
	NAME ("name"),
	DESCRIPTION ("description"),
	CONFIDENCE ("confidence"),
	COLOR ("color"),
	RED ("red"),
	GREEN ("green"),
	BLUE ("blue"),
	PROPERTY ("property");

	public final String elementName;

	PhyloXMLElement(String elementName) {
		this.elementName = elementName;
	}
}
