package phyloxml;

import phyloxml.constants.PhyloXMLAttribute;
import phyloxml.constants.PhyloXMLElement;
import phyloxml.xml.XMLDataElement;

/**
 * Everything needed to write one phyloXML property element.
 */
public final class PropertyDescriptor {

	private final String ref;
	private final String appliesTo;
	private final String unit;
	private final String datatype;
	private final String value;

	public PropertyDescriptor(String ref, String appliesTo, String unit, String datatype, String value) {
		this.ref = ref;
		this.appliesTo = appliesTo;
		this.unit = unit;
		this.datatype = datatype;
		this.value = value;
	}

	public String getRef() {return this.ref;}

	public String getAppliesTo() {return this.appliesTo;}

	/**
	 * @return the unit, or null when the property has none
	 */
	public String getUnit() {return this.unit;}

	public String getDatatype() {return this.datatype;}

	public String getValue() {return this.value;}

	public XMLDataElement toElement() {
		XMLDataElement propertyElement = new XMLDataElement(PhyloXMLElement.PROPERTY.elementName);
		propertyElement.setAttribute(PhyloXMLAttribute.DATATYPE.attributeName, this.datatype);
		propertyElement.setAttribute(PhyloXMLAttribute.REF.attributeName, this.ref);
		propertyElement.setAttribute(PhyloXMLAttribute.APPLIES_TO.attributeName, this.appliesTo);
		if (this.unit != null) {
			propertyElement.setAttribute(PhyloXMLAttribute.UNIT.attributeName, this.unit);
		}
		propertyElement.setCharacterData(this.value);
		return propertyElement;
	}

	@Override
	public String toString() {
		return "PropertyDescriptor[ref=" + this.ref + ", applies_to=" + this.appliesTo + ", unit=" + this.unit
				+ ", datatype=" + this.datatype + ", value=" + this.value + "]";
	}
}
