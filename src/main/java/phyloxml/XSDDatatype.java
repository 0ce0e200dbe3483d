package phyloxml;

import arbor.tree.ValueKind;
import arbor.tree.Variant;

/**
 * Maps the runtime kind of an array value to the XML Schema datatype written in the `datatype`
 *	attribute of a phyloXML property. Kinds without a better match are written as xsd:string.
 */
public final class XSDDatatype {

	public static final String STRING = "xsd:string";

	private XSDDatatype() {}

	public static String forKind(ValueKind kind) {
		if (kind == null) {
			return STRING;
		}
		switch (kind) {
		case SHORT:
			return "xsd:short";
		case LONG:
			return "xsd:long";
		case FLOAT:
			return "xsd:float";
		case DOUBLE:
			return "xsd:double";
		case INT:
			return "xsd:integer";
		case BIT:
			return "xsd:boolean";
		case CHAR:
		case SIGNED_CHAR:
			return "xsd:byte";
		case UNSIGNED_CHAR:
			return "xsd:unsignedByte";
		case UNSIGNED_SHORT:
			return "xsd:unsignedShort";
		case UNSIGNED_INT:
			return "xsd:unsignedInt";
		case UNSIGNED_LONG:
		case UNSIGNED_LONG_LONG:
		case ID_TYPE:
			return "xsd:unsignedLong";
		case LONG_LONG:
			return "xsd:long";
		default:
			return STRING;
		}
	}

	public static String forValue(Variant value) {
		return forKind(value.getKind());
	}
}
