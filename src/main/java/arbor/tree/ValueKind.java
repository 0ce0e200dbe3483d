package arbor.tree;

/**
 * The runtime kinds a value stored in an AttributeArray can have. The type name is the
 * C-style spelling used by tree producers (and by the JSON tree format) to declare a column type.
 */
public enum ValueKind {

	INVALID ("invalid"),
	BIT ("bit"),
	CHAR ("char"),
	SIGNED_CHAR ("signed char"),
	UNSIGNED_CHAR ("unsigned char"),
	SHORT ("short"),
	UNSIGNED_SHORT ("unsigned short"),
	INT ("int"),
	UNSIGNED_INT ("unsigned int"),
	LONG ("long"),
	UNSIGNED_LONG ("unsigned long"),
	LONG_LONG ("long long"),
	UNSIGNED_LONG_LONG ("unsigned long long"),
	ID_TYPE ("idtype"),
	FLOAT ("float"),
	DOUBLE ("double"),
	STRING ("string");

	public final String typeName;

	ValueKind(String typeName) {
		this.typeName = typeName;
	}

	public boolean isIntegral() {
		switch (this) {
		case CHAR:
		case SIGNED_CHAR:
		case UNSIGNED_CHAR:
		case SHORT:
		case UNSIGNED_SHORT:
		case INT:
		case UNSIGNED_INT:
		case LONG:
		case UNSIGNED_LONG:
		case LONG_LONG:
		case UNSIGNED_LONG_LONG:
		case ID_TYPE:
			return true;
		default:
			return false;
		}
	}

	public boolean isNumeric() {
		return isIntegral() || this == FLOAT || this == DOUBLE;
	}

	/**
	 * 64 bit kinds whose values are to be read as unsigned.
	 */
	public boolean isUnsigned64() {
		return this == UNSIGNED_LONG || this == UNSIGNED_LONG_LONG || this == ID_TYPE;
	}

	/**
	 * @return the kind spelled `typeName`, or null if there is none
	 */
	public static ValueKind forTypeName(String typeName) {
		for (ValueKind kind : values()) {
			if (kind.typeName.equals(typeName)) {
				return kind;
			}
		}
		return null;
	}
}
