package arbor.tree;

import org.apache.commons.lang3.math.NumberUtils;

/**
 * An immutable value tagged with its ValueKind. Integral kinds are held as a long (bit pattern for
 *	the unsigned 64 bit kinds), FLOAT as a Float, DOUBLE as a Double, BIT as a Boolean and STRING as a String.
 */
public final class Variant {

	public static final Variant INVALID = new Variant(ValueKind.INVALID, null);

	private final ValueKind kind;
	private final Object value;

	private Variant(ValueKind kind, Object value) {
		this.kind = kind;
		this.value = value;
	}

	/**
	 * Converts `obj` to the representation used for `kind`.
	 * @throws NumberFormatException if `obj` is a String that does not parse as the requested numeric kind,
	 *	or an integral value that does not fit in `kind` (the 64 bit unsigned kinds take any bit pattern)
	 */
	public static Variant of(ValueKind kind, Object obj) {
		if (kind == null || kind == ValueKind.INVALID || obj == null) {
			return INVALID;
		}
		if (kind.isIntegral()) {
			return new Variant(kind, checkRange(kind, toLong(kind, obj)));
		}
		switch (kind) {
		case BIT:
			if (obj instanceof Boolean) {
				return new Variant(kind, obj);
			} else if (obj instanceof Number) {
				return new Variant(kind, ((Number) obj).doubleValue() != 0);
			}
			return new Variant(kind, Boolean.parseBoolean(obj.toString().trim()));
		case FLOAT:
			if (obj instanceof Number) {
				return new Variant(kind, ((Number) obj).floatValue());
			}
			return new Variant(kind, Float.parseFloat(obj.toString().trim()));
		case DOUBLE:
			if (obj instanceof Number) {
				return new Variant(kind, ((Number) obj).doubleValue());
			}
			return new Variant(kind, Double.parseDouble(obj.toString().trim()));
		default:
			return new Variant(ValueKind.STRING, obj.toString());
		}
	}

	private static long toLong(ValueKind kind, Object obj) {
		if (obj instanceof Number) {
			return ((Number) obj).longValue();
		} else if (obj instanceof Boolean) {
			return ((Boolean) obj) ? 1L : 0L;
		} else if (obj instanceof Character) {
			return (long) ((Character) obj).charValue();
		}
		String s = obj.toString().trim();
		if (kind.isUnsigned64()) {
			return Long.parseUnsignedLong(s);
		}
		return Long.parseLong(s);
	}

	private static long checkRange(ValueKind kind, long v) {
		long min;
		long max;
		switch (kind) {
		case CHAR:
		case SIGNED_CHAR:
			min = Byte.MIN_VALUE;
			max = Byte.MAX_VALUE;
			break;
		case UNSIGNED_CHAR:
			min = 0;
			max = 0xFFL;
			break;
		case SHORT:
			min = Short.MIN_VALUE;
			max = Short.MAX_VALUE;
			break;
		case UNSIGNED_SHORT:
			min = 0;
			max = 0xFFFFL;
			break;
		case INT:
			min = Integer.MIN_VALUE;
			max = Integer.MAX_VALUE;
			break;
		case UNSIGNED_INT:
			min = 0;
			max = 0xFFFFFFFFL;
			break;
		default:
			return v;
		}
		if (v < min || v > max) {
			throw new NumberFormatException("value " + v + " is out of range for " + kind.typeName);
		}
		return v;
	}

	public ValueKind getKind() {return this.kind;}

	public boolean isValid() {return this.kind != ValueKind.INVALID;}

	/**
	 * @return the value as a double; non-numeric strings and invalid values give 0.0
	 */
	public double toDouble() {
		if (this.value == null) {
			return 0.0;
		}
		if (this.kind.isUnsigned64()) {
			long bits = (Long) this.value;
			return bits >= 0 ? (double) bits : Double.parseDouble(Long.toUnsignedString(bits));
		}
		if (this.value instanceof Number) {
			return ((Number) this.value).doubleValue();
		}
		if (this.value instanceof Boolean) {
			return ((Boolean) this.value) ? 1.0 : 0.0;
		}
		return NumberUtils.toDouble(this.value.toString().trim(), 0.0);
	}

	/**
	 * @return the string form of the value; the empty string for INVALID
	 */
	@Override
	public String toString() {
		if (this.value == null) {
			return "";
		}
		if (this.kind.isUnsigned64()) {
			return Long.toUnsignedString((Long) this.value);
		}
		return this.value.toString();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Variant)) {
			return false;
		}
		Variant other = (Variant) o;
		return this.kind == other.kind && (this.value == null ? other.value == null : this.value.equals(other.value));
	}

	@Override
	public int hashCode() {
		return 31 * this.kind.hashCode() + (this.value == null ? 0 : this.value.hashCode());
	}
}
