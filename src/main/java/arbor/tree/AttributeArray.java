package arbor.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Set;

/**
 * A named column of typed values with one tuple per vertex (or per edge) of a tree. Each tuple holds
 *	getNumberOfComponents() values of the array's ValueKind.
 *
 * Arrays also carry string side metadata ("information") such as the `authority`, `applies_to` and
 *	`unit` of a phyloXML property, or the `type` of a confidence value.
 */
public class AttributeArray {

	private final String name;
	private final ValueKind kind;
	private final int numberOfComponents;
	private final ArrayList<Variant> values; // tuple-major
	private final LinkedHashMap<String, String> information;

	public AttributeArray(String name, ValueKind kind) {
		this(name, kind, 1);
	}

	public AttributeArray(String name, ValueKind kind, int numberOfComponents) {
		if (name == null) {
			throw new IllegalArgumentException("array name may not be null");
		}
		if (kind == null || kind == ValueKind.INVALID) {
			throw new IllegalArgumentException("array \"" + name + "\" needs a value kind");
		}
		if (numberOfComponents < 1) {
			throw new IllegalArgumentException("array \"" + name + "\" needs at least one component");
		}
		this.name = name;
		this.kind = kind;
		this.numberOfComponents = numberOfComponents;
		this.values = new ArrayList<Variant>();
		this.information = new LinkedHashMap<String, String>();
	}

	/*
	 * convenience factories for single component arrays
	 */

	public static AttributeArray ofStrings(String name, String... vals) {
		AttributeArray arr = new AttributeArray(name, ValueKind.STRING);
		for (String v : vals) {
			arr.insertNextValue(v);
		}
		return arr;
	}

	public static AttributeArray ofDoubles(String name, double... vals) {
		AttributeArray arr = new AttributeArray(name, ValueKind.DOUBLE);
		for (double v : vals) {
			arr.insertNextValue(v);
		}
		return arr;
	}

	public static AttributeArray ofInts(String name, int... vals) {
		AttributeArray arr = new AttributeArray(name, ValueKind.INT);
		for (int v : vals) {
			arr.insertNextValue(v);
		}
		return arr;
	}

	public String getName() {return this.name;}

	public ValueKind getKind() {return this.kind;}

	public int getNumberOfComponents() {return this.numberOfComponents;}

	public int getNumberOfTuples() {return this.values.size() / this.numberOfComponents;}

	/**
	 * Appends a one-component tuple.
	 * @return the index of the new tuple
	 */
	public int insertNextValue(Object value) {
		if (this.numberOfComponents != 1) {
			throw new IllegalStateException("array \"" + this.name + "\" has " + this.numberOfComponents
					+ " components; use insertNextTuple");
		}
		this.values.add(Variant.of(this.kind, value));
		return getNumberOfTuples() - 1;
	}

	/**
	 * Appends a tuple with exactly getNumberOfComponents() values.
	 * @return the index of the new tuple
	 */
	public int insertNextTuple(Object... components) {
		if (components.length != this.numberOfComponents) {
			throw new IllegalArgumentException("array \"" + this.name + "\" expects " + this.numberOfComponents
					+ " components, got " + components.length);
		}
		for (Object c : components) {
			this.values.add(Variant.of(this.kind, c));
		}
		return getNumberOfTuples() - 1;
	}

	/**
	 * @return component 0 of tuple `tuple`, or Variant.INVALID if there is no such tuple
	 */
	public Variant getVariantValue(int tuple) {
		return getComponent(tuple, 0);
	}

	/**
	 * @return component `component` of tuple `tuple`, or Variant.INVALID if there is no such value
	 */
	public Variant getComponent(int tuple, int component) {
		if (tuple < 0 || tuple >= getNumberOfTuples() || component < 0 || component >= this.numberOfComponents) {
			return Variant.INVALID;
		}
		return this.values.get(tuple * this.numberOfComponents + component);
	}

	public void setInformation(String key, String value) {
		this.information.put(key, value);
	}

	/**
	 * @return the metadata stored under `key`, or null
	 */
	public String getInformation(String key) {
		return this.information.get(key);
	}

	public Set<String> getInformationKeys() {
		return Collections.unmodifiableSet(this.information.keySet());
	}

	@Override
	public String toString() {
		return "AttributeArray[" + this.name + ", " + this.kind.typeName + " x" + this.numberOfComponents
				+ ", " + getNumberOfTuples() + " tuples]";
	}
}
