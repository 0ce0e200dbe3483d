package phyloxml;

import arbor.tree.AttributeArray;
import arbor.tree.Variant;

import org.apache.commons.lang3.StringUtils;

import phyloxml.constants.ArrayNames;

/**
 * Works out how an attribute array is written as a phyloXML property: its ref (authority:name),
 *	applies_to scope, optional unit, datatype and value.
 *
 * The authority, applies_to and unit come from the array information; a missing or empty authority
 *	becomes "VTK" and a missing or empty applies_to becomes "clade". The property name is the array
 *	name with everything up to and including the first "property." removed.
 */
public class PropertyResolver {

	/**
	 * Resolves the property for vertex `vertex`. Does not touch any tracker; the caller decides
	 *	whether the array has been written.
	 */
	public PropertyDescriptor resolve(AttributeArray array, int vertex) {
		Variant val = array.getVariantValue(vertex);
		return new PropertyDescriptor(getRef(array), getAppliesTo(array), getUnit(array),
				XSDDatatype.forValue(val), val.toString());
	}

	/**
	 * Resolves a tree level property. Tree level arrays hold their value at index 0. The array is
	 *	marked in `tracker` whether or not it has a value, so it is not written again for each clade.
	 */
	public PropertyDescriptor resolveTreeLevel(AttributeArray array, EmissionTracker tracker) {
		tracker.mark(array.getName());
		return resolve(array, 0);
	}

	public String getRef(AttributeArray array) {
		return getAuthority(array) + ":" + getPropertyName(array.getName());
	}

	public String getAuthority(AttributeArray array) {
		return StringUtils.defaultIfEmpty(array.getInformation(ArrayNames.INFO_AUTHORITY), ArrayNames.DEFAULT_AUTHORITY);
	}

	public String getAppliesTo(AttributeArray array) {
		return StringUtils.defaultIfEmpty(array.getInformation(ArrayNames.INFO_APPLIES_TO), ArrayNames.DEFAULT_APPLIES_TO);
	}

	/**
	 * @return the unit, or null if the array has none
	 */
	public String getUnit(AttributeArray array) {
		return StringUtils.defaultIfEmpty(array.getInformation(ArrayNames.INFO_UNIT), null);
	}

	public static String getPropertyName(String arrayName) {
		int begin = arrayName.indexOf(ArrayNames.PROPERTY_PREFIX);
		if (begin < 0) {
			return arrayName;
		}
		return arrayName.substring(begin + ArrayNames.PROPERTY_PREFIX.length());
	}
}
