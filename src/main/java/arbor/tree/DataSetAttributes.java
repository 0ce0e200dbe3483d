package arbor.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * The ordered set of AttributeArrays attached to the vertices (or the edges) of a tree.
 *	Array order is insertion order and is the order in which writers visit the arrays.
 */
public class DataSetAttributes implements Iterable<AttributeArray> {

	private final ArrayList<AttributeArray> arrays;

	public DataSetAttributes() {
		this.arrays = new ArrayList<AttributeArray>();
	}

	/**
	 * Adds `array`, replacing (in place) any array with the same name.
	 */
	public void addArray(AttributeArray array) {
		for (int i = 0; i < this.arrays.size(); i++) {
			if (this.arrays.get(i).getName().equals(array.getName())) {
				this.arrays.set(i, array);
				return;
			}
		}
		this.arrays.add(array);
	}

	public boolean removeArray(String name) {
		AttributeArray arr = getArray(name);
		return arr != null && this.arrays.remove(arr);
	}

	/**
	 * @return the array named `name`, or null
	 * O(N) lookup.
	 */
	public AttributeArray getArray(String name) {
		if (name == null) {
			return null;
		}
		for (AttributeArray arr : this.arrays) {
			if (arr.getName().equals(name)) {
				return arr;
			}
		}
		return null;
	}

	/**
	 * @return the i-th array or throw IndexOutOfBoundsException.
	 */
	public AttributeArray getArray(int i) throws IndexOutOfBoundsException {
		return this.arrays.get(i);
	}

	public int getNumberOfArrays() {return this.arrays.size();}

	public List<AttributeArray> getArrays() {return Collections.unmodifiableList(this.arrays);}

	@Override
	public Iterator<AttributeArray> iterator() {
		return getArrays().iterator();
	}
}
