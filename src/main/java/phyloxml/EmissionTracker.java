package phyloxml;

import java.util.HashSet;

/**
 * The names of the arrays already represented in the document being written. An array whose name
 *	is tracked is never written again as a generic property. One tracker belongs to one write pass.
 */
public class EmissionTracker {

	private final HashSet<String> names;

	public EmissionTracker() {
		this.names = new HashSet<String>();
	}

	public boolean contains(String arrayName) {
		return this.names.contains(arrayName);
	}

	/**
	 * Marks `arrayName` as written. Marking an already tracked name is a no-op.
	 * @return true if the name was not tracked before
	 */
	public boolean mark(String arrayName) {
		return this.names.add(arrayName);
	}

	public int size() {return this.names.size();}
}
