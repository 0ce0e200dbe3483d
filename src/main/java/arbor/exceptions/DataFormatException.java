package arbor.exceptions;

import java.io.PrintStream;

/**
 * Thrown when a tree description (Newick string, JSON tree document) cannot be turned into an
 *	AttributedTree.
 */
public class DataFormatException extends Exception {

	private static final long serialVersionUID = 1L;

	public DataFormatException(String msg) {
		super(msg);
	}

	public DataFormatException(String msg, Throwable cause) {
		super(msg, cause);
	}

	@Override
	public String toString() {
		return "Format not recognized: " + getMessage();
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String em = failedAction + " failed. " + this.toString();
		out.println(em);
	}
}
