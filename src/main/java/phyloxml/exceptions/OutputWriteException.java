package phyloxml.exceptions;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Thrown when the stream a phyloXML document is written to stops accepting output. This is the only
 *	failure a write pass reports; whatever was written before the failure stays written.
 */
public class OutputWriteException extends Exception {

	private static final long serialVersionUID = 1L;

	public OutputWriteException(String msg, IOException cause) {
		super(msg, cause);
	}

	@Override
	public String toString() {
		String m = "OutputWriteException: " + getMessage();
		if (getCause() != null) {
			m += " (" + getCause().getMessage() + ")";
		}
		return m;
	}

	public void reportFailedAction(PrintStream out, String failedAction) {
		String m = failedAction + " failed due to " + this.toString();
		out.println(m);
	}
}
