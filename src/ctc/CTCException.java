package ctc;

/**
 * A CTC Exception consisting of a prefix (type of error) and, when known, a line number
 * in the template file
 *
 */
public abstract class CTCException extends RuntimeException {
	private final int line;
	private final String msg;
	private final String prefix;

	public CTCException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
		this.line = -1;
	}

	public CTCException(String prefix, String msg, int lineN) {
		super(prefix + ": " + msg + " at line " + lineN);
		this.prefix = prefix;
		this.line = lineN;
		this.msg = msg;
	}

	public String getMsg() {
		return msg;
	}

	public String getPrefix() {
		return prefix;
	}

	public int getLine() {
		return line;
	}
}
