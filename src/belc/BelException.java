package belc;

/**
 * A belc exception consisting of a prefix (type of error) and, where known, the number of the BEL line that
 * caused it.
 */
public abstract class BelException extends RuntimeException {
	private final int line;
	private final String msg;
	private final String prefix;

	public BelException(String prefix, String msg) {
		super(prefix + ": " + msg);
		this.prefix = prefix;
		this.msg = msg;
		this.line = -1;
	}

	public BelException(String prefix, String msg, int lineN) {
		super(prefix + ": " + msg + " at line " + lineN);
		this.prefix = prefix;
		this.msg = msg;
		this.line = lineN;
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
