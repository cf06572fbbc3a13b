package belc.oracle;

/**
 * A vocabulary lookup that could not be answered, as opposed to one answered negatively.
 */
public class OracleException extends Exception {

	private static final long serialVersionUID = -6005418839024711250L;

	public OracleException(String message) {
		super(message);
	}

	public OracleException(String message, Throwable cause) {
		super(message, cause);
	}
}
