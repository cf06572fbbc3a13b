package belc;

/**
 * Thrown when a compiler configuration cannot be read or does not make sense.
 */
@SuppressWarnings("serial")
public class BelcOptionException extends Exception {

	public BelcOptionException(String message) {
		super(message);
	}

	public BelcOptionException(String message, Throwable cause) {
		super(message, cause);
	}
}
