package belc;

/**
 * Thrown from code paths that cannot be reached, such as IOException handlers around string writers.
 */
public class Unreachable extends RuntimeException {
	public Unreachable() {
		super("unreachable");
	}

	public Unreachable(Exception e) {
		super("unreachable", e);
	}
}
