package belc.model.graph;

/**
 * A protein fragment. Start and stop are both null for the unknown fragment.
 */
public final class Fragment extends Variant {

	private final String start;
	private final String stop;
	private final String description;

	public Fragment(String start, String stop, String description) {
		this.start = start;
		this.stop = stop;
		this.description = description;
	}

	public static Fragment missing(String description) {
		return new Fragment(null, null, description);
	}

	public boolean isMissing() {
		return start == null;
	}

	public String getStart() {
		return start;
	}

	public String getStop() {
		return stop;
	}

	/**
	 * @return the free-text description, or null
	 */
	public String getDescription() {
		return description;
	}

	@Override
	public <T, E extends Throwable> T accept(VariantVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
