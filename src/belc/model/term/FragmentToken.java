package belc.model.term;

import belc.util.SourceLocation;

/**
 * {@code frag("start_stop"[, "description"])}. Start and stop are null for the unknown fragment {@code frag("?")};
 * otherwise each is an integer as text, {@code ?}, or for the stop also {@code *}.
 */
public class FragmentToken extends VariantToken {

	private final String start;
	private final String stop;
	private final String description;

	public FragmentToken(SourceLocation location, String start, String stop, String description) {
		super(location, null);
		this.start = start;
		this.stop = stop;
		this.description = description;
	}

	public String getStart() {
		return start;
	}

	public String getStop() {
		return stop;
	}

	public boolean isMissing() {
		return start == null;
	}

	public String getDescription() {
		return description;
	}

	@Override
	public <T, E extends Throwable> T accept(VariantTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
