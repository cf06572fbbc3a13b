package belc.model.term;

import belc.util.SourceLocatable;
import belc.util.SourceLocation;

/**
 * A fusion breakpoint range such as {@code "p.1_79"}, or the missing range {@code "?"} when {@link #isMissing()}.
 * Start and stop are integers as text or {@code ?}.
 */
public class FusionRangeToken extends SourceLocatable {

	private final SourceLocation location;
	private final String reference;
	private final String start;
	private final String stop;

	public FusionRangeToken(SourceLocation location, String reference, String start, String stop) {
		this.location = location;
		this.reference = reference;
		this.start = start;
		this.stop = stop;
	}

	public static FusionRangeToken missing(SourceLocation location) {
		return new FusionRangeToken(location, null, null, null);
	}

	public boolean isMissing() {
		return reference == null;
	}

	public String getReference() {
		return reference;
	}

	public String getStart() {
		return start;
	}

	public String getStop() {
		return stop;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}
}
