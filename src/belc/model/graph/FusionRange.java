package belc.model.graph;

import java.util.Objects;

/**
 * A fusion breakpoint range {@code reference.start_stop}, or the missing range.
 */
public final class FusionRange {

	private static final FusionRange MISSING = new FusionRange(null, null, null);

	private final String reference;
	private final String start;
	private final String stop;

	private FusionRange(String reference, String start, String stop) {
		this.reference = reference;
		this.start = start;
		this.stop = stop;
	}

	public static FusionRange of(String reference, String start, String stop) {
		return new FusionRange(Objects.requireNonNull(reference), Objects.requireNonNull(start), Objects.requireNonNull(stop));
	}

	public static FusionRange missing() {
		return MISSING;
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
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		FusionRange that = (FusionRange) o;
		return Objects.equals(reference, that.reference) && Objects.equals(start, that.start) &&
				Objects.equals(stop, that.stop);
	}

	@Override
	public int hashCode() {
		return Objects.hash(reference, start, stop);
	}

	@Override
	public String toString() {
		return isMissing() ? "?" : reference + "." + start + "_" + stop;
	}
}
