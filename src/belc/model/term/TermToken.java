package belc.model.term;

import belc.util.SourceLocatable;
import belc.util.SourceLocation;

/**
 * The result of parsing one BEL term. Term tokens are immutable and closed over the subclasses visited by
 * {@link TermTokenVisitor}.
 */
public abstract class TermToken extends SourceLocatable {

	private final SourceLocation location;

	protected TermToken(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public abstract <T, E extends Throwable> T accept(TermTokenVisitor<T, E> v) throws E;
}
