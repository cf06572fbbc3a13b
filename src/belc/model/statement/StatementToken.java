package belc.model.statement;

import belc.util.SourceLocatable;
import belc.util.SourceLocation;

/**
 * The result of parsing one BEL statement line.
 */
public abstract class StatementToken extends SourceLocatable {

	private final SourceLocation location;

	protected StatementToken(SourceLocation location) {
		this.location = location;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public abstract <T, E extends Throwable> T accept(StatementTokenVisitor<T, E> v) throws E;
}
