package belc.model.statement;

import belc.model.term.TermToken;
import belc.util.SourceLocation;

/**
 * A line consisting of a single term, which only asserts that its node exists.
 */
public class TermStatementToken extends StatementToken {

	private final TermToken term;

	public TermStatementToken(SourceLocation location, TermToken term) {
		super(location);
		this.term = term;
	}

	public TermToken getTerm() {
		return term;
	}

	@Override
	public <T, E extends Throwable> T accept(StatementTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
