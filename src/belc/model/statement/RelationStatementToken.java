package belc.model.statement;

import belc.model.BelRelation;
import belc.model.term.TermToken;
import belc.util.SourceLocation;

/**
 * {@code subject relation object}.
 */
public class RelationStatementToken extends StatementToken {

	private final TermToken subject;
	private final BelRelation relation;
	private final TermToken object;

	public RelationStatementToken(SourceLocation location, TermToken subject, BelRelation relation, TermToken object) {
		super(location);
		this.subject = subject;
		this.relation = relation;
		this.object = object;
	}

	public TermToken getSubject() {
		return subject;
	}

	public BelRelation getRelation() {
		return relation;
	}

	public TermToken getObject() {
		return object;
	}

	@Override
	public <T, E extends Throwable> T accept(StatementTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
