package belc.model.statement;

import belc.model.BelRelation;
import belc.model.term.TermToken;
import belc.util.SourceLocation;

/**
 * {@code subject relation (subject2 relation2 object2)}. Parsed so that it can be reported precisely; nested
 * statements are never compiled into the graph.
 */
public class NestedStatementToken extends StatementToken {

	private final TermToken subject;
	private final BelRelation relation;
	private final RelationStatementToken nested;

	public NestedStatementToken(SourceLocation location, TermToken subject, BelRelation relation,
	                            RelationStatementToken nested) {
		super(location);
		this.subject = subject;
		this.relation = relation;
		this.nested = nested;
	}

	public TermToken getSubject() {
		return subject;
	}

	public BelRelation getRelation() {
		return relation;
	}

	public RelationStatementToken getNested() {
		return nested;
	}

	@Override
	public <T, E extends Throwable> T accept(StatementTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
