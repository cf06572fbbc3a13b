package belc.model.statement;

import belc.model.BelRelation;
import belc.model.term.AbundanceToken;
import belc.model.term.TermToken;
import belc.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * {@code subject hasMembers list(a, b, ...)} or {@code subject hasComponents list(...)}, which fans out into one
 * {@link #getRelation()} edge per element.
 */
public class ListStatementToken extends StatementToken {

	private final TermToken subject;
	private final BelRelation relation;
	private final List<AbundanceToken> elements;

	public ListStatementToken(SourceLocation location, TermToken subject, BelRelation relation,
	                          List<AbundanceToken> elements) {
		super(location);
		this.subject = subject;
		this.relation = relation;
		this.elements = Collections.unmodifiableList(elements);
	}

	public TermToken getSubject() {
		return subject;
	}

	public BelRelation getRelation() {
		return relation;
	}

	public List<AbundanceToken> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(StatementTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
