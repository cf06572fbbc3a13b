package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.model.term.IdentifierToken;

/**
 * An identifier was written without a namespace while naked names are not allowed.
 */
public class NakedNameIssue extends Issue {
	private final IdentifierToken identifier;

	public NakedNameIssue(IdentifierToken identifier) {
		super(Severity.ERROR, identifier.getLocation());
		this.identifier = identifier;
	}

	public IdentifierToken getIdentifier() {
		return identifier;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
