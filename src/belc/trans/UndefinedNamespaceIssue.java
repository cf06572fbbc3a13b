package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.model.term.IdentifierToken;

/**
 * The namespace of an identifier is unknown to the namespace oracle.
 */
public class UndefinedNamespaceIssue extends Issue {
	private final IdentifierToken identifier;

	public UndefinedNamespaceIssue(IdentifierToken identifier) {
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
