package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.model.term.IdentifierToken;

/**
 * The namespace exists but does not contain the name.
 */
public class MissingNamespaceNameIssue extends Issue {
	private final IdentifierToken identifier;

	public MissingNamespaceNameIssue(IdentifierToken identifier) {
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
