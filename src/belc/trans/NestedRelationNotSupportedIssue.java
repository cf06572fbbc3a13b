package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

/**
 * A statement whose object is itself a parenthesized statement, as in {@code a -> (b -| c)}.
 */
public class NestedRelationNotSupportedIssue extends Issue {

	public NestedRelationNotSupportedIssue(SourceLocation location) {
		super(Severity.ERROR, location);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
