package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

/**
 * A qualified statement with no evidence in effect.
 */
public class MissingSupportIssue extends Issue {

	public MissingSupportIssue(SourceLocation location) {
		super(Severity.ERROR, location);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
