package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

/**
 * A qualified statement or an annotation SET with no citation in effect.
 */
public class MissingCitationIssue extends Issue {

	public MissingCitationIssue(SourceLocation location) {
		super(Severity.ERROR, location);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
