package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

/**
 * A {@code tloc} written without its from and to locations.
 */
public class IllegalTranslocationIssue extends Issue {

	public IllegalTranslocationIssue(SourceLocation location) {
		super(Severity.ERROR, location);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
