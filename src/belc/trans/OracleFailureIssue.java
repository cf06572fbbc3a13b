package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.oracle.OracleException;
import belc.util.SourceLocation;

public class OracleFailureIssue extends Issue {
	private final OracleException error;

	public OracleFailureIssue(SourceLocation location, OracleException error) {
		super(Severity.ERROR, location);
		initCause(error);
		this.error = error;
	}

	public OracleException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
