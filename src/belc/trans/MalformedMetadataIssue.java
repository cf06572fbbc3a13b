package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

public class MalformedMetadataIssue extends Issue {
	private final String reason;

	public MalformedMetadataIssue(SourceLocation location, String reason) {
		super(Severity.ERROR, location);
		this.reason = reason;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
