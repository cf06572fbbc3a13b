package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

public class UndefinedAnnotationIssue extends Issue {
	private final String key;

	public UndefinedAnnotationIssue(SourceLocation location, String key) {
		super(Severity.ERROR, location);
		this.key = key;
	}

	public String getKey() {
		return key;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
