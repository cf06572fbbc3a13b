package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

public class IllegalAnnotationValueIssue extends Issue {
	private final String key;
	private final String value;

	public IllegalAnnotationValueIssue(SourceLocation location, String key, String value) {
		super(Severity.ERROR, location);
		this.key = key;
		this.value = value;
	}

	public String getKey() {
		return key;
	}

	public String getValue() {
		return value;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
