package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

/**
 * An UNSET of something that was not set. Harmless, so only a warning.
 */
public class MissingAnnotationKeyIssue extends Issue {
	private final String key;

	public MissingAnnotationKeyIssue(SourceLocation location, String key) {
		super(Severity.WARNING, location);
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
