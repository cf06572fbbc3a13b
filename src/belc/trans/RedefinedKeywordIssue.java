package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

/**
 * A namespace or annotation keyword defined a second time. The newer definition is kept.
 */
public class RedefinedKeywordIssue extends Issue {
	private final String kind;
	private final String keyword;

	public RedefinedKeywordIssue(SourceLocation location, String kind, String keyword) {
		super(Severity.WARNING, location);
		this.kind = kind;
		this.keyword = keyword;
	}

	/**
	 * @return "namespace" or "annotation"
	 */
	public String getKind() {
		return kind;
	}

	public String getKeyword() {
		return keyword;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
