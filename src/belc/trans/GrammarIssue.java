package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.parser.ParseFailureException;

/**
 * A line that matches none of the BEL grammars.
 */
public class GrammarIssue extends Issue {
	private final String language;
	private final ParseFailureException error;

	public GrammarIssue(String language, ParseFailureException error) {
		super(Severity.ERROR, error.getFurthestLocation());
		initCause(error);
		this.language = language;
		this.error = error;
	}

	public ParseFailureException getError() {
		return error;
	}

	/**
	 * @return what was being parsed, such as "statement" or "control"
	 */
	public String getLanguage() {
		return language;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
