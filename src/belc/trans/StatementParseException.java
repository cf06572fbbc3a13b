package belc.trans;

import belc.BelException;
import belc.errors.Issue;

/**
 * Thrown instead of recording a warning when the compiler is configured to stop at the first error.
 */
public class StatementParseException extends BelException {

	private static final long serialVersionUID = 3287104593362717604L;
	private static final String prefix = "BEL Error";

	private final String lineText;
	private final Issue issue;

	public StatementParseException(int lineNumber, String lineText, Issue issue) {
		super(prefix, issue.getMessage() + " in \"" + lineText + "\"", lineNumber);
		initCause(issue);
		this.lineText = lineText;
		this.issue = issue;
	}

	public String getLineText() {
		return lineText;
	}

	public Issue getIssue() {
		return issue;
	}
}
