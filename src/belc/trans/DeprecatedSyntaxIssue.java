package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

/**
 * BEL 1.0 syntax that was accepted and normalized.
 */
public class DeprecatedSyntaxIssue extends Issue {
	private final String legacySyntax;
	private final String replacement;

	public DeprecatedSyntaxIssue(SourceLocation location, String legacySyntax, String replacement) {
		super(Severity.WARNING, location);
		this.legacySyntax = legacySyntax;
		this.replacement = replacement;
	}

	public String getLegacySyntax() {
		return legacySyntax;
	}

	public String getReplacement() {
		return replacement;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
