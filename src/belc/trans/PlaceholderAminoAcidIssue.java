package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.util.SourceLocation;

/**
 * A protein modification using the placeholder amino acid {@code X}.
 */
public class PlaceholderAminoAcidIssue extends Issue {

	public PlaceholderAminoAcidIssue(SourceLocation location) {
		super(Severity.ERROR, location);
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
