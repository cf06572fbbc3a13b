package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueVisitor;
import belc.errors.Severity;
import belc.model.BelRelation;
import belc.util.SourceLocation;

/**
 * A {@code hasMembers} or {@code hasComponents} statement whose subject is wrapped in an activity, degradation,
 * translocation or location. Membership is unqualified, so the wrapper would have nowhere to go.
 */
public class ModifiedListSubjectIssue extends Issue {

	private final BelRelation relation;

	public ModifiedListSubjectIssue(SourceLocation location, BelRelation relation) {
		super(Severity.ERROR, location);
		this.relation = relation;
	}

	public BelRelation getRelation() {
		return relation;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
