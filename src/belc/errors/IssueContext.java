package belc.errors;

public abstract class IssueContext {

	public abstract void report(Issue issue);

	/**
	 * @return whether any issue of severity {@link Severity#ERROR} was reported
	 */
	public abstract boolean hasErrors();
}
