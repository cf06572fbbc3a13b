package belc.model.term;

import belc.util.SourceLocation;

/**
 * {@code act(target)} or {@code act(target, ma(activity))}. BEL 1.0 activity functions such as {@code kin(p(X))}
 * parse to {@code act(p(X), ma(kin))} and keep their original function name in {@link #getLegacySyntax()}.
 */
public class ActivityToken extends ModifierToken {

	private final IdentifierToken molecularActivity;
	private final String legacySyntax;

	public ActivityToken(SourceLocation location, AbundanceToken target, IdentifierToken molecularActivity,
	                     String legacySyntax) {
		super(location, target);
		this.molecularActivity = molecularActivity;
		this.legacySyntax = legacySyntax;
	}

	/**
	 * @return the {@code ma(...)} identifier, or null for a plain {@code act(...)}
	 */
	public IdentifierToken getMolecularActivity() {
		return molecularActivity;
	}

	public String getLegacySyntax() {
		return legacySyntax;
	}

	@Override
	public <T, E extends Throwable> T accept(TermTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
