package belc.model.term;

import belc.util.SourceLocation;

/**
 * A function that describes what happens to an abundance within a statement (its activity, degradation or
 * translocation) rather than naming a new node.
 */
public abstract class ModifierToken extends TermToken {

	private final AbundanceToken target;

	protected ModifierToken(SourceLocation location, AbundanceToken target) {
		super(location);
		this.target = target;
	}

	public AbundanceToken getTarget() {
		return target;
	}
}
