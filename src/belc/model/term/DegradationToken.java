package belc.model.term;

import belc.util.SourceLocation;

public class DegradationToken extends ModifierToken {

	public DegradationToken(SourceLocation location, AbundanceToken target) {
		super(location, target);
	}

	@Override
	public <T, E extends Throwable> T accept(TermTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
