package belc.model.term;

import belc.model.BelFunction;
import belc.util.SourceLocation;

/**
 * {@code fn(NS:name)}, including named complexes, biological processes and pathologies.
 */
public class SimpleAbundanceToken extends AbundanceToken {

	private final IdentifierToken identifier;

	public SimpleAbundanceToken(SourceLocation location, BelFunction function, IdentifierToken identifier,
	                            IdentifierToken cellularLocation) {
		super(location, function, cellularLocation);
		this.identifier = identifier;
	}

	public IdentifierToken getIdentifier() {
		return identifier;
	}

	@Override
	public <T, E extends Throwable> T accept(TermTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
