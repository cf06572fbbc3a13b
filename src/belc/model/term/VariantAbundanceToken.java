package belc.model.term;

import belc.model.BelFunction;
import belc.util.SourceLocation;

import java.util.Collections;
import java.util.List;

/**
 * {@code fn(NS:name, variant, ...)}, with variants in source order.
 */
public class VariantAbundanceToken extends AbundanceToken {

	private final IdentifierToken identifier;
	private final List<VariantToken> variants;

	public VariantAbundanceToken(SourceLocation location, BelFunction function, IdentifierToken identifier,
	                             List<VariantToken> variants, IdentifierToken cellularLocation) {
		super(location, function, cellularLocation);
		this.identifier = identifier;
		this.variants = Collections.unmodifiableList(variants);
	}

	public IdentifierToken getIdentifier() {
		return identifier;
	}

	public List<VariantToken> getVariants() {
		return variants;
	}

	@Override
	public <T, E extends Throwable> T accept(TermTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
