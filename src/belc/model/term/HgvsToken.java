package belc.model.term;

import belc.util.SourceLocation;

/**
 * {@code var("p.Ala127Tyr")}. Also the normalized form of the deprecated {@code sub(...)} and {@code trunc(...)}.
 */
public class HgvsToken extends VariantToken {

	private final String variant;

	public HgvsToken(SourceLocation location, String variant, String legacySyntax) {
		super(location, legacySyntax);
		this.variant = variant;
	}

	public String getVariant() {
		return variant;
	}

	@Override
	public <T, E extends Throwable> T accept(VariantTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
