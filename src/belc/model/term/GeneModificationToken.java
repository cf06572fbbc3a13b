package belc.model.term;

import belc.util.SourceLocation;

public class GeneModificationToken extends VariantToken {

	private final IdentifierToken identifier;

	public GeneModificationToken(SourceLocation location, IdentifierToken identifier) {
		super(location, null);
		this.identifier = identifier;
	}

	public IdentifierToken getIdentifier() {
		return identifier;
	}

	@Override
	public <T, E extends Throwable> T accept(VariantTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
