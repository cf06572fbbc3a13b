package belc.model.term;

import belc.util.SourceLocation;

/**
 * {@code pmod(identifier[, code[, position]])}. The amino acid code is always a three-letter code; one-letter codes
 * are expanded by the grammar. A placeholder code ({@code X}) is kept so that it can be reported.
 */
public class ProteinModificationToken extends VariantToken {

	public static final String PLACEHOLDER_CODE = "X";

	private final IdentifierToken identifier;
	private final String code;
	private final Integer position;

	public ProteinModificationToken(SourceLocation location, IdentifierToken identifier, String code,
	                                Integer position, String legacySyntax) {
		super(location, legacySyntax);
		this.identifier = identifier;
		this.code = code;
		this.position = position;
	}

	public IdentifierToken getIdentifier() {
		return identifier;
	}

	/**
	 * @return the three-letter amino acid code, or null
	 */
	public String getCode() {
		return code;
	}

	/**
	 * @return the residue position, or null
	 */
	public Integer getPosition() {
		return position;
	}

	public boolean hasPlaceholderCode() {
		return PLACEHOLDER_CODE.equals(code);
	}

	@Override
	public <T, E extends Throwable> T accept(VariantTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
