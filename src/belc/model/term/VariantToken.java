package belc.model.term;

import belc.util.SourceLocatable;
import belc.util.SourceLocation;

/**
 * One modifier call in the variant list of a gene, RNA, miRNA or protein term.
 */
public abstract class VariantToken extends SourceLocatable {

	private final SourceLocation location;
	private final String legacySyntax;

	protected VariantToken(SourceLocation location, String legacySyntax) {
		this.location = location;
		this.legacySyntax = legacySyntax;
	}

	/**
	 * @return the deprecated text this variant was normalized from, or null if it was written in BEL 2.0 syntax
	 */
	public String getLegacySyntax() {
		return legacySyntax;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	public abstract <T, E extends Throwable> T accept(VariantTokenVisitor<T, E> v) throws E;
}
