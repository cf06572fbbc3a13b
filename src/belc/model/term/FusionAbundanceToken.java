package belc.model.term;

import belc.model.BelFunction;
import belc.util.SourceLocation;

/**
 * {@code fn(fus(NS:5p, range, NS:3p, range))}. Legacy fusions, written as {@code fn(NS:5p, fus(NS:3p, start,
 * stop))}, are normalized into this form and remember their original text in {@link #getLegacySyntax()}.
 */
public class FusionAbundanceToken extends AbundanceToken {

	private final IdentifierToken partner5p;
	private final FusionRangeToken range5p;
	private final IdentifierToken partner3p;
	private final FusionRangeToken range3p;
	private final String legacySyntax;

	public FusionAbundanceToken(SourceLocation location, BelFunction function,
	                            IdentifierToken partner5p, FusionRangeToken range5p,
	                            IdentifierToken partner3p, FusionRangeToken range3p,
	                            IdentifierToken cellularLocation, String legacySyntax) {
		super(location, function, cellularLocation);
		this.partner5p = partner5p;
		this.range5p = range5p;
		this.partner3p = partner3p;
		this.range3p = range3p;
		this.legacySyntax = legacySyntax;
	}

	public IdentifierToken getPartner5p() {
		return partner5p;
	}

	public FusionRangeToken getRange5p() {
		return range5p;
	}

	public IdentifierToken getPartner3p() {
		return partner3p;
	}

	public FusionRangeToken getRange3p() {
		return range3p;
	}

	public String getLegacySyntax() {
		return legacySyntax;
	}

	@Override
	public <T, E extends Throwable> T accept(TermTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
