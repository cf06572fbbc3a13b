package belc.model.term;

import belc.model.graph.TranslocationKind;
import belc.util.SourceLocation;

/**
 * {@code tloc(target, fromLoc(...), toLoc(...))} and its shorthands {@code sec(target)} and {@code surf(target)}.
 * A {@code tloc(target)} without locations is still parsed, so that it can be rejected with a precise diagnostic.
 */
public class TranslocationToken extends ModifierToken {

	private final TranslocationKind kind;
	private final IdentifierToken fromLocation;
	private final IdentifierToken toLocation;
	private final String legacySyntax;

	public TranslocationToken(SourceLocation location, AbundanceToken target, TranslocationKind kind,
	                          IdentifierToken fromLocation, IdentifierToken toLocation, String legacySyntax) {
		super(location, target);
		this.kind = kind;
		this.fromLocation = fromLocation;
		this.toLocation = toLocation;
		this.legacySyntax = legacySyntax;
	}

	public TranslocationKind getKind() {
		return kind;
	}

	/**
	 * @return whether this is a {@code tloc} lacking its from and to locations
	 */
	public boolean isUnqualified() {
		return kind == TranslocationKind.TRANSLOCATION && (fromLocation == null || toLocation == null);
	}

	public IdentifierToken getFromLocation() {
		return fromLocation;
	}

	public IdentifierToken getToLocation() {
		return toLocation;
	}

	public String getLegacySyntax() {
		return legacySyntax;
	}

	@Override
	public <T, E extends Throwable> T accept(TermTokenVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
