package belc.model.term;

import belc.model.BelFunction;
import belc.util.SourceLocation;

/**
 * A term denoting a graph node, as opposed to a {@link ModifierToken} wrapping one. The optional cellular location
 * ({@code loc(...)}) describes the statement the term appears in, not the node itself.
 */
public abstract class AbundanceToken extends TermToken {

	private final BelFunction function;
	private final IdentifierToken cellularLocation;

	protected AbundanceToken(SourceLocation location, BelFunction function, IdentifierToken cellularLocation) {
		super(location);
		this.function = function;
		this.cellularLocation = cellularLocation;
	}

	public BelFunction getFunction() {
		return function;
	}

	/**
	 * @return the {@code loc(...)} identifier, or null
	 */
	public IdentifierToken getCellularLocation() {
		return cellularLocation;
	}
}
