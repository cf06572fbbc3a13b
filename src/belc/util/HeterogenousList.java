package belc.util;

/**
 * A typesafe heterogenous list, used as the result of {@link belc.parser.AbstractSequenceGrammar}.
 *
 * <p>Elements of any type may be prepended and read back without a downcast, because the type of each tail is
 * tracked by the typechecker. Sequence grammars have a length known at compile time, which is the only case this
 * list needs to support.</p>
 * @param <First> the type of the head of this list
 * @param <Rest> the type of the tail, recursively also a list
 */
public final class HeterogenousList<First, Rest extends EmptyHeterogenousList> extends EmptyHeterogenousList {

	private final First first;
	private final Rest rest;

	public HeterogenousList(First first, Rest rest) {
		this.first = first;
		this.rest = rest;
	}

	public First getFirst() {
		return first;
	}

	public Rest getRest() {
		return rest;
	}

	@Override
	public boolean isEmpty() {
		return false;
	}
}
