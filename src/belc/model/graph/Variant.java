package belc.model.graph;

import belc.formatters.BelNodeFormattingVisitor;

/**
 * A variant carried by a {@link VariantNode}. Variants order by their canonical rendering.
 */
public abstract class Variant implements Comparable<Variant> {

	private String canonicalBel;

	public abstract <T, E extends Throwable> T accept(VariantVisitor<T, E> v) throws E;

	public String toBel() {
		if(canonicalBel == null) {
			canonicalBel = BelNodeFormattingVisitor.formatVariant(this);
		}
		return canonicalBel;
	}

	@Override
	public int compareTo(Variant o) {
		return toBel().compareTo(o.toBel());
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof Variant)) return false;
		return toBel().equals(((Variant) o).toBel());
	}

	@Override
	public int hashCode() {
		return toBel().hashCode();
	}

	@Override
	public String toString() {
		return toBel();
	}
}
