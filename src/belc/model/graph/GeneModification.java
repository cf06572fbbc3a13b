package belc.model.graph;

public final class GeneModification extends Variant {

	private final Concept modification;

	public GeneModification(Concept modification) {
		this.modification = modification;
	}

	public Concept getModification() {
		return modification;
	}

	@Override
	public <T, E extends Throwable> T accept(VariantVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
