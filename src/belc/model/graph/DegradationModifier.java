package belc.model.graph;

public final class DegradationModifier extends Modifier {

	@Override
	public <T, E extends Throwable> T accept(ModifierVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof DegradationModifier;
	}

	@Override
	public int hashCode() {
		return DegradationModifier.class.hashCode();
	}
}
