package belc.model.graph;

import java.util.Objects;

public final class ActivityModifier extends Modifier {

	private final Concept effect;

	/**
	 * @param effect the molecular activity, or null for unspecified activity
	 */
	public ActivityModifier(Concept effect) {
		this.effect = effect;
	}

	public Concept getEffect() {
		return effect;
	}

	@Override
	public <T, E extends Throwable> T accept(ModifierVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		return Objects.equals(effect, ((ActivityModifier) o).effect);
	}

	@Override
	public int hashCode() {
		return Objects.hash(ActivityModifier.class, effect);
	}
}
