package belc.model.graph;

public abstract class ModifierVisitor<T, E extends Throwable> {
	public abstract T visit(ActivityModifier activityModifier) throws E;
	public abstract T visit(DegradationModifier degradationModifier) throws E;
	public abstract T visit(TranslocationModifier translocationModifier) throws E;
}
