package belc.model.graph;

/**
 * A function wrapped around one end of a relation: activity, degradation or translocation. Modifiers qualify the
 * edge, never the node.
 */
public abstract class Modifier {
	public abstract <T, E extends Throwable> T accept(ModifierVisitor<T, E> v) throws E;
}
