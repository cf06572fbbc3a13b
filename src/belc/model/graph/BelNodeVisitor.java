package belc.model.graph;

public abstract class BelNodeVisitor<T, E extends Throwable> {
	public abstract T visit(SimpleNode simpleNode) throws E;
	public abstract T visit(VariantNode variantNode) throws E;
	public abstract T visit(FusionNode fusionNode) throws E;
	public abstract T visit(ListNode listNode) throws E;
	public abstract T visit(ReactionNode reactionNode) throws E;
}
