package belc.model.term;

public abstract class TermTokenVisitor<T, E extends Throwable> {
	public abstract T visit(SimpleAbundanceToken simpleAbundanceToken) throws E;
	public abstract T visit(VariantAbundanceToken variantAbundanceToken) throws E;
	public abstract T visit(FusionAbundanceToken fusionAbundanceToken) throws E;
	public abstract T visit(ListAbundanceToken listAbundanceToken) throws E;
	public abstract T visit(ReactionToken reactionToken) throws E;
	public abstract T visit(ActivityToken activityToken) throws E;
	public abstract T visit(DegradationToken degradationToken) throws E;
	public abstract T visit(TranslocationToken translocationToken) throws E;
}
