package belc.model.graph;

import belc.model.BelFunction;

public final class FusionNode extends BelNode {

	private final Concept partner5p;
	private final FusionRange range5p;
	private final Concept partner3p;
	private final FusionRange range3p;

	public FusionNode(BelFunction function, Concept partner5p, FusionRange range5p, Concept partner3p,
	                  FusionRange range3p) {
		super(function);
		this.partner5p = partner5p;
		this.range5p = range5p;
		this.partner3p = partner3p;
		this.range3p = range3p;
		computeIdentity();
	}

	public Concept getPartner5p() {
		return partner5p;
	}

	public FusionRange getRange5p() {
		return range5p;
	}

	public Concept getPartner3p() {
		return partner3p;
	}

	public FusionRange getRange3p() {
		return range3p;
	}

	@Override
	public <T, E extends Throwable> T accept(BelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
