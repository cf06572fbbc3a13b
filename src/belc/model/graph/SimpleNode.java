package belc.model.graph;

import belc.model.BelFunction;

public final class SimpleNode extends BelNode {

	private final Concept concept;

	public SimpleNode(BelFunction function, Concept concept) {
		super(function);
		this.concept = concept;
		computeIdentity();
	}

	public Concept getConcept() {
		return concept;
	}

	/**
	 * @return the same entity under another function, as used for central dogma expansion
	 */
	public SimpleNode withFunction(BelFunction function) {
		return new SimpleNode(function, concept);
	}

	@Override
	public <T, E extends Throwable> T accept(BelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
