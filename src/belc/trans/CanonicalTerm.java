package belc.trans;

import belc.model.graph.BelNode;
import belc.model.graph.EndpointContext;

/**
 * A canonicalized statement term: the node it denotes and what the statement says about that node.
 */
public final class CanonicalTerm {

	private final BelNode node;
	private final EndpointContext context;

	public CanonicalTerm(BelNode node, EndpointContext context) {
		this.node = node;
		this.context = context == null ? EndpointContext.empty() : context;
	}

	public BelNode getNode() {
		return node;
	}

	public EndpointContext getContext() {
		return context;
	}
}
