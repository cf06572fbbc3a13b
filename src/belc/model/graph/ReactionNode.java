package belc.model.graph;

import belc.model.BelFunction;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import java.util.List;

public final class ReactionNode extends BelNode {

	private final List<BelNode> reactants;
	private final List<BelNode> products;

	public ReactionNode(List<BelNode> reactants, List<BelNode> products) {
		super(BelFunction.REACTION);
		this.reactants = ImmutableList.copyOf(Ordering.natural().sortedCopy(reactants));
		this.products = ImmutableList.copyOf(Ordering.natural().sortedCopy(products));
		computeIdentity();
	}

	public List<BelNode> getReactants() {
		return reactants;
	}

	public List<BelNode> getProducts() {
		return products;
	}

	@Override
	public <T, E extends Throwable> T accept(BelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
