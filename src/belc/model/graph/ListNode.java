package belc.model.graph;

import belc.model.BelFunction;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import java.util.List;

/**
 * A complex or composite abundance of member nodes, kept in canonical order.
 */
public final class ListNode extends BelNode {

	private final List<BelNode> members;

	public ListNode(BelFunction function, List<BelNode> members) {
		super(function);
		if(function != BelFunction.COMPLEX && function != BelFunction.COMPOSITE) {
			throw new IllegalArgumentException("list nodes are complexes or composites, not " + function);
		}
		this.members = ImmutableList.copyOf(Ordering.natural().sortedCopy(members));
		computeIdentity();
	}

	public List<BelNode> getMembers() {
		return members;
	}

	@Override
	public <T, E extends Throwable> T accept(BelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
