package belc.model.graph;

import belc.model.BelFunction;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Ordering;

import java.util.List;

/**
 * A gene, RNA, miRNA or protein carrying one or more variants. Variants are kept sorted, so the order they were
 * written in does not affect identity.
 */
public final class VariantNode extends BelNode {

	private final Concept concept;
	private final List<Variant> variants;

	public VariantNode(BelFunction function, Concept concept, List<Variant> variants) {
		super(function);
		if(variants.isEmpty()) {
			throw new IllegalArgumentException("a variant node needs at least one variant");
		}
		this.concept = concept;
		this.variants = ImmutableList.copyOf(Ordering.natural().sortedCopy(variants));
		computeIdentity();
	}

	public Concept getConcept() {
		return concept;
	}

	public List<Variant> getVariants() {
		return variants;
	}

	/**
	 * @return this node with all variants stripped
	 */
	public SimpleNode getParent() {
		return new SimpleNode(getFunction(), concept);
	}

	@Override
	public <T, E extends Throwable> T accept(BelNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}
}
