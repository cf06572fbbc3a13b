package belc.trans;

import belc.model.BelFunction;
import belc.model.BelRelation;
import belc.model.graph.BelEdge;
import belc.model.graph.BelGraph;
import belc.model.graph.BelNode;
import belc.model.graph.BelNodeVisitor;
import belc.model.graph.EdgeContext;
import belc.model.graph.FusionNode;
import belc.model.graph.ListNode;
import belc.model.graph.ReactionNode;
import belc.model.graph.SimpleNode;
import belc.model.graph.VariantNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Inserts canonical nodes and edges into a {@link BelGraph}, adding the structure every node implies the first time
 * it is seen: the parent of a variant, the members of a list, the participants of a reaction and, in complete
 * origin mode, the gene and RNA a product is made from.
 */
public class GraphBuilder {

	private final BelGraph graph;
	private final boolean completeOrigin;

	public GraphBuilder(BelGraph graph, boolean completeOrigin) {
		this.graph = graph;
		this.completeOrigin = completeOrigin;
	}

	public BelGraph getGraph() {
		return graph;
	}

	/**
	 * @return {@param node}, now present in the graph together with its implied structure
	 */
	public BelNode ensureNode(BelNode node) {
		if(graph.containsNode(node)) {
			return node;
		}
		graph.addNode(node);
		node.accept(new ImpliedStructureVisitor());
		return node;
	}

	private void ensureUnqualifiedEdge(BelNode source, BelRelation relation, BelNode target) {
		graph.addEdge(BelEdge.unqualified(source, relation, target));
	}

	/**
	 * Adds an edge between two nodes, which must already have been ensured. Relations that never carry provenance
	 * ignore {@param context}; symmetric relations are stored in both directions.
	 *
	 * @return the edges stored, reverse edge last
	 */
	public List<BelEdge> ensureEdge(BelNode source, BelRelation relation, BelNode target, EdgeContext context) {
		List<BelEdge> result = new ArrayList<>(2);
		if(relation.isUnqualified() || context == null) {
			result.add(graph.addEdge(BelEdge.unqualified(source, relation, target)));
			return result;
		}
		result.add(graph.addEdge(new BelEdge(source, relation, target, context, false)));
		if(relation.isSymmetric()) {
			result.add(graph.addEdge(new BelEdge(target, relation, source, context.swapped(), true)));
		}
		return result;
	}

	private class ImpliedStructureVisitor extends BelNodeVisitor<Void, RuntimeException> {

		private void ensureOrigin(BelNode node, BelNode upstream) {
			if(!completeOrigin || upstream == null) {
				return;
			}
			ensureNode(upstream);
			ensureUnqualifiedEdge(upstream, node.getFunction().getRelationFromUpstream(), node);
		}

		@Override
		public Void visit(SimpleNode simpleNode) {
			BelFunction upstream = simpleNode.getFunction().getUpstream();
			ensureOrigin(simpleNode, upstream == null ? null : simpleNode.withFunction(upstream));
			return null;
		}

		@Override
		public Void visit(VariantNode variantNode) {
			SimpleNode parent = variantNode.getParent();
			ensureNode(parent);
			ensureUnqualifiedEdge(parent, BelRelation.HAS_VARIANT, variantNode);
			return null;
		}

		@Override
		public Void visit(FusionNode fusionNode) {
			// breakpoints are in the coordinates of the fusion's own level and have no gene or RNA counterpart
			return null;
		}

		@Override
		public Void visit(ListNode listNode) {
			for(BelNode member : listNode.getMembers()) {
				ensureNode(member);
				ensureUnqualifiedEdge(listNode, BelRelation.HAS_COMPONENT, member);
			}
			return null;
		}

		@Override
		public Void visit(ReactionNode reactionNode) {
			for(BelNode reactant : reactionNode.getReactants()) {
				ensureNode(reactant);
				ensureUnqualifiedEdge(reactionNode, BelRelation.HAS_REACTANT, reactant);
			}
			for(BelNode product : reactionNode.getProducts()) {
				ensureNode(product);
				ensureUnqualifiedEdge(reactionNode, BelRelation.HAS_PRODUCT, product);
			}
			return null;
		}
	}
}
