package belc.trans;

import belc.errors.IssueContext;
import belc.formatters.BelEdgeFormatter;
import belc.model.graph.ActivityModifier;
import belc.model.graph.BelNode;
import belc.model.graph.Concept;
import belc.model.graph.DegradationModifier;
import belc.model.graph.EndpointContext;
import belc.model.graph.Fragment;
import belc.model.graph.FusionNode;
import belc.model.graph.FusionRange;
import belc.model.graph.GeneModification;
import belc.model.graph.HgvsVariant;
import belc.model.graph.ListNode;
import belc.model.graph.Modifier;
import belc.model.graph.ProteinModification;
import belc.model.graph.ReactionNode;
import belc.model.graph.SimpleNode;
import belc.model.graph.TranslocationKind;
import belc.model.graph.TranslocationModifier;
import belc.model.graph.Variant;
import belc.model.graph.VariantNode;
import belc.model.term.AbundanceToken;
import belc.model.term.ActivityToken;
import belc.model.term.DegradationToken;
import belc.model.term.FragmentToken;
import belc.model.term.FusionAbundanceToken;
import belc.model.term.FusionRangeToken;
import belc.model.term.GeneModificationToken;
import belc.model.term.HgvsToken;
import belc.model.term.ListAbundanceToken;
import belc.model.term.ProteinModificationToken;
import belc.model.term.ReactionToken;
import belc.model.term.SimpleAbundanceToken;
import belc.model.term.TermTokenVisitor;
import belc.model.term.TranslocationToken;
import belc.model.term.VariantAbundanceToken;
import belc.model.term.VariantToken;
import belc.model.term.VariantTokenVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps parsed terms to canonical nodes, without touching any graph. Identifiers are resolved as they are met and
 * every problem is reported into the issue context; legacy spellings are reported with their BEL 2.0 rendering.
 */
public class NodeCanonicalizer extends TermTokenVisitor<CanonicalTerm, RuntimeException> {

	private final IssueContext ctx;
	private final IdentifierResolver resolver;
	private final VariantCanonicalizer variantCanonicalizer = new VariantCanonicalizer();

	public NodeCanonicalizer(IssueContext ctx, IdentifierResolver resolver) {
		this.ctx = ctx;
		this.resolver = resolver;
	}

	/**
	 * Canonicalizes a term nested inside another one, where a {@code loc(...)} has no meaning and is dropped.
	 */
	public BelNode canonicalizeNode(AbundanceToken token) {
		return token.accept(this).getNode();
	}

	private List<BelNode> canonicalizeNodes(List<AbundanceToken> tokens) {
		List<BelNode> nodes = new ArrayList<>(tokens.size());
		for(AbundanceToken token : tokens) {
			nodes.add(canonicalizeNode(token));
		}
		return nodes;
	}

	private EndpointContext endpoint(AbundanceToken token, Modifier modifier) {
		Concept location = null;
		if(token.getCellularLocation() != null) {
			location = resolver.resolve(ctx, token.getCellularLocation());
		}
		if(modifier == null && location == null) {
			return EndpointContext.empty();
		}
		return new EndpointContext(modifier, location);
	}

	private FusionRange canonicalizeRange(FusionRangeToken range) {
		if(range.isMissing()) {
			return FusionRange.missing();
		}
		return FusionRange.of(range.getReference(), range.getStart(), range.getStop());
	}

	@Override
	public CanonicalTerm visit(SimpleAbundanceToken simpleAbundanceToken) {
		Concept concept = resolver.resolve(ctx, simpleAbundanceToken.getIdentifier());
		return new CanonicalTerm(
				new SimpleNode(simpleAbundanceToken.getFunction(), concept),
				endpoint(simpleAbundanceToken, null));
	}

	@Override
	public CanonicalTerm visit(VariantAbundanceToken variantAbundanceToken) {
		Concept concept = resolver.resolve(ctx, variantAbundanceToken.getIdentifier());
		List<Variant> variants = new ArrayList<>();
		for(VariantToken token : variantAbundanceToken.getVariants()) {
			Variant variant = token.accept(variantCanonicalizer);
			if(token.getLegacySyntax() != null) {
				ctx.report(new DeprecatedSyntaxIssue(token.getLocation(), token.getLegacySyntax(), variant.toBel()));
			}
			variants.add(variant);
		}
		return new CanonicalTerm(
				new VariantNode(variantAbundanceToken.getFunction(), concept, variants),
				endpoint(variantAbundanceToken, null));
	}

	@Override
	public CanonicalTerm visit(FusionAbundanceToken fusionAbundanceToken) {
		FusionNode node = new FusionNode(
				fusionAbundanceToken.getFunction(),
				resolver.resolve(ctx, fusionAbundanceToken.getPartner5p()),
				canonicalizeRange(fusionAbundanceToken.getRange5p()),
				resolver.resolve(ctx, fusionAbundanceToken.getPartner3p()),
				canonicalizeRange(fusionAbundanceToken.getRange3p()));
		if(fusionAbundanceToken.getLegacySyntax() != null) {
			ctx.report(new DeprecatedSyntaxIssue(
					fusionAbundanceToken.getLocation(), fusionAbundanceToken.getLegacySyntax(), node.toBel()));
		}
		return new CanonicalTerm(node, endpoint(fusionAbundanceToken, null));
	}

	@Override
	public CanonicalTerm visit(ListAbundanceToken listAbundanceToken) {
		return new CanonicalTerm(
				new ListNode(listAbundanceToken.getFunction(), canonicalizeNodes(listAbundanceToken.getMembers())),
				endpoint(listAbundanceToken, null));
	}

	@Override
	public CanonicalTerm visit(ReactionToken reactionToken) {
		return new CanonicalTerm(
				new ReactionNode(
						canonicalizeNodes(reactionToken.getReactants()),
						canonicalizeNodes(reactionToken.getProducts())),
				EndpointContext.empty());
	}

	@Override
	public CanonicalTerm visit(ActivityToken activityToken) {
		AbundanceToken target = activityToken.getTarget();
		BelNode node = canonicalizeNode(target);
		Concept effect = null;
		if(activityToken.getMolecularActivity() != null) {
			effect = resolver.resolve(ctx, activityToken.getMolecularActivity());
		}
		EndpointContext context = endpoint(target, new ActivityModifier(effect));
		if(activityToken.getLegacySyntax() != null) {
			ctx.report(new DeprecatedSyntaxIssue(activityToken.getLocation(), activityToken.getLegacySyntax(),
					BelEdgeFormatter.formatEndpoint(node, context)));
		}
		return new CanonicalTerm(node, context);
	}

	@Override
	public CanonicalTerm visit(DegradationToken degradationToken) {
		AbundanceToken target = degradationToken.getTarget();
		return new CanonicalTerm(canonicalizeNode(target), endpoint(target, new DegradationModifier()));
	}

	@Override
	public CanonicalTerm visit(TranslocationToken translocationToken) {
		AbundanceToken target = translocationToken.getTarget();
		BelNode node = canonicalizeNode(target);
		if(translocationToken.isUnqualified()) {
			ctx.report(new IllegalTranslocationIssue(translocationToken.getLocation()));
			return new CanonicalTerm(node, endpoint(target, null));
		}
		TranslocationModifier modifier;
		if(translocationToken.getKind() == TranslocationKind.TRANSLOCATION) {
			modifier = new TranslocationModifier(
					TranslocationKind.TRANSLOCATION,
					resolver.resolve(ctx, translocationToken.getFromLocation()),
					resolver.resolve(ctx, translocationToken.getToLocation()));
		} else {
			modifier = TranslocationModifier.shorthand(translocationToken.getKind());
		}
		EndpointContext context = endpoint(target, modifier);
		if(translocationToken.getLegacySyntax() != null) {
			ctx.report(new DeprecatedSyntaxIssue(translocationToken.getLocation(), translocationToken.getLegacySyntax(),
					BelEdgeFormatter.formatEndpoint(node, context)));
		}
		return new CanonicalTerm(node, context);
	}

	private class VariantCanonicalizer extends VariantTokenVisitor<Variant, RuntimeException> {

		@Override
		public Variant visit(HgvsToken hgvsToken) {
			return new HgvsVariant(hgvsToken.getVariant());
		}

		@Override
		public Variant visit(ProteinModificationToken proteinModificationToken) {
			if(proteinModificationToken.hasPlaceholderCode()) {
				ctx.report(new PlaceholderAminoAcidIssue(proteinModificationToken.getLocation()));
			}
			return new ProteinModification(
					resolver.resolve(ctx, proteinModificationToken.getIdentifier()),
					proteinModificationToken.getCode(),
					proteinModificationToken.getPosition());
		}

		@Override
		public Variant visit(GeneModificationToken geneModificationToken) {
			return new GeneModification(resolver.resolve(ctx, geneModificationToken.getIdentifier()));
		}

		@Override
		public Variant visit(FragmentToken fragmentToken) {
			if(fragmentToken.isMissing()) {
				return Fragment.missing(fragmentToken.getDescription());
			}
			return new Fragment(fragmentToken.getStart(), fragmentToken.getStop(), fragmentToken.getDescription());
		}
	}
}
