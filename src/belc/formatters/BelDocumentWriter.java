package belc.formatters;

import belc.Unreachable;
import belc.model.BelRelation;
import belc.model.graph.BelEdge;
import belc.model.graph.BelGraph;
import belc.model.graph.BelNode;
import belc.model.graph.BelNodeVisitor;
import belc.model.graph.Citation;
import belc.model.graph.EdgeContext;
import belc.model.graph.FusionNode;
import belc.model.graph.ListNode;
import belc.model.graph.ReactionNode;
import belc.model.graph.SimpleNode;
import belc.model.graph.VariantNode;
import belc.model.metadata.Definition;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeSet;

/**
 * Writes a {@link BelGraph} as a canonical BEL document that compiles back into the same graph.
 *
 * Qualified edges are grouped by citation and evidence. Unqualified edges that node structure does not already
 * imply, and nodes no written statement brings back, follow at the end under a generated citation.
 */
public final class BelDocumentWriter {

	private BelDocumentWriter() {}

	public static final String GENERATED_CITATION_TYPE = "Other";
	public static final String GENERATED_CITATION_REFERENCE = "Added by belc";

	private static final Comparator<String> NULLS_FIRST = Comparator.nullsFirst(Comparator.naturalOrder());

	private static final Comparator<BelEdge> GROUP_ORDER = Comparator
			.comparing((BelEdge e) -> citationType(e.getContext()), NULLS_FIRST)
			.thenComparing(e -> citationReference(e.getContext()), NULLS_FIRST)
			.thenComparing(e -> e.getContext().getEvidence(), NULLS_FIRST);

	private static String citationType(EdgeContext context) {
		return context.getCitation() == null ? null : context.getCitation().getType();
	}

	private static String citationReference(EdgeContext context) {
		return context.getCitation() == null ? null : context.getCitation().getReference();
	}

	public static String toBel(BelGraph graph) {
		StringWriter w = new StringWriter();
		try {
			write(graph, w);
		} catch (IOException e) {
			throw new Unreachable(e);
		}
		return w.toString();
	}

	public static void write(BelGraph graph, Writer writer) throws IOException {
		IndentingWriter out = new IndentingWriter(writer);
		writeHeader(graph, out);
		writeQualifiedEdges(graph, out);
		writeFooter(graph, out);
		out.flush();
	}

	private static void writeDefinition(IndentingWriter out, String target, Definition definition) throws IOException {
		out.write("DEFINE ");
		out.write(target);
		out.write(" ");
		out.write(definition.getKeyword());
		out.write(" AS ");
		out.write(definition.getKind().name());
		out.write(" ");
		if(definition.getKind() == Definition.Kind.LIST) {
			writeValueList(out, definition.getValues());
		} else {
			out.write(FormattingTools.quote(definition.getValue()));
		}
		out.newLine();
	}

	private static void writeValueList(IndentingWriter out, Iterable<String> values) throws IOException {
		out.write("{");
		boolean first = true;
		for(String value : values) {
			if(!first) {
				out.write(", ");
			}
			first = false;
			out.write(FormattingTools.quote(value));
		}
		out.write("}");
	}

	private static void writeHeader(BelGraph graph, IndentingWriter out) throws IOException {
		Map<String, String> properties = graph.getMetadata().getProperties();
		for(Map.Entry<String, String> property : properties.entrySet()) {
			out.write("SET DOCUMENT ");
			out.write(property.getKey());
			out.write(" = ");
			out.write(FormattingTools.quote(property.getValue()));
			out.newLine();
		}
		if(!properties.isEmpty()) {
			out.newLine();
		}
		Map<String, Definition> namespaces = graph.getMetadata().getNamespaces();
		for(Definition definition : namespaces.values()) {
			writeDefinition(out, "NAMESPACE", definition);
		}
		if(!namespaces.isEmpty()) {
			out.newLine();
		}
		Map<String, Definition> annotations = graph.getMetadata().getAnnotations();
		for(Definition definition : annotations.values()) {
			writeDefinition(out, "ANNOTATION", definition);
		}
		if(!annotations.isEmpty()) {
			out.newLine();
		}
	}

	static List<String> citationFields(Citation citation) {
		List<String> fields = new ArrayList<>();
		fields.add(citation.getType());
		if(citation.getName() == null && citation.getDate() == null && citation.getAuthors().isEmpty() &&
				citation.getComments() == null) {
			fields.add(citation.getReference());
			return fields;
		}
		fields.add(citation.getName() == null ? "" : citation.getName());
		fields.add(citation.getReference());
		fields.add(citation.getDate() == null ? "" : citation.getDate());
		fields.add(String.join("|", citation.getAuthors()));
		fields.add(citation.getComments() == null ? "" : citation.getComments());
		while(fields.size() > 3 && fields.get(fields.size() - 1).isEmpty()) {
			fields.remove(fields.size() - 1);
		}
		return fields;
	}

	private static void writeCitation(IndentingWriter out, Citation citation) throws IOException {
		out.write("SET Citation = ");
		writeValueList(out, citationFields(citation));
		out.newLine();
	}

	private static void writeEvidence(IndentingWriter out, String evidence) throws IOException {
		out.write("SET SupportingText = ");
		out.write(FormattingTools.quote(evidence));
		out.newLine();
	}

	private static void writeQualifiedEdges(BelGraph graph, IndentingWriter out) throws IOException {
		List<BelEdge> qualified = new ArrayList<>();
		for(BelEdge edge : graph.edges()) {
			if(edge.isQualified() && !edge.isReverse()) {
				qualified.add(edge);
			}
		}
		// stable, so insertion order is kept within a group
		qualified.sort(GROUP_ORDER);

		int i = 0;
		while(i < qualified.size()) {
			EdgeContext first = qualified.get(i).getContext();
			Citation citation = first.getCitation();
			String evidence = first.getEvidence();
			if(citation != null) {
				writeCitation(out, citation);
			}
			if(evidence != null) {
				writeEvidence(out, evidence);
			}
			for(; i < qualified.size(); i++) {
				EdgeContext context = qualified.get(i).getContext();
				if(!Objects.equals(context.getCitation(), citation) || !Objects.equals(context.getEvidence(), evidence)) {
					break;
				}
				writeAnnotatedEdge(out, qualified.get(i));
			}
			if(evidence != null) {
				out.write("UNSET SupportingText");
				out.newLine();
			}
			if(citation != null) {
				out.write("UNSET Citation");
				out.newLine();
			}
			out.newLine();
		}
	}

	private static void writeAnnotatedEdge(IndentingWriter out, BelEdge edge) throws IOException {
		SortedMap<String, Set<String>> annotations = edge.getContext().getAnnotations();
		for(Map.Entry<String, Set<String>> annotation : annotations.entrySet()) {
			out.write("SET ");
			out.write(annotation.getKey());
			out.write(" = ");
			if(annotation.getValue().size() == 1) {
				out.write(FormattingTools.quote(annotation.getValue().iterator().next()));
			} else {
				writeValueList(out, annotation.getValue());
			}
			out.newLine();
		}
		out.write(BelEdgeFormatter.formatEdge(edge));
		out.newLine();
		if(annotations.size() == 1) {
			out.write("UNSET ");
			out.write(annotations.firstKey());
			out.newLine();
		} else if(annotations.size() > 1) {
			out.write("UNSET {");
			out.write(String.join(", ", annotations.keySet()));
			out.write("}");
			out.newLine();
		}
	}

	/**
	 * Whether compiling {@code source} alone already adds {@param edge}: the parent link of a variant, the members
	 * of a list and the participants of a reaction.
	 */
	static boolean isImpliedByStructure(BelEdge edge) {
		BelRelation relation = edge.getRelation();
		BelNode target = edge.getTarget();
		return edge.getSource().accept(new BelNodeVisitor<Boolean, RuntimeException>() {
			@Override
			public Boolean visit(SimpleNode simpleNode) {
				return relation == BelRelation.HAS_VARIANT && target instanceof VariantNode &&
						((VariantNode) target).getParent().equals(simpleNode);
			}

			@Override
			public Boolean visit(VariantNode variantNode) {
				return false;
			}

			@Override
			public Boolean visit(FusionNode fusionNode) {
				return false;
			}

			@Override
			public Boolean visit(ListNode listNode) {
				return relation == BelRelation.HAS_COMPONENT && listNode.getMembers().contains(target);
			}

			@Override
			public Boolean visit(ReactionNode reactionNode) {
				return (relation == BelRelation.HAS_REACTANT && reactionNode.getReactants().contains(target)) ||
						(relation == BelRelation.HAS_PRODUCT && reactionNode.getProducts().contains(target));
			}
		});
	}

	/**
	 * @return the node whose compilation brings in the other end of an implied edge
	 */
	private static BelNode impliedBy(BelEdge edge) {
		return edge.getRelation() == BelRelation.HAS_VARIANT ? edge.getTarget() : edge.getSource();
	}

	private static void writeFooter(BelGraph graph, IndentingWriter out) throws IOException {
		Set<BelNode> covered = new HashSet<>();
		Set<BelNode> implied = new HashSet<>();
		Set<String> statements = new TreeSet<>();
		for(BelEdge edge : graph.edges()) {
			if(edge.isQualified()) {
				covered.add(edge.getSource());
				covered.add(edge.getTarget());
			} else if(isImpliedByStructure(edge)) {
				BelNode origin = impliedBy(edge);
				implied.add(origin == edge.getSource() ? edge.getTarget() : edge.getSource());
			} else {
				covered.add(edge.getSource());
				covered.add(edge.getTarget());
				statements.add(BelEdgeFormatter.formatEdge(edge));
			}
		}
		for(BelNode node : graph.nodes()) {
			if(!covered.contains(node) && !implied.contains(node)) {
				statements.add(node.toBel());
			}
		}
		if(statements.isEmpty()) {
			return;
		}
		writeCitation(out, new Citation(GENERATED_CITATION_TYPE, GENERATED_CITATION_REFERENCE));
		writeEvidence(out, GENERATED_CITATION_REFERENCE);
		for(String statement : statements) {
			out.write(statement);
			out.newLine();
		}
		out.write("UNSET SupportingText");
		out.newLine();
		out.write("UNSET Citation");
		out.newLine();
	}
}
