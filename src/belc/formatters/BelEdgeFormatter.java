package belc.formatters;

import belc.Unreachable;
import belc.model.graph.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Map;
import java.util.Set;

/**
 * Writes edges as BEL statements, wrapping each endpoint in its modifier and location, and serializes edge
 * contexts for edge keys.
 */
public final class BelEdgeFormatter {

	private BelEdgeFormatter() {}

	private static final class ModifierWrappingVisitor extends ModifierVisitor<Void, IOException> {
		private final IndentingWriter out;
		private final String term;

		ModifierWrappingVisitor(IndentingWriter out, String term) {
			this.out = out;
			this.term = term;
		}

		@Override
		public Void visit(ActivityModifier activityModifier) throws IOException {
			out.write("act(");
			out.write(term);
			if(activityModifier.getEffect() != null) {
				out.write(", ma(");
				FormattingTools.writeConcept(out, activityModifier.getEffect());
				out.write(")");
			}
			out.write(")");
			return null;
		}

		@Override
		public Void visit(DegradationModifier degradationModifier) throws IOException {
			out.write("deg(");
			out.write(term);
			out.write(")");
			return null;
		}

		@Override
		public Void visit(TranslocationModifier translocationModifier) throws IOException {
			out.write(translocationModifier.getKind().getKeyword());
			out.write("(");
			out.write(term);
			if(translocationModifier.getKind() == TranslocationKind.TRANSLOCATION) {
				out.write(", fromLoc(");
				FormattingTools.writeConcept(out, translocationModifier.getFrom());
				out.write("), toLoc(");
				FormattingTools.writeConcept(out, translocationModifier.getTo());
				out.write(")");
			}
			out.write(")");
			return null;
		}
	}

	private static String withLocation(String term, Concept location) throws IOException {
		if(location == null) {
			return term;
		}
		StringWriter w = new StringWriter();
		IndentingWriter out = new IndentingWriter(w);
		out.write(term.substring(0, term.length() - 1));
		out.write(", loc(");
		FormattingTools.writeConcept(out, location);
		out.write("))");
		return w.toString();
	}

	private static String wrap(String term, EndpointContext context) {
		try {
			String located = withLocation(term, context.getLocation());
			if(context.getModifier() == null) {
				return located;
			}
			StringWriter w = new StringWriter();
			context.getModifier().accept(new ModifierWrappingVisitor(new IndentingWriter(w), located));
			return w.toString();
		} catch (IOException e) {
			throw new Unreachable(e);
		}
	}

	/**
	 * @return {@param node} as written at one end of a statement with the given context
	 */
	public static String formatEndpoint(BelNode node, EndpointContext context) {
		return wrap(node.toBel(), context == null ? EndpointContext.empty() : context);
	}

	public static String formatEdge(BelEdge edge) {
		EdgeContext context = edge.getContext();
		return formatEndpoint(edge.getSource(), context == null ? null : context.getSubject()) + " " +
				edge.getRelation().getCanonicalName() + " " +
				formatEndpoint(edge.getTarget(), context == null ? null : context.getObject());
	}

	private static void appendField(StringBuilder builder, String name, Object value) {
		builder.append(name).append('=');
		if(value != null) {
			builder.append(FormattingTools.quote(value.toString()));
		}
		builder.append(';');
	}

	private static String quotedList(Iterable<String> values) {
		StringBuilder builder = new StringBuilder("{");
		for(String value : values) {
			if(builder.length() > 1) {
				builder.append(',');
			}
			builder.append(FormattingTools.quote(value));
		}
		return builder.append('}').toString();
	}

	/**
	 * A deterministic text form of {@param context}; equal contexts serialize equally.
	 */
	public static String serializeContext(EdgeContext context) {
		StringBuilder builder = new StringBuilder();
		Citation citation = context.getCitation();
		if(citation != null) {
			appendField(builder, "citation_type", citation.getType());
			appendField(builder, "citation_reference", citation.getReference());
			appendField(builder, "citation_name", citation.getName());
			appendField(builder, "citation_date", citation.getDate());
			appendField(builder, "citation_authors", quotedList(citation.getAuthors()));
			appendField(builder, "citation_comments", citation.getComments());
		}
		appendField(builder, "evidence", context.getEvidence());
		for(Map.Entry<String, Set<String>> annotation : context.getAnnotations().entrySet()) {
			appendField(builder, "annotation:" + annotation.getKey(), quotedList(annotation.getValue()));
		}
		appendField(builder, "subject", wrap("x()", context.getSubject()));
		appendField(builder, "object", wrap("x()", context.getObject()));
		return builder.toString();
	}
}
