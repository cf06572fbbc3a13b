package belc.trans;

import belc.errors.Issue;
import belc.errors.IssueContext;
import belc.errors.TopLevelIssueContext;
import belc.model.BelRelation;
import belc.model.graph.BelNode;
import belc.model.graph.EdgeContext;
import belc.model.statement.ListStatementToken;
import belc.model.statement.NestedStatementToken;
import belc.model.statement.RelationStatementToken;
import belc.model.statement.StatementToken;
import belc.model.statement.StatementTokenVisitor;
import belc.model.statement.TermStatementToken;
import belc.model.term.AbundanceToken;
import belc.parser.BelStatementParser;
import belc.parser.LexicalContext;
import belc.parser.ParseFailureException;

import java.util.ArrayList;
import java.util.List;

/**
 * Adds the nodes and edges of one statement to a graph, qualifying causal and correlative edges with the context
 * currently held by a {@link ControlParser}.
 *
 * Compilation happens in two steps. All terms are first canonicalized, which only reports issues; the graph is
 * changed afterwards, and only if none of those issues is an error.
 */
public class StatementCompiler {

	private final GraphBuilder builder;
	private final IdentifierResolver resolver;
	private final ControlParser control;
	private final boolean requireCitation;
	private final boolean requireEvidence;

	public StatementCompiler(GraphBuilder builder, IdentifierResolver resolver, ControlParser control,
	                         boolean requireCitation, boolean requireEvidence) {
		this.builder = builder;
		this.resolver = resolver;
		this.control = control;
		this.requireCitation = requireCitation;
		this.requireEvidence = requireEvidence;
	}

	public void processLine(IssueContext ctx, int lineNumber, String line) {
		StatementToken statement;
		try {
			statement = BelStatementParser.readStatement(new LexicalContext(lineNumber, line.trim()));
		} catch (ParseFailureException e) {
			ctx.report(new GrammarIssue("statement", e));
			return;
		}
		compile(ctx, statement);
	}

	/**
	 * @return whether the graph was changed
	 */
	public boolean compile(IssueContext ctx, StatementToken statement) {
		TopLevelIssueContext local = new TopLevelIssueContext();
		List<Runnable> mutations = statement.accept(new StatementPlanner(local));
		for(Issue issue : local.getIssues()) {
			ctx.report(issue);
		}
		if(local.hasErrors()) {
			return false;
		}
		for(Runnable mutation : mutations) {
			mutation.run();
		}
		return !mutations.isEmpty();
	}

	/**
	 * Canonicalizes the terms of a statement and yields the graph changes it calls for, to be applied in order.
	 */
	private class StatementPlanner extends StatementTokenVisitor<List<Runnable>, RuntimeException> {

		private final IssueContext ctx;
		private final NodeCanonicalizer canonicalizer;

		StatementPlanner(IssueContext ctx) {
			this.ctx = ctx;
			this.canonicalizer = new NodeCanonicalizer(ctx, resolver);
		}

		private EdgeContext qualify(StatementToken statement, CanonicalTerm subject, CanonicalTerm object) {
			if(requireCitation && control.getCitation() == null) {
				ctx.report(new MissingCitationIssue(statement.getLocation()));
			}
			if(requireEvidence && control.getEvidence() == null) {
				ctx.report(new MissingSupportIssue(statement.getLocation()));
			}
			return new EdgeContext(control.getCitation(), control.getEvidence(), control.getAnnotations(),
					subject.getContext(), object.getContext());
		}

		@Override
		public List<Runnable> visit(TermStatementToken termStatementToken) {
			BelNode node = termStatementToken.getTerm().accept(canonicalizer).getNode();
			List<Runnable> mutations = new ArrayList<>();
			mutations.add(() -> builder.ensureNode(node));
			return mutations;
		}

		@Override
		public List<Runnable> visit(RelationStatementToken relationStatementToken) {
			CanonicalTerm subject = relationStatementToken.getSubject().accept(canonicalizer);
			CanonicalTerm object = relationStatementToken.getObject().accept(canonicalizer);
			BelRelation relation = relationStatementToken.getRelation();
			EdgeContext context = relation.isUnqualified() ? null : qualify(relationStatementToken, subject, object);
			List<Runnable> mutations = new ArrayList<>();
			mutations.add(() -> {
				builder.ensureNode(subject.getNode());
				builder.ensureNode(object.getNode());
				builder.ensureEdge(subject.getNode(), relation, object.getNode(), context);
			});
			return mutations;
		}

		@Override
		public List<Runnable> visit(NestedStatementToken nestedStatementToken) {
			ctx.report(new NestedRelationNotSupportedIssue(nestedStatementToken.getLocation()));
			return new ArrayList<>();
		}

		@Override
		public List<Runnable> visit(ListStatementToken listStatementToken) {
			CanonicalTerm canonicalSubject = listStatementToken.getSubject().accept(canonicalizer);
			BelNode subject = canonicalSubject.getNode();
			BelRelation relation = listStatementToken.getRelation();
			if(!canonicalSubject.getContext().isEmpty()) {
				ctx.report(new ModifiedListSubjectIssue(listStatementToken.getLocation(), relation));
			}
			List<Runnable> mutations = new ArrayList<>();
			mutations.add(() -> builder.ensureNode(subject));
			for(AbundanceToken element : listStatementToken.getElements()) {
				BelNode node = canonicalizer.canonicalizeNode(element);
				mutations.add(() -> {
					builder.ensureNode(node);
					builder.ensureEdge(subject, relation, node, null);
				});
			}
			return mutations;
		}
	}
}
