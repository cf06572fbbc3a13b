package belc.trans;

import belc.VocabularyFixtures;
import belc.errors.Issue;
import belc.errors.TopLevelIssueContext;
import belc.model.BelRelation;
import belc.model.graph.BelEdge;
import belc.model.graph.BelGraph;
import belc.model.graph.Citation;
import belc.parser.BelControlParser;
import org.junit.Before;
import org.junit.Test;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class StatementCompilerTest {

	private BelGraph graph;
	private ControlParser control;
	private StatementCompiler compiler;
	private TopLevelIssueContext ctx;
	private int lineNumber;

	private void setUp(boolean completeOrigin, boolean requireCitation, boolean requireEvidence) {
		graph = new BelGraph();
		control = new ControlParser(VocabularyFixtures.permissive(), requireCitation);
		compiler = new StatementCompiler(
				new GraphBuilder(graph, completeOrigin),
				new IdentifierResolver(VocabularyFixtures.permissive(), false),
				control, requireCitation, requireEvidence);
		ctx = new TopLevelIssueContext();
		lineNumber = 0;
	}

	@Before
	public void setUp() {
		setUp(false, true, true);
	}

	private void lines(String... lines) {
		for(String line : lines) {
			++lineNumber;
			if(control.isAccumulating() || BelControlParser.isControlLine(line)) {
				control.processLine(ctx, lineNumber, line);
			} else {
				compiler.processLine(ctx, lineNumber, line);
			}
		}
	}

	private List<BelEdge> qualifiedEdges() {
		return graph.edges().stream().filter(BelEdge::isQualified).collect(Collectors.toList());
	}

	@Test
	public void testComplexBindingScenario() {
		lines(
				"SET Citation = {\"PubMed\", \"Sialic acid binding\", \"26438529\"}",
				"SET Evidence = \"CD33 binds sialic acid\"",
				"complex(p(HGNC:CD33), a(CHEBI:\"sialic acid\")) -> p(HGNC:CD33, pmod(Ph))");
		assertThat(ctx.format(), ctx.getIssues().size(), is(0));
		assertThat(graph.numberOfNodes(), is(4));
		assertThat(graph.numberOfEdges(), is(4));
		List<BelEdge> qualified = qualifiedEdges();
		assertThat(qualified.size(), is(1));
		BelEdge edge = qualified.get(0);
		assertThat(edge.getRelation(), is(BelRelation.INCREASES));
		assertThat(edge.getSource().toBel(), is("complex(a(CHEBI:\"sialic acid\"), p(HGNC:CD33))"));
		assertThat(edge.getTarget().toBel(), is("p(HGNC:CD33, pmod(Ph))"));
		assertThat(edge.getContext().getCitation(),
				is(new Citation("PubMed", "26438529", "Sialic acid binding", null, null, null)));
		assertThat(edge.getContext().getEvidence(), is("CD33 binds sialic acid"));
	}

	@Test
	public void testCompleteOrigin() {
		setUp(true, true, true);
		lines(
				"SET Citation = {\"PubMed\", \"1\"}",
				"SET Evidence = \"e\"",
				"complex(p(HGNC:CD33), a(CHEBI:\"sialic acid\")) -> p(HGNC:CD33, pmod(Ph))");
		// r(HGNC:CD33) and g(HGNC:CD33) join the four nodes
		assertThat(graph.numberOfNodes(), is(6));
		assertThat(graph.numberOfEdges(), is(6));
	}

	@Test
	public void testAnnotationsQualifyEdges() {
		lines(
				"SET Citation = {\"PubMed\", \"1\"}",
				"SET Evidence = \"e\"",
				"SET Species = 9606",
				"SET CellLine = {\"HeLa\", \"MCF 7\"}",
				"act(p(HGNC:AKT1), ma(kin)) => p(HGNC:TP53, pmod(Ph, Ser, 15))");
		BelEdge edge = qualifiedEdges().get(0);
		assertThat(edge.getContext().getAnnotations().get("Species"), is(Collections.singleton("9606")));
		assertThat(edge.getContext().getAnnotations().get("CellLine").size(), is(2));
		assertFalse(edge.getContext().getSubject().isEmpty());
		assertTrue(edge.getContext().getObject().isEmpty());
	}

	@Test
	public void testSymmetricStatement() {
		lines("SET Citation = {\"PubMed\", \"1\"}", "SET Evidence = \"e\"", "p(HGNC:EGFR) pos p(HGNC:MAPK1)");
		assertThat(graph.numberOfNodes(), is(2));
		assertThat(qualifiedEdges().size(), is(2));
		assertThat(qualifiedEdges().stream().filter(BelEdge::isReverse).count(), is(1L));
	}

	@Test
	public void testMissingCitationAndEvidence() {
		lines("p(HGNC:AKT1) -> p(HGNC:TP53)");
		assertThat(ctx.getIssues().size(), is(2));
		assertThat(ctx.getIssues().get(0), instanceOf(MissingCitationIssue.class));
		assertThat(ctx.getIssues().get(1), instanceOf(MissingSupportIssue.class));
		assertThat(graph.numberOfNodes(), is(0));
	}

	@Test
	public void testMissingEvidenceOnly() {
		lines("SET Citation = {\"PubMed\", \"1\"}", "p(HGNC:AKT1) -> p(HGNC:TP53)");
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(MissingSupportIssue.class));
	}

	@Test
	public void testProvenanceNotRequired() {
		setUp(false, false, false);
		lines("p(HGNC:AKT1) -> p(HGNC:TP53)");
		assertThat(ctx.getIssues().size(), is(0));
		BelEdge edge = qualifiedEdges().get(0);
		assertThat(edge.getContext().getCitation(), nullValue());
		assertThat(edge.getContext().getEvidence(), nullValue());
	}

	@Test
	public void testUnqualifiedRelationNeedsNoCitation() {
		lines("g(HGNC:AKT1) :> r(HGNC:AKT1)", "p(SFAM:\"AKT Family\") isA p(SFAM:Kinases)");
		assertThat(ctx.getIssues().size(), is(0));
		assertThat(graph.numberOfEdges(), is(2));
		assertTrue(qualifiedEdges().isEmpty());
	}

	@Test
	public void testNestedStatementChangesNothing() {
		lines("SET Citation = {\"PubMed\", \"1\"}", "SET Evidence = \"e\"",
				"p(HGNC:AKT1) -> (p(HGNC:EGFR) => p(HGNC:MAPK1))");
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(NestedRelationNotSupportedIssue.class));
		assertThat(graph.numberOfNodes(), is(0));
		assertThat(graph.numberOfEdges(), is(0));
	}

	@Test
	public void testErrorsLeaveGraphUntouched() {
		lines("SET Citation = {\"PubMed\", \"1\"}", "SET Evidence = \"e\"",
				"p(HGNC:AKT1) -> p(UNIPROT:P04637)");
		assertThat(ctx.getIssues().get(0), instanceOf(UndefinedNamespaceIssue.class));
		assertThat(graph.numberOfNodes(), is(0));
	}

	@Test
	public void testWarningsDoNotBlockCompilation() {
		lines("SET Citation = {\"PubMed\", \"1\"}", "SET Evidence = \"e\"", "kin(p(HGNC:AKT1)) -> p(HGNC:TP53)");
		assertThat(ctx.getIssues().size(), is(1));
		assertFalse(ctx.hasErrors());
		assertThat(graph.numberOfEdges(), is(1));
	}

	@Test
	public void testListStatement() {
		lines("p(SFAM:\"AKT Family\") hasMembers list(p(HGNC:AKT1), p(HGNC:AKT2))");
		assertThat(ctx.getIssues().size(), is(0));
		assertThat(graph.numberOfNodes(), is(3));
		for(BelEdge edge : graph.edges()) {
			assertThat(edge.getRelation(), is(BelRelation.HAS_MEMBER));
			assertFalse(edge.isQualified());
		}
	}

	@Test
	public void testModifiedListSubjectIsRejected() {
		lines("act(p(SFAM:\"AKT Family\")) hasMembers list(p(HGNC:AKT1), p(HGNC:AKT2))");
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(ModifiedListSubjectIssue.class));
		assertThat(graph.numberOfNodes(), is(0));
	}

	@Test
	public void testTermStatement() {
		lines("p(HGNC:AKT1, pmod(Ph))");
		assertThat(ctx.getIssues().size(), is(0));
		assertThat(graph.numberOfNodes(), is(2));
		assertThat(graph.edges().iterator().next().getRelation(), is(BelRelation.HAS_VARIANT));
	}

	@Test
	public void testGrammarFailure() {
		lines("p(HGNC:AKT1) -> ");
		Issue issue = ctx.getIssues().get(0);
		assertThat(issue, instanceOf(GrammarIssue.class));
		assertTrue(issue.isError());
	}
}
