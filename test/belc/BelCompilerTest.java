package belc;

import belc.model.BelRelation;
import belc.model.graph.BelEdge;
import belc.model.graph.BelGraph;
import belc.model.graph.BelWarning;
import belc.model.metadata.DocumentMetadata;
import belc.trans.ControlParser;
import belc.trans.GrammarIssue;
import belc.trans.MalformedMetadataIssue;
import belc.trans.MissingCitationIssue;
import belc.trans.MissingNamespaceNameIssue;
import belc.trans.StatementParseException;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class BelCompilerTest {

	private static File resource(String name) throws URISyntaxException {
		return new File(BelCompilerTest.class.getResource("/belc/" + name).toURI());
	}

	private static BelGraph compileSample() throws Exception {
		BelCompiler compiler = BelCompiler.fromOptions(BelcOptions.read(resource("options.json")));
		return compiler.compileFile(resource("sample.bel"));
	}

	private static List<BelEdge> edges(BelGraph graph, BelRelation relation) {
		return graph.edges().stream().filter(e -> e.getRelation() == relation).collect(Collectors.toList());
	}

	@Test
	public void testSampleDocument() throws Exception {
		BelGraph graph = compileSample();
		assertThat(graph.getWarnings().toString(), graph.getWarnings().size(), is(0));
		assertThat(graph.numberOfNodes(), is(10));
		assertThat(graph.numberOfEdges(), is(9));
		assertThat(graph.getMetadata().getProperty(DocumentMetadata.NAME), is("Sample"));
		assertThat(graph.getMetadata().getNamespaces().size(), is(3));
	}

	@Test
	public void testSampleDocumentContexts() throws Exception {
		BelGraph graph = compileSample();

		BelEdge binding = edges(graph, BelRelation.INCREASES).get(0);
		assertThat(binding.getContext().getEvidence(),
				is("Sialic acid bound to CD33 leads to phosphorylation of CD33"));
		assertThat(binding.getContext().getAnnotations().keySet(), is(Collections.singleton("Species")));

		BelEdge kinase = edges(graph, BelRelation.DIRECTLY_INCREASES).get(0);
		assertThat(kinase.getContext().getAnnotations().get("CellLine"),
				is(new HashSet<>(Arrays.asList("HeLa", "MCF 7"))));

		BelEdge correlation = edges(graph, BelRelation.POSITIVE_CORRELATION).get(0);
		assertFalse(correlation.getContext().getAnnotations().containsKey("CellLine"));

		BelEdge translocation = edges(graph, BelRelation.DECREASES).get(0);
		assertThat(translocation.getContext().getEvidence(), is("Evidence spanning two physical lines"));
		assertThat(translocation.getContext().getCitation().getReference(), is("12345"));
		assertTrue(translocation.getContext().getAnnotations().isEmpty());
	}

	@Test
	public void testIssuesBecomeWarnings() {
		BelCompiler compiler = new BelCompiler(new BelcOptions(), VocabularyFixtures.permissive());
		BelGraph graph = compiler.compile(String.join("\n",
				"SET DOCUMENT Colour = \"blue\"",
				"SET Citation = {\"PubMed\", \"1\"}",
				"SET Evidence = \"text\"",
				"SET Species = 9606",
				"p(HGNC:AKT1) -> p(UNIPROT:P04637)",
				"p(HGNC:AKT1) -> p(HGNC:TP53)"));
		assertThat(graph.getWarnings().size(), is(2));

		BelWarning metadata = graph.getWarnings().get(0);
		assertThat(metadata.getLineNumber(), is(1));
		assertThat(metadata.getIssue(), instanceOf(MalformedMetadataIssue.class));
		assertTrue(metadata.getAnnotations().isEmpty());

		BelWarning statement = graph.getWarnings().get(1);
		assertThat(statement.getLineNumber(), is(5));
		assertThat(statement.getLine(), is("p(HGNC:AKT1) -> p(UNIPROT:P04637)"));
		assertThat(statement.getAnnotations().get("Species"), is(Collections.singleton("9606")));
		assertThat(statement.getAnnotations().get(ControlParser.CITATION_REFERENCE_KEY), is(Collections.singleton("1")));

		// the line after the failing one still compiles
		assertThat(edges(graph, BelRelation.INCREASES).size(), is(1));
	}

	@Test
	public void testStopOnError() {
		BelcOptions options = new BelcOptions();
		options.stopOnError = true;
		BelCompiler compiler = new BelCompiler(options, VocabularyFixtures.permissive());
		try {
			compiler.compile(String.join("\n",
					"SET Citation = {\"PubMed\", \"1\"}",
					"SET Evidence = \"text\"",
					"p(HGNC:AKT1) -> p(UNIPROT:P04637)",
					"p(HGNC:AKT1) -> p(HGNC:TP53)"));
			fail("expected the compiler to stop");
		} catch (StatementParseException e) {
			assertThat(e.getLine(), is(3));
			assertThat(e.getLineText(), is("p(HGNC:AKT1) -> p(UNIPROT:P04637)"));
		}
	}

	@Test
	public void testWarningsDoNotStopCompilation() {
		BelcOptions options = new BelcOptions();
		options.stopOnError = true;
		options.completeOrigin = false;
		BelCompiler compiler = new BelCompiler(options, VocabularyFixtures.permissive());
		BelGraph graph = compiler.compile(String.join("\n",
				"SET Citation = {\"PubMed\", \"1\"}",
				"SET Evidence = \"text\"",
				"kin(p(HGNC:AKT1)) -> p(HGNC:TP53)"));
		assertThat(graph.getWarnings().size(), is(1));
		assertThat(graph.numberOfEdges(), is(1));
	}

	@Test
	public void testOversizedCoordinateOnlyFailsItsLine() {
		BelcOptions options = VocabularyFixtures.lenientOptions();
		options.completeOrigin = false;
		BelCompiler compiler = new BelCompiler(options, VocabularyFixtures.permissive());
		BelGraph graph = compiler.compile(String.join("\n",
				"p(HGNC:AKT1, pmod(Ph, Ser, 99999999999))",
				"p(HGNC:AKT1, trunc(3000000000))",
				"p(HGNC:TP53, pmod(Ph, Ser, 2147483647))",
				"p(HGNC:TP53)"));
		assertThat(graph.getWarnings().size(), is(2));
		assertThat(graph.getWarnings().get(0).getLineNumber(), is(1));
		assertThat(graph.getWarnings().get(0).getIssue(), instanceOf(GrammarIssue.class));
		assertThat(graph.getWarnings().get(1).getLineNumber(), is(2));
		assertThat(graph.getWarnings().get(1).getIssue(), instanceOf(GrammarIssue.class));
		assertThat(graph.numberOfNodes(), is(2));
	}

	@Test
	public void testAnnotationValuesWithSeparatorsStayDistinct() {
		BelcOptions options = new BelcOptions();
		options.completeOrigin = false;
		BelCompiler compiler = new BelCompiler(options, VocabularyFixtures.permissive());
		BelGraph graph = compiler.compile(String.join("\n",
				"DEFINE ANNOTATION A AS LIST {\"x|y\", \"x\", \"y\"}",
				"SET Citation = {\"PubMed\", \"1\"}",
				"SET Evidence = \"text\"",
				"SET A = \"x|y\"",
				"p(HGNC:AKT1) -> p(HGNC:TP53)",
				"SET A = {\"x\", \"y\"}",
				"p(HGNC:AKT1) -> p(HGNC:TP53)"));
		assertThat(graph.getWarnings().toString(), graph.getWarnings().size(), is(0));
		assertThat(edges(graph, BelRelation.INCREASES).size(), is(2));
	}

	@Test
	public void testContextDoesNotLeakBetweenDocuments() {
		BelCompiler compiler = new BelCompiler(new BelcOptions(), VocabularyFixtures.permissive());
		compiler.compile(String.join("\n", "SET Citation = {\"PubMed\", \"1\"}", "SET Evidence = \"text\""));
		BelGraph second = compiler.compile("p(HGNC:AKT1) -> p(HGNC:TP53)");
		assertThat(second.getWarnings().get(0).getIssue(), instanceOf(MissingCitationIssue.class));
		assertThat(second.numberOfEdges(), is(0));
	}

	@Test
	public void testDocumentDefinitionsWithoutVocabulary() {
		BelCompiler compiler = new BelCompiler(VocabularyFixtures.lenientOptions(), null);
		BelGraph graph = compiler.compile(String.join("\n",
				"DEFINE NAMESPACE HGNC AS PATTERN \"[A-Z0-9]+\"",
				"p(HGNC:AKT1) -> p(HGNC:TP53)",
				"p(HGNC:akt1)"));
		assertThat(graph.getWarnings().size(), is(1));
		assertThat(graph.getWarnings().get(0).getIssue(), instanceOf(MissingNamespaceNameIssue.class));
		// two proteins, with their RNAs and genes
		assertThat(graph.numberOfNodes(), is(6));
	}

	@Test
	public void testCompileFromStream() throws IOException {
		BelCompiler compiler = new BelCompiler(VocabularyFixtures.lenientOptions(), VocabularyFixtures.permissive());
		BelGraph graph = compiler.compile(new ByteArrayInputStream(
				"a(CHEBI:water)\r\na(CHEBI:oxygen)\r\n".getBytes(StandardCharsets.UTF_8)));
		assertThat(graph.numberOfNodes(), is(2));
	}

	@Test(expected = BelcOptionException.class)
	public void testMissingVocabulary() throws BelcOptionException {
		BelcOptions options = new BelcOptions();
		options.vocabularyPath = "does/not/exist.json";
		BelCompiler.fromOptions(options);
	}
}
