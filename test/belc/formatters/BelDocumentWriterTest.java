package belc.formatters;

import belc.BelCompiler;
import belc.BelcOptions;
import belc.VocabularyFixtures;
import belc.model.BelFunction;
import belc.model.BelRelation;
import belc.model.graph.*;
import belc.model.metadata.Definition;
import org.junit.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class BelDocumentWriterTest {

	private static File resource(String name) throws URISyntaxException {
		return new File(BelDocumentWriterTest.class.getResource("/belc/" + name).toURI());
	}

	private static SimpleNode protein(String name) {
		return new SimpleNode(BelFunction.PROTEIN, new Concept("HGNC", name));
	}

	private static Set<String> edgeKeys(BelGraph graph) {
		return graph.edges().stream().map(BelEdge::getKey).collect(Collectors.toSet());
	}

	private static void assertSameGraph(BelGraph expected, BelGraph actual) {
		assertThat(new HashSet<>(actual.nodes()), is(new HashSet<>(expected.nodes())));
		assertThat(edgeKeys(actual), is(edgeKeys(expected)));
	}

	@Test
	public void testSampleRoundTrip() throws Exception {
		BelCompiler compiler = BelCompiler.fromOptions(BelcOptions.read(resource("options.json")));
		BelGraph graph = compiler.compileFile(resource("sample.bel"));
		String written = BelDocumentWriter.toBel(graph);

		BelGraph recompiled = compiler.compile(written);
		assertThat(written, recompiled.getWarnings().size(), is(0));
		assertSameGraph(graph, recompiled);
		assertThat(recompiled.getMetadata().getProperties(), is(graph.getMetadata().getProperties()));
		assertThat(recompiled.getMetadata().getNamespaces(), is(graph.getMetadata().getNamespaces()));
		assertThat(recompiled.getMetadata().getAnnotations(), is(graph.getMetadata().getAnnotations()));
	}

	@Test
	public void testSampleNeedsNoFooter() throws Exception {
		BelCompiler compiler = BelCompiler.fromOptions(BelcOptions.read(resource("options.json")));
		String written = BelDocumentWriter.toBel(compiler.compileFile(resource("sample.bel")));
		assertThat(written, not(containsString(BelDocumentWriter.GENERATED_CITATION_REFERENCE)));
	}

	@Test
	public void testExactOutput() {
		BelGraph graph = new BelGraph();
		graph.getMetadata().setProperty("Name", "x");
		graph.getMetadata().defineNamespace(Definition.url("HGNC", "u"));
		EdgeContext context = new EdgeContext(new Citation("PubMed", "1"), "text",
				Collections.singletonMap("Species", Collections.singleton("9606")),
				EndpointContext.empty(), EndpointContext.empty());
		graph.addEdge(new BelEdge(protein("AKT1"), BelRelation.INCREASES, protein("TP53"), context, false));

		assertThat(BelDocumentWriter.toBel(graph), is(
				"SET DOCUMENT Name = \"x\"\n" +
				"\n" +
				"DEFINE NAMESPACE HGNC AS URL \"u\"\n" +
				"\n" +
				"SET Citation = {\"PubMed\", \"1\"}\n" +
				"SET SupportingText = \"text\"\n" +
				"SET Species = \"9606\"\n" +
				"p(HGNC:AKT1) increases p(HGNC:TP53)\n" +
				"UNSET Species\n" +
				"UNSET SupportingText\n" +
				"UNSET Citation\n" +
				"\n"));
	}

	@Test
	public void testReverseEdgesAreSkipped() {
		BelcOptions options = VocabularyFixtures.lenientOptions();
		options.completeOrigin = false;
		BelCompiler compiler = new BelCompiler(options, VocabularyFixtures.permissive());
		BelGraph graph = compiler.compile(
				"SET Citation = {\"PubMed\", \"1\"}\n" +
				"SET SupportingText = \"text\"\n" +
				"p(HGNC:AKT1) association p(HGNC:TP53)\n");
		assertThat(graph.numberOfEdges(), is(2));

		String written = BelDocumentWriter.toBel(graph);
		assertThat(written, containsString("p(HGNC:AKT1) association p(HGNC:TP53)"));
		assertThat(written, not(containsString("p(HGNC:TP53) association p(HGNC:AKT1)")));
		assertSameGraph(graph, compiler.compile(written));
	}

	@Test
	public void testFooter() {
		BelCompiler compiler = new BelCompiler(VocabularyFixtures.lenientOptions(), VocabularyFixtures.permissive());
		BelGraph graph = compiler.compile("p(HGNC:AKT1)\na(CHEBI:water)\n");
		assertThat(graph.numberOfNodes(), is(4));

		String written = BelDocumentWriter.toBel(graph);
		assertThat(written, containsString("SET Citation = {\"Other\", \"Added by belc\"}\n"));
		assertThat(written, containsString(
				"a(CHEBI:water)\n" +
				"g(HGNC:AKT1) transcribedTo r(HGNC:AKT1)\n" +
				"r(HGNC:AKT1) translatedTo p(HGNC:AKT1)\n"));

		BelGraph recompiled = compiler.compile(written);
		assertThat(written, recompiled.getWarnings().size(), is(0));
		assertSameGraph(graph, recompiled);
	}

	@Test
	public void testShortCitationFields() {
		assertThat(BelDocumentWriter.citationFields(new Citation("PubMed", "1")), is(Arrays.asList("PubMed", "1")));
	}

	@Test
	public void testFullCitationFieldsAreTrimmed() {
		Citation named = new Citation("PubMed", "1", "Title", null, Collections.emptyList(), null);
		assertThat(BelDocumentWriter.citationFields(named), is(Arrays.asList("PubMed", "Title", "1")));

		Citation withAuthors = new Citation("Book", "isbn", null, null, Arrays.asList("Smith J", "Doe A"), null);
		assertThat(BelDocumentWriter.citationFields(withAuthors),
				is(Arrays.asList("Book", "", "isbn", "", "Smith J|Doe A")));
	}

	@Test
	public void testImpliedByStructure() {
		SimpleNode akt1 = protein("AKT1");
		SimpleNode tp53 = protein("TP53");
		VariantNode variant = new VariantNode(BelFunction.PROTEIN, new Concept("HGNC", "AKT1"),
				Collections.singletonList(new ProteinModification(new Concept("bel", "Ph"), "Ser", 473)));
		ListNode complex = new ListNode(BelFunction.COMPLEX, Arrays.asList(akt1, tp53));

		assertTrue(BelDocumentWriter.isImpliedByStructure(BelEdge.unqualified(akt1, BelRelation.HAS_VARIANT, variant)));
		assertTrue(BelDocumentWriter.isImpliedByStructure(
				BelEdge.unqualified(complex, BelRelation.HAS_COMPONENT, tp53)));
		assertFalse(BelDocumentWriter.isImpliedByStructure(
				BelEdge.unqualified(complex, BelRelation.HAS_COMPONENT, protein("EGFR"))));
		assertFalse(BelDocumentWriter.isImpliedByStructure(BelEdge.unqualified(tp53, BelRelation.HAS_VARIANT, variant)));
		assertFalse(BelDocumentWriter.isImpliedByStructure(BelEdge.unqualified(akt1, BelRelation.IS_A, tp53)));
	}
}
