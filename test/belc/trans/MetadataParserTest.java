package belc.trans;

import belc.errors.TopLevelIssueContext;
import belc.model.metadata.Definition;
import belc.model.metadata.DocumentMetadata;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.LinkedHashSet;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class MetadataParserTest {

	private MetadataParser parser;
	private TopLevelIssueContext ctx;

	@Before
	public void setUp() {
		parser = new MetadataParser(new DocumentMetadata());
		ctx = new TopLevelIssueContext();
	}

	private void lines(String... lines) {
		int lineNumber = 0;
		for(String line : lines) {
			parser.processLine(ctx, ++lineNumber, line);
		}
	}

	@Test
	public void testDocumentAndDefinitions() {
		lines(
				"SET DOCUMENT Name = \"Sample\"",
				"SET DOCUMENT Version = \"1.0\"",
				"DEFINE NAMESPACE HGNC AS URL \"http://example.org/hgnc.belns\"",
				"DEFINE NAMESPACE dbSNP AS PATTERN \"rs[0-9]+\"",
				"DEFINE ANNOTATION CellLine AS LIST {\"HeLa\", \"MCF 7\"}");
		assertThat(ctx.getIssues().size(), is(0));
		DocumentMetadata metadata = parser.getMetadata();
		assertThat(metadata.getProperty(DocumentMetadata.NAME), is("Sample"));
		assertThat(metadata.getProperty(DocumentMetadata.VERSION), is("1.0"));
		assertThat(metadata.getNamespaces().keySet(), is(new LinkedHashSet<>(Arrays.asList("HGNC", "dbSNP"))));
		assertThat(metadata.getAnnotations().get("CellLine"), is(Definition.list("CellLine", Arrays.asList("HeLa", "MCF 7"))));
	}

	@Test
	public void testUnknownDocumentProperty() {
		lines("SET DOCUMENT Colour = \"blue\"");
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(MalformedMetadataIssue.class));
		assertTrue(parser.getMetadata().getProperties().isEmpty());
	}

	@Test
	public void testInvalidPattern() {
		lines("DEFINE NAMESPACE Broken AS PATTERN \"[a-z\"");
		assertThat(ctx.getIssues().get(0), instanceOf(MalformedMetadataIssue.class));
		assertFalse(parser.getMetadata().getNamespaces().containsKey("Broken"));
	}

	@Test
	public void testRedefinition() {
		lines(
				"DEFINE ANNOTATION Species AS URL \"http://example.org/species.belanno\"",
				"DEFINE ANNOTATION Species AS LIST {\"9606\"}");
		assertThat(ctx.getIssues().size(), is(1));
		assertThat(ctx.getIssues().get(0), instanceOf(RedefinedKeywordIssue.class));
		assertThat(parser.getMetadata().getAnnotations().get("Species").getKind(), is(Definition.Kind.LIST));
	}

	@Test
	public void testGrammarFailure() {
		lines("DEFINE NAMESPACE HGNC URL \"x\"");
		assertThat(ctx.getIssues().get(0), instanceOf(GrammarIssue.class));
		assertTrue(ctx.hasErrors());
	}
}
