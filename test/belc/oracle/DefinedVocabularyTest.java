package belc.oracle;

import belc.VocabularyFixtures;
import belc.model.metadata.Definition;
import belc.model.metadata.DocumentMetadata;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class DefinedVocabularyTest {

	private DocumentMetadata metadata;

	@Before
	public void setUp() {
		metadata = new DocumentMetadata();
		metadata.defineNamespace(Definition.url("HGNC", "http://example.org/hgnc.belns"));
		metadata.defineNamespace(Definition.pattern("dbSNP", "rs[0-9]+"));
		metadata.defineAnnotation(Definition.list("CellLine", Arrays.asList("HeLa", "MCF 7")));
		metadata.defineAnnotation(Definition.pattern("Confidence", "High|Low"));
		metadata.defineAnnotation(Definition.url("Species", "http://example.org/species.belanno"));
	}

	@Test
	public void testLocalDefinitions() throws OracleException {
		DefinedVocabulary vocabulary = new DefinedVocabulary(metadata, null);
		assertTrue(vocabulary.isNamespaceDefined("dbSNP"));
		assertTrue(vocabulary.isMember("dbSNP", "rs123"));
		assertFalse(vocabulary.isMember("dbSNP", "123"));
		assertTrue(vocabulary.isAnnotationValue("CellLine", "MCF 7"));
		assertFalse(vocabulary.isAnnotationValue("CellLine", "HEK293"));
		assertThat(vocabulary.annotationValues("CellLine"), is(new HashSet<>(Arrays.asList("HeLa", "MCF 7"))));
		assertTrue(vocabulary.isAnnotationValue("Confidence", "Low"));
		assertThat(vocabulary.annotationValues("Confidence"), is(Collections.<String>emptySet()));
	}

	@Test
	public void testUrlDefinitionsUseFallback() throws OracleException {
		DefinedVocabulary vocabulary = new DefinedVocabulary(metadata, VocabularyFixtures.permissive());
		assertTrue(vocabulary.isMember("HGNC", "AKT1"));
		assertTrue(vocabulary.isAnnotationValue("Species", "9606"));
		assertFalse(vocabulary.isAnnotationValue("Species", "7227"));
	}

	@Test
	public void testUndefinedKeywordsUseFallback() throws OracleException {
		DefinedVocabulary vocabulary = new DefinedVocabulary(metadata, VocabularyFixtures.permissive());
		assertTrue(vocabulary.isNamespaceDefined("CHEBI"));
		assertTrue(vocabulary.isMember("CHEBI", "water"));
		assertFalse(vocabulary.isNamespaceDefined("UNIPROT"));

		DefinedVocabulary standalone = new DefinedVocabulary(metadata, null);
		assertFalse(standalone.isNamespaceDefined("CHEBI"));
		assertFalse(standalone.isMember("CHEBI", "water"));
	}

	@Test(expected = OracleException.class)
	public void testUrlDefinitionWithoutFallback() throws OracleException {
		new DefinedVocabulary(metadata, null).isMember("HGNC", "AKT1");
	}

	@Test
	public void testLocalDefinitionShadowsFallback() throws OracleException {
		metadata.defineNamespace(Definition.pattern("CHEBI", "[0-9]+"));
		DefinedVocabulary vocabulary = new DefinedVocabulary(metadata, VocabularyFixtures.permissive());
		assertFalse(vocabulary.isMember("CHEBI", "water"));
		assertTrue(vocabulary.isMember("CHEBI", "15377"));
	}
}
