package belc;

import belc.oracle.JsonVocabulary;
import belc.oracle.NamespaceOracle;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;

/**
 * Vocabularies shared by the tests.
 */
public final class VocabularyFixtures {

	private VocabularyFixtures() {}

	/**
	 * Accepts any name in HGNC, CHEBI, GO, MESH, SCOMP and SFAM; knows the annotations Species (9606 and 10090),
	 * CellLine (HeLa and "MCF 7") and Confidence (a pattern).
	 */
	public static NamespaceOracle permissive() {
		return new JsonVocabulary(new JSONObject("{" +
				"\"namespaces\": {" +
				"  \"HGNC\": {\"pattern\": \".+\"}," +
				"  \"CHEBI\": {\"pattern\": \".+\"}," +
				"  \"GO\": {\"pattern\": \".+\"}," +
				"  \"MESH\": {\"pattern\": \".+\"}," +
				"  \"SCOMP\": {\"pattern\": \".+\"}," +
				"  \"SFAM\": {\"pattern\": \".+\"}" +
				"}," +
				"\"annotations\": {" +
				"  \"Species\": [\"9606\", \"10090\"]," +
				"  \"CellLine\": [\"HeLa\", \"MCF 7\"]," +
				"  \"Confidence\": {\"pattern\": \"High|Medium|Low\"}" +
				"}}"));
	}

	/**
	 * The vocabulary of {@code test-resources/belc/vocabulary.json}.
	 */
	public static NamespaceOracle fromResource() throws IOException {
		try (InputStream in = VocabularyFixtures.class.getResourceAsStream("/belc/vocabulary.json")) {
			return JsonVocabulary.fromStream(in);
		}
	}

	public static BelcOptions lenientOptions() {
		BelcOptions options = new BelcOptions();
		options.requireCitation = false;
		options.requireEvidence = false;
		return options;
	}
}
