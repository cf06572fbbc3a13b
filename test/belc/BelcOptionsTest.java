package belc;

import org.apache.commons.io.FileUtils;
import org.json.JSONObject;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class BelcOptionsTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testDefaults() throws BelcOptionException {
		BelcOptions options = BelcOptions.parse("{}");
		assertTrue(options.completeOrigin);
		assertFalse(options.allowNakedNames);
		assertTrue(options.requireCitation);
		assertTrue(options.requireEvidence);
		assertFalse(options.stopOnError);
		assertThat(options.vocabularyPath, nullValue());
	}

	@Test
	public void testAllFields() throws BelcOptionException {
		BelcOptions options = BelcOptions.parse("{\"complete_origin\": false, \"allow_naked_names\": true, " +
				"\"require_citation\": false, \"require_evidence\": false, \"stop_on_error\": true, " +
				"\"vocabulary\": \"/data/vocabulary.json\"}");
		assertFalse(options.completeOrigin);
		assertTrue(options.allowNakedNames);
		assertFalse(options.requireCitation);
		assertFalse(options.requireEvidence);
		assertTrue(options.stopOnError);
		assertThat(options.vocabularyPath, is(new File("/data/vocabulary.json").getPath()));
	}

	@Test
	public void testRelativeVocabularyPath() throws BelcOptionException {
		File base = new File("configs");
		BelcOptions options = BelcOptions.fromJSON(new JSONObject("{\"vocabulary\": \"v.json\"}"), base);
		assertThat(options.vocabularyPath, is(new File(base, "v.json").getPath()));
	}

	@Test
	public void testReadResolvesAgainstConfigDirectory() throws IOException, BelcOptionException {
		File config = folder.newFile("belc.json");
		FileUtils.writeStringToFile(config, "{\"vocabulary\": \"vocabulary.json\"}", StandardCharsets.UTF_8);
		BelcOptions options = BelcOptions.read(config);
		assertThat(options.vocabularyPath,
				is(new File(config.getAbsoluteFile().getParentFile(), "vocabulary.json").getPath()));
	}

	@Test(expected = BelcOptionException.class)
	public void testNonBooleanFlag() throws BelcOptionException {
		BelcOptions.parse("{\"complete_origin\": \"yes\"}");
	}

	@Test(expected = BelcOptionException.class)
	public void testEmptyVocabularyPath() throws BelcOptionException {
		BelcOptions.parse("{\"vocabulary\": \"\"}");
	}

	@Test(expected = BelcOptionException.class)
	public void testVocabularyPathMustBeAString() throws BelcOptionException {
		BelcOptions.parse("{\"vocabulary\": 3}");
	}

	@Test(expected = BelcOptionException.class)
	public void testMalformedJson() throws BelcOptionException {
		BelcOptions.parse("{\"complete_origin\": ");
	}

	@Test(expected = BelcOptionException.class)
	public void testMissingFile() throws BelcOptionException {
		BelcOptions.read(new File(folder.getRoot(), "missing.json"));
	}
}
