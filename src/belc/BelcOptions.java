package belc;

import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public class BelcOptions {
	public static final String VERSION = "0.1.0";

	// fields extracted from the JSON configuration file
	public static final String COMPLETE_ORIGIN_FIELD = "complete_origin";
	public static final String ALLOW_NAKED_NAMES_FIELD = "allow_naked_names";
	public static final String REQUIRE_CITATION_FIELD = "require_citation";
	public static final String REQUIRE_EVIDENCE_FIELD = "require_evidence";
	public static final String STOP_ON_ERROR_FIELD = "stop_on_error";
	public static final String VOCABULARY_FIELD = "vocabulary";

	// when set, every RNA, miRNA and protein brings its gene (and RNA) along with it
	public boolean completeOrigin = true;
	public boolean allowNakedNames = false;
	public boolean requireCitation = true;
	public boolean requireEvidence = true;
	public boolean stopOnError = false;

	// path of a JSON vocabulary; null means the document's own definitions are all there is
	public String vocabularyPath;

	public BelcOptions() {}

	/**
	 * Reads the options present in {@param config}; absent keys keep their defaults. A relative vocabulary path is
	 * resolved against {@param baseDirectory} when one is given.
	 */
	public static BelcOptions fromJSON(JSONObject config, File baseDirectory) throws BelcOptionException {
		BelcOptions options = new BelcOptions();
		try {
			checkBoolean(config, COMPLETE_ORIGIN_FIELD);
			checkBoolean(config, ALLOW_NAKED_NAMES_FIELD);
			checkBoolean(config, REQUIRE_CITATION_FIELD);
			checkBoolean(config, REQUIRE_EVIDENCE_FIELD);
			checkBoolean(config, STOP_ON_ERROR_FIELD);
			options.completeOrigin = config.optBoolean(COMPLETE_ORIGIN_FIELD, options.completeOrigin);
			options.allowNakedNames = config.optBoolean(ALLOW_NAKED_NAMES_FIELD, options.allowNakedNames);
			options.requireCitation = config.optBoolean(REQUIRE_CITATION_FIELD, options.requireCitation);
			options.requireEvidence = config.optBoolean(REQUIRE_EVIDENCE_FIELD, options.requireEvidence);
			options.stopOnError = config.optBoolean(STOP_ON_ERROR_FIELD, options.stopOnError);
			if (config.has(VOCABULARY_FIELD)) {
				String path = config.getString(VOCABULARY_FIELD);
				if (path.isEmpty()) {
					throw new BelcOptionException(VOCABULARY_FIELD + " must not be empty");
				}
				File file = new File(path);
				if (!file.isAbsolute() && baseDirectory != null) {
					file = new File(baseDirectory, path);
				}
				options.vocabularyPath = file.getPath();
			}
		} catch (JSONException e) {
			throw new BelcOptionException("invalid configuration: " + e.getMessage(), e);
		}
		return options;
	}

	// optBoolean silently defaults on values of the wrong type
	private static void checkBoolean(JSONObject config, String field) throws BelcOptionException {
		if (config.has(field) && !(config.get(field) instanceof Boolean)) {
			throw new BelcOptionException(field + " must be true or false, found " + config.get(field));
		}
	}

	public static BelcOptions parse(String json) throws BelcOptionException {
		JSONObject config;
		try {
			config = new JSONObject(json);
		} catch (JSONException e) {
			throw new BelcOptionException("parsing error: " + e.getMessage(), e);
		}
		return fromJSON(config, null);
	}

	public static BelcOptions read(File configFile) throws BelcOptionException {
		String s;
		try {
			s = FileUtils.readFileToString(configFile, StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new BelcOptionException("Error reading configuration file: " + ex.getMessage(), ex);
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
		} catch (JSONException e) {
			throw new BelcOptionException(configFile + ": parsing error: " + e.getMessage(), e);
		}
		return fromJSON(config, configFile.getAbsoluteFile().getParentFile());
	}
}
