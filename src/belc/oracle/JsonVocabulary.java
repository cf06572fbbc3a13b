package belc.oracle;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A vocabulary read from a JSON document of the form
 * <pre>
 * {
 *   "namespaces": {"HGNC": ["AKT1", "CD33"], "CHEBI": {"pattern": ".+"}},
 *   "annotations": {"Species": ["9606", "10090"], "Confidence": {"pattern": "High|Low"}}
 * }
 * </pre>
 * Each keyword maps either to the list of its names or to an object holding a regular expression that all names
 * must match.
 */
public class JsonVocabulary implements NamespaceOracle {

	private final Vocabulary namespaces;
	private final Vocabulary annotations;

	private static final class Vocabulary {
		private final ImmutableMap<String, Set<String>> enumerated;
		private final ImmutableMap<String, Pattern> patterns;

		Vocabulary(JSONObject object, String section) {
			ImmutableMap.Builder<String, Set<String>> enumeratedBuilder = ImmutableMap.builder();
			ImmutableMap.Builder<String, Pattern> patternBuilder = ImmutableMap.builder();
			if(object != null) {
				for(String keyword : object.keySet()) {
					Object value = object.get(keyword);
					if(value instanceof JSONArray) {
						ImmutableSet.Builder<String> names = ImmutableSet.builder();
						JSONArray array = (JSONArray) value;
						for(int i = 0; i < array.length(); i++) {
							names.add(array.getString(i));
						}
						enumeratedBuilder.put(keyword, names.build());
					} else if(value instanceof JSONObject && ((JSONObject) value).has("pattern")) {
						String regex = ((JSONObject) value).getString("pattern");
						try {
							patternBuilder.put(keyword, Pattern.compile(regex));
						} catch (PatternSyntaxException e) {
							throw new JSONException("invalid pattern for " + section + " " + keyword + ": " + regex, e);
						}
					} else {
						throw new JSONException(section + " " + keyword + " must be a list of names or {\"pattern\": ...}");
					}
				}
			}
			this.enumerated = enumeratedBuilder.build();
			this.patterns = patternBuilder.build();
		}

		boolean isDefined(String keyword) {
			return enumerated.containsKey(keyword) || patterns.containsKey(keyword);
		}

		boolean contains(String keyword, String name) {
			if(enumerated.containsKey(keyword)) {
				return enumerated.get(keyword).contains(name);
			}
			Pattern pattern = patterns.get(keyword);
			return pattern != null && pattern.matcher(name).matches();
		}

		Set<String> values(String keyword) {
			return enumerated.getOrDefault(keyword, Collections.emptySet());
		}
	}

	public JsonVocabulary(JSONObject object) {
		this.namespaces = new Vocabulary(object.optJSONObject("namespaces"), "namespace");
		this.annotations = new Vocabulary(object.optJSONObject("annotations"), "annotation");
	}

	public static JsonVocabulary fromStream(InputStream in) throws IOException {
		try {
			return new JsonVocabulary(new JSONObject(IOUtils.toString(in, StandardCharsets.UTF_8)));
		} catch (JSONException e) {
			throw new IOException("malformed vocabulary: " + e.getMessage(), e);
		}
	}

	public static JsonVocabulary fromFile(Path path) throws IOException {
		try (InputStream in = Files.newInputStream(path)) {
			return fromStream(in);
		}
	}

	@Override
	public boolean isNamespaceDefined(String namespace) {
		return namespaces.isDefined(namespace);
	}

	@Override
	public boolean isMember(String namespace, String name) {
		return namespaces.contains(namespace, name);
	}

	@Override
	public boolean isAnnotationDefined(String keyword) {
		return annotations.isDefined(keyword);
	}

	@Override
	public Set<String> annotationValues(String keyword) {
		return annotations.values(keyword);
	}

	@Override
	public boolean isAnnotationValue(String keyword, String value) {
		return annotations.contains(keyword, value);
	}
}
