package belc.oracle;

import belc.model.metadata.Definition;
import belc.model.metadata.DocumentMetadata;
import com.google.common.collect.ImmutableSet;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * The vocabulary a document defines for itself with DEFINE lines. LIST and PATTERN definitions are answered
 * locally; URL definitions, and keywords the document does not define at all, are passed on to the fallback
 * oracle, if any.
 */
public class DefinedVocabulary implements NamespaceOracle {

	private final DocumentMetadata metadata;
	private final NamespaceOracle fallback;
	private final Map<String, Pattern> compiledPatterns = new HashMap<>();

	/**
	 * @param fallback the oracle for URL definitions and undefined keywords; may be null
	 */
	public DefinedVocabulary(DocumentMetadata metadata, NamespaceOracle fallback) {
		this.metadata = metadata;
		this.fallback = fallback;
	}

	private Pattern pattern(Definition definition) throws OracleException {
		Pattern pattern = compiledPatterns.get(definition.getValue());
		if(pattern == null) {
			try {
				pattern = Pattern.compile(definition.getValue());
			} catch (PatternSyntaxException e) {
				throw new OracleException("invalid pattern for " + definition.getKeyword() + ": " + definition.getValue(), e);
			}
			compiledPatterns.put(definition.getValue(), pattern);
		}
		return pattern;
	}

	private NamespaceOracle requireFallback(String keyword) throws OracleException {
		if(fallback == null) {
			throw new OracleException("no vocabulary available to resolve " + keyword);
		}
		return fallback;
	}

	private boolean contains(Definition definition, String name) throws OracleException {
		switch (definition.getKind()) {
			case LIST:
				return definition.getValues().contains(name);
			case PATTERN:
				return pattern(definition).matcher(name).matches();
			default:
				throw new IllegalArgumentException("not a local definition: " + definition.getKind());
		}
	}

	@Override
	public boolean isNamespaceDefined(String namespace) throws OracleException {
		Definition definition = metadata.getNamespaces().get(namespace);
		if(definition != null) {
			return true;
		}
		return fallback != null && fallback.isNamespaceDefined(namespace);
	}

	@Override
	public boolean isMember(String namespace, String name) throws OracleException {
		Definition definition = metadata.getNamespaces().get(namespace);
		if(definition == null) {
			return fallback != null && fallback.isMember(namespace, name);
		}
		if(definition.getKind() == Definition.Kind.URL) {
			return requireFallback(namespace).isMember(namespace, name);
		}
		return contains(definition, name);
	}

	@Override
	public boolean isAnnotationDefined(String keyword) throws OracleException {
		if(metadata.getAnnotations().containsKey(keyword)) {
			return true;
		}
		return fallback != null && fallback.isAnnotationDefined(keyword);
	}

	@Override
	public Set<String> annotationValues(String keyword) throws OracleException {
		Definition definition = metadata.getAnnotations().get(keyword);
		if(definition == null) {
			return fallback == null ? Collections.emptySet() : fallback.annotationValues(keyword);
		}
		switch (definition.getKind()) {
			case LIST:
				return ImmutableSet.copyOf(definition.getValues());
			case URL:
				return requireFallback(keyword).annotationValues(keyword);
			default:
				return Collections.emptySet();
		}
	}

	@Override
	public boolean isAnnotationValue(String keyword, String value) throws OracleException {
		Definition definition = metadata.getAnnotations().get(keyword);
		if(definition == null) {
			return fallback != null && fallback.isAnnotationValue(keyword, value);
		}
		if(definition.getKind() == Definition.Kind.URL) {
			return requireFallback(keyword).isAnnotationValue(keyword, value);
		}
		return contains(definition, value);
	}
}
