package belc.model.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The header of a BEL document: {@code SET DOCUMENT} properties and the namespace and annotation definitions.
 */
public class DocumentMetadata {

	public static final String NAME = "Name";
	public static final String VERSION = "Version";

	private final Map<String, String> properties = new LinkedHashMap<>();
	private final Map<String, Definition> namespaces = new LinkedHashMap<>();
	private final Map<String, Definition> annotations = new LinkedHashMap<>();

	/**
	 * @return the previous value, or null
	 */
	public String setProperty(String key, String value) {
		return properties.put(key, value);
	}

	public String getProperty(String key) {
		return properties.get(key);
	}

	public Map<String, String> getProperties() {
		return Collections.unmodifiableMap(properties);
	}

	/**
	 * @return the definition this one replaced, or null
	 */
	public Definition defineNamespace(Definition definition) {
		return namespaces.put(definition.getKeyword(), definition);
	}

	public Definition defineAnnotation(Definition definition) {
		return annotations.put(definition.getKeyword(), definition);
	}

	public Map<String, Definition> getNamespaces() {
		return Collections.unmodifiableMap(namespaces);
	}

	public Map<String, Definition> getAnnotations() {
		return Collections.unmodifiableMap(annotations);
	}

	public void mergeFrom(DocumentMetadata other) {
		other.properties.forEach(properties::putIfAbsent);
		other.namespaces.forEach(namespaces::putIfAbsent);
		other.annotations.forEach(annotations::putIfAbsent);
	}
}
