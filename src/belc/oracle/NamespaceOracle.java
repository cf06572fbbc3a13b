package belc.oracle;

import java.util.Set;

/**
 * Answers which namespaces and annotations exist and what they contain. Lookups may block and may fail; a failure
 * is an {@link OracleException}, never a negative answer.
 */
public interface NamespaceOracle {

	boolean isNamespaceDefined(String namespace) throws OracleException;

	/**
	 * @return whether {@param name} belongs to {@param namespace}; false if the namespace is not defined
	 */
	boolean isMember(String namespace, String name) throws OracleException;

	boolean isAnnotationDefined(String keyword) throws OracleException;

	/**
	 * @return the enumerated values of the annotation, or an empty set if it is undefined or not enumerated
	 */
	Set<String> annotationValues(String keyword) throws OracleException;

	default boolean isAnnotationValue(String keyword, String value) throws OracleException {
		return annotationValues(keyword).contains(value);
	}
}
