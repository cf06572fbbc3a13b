package belc.model.graph;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;

/**
 * The qualification of a causal or correlative edge: citation, evidence, the annotations in effect and the
 * endpoint contexts of subject and object. Annotations are stored sorted so that equal contexts serialize equally.
 */
public final class EdgeContext {

	private final Citation citation;
	private final String evidence;
	private final SortedMap<String, Set<String>> annotations;
	private final EndpointContext subject;
	private final EndpointContext object;

	public EdgeContext(Citation citation, String evidence, Map<String, ? extends Set<String>> annotations,
	                   EndpointContext subject, EndpointContext object) {
		this.citation = citation;
		this.evidence = evidence;
		ImmutableSortedMap.Builder<String, Set<String>> builder = ImmutableSortedMap.naturalOrder();
		for(Map.Entry<String, ? extends Set<String>> entry : annotations.entrySet()) {
			builder.put(entry.getKey(), ImmutableSortedSet.copyOf(entry.getValue()));
		}
		this.annotations = builder.build();
		this.subject = subject == null ? EndpointContext.empty() : subject;
		this.object = object == null ? EndpointContext.empty() : object;
	}

	/**
	 * @return the citation, or null when citations are not required and none was set
	 */
	public Citation getCitation() {
		return citation;
	}

	/**
	 * @return the evidence text, or null when evidence is not required and none was set
	 */
	public String getEvidence() {
		return evidence;
	}

	public SortedMap<String, Set<String>> getAnnotations() {
		return annotations;
	}

	public EndpointContext getSubject() {
		return subject;
	}

	public EndpointContext getObject() {
		return object;
	}

	/**
	 * @return this context seen from the other end of a symmetric relation
	 */
	public EdgeContext swapped() {
		return new EdgeContext(citation, evidence, annotations, object, subject);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		EdgeContext that = (EdgeContext) o;
		return Objects.equals(citation, that.citation) && Objects.equals(evidence, that.evidence) &&
				annotations.equals(that.annotations) && subject.equals(that.subject) && object.equals(that.object);
	}

	@Override
	public int hashCode() {
		return Objects.hash(citation, evidence, annotations, subject, object);
	}
}
