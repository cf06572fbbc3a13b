package belc.model.graph;

import java.util.Comparator;
import java.util.Objects;

/**
 * A resolved {@code namespace:name} pair.
 */
public final class Concept implements Comparable<Concept> {

	private static final Comparator<Concept> ORDER = Comparator
			.comparing(Concept::getNamespace)
			.thenComparing(Concept::getName);

	private final String namespace;
	private final String name;

	public Concept(String namespace, String name) {
		this.namespace = Objects.requireNonNull(namespace);
		this.name = Objects.requireNonNull(name);
	}

	public String getNamespace() {
		return namespace;
	}

	public String getName() {
		return name;
	}

	@Override
	public int compareTo(Concept o) {
		return ORDER.compare(this, o);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Concept concept = (Concept) o;
		return namespace.equals(concept.namespace) && name.equals(concept.name);
	}

	@Override
	public int hashCode() {
		return Objects.hash(namespace, name);
	}

	@Override
	public String toString() {
		return namespace + ":" + name;
	}
}
