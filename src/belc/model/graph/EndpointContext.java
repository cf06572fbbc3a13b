package belc.model.graph;

import java.util.Objects;

/**
 * What was said about one end of an edge beyond the node itself: a modifier, a cellular location, or both.
 */
public final class EndpointContext {

	private static final EndpointContext EMPTY = new EndpointContext(null, null);

	private final Modifier modifier;
	private final Concept location;

	public EndpointContext(Modifier modifier, Concept location) {
		this.modifier = modifier;
		this.location = location;
	}

	public static EndpointContext empty() {
		return EMPTY;
	}

	public Modifier getModifier() {
		return modifier;
	}

	public Concept getLocation() {
		return location;
	}

	public boolean isEmpty() {
		return modifier == null && location == null;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		EndpointContext that = (EndpointContext) o;
		return Objects.equals(modifier, that.modifier) && Objects.equals(location, that.location);
	}

	@Override
	public int hashCode() {
		return Objects.hash(modifier, location);
	}
}
