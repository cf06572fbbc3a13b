package belc.parser;

import belc.util.SourceLocatable;
import belc.util.SourceLocation;

import java.util.Objects;

/**
 * Attaches a {@link SourceLocation} to an arbitrary value produced by a grammar.
 */
public class Located<T> extends SourceLocatable {

	private final SourceLocation location;
	private final T value;

	public Located(SourceLocation location, T value){
		this.location = location;
		this.value = value;
	}

	public T getValue(){
		return value;
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public String toString() {
		return value + " at " + location;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Located<?> located = (Located<?>) o;
		return Objects.equals(location, located.location) &&
				Objects.equals(value, located.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(location, value);
	}
}
