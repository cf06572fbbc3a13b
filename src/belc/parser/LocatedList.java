package belc.parser;

import belc.util.SourceLocatable;
import belc.util.SourceLocation;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * An unmodifiable list of parse results, located at the span covering all of them.
 */
public class LocatedList<T> extends SourceLocatable implements Iterable<T> {

	private final SourceLocation location;
	private final List<T> items;

	public LocatedList(SourceLocation location, List<T> items){
		this.location = location;
		this.items = Collections.unmodifiableList(items);
	}

	public List<T> getItems() {
		return items;
	}

	public int size() {
		return items.size();
	}

	public T get(int index) {
		return items.get(index);
	}

	@Override
	public Iterator<T> iterator() {
		return items.iterator();
	}

	@Override
	public SourceLocation getLocation() {
		return location;
	}

	@Override
	public boolean equals(Object other){
		if (this == other) return true;
		if (other == null || getClass() != other.getClass()) return false;
		return items.equals(((LocatedList<?>) other).items);
	}

	@Override
	public int hashCode(){
		return items.hashCode();
	}

	@Override
	public String toString() {
		return items + " at " + location;
	}
}
