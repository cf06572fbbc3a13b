package belc.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * A persistent singly-linked list, used to accumulate repetitions without copying during backtracking.
 */
final class ConsList<T> {

	private final T head;
	private final ConsList<T> tail;

	ConsList() {
		this.head = null;
		this.tail = null;
	}

	private ConsList(T head, ConsList<T> tail) {
		this.head = head;
		this.tail = tail;
	}

	ConsList<T> cons(T value) {
		return new ConsList<>(value, this);
	}

	List<T> toList() {
		List<T> result = new ArrayList<>();
		for(ConsList<T> cell = this; cell.tail != null; cell = cell.tail) {
			result.add(cell.head);
		}
		return result;
	}

	@Override
	public String toString() {
		return toList().toString();
	}
}
