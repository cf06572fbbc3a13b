package belc.util;

/**
 * The empty tail of every {@link HeterogenousList}.
 *
 * <p>All heterogenous lists are subtypes of this class, so a longer list may be passed where a shorter one is
 * expected.</p>
 */
public class EmptyHeterogenousList {

	public boolean isEmpty(){ return true; }

	/**
	 * @return a new list with {@param first} as the head and this list as the tail
	 */
	public <First> HeterogenousList<First, ?> cons(First first) {
		return new HeterogenousList<>(first, this);
	}
}
