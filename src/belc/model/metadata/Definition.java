package belc.model.metadata;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A {@code DEFINE NAMESPACE} or {@code DEFINE ANNOTATION} line: a keyword bound to a URL, a regular expression or
 * an inline list of values.
 */
public final class Definition {

	public enum Kind {
		URL,
		PATTERN,
		LIST
	}

	private final String keyword;
	private final Kind kind;
	private final String value;
	private final List<String> values;

	private Definition(String keyword, Kind kind, String value, List<String> values) {
		this.keyword = keyword;
		this.kind = kind;
		this.value = value;
		this.values = values;
	}

	public static Definition url(String keyword, String url) {
		return new Definition(keyword, Kind.URL, url, ImmutableList.of());
	}

	public static Definition pattern(String keyword, String pattern) {
		return new Definition(keyword, Kind.PATTERN, pattern, ImmutableList.of());
	}

	public static Definition list(String keyword, List<String> values) {
		return new Definition(keyword, Kind.LIST, null, ImmutableList.copyOf(values));
	}

	public String getKeyword() {
		return keyword;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the URL or pattern; null for list definitions
	 */
	public String getValue() {
		return value;
	}

	public List<String> getValues() {
		return values;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Definition that = (Definition) o;
		return keyword.equals(that.keyword) && kind == that.kind && Objects.equals(value, that.value) &&
				values.equals(that.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(keyword, kind, value, values);
	}
}
