package belc.model.graph;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * The source a statement was taken from. Only type and reference take part in grouping statements on output, but
 * all fields take part in equality.
 */
public final class Citation {

	private final String type;
	private final String reference;
	private final String name;
	private final String date;
	private final List<String> authors;
	private final String comments;

	public Citation(String type, String reference, String name, String date, List<String> authors, String comments) {
		this.type = Objects.requireNonNull(type);
		this.reference = Objects.requireNonNull(reference);
		this.name = name;
		this.date = date;
		this.authors = authors == null ? ImmutableList.of() : ImmutableList.copyOf(authors);
		this.comments = comments;
	}

	public Citation(String type, String reference) {
		this(type, reference, null, null, null, null);
	}

	public String getType() {
		return type;
	}

	public String getReference() {
		return reference;
	}

	public String getName() {
		return name;
	}

	public String getDate() {
		return date;
	}

	public List<String> getAuthors() {
		return authors;
	}

	public String getComments() {
		return comments;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		Citation citation = (Citation) o;
		return type.equals(citation.type) && reference.equals(citation.reference) &&
				Objects.equals(name, citation.name) && Objects.equals(date, citation.date) &&
				authors.equals(citation.authors) && Objects.equals(comments, citation.comments);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, reference, name, date, authors, comments);
	}

	@Override
	public String toString() {
		return type + ":" + reference;
	}
}
