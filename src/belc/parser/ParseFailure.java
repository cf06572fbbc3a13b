package belc.parser;

import belc.Unreachable;

import java.util.Comparator;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One reason a grammar failed to match at some position. Failures are collected by position so that the furthest
 * ones can be reported to the user; at one position they are ordered by kind, then by what was expected, so the
 * report for a given line never changes between runs.
 */
public final class ParseFailure implements Comparable<ParseFailure> {

	public enum Kind {
		LITERAL,
		PATTERN,
		END_OF_LINE,
		REJECTED,
	}

	private static final Comparator<ParseFailure> ORDER = Comparator
			.comparing(ParseFailure::getKind)
			.thenComparing(ParseFailure::getExpectation);

	private final Kind kind;
	private final String expectation;

	private ParseFailure(Kind kind, String expectation) {
		this.kind = kind;
		this.expectation = expectation;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the literal, the pattern source or the description of the rejected grammar, depending on the kind;
	 * empty for {@link Kind#END_OF_LINE}
	 */
	public String getExpectation() {
		return expectation;
	}

	public static ParseFailure literal(String literal) {
		return new ParseFailure(Kind.LITERAL, literal);
	}

	public static ParseFailure pattern(Pattern pattern) {
		return new ParseFailure(Kind.PATTERN, pattern.pattern());
	}

	public static ParseFailure endOfLine() {
		return new ParseFailure(Kind.END_OF_LINE, "");
	}

	public static ParseFailure rejected(Grammar<?> toReject) {
		return new ParseFailure(Kind.REJECTED, toReject.toString());
	}

	@Override
	public int compareTo(ParseFailure other) {
		return ORDER.compare(this, other);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		ParseFailure that = (ParseFailure) o;
		return kind == that.kind && expectation.equals(that.expectation);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, expectation);
	}

	@Override
	public String toString() {
		switch (kind) {
			case LITERAL:
				return "expected \"" + expectation + "\"";
			case PATTERN:
				return "expected text matching " + expectation;
			case END_OF_LINE:
				return "expected end of line";
			case REJECTED:
				return "unexpected " + expectation;
			default:
				throw new Unreachable();
		}
	}
}
