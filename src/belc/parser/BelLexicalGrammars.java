package belc.parser;

import belc.model.term.IdentifierToken;
import belc.util.SourceLocatable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.regex.Pattern;

import static belc.parser.ParseTools.*;

/**
 * The lexical building blocks shared by all BEL grammars. Every grammar returned here skips the whitespace in front
 * of what it matches, and locates its result at the matched text only.
 */
public final class BelLexicalGrammars {

	private BelLexicalGrammars() {}

	static final Pattern QUOTED_STRING = Pattern.compile("\"((?:[^\"\\\\]|\\\\.)*)\"");
	static final Pattern NAMESPACE = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");
	static final Pattern UNQUOTED_NAME = Pattern.compile("[^\\s,():\"{}]+");
	static final Pattern INTEGER = Pattern.compile("[0-9]+");
	static final Pattern WORD_CHARACTER = Pattern.compile("[A-Za-z0-9_]");

	/**
	 * @return {@param grammar}, preceded by optional whitespace
	 */
	public static <T extends SourceLocatable> Grammar<T> ws(Grammar<T> grammar) {
		return emptySequence()
				.drop(skipWhitespace())
				.part(grammar)
				.map(seq -> seq.getValue().getFirst());
	}

	public static Grammar<Located<Void>> token(String token) {
		return ws(matchString(token));
	}

	/**
	 * Matches one of {@param keywords} as a whole word.
	 */
	public static Grammar<Located<String>> keyword(Collection<String> keywords) {
		return ws(emptySequence()
				.part(matchStringOneOf(keywords))
				.drop(reject(matchPattern(WORD_CHARACTER)))
				.map(seq -> seq.getValue().getFirst()));
	}

	/**
	 * Matches the start of a function call: one of {@param keywords} followed by an opening parenthesis.
	 * @return a grammar yielding the keyword as written
	 */
	public static Grammar<Located<String>> functionOpen(Collection<String> keywords) {
		return emptySequence()
				.part(keyword(keywords))
				.drop(token("("))
				.map(seq -> seq.getValue().getFirst());
	}

	public static String unescape(String quoted) {
		StringBuilder builder = new StringBuilder(quoted.length());
		for(int i = 0; i < quoted.length(); i++) {
			char c = quoted.charAt(i);
			if(c == '\\' && i + 1 < quoted.length()) {
				char next = quoted.charAt(i + 1);
				if(next == '"' || next == '\\') {
					builder.append(next);
					i++;
					continue;
				}
			}
			builder.append(c);
		}
		return builder.toString();
	}

	/**
	 * @return a grammar yielding the unescaped contents of a double-quoted string
	 */
	public static Grammar<Located<String>> quotedString() {
		return ws(matchPattern(QUOTED_STRING)
				.map(m -> new Located<>(m.getLocation(), unescape(m.getValue().group(1)))));
	}

	/**
	 * A name, either quoted or a bare word.
	 */
	public static Grammar<Located<String>> name() {
		return cut(parseOneOf(
				quotedString(),
				ws(matchPatternText(UNQUOTED_NAME))));
	}

	/**
	 * A non-negative integer. Digit runs beyond {@link Integer#MAX_VALUE} do not parse.
	 */
	public static Grammar<Located<Integer>> integer() {
		return ws(matchPatternText(INTEGER)
				.filter(text -> fitsInInteger(text.getValue()))
				.map(text -> new Located<>(text.getLocation(), Integer.valueOf(text.getValue()))));
	}

	static boolean fitsInInteger(String digits) {
		String significant = digits.replaceFirst("^0+(?=.)", "");
		return significant.length() < 10 ||
				(significant.length() == 10 && Long.parseLong(significant) <= Integer.MAX_VALUE);
	}

	/**
	 * {@code NS:name}, yielding an identifier token with a namespace.
	 */
	public static Grammar<IdentifierToken> qualifiedIdentifier() {
		return ws(emptySequence()
				.part(matchPatternText(NAMESPACE))
				.drop(matchString(":"))
				.part(name())
				.map(seq -> new IdentifierToken(
						seq.getLocation(),
						seq.getValue().getRest().getFirst().getValue(),
						seq.getValue().getFirst().getValue())));
	}

	/**
	 * {@code NS:name} or, failing that, a bare name. Bare names are yielded without a namespace so that they can be
	 * rejected or accepted during resolution.
	 */
	public static Grammar<IdentifierToken> identifier() {
		return cut(ParseTools.<IdentifierToken>parseOneOf(
				qualifiedIdentifier(),
				name().map(n -> new IdentifierToken(n.getLocation(), null, n.getValue()))));
	}

	/**
	 * A brace-delimited, comma separated list of names: {@code {"a", "b", c}}.
	 */
	public static Grammar<LocatedList<Located<String>>> delimitedSet() {
		return emptySequence()
				.drop(token("{"))
				.part(parseListOf(name(), token(",")))
				.drop(token("}"))
				.map(seq -> new LocatedList<>(seq.getLocation(), new ArrayList<>(seq.getValue().getFirst().getItems())));
	}

	static List<String> values(LocatedList<Located<String>> list) {
		List<String> result = new ArrayList<>(list.size());
		for(Located<String> item : list) {
			result.add(item.getValue());
		}
		return result;
	}
}
