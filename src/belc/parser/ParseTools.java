package belc.parser;

import belc.util.SourceLocatable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * The general vocabulary of grammar combinators that the BEL grammars are written in.
 */
public final class ParseTools {

	private ParseTools() {}

	public static final Pattern WHITESPACE = Pattern.compile("\\s+");
	public static final Pattern OPTIONAL_WHITESPACE = Pattern.compile("\\s*");

	/**
	 * @return a grammar matching exactly {@param token}, yielding Void located at the matched text
	 */
	public static Grammar<Located<Void>> matchString(String token){
		return new TerminalGrammar.Literal(token);
	}

	/**
	 * Matches any one of {@param options}. Options are tried longest first so that a string which is a prefix of
	 * another (like {@code "-"} and {@code "->"}) cannot shadow it.
	 * @return a grammar yielding which option matched
	 */
	public static Grammar<Located<String>> matchStringOneOf(Collection<String> options){
		List<String> longestFirst = new ArrayList<>(options);
		longestFirst.sort(Comparator.comparingInt(String::length).reversed());
		return cut(parseOneOf(longestFirst
				.stream()
				.map(option -> matchString(option).map(v -> new Located<>(v.getLocation(), option)))
				.collect(Collectors.toList())));
	}

	/**
	 * Matches {@param pattern} at the current position, in the sense of {@link java.util.regex.Matcher#lookingAt()}.
	 */
	public static Grammar<Located<MatchResult>> matchPattern(Pattern pattern){
		return new TerminalGrammar.Regex(pattern);
	}

	/**
	 * @return a grammar yielding the text matched by {@param pattern}
	 */
	public static Grammar<Located<String>> matchPatternText(Pattern pattern){
		return matchPattern(pattern).map(m -> new Located<>(m.getLocation(), m.getValue().group()));
	}

	public static Grammar<Located<Void>> matchWhitespace(){
		return matchPattern(WHITESPACE).map(res -> new Located<>(res.getLocation(), null));
	}

	public static Grammar<Located<Void>> skipWhitespace(){
		return matchPattern(OPTIONAL_WHITESPACE).map(res -> new Located<>(res.getLocation(), null));
	}

	/**
	 * Yields every successful parse of each grammar in {@param options}, in order.
	 */
	public static <Result extends SourceLocatable> Grammar<Result> parseOneOf(
			List<Grammar<? extends Result>> options){
		return new BranchGrammar<>(options);
	}

	@SafeVarargs
	public static <Result extends SourceLocatable> Grammar<Result> parseOneOf(
			Grammar<? extends Result>... options){
		return parseOneOf(Arrays.asList(options));
	}

	/**
	 * Parses any number of repetitions of {@param element}, yielding all possible repetition counts from longest to
	 * shortest. Wrap the result in {@link #cut(Grammar)} when only the longest is wanted.
	 */
	public static <Result extends SourceLocatable> Grammar<LocatedList<Result>> repeat(Grammar<Result> element){
		Objects.requireNonNull(element);
		ReferenceGrammar<Located<ConsList<Result>>> recur = new ReferenceGrammar<>();
		recur.setReferencedGrammar(parseOneOf(
				emptySequence()
						.part(element)
						.part(recur)
						.map(seq -> new Located<>(
								seq.getLocation(),
								seq.getValue().getFirst().getValue().cons(seq.getValue().getRest().getFirst()))),
				nop().map(v -> new Located<>(v.getLocation(), new ConsList<>()))));
		return recur.map(seq -> new LocatedList<>(seq.getLocation(), seq.getValue().toList()));
	}

	/**
	 * The same as {@link #repeat(Grammar)}, but requiring at least one element.
	 */
	public static <Result extends SourceLocatable> Grammar<LocatedList<Result>> repeatOneOrMore(Grammar<Result> element){
		return repeat(element).filter(list -> list.size() > 0);
	}

	/**
	 * Asks the engine to remember the results of {@param grammar} per position, so that a prefix shared by several
	 * branches is parsed once. The same grammar object must be used each time.
	 */
	public static <Result extends SourceLocatable> Grammar<Result> memoize(Grammar<Result> grammar) {
		return new RestrictedGrammar.Memoize<>(grammar);
	}

	/**
	 * The start of every sequence; see {@link AbstractSequenceGrammar}.
	 */
	public static EmptySequenceGrammar emptySequence() { return new EmptySequenceGrammar(); }

	/**
	 * Succeeds, consuming nothing, only if {@param grammar} cannot be parsed at the current position.
	 */
	public static <Result extends SourceLocatable> Grammar<Located<Void>> reject(Grammar<Result> grammar){
		return new RejectGrammar<>(grammar);
	}

	/**
	 * Restricts {@param grammar} to its first parse, if any.
	 */
	public static <Result extends SourceLocatable> Grammar<Result> cut(Grammar<Result> grammar) {
		return new RestrictedGrammar.Cut<>(grammar);
	}

	/**
	 * @return a grammar that always succeeds without consuming input
	 */
	public static Grammar<Located<Void>> nop() {
		return matchString("");
	}

	public static Grammar<Located<Void>> matchEOF() {
		return new TerminalGrammar.EndOfLine();
	}

	/**
	 * Parses {@param grammar} followed by optional trailing whitespace and the end of the line.
	 * @throws ParseFailureException if no parse covers the whole text
	 */
	public static <T extends SourceLocatable> T readOrExcept(LexicalContext ctx, Grammar<T> grammar) throws ParseFailureException {
		Grammar<T> withEOF = emptySequence()
				.part(grammar)
				.drop(skipWhitespace())
				.drop(matchEOF())
				.map(seq -> seq.getValue().getFirst());
		return withEOF.parse(ctx);
	}

	/**
	 * Parses one or more {@param element}s separated by {@param sep}, yielding them in order. The separators'
	 * values are ignored.
	 */
	public static <AST extends SourceLocatable> Grammar<LocatedList<AST>> parseListOf(
			Grammar<AST> element, Grammar<? extends SourceLocatable> sep){
		return emptySequence()
				.part(element)
				.part(repeat(
						emptySequence()
								.drop(sep)
								.part(element)
								.map(seq -> seq.getValue().getFirst())))
				.map(seq -> {
					List<AST> result = new ArrayList<>();
					result.add(seq.getValue().getRest().getFirst());
					result.addAll(seq.getValue().getFirst().getItems());
					return new LocatedList<>(seq.getLocation(), result);
				});
	}

}
