package belc.parser;

import belc.util.SourceLocatable;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * A strategy for parsing BEL text into an object of type Result.
 *
 * <p>Grammars are immutable once built, so the grammars of {@link BelTermParser} and friends are constructed once
 * in static initializers and shared freely between threads. All mutable parsing state lives in the
 * {@link LexicalContext} and in the execution visitor created by each call to {@link #parse(LexicalContext)}.</p>
 * @param <Result> the type of an object representing a successful parse
 */
public abstract class Grammar<Result extends SourceLocatable> {

	/**
	 * @param mapping a mapping from the actual parse result to an adjusted parse result
	 * @param <MappingResult> the result type of the new grammar
	 * @return a grammar yielding {@param mapping} applied to every result of this grammar
	 */
	public <MappingResult extends SourceLocatable> Grammar<MappingResult> map(Function<Result, MappingResult> mapping){
		return new MappingGrammar<>(this, mapping);
	}

	/**
	 * @param predicate the predicate to test
	 * @return a grammar yielding only those results of this grammar that satisfy {@param predicate}
	 */
	public Grammar<Result> filter(Predicate<Result> predicate) {
		return new PredicateGrammar<>(this, predicate);
	}

	/**
	 * Parses this grammar at the current position of {@param lexicalContext}. If several parses exist the first one
	 * is returned and the context is left just after it.
	 * @throws ParseFailureException if no valid parse exists, carrying the furthest failures encountered
	 */
	@SuppressWarnings("unchecked")
	public Result parse(LexicalContext lexicalContext) throws ParseFailureException {
		GrammarExecuteVisitor visitor = new GrammarExecuteVisitor(lexicalContext);
		GrammarExecuteVisitor.ParsingResult parsingResult = accept(visitor);
		if(parsingResult.getResults().isEmpty()) {
			throw new ParseFailureException(lexicalContext.getText(), visitor.getFailures());
		}
		GrammarExecuteVisitor.ParsingResultPair first = parsingResult.getResults().get(0);
		lexicalContext.restore(first.getMark());
		return (Result)first.getResult();
	}

	/**
	 * @return every valid interpretation of the text at the current position of {@param lexicalContext}, possibly
	 * none
	 */
	@SuppressWarnings("unchecked")
	public List<Result> enumerate(LexicalContext lexicalContext) {
		GrammarExecuteVisitor visitor = new GrammarExecuteVisitor(lexicalContext);
		GrammarExecuteVisitor.ParsingResult parsingResult = accept(visitor);
		return parsingResult.getResults().stream().map(p -> (Result)p.getResult()).collect(Collectors.toList());
	}

	public abstract <GrammarResult, Except extends Throwable> GrammarResult accept(GrammarVisitor<GrammarResult, Except> visitor) throws Except;
}
