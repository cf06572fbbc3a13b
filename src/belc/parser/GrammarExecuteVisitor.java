package belc.parser;

import belc.util.EmptyHeterogenousList;
import belc.util.SourceLocatable;
import belc.util.SourceLocation;

import java.util.*;
import java.util.regex.MatchResult;

/**
 * Executes a grammar against a {@link LexicalContext} by exhaustive backtracking. Every grammar node yields the list
 * of all its successful parses, each paired with the position the parse ended at. A fresh visitor is created per
 * parse, so grammars themselves never hold parsing state.
 */
public class GrammarExecuteVisitor extends GrammarVisitor<GrammarExecuteVisitor.ParsingResult, RuntimeException> {

	static final class ParsingResultPair {
		private final LexicalContext.Mark mark;
		private final SourceLocatable result;

		ParsingResultPair(LexicalContext.Mark mark, SourceLocatable result) {
			this.mark = mark;
			this.result = result;
		}

		LexicalContext.Mark getMark() {
			return mark;
		}

		SourceLocatable getResult() {
			return result;
		}
	}

	static final class ParsingResult {
		private final List<ParsingResultPair> results;

		ParsingResult(List<ParsingResultPair> results) {
			this.results = results;
		}

		List<ParsingResultPair> getResults() {
			return results;
		}

		static ParsingResult none() {
			return new ParsingResult(Collections.emptyList());
		}

		static ParsingResult one(LexicalContext.Mark mark, SourceLocatable result) {
			return new ParsingResult(Collections.singletonList(new ParsingResultPair(mark, result)));
		}
	}

	private static final class MemoizeKey {
		private final Grammar<?> grammar;
		private final int index;

		MemoizeKey(Grammar<?> grammar, int index) {
			this.grammar = grammar;
			this.index = index;
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) return true;
			if (o == null || getClass() != o.getClass()) return false;
			MemoizeKey that = (MemoizeKey) o;
			return grammar == that.grammar && index == that.index;
		}

		@Override
		public int hashCode() {
			return 31 * System.identityHashCode(grammar) + index;
		}
	}

	private final LexicalContext lexicalContext;
	private final NavigableMap<SourceLocation, Set<ParseFailure>> failures;
	private final Map<MemoizeKey, ParsingResult> memoizeTable;

	GrammarExecuteVisitor(LexicalContext lexicalContext) {
		this(lexicalContext, new TreeMap<>(), new HashMap<>());
	}

	private GrammarExecuteVisitor(LexicalContext lexicalContext, NavigableMap<SourceLocation, Set<ParseFailure>> failures,
	                              Map<MemoizeKey, ParsingResult> memoizeTable) {
		this.lexicalContext = lexicalContext;
		this.failures = failures;
		this.memoizeTable = memoizeTable;
	}

	NavigableMap<SourceLocation, Set<ParseFailure>> getFailures() {
		return failures;
	}

	private void addFailure(ParseFailure failure){
		failures.computeIfAbsent(lexicalContext.getSourceLocation(), k -> new TreeSet<>()).add(failure);
	}

	@Override
	public ParsingResult visit(TerminalGrammar.Literal literal) {
		Optional<Located<Void>> result = lexicalContext.matchString(literal.getText());
		if(result.isPresent()) {
			return ParsingResult.one(lexicalContext.mark(), result.get());
		}
		addFailure(ParseFailure.literal(literal.getText()));
		return ParsingResult.none();
	}

	@Override
	public ParsingResult visit(TerminalGrammar.Regex regex) {
		Optional<Located<MatchResult>> result = lexicalContext.matchPattern(regex.getPattern());
		if(result.isPresent()) {
			return ParsingResult.one(lexicalContext.mark(), result.get());
		}
		addFailure(ParseFailure.pattern(regex.getPattern()));
		return ParsingResult.none();
	}

	@Override
	public ParsingResult visit(TerminalGrammar.EndOfLine endOfLine) {
		if(lexicalContext.isEOF()) {
			return ParsingResult.one(lexicalContext.mark(), new Located<Void>(lexicalContext.getSourceLocation(), null));
		}
		addFailure(ParseFailure.endOfLine());
		return ParsingResult.none();
	}

	@Override
	@SuppressWarnings("unchecked")
	public <PredecessorResult extends SourceLocatable, GrammarResult extends SourceLocatable> ParsingResult visit(
			MappingGrammar<PredecessorResult, GrammarResult> mappingGrammar) {
		ParsingResult predecessorResult = mappingGrammar.getPredecessorGrammar().accept(this);
		List<ParsingResultPair> mapped = new ArrayList<>(predecessorResult.getResults().size());
		for(ParsingResultPair prev : predecessorResult.getResults()) {
			mapped.add(new ParsingResultPair(
					prev.getMark(),
					mappingGrammar.getMapping().apply((PredecessorResult)prev.getResult())));
		}
		return new ParsingResult(mapped);
	}

	@Override
	public <GrammarResult extends SourceLocatable> ParsingResult visit(ReferenceGrammar<GrammarResult> referenceGrammar) {
		return referenceGrammar.getReferencedGrammar().accept(this);
	}

	@Override
	public <GrammarResult extends SourceLocatable> ParsingResult visit(BranchGrammar<GrammarResult> branchGrammar) {
		List<ParsingResultPair> results = new ArrayList<>();
		LexicalContext.Mark mark = lexicalContext.mark();
		for(Grammar<? extends GrammarResult> branch : branchGrammar.getBranches()) {
			lexicalContext.restore(mark);
			results.addAll(branch.accept(this).getResults());
		}
		return new ParsingResult(results);
	}

	@Override
	@SuppressWarnings("unchecked")
	public <GrammarResult extends SourceLocatable> ParsingResult visit(PredicateGrammar<GrammarResult> predicateGrammar) {
		ParsingResult prevResult = predicateGrammar.getToFilter().accept(this);
		List<ParsingResultPair> results = new ArrayList<>(prevResult.getResults().size());
		for(ParsingResultPair p : prevResult.getResults()) {
			if(predicateGrammar.getPredicate().test((GrammarResult)p.getResult())) {
				results.add(p);
			}
		}
		return new ParsingResult(results);
	}

	@Override
	public <GrammarResult extends SourceLocatable> ParsingResult visit(RejectGrammar<GrammarResult> rejectGrammar) {
		LexicalContext.Mark mark = lexicalContext.mark();
		// failures inside the rejected grammar are not failures of the overall parse
		ParsingResult result = rejectGrammar.getToReject().accept(
				new GrammarExecuteVisitor(lexicalContext, new TreeMap<>(), memoizeTable));
		lexicalContext.restore(mark);
		if(result.getResults().isEmpty()) {
			return ParsingResult.one(mark, new Located<Void>(lexicalContext.getSourceLocation(), null));
		}
		addFailure(ParseFailure.rejected(rejectGrammar.getToReject()));
		return ParsingResult.none();
	}

	@Override
	public <GrammarResult extends SourceLocatable> ParsingResult visit(RestrictedGrammar.Cut<GrammarResult> cut) {
		ParsingResult result = cut.getInner().accept(this);
		if(result.getResults().size() <= 1) {
			return result;
		}
		return new ParsingResult(Collections.singletonList(result.getResults().get(0)));
	}

	@Override
	public <GrammarResult extends SourceLocatable> ParsingResult visit(RestrictedGrammar.Memoize<GrammarResult> memoize) {
		MemoizeKey key = new MemoizeKey(memoize, lexicalContext.mark().getMarkedIndex());
		ParsingResult cached = memoizeTable.get(key);
		if(cached != null) {
			return cached;
		}
		ParsingResult result = memoize.getInner().accept(this);
		memoizeTable.put(key, result);
		return result;
	}

	@Override
	public ParsingResult visit(EmptySequenceGrammar emptySequenceGrammar) {
		return ParsingResult.one(
				lexicalContext.mark(), new Located<>(SourceLocation.unknown(), new EmptyHeterogenousList()));
	}

	@Override
	public <Dropped extends SourceLocatable, PrevResult extends EmptyHeterogenousList> ParsingResult visit(
			DropSequenceGrammar<Dropped, PrevResult> dropSequenceGrammar) {
		ParsingResult prevResults = dropSequenceGrammar.getPrevious().accept(this);
		List<ParsingResultPair> results = new ArrayList<>();
		for(ParsingResultPair prevResult : prevResults.getResults()) {
			lexicalContext.restore(prevResult.getMark());
			Located<?> prev = (Located<?>)prevResult.getResult();
			for(ParsingResultPair p : dropSequenceGrammar.getDropped().accept(this).getResults()) {
				results.add(new ParsingResultPair(
						p.getMark(),
						new Located<>(prev.getLocation().combine(p.getResult().getLocation()), prev.getValue())));
			}
		}
		return new ParsingResult(results);
	}

	@Override
	@SuppressWarnings("unchecked")
	public <Part extends SourceLocatable, PrevResult extends EmptyHeterogenousList> ParsingResult visit(
			PartSequenceGrammar<Part, PrevResult> partSequenceGrammar) {
		ParsingResult prevResults = partSequenceGrammar.getPrevious().accept(this);
		List<ParsingResultPair> results = new ArrayList<>();
		for(ParsingResultPair prevResult : prevResults.getResults()) {
			lexicalContext.restore(prevResult.getMark());
			Located<PrevResult> prev = (Located<PrevResult>)prevResult.getResult();
			for(ParsingResultPair p : partSequenceGrammar.getCurrent().accept(this).getResults()) {
				results.add(new ParsingResultPair(
						p.getMark(),
						new Located<>(
								prev.getLocation().combine(p.getResult().getLocation()),
								prev.getValue().cons(p.getResult()))));
			}
		}
		return new ParsingResult(results);
	}
}
