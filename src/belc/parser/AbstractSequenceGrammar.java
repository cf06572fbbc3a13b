package belc.parser;

import belc.util.EmptyHeterogenousList;
import belc.util.SourceLocatable;

/**
 * A grammar representing a sequence, used builder-style to chain grammars one after another.
 *
 * <p>Results are accumulated in a {@link belc.util.HeterogenousList} in reverse parse order: the most recently
 * added part is the head of the list, so for {@code emptySequence().part(a).part(b)} the result of {@code b} is
 * {@code getFirst()} and the result of {@code a} is {@code getRest().getFirst()}.</p>
 * @param <Sequence> the heterogenous list holding all non-dropped results of this sequence
 */
public abstract class AbstractSequenceGrammar<Sequence extends EmptyHeterogenousList> extends Grammar<Located<Sequence>> {

	/**
	 * @return a sequence that also parses {@param grammar} and prepends its result to the current results
	 */
	public <Result extends SourceLocatable> PartSequenceGrammar<Result, Sequence> part(Grammar<Result> grammar) {
		return new PartSequenceGrammar<>(this, grammar);
	}

	/**
	 * @return a sequence that also parses {@param grammar} but discards its result. The location of the dropped
	 * text still contributes to the location of the whole sequence.
	 */
	public <Dropped extends SourceLocatable> DropSequenceGrammar<Dropped, Sequence> drop(Grammar<Dropped> grammar) {
		return new DropSequenceGrammar<>(this, grammar);
	}

}
