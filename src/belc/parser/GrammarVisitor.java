package belc.parser;

import belc.util.EmptyHeterogenousList;
import belc.util.SourceLocatable;

public abstract class GrammarVisitor<Result, Except extends Throwable> {
	public abstract Result visit(TerminalGrammar.Literal literal) throws Except;
	public abstract Result visit(TerminalGrammar.Regex regex) throws Except;
	public abstract Result visit(TerminalGrammar.EndOfLine endOfLine) throws Except;
	public abstract <PredecessorResult extends SourceLocatable, GrammarResult extends SourceLocatable> Result visit(MappingGrammar<PredecessorResult, GrammarResult> mappingGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(ReferenceGrammar<GrammarResult> referenceGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(BranchGrammar<GrammarResult> branchGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(PredicateGrammar<GrammarResult> predicateGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(RejectGrammar<GrammarResult> rejectGrammar) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(RestrictedGrammar.Cut<GrammarResult> cut) throws Except;
	public abstract <GrammarResult extends SourceLocatable> Result visit(RestrictedGrammar.Memoize<GrammarResult> memoize) throws Except;
	public abstract Result visit(EmptySequenceGrammar emptySequenceGrammar) throws Except;
	public abstract <Dropped extends SourceLocatable, PrevResult extends EmptyHeterogenousList> Result visit(DropSequenceGrammar<Dropped, PrevResult> dropSequenceGrammar) throws Except;
	public abstract <Part extends SourceLocatable, PrevResult extends EmptyHeterogenousList> Result visit(PartSequenceGrammar<Part, PrevResult> partSequenceGrammar) throws Except;
}
