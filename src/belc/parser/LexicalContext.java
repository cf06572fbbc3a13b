package belc.parser;

import belc.util.SourceLocation;

import java.util.Optional;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The read position within one logical BEL line. Grammars advance it as they match and restore earlier
 * {@link Mark}s when they backtrack.
 */
public class LexicalContext {

	private final int line;
	private final String text;
	private int index;

	public static final class Mark {
		private final int markedIndex;

		private Mark(int markedIndex) {
			this.markedIndex = markedIndex;
		}

		public int getMarkedIndex() { return markedIndex; }
	}

	/**
	 * @param line the 1-based number of the document line {@param text} starts on
	 * @param text the logical line to parse
	 */
	public LexicalContext(int line, String text) {
		this.line = line;
		this.text = text;
		this.index = 0;
	}

	public Mark mark() {
		return new Mark(index);
	}

	public void restore(Mark mark) {
		index = mark.getMarkedIndex();
	}

	/**
	 * Attempts to match {@param pattern} starting exactly at the current position.
	 * @return the located match, or empty if the pattern does not match here
	 */
	public Optional<Located<MatchResult>> matchPattern(Pattern pattern){
		if(index > text.length()) return Optional.empty();
		Matcher m = pattern.matcher(text);
		m.region(index, text.length());
		if(!m.lookingAt()){
			return Optional.empty();
		}
		SourceLocation location = new SourceLocation(line, index, m.end());
		index = m.end();
		return Optional.of(new Located<>(location, m.toMatchResult()));
	}

	public Optional<Located<Void>> matchString(String string){
		if(!text.startsWith(string, index)){
			return Optional.empty();
		}
		SourceLocation location = new SourceLocation(line, index, index + string.length());
		index += string.length();
		return Optional.of(new Located<>(location, null));
	}

	public SourceLocation getSourceLocation(){
		return new SourceLocation(line, index, index);
	}

	public boolean isEOF(){
		return index >= text.length();
	}

	public int getLine() {
		return line;
	}

	public String getText() {
		return text;
	}
}
