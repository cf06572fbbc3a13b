package belc.parser;

import belc.model.control.ControlCommand;
import belc.model.control.SetCommand;
import belc.model.control.UnsetCommand;

import java.util.Collections;
import java.util.regex.Pattern;

import static belc.parser.BelLexicalGrammars.*;
import static belc.parser.ParseTools.*;

/**
 * The grammar of {@code SET} and {@code UNSET} lines in the statements section. What the keys mean is up to the
 * caller; the grammar only distinguishes single values from braced lists.
 */
public final class BelControlParser {

	private BelControlParser() {}

	private static final Pattern KEY_PATTERN = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	static final Grammar<Located<String>> KEY = ws(matchPatternText(KEY_PATTERN));

	static final Grammar<ControlCommand> SET = cut(ParseTools.<ControlCommand>parseOneOf(
			emptySequence()
					.drop(keyword(Collections.singletonList("SET")))
					.part(KEY)
					.drop(token("="))
					.part(delimitedSet())
					.map(seq -> new SetCommand(seq.getLocation(), seq.getValue().getRest().getFirst().getValue(),
							values(seq.getValue().getFirst()), true)),
			emptySequence()
					.drop(keyword(Collections.singletonList("SET")))
					.part(KEY)
					.drop(token("="))
					.part(name())
					.map(seq -> new SetCommand(seq.getLocation(), seq.getValue().getRest().getFirst().getValue(),
							Collections.singletonList(seq.getValue().getFirst().getValue()), false))));

	static final Grammar<ControlCommand> UNSET = cut(ParseTools.<ControlCommand>parseOneOf(
			emptySequence()
					.drop(keyword(Collections.singletonList("UNSET")))
					.part(delimitedSet())
					.map(seq -> new UnsetCommand(seq.getLocation(), values(seq.getValue().getFirst()))),
			emptySequence()
					.drop(keyword(Collections.singletonList("UNSET")))
					.part(KEY)
					.map(seq -> new UnsetCommand(seq.getLocation(),
							Collections.singletonList(seq.getValue().getFirst().getValue())))));

	public static final Grammar<ControlCommand> CONTROL = parseOneOf(SET, UNSET);

	public static ControlCommand readControlCommand(LexicalContext ctx) throws ParseFailureException {
		return readOrExcept(ctx, CONTROL);
	}

	/**
	 * @return whether {@param line} is meant as a control command, judging only by its first word
	 */
	public static boolean isControlLine(String line) {
		return line.startsWith("SET ") || line.startsWith("UNSET ");
	}
}
