package belc.parser;

import belc.model.control.ControlCommand;
import belc.model.control.SetCommand;
import belc.model.control.UnsetCommand;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class BelControlParserTest {

	private static ControlCommand parse(String text) throws ParseFailureException {
		return BelControlParser.readControlCommand(new LexicalContext(1, text));
	}

	@Test
	public void testSetSingleValue() throws ParseFailureException {
		SetCommand set = (SetCommand) parse("SET Species = 9606");
		assertThat(set.getKey(), is("Species"));
		assertThat(set.getValues(), is(Collections.singletonList("9606")));
		assertFalse(set.isList());
	}

	@Test
	public void testSetQuotedValue() throws ParseFailureException {
		SetCommand set = (SetCommand) parse("SET SupportingText = \"a \\\"quoted\\\" sentence, with commas\"");
		assertThat(set.getValues().get(0), is("a \"quoted\" sentence, with commas"));
	}

	@Test
	public void testSetList() throws ParseFailureException {
		SetCommand set = (SetCommand) parse("SET Citation = {\"PubMed\", \"Some title\", \"12345\"}");
		assertTrue(set.isList());
		assertThat(set.getValues(), is(Arrays.asList("PubMed", "Some title", "12345")));
	}

	@Test
	public void testUnsetForms() throws ParseFailureException {
		UnsetCommand single = (UnsetCommand) parse("UNSET Species");
		assertThat(single.getKeys(), is(Collections.singletonList("Species")));
		assertFalse(single.isUnsetAll());

		UnsetCommand list = (UnsetCommand) parse("UNSET {Species, CellLine}");
		assertThat(list.getKeys(), is(Arrays.asList("Species", "CellLine")));

		assertTrue(((UnsetCommand) parse("UNSET ALL")).isUnsetAll());
	}

	@Test
	public void testIsControlLine() {
		assertTrue(BelControlParser.isControlLine("SET Citation = {\"PubMed\", \"1\"}"));
		assertTrue(BelControlParser.isControlLine("UNSET ALL"));
		assertFalse(BelControlParser.isControlLine("SETTINGS"));
		assertFalse(BelControlParser.isControlLine("p(HGNC:AKT1)"));
	}

	@Test(expected = ParseFailureException.class)
	public void testMissingValue() throws ParseFailureException {
		parse("SET Species =");
	}

	@Test(expected = ParseFailureException.class)
	public void testUnclosedList() throws ParseFailureException {
		parse("SET Citation = {\"PubMed\", \"1\"");
	}
}
