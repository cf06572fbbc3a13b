package belc;

import org.apache.commons.io.FileUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.StringWriter;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class BelcMainTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private static String resource(String name) throws URISyntaxException {
		return new File(BelcMainTest.class.getResource("/belc/" + name).toURI()).getPath();
	}

	@Test
	public void testPrintsCanonicalDocument() throws Exception {
		StringWriter out = new StringWriter();
		assertTrue(new BelcMain(new String[]{resource("sample.bel"), resource("options.json")}, out).run());
		assertThat(out.toString(), containsString("SET DOCUMENT Name = \"Sample\""));
		assertThat(out.toString(), containsString("p(HGNC:EGFR) positiveCorrelation p(HGNC:MAPK1)"));
	}

	@Test
	public void testErrorsFailTheRun() throws Exception {
		File document = folder.newFile("broken.bel");
		FileUtils.write(document, "p(HGNC:AKT1) increases p(HGNC:TP53)\n", StandardCharsets.UTF_8);
		StringWriter out = new StringWriter();
		// no citation, and HGNC is neither defined nor in a vocabulary
		assertFalse(new BelcMain(new String[]{document.getPath()}, out).run());
	}

	@Test
	public void testWrongArguments() {
		assertFalse(new BelcMain(new String[0], new StringWriter()).run());
		assertFalse(new BelcMain(new String[]{"a", "b", "c"}, new StringWriter()).run());
	}

	@Test
	public void testMissingDocument() throws Exception {
		File missing = new File(folder.getRoot(), "missing.bel");
		assertFalse(new BelcMain(new String[]{missing.getPath()}, new StringWriter()).run());
	}

	@Test
	public void testBadConfig() throws Exception {
		File config = folder.newFile("config.json");
		FileUtils.write(config, "{\"stop_on_error\": \"yes\"}", StandardCharsets.UTF_8);
		StringWriter out = new StringWriter();
		assertFalse(new BelcMain(new String[]{resource("sample.bel"), config.getPath()}, out).run());
		assertThat(out.toString(), is(""));
	}
}
