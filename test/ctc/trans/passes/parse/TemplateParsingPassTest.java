package ctc.trans.passes.parse;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.nio.file.Paths;

import org.junit.Test;

public class TemplateParsingPassTest {

	@Test
	public void wrapsParseErrors() {
		try {
			TemplateParsingPass.perform(Paths.get("TEST"), "var x : int\ninit () { x = 0 }\nunsafe () { x = 1 ");
			fail("parsing should have failed");
		} catch (ParsingIssue e) {
			assertThat(e.getError().getLine(), is(3));
			assertThat(e.getMessage(), startsWith("error parsing template: "));
		}
	}

}
