package ctc.model.template;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Collections;

import org.junit.Test;

import ctc.model.data.DataScalar;

public class TemplateContextTest {

	private final TemplateContext context = TemplateContext.empty()
			.extend(new TemplateBinding("a", Collections.singletonMap("next", new DataScalar("b"))))
			.extend(new TemplateBinding("b", Collections.emptyMap()));

	@Test
	public void extendingKeepsTheOriginal() {
		assertThat(TemplateContext.empty().size(), is(0));
		assertThat(context.size(), is(2));
		assertThat(context.extend(new TemplateBinding("c", Collections.emptyMap())).size(), is(3));
		assertThat(context.size(), is(2));
	}

	@Test
	public void looksUpKeysAndFields() {
		assertThat(context.getKey(0), is(new DataScalar("a")));
		assertThat(context.getKey(1), is(new DataScalar("b")));
		assertThat(context.getField(0, "next"), is(new DataScalar("b")));
	}

	@Test
	public void rejectsUndefinedIndex() {
		try {
			context.getKey(2);
			fail("index 2 is not bound");
		} catch (UndefinedContextIndexIssue e) {
			assertThat(e.getIndex(), is(2));
			assertThat(e.getContextSize(), is(2));
		}
	}

	@Test(expected = UnknownContextFieldIssue.class)
	public void rejectsUnknownField() {
		context.getField(1, "next");
	}

}
