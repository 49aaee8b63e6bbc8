package ctc.formatters;

import static ctc.model.cubicle.CubicleBuilder.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.util.Arrays;

import org.junit.Test;

import ctc.errors.Issue;
import ctc.errors.TopLevelIssueContext;
import ctc.model.data.DataScalar;
import ctc.model.data.DataSequence;
import ctc.model.template.TemplateArgument;
import ctc.trans.passes.expansion.ExpandingName;
import ctc.trans.passes.expansion.ExpandingTemplateReference;
import ctc.trans.passes.expansion.NotIterableIssue;
import ctc.trans.passes.expansion.NotScalarIssue;
import ctc.trans.passes.expansion.UnknownTemplateArgumentIssue;

public class IssueFormattingVisitorTest {

	@Test
	public void printsContextTrail() {
		TemplateArgument argument = arg("T");
		Issue issue = new UnknownTemplateArgumentIssue(argument)
				.withContext(new ExpandingTemplateReference(argument))
				.withContext(new ExpandingName(name("x_", argument)));
		assertThat(issue.getMessage(), is(
				"in name x_@T@\n" +
				"    in template reference @T@\n" +
				"        template argument T is not defined in the data"));
	}

	@Test
	public void printsDataValues() {
		assertThat(new NotIterableIssue(new DataScalar("a")).getMessage(),
				is("expected a mapping or a sequence, got a"));
		assertThat(new NotScalarIssue(new DataSequence(Arrays.asList(new DataScalar("a"), new DataScalar("b"))))
				.getMessage(), is("expected a scalar, got [a, b]"));
	}

	@Test
	public void countsIssues() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.error(new NotIterableIssue(new DataScalar("a")));
		ctx.error(new UnknownTemplateArgumentIssue(arg("U")));
		assertThat(ctx.format(), is(
				"Detected 2 issue(s):\n" +
				"expected a mapping or a sequence, got a\n" +
				"template argument U is not defined in the data"));
	}

}
