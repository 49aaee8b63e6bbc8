package ctc.trans.passes.expansion;

import static ctc.model.cubicle.CubicleBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import ctc.errors.Issue;
import ctc.errors.IssueWithContext;
import ctc.model.cubicle.CubicleBoolExpression;
import ctc.model.cubicle.CubicleName;
import ctc.model.template.TemplateContext;
import ctc.model.template.UndefinedContextIndexIssue;
import ctc.model.template.UnknownContextFieldIssue;
import ctc.trans.passes.data.DataLoadingPass;

public class TemplateInstanceGeneratorTest {

	private static final String DATA = "{" +
			"\"procs\": [\"b\", \"a\"]," +
			"\"kinds\": {\"y\": 1, \"x\": 2}," +
			"\"nodes\": {\"n2\": {\"next\": [\"n1\"]}, \"n1\": {\"next\": [\"n3\", \"n2\"]}}," +
			"\"names\": [\"ok1\", \"1bad\"]," +
			"\"scalar\": \"s\"," +
			"\"nested\": [[\"a\"]]" +
			"}";

	private final TemplateInstanceGenerator generator = new TemplateInstanceGenerator(DataLoadingPass.read(DATA));

	private static List<String> keys(List<TemplateContext> instances) {
		List<String> result = new ArrayList<>();
		for (TemplateContext instance : instances) {
			StringBuilder keys = new StringBuilder();
			for (int i = 0; i < instance.size(); ++i) {
				if (i > 0) {
					keys.append(",");
				}
				keys.append(instance.getBinding(i).getKey());
			}
			result.add(keys.toString());
		}
		return result;
	}

	private static Issue innermost(Issue issue) {
		while (issue instanceof IssueWithContext) {
			issue = ((IssueWithContext) issue).getIssue();
		}
		return issue;
	}

	private Issue nameIssue(CubicleName name, TemplateContext context) {
		try {
			generator.expandName(name, context);
		} catch (Issue e) {
			return innermost(e);
		}
		fail("name expansion should have failed");
		return null;
	}

	@Test
	public void noDeclarationMeansOneInstance() {
		TemplateContext context = TemplateContext.empty();
		assertThat(generator.instances(null, context), is(Collections.singletonList(context)));
	}

	@Test
	public void instancesAreSortedCrossProduct() {
		assertThat(keys(generator.instances(tdecl(arg("procs"), arg("kinds")), TemplateContext.empty())),
				is(Arrays.asList("a,x", "a,y", "b,x", "b,y")));
	}

	@Test
	public void argumentsMayDependOnEarlierBindings() {
		assertThat(keys(generator.instances(tdecl(arg("nodes"), field(0, "next")), TemplateContext.empty())),
				is(Arrays.asList("n1,n2", "n1,n3", "n2,n1")));
	}

	@Test
	public void conditionFiltersInstances() {
		assertThat(keys(generator.instances(
				tdeclIf(or(branch(term(neq(ref(name(key(0))), ref(name(key(1))))))), arg("procs"), arg("procs")),
				TemplateContext.empty())),
				is(Arrays.asList("a,b", "b,a")));
	}

	@Test
	public void conditionMayReadEnclosingBindings() {
		TemplateContext outer = generator.instances(tdecl(arg("procs")), TemplateContext.empty()).get(0);
		assertThat(keys(generator.instances(
				tdeclIf(or(branch(term(neq(ref(name(key(0))), ref(name(key(1))))))), arg("procs")),
				outer)),
				is(Collections.singletonList("a,b")));
	}

	@Test
	public void scalarValuesAreExposedAsValueField() {
		TemplateContext context = generator.instances(tdecl(arg("kinds")), TemplateContext.empty()).get(0);
		assertThat(generator.expandName(name("K_", key(0), "_", field(0, "value")), context),
				is(name("K_x_2")));
	}

	@Test
	public void distributesConjunctionOverNestedDisjunction() {
		CubicleBoolExpression p = eq(ref("p"), constant("1"));
		CubicleBoolExpression q = eq(ref("q"), constant("1"));
		CubicleBoolExpression r = eq(ref("r"), constant("1"));
		assertThat(generator.expandOr(or(branch(term(p), nestedOr(branch(term(q)), branch(term(r))))),
				TemplateContext.empty()),
				is(dnf(Arrays.asList(p, q), Arrays.asList(p, r))));
	}

	@Test
	public void distributesInSourceOrder() {
		CubicleBoolExpression a = eq(ref("a"), constant("1"));
		CubicleBoolExpression b = eq(ref("b"), constant("1"));
		CubicleBoolExpression c = eq(ref("c"), constant("1"));
		CubicleBoolExpression d = eq(ref("d"), constant("1"));
		assertThat(generator.expandOr(or(branch(
				nestedOr(branch(term(a)), branch(term(b))),
				nestedOr(branch(term(c)), branch(term(d))))),
				TemplateContext.empty()),
				is(dnf(Arrays.asList(a, c), Arrays.asList(a, d), Arrays.asList(b, c), Arrays.asList(b, d))));
	}

	@Test
	public void andIteratorDistributesOverItsInstances() {
		// @procs@ (&& (x_@0@ = 1 || y_@0@ = 1))
		assertThat(generator.expandOr(or(branch(andIter(tdecl(arg("procs")), nestedOr(
				branch(term(eq(ref(name("x_", key(0))), constant("1")))),
				branch(term(eq(ref(name("y_", key(0))), constant("1")))))))),
				TemplateContext.empty()),
				is(dnf(
						Arrays.asList(eq(ref("x_a"), constant("1")), eq(ref("x_b"), constant("1"))),
						Arrays.asList(eq(ref("x_a"), constant("1")), eq(ref("y_b"), constant("1"))),
						Arrays.asList(eq(ref("y_a"), constant("1")), eq(ref("x_b"), constant("1"))),
						Arrays.asList(eq(ref("y_a"), constant("1")), eq(ref("y_b"), constant("1"))))));
	}

	@Test
	public void emptyIteratorsVanish() {
		CubicleBoolExpression p = eq(ref("p"), constant("1"));
		assertThat(generator.expandOr(
				or(branch(term(p), andIter(tdeclIf(or(), arg("procs")), term(p)))),
				TemplateContext.empty()),
				is(dnf(Collections.singletonList(p))));
		assertThat(generator.expandOr(or(orIter(tdeclIf(or(), arg("procs")), term(p))), TemplateContext.empty()),
				is(or()));
	}

	@Test(expected = NestedOrNotAllowedIssue.class)
	public void plainConjunctionRejectsNestedDisjunction() {
		generator.expandAnd(and(nestedOr(branch(term(eq(ref("q"), constant("1")))))), TemplateContext.empty());
	}

	@Test
	public void validatesExpandedNames() {
		List<TemplateContext> instances = generator.instances(tdecl(arg("names")), TemplateContext.empty());
		// "1bad" sorts first
		assertThat(nameIssue(name(key(0), "_value"), instances.get(0)), is(instanceOf(MalformedNameIssue.class)));
		assertThat(generator.expandName(name(key(0), "_value"), instances.get(1)),
				is(name("ok1_value")));
	}

	@Test
	public void reportsLookupErrors() {
		TemplateContext context = generator.instances(tdecl(arg("procs")), TemplateContext.empty()).get(0);
		assertThat(nameIssue(name(arg("missing")), context), is(instanceOf(UnknownTemplateArgumentIssue.class)));
		assertThat(nameIssue(name(key(1)), context), is(instanceOf(UndefinedContextIndexIssue.class)));
		assertThat(nameIssue(name(field(0, "next")), context), is(instanceOf(UnknownContextFieldIssue.class)));
		assertThat(nameIssue(name(arg("procs")), context), is(instanceOf(NotScalarIssue.class)));
	}

	@Test
	public void reportsShapeErrors() {
		try {
			generator.instances(tdecl(arg("scalar")), TemplateContext.empty());
			fail("scalar should not be iterable");
		} catch (Issue e) {
			assertThat(innermost(e), is(instanceOf(NotIterableIssue.class)));
		}
		try {
			generator.instances(tdecl(arg("nested")), TemplateContext.empty());
			fail("sequence of sequences should not be iterable");
		} catch (Issue e) {
			assertThat(innermost(e), is(instanceOf(NotScalarIssue.class)));
		}
	}

}
