package ctc.trans.passes.expansion;

import static ctc.model.cubicle.CubicleBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import org.junit.Test;

import ctc.model.cubicle.CubicleOrExpression;

public class ExpandedConditionEvaluatorTest {

	private static boolean evaluate(CubicleOrExpression condition) {
		return new ExpandedConditionEvaluator().evaluate(condition);
	}

	private static String rejectedConstruct(CubicleOrExpression condition) {
		try {
			evaluate(condition);
		} catch (ConditionConstructNotAllowedIssue e) {
			return e.getConstruct();
		}
		fail("condition should have been rejected");
		return null;
	}

	@Test
	public void comparesText() {
		assertThat(evaluate(or(branch(term(eq(ref("a"), ref("a")))))), is(true));
		assertThat(evaluate(or(branch(term(eq(ref("a"), ref("b")))))), is(false));
		assertThat(evaluate(or(branch(term(neq(ref("a"), ref("b")))))), is(true));
		assertThat(evaluate(or(branch(term(neq(ref("a"), ref("a")))))), is(false));
		assertThat(evaluate(or(branch(term(eq(ref("1"), constant("1")))))), is(true));
		assertThat(evaluate(or(branch(term(eq(constant("True"), ref("true")))))), is(false));
	}

	@Test
	public void combinesBranches() {
		assertThat(evaluate(or(
				branch(term(eq(ref("a"), ref("b")))),
				branch(term(eq(ref("c"), ref("c")))))), is(true));
		assertThat(evaluate(or(branch(
				term(eq(ref("c"), ref("c"))),
				term(eq(ref("a"), ref("b")))))), is(false));
	}

	@Test
	public void emptyConditionIsFalse() {
		assertThat(evaluate(or()), is(false));
	}

	@Test
	public void emptyBranchIsTrue() {
		assertThat(evaluate(or(branch())), is(true));
	}

	@Test
	public void rejectsOtherConstructs() {
		assertThat(rejectedConstruct(or(branch(term(cmp(ref("a"), "<", ref("b")))))), is("< operations"));
		assertThat(rejectedConstruct(or(branch(term(eq(ref("a", "i"), ref("b")))))), is("arrays"));
		assertThat(rejectedConstruct(or(branch(term(eq(binop(ref("a"), "+", constant("1")), ref("b")))))),
				is("+/- operations"));
		assertThat(rejectedConstruct(or(branch(term(forall("j", eq(ref("a"), ref("b"))))))),
				is("forall_other constructs"));
	}

	@Test
	public void operatorIsCheckedBeforeOperands() {
		assertThat(rejectedConstruct(or(branch(term(cmp(ref("a", "i"), ">", ref("b")))))), is("> operations"));
	}

	@Test
	public void shortCircuits() {
		// the second branch is never looked at
		assertThat(evaluate(or(
				branch(term(eq(ref("a"), ref("a")))),
				branch(term(cmp(ref("a"), "<", ref("b")))))), is(true));
		assertThat(evaluate(or(branch(
				term(eq(ref("a"), ref("b"))),
				term(forall("j", eq(ref("a"), ref("b"))))))), is(false));
	}

}
