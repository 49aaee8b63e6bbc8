package ctc.parser;

import static ctc.model.cubicle.CubicleBuilder.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import ctc.model.cubicle.CubicleOrExpression;

@RunWith(Parameterized.class)
public class CubicleTemplateExpressionParseTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{"x = 1", or(branch(term(eq(ref("x"), constant("1")))))},
				{"x = 1.5", or(branch(term(eq(ref("x"), constant("1.5")))))},
				{"Flag <> True", or(branch(term(neq(ref("Flag"), constant("True")))))},
				{"Trueish = False", or(branch(term(eq(ref("Trueish"), constant("False")))))},
				{"x = y + 1", or(branch(term(eq(ref("x"), binop(ref("y"), "+", constant("1"))))))},
				{"a[i] <= b[i, j]", or(branch(term(cmp(ref("a", "i"), "<=", ref("b", "i", "j")))))},
				{"a < b", or(branch(term(cmp(ref("a"), "<", ref("b")))))},
				{"a >= b", or(branch(term(cmp(ref("a"), ">=", ref("b")))))},

				// conjunctions and disjunctions
				{"p = 1 && q = 2", or(branch(
						term(eq(ref("p"), constant("1"))),
						term(eq(ref("q"), constant("2")))))
				},
				{"p = 1 || q = 2", or(
						branch(term(eq(ref("p"), constant("1")))),
						branch(term(eq(ref("q"), constant("2")))))
				},
				{"p = 1 && (q = 1 || r = 1)", or(branch(
						term(eq(ref("p"), constant("1"))),
						nestedOr(
								branch(term(eq(ref("q"), constant("1")))),
								branch(term(eq(ref("r"), constant("1")))))))
				},

				// forall_other
				{"forall_other j. x[j] = 0", or(branch(term(forall("j", eq(ref("x", "j"), constant("0"))))))},
				{"forall_other j. (x[j] = 0 || y = 1)", or(branch(term(forall("j", or(
						branch(term(eq(ref("x", "j"), constant("0")))),
						branch(term(eq(ref("y"), constant("1")))))))))
				},

				// comments
				{"x (* a (* nested *) comment *) = 1", or(branch(term(eq(ref("x"), constant("1")))))},

				// templated names
				{"x_@0@ = 1", or(branch(term(eq(ref(name("x_", key(0))), constant("1")))))},
				{"x@0@y = @1.val@", or(branch(term(eq(
						ref(name("x", key(0), "y")),
						ref(name(field(1, "val")))))))
				},
				{"@N@ = 1", or(branch(term(eq(ref(name(arg("N"))), constant("1")))))},
				{"a[@0@] = b", or(branch(term(eq(ref(name("a"), name(key(0))), ref("b")))))},

				// iterators
				{"@T@ (|| x_@0@ = 1)", or(orIter(tdecl(arg("T")), term(eq(ref(name("x_", key(0))), constant("1")))))},
				{"@T@ (&& x_@0@ = 1)", or(branch(andIter(tdecl(arg("T")),
						term(eq(ref(name("x_", key(0))), constant("1"))))))
				},
				{"p = 1 && @T, 0.next@ (&& x[@1@] = @0@)", or(branch(
						term(eq(ref("p"), constant("1"))),
						andIter(tdecl(arg("T"), field(0, "next")),
								term(eq(ref(name("x"), name(key(1))), ref(name(key(0))))))))
				},
				{"@T, U | @0@ <> @1@@ (|| s[@0@] = @1@)", or(orIter(
						tdeclIf(or(branch(term(neq(ref(name(key(0))), ref(name(key(1))))))), arg("T"), arg("U")),
						term(eq(ref(name("s"), name(key(0))), ref(name(key(1)))))))
				},
		});
	}

	private final String template;
	private final CubicleOrExpression expected;

	public CubicleTemplateExpressionParseTest(String template, CubicleOrExpression expected) {
		this.template = template;
		this.expected = expected;
	}

	@Test
	public void test() throws TemplateParseException {
		Path testFile = Paths.get("TEST");
		CubicleOrExpression actual = CubicleTemplateParser.readOrExpression(testFile, template);
		assertThat(actual, is(expected));
	}

}
