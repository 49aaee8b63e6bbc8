package ctc.formatters;

import static ctc.model.cubicle.CubicleBuilder.*;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import ctc.InternalCompilerError;
import ctc.model.cubicle.CubicleModel;
import ctc.model.cubicle.CubicleNode;
import ctc.model.cubicle.CubicleVariableDeclaration;

public class ExpandedModelFormattingVisitorTest {

	private static String format(CubicleNode node) throws IOException {
		StringWriter w = new StringWriter();
		node.accept(ExpandedModelFormattingVisitor.forCubicle(w));
		return w.toString();
	}

	@Test
	public void printsModel() throws IOException {
		CubicleModel model = model(
				null,
				Arrays.asList(abstractType(null, name("id")), enumType(null, name("state"),
						enumName(name("Idle")), enumName(name("Crit")))),
				Arrays.asList(
						varDecl(null, CubicleVariableDeclaration.Kind.VAR, ref("x"), "int"),
						varDecl(null, CubicleVariableDeclaration.Kind.ARRAY, ref("S", "proc"), "state")),
				init(procs(), dnf(Collections.singletonList(eq(ref("x"), constant("0"))))),
				Collections.singletonList(invariant(null, procs("i", "j"), dnf(
						Arrays.asList(eq(ref("S", "i"), ref("Crit")), eq(ref("S", "j"), ref("Crit"))),
						Collections.singletonList(neq(ref("x"), binop(ref("y"), "-", constant("1"))))))),
				Collections.singletonList(unsafe(null, procs("i"), dnf(
						Collections.singletonList(eq(ref("S", "i"), ref("Crit")))))),
				Collections.singletonList(transition(null, name("t"), procs("i"),
						dnf(Collections.singletonList(forall("j", eq(ref("S", "j"), ref("Idle"))))),
						assign(ref("x"), constant("1")),
						assignAny(ref("y")),
						assignCase(ref("S", "i"),
								caseOf(and(term(eq(ref("x"), constant("1")))), ref("Crit")),
								wildcard(ref("Idle"))))));

		assertThat(format(model), is(
				"type id\n" +
				"type state = Idle | Crit\n" +
				"var x : int\n" +
				"array S[proc] : state\n" +
				"init () { x = 0 }\n" +
				"invariant (i j) { S[i] = Crit && S[j] = Crit || x <> y - 1 }\n" +
				"unsafe (i) { S[i] = Crit }\n" +
				"transition t (i)\n" +
				"\trequires { forall_other j. S[j] = Idle }\n" +
				"{\n" +
				"\tx := 1;\n" +
				"\ty := ?;\n" +
				"\tS[i] := case\n" +
				"\t\t| x = 1 : Crit\n" +
				"\t\t| _ : Idle\n" +
				"\t;\n" +
				"}\n"));
	}

	@Test(expected = InternalCompilerError.class)
	public void rejectsTemplateNames() throws IOException {
		format(ref(name("x_", key(0))));
	}

	@Test(expected = InternalCompilerError.class)
	public void rejectsIterators() throws IOException {
		format(or(orIter(tdecl(arg("T")), term(eq(ref("x"), constant("1"))))));
	}

	@Test(expected = InternalCompilerError.class)
	public void rejectsNestedDisjunctions() throws IOException {
		format(and(nestedOr(branch(term(eq(ref("x"), constant("1")))))));
	}

}
