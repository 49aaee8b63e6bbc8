package ctc.parser;

import static ctc.model.cubicle.CubicleBuilder.*;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import ctc.formatters.CubicleNodeFormattingVisitor;
import ctc.formatters.IndentingWriter;
import ctc.model.cubicle.CubicleModel;
import ctc.model.cubicle.CubicleVariableDeclaration;

public class CubicleTemplateParserTest {

	private static final Path TEST_FILE = Paths.get("TEST");

	private static final String MUTEX =
			"number_procs 2\n" +
			"type state = Idle | Crit | @T@ (Want_@0@)\n" +
			"@T@ var X_@0@ : bool\n" +
			"array S[proc] : state\n" +
			"init (i) { S[i] = Idle }\n" +
			"(* two processes in the critical section *)\n" +
			"unsafe (i j) { S[i] = Crit && S[j] = Crit }\n" +
			"@T@ transition go_@0@ (i)\n" +
			"requires { S[i] = Idle }\n" +
			"{\n" +
			"\tS[i] := Want_@0@;\n" +
			"\t@T@ (X_@0@ := True;)\n" +
			"\tS[j] := case\n" +
			"\t\t| j = i : Crit\n" +
			"\t\t| _ : S[j];\n" +
			"}\n";

	private static CubicleModel mutexModel() {
		return model(
				"2",
				Collections.singletonList(enumType(null, name("state"),
						enumName(name("Idle")),
						enumName(name("Crit")),
						enumIter(tdecl(arg("T")), enumName(name("Want_", key(0)))))),
				Arrays.asList(
						varDecl(tdecl(arg("T")), CubicleVariableDeclaration.Kind.VAR, ref(name("X_", key(0))), "bool"),
						varDecl(null, CubicleVariableDeclaration.Kind.ARRAY, ref("S", "proc"), "state")),
				init(procs("i"), or(branch(term(eq(ref("S", "i"), ref("Idle")))))),
				Collections.emptyList(),
				Collections.singletonList(unsafe(null, procs("i", "j"), or(branch(
						term(eq(ref("S", "i"), ref("Crit"))),
						term(eq(ref("S", "j"), ref("Crit"))))))),
				Collections.singletonList(transition(
						tdecl(arg("T")),
						name("go_", key(0)),
						procs("i"),
						or(branch(term(eq(ref("S", "i"), ref("Idle"))))),
						assign(ref("S", "i"), ref(name("Want_", key(0)))),
						updateIter(tdecl(arg("T")), assign(ref(name("X_", key(0))), constant("True"))),
						assignCase(ref("S", "j"),
								caseOf(and(term(eq(ref("j"), ref("i")))), ref("Crit")),
								wildcard(ref("S", "j"))))));
	}

	private static String format(CubicleModel model) throws IOException {
		StringWriter w = new StringWriter();
		model.accept(new CubicleNodeFormattingVisitor(new IndentingWriter(w, "\t")));
		return w.toString();
	}

	@Test
	public void parsesModel() throws TemplateParseException {
		assertThat(CubicleTemplateParser.readModel(TEST_FILE, MUTEX), is(mutexModel()));
	}

	@Test
	public void printedModelParsesBack() throws TemplateParseException, IOException {
		CubicleModel parsed = CubicleTemplateParser.readModel(TEST_FILE, MUTEX);
		String printed = format(parsed);
		assertThat(CubicleTemplateParser.readModel(TEST_FILE, printed), is(parsed));
		assertThat(format(CubicleTemplateParser.readModel(TEST_FILE, printed)), is(printed));
	}

	@Test
	public void parsesTemplatedConstructs() throws TemplateParseException {
		CubicleModel model = CubicleTemplateParser.readModel(TEST_FILE,
				"@T@ type t_@0@\n" +
				"@T | @0.on@ = true@ const C_@0@ : int\n" +
				"init () { C = 0 }\n" +
				"@T@ invariant () { C_@0@ = 1 }\n" +
				"unsafe () { C = 1 }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tC := ?;\n" +
				"\t@T@ (D := case @0.cases@ (| E = @0@ : 1) | _ : 2;)\n" +
				"}\n");
		assertThat(model.getTypes(), is(Collections.singletonList(abstractType(tdecl(arg("T")), name("t_", key(0))))));
		assertThat(model.getDeclarations(), is(Collections.singletonList(
				varDecl(tdeclIf(or(branch(term(eq(ref(name(field(0, "on"))), ref("true"))))), arg("T")),
						CubicleVariableDeclaration.Kind.CONST, ref(name("C_", key(0))), "int"))));
		assertThat(model.getInvariants(), is(Collections.singletonList(
				invariant(tdecl(arg("T")), procs(), or(branch(term(eq(ref(name("C_", key(0))), constant("1")))))))));
		assertThat(model.getTransitions(), is(Collections.singletonList(transition(
				null, name("t"), procs(), null,
				assignAny(ref("C")),
				updateIter(tdecl(arg("T")), assignCase(ref("D"),
						caseIter(tdecl(field(0, "cases")), caseOf(and(term(eq(ref("E"), ref(name(key(0)))))), constant("1"))),
						wildcard(constant("2"))))))));
	}

	@Test
	public void reportsPosition() {
		try {
			CubicleTemplateParser.readModel(TEST_FILE, "var X : bool\ninit (i) { X = }\n");
			fail("parse error expected");
		} catch (TemplateParseException e) {
			assertThat(e.getLine(), is(2));
			assertThat(e.getColumn(), is(16));
		}
	}

	@Test(expected = TemplateParseException.class)
	public void rejectsUnterminatedComment() {
		CubicleTemplateParser.readModel(TEST_FILE, "var X : bool (* (* *)\ninit () { X = 1 }\n");
	}

	@Test(expected = TemplateParseException.class)
	public void rejectsReplicatedInit() {
		CubicleTemplateParser.readModel(TEST_FILE, "var X : bool\n@T@ init () { X = 1 }\n");
	}

	@Test(expected = TemplateParseException.class)
	public void rejectsMissingInit() {
		CubicleTemplateParser.readModel(TEST_FILE, "var X : bool\nunsafe () { X = 1 }\n");
	}

	@Test(expected = TemplateParseException.class)
	public void rejectsConstructsOutOfOrder() {
		CubicleTemplateParser.readModel(TEST_FILE, "var X : bool\ninit () { X = 1 }\ntype t\n");
	}

}
