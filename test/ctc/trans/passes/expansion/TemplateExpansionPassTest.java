package ctc.trans.passes.expansion;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.junit.Test;

import ctc.errors.Issue;
import ctc.errors.IssueWithContext;
import ctc.errors.TopLevelIssueContext;
import ctc.formatters.ExpandedModelFormattingVisitor;
import ctc.model.cubicle.CubicleModel;
import ctc.parser.CubicleTemplateParser;
import ctc.trans.passes.data.DataLoadingPass;

public class TemplateExpansionPassTest {

	private static final Path TEST_FILE = Paths.get("TEST");

	private static CubicleModel perform(TopLevelIssueContext ctx, String template, String data) {
		return TemplateExpansionPass.perform(ctx, CubicleTemplateParser.readModel(TEST_FILE, template),
				DataLoadingPass.read(data));
	}

	private static String expand(String template, String data) throws IOException {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		CubicleModel model = perform(ctx, template, data);
		assertFalse(ctx.format(), ctx.hasErrors());
		StringWriter w = new StringWriter();
		model.accept(ExpandedModelFormattingVisitor.forCubicle(w));
		return w.toString();
	}

	private static Issue expansionIssue(String template, String data) {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(perform(ctx, template, data), is(nullValue()));
		assertThat(ctx.getIssues().size(), is(1));
		Issue issue = ctx.getIssues().get(0);
		while (issue instanceof IssueWithContext) {
			issue = ((IssueWithContext) issue).getIssue();
		}
		return issue;
	}

	@Test
	public void replicatesOverData() throws IOException {
		String template =
				"@P@ var x_@0@ : int\n" +
				"init () { @P@ (&& x_@0@ = 0) }\n" +
				"unsafe () { @P@ (|| x_@0@ = 1) }\n" +
				"transition t ()\n" +
				"{\n" +
				"\t@P@ (x_@0@ := 1;)\n" +
				"}\n";
		assertThat(expand(template, "{\"P\": [\"B\", \"A\"]}"), is(
				"var x_A : int\n" +
				"var x_B : int\n" +
				"init () { x_A = 0 && x_B = 0 }\n" +
				"unsafe () { x_A = 1 || x_B = 1 }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tx_A := 1;\n" +
				"\tx_B := 1;\n" +
				"}\n"));
	}

	@Test
	public void withoutTemplatesIsIdentity() throws IOException {
		String program =
				"number_procs 2\n" +
				"type state = Idle | Crit\n" +
				"array S[proc] : state\n" +
				"init (i) { S[i] = Idle }\n" +
				"invariant () { forall_other j. (S[j] = Idle || S[j] = Crit) }\n" +
				"unsafe (i j) { S[i] = Crit && S[j] = Crit }\n" +
				"transition enter (i)\n" +
				"\trequires { S[i] = Idle && forall_other j. S[j] <> Crit }\n" +
				"{\n" +
				"\tS[j] := case\n" +
				"\t\t| j = i : Crit\n" +
				"\t\t| _ : S[j]\n" +
				"\t;\n" +
				"}\n";
		assertThat(expand(program, "{}"), is(program));
	}

	@Test
	public void isDeterministic() throws IOException {
		String template =
				"@T, U | @0@ <> @1@@ var link_@0@_@1@ : bool\n" +
				"init () { @T@ (&& @T@ (&& link_@0@_@1@ = False)) }\n" +
				"unsafe () { @T@ (|| x = @0@) }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tx := 1;\n" +
				"}\n";
		String data = "{\"T\": {\"c\": 1, \"a\": 2, \"b\": 3}, \"U\": [\"b\", \"c\", \"a\"]}";
		assertThat(expand(template, data), is(expand(template, data)));
	}

	@Test
	public void replicationOrderFollowsSortedKeys() throws IOException {
		String template =
				"var x : int\n" +
				"init () { x = 0 }\n" +
				"unsafe () { x = 1 }\n" +
				"@T, U@ transition t_@0@_@1@ ()\n" +
				"{\n" +
				"\tx := @1.value@;\n" +
				"}\n";
		assertThat(expand(template, "{\"T\": [\"b\", \"a\"], \"U\": {\"y\": \"Low\", \"x\": \"High\"}}"), is(
				"var x : int\n" +
				"init () { x = 0 }\n" +
				"unsafe () { x = 1 }\n" +
				"transition t_a_x ()\n{\n\tx := High;\n}\n" +
				"transition t_a_y ()\n{\n\tx := Low;\n}\n" +
				"transition t_b_x ()\n{\n\tx := High;\n}\n" +
				"transition t_b_y ()\n{\n\tx := Low;\n}\n"));
	}

	@Test
	public void indexesDependOnEnclosingBindings() throws IOException {
		String template =
				"@nodes@ var at_@0@ : bool\n" +
				"init () { @nodes@ (&& at_@0@ = False) }\n" +
				"unsafe () { @nodes@ (|| at_@0@ = True) }\n" +
				"@nodes, 0.next | @0@ <> @1@@ transition move_@0@_@1@ ()\n" +
				"\trequires { at_@0@ = True }\n" +
				"{\n" +
				"\tat_@0@ := False;\n" +
				"\tat_@1@ := True;\n" +
				"}\n";
		String data = "{\"nodes\": {\"n2\": {\"next\": [\"n1\", \"n2\"]}, \"n1\": {\"next\": [\"n2\"]}}}";
		assertThat(expand(template, data), is(
				"var at_n1 : bool\n" +
				"var at_n2 : bool\n" +
				"init () { at_n1 = False && at_n2 = False }\n" +
				"unsafe () { at_n1 = True || at_n2 = True }\n" +
				"transition move_n1_n2 ()\n" +
				"\trequires { at_n1 = True }\n" +
				"{\n" +
				"\tat_n1 := False;\n" +
				"\tat_n2 := True;\n" +
				"}\n" +
				"transition move_n2_n1 ()\n" +
				"\trequires { at_n2 = True }\n" +
				"{\n" +
				"\tat_n2 := False;\n" +
				"\tat_n1 := True;\n" +
				"}\n"));
	}

	@Test
	public void distributesNestedDisjunctions() throws IOException {
		String template =
				"var p : int\n" +
				"init () { p = 0 }\n" +
				"unsafe () { p = 1 && (q = 1 || r = 1) }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tp := 1;\n" +
				"}\n";
		assertThat(expand(template, "{}"), containsString("unsafe () { p = 1 && q = 1 || p = 1 && r = 1 }\n"));
	}

	@Test
	public void emptyCollectionsVanish() throws IOException {
		String template =
				"type t = @E@ (C_@0@)\n" +
				"var X : int\n" +
				"init () { X = 0 }\n" +
				"invariant () { @E@ (|| X = 1) }\n" +
				"unsafe () { X = 1 && @E@ (&& X = 2) }\n" +
				"transition keep ()\n" +
				"\trequires { @E@ (|| X = @0@) }\n" +
				"{\n" +
				"\tX := 1;\n" +
				"\tY := case @E@ (| X = @0@ : 1);\n" +
				"}\n" +
				"@E@ transition gone_@0@ ()\n" +
				"{\n" +
				"\tX := 2;\n" +
				"}\n" +
				"transition empty ()\n" +
				"{\n" +
				"\t@E@ (X := 3;)\n" +
				"}\n";
		assertThat(expand(template, "{\"E\": []}"), is(
				"type t\n" +
				"var X : int\n" +
				"init () { X = 0 }\n" +
				"unsafe () { X = 1 }\n" +
				"transition keep ()\n" +
				"{\n" +
				"\tX := 1;\n" +
				"}\n"));
	}

	@Test
	public void vanishingForallIsDropped() throws IOException {
		String template =
				"var X : int\n" +
				"init () { X = 0 && forall_other j. (@E@ (|| X = @0@)) }\n" +
				"unsafe () { X = 1 }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tX := case | X = 1 && @E@ (&& X = @0@) : 2 | _ : 3;\n" +
				"}\n";
		assertThat(expand(template, "{\"E\": []}"), is(
				"var X : int\n" +
				"init () { X = 0 }\n" +
				"unsafe () { X = 1 }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tX := case\n" +
				"\t\t| X = 1 : 2\n" +
				"\t\t| _ : 3\n" +
				"\t;\n" +
				"}\n"));
	}

	@Test
	public void validatesNames() throws IOException {
		String template =
				"var @key@_value : int\n" +
				"init () { x = 0 }\n" +
				"unsafe () { x = 1 }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tx := 1;\n" +
				"}\n";
		assertThat(expansionIssue(template, "{\"key\": \"1bad\"}"), is(instanceOf(MalformedNameIssue.class)));
		assertThat(expand(template, "{\"key\": \"ok1\"}"), startsWith("var ok1_value : int\n"));
	}

	@Test
	public void reportsMalformedNameWithLine() {
		String template =
				"var x : int\n" +
				"init () { x = 0 }\n" +
				"@P@ unsafe (z) { @0@_z = 1 }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tx := 1;\n" +
				"}\n";
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(perform(ctx, template, "{\"P\": [\"1a\"]}"), is(nullValue()));
		String report = ctx.format();
		assertThat(report, containsString("line 3: in name @0@_z"));
		assertThat(report, containsString("expanded name \"1a_z\" is not a valid identifier"));
	}

	@Test
	public void reportsEmptyUnsafe() {
		String template =
				"var x : int\n" +
				"init () { x = 0 }\n" +
				"@E@ unsafe () { x = 1 }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tx := 1;\n" +
				"}\n";
		Issue issue = expansionIssue(template, "{\"E\": []}");
		assertThat(issue, is(instanceOf(EmptyModelCategoryIssue.class)));
		assertThat(((EmptyModelCategoryIssue) issue).getCategory(), is("unsafe formula"));
	}

	@Test
	public void reportsEveryEmptyCategory() {
		String template =
				"@E@ var x : int\n" +
				"init () { @E@ (|| x = 0) }\n" +
				"@E@ unsafe () { x = 1 }\n" +
				"@E@ transition t ()\n" +
				"{\n" +
				"\tx := 1;\n" +
				"}\n";
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(perform(ctx, template, "{\"E\": []}"), is(nullValue()));
		assertThat(ctx.getIssues().size(), is(4));
		assertThat(ctx.format(), is(
				"Detected 4 issue(s):\n" +
				"expanded model has no variable declaration\n" +
				"expanded model has no init formula\n" +
				"expanded model has no unsafe formula\n" +
				"expanded model has no transition"));
	}

	@Test
	public void reportsMissingArgumentWithContext() {
		String template =
				"var x : int\n" +
				"init () { x = 0 }\n" +
				"unsafe () { x = 1 }\n" +
				"@Missing@ transition t_@0@ ()\n" +
				"{\n" +
				"\tx := 1;\n" +
				"}\n";
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		assertThat(perform(ctx, template, "{}"), is(nullValue()));
		String report = ctx.format();
		assertThat(report, containsString("line 4: in @Missing@ transition t_@0@"));
		assertThat(report, containsString("template argument Missing is not defined in the data"));
	}

	@Test
	public void rejectsNestedDisjunctionInCaseGuard() {
		String template =
				"var x : int\n" +
				"init () { x = 0 }\n" +
				"unsafe () { x = 1 }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tx := case | (x = 1 || x = 2) : 1 | _ : 2;\n" +
				"}\n";
		assertThat(expansionIssue(template, "{}"), is(instanceOf(NestedOrNotAllowedIssue.class)));
	}

	@Test
	public void rejectsOrderingInConditions() {
		String template =
				"@T | @0@ < b@ var x_@0@ : int\n" +
				"init () { x = 0 }\n" +
				"unsafe () { x = 1 }\n" +
				"transition t ()\n" +
				"{\n" +
				"\tx := 1;\n" +
				"}\n";
		assertThat(expansionIssue(template, "{\"T\": [\"a\"]}"), is(instanceOf(ConditionConstructNotAllowedIssue.class)));
	}

}
