package ctc.formatters;

import ctc.errors.IssueVisitor;
import ctc.errors.IssueWithContext;
import ctc.model.template.UndefinedContextIndexIssue;
import ctc.model.template.UnknownContextFieldIssue;
import ctc.trans.intermediate.IOErrorIssue;
import ctc.trans.passes.data.DataFormatIssue;
import ctc.trans.passes.expansion.*;
import ctc.trans.passes.parse.ParsingIssue;
import ctc.trans.passes.parse.option.OptionParserIssue;

import java.io.IOException;

public class IssueFormattingVisitor extends IssueVisitor<Void, IOException> {
	private final IndentingWriter out;

	public IssueFormattingVisitor(IndentingWriter out) {
		this.out = out;
	}

	@Override
	public Void visit(IssueWithContext issueWithContext) throws IOException {
		issueWithContext.getContext().accept(new ContextFormattingVisitor(out));
		try (IndentingWriter.Indent ignored = out.indent()) {
			out.newLine();
			issueWithContext.getIssue().accept(this);
		}
		return null;
	}

	@Override
	public Void visit(IOErrorIssue ioErrorIssue) throws IOException {
		out.write("IO Error: ");
		out.write(ioErrorIssue.getError().toString());
		return null;
	}

	@Override
	public Void visit(OptionParserIssue optionParserIssue) throws IOException {
		out.write("option error: ");
		out.write(optionParserIssue.getError());
		return null;
	}

	@Override
	public Void visit(ParsingIssue parsingIssue) throws IOException {
		out.write("error parsing template: ");
		out.write(parsingIssue.getError().getMessage());
		return null;
	}

	@Override
	public Void visit(DataFormatIssue dataFormatIssue) throws IOException {
		out.write("invalid data: ");
		out.write(dataFormatIssue.getProblem());
		return null;
	}

	@Override
	public Void visit(UnknownTemplateArgumentIssue unknownTemplateArgumentIssue) throws IOException {
		out.write("template argument ");
		out.write(unknownTemplateArgumentIssue.getArgument().getName());
		out.write(" is not defined in the data");
		return null;
	}

	@Override
	public Void visit(UndefinedContextIndexIssue undefinedContextIndexIssue) throws IOException {
		out.write("template index ");
		out.write(Integer.toString(undefinedContextIndexIssue.getIndex()));
		out.write(" is undefined; ");
		out.write(Integer.toString(undefinedContextIndexIssue.getContextSize()));
		out.write(" binding(s) in scope");
		return null;
	}

	@Override
	public Void visit(UnknownContextFieldIssue unknownContextFieldIssue) throws IOException {
		out.write("binding ");
		out.write(Integer.toString(unknownContextFieldIssue.getIndex()));
		out.write(" (key ");
		out.write(unknownContextFieldIssue.getBinding().getKey());
		out.write(") has no field ");
		out.write(unknownContextFieldIssue.getField());
		return null;
	}

	@Override
	public Void visit(NotIterableIssue notIterableIssue) throws IOException {
		out.write("expected a mapping or a sequence, got ");
		notIterableIssue.getValue().accept(new DataValueFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(NotScalarIssue notScalarIssue) throws IOException {
		out.write("expected a scalar, got ");
		notScalarIssue.getValue().accept(new DataValueFormattingVisitor(out));
		return null;
	}

	@Override
	public Void visit(MalformedNameIssue malformedNameIssue) throws IOException {
		out.write("expanded name \"");
		out.write(malformedNameIssue.getName());
		out.write("\" is not a valid identifier");
		return null;
	}

	@Override
	public Void visit(ConditionConstructNotAllowedIssue conditionConstructNotAllowedIssue) throws IOException {
		out.write(conditionConstructNotAllowedIssue.getConstruct());
		out.write(" not allowed in template conditions");
		return null;
	}

	@Override
	public Void visit(NestedOrNotAllowedIssue nestedOrNotAllowedIssue) throws IOException {
		out.write("nested || expression ");
		nestedOrNotAllowedIssue.getNestedOr().accept(new CubicleNodeFormattingVisitor(out));
		out.write(" is only allowed inside a || expression");
		return null;
	}

	@Override
	public Void visit(EmptyModelCategoryIssue emptyModelCategoryIssue) throws IOException {
		out.write("expanded model has no ");
		out.write(emptyModelCategoryIssue.getCategory());
		return null;
	}
}
