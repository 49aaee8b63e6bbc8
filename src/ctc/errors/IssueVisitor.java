package ctc.errors;

import ctc.model.template.UndefinedContextIndexIssue;
import ctc.model.template.UnknownContextFieldIssue;
import ctc.trans.intermediate.IOErrorIssue;
import ctc.trans.passes.data.DataFormatIssue;
import ctc.trans.passes.expansion.*;
import ctc.trans.passes.parse.ParsingIssue;
import ctc.trans.passes.parse.option.OptionParserIssue;

public abstract class IssueVisitor<T, E extends Throwable> {
	public abstract T visit(IssueWithContext issueWithContext) throws E;
	public abstract T visit(IOErrorIssue ioErrorIssue) throws E;
	public abstract T visit(OptionParserIssue optionParserIssue) throws E;
	public abstract T visit(ParsingIssue parsingIssue) throws E;
	public abstract T visit(DataFormatIssue dataFormatIssue) throws E;
	public abstract T visit(UnknownTemplateArgumentIssue unknownTemplateArgumentIssue) throws E;
	public abstract T visit(UndefinedContextIndexIssue undefinedContextIndexIssue) throws E;
	public abstract T visit(UnknownContextFieldIssue unknownContextFieldIssue) throws E;
	public abstract T visit(NotIterableIssue notIterableIssue) throws E;
	public abstract T visit(NotScalarIssue notScalarIssue) throws E;
	public abstract T visit(MalformedNameIssue malformedNameIssue) throws E;
	public abstract T visit(ConditionConstructNotAllowedIssue conditionConstructNotAllowedIssue) throws E;
	public abstract T visit(NestedOrNotAllowedIssue nestedOrNotAllowedIssue) throws E;
	public abstract T visit(EmptyModelCategoryIssue emptyModelCategoryIssue) throws E;
}
