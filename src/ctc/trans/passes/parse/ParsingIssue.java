package ctc.trans.passes.parse;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;
import ctc.parser.TemplateParseException;

public class ParsingIssue extends Issue {

	private final TemplateParseException error;

	public ParsingIssue(TemplateParseException error) {
		initCause(error);
		this.error = error;
	}

	public TemplateParseException getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
