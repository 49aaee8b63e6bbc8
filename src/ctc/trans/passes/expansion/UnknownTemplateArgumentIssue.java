package ctc.trans.passes.expansion;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;
import ctc.model.template.TemplateArgument;

public class UnknownTemplateArgumentIssue extends Issue {

	private final TemplateArgument argument;

	public UnknownTemplateArgumentIssue(TemplateArgument argument) {
		this.argument = argument;
	}

	public TemplateArgument getArgument() {
		return argument;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
