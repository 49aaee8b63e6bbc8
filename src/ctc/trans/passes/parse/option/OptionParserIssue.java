package ctc.trans.passes.parse.option;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;

public class OptionParserIssue extends Issue {

	private final String error;

	public OptionParserIssue(String error) {
		this.error = error;
	}

	public String getError() {
		return error;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
