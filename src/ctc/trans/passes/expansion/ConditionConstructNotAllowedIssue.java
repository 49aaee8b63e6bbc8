package ctc.trans.passes.expansion;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;

/**
 * A template condition used a construct other than = or <> between constants and scalar variables.
 */
public class ConditionConstructNotAllowedIssue extends Issue {

	private final String construct;

	public ConditionConstructNotAllowedIssue(String construct) {
		this.construct = construct;
	}

	public String getConstruct() {
		return construct;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
