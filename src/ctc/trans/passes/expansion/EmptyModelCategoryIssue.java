package ctc.trans.passes.expansion;

import ctc.errors.Issue;
import ctc.errors.IssueVisitor;

/**
 * The expanded model lacks a mandatory part, e.g. it has no transition left.
 */
public class EmptyModelCategoryIssue extends Issue {

	private final String category;

	public EmptyModelCategoryIssue(String category) {
		this.category = category;
	}

	public String getCategory() {
		return category;
	}

	@Override
	public <T, E extends Throwable> T accept(IssueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
