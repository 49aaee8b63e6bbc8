package ctc.trans.passes.expansion;

import ctc.InternalCompilerError;
import ctc.model.cubicle.*;

/**
 * Evaluates an expanded template condition. Conditions compare text: the only allowed
 * comparisons are = and <> between constants and scalar variable names.
 */
public class ExpandedConditionEvaluator extends CubicleBoolExpressionVisitor<Boolean, RuntimeException> {

	private static class OperandTextVisitor extends CubicleExpressionVisitor<String, RuntimeException> {
		@Override
		public String visit(CubicleReference reference) throws RuntimeException {
			if (reference.isArray()) {
				throw new ConditionConstructNotAllowedIssue("arrays");
			}
			return reference.getName().getText();
		}

		@Override
		public String visit(CubicleConstant constant) throws RuntimeException {
			return constant.getValue();
		}

		@Override
		public String visit(CubicleBinop binop) throws RuntimeException {
			throw new ConditionConstructNotAllowedIssue("+/- operations");
		}
	}

	private class BranchEvaluator extends CubicleOrElementVisitor<Boolean, RuntimeException> {
		@Override
		public Boolean visit(CubicleOrBranch orBranch) throws RuntimeException {
			for (CubicleAndElement element : orBranch.getBranch().getElements()) {
				if (!element.accept(new ConjunctEvaluator())) {
					return false;
				}
			}
			return true;
		}

		@Override
		public Boolean visit(CubicleOrIterator orIterator) throws RuntimeException {
			throw new InternalCompilerError("|| iterator left in expanded condition");
		}
	}

	private class ConjunctEvaluator extends CubicleAndElementVisitor<Boolean, RuntimeException> {
		@Override
		public Boolean visit(CubicleAndTerm andTerm) throws RuntimeException {
			return andTerm.getExpression().accept(ExpandedConditionEvaluator.this);
		}

		@Override
		public Boolean visit(CubicleAndNestedOr andNestedOr) throws RuntimeException {
			throw new InternalCompilerError("nested || left in expanded condition");
		}

		@Override
		public Boolean visit(CubicleAndIterator andIterator) throws RuntimeException {
			throw new InternalCompilerError("&& iterator left in expanded condition");
		}
	}

	/**
	 * @return whether some branch of the condition holds; false for a condition with no branch
	 */
	public boolean evaluate(CubicleOrExpression condition) {
		for (CubicleOrElement element : condition.getElements()) {
			if (element.accept(new BranchEvaluator())) {
				return true;
			}
		}
		return false;
	}

	@Override
	public Boolean visit(CubicleComparison comparison) throws RuntimeException {
		String operator = comparison.getOperator();
		if (!operator.equals("=") && !operator.equals("<>")) {
			throw new ConditionConstructNotAllowedIssue(operator + " operations");
		}
		String lhs = comparison.getLhs().accept(new OperandTextVisitor());
		String rhs = comparison.getRhs().accept(new OperandTextVisitor());
		return operator.equals("=") == lhs.equals(rhs);
	}

	@Override
	public Boolean visit(CubicleForallOther forallOther) throws RuntimeException {
		throw new ConditionConstructNotAllowedIssue("forall_other constructs");
	}

}
