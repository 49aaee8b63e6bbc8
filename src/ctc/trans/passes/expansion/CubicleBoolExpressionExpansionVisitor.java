package ctc.trans.passes.expansion;

import ctc.model.cubicle.*;
import ctc.model.template.TemplateContext;

/**
 * Expands names inside a boolean expression. Returns null when the expression vanishes, which
 * happens to a forall_other whose formula expanded to no branch.
 */
public class CubicleBoolExpressionExpansionVisitor
		extends CubicleBoolExpressionVisitor<CubicleBoolExpression, RuntimeException> {

	private final TemplateInstanceGenerator generator;
	private final TemplateContext context;

	public CubicleBoolExpressionExpansionVisitor(TemplateInstanceGenerator generator, TemplateContext context) {
		this.generator = generator;
		this.context = context;
	}

	@Override
	public CubicleComparison visit(CubicleComparison comparison) throws RuntimeException {
		CubicleExpressionExpansionVisitor v = new CubicleExpressionExpansionVisitor(generator, context);
		return new CubicleComparison(comparison.getLocation(), comparison.getLhs().accept(v),
				comparison.getOperator(), comparison.getRhs().accept(v));
	}

	@Override
	public CubicleBoolExpression visit(CubicleForallOther forallOther) throws RuntimeException {
		if (!forallOther.hasFormula()) {
			return new CubicleForallOther(forallOther.getLocation(), forallOther.getProcess(),
					visit(forallOther.getComparison()));
		}
		CubicleOrExpression formula = generator.expandOr(forallOther.getFormula(), context);
		if (formula.getElements().isEmpty()) {
			return null;
		}
		return new CubicleForallOther(forallOther.getLocation(), forallOther.getProcess(), formula);
	}

}
