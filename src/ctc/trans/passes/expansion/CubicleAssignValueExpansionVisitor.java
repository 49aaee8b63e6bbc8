package ctc.trans.passes.expansion;

import ctc.model.cubicle.*;
import ctc.model.template.TemplateContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Expands the right-hand side of an assignment. A switch whose cases all vanished yields null.
 */
public class CubicleAssignValueExpansionVisitor
		extends CubicleAssignValueVisitor<CubicleAssignValue, RuntimeException> {

	private final TemplateInstanceGenerator generator;
	private final TemplateContext context;

	public CubicleAssignValueExpansionVisitor(TemplateInstanceGenerator generator, TemplateContext context) {
		this.generator = generator;
		this.context = context;
	}

	@Override
	public CubicleAssignValue visit(CubicleExpressionValue expressionValue) throws RuntimeException {
		return new CubicleExpressionValue(expressionValue.getLocation(),
				expressionValue.getExpression().accept(new CubicleExpressionExpansionVisitor(generator, context)));
	}

	@Override
	public CubicleAssignValue visit(CubicleSwitch cubicleSwitch) throws RuntimeException {
		List<CubicleCaseElement> cases = new ArrayList<>();
		CubicleCaseElementExpansionVisitor v = new CubicleCaseElementExpansionVisitor(generator, context);
		for (CubicleCaseElement element : cubicleSwitch.getCases()) {
			cases.addAll(element.accept(v));
		}
		if (cases.isEmpty()) {
			return null;
		}
		return new CubicleSwitch(cubicleSwitch.getLocation(), cases);
	}

	@Override
	public CubicleAssignValue visit(CubicleNondeterministic nondeterministic) throws RuntimeException {
		return nondeterministic;
	}

}
