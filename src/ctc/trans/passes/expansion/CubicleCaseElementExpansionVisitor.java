package ctc.trans.passes.expansion;

import ctc.model.cubicle.*;
import ctc.model.template.TemplateContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CubicleCaseElementExpansionVisitor
		extends CubicleCaseElementVisitor<List<CubicleCaseElement>, RuntimeException> {

	private final TemplateInstanceGenerator generator;
	private final TemplateContext context;

	public CubicleCaseElementExpansionVisitor(TemplateInstanceGenerator generator, TemplateContext context) {
		this.generator = generator;
		this.context = context;
	}

	@Override
	public List<CubicleCaseElement> visit(CubicleCase cubicleCase) throws RuntimeException {
		CubicleExpressionExpansionVisitor v = new CubicleExpressionExpansionVisitor(generator, context);
		if (cubicleCase.isWildcard()) {
			return Collections.singletonList(
					new CubicleCase(cubicleCase.getLocation(), null, cubicleCase.getValue().accept(v)));
		}
		List<CubicleBoolExpression> guard = generator.expandAnd(cubicleCase.getGuard(), context);
		if (guard.isEmpty()) {
			return Collections.emptyList();
		}
		return Collections.singletonList(new CubicleCase(cubicleCase.getLocation(),
				TemplateInstanceGenerator.conjunction(cubicleCase.getGuard(), guard), cubicleCase.getValue().accept(v)));
	}

	@Override
	public List<CubicleCaseElement> visit(CubicleCaseIterator caseIterator) throws RuntimeException {
		List<CubicleCaseElement> result = new ArrayList<>();
		for (TemplateContext instance : generator.instances(caseIterator.getDeclaration(), context)) {
			CubicleCaseElementExpansionVisitor v = new CubicleCaseElementExpansionVisitor(generator, instance);
			for (CubicleCaseElement element : caseIterator.getBody()) {
				result.addAll(element.accept(v));
			}
		}
		return result;
	}

}
