package ctc.trans.passes.expansion;

import ctc.model.cubicle.*;
import ctc.model.template.TemplateContext;

import java.util.ArrayList;
import java.util.List;

public class CubicleExpressionExpansionVisitor extends CubicleExpressionVisitor<CubicleExpression, RuntimeException> {

	private final TemplateInstanceGenerator generator;
	private final TemplateContext context;

	public CubicleExpressionExpansionVisitor(TemplateInstanceGenerator generator, TemplateContext context) {
		this.generator = generator;
		this.context = context;
	}

	public CubicleReference expandReference(CubicleReference reference) {
		List<CubicleName> indices = new ArrayList<>();
		for (CubicleName index : reference.getIndices()) {
			indices.add(generator.expandName(index, context));
		}
		return new CubicleReference(
				reference.getLocation(), generator.expandName(reference.getName(), context), indices);
	}

	@Override
	public CubicleExpression visit(CubicleReference reference) throws RuntimeException {
		return expandReference(reference);
	}

	@Override
	public CubicleExpression visit(CubicleConstant constant) throws RuntimeException {
		return constant;
	}

	@Override
	public CubicleExpression visit(CubicleBinop binop) throws RuntimeException {
		return new CubicleBinop(binop.getLocation(), binop.getLhs().accept(this), binop.getOperator(),
				binop.getRhs().accept(this));
	}

}
