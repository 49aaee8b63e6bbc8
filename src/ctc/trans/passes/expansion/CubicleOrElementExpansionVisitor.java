package ctc.trans.passes.expansion;

import ctc.model.cubicle.CubicleBoolExpression;
import ctc.model.cubicle.CubicleOrBranch;
import ctc.model.cubicle.CubicleOrElementVisitor;
import ctc.model.cubicle.CubicleOrIterator;
import ctc.model.template.TemplateContext;

import java.util.ArrayList;
import java.util.List;

public class CubicleOrElementExpansionVisitor
		extends CubicleOrElementVisitor<List<List<CubicleBoolExpression>>, RuntimeException> {

	private final TemplateInstanceGenerator generator;
	private final TemplateContext context;

	public CubicleOrElementExpansionVisitor(TemplateInstanceGenerator generator, TemplateContext context) {
		this.generator = generator;
		this.context = context;
	}

	@Override
	public List<List<CubicleBoolExpression>> visit(CubicleOrBranch orBranch) throws RuntimeException {
		return CubicleAndElementDistributingVisitor.distribute(generator, orBranch.getBranch(), context);
	}

	@Override
	public List<List<CubicleBoolExpression>> visit(CubicleOrIterator orIterator) throws RuntimeException {
		List<List<CubicleBoolExpression>> branches = new ArrayList<>();
		for (TemplateContext instance : generator.instances(orIterator.getDeclaration(), context)) {
			branches.addAll(CubicleAndElementDistributingVisitor.distribute(generator, orIterator.getBody(), instance));
		}
		return branches;
	}

}
