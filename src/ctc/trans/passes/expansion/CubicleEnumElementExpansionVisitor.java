package ctc.trans.passes.expansion;

import ctc.model.cubicle.*;
import ctc.model.template.TemplateContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CubicleEnumElementExpansionVisitor
		extends CubicleEnumElementVisitor<List<CubicleEnumElement>, RuntimeException> {

	private final TemplateInstanceGenerator generator;
	private final TemplateContext context;

	public CubicleEnumElementExpansionVisitor(TemplateInstanceGenerator generator, TemplateContext context) {
		this.generator = generator;
		this.context = context;
	}

	@Override
	public List<CubicleEnumElement> visit(CubicleEnumName enumName) throws RuntimeException {
		return Collections.singletonList(
				new CubicleEnumName(enumName.getLocation(), generator.expandName(enumName.getName(), context)));
	}

	@Override
	public List<CubicleEnumElement> visit(CubicleEnumIterator enumIterator) throws RuntimeException {
		List<CubicleEnumElement> result = new ArrayList<>();
		for (TemplateContext instance : generator.instances(enumIterator.getDeclaration(), context)) {
			CubicleEnumElementExpansionVisitor v = new CubicleEnumElementExpansionVisitor(generator, instance);
			for (CubicleEnumElement element : enumIterator.getBody()) {
				result.addAll(element.accept(v));
			}
		}
		return result;
	}

}
