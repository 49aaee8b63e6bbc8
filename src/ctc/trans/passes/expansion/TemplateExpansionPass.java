package ctc.trans.passes.expansion;

import ctc.errors.Issue;
import ctc.errors.IssueContext;
import ctc.model.cubicle.*;
import ctc.model.data.DataEnvironment;
import ctc.model.template.TemplateContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiFunction;
import java.util.logging.Logger;

/**
 * Instantiates a Cubicle template with its data. Every top-level construct is replicated once per
 * instance of its template declaration, then the template shapes inside it are expanded.
 */
public class TemplateExpansionPass {
	private static final Logger logger = Logger.getLogger("CTC Template Expansion");

	private TemplateExpansionPass() {}

	private static <C extends CubicleConstruct> List<C> replicate(TemplateInstanceGenerator generator,
	                                                              List<C> constructs,
	                                                              BiFunction<C, TemplateContext, C> expand) {
		List<C> result = new ArrayList<>();
		for (C construct : constructs) {
			try {
				List<TemplateContext> instances =
						generator.instances(construct.getDeclaration(), TemplateContext.empty());
				for (TemplateContext instance : instances) {
					C expanded = expand.apply(construct, instance);
					if (expanded != null) {
						result.add(expanded);
					}
				}
			} catch (Issue e) {
				throw e.withContext(new ExpandingConstruct(construct));
			}
		}
		return result;
	}

	private static CubicleTypeDeclaration expandType(TemplateInstanceGenerator generator,
	                                                 CubicleTypeDeclaration type, TemplateContext context) {
		CubicleName name = generator.expandName(type.getName(), context);
		List<CubicleEnumElement> constructors = null;
		if (type.isEnumerated()) {
			constructors = new ArrayList<>();
			CubicleEnumElementExpansionVisitor v = new CubicleEnumElementExpansionVisitor(generator, context);
			for (CubicleEnumElement element : type.getConstructors()) {
				constructors.addAll(element.accept(v));
			}
		}
		return new CubicleTypeDeclaration(type.getLocation(), null, name, constructors);
	}

	private static CubicleVariableDeclaration expandVariable(TemplateInstanceGenerator generator,
	                                                         CubicleVariableDeclaration declaration,
	                                                         TemplateContext context) {
		CubicleReference variable = new CubicleExpressionExpansionVisitor(generator, context)
				.expandReference(declaration.getVariable());
		return new CubicleVariableDeclaration(declaration.getLocation(), null, declaration.getKind(), variable,
				generator.expandName(declaration.getType(), context));
	}

	private static CubicleProcExprConstruct expandProcExpr(TemplateInstanceGenerator generator,
	                                                       CubicleProcExprConstruct construct,
	                                                       TemplateContext context) {
		CubicleOrExpression formula = generator.expandOr(construct.getFormula(), context);
		if (formula.getElements().isEmpty()) {
			return null;
		}
		return new CubicleProcExprConstruct(construct.getLocation(), null, construct.getKind(),
				construct.getProcesses(), formula);
	}

	private static CubicleTransition expandTransition(TemplateInstanceGenerator generator,
	                                                  CubicleTransition transition, TemplateContext context) {
		CubicleName name = generator.expandName(transition.getName(), context);
		CubicleOrExpression guard = null;
		if (transition.getGuard() != null) {
			guard = generator.expandOr(transition.getGuard(), context);
			if (guard.getElements().isEmpty()) {
				guard = null;
			}
		}
		List<CubicleUpdate> updates = new ArrayList<>();
		CubicleUpdateExpansionVisitor v = new CubicleUpdateExpansionVisitor(generator, context);
		for (CubicleUpdate update : transition.getUpdates()) {
			updates.addAll(update.accept(v));
		}
		if (updates.isEmpty()) {
			return null;
		}
		return new CubicleTransition(transition.getLocation(), null, name, transition.getProcesses(), guard, updates);
	}

	private static void checkNotEmpty(IssueContext ctx, List<?> expanded, String category) {
		if (expanded.isEmpty()) {
			ctx.error(new EmptyModelCategoryIssue(category));
		}
	}

	/**
	 * @return the expanded model, or null if an issue was reported to ctx
	 */
	public static CubicleModel perform(IssueContext ctx, CubicleModel model, DataEnvironment data) {
		TemplateInstanceGenerator generator = new TemplateInstanceGenerator(data);
		List<CubicleTypeDeclaration> types;
		List<CubicleVariableDeclaration> declarations;
		List<CubicleProcExprConstruct> init;
		List<CubicleProcExprConstruct> invariants;
		List<CubicleProcExprConstruct> unsafes;
		List<CubicleTransition> transitions;
		try {
			types = replicate(generator, model.getTypes(),
					(type, context) -> expandType(generator, type, context));
			declarations = replicate(generator, model.getDeclarations(),
					(declaration, context) -> expandVariable(generator, declaration, context));
			init = replicate(generator, Collections.singletonList(model.getInit()),
					(construct, context) -> expandProcExpr(generator, construct, context));
			invariants = replicate(generator, model.getInvariants(),
					(construct, context) -> expandProcExpr(generator, construct, context));
			unsafes = replicate(generator, model.getUnsafes(),
					(construct, context) -> expandProcExpr(generator, construct, context));
			transitions = replicate(generator, model.getTransitions(),
					(transition, context) -> expandTransition(generator, transition, context));
		} catch (Issue e) {
			ctx.error(e);
			return null;
		}

		logger.fine("expanded " + model.getTypes().size() + " type(s) into " + types.size());
		logger.fine("expanded " + model.getDeclarations().size() + " declaration(s) into " + declarations.size());
		logger.fine("expanded " + model.getInvariants().size() + " invariant(s) into " + invariants.size());
		logger.fine("expanded " + model.getUnsafes().size() + " unsafe formula(s) into " + unsafes.size());
		logger.fine("expanded " + model.getTransitions().size() + " transition(s) into " + transitions.size());

		checkNotEmpty(ctx, declarations, "variable declaration");
		checkNotEmpty(ctx, init, "init formula");
		checkNotEmpty(ctx, unsafes, "unsafe formula");
		checkNotEmpty(ctx, transitions, "transition");
		if (ctx.hasErrors()) {
			return null;
		}

		return new CubicleModel(model.getLocation(), model.getProcessCount(), types, declarations, init.get(0),
				invariants, unsafes, transitions);
	}

}
