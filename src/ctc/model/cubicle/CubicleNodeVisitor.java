package ctc.model.cubicle;

import ctc.model.template.TemplateArgument;
import ctc.model.template.TemplateDeclaration;
import ctc.model.template.TemplateFieldReference;
import ctc.model.template.TemplateKeyReference;

public abstract class CubicleNodeVisitor<T, E extends Throwable> {
	public abstract T visit(CubicleModel model) throws E;
	public abstract T visit(CubicleTypeDeclaration typeDeclaration) throws E;
	public abstract T visit(CubicleVariableDeclaration variableDeclaration) throws E;
	public abstract T visit(CubicleProcExprConstruct procExprConstruct) throws E;
	public abstract T visit(CubicleTransition transition) throws E;
	public abstract T visit(CubicleEnumName enumName) throws E;
	public abstract T visit(CubicleEnumIterator enumIterator) throws E;
	public abstract T visit(CubicleAssignment assignment) throws E;
	public abstract T visit(CubicleUpdateIterator updateIterator) throws E;
	public abstract T visit(CubicleExpressionValue expressionValue) throws E;
	public abstract T visit(CubicleSwitch cubicleSwitch) throws E;
	public abstract T visit(CubicleNondeterministic nondeterministic) throws E;
	public abstract T visit(CubicleCase cubicleCase) throws E;
	public abstract T visit(CubicleCaseIterator caseIterator) throws E;
	public abstract T visit(CubicleOrExpression orExpression) throws E;
	public abstract T visit(CubicleOrBranch orBranch) throws E;
	public abstract T visit(CubicleOrIterator orIterator) throws E;
	public abstract T visit(CubicleAndExpression andExpression) throws E;
	public abstract T visit(CubicleAndTerm andTerm) throws E;
	public abstract T visit(CubicleAndNestedOr andNestedOr) throws E;
	public abstract T visit(CubicleAndIterator andIterator) throws E;
	public abstract T visit(CubicleComparison comparison) throws E;
	public abstract T visit(CubicleForallOther forallOther) throws E;
	public abstract T visit(CubicleReference reference) throws E;
	public abstract T visit(CubicleConstant constant) throws E;
	public abstract T visit(CubicleBinop binop) throws E;
	public abstract T visit(CubicleName name) throws E;
	public abstract T visit(TemplateDeclaration templateDeclaration) throws E;
	public abstract T visit(TemplateArgument templateArgument) throws E;
	public abstract T visit(TemplateKeyReference templateKeyReference) throws E;
	public abstract T visit(TemplateFieldReference templateFieldReference) throws E;
}
