package ctc.model.cubicle;

public abstract class CubicleAssignValueVisitor<T, E extends Throwable> {
	public abstract T visit(CubicleExpressionValue expressionValue) throws E;
	public abstract T visit(CubicleSwitch cubicleSwitch) throws E;
	public abstract T visit(CubicleNondeterministic nondeterministic) throws E;
}
