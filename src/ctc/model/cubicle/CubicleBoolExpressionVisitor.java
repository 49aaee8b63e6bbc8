package ctc.model.cubicle;

public abstract class CubicleBoolExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(CubicleComparison comparison) throws E;
	public abstract T visit(CubicleForallOther forallOther) throws E;
}
