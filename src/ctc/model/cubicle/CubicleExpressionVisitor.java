package ctc.model.cubicle;

public abstract class CubicleExpressionVisitor<T, E extends Throwable> {
	public abstract T visit(CubicleReference reference) throws E;
	public abstract T visit(CubicleConstant constant) throws E;
	public abstract T visit(CubicleBinop binop) throws E;
}
