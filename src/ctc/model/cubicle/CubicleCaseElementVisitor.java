package ctc.model.cubicle;

public abstract class CubicleCaseElementVisitor<T, E extends Throwable> {
	public abstract T visit(CubicleCase cubicleCase) throws E;
	public abstract T visit(CubicleCaseIterator caseIterator) throws E;
}
