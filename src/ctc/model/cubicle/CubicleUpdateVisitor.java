package ctc.model.cubicle;

public abstract class CubicleUpdateVisitor<T, E extends Throwable> {
	public abstract T visit(CubicleAssignment assignment) throws E;
	public abstract T visit(CubicleUpdateIterator updateIterator) throws E;
}
