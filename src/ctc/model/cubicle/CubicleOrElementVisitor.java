package ctc.model.cubicle;

public abstract class CubicleOrElementVisitor<T, E extends Throwable> {
	public abstract T visit(CubicleOrBranch orBranch) throws E;
	public abstract T visit(CubicleOrIterator orIterator) throws E;
}
