package ctc.model.cubicle;

import ctc.util.SourceLocation;

public abstract class CubicleBoolExpression extends CubicleNode {

	public CubicleBoolExpression(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CubicleBoolExpressionVisitor<T, E> v) throws E;

}
