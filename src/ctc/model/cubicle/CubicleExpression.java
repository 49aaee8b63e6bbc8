package ctc.model.cubicle;

import ctc.util.SourceLocation;

/**
 * Operand of a comparison: a reference, a constant or a single +/- operation.
 */
public abstract class CubicleExpression extends CubicleNode {

	public CubicleExpression(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CubicleExpressionVisitor<T, E> v) throws E;

}
