package ctc.model.cubicle;

import ctc.util.SourceLocation;

/**
 * An element of a conjunction: a boolean expression, a parenthesized disjunction, or a template iterator
 * replicating a conjunction once per instance.
 */
public abstract class CubicleAndElement extends CubicleNode {

	public CubicleAndElement(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CubicleAndElementVisitor<T, E> v) throws E;

}
