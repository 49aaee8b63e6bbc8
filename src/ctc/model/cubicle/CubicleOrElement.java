package ctc.model.cubicle;

import ctc.util.SourceLocation;

/**
 * An element of a disjunction: a plain conjunction, or a template iterator replicating a conjunction once
 * per instance, each replica being one more disjunct.
 */
public abstract class CubicleOrElement extends CubicleNode {

	public CubicleOrElement(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(CubicleOrElementVisitor<T, E> v) throws E;

}
