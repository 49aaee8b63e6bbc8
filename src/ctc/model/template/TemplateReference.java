package ctc.model.template;

import ctc.model.cubicle.CubicleNode;
import ctc.util.SourceLocation;

/**
 * A placeholder resolving either to a root value of the data environment or to a binding of the
 * current template context.
 */
public abstract class TemplateReference extends CubicleNode {

	public TemplateReference(SourceLocation location) {
		super(location);
	}

	public abstract <T, E extends Throwable> T accept(TemplateReferenceVisitor<T, E> v) throws E;

}
