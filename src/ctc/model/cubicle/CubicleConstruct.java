package ctc.model.cubicle;

import ctc.model.template.TemplateDeclaration;
import ctc.util.SourceLocation;

/**
 * A top-level construct of a model. It may be preceded by a template declaration, in which
 * case it is replicated once per instance of that declaration.
 */
public abstract class CubicleConstruct extends CubicleNode {

	private final TemplateDeclaration declaration;

	public CubicleConstruct(SourceLocation location, TemplateDeclaration declaration) {
		super(location);
		this.declaration = declaration;
	}

	/**
	 * @return the outer template declaration, or null if the construct is not replicated
	 */
	public TemplateDeclaration getDeclaration() {
		return declaration;
	}

	/**
	 * @return the keyword introducing the construct, used in messages
	 */
	public abstract String getKeyword();

}
