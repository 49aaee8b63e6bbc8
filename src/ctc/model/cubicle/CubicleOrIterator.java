package ctc.model.cubicle;

import ctc.model.template.TemplateDeclaration;
import ctc.util.SourceLocation;

import java.util.Objects;

public class CubicleOrIterator extends CubicleOrElement {

	private final TemplateDeclaration declaration;
	private final CubicleAndExpression body;

	public CubicleOrIterator(SourceLocation location, TemplateDeclaration declaration, CubicleAndExpression body) {
		super(location);
		this.declaration = declaration;
		this.body = body;
	}

	public TemplateDeclaration getDeclaration() {
		return declaration;
	}

	public CubicleAndExpression getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleOrElementVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(declaration, body);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleOrIterator other = (CubicleOrIterator) obj;
		return Objects.equals(declaration, other.declaration) && Objects.equals(body, other.body);
	}

}
