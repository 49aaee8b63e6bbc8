package ctc.model.cubicle;

import ctc.model.template.TemplateDeclaration;
import ctc.util.SourceLocation;

import java.util.Objects;

public class CubicleAndIterator extends CubicleAndElement {

	private final TemplateDeclaration declaration;
	private final CubicleAndExpression body;

	public CubicleAndIterator(SourceLocation location, TemplateDeclaration declaration, CubicleAndExpression body) {
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
	public <T, E extends Throwable> T accept(CubicleAndElementVisitor<T, E> v) throws E {
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
		CubicleAndIterator other = (CubicleAndIterator) obj;
		return Objects.equals(declaration, other.declaration) && Objects.equals(body, other.body);
	}

}
