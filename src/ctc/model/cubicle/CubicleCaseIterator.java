package ctc.model.cubicle;

import ctc.model.template.TemplateDeclaration;
import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CubicleCaseIterator extends CubicleCaseElement {

	private final TemplateDeclaration declaration;
	private final List<CubicleCaseElement> body;

	public CubicleCaseIterator(SourceLocation location, TemplateDeclaration declaration, List<CubicleCaseElement> body) {
		super(location);
		this.declaration = declaration;
		this.body = body;
	}

	public TemplateDeclaration getDeclaration() {
		return declaration;
	}

	public List<CubicleCaseElement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleCaseElementVisitor<T, E> v) throws E {
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
		CubicleCaseIterator other = (CubicleCaseIterator) obj;
		return Objects.equals(declaration, other.declaration) && Objects.equals(body, other.body);
	}

}
