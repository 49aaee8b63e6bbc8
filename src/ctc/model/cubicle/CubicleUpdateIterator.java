package ctc.model.cubicle;

import ctc.model.template.TemplateDeclaration;
import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CubicleUpdateIterator extends CubicleUpdate {

	private final TemplateDeclaration declaration;
	private final List<CubicleUpdate> body;

	public CubicleUpdateIterator(SourceLocation location, TemplateDeclaration declaration, List<CubicleUpdate> body) {
		super(location);
		this.declaration = declaration;
		this.body = body;
	}

	public TemplateDeclaration getDeclaration() {
		return declaration;
	}

	public List<CubicleUpdate> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleUpdateVisitor<T, E> v) throws E {
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
		CubicleUpdateIterator other = (CubicleUpdateIterator) obj;
		return Objects.equals(declaration, other.declaration) && Objects.equals(body, other.body);
	}

}
