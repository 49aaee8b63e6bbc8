package ctc.model.cubicle;

import ctc.model.template.TemplateDeclaration;
import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CubicleEnumIterator extends CubicleEnumElement {

	private final TemplateDeclaration declaration;
	private final List<CubicleEnumElement> body;

	public CubicleEnumIterator(SourceLocation location, TemplateDeclaration declaration, List<CubicleEnumElement> body) {
		super(location);
		this.declaration = declaration;
		this.body = body;
	}

	public TemplateDeclaration getDeclaration() {
		return declaration;
	}

	public List<CubicleEnumElement> getBody() {
		return body;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleEnumElementVisitor<T, E> v) throws E {
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
		CubicleEnumIterator other = (CubicleEnumIterator) obj;
		return Objects.equals(declaration, other.declaration) && Objects.equals(body, other.body);
	}

}
