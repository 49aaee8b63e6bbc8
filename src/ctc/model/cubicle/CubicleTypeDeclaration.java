package ctc.model.cubicle;

import ctc.model.template.TemplateDeclaration;
import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * type name, or type name = A | B | ... when constructors is non-null.
 */
public class CubicleTypeDeclaration extends CubicleConstruct {

	private final CubicleName name;
	private final List<CubicleEnumElement> constructors;

	public CubicleTypeDeclaration(SourceLocation location, TemplateDeclaration declaration, CubicleName name,
	                              List<CubicleEnumElement> constructors) {
		super(location, declaration);
		this.name = name;
		this.constructors = constructors;
	}

	public CubicleName getName() {
		return name;
	}

	public List<CubicleEnumElement> getConstructors() {
		return constructors;
	}

	public boolean isEnumerated() {
		return constructors != null;
	}

	@Override
	public String getKeyword() {
		return "type";
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getDeclaration(), name, constructors);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleTypeDeclaration other = (CubicleTypeDeclaration) obj;
		return Objects.equals(getDeclaration(), other.getDeclaration()) && Objects.equals(name, other.name) &&
				Objects.equals(constructors, other.constructors);
	}

}
