package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

public class CubicleReference extends CubicleExpression {

	private final CubicleName name;
	private final List<CubicleName> indices;

	public CubicleReference(SourceLocation location, CubicleName name, List<CubicleName> indices) {
		super(location);
		this.name = name;
		this.indices = indices;
	}

	public CubicleName getName() {
		return name;
	}

	public List<CubicleName> getIndices() {
		return indices;
	}

	public boolean isArray() {
		return !indices.isEmpty();
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleExpressionVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, indices);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleReference other = (CubicleReference) obj;
		return Objects.equals(name, other.name) && Objects.equals(indices, other.indices);
	}

}
