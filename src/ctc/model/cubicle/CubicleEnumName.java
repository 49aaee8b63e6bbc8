package ctc.model.cubicle;

import ctc.util.SourceLocation;

import java.util.Objects;

public class CubicleEnumName extends CubicleEnumElement {

	private final CubicleName name;

	public CubicleEnumName(SourceLocation location, CubicleName name) {
		super(location);
		this.name = name;
	}

	public CubicleName getName() {
		return name;
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
		return Objects.hash(name);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleEnumName other = (CubicleEnumName) obj;
		return Objects.equals(name, other.name);
	}

}
