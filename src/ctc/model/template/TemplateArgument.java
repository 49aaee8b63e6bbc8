package ctc.model.template;

import ctc.model.cubicle.CubicleNodeVisitor;
import ctc.util.SourceLocation;

import java.util.Objects;

public class TemplateArgument extends TemplateReference {

	private final String name;

	public TemplateArgument(SourceLocation location, String name) {
		super(location);
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T, E extends Throwable> T accept(TemplateReferenceVisitor<T, E> v) throws E {
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
		TemplateArgument other = (TemplateArgument) obj;
		return Objects.equals(name, other.name);
	}

}
