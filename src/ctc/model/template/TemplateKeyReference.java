package ctc.model.template;

import ctc.model.cubicle.CubicleNodeVisitor;
import ctc.util.SourceLocation;

import java.util.Objects;

public class TemplateKeyReference extends TemplateReference {

	private final int index;

	public TemplateKeyReference(SourceLocation location, int index) {
		super(location);
		this.index = index;
	}

	public int getIndex() {
		return index;
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
		return Objects.hash(index);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		TemplateKeyReference other = (TemplateKeyReference) obj;
		return index == other.index;
	}

}
