package ctc.model.template;

import ctc.model.cubicle.CubicleNodeVisitor;
import ctc.util.SourceLocation;

import java.util.Objects;

public class TemplateFieldReference extends TemplateReference {

	private final int index;
	private final String field;

	public TemplateFieldReference(SourceLocation location, int index, String field) {
		super(location);
		this.index = index;
		this.field = field;
	}

	public int getIndex() {
		return index;
	}

	public String getField() {
		return field;
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
		return Objects.hash(index, field);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		TemplateFieldReference other = (TemplateFieldReference) obj;
		return index == other.index && Objects.equals(field, other.field);
	}

}
