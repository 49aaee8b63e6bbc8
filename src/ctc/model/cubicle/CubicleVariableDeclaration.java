package ctc.model.cubicle;

import ctc.model.template.TemplateDeclaration;
import ctc.util.SourceLocation;

import java.util.Objects;

public class CubicleVariableDeclaration extends CubicleConstruct {

	public enum Kind {
		VAR("var"),
		ARRAY("array"),
		CONST("const");

		private final String keyword;

		Kind(String keyword) {
			this.keyword = keyword;
		}

		public String getKeyword() {
			return keyword;
		}

		public static Kind fromKeyword(String keyword) {
			for (Kind kind : values()) {
				if (kind.keyword.equals(keyword)) {
					return kind;
				}
			}
			return null;
		}
	}

	private final Kind kind;
	private final CubicleReference variable;
	private final CubicleName type;

	public CubicleVariableDeclaration(SourceLocation location, TemplateDeclaration declaration, Kind kind,
	                                  CubicleReference variable, CubicleName type) {
		super(location, declaration);
		this.kind = kind;
		this.variable = variable;
		this.type = type;
	}

	public Kind getKind() {
		return kind;
	}

	public CubicleReference getVariable() {
		return variable;
	}

	public CubicleName getType() {
		return type;
	}

	@Override
	public String getKeyword() {
		return kind.getKeyword();
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getDeclaration(), kind, variable, type);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		CubicleVariableDeclaration other = (CubicleVariableDeclaration) obj;
		return Objects.equals(getDeclaration(), other.getDeclaration()) && kind == other.kind &&
				Objects.equals(variable, other.variable) && Objects.equals(type, other.type);
	}

}
