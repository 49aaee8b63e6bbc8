package ctc.model.template;

import ctc.model.cubicle.CubicleNode;
import ctc.model.cubicle.CubicleNodeVisitor;
import ctc.model.cubicle.CubicleOrExpression;
import ctc.util.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * @arg0, arg1, ... | condition@ : requests one replica of the following subtree per combination
 * of the argument collections that satisfies the condition.
 */
public class TemplateDeclaration extends CubicleNode {

	private final List<TemplateReference> arguments;
	private final CubicleOrExpression condition;

	public TemplateDeclaration(SourceLocation location, List<TemplateReference> arguments,
	                           CubicleOrExpression condition) {
		super(location);
		this.arguments = arguments;
		this.condition = condition;
	}

	public List<TemplateReference> getArguments() {
		return arguments;
	}

	/**
	 * @return the filtering condition, or null if every combination is kept
	 */
	public CubicleOrExpression getCondition() {
		return condition;
	}

	@Override
	public <T, E extends Throwable> T accept(CubicleNodeVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return Objects.hash(arguments, condition);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		TemplateDeclaration other = (TemplateDeclaration) obj;
		return Objects.equals(arguments, other.arguments) && Objects.equals(condition, other.condition);
	}

}
