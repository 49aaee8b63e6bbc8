package ctc.trans.passes.expansion;

import ctc.errors.Context;
import ctc.errors.ContextVisitor;
import ctc.model.cubicle.CubicleConstruct;

public class ExpandingConstruct extends Context {

	private final CubicleConstruct construct;

	public ExpandingConstruct(CubicleConstruct construct) {
		this.construct = construct;
	}

	public CubicleConstruct getConstruct() {
		return construct;
	}

	@Override
	public <T, E extends Throwable> T accept(ContextVisitor<T, E> v) throws E {
		return v.visit(this);
	}

}
