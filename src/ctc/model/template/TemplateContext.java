package ctc.model.template;

import ctc.model.data.DataScalar;
import ctc.model.data.DataValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An instance: the ordered bindings made by enclosing template declarations. Contexts are
 * immutable; extending one creates a new context.
 */
public class TemplateContext {

	private static final TemplateContext EMPTY = new TemplateContext(Collections.emptyList());

	private final List<TemplateBinding> bindings;

	private TemplateContext(List<TemplateBinding> bindings) {
		this.bindings = bindings;
	}

	public static TemplateContext empty() {
		return EMPTY;
	}

	public TemplateContext extend(TemplateBinding binding) {
		List<TemplateBinding> extended = new ArrayList<>(bindings.size() + 1);
		extended.addAll(bindings);
		extended.add(binding);
		return new TemplateContext(Collections.unmodifiableList(extended));
	}

	public List<TemplateBinding> getBindings() {
		return bindings;
	}

	public int size() {
		return bindings.size();
	}

	public TemplateBinding getBinding(int index) {
		if (index < 0 || index >= bindings.size()) {
			throw new UndefinedContextIndexIssue(index, bindings.size());
		}
		return bindings.get(index);
	}

	public DataValue getKey(int index) {
		return new DataScalar(getBinding(index).getKey());
	}

	public DataValue getField(int index, String field) {
		TemplateBinding binding = getBinding(index);
		DataValue value = binding.getFields().get(field);
		if (value == null) {
			throw new UnknownContextFieldIssue(index, field, binding);
		}
		return value;
	}

	@Override
	public int hashCode() {
		return bindings.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return bindings.equals(((TemplateContext) obj).bindings);
	}

	@Override
	public String toString() {
		return "TemplateContext " + bindings;
	}

}
