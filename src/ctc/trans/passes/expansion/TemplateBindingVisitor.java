package ctc.trans.passes.expansion;

import ctc.model.data.DataMapping;
import ctc.model.data.DataScalar;
import ctc.model.data.DataSequence;
import ctc.model.data.DataValue;
import ctc.model.data.DataValueVisitor;
import ctc.model.template.TemplateBinding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Turns an iterated collection into bindings, sorted by key text.
 *
 * An entry k: {f: ...} of a mapping binds key k with the fields of its value; any other value v
 * is exposed as the single field "value". A sequence element must be a scalar and becomes a key
 * without fields.
 */
public class TemplateBindingVisitor extends DataValueVisitor<List<TemplateBinding>, RuntimeException> {

	public static final String VALUE_FIELD = "value";

	private static List<TemplateBinding> sorted(List<TemplateBinding> bindings) {
		bindings.sort(Comparator.comparing(TemplateBinding::getKey));
		return bindings;
	}

	@Override
	public List<TemplateBinding> visit(DataMapping dataMapping) throws RuntimeException {
		List<TemplateBinding> bindings = new ArrayList<>();
		for (Map.Entry<String, DataValue> entry : dataMapping.getEntries().entrySet()) {
			DataValue value = entry.getValue();
			if (value instanceof DataMapping) {
				bindings.add(new TemplateBinding(entry.getKey(), ((DataMapping) value).getEntries()));
			} else {
				bindings.add(new TemplateBinding(entry.getKey(), Collections.singletonMap(VALUE_FIELD, value)));
			}
		}
		return sorted(bindings);
	}

	@Override
	public List<TemplateBinding> visit(DataSequence dataSequence) throws RuntimeException {
		List<TemplateBinding> bindings = new ArrayList<>();
		for (DataValue element : dataSequence.getElements()) {
			if (!(element instanceof DataScalar)) {
				throw new NotScalarIssue(element);
			}
			bindings.add(new TemplateBinding(((DataScalar) element).getText(), Collections.emptyMap()));
		}
		return sorted(bindings);
	}

	@Override
	public List<TemplateBinding> visit(DataScalar dataScalar) throws RuntimeException {
		throw new NotIterableIssue(dataScalar);
	}

}
