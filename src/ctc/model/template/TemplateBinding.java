package ctc.model.template;

import ctc.model.data.DataValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One element chosen from an iterated collection: its key, and the fields of its value when
 * that value was a mapping.
 */
public class TemplateBinding {

	private final String key;
	private final Map<String, DataValue> fields;

	public TemplateBinding(String key, Map<String, DataValue> fields) {
		this.key = key;
		this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
	}

	public String getKey() {
		return key;
	}

	public Map<String, DataValue> getFields() {
		return fields;
	}

	@Override
	public int hashCode() {
		return Objects.hash(key, fields);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		TemplateBinding other = (TemplateBinding) obj;
		return key.equals(other.key) && fields.equals(other.fields);
	}

	@Override
	public String toString() {
		return key + fields;
	}

}
