package ctc.model.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class DataMapping extends DataValue {

	private final Map<String, DataValue> entries;

	public DataMapping(Map<String, DataValue> entries) {
		this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
	}

	public Map<String, DataValue> getEntries() {
		return entries;
	}

	/**
	 * @return the value bound to key, or null if there is none
	 */
	public DataValue get(String key) {
		return entries.get(key);
	}

	@Override
	public <T, E extends Throwable> T accept(DataValueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return entries.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return entries.equals(((DataMapping) obj).entries);
	}

}
