package ctc.model.data;

import java.util.Collections;
import java.util.List;
import java.util.ArrayList;

public class DataSequence extends DataValue {

	private final List<DataValue> elements;

	public DataSequence(List<DataValue> elements) {
		this.elements = Collections.unmodifiableList(new ArrayList<>(elements));
	}

	public List<DataValue> getElements() {
		return elements;
	}

	@Override
	public <T, E extends Throwable> T accept(DataValueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return elements.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return elements.equals(((DataSequence) obj).elements);
	}

}
