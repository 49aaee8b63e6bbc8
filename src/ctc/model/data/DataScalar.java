package ctc.model.data;

/**
 * A leaf of the data environment, kept as the text it is substituted and compared with.
 */
public class DataScalar extends DataValue {

	private final String text;

	public DataScalar(String text) {
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T, E extends Throwable> T accept(DataValueVisitor<T, E> v) throws E {
		return v.visit(this);
	}

	@Override
	public int hashCode() {
		return text.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (obj == null || getClass() != obj.getClass()) {
			return false;
		}
		return text.equals(((DataScalar) obj).text);
	}

}
