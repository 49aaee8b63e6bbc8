package ctc.model.data;

import java.util.Collections;

/**
 * The data a template is instantiated with. Its root is always a mapping whose keys are
 * the names template arguments refer to.
 */
public class DataEnvironment {

	private final DataMapping root;

	public DataEnvironment(DataMapping root) {
		this.root = root;
	}

	public static DataEnvironment empty() {
		return new DataEnvironment(new DataMapping(Collections.emptyMap()));
	}

	public DataMapping getRoot() {
		return root;
	}

	/**
	 * @return the value of the root key name, or null if the data does not define it
	 */
	public DataValue lookup(String name) {
		return root.get(name);
	}

}
