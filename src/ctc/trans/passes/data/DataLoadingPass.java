package ctc.trans.passes.data;

import ctc.errors.Issue;
import ctc.model.data.DataEnvironment;
import ctc.model.data.DataMapping;
import ctc.model.data.DataScalar;
import ctc.model.data.DataSequence;
import ctc.model.data.DataValue;
import ctc.trans.intermediate.IOErrorIssue;
import org.apache.commons.io.FileUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the JSON data of a template. Objects become mappings, arrays become sequences and
 * everything else becomes a scalar holding its JSON text.
 */
public class DataLoadingPass {
	private DataLoadingPass() {}

	private static DataValue convert(Object value) {
		if (value instanceof JSONObject) {
			JSONObject object = (JSONObject) value;
			Map<String, DataValue> entries = new LinkedHashMap<>();
			for (String key : object.keySet()) {
				entries.put(key, convert(object.get(key)));
			}
			return new DataMapping(entries);
		}
		if (value instanceof JSONArray) {
			JSONArray array = (JSONArray) value;
			List<DataValue> elements = new ArrayList<>();
			for (int i = 0; i < array.length(); ++i) {
				elements.add(convert(array.get(i)));
			}
			return new DataSequence(elements);
		}
		// JSONObject.NULL prints as "null"
		return new DataScalar(value.toString());
	}

	public static DataEnvironment read(CharSequence contents) throws Issue {
		Object root;
		try {
			JSONTokener tokener = new JSONTokener(contents.toString());
			root = tokener.nextValue();
			if (tokener.nextClean() != 0) {
				throw new DataFormatIssue("unexpected content after the JSON document");
			}
		} catch (JSONException e) {
			throw new DataFormatIssue(e.getMessage());
		}
		if (!(root instanceof JSONObject)) {
			throw new DataFormatIssue("the root of the data must be an object");
		}
		return new DataEnvironment((DataMapping) convert(root));
	}

	/**
	 * @param dataFilePath the JSON file, or null for an empty environment
	 */
	public static DataEnvironment perform(Path dataFilePath) throws Issue {
		if (dataFilePath == null) {
			return DataEnvironment.empty();
		}
		String contents;
		try {
			contents = FileUtils.readFileToString(dataFilePath.toFile(), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new IOErrorIssue(e);
		}
		return read(contents);
	}
}
