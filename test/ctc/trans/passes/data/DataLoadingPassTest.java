package ctc.trans.passes.data;

import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.Test;

import ctc.model.data.DataEnvironment;
import ctc.model.data.DataMapping;
import ctc.model.data.DataScalar;
import ctc.model.data.DataSequence;
import ctc.model.data.DataValue;

public class DataLoadingPassTest {

	@Test
	public void convertsJsonValues() {
		DataEnvironment data = DataLoadingPass.read(
				"{\"procs\": [\"A\", \"B\"], \"n\": 3, \"flag\": true, \"none\": null, " +
				"\"nodes\": {\"x\": {\"next\": \"y\"}}}");

		assertThat(data.lookup("procs"), is(new DataSequence(Arrays.asList(new DataScalar("A"), new DataScalar("B")))));
		assertThat(data.lookup("n"), is(new DataScalar("3")));
		assertThat(data.lookup("flag"), is(new DataScalar("true")));
		assertThat(data.lookup("none"), is(new DataScalar("null")));

		Map<String, DataValue> node = new LinkedHashMap<>();
		node.put("next", new DataScalar("y"));
		Map<String, DataValue> nodes = new LinkedHashMap<>();
		nodes.put("x", new DataMapping(node));
		assertThat(data.lookup("nodes"), is(new DataMapping(nodes)));

		assertThat(data.lookup("missing"), is(nullValue()));
	}

	@Test
	public void noFileMeansNoData() {
		assertThat(DataLoadingPass.perform(null).getRoot().getEntries().isEmpty(), is(true));
	}

	@Test(expected = DataFormatIssue.class)
	public void rejectsArrayRoot() {
		DataLoadingPass.read("[1, 2]");
	}

	@Test(expected = DataFormatIssue.class)
	public void rejectsScalarRoot() {
		DataLoadingPass.read("\"A\"");
	}

	@Test(expected = DataFormatIssue.class)
	public void rejectsMalformedJson() {
		DataLoadingPass.read("{\"a\": ");
	}

	@Test(expected = DataFormatIssue.class)
	public void rejectsTrailingContent() {
		DataLoadingPass.read("{} {}");
	}

}
