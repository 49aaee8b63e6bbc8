package ctc.trans.passes.parse;

import ctc.errors.Issue;
import ctc.model.cubicle.CubicleModel;
import ctc.parser.CubicleTemplateParser;
import ctc.parser.TemplateParseException;

import java.nio.file.Path;

public class TemplateParsingPass {
	private TemplateParsingPass() {}

	public static CubicleModel perform(Path inputFileName, CharSequence inputFileContents) throws Issue {
		try {
			return CubicleTemplateParser.readModel(inputFileName, inputFileContents);
		} catch (TemplateParseException e) {
			throw new ParsingIssue(e);
		}
	}
}
