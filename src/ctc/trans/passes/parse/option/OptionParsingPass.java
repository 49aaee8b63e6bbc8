package ctc.trans.passes.parse.option;

import ctc.CTCOptionException;
import ctc.CTCOptions;
import ctc.errors.IssueContext;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static CTCOptions perform(IssueContext ctx, Logger logger, String[] args) {
		CTCOptions opts = new CTCOptions(args);
		try {
			opts.parse();
		} catch (CTCOptionException e) {
			ctx.error(new OptionParserIssue(e.getMsg()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.quiet) {
			level = Level.WARNING;
		} else if (opts.verbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		for (Handler handler : logger.getHandlers()) {
			handler.setLevel(level);
		}
		return opts;
	}
}
