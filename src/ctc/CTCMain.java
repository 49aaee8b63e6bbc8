package ctc;

import ctc.errors.Issue;
import ctc.errors.TopLevelIssueContext;
import ctc.formatters.ExpandedModelFormattingVisitor;
import ctc.model.cubicle.CubicleModel;
import ctc.model.data.DataEnvironment;
import ctc.trans.CTCTransException;
import ctc.trans.intermediate.IOErrorIssue;
import ctc.trans.passes.data.DataLoadingPass;
import ctc.trans.passes.expansion.TemplateExpansionPass;
import ctc.trans.passes.parse.TemplateParsingPass;
import ctc.trans.passes.parse.option.OptionParsingPass;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

public class CTCMain {
	private final String[] cmdArgs;
	private static Logger logger;

	public CTCMain(String[] args) {
		cmdArgs = args;
		logger = Logger.getLogger("CTCMain");
	}

	public static void main(String[] args) {
		int status = new CTCMain(args).run();
		if (status == 0) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with status " + status);
		}
		System.exit(status);
	}

	private CubicleModel parseTemplate(CTCOptions opts) throws IOException {
		logger.info("Parsing template");
		Path templatePath;
		String contents;
		if (opts.file == null) {
			templatePath = Paths.get("<stdin>");
			contents = IOUtils.toString(System.in, StandardCharsets.UTF_8);
		} else {
			templatePath = Paths.get(opts.file);
			contents = FileUtils.readFileToString(templatePath.toFile(), StandardCharsets.UTF_8);
		}
		return TemplateParsingPass.perform(templatePath, contents);
	}

	private static String formatModel(CubicleModel model) throws IOException {
		StringWriter writer = new StringWriter();
		model.accept(ExpandedModelFormattingVisitor.forCubicle(writer));
		return writer.toString();
	}

	private void writeProgram(CTCOptions opts, String program) throws IOException {
		if (opts.output == null) {
			logger.info("Writing Cubicle program to standard output");
			System.out.print(program);
			System.out.flush();
		} else {
			logger.info("Writing Cubicle program to \"" + opts.output + "\"");
			FileUtils.writeStringToFile(new File(opts.output), program, StandardCharsets.UTF_8);
		}
	}

	/**
	 * Runs cubicle on a temporary copy of the program, which is deleted whatever happens. Cubicle is
	 * stopped if the wait for it is interrupted.
	 *
	 * @return the exit status of cubicle
	 */
	private int runCubicle(CTCOptions opts, String program) throws IOException, InterruptedException {
		File tempFile = File.createTempFile("ctc-", ".cub");
		try {
			FileUtils.writeStringToFile(tempFile, program, StandardCharsets.UTF_8);
			List<String> command = new ArrayList<>();
			command.add(opts.cubicle);
			command.addAll(opts.getCubicleArguments());
			command.add(tempFile.getPath());
			logger.info("Running " + String.join(" ", command));
			ProcessBuilder builder = new ProcessBuilder(command)
					.redirectInput(ProcessBuilder.Redirect.INHERIT)
					.redirectError(ProcessBuilder.Redirect.INHERIT);
			if (opts.output == null) {
				builder.redirectOutput(ProcessBuilder.Redirect.INHERIT);
			} else {
				builder.redirectOutput(new File(opts.output));
			}
			Process process = builder.start();
			try {
				return process.waitFor();
			} catch (InterruptedException e) {
				process.destroy();
				throw e;
			}
		} finally {
			FileUtils.deleteQuietly(tempFile);
		}
	}

	// Top-level workhorse method, returns the exit status.
	public int run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		CTCOptions opts = OptionParsingPass.perform(ctx, Logger.getLogger(""), cmdArgs);
		if (ctx.hasErrors()) {
			System.err.println(ctx.format());
			opts.printHelp();
			return 1;
		}

		try {
			CubicleModel template = parseTemplate(opts);

			logger.info("Loading data");
			DataEnvironment data = DataLoadingPass.perform(opts.data == null ? null : Paths.get(opts.data));

			logger.info("Expanding templates");
			CubicleModel model = TemplateExpansionPass.perform(ctx, template, data);
			checkErrors(ctx);

			String program = formatModel(model);
			if (opts.compile) {
				writeProgram(opts, program);
				return 0;
			}
			return runCubicle(opts, program);
		} catch (Issue e) {
			ctx.error(e);
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.severe("interrupted while waiting for cubicle");
			return 1;
		} catch (CTCTransException e) {
			logger.severe("found issues");
			System.err.println(e.getMsg());
			return 1;
		}
		logger.severe("found issues");
		System.err.println(ctx.format());
		return 1;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws CTCTransException {
		if (ctx.hasErrors()) {
			throw new CTCTransException(ctx.format());
		}
	}
}
