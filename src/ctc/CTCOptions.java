package ctc;

import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

public class CTCOptions {
	public static final String VERSION = "0.1";

	@Option(value = "Version")
	public boolean version = false;

	@Option(value = "-h Print usage information")
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution")
	public boolean quiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution")
	public boolean verbose = false;

	@Option(value = "-c Print the expanded Cubicle program and stop")
	public boolean compile = false;

	@Option(value = "-f <filename> Cubicle template file (default: standard input)")
	public String file;

	@Option(value = "-d <filename> JSON data file (default: no data)")
	public String data;

	@Option(value = "-o <filename> Output file (default: standard output)")
	public String output;

	@Option(value = "<filename> Cubicle executable")
	public String cubicle = "cubicle";

	private final Options plumeOptions;
	private final String[] args;
	private List<String> cubicleArguments;

	public CTCOptions(String[] args) {
		this.args = args;
		plumeOptions = new Options("ctc [options] [-- cubicle arguments]", this);
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	/**
	 * @return the arguments passed through to cubicle, those following "--" included
	 */
	public List<String> getCubicleArguments() {
		return cubicleArguments;
	}

	public void parse() throws CTCOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new CTCOptionException(e.getMessage());
		}

		if (version) {
			System.out.println("CTC version " + VERSION);
			System.exit(0);
		}

		if (help) {
			printHelp();
			System.exit(0);
		}

		cubicleArguments = new ArrayList<>(Arrays.asList(remainingArgs));

		if (compile && !cubicleArguments.isEmpty()) {
			throw new CTCOptionException("cubicle arguments are not allowed in compile mode");
		}
		if (cubicle.isEmpty()) {
			throw new CTCOptionException("the cubicle executable cannot be empty");
		}
	}
}
