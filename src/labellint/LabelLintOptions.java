package labellint;

import org.plumelib.options.Option;
import org.plumelib.options.Options;

public class LabelLintOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Version", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean logLvlQuiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean logLvlVerbose = false;

	@Option(value = "-f Remove unused labels instead of reporting them", aliases = {"-fix"})
	public boolean fix = false;

	@Option(value = "-s path to the output of sourcekitten structure for the input file", aliases = {"-structure", "--structure"})
	public String structureFilePath;

	@Option(value = "-t path to the output of sourcekitten syntax for the input file", aliases = {"-syntax", "--syntax"})
	public String syntaxFilePath;

	@Option(value = "-c path to the configuration file, if any", aliases = {"-config", "--config"})
	public String configFilePath;

	public String inputFilePath;

	private Options plumeOptions;
	private String[] args;

	public LabelLintOptions(String[] args) {
		this.plumeOptions = new Options("labellint [options] file.swift", this);
		this.args = args;
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public void parse() throws LabelLintOptionException {
		String[] remainingArgs;
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new LabelLintOptionException(e.getMessage());
		}

		if (version || help) {
			return;
		}

		if (remainingArgs.length != 1) {
			throw new LabelLintOptionException("expected exactly one input file, found " + remainingArgs.length);
		}
		if (logLvlQuiet && logLvlVerbose) {
			throw new LabelLintOptionException("-q and -v cannot be used together");
		}

		inputFilePath = remainingArgs[0];
		// sourcekitten output is expected next to the source file unless given explicitly
		if (structureFilePath == null || structureFilePath.isEmpty()) {
			structureFilePath = inputFilePath + ".structure.json";
		}
		if (syntaxFilePath == null || syntaxFilePath.isEmpty()) {
			syntaxFilePath = inputFilePath + ".syntax.json";
		}
	}
}
