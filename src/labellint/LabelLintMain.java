package labellint;

import labellint.errors.IOErrorIssue;
import labellint.errors.TopLevelIssueContext;
import labellint.formatters.ReportFormatter;
import labellint.model.SourceFile;
import labellint.passes.ConfigurationLoadingPass;
import labellint.passes.OptionParsingPass;
import labellint.passes.SourceLoadingPass;
import labellint.rules.Correction;
import labellint.rules.Rule;
import labellint.rules.Severity;
import labellint.rules.StyleViolation;
import labellint.rules.lint.UnusedControlFlowLabelRule;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

public class LabelLintMain {
	public static final int EXIT_OK = 0;
	public static final int EXIT_ISSUES = 1;
	public static final int EXIT_SERIOUS_VIOLATIONS = 2;

	private static final Logger logger = Logger.getLogger("labellint");

	private final String[] cmdArgs;
	private final PrintStream out;
	private final PrintStream err;

	public LabelLintMain(String[] args) {
		this(args, System.out, System.err);
	}

	public LabelLintMain(String[] args, PrintStream out, PrintStream err) {
		this.cmdArgs = args;
		this.out = out;
		this.err = err;
	}

	public static void main(String[] args) {
		int status = new LabelLintMain(args).run();
		if (status == EXIT_ISSUES) {
			logger.info("Terminated with errors");
		} else {
			logger.info("Finished");
		}
		System.exit(status);
	}

	private boolean reportIssues(TopLevelIssueContext ctx) {
		if (ctx.hasErrors()) {
			err.println(ctx.format());
			return true;
		}
		return false;
	}

	// Top-level workhorse method.
	public int run() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();

		// Check options, set up logging.
		LabelLintOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
		if (reportIssues(ctx)) {
			opts.printHelp();
			return EXIT_ISSUES;
		}
		if (opts.version) {
			out.println("labellint version " + LabelLintOptions.VERSION);
			return EXIT_OK;
		}
		if (opts.help) {
			opts.printHelp();
			return EXIT_OK;
		}

		UnusedControlFlowLabelRule rule = new UnusedControlFlowLabelRule();
		List<Rule> rules = Collections.singletonList(rule);
		if (opts.configFilePath != null && !opts.configFilePath.isEmpty()) {
			logger.info("Reading configuration from \"" + opts.configFilePath + "\"");
			ConfigurationLoadingPass.perform(ctx, Paths.get(opts.configFilePath), rules);
			if (reportIssues(ctx)) {
				return EXIT_ISSUES;
			}
		}

		logger.info("Opening source file");
		Path inputFilePath = Paths.get(opts.inputFilePath);
		SourceFile file = SourceLoadingPass.perform(
				ctx, inputFilePath, Paths.get(opts.structureFilePath), Paths.get(opts.syntaxFilePath));
		if (reportIssues(ctx)) {
			return EXIT_ISSUES;
		}

		Linter linter = new Linter(file, rules);
		if (opts.fix) {
			logger.info("Correcting unused control flow labels");
			List<Correction> corrections;
			try {
				corrections = linter.correct();
			} catch (IOException e) {
				ctx.error(new IOErrorIssue(e));
				reportIssues(ctx);
				return EXIT_ISSUES;
			}
			for (Correction correction : corrections) {
				out.println(ReportFormatter.format(correction));
			}
			logger.info("Applied " + corrections.size() + " correction(s) to \"" + inputFilePath + "\"");
			return EXIT_OK;
		}

		logger.info("Checking for unused control flow labels");
		List<StyleViolation> violations = linter.lint();
		boolean serious = false;
		for (StyleViolation violation : violations) {
			out.println(ReportFormatter.format(violation));
			logger.fine(violation.getLocation().excerpt(file.getContents()));
			serious |= violation.getSeverity() == Severity.ERROR;
		}
		logger.info("Found " + violations.size() + " violation(s) in \"" + inputFilePath + "\"");
		return serious ? EXIT_SERIOUS_VIOLATIONS : EXIT_OK;
	}
}
