package labellint.passes;

import labellint.LabelLintOptionException;
import labellint.LabelLintOptions;
import labellint.errors.IssueContext;
import labellint.errors.OptionParserIssue;

import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static LabelLintOptions perform(IssueContext ctx, Logger logger, String[] args) {
		LabelLintOptions opts = new LabelLintOptions(args);
		try {
			opts.parse();
		} catch (LabelLintOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		Level level;
		if (opts.logLvlQuiet) {
			level = Level.WARNING;
		} else if (opts.logLvlVerbose) {
			level = Level.FINE;
		} else {
			level = Level.INFO;
		}
		logger.setLevel(level);
		if (opts.logLvlVerbose) {
			// the default console handler drops anything below INFO
			for (Handler handler : Logger.getLogger("").getHandlers()) {
				handler.setLevel(level);
			}
		}
		return opts;
	}
}
