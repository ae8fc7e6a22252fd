package labellint.passes;

import labellint.errors.ConfigurationIssue;
import labellint.errors.IOErrorIssue;
import labellint.errors.IssueContext;
import labellint.rules.InvalidConfigurationException;
import labellint.rules.Rule;
import org.apache.commons.io.FileUtils;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Applies a JSON configuration file to rules. Each rule reads the entry keyed by its identifier,
 * for instance {@code {"unused_control_flow_label": "error"}}; rules without an entry keep their
 * defaults.
 */
public class ConfigurationLoadingPass {
	private static final Logger logger = Logger.getLogger(ConfigurationLoadingPass.class.getName());

	private ConfigurationLoadingPass() {}

	public static void perform(IssueContext ctx, Path configFile, List<? extends Rule> rules) {
		JSONObject config;
		try {
			config = new JSONObject(FileUtils.readFileToString(configFile.toFile(), StandardCharsets.UTF_8));
		} catch (IOException e) {
			ctx.error(new IOErrorIssue(e));
			return;
		} catch (JSONException e) {
			ctx.error(new ConfigurationIssue(configFile, "parsing error: " + e.getMessage()));
			return;
		}
		for (Rule rule : rules) {
			String identifier = rule.getDescription().getIdentifier();
			if (!config.has(identifier)) {
				continue;
			}
			try {
				rule.getConfiguration().apply(config.get(identifier));
				logger.fine("Configured " + identifier + " with severity " + rule.getConfiguration());
			} catch (InvalidConfigurationException e) {
				ctx.error(new ConfigurationIssue(configFile, identifier + ": " + e.getMessage()));
			}
		}
	}
}
