package labellint.rules.lint;

import labellint.model.SourceFile;
import labellint.model.StatementKind;
import labellint.model.StructureNode;
import labellint.rules.ASTRule;
import labellint.rules.CorrectableRule;
import labellint.rules.Correction;
import labellint.rules.RuleDescription;
import labellint.rules.RuleKind;
import labellint.rules.Severity;
import labellint.rules.SeverityConfiguration;
import labellint.rules.StyleViolation;
import labellint.util.TextRange;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;

public class UnusedControlFlowLabelRule extends ASTRule implements CorrectableRule {
	private static final Logger logger = Logger.getLogger(UnusedControlFlowLabelRule.class.getName());

	public static final RuleDescription DESCRIPTION = new RuleDescription(
			"unused_control_flow_label",
			"Unused Control Flow Label",
			"Unused control flow label should be removed.",
			RuleKind.LINT,
			Arrays.asList(
					"loop: while true { break loop }",
					"loop: while true { continue loop }",
					"loop:\n    while true { break loop }",
					"while true { break }",
					"loop: for x in array { break loop }",
					"label: switch number {\n" +
							"case 1: print(\"1\")\n" +
							"case 2: print(\"2\")\n" +
							"default: break label\n" +
							"}",
					"loop: repeat {\n" +
							"    if x == 10 {\n" +
							"        break loop\n" +
							"    }\n" +
							"} while true"),
			Arrays.asList(
					"↓loop: while true { break }",
					"↓loop: while true { break loop1 }",
					"↓loop: while true { break outerLoop }",
					"↓loop: for x in array { break }",
					"↓label: switch number {\n" +
							"case 1: print(\"1\")\n" +
							"case 2: print(\"2\")\n" +
							"default: break\n" +
							"}",
					"↓loop: repeat {\n" +
							"    if x == 10 {\n" +
							"        break\n" +
							"    }\n" +
							"} while true"),
			corrections());

	private static Map<String, String> corrections() {
		Map<String, String> corrections = new LinkedHashMap<>();
		corrections.put("↓loop: while true { break }", "while true { break }");
		corrections.put("↓loop: while true { break loop1 }", "while true { break loop1 }");
		corrections.put("↓loop: while true { break outerLoop }", "while true { break outerLoop }");
		corrections.put("↓loop: for x in array { break }", "for x in array { break }");
		corrections.put(
				"↓label: switch number {\n" +
						"case 1: print(\"1\")\n" +
						"case 2: print(\"2\")\n" +
						"default: break\n" +
						"}",
				"switch number {\n" +
						"case 1: print(\"1\")\n" +
						"case 2: print(\"2\")\n" +
						"default: break\n" +
						"}");
		corrections.put(
				"↓loop: repeat {\n" +
						"    if x == 10 {\n" +
						"        break\n" +
						"    }\n" +
						"} while true",
				"repeat {\n" +
						"    if x == 10 {\n" +
						"        break\n" +
						"    }\n" +
						"} while true");
		return corrections;
	}

	private final SeverityConfiguration configuration;

	public UnusedControlFlowLabelRule() {
		this(new SeverityConfiguration(Severity.WARNING));
	}

	public UnusedControlFlowLabelRule(SeverityConfiguration configuration) {
		this.configuration = configuration;
	}

	@Override
	public RuleDescription getDescription() {
		return DESCRIPTION;
	}

	@Override
	public SeverityConfiguration getConfiguration() {
		return configuration;
	}

	@Override
	public List<StyleViolation> validate(SourceFile file, StatementKind kind, StructureNode node) {
		if (file.isStale()) {
			return Collections.emptyList();
		}
		TextRange range = UnusedLabelCollector.violationRange(file, kind, node);
		if (range == null) {
			return Collections.emptyList();
		}
		return Collections.singletonList(new StyleViolation(
				DESCRIPTION, configuration.getSeverity(), file.locationOf(range.getLocation())));
	}

	@Override
	public List<Correction> correct(SourceFile file) throws IOException {
		if (file.isStale()) {
			logger.warning("Not correcting " + file.getPath() + ": its structure does not match its contents");
			return Collections.emptyList();
		}
		List<TextRange> matches = UnusedLabelCollector.collect(file).stream()
				.filter(range -> file.isRuleEnabled(DESCRIPTION.getIdentifier(), range.getLocation()))
				.collect(Collectors.toList());
		if (matches.isEmpty()) {
			return Collections.emptyList();
		}
		UnusedLabelCorrector.Result result = UnusedLabelCorrector.correct(file, matches);
		if (result.getAppliedRanges().isEmpty()) {
			return Collections.emptyList();
		}
		// locations refer to the text as it was before the labels were removed
		List<Correction> corrections = result.getAppliedRanges().stream()
				.map(range -> new Correction(DESCRIPTION, file.locationOf(range.getLocation())))
				.collect(Collectors.toList());
		file.write(result.getContents());
		logger.fine("Removed " + corrections.size() + " unused label(s) from " + file.getPath());
		return corrections;
	}
}
