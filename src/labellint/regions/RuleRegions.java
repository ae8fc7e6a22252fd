package labellint.regions;

import labellint.lexer.SyntaxToken;
import labellint.model.SourceFile;
import labellint.util.Location;
import labellint.util.TextRange;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tracks where in a file each rule has been switched off by comment commands such as
 * {@code // labellint:disable:next unused_control_flow_label}.
 */
public class RuleRegions {

	static final Pattern COMMAND = Pattern.compile(
			"labellint:(enable|disable)(?::(this|next|previous))?((?:[ \\t]+[\\w-]+)+)");

	private final String contents;
	private final List<DisableCommand> commands;

	public RuleRegions(String contents, List<DisableCommand> commands) {
		this.contents = contents;
		this.commands = Collections.unmodifiableList(commands);
	}

	public static RuleRegions of(SourceFile file) {
		List<DisableCommand> commands = new ArrayList<>();
		for (SyntaxToken token : file.getSyntaxMap().getTokens()) {
			if (!token.getType().isComment()) {
				continue;
			}
			TextRange range = file.getBridge().byteRangeToTextRange(token.getByteRange());
			if (range == null) {
				continue;
			}
			String comment = file.getContents().substring(range.getLocation(), range.getEnd());
			commands.addAll(parseCommands(file.getContents(), comment, range.getLocation()));
		}
		return new RuleRegions(file.getContents(), commands);
	}

	static List<DisableCommand> parseCommands(String contents, String comment, int commentOffset) {
		List<DisableCommand> result = new ArrayList<>();
		Matcher matcher = COMMAND.matcher(comment);
		while (matcher.find()) {
			DisableCommand.Action action = DisableCommand.Action.valueOf(matcher.group(1).toUpperCase(Locale.ROOT));
			DisableCommand.Modifier modifier = matcher.group(2) == null
					? DisableCommand.Modifier.NONE
					: DisableCommand.Modifier.valueOf(matcher.group(2).toUpperCase(Locale.ROOT));
			Set<String> identifiers = new LinkedHashSet<>(Arrays.asList(matcher.group(3).trim().split("\\s+")));
			int offset = commentOffset + matcher.start();
			int line = Location.of(null, contents, offset).getLine();
			result.add(new DisableCommand(action, modifier, identifiers, offset, line));
		}
		return result;
	}

	public List<DisableCommand> getCommands() {
		return commands;
	}

	public boolean isRuleEnabled(String ruleIdentifier, int characterOffset) {
		boolean enabled = true;
		for (DisableCommand command : commands) {
			if (command.getModifier() == DisableCommand.Modifier.NONE &&
					command.getCharacterOffset() < characterOffset && command.appliesTo(ruleIdentifier)) {
				enabled = command.getAction() == DisableCommand.Action.ENABLE;
			}
		}
		int line = Location.of(null, contents, characterOffset).getLine();
		for (DisableCommand command : commands) {
			if (command.getTargetLine() == line && command.appliesTo(ruleIdentifier)) {
				enabled = command.getAction() == DisableCommand.Action.ENABLE;
			}
		}
		return enabled;
	}
}
