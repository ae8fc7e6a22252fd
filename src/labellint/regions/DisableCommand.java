package labellint.regions;

import java.util.Collections;
import java.util.Set;

/**
 * A single {@code labellint:disable} or {@code labellint:enable} comment command.
 */
public class DisableCommand {

	public enum Action {
		ENABLE,
		DISABLE,
	}

	public enum Modifier {
		// from here to the next command
		NONE,
		// the line the comment is on
		THIS,
		NEXT,
		PREVIOUS,
	}

	public static final String ALL_RULES = "all";

	private final Action action;
	private final Modifier modifier;
	private final Set<String> ruleIdentifiers;
	private final int characterOffset;
	private final int line;

	public DisableCommand(Action action, Modifier modifier, Set<String> ruleIdentifiers, int characterOffset, int line) {
		this.action = action;
		this.modifier = modifier;
		this.ruleIdentifiers = Collections.unmodifiableSet(ruleIdentifiers);
		this.characterOffset = characterOffset;
		this.line = line;
	}

	public Action getAction() {
		return action;
	}

	public Modifier getModifier() {
		return modifier;
	}

	public Set<String> getRuleIdentifiers() {
		return ruleIdentifiers;
	}

	public int getCharacterOffset() {
		return characterOffset;
	}

	public int getLine() {
		return line;
	}

	public boolean appliesTo(String ruleIdentifier) {
		return ruleIdentifiers.contains(ALL_RULES) || ruleIdentifiers.contains(ruleIdentifier);
	}

	/**
	 * @return the only line a scoped command affects, or -1 for an unscoped command
	 */
	public int getTargetLine() {
		switch (modifier) {
			case THIS:
				return line;
			case NEXT:
				return line + 1;
			case PREVIOUS:
				return line - 1;
			default:
				return -1;
		}
	}

	@Override
	public String toString() {
		return "DisableCommand [action=" + action + ", modifier=" + modifier + ", ruleIdentifiers=" +
				ruleIdentifiers + ", characterOffset=" + characterOffset + ", line=" + line + "]";
	}
}
