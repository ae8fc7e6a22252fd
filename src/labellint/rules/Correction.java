package labellint.rules;

import labellint.util.Location;

import java.util.Objects;

/**
 * An edit a rule applied to a file, located where the offending text used to start.
 */
public class Correction {
	private final RuleDescription ruleDescription;
	private final Location location;

	public Correction(RuleDescription ruleDescription, Location location) {
		this.ruleDescription = ruleDescription;
		this.location = location;
	}

	public RuleDescription getRuleDescription() {
		return ruleDescription;
	}

	public Location getLocation() {
		return location;
	}

	public String getDescription() {
		return ruleDescription.getName();
	}

	@Override
	public int hashCode() {
		return Objects.hash(ruleDescription.getIdentifier(), location);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Correction other = (Correction) obj;
		return ruleDescription.getIdentifier().equals(other.ruleDescription.getIdentifier()) &&
				location.equals(other.location);
	}

	@Override
	public String toString() {
		return "Correction [rule=" + ruleDescription.getIdentifier() + ", location=" + location + "]";
	}
}
