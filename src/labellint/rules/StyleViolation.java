package labellint.rules;

import labellint.util.Location;

import java.util.Objects;

public class StyleViolation {
	private final RuleDescription ruleDescription;
	private final Severity severity;
	private final Location location;
	private final String reason;

	public StyleViolation(RuleDescription ruleDescription, Severity severity, Location location) {
		this(ruleDescription, severity, location, ruleDescription.getDescription());
	}

	public StyleViolation(RuleDescription ruleDescription, Severity severity, Location location, String reason) {
		this.ruleDescription = ruleDescription;
		this.severity = severity;
		this.location = location;
		this.reason = reason;
	}

	public RuleDescription getRuleDescription() {
		return ruleDescription;
	}

	public Severity getSeverity() {
		return severity;
	}

	public Location getLocation() {
		return location;
	}

	public String getReason() {
		return reason;
	}

	@Override
	public int hashCode() {
		return Objects.hash(ruleDescription.getIdentifier(), severity, location, reason);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		StyleViolation other = (StyleViolation) obj;
		return ruleDescription.getIdentifier().equals(other.ruleDescription.getIdentifier()) &&
				severity == other.severity && location.equals(other.location) && reason.equals(other.reason);
	}

	@Override
	public String toString() {
		return "StyleViolation [rule=" + ruleDescription.getIdentifier() + ", severity=" + severity +
				", location=" + location + "]";
	}
}
