package codecleaner;

import java.util.Locale;

/**
 * What happens to a body, else-clause, handler or finally-clause once every statement in it was removed.
 */
public enum EmptyBlockPolicy {
	/**
	 * Insert a single <code>pass</code>.
	 */
	Synthesize("pass"),
	/**
	 * Remove the construct owning the body, or drop the emptied clause.
	 */
	Delete("remove"),
	/**
	 * Leave the list empty.
	 */
	Preserve("keep"),
	;

	private final String optionName;

	EmptyBlockPolicy(String optionName) {
		this.optionName = optionName;
	}

	public String getOptionName() {
		return optionName;
	}

	/**
	 * Accepts the command line spelling (pass, remove, keep) as well as the constant names, ignoring case.
	 */
	public static EmptyBlockPolicy parse(String value) {
		for (var policy : values()) {
			if (policy.optionName.equalsIgnoreCase(value) || policy.name().equalsIgnoreCase(value))
				return policy;
		}
		throw new IllegalArgumentException(String.format("Unknown empty block policy \"%s\". Use pass, remove or keep.", value.toLowerCase(Locale.ROOT)));
	}
}
