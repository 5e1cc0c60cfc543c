package org.qargs;

/** The kinds of failure a parse may end with */
public enum ParseErrorKind {
	/** A command-line string could not be classified, e.g. "--=value" */
	MALFORMED_TOKEN(Category.TOKEN),
	/** A flag, option or value matches nothing the command declares */
	UNKNOWN_ARGUMENT(Category.BIND),
	/** An option was not followed by enough values */
	MISSING_VALUE(Category.BIND),
	/** An argument that may only be specified once was specified again */
	TOO_MANY_OCCURRENCES(Category.BIND),
	/** A value is not among its argument's possible values */
	INVALID_VALUE(Category.BIND),
	/** A value was attached to a flag, which takes none, e.g. "--verbose=yes" */
	UNEXPECTED_VALUE(Category.BIND),
	/** A required argument was not specified and has no default */
	MISSING_REQUIRED(Category.VALIDATION),
	/** Two members of a conflict group were both specified */
	CONFLICTING_ARGUMENTS(Category.VALIDATION),
	/** A requirement or one-required group is not satisfied */
	GROUP_REQUIREMENT_UNMET(Category.VALIDATION),
	/** A command that requires a subcommand was given none */
	MISSING_SUBCOMMAND(Category.VALIDATION);

	/** The parse phase that detects each kind of error */
	public enum Category {
		/** Detected while classifying command-line strings */
		TOKEN,
		/** Detected while assigning tokens to arguments */
		BIND,
		/** Detected after all tokens of a command have been bound */
		VALIDATION;
	}

	/** The phase that detects this kind of error */
	public final Category category;

	private ParseErrorKind(Category category) {
		this.category = category;
	}
}
