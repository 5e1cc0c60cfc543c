package org.qargs;

/**
 * Thrown when a {@link CommandSpec} cannot be built from its declarations. This is a mistake by the application author, not by the user
 * typing the command line, so it is unchecked.
 */
public class SpecConfigException extends IllegalArgumentException {
	/** The kinds of configuration problems detected when a {@link CommandSpec} is built */
	public enum ConfigErrorKind {
		/** Two arguments, groups or subcommands of the same command share a name, short form or long form */
		DUPLICATE_IDENTITY,
		/** A group references an argument that is not declared in the same command */
		UNKNOWN_GROUP_MEMBER,
		/** Positional indexes are not unique and contiguous, or an unbounded or required positional is misplaced */
		INVALID_POSITIONAL_ORDERING,
		/** A flag or option declares neither a short nor a long form */
		MISSING_IDENTITY,
		/** A name, short form or long form cannot be typed unambiguously on a command line */
		INVALID_IDENTITY,
		/** A value count range is empty, negative, or declared on an argument that takes no values */
		INVALID_ARITY,
		/** A default value is declared on a flag or is not among the argument's possible values */
		INVALID_DEFAULT,
		/** A group has too few members for its kind, or lists a member twice */
		INVALID_GROUP,
		/** An argument overrides itself, a positional, or an argument that is not declared in the same command */
		INVALID_OVERRIDE;
	}

	private final ConfigErrorKind theKind;
	private final String theCommandPath;
	private final String theSubject;

	/**
	 * @param kind The kind of the problem
	 * @param commandPath The space-separated path of the command whose declarations are invalid
	 * @param subject The name of the argument, group or subcommand that is invalid
	 * @param message The description of the problem
	 */
	public SpecConfigException(ConfigErrorKind kind, String commandPath, String subject, String message) {
		super(commandPath + ": " + message);
		theKind = kind;
		theCommandPath = commandPath;
		theSubject = subject;
	}

	/** @return The kind of the problem */
	public ConfigErrorKind getKind() {
		return theKind;
	}

	/** @return The space-separated path of the command whose declarations are invalid */
	public String getCommandPath() {
		return theCommandPath;
	}

	/** @return The name of the argument, group or subcommand that is invalid */
	public String getSubject() {
		return theSubject;
	}
}
