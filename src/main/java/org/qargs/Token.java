package org.qargs;

/**
 * A classified piece of a command line, produced by the {@link Tokenizer} and consumed once by the matcher. One command-line string may
 * produce several tokens, e.g. "-abc" for 3 boolean flags.
 */
public class Token {
	/** The classifications of tokens */
	public enum Kind {
		/** A single-character flag or option, e.g. "-v" */
		SHORT_FLAG,
		/** A long flag or option, e.g. "--verbose" */
		LONG_FLAG,
		/** A flag or option with a value attached, e.g. "--name=value" or "-n5" */
		VALUE_JOINED,
		/** A value that fills a positional argument */
		POSITIONAL,
		/** The "--" marker, after which every string is positional */
		END_OF_OPTIONS,
		/** A value no positional argument is waiting for: a subcommand name or an error */
		BARE;
	}

	private final Kind theKind;
	private final String theText;
	private final int theArgIndex;
	private final Character theShortName;
	private final String theLongName;
	private final String theValue;
	private final ArgumentSpec theArgument;

	Token(Kind kind, String text, int argIndex, Character shortName, String longName, String value, ArgumentSpec argument) {
		theKind = kind;
		theText = text;
		theArgIndex = argIndex;
		theShortName = shortName;
		theLongName = longName;
		theValue = value;
		theArgument = argument;
	}

	/** @return The classification of this token */
	public Kind getKind() {
		return theKind;
	}

	/** @return The command-line string this token was produced from */
	public String getText() {
		return theText;
	}

	/** @return The index of the string this token was produced from in the parsed argument list */
	public int getArgIndex() {
		return theArgIndex;
	}

	/** @return The short form named by this token, or null */
	public Character getShortName() {
		return theShortName;
	}

	/** @return The long form named by this token, or null */
	public String getLongName() {
		return theLongName;
	}

	/** @return The joined value of a {@link Kind#VALUE_JOINED} token, or the text of a positional or bare token */
	public String getValue() {
		return theValue;
	}

	/** @return The flag or option this token names, or null if it names an identity the command does not declare */
	public ArgumentSpec getArgument() {
		return theArgument;
	}

	/** @return Whether this token names a flag or option */
	public boolean isSwitch() {
		return theKind == Kind.SHORT_FLAG || theKind == Kind.LONG_FLAG || theKind == Kind.VALUE_JOINED;
	}

	/** @return The flag or option identity as typed, e.g. "-v" or "--name", or the text of other tokens */
	public String getIdentity() {
		if (theLongName != null)
			return "--" + theLongName;
		else if (theShortName != null)
			return "-" + theShortName;
		else
			return theText;
	}

	@Override
	public String toString() {
		switch (theKind) {
		case VALUE_JOINED:
			return theKind + "(" + getIdentity() + "=" + theValue + ")";
		case END_OF_OPTIONS:
			return theKind.toString();
		default:
			return theKind + "(" + getIdentity() + ")";
		}
	}
}
