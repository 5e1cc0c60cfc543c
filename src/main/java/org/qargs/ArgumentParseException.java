package org.qargs;

/** Thrown by {@link ArgumentParser#parseOrThrow(CommandSpec, java.util.List)} if a command line cannot be parsed */
public class ArgumentParseException extends Exception {
	private final ParseError theError;

	/** @param error The reason the command line could not be parsed */
	public ArgumentParseException(ParseError error) {
		super(error.getMessage());
		theError = error;
	}

	/** @return The reason the command line could not be parsed */
	public ParseError getError() {
		return theError;
	}
}
