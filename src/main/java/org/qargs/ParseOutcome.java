package org.qargs;

import java.util.Objects;

/**
 * What a parse ended with: exactly one of a {@link #getResult() result}, an {@link #getError() error}, or a {@link #getHelpText() help}
 * request
 */
public abstract class ParseOutcome {
	/** The kinds of outcome */
	public enum Type {
		/** The command line was bound and validated */
		SUCCESS,
		/** The command line could not be parsed */
		FAILURE,
		/** The command line asked for help */
		HELP_REQUESTED;
	}

	private ParseOutcome() {}

	/** @return The kind of this outcome */
	public abstract Type getType();

	/** @return The command the outcome is about: the root command for a success, else the level at which the parse stopped */
	public abstract CommandSpec getCommand();

	/** @return Whether the command line was bound and validated */
	public boolean isSuccess() {
		return getType() == Type.SUCCESS;
	}

	/** @return Whether the command line asked for help */
	public boolean isHelpRequested() {
		return getType() == Type.HELP_REQUESTED;
	}

	/**
	 * @return The parse result
	 * @throws IllegalStateException If the parse did not succeed
	 */
	public ParseResult getResult() throws IllegalStateException {
		throw new IllegalStateException("Parse did not succeed: " + this);
	}

	/**
	 * @return The parse error
	 * @throws IllegalStateException If the parse did not fail
	 */
	public ParseError getError() throws IllegalStateException {
		throw new IllegalStateException("Parse did not fail: " + this);
	}

	/**
	 * @return The rendered help of the {@link #getCommand() command} help was requested for
	 * @throws IllegalStateException If help was not requested
	 */
	public String getHelpText() throws IllegalStateException {
		throw new IllegalStateException("Help was not requested: " + this);
	}

	static ParseOutcome success(ParseResult result) {
		return new Success(result);
	}

	static ParseOutcome failure(ParseError error) {
		return new Failure(error);
	}

	static ParseOutcome help(CommandSpec command, String helpText) {
		return new HelpRequested(command, helpText);
	}

	static class Success extends ParseOutcome {
		private final ParseResult theResult;

		Success(ParseResult result) {
			theResult = result;
		}

		@Override
		public Type getType() {
			return Type.SUCCESS;
		}

		@Override
		public CommandSpec getCommand() {
			return theResult.getCommand();
		}

		@Override
		public ParseResult getResult() {
			return theResult;
		}

		@Override
		public int hashCode() {
			return theResult.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Success && theResult.equals(((Success) obj).theResult);
		}

		@Override
		public String toString() {
			return theResult.toString();
		}
	}

	static class Failure extends ParseOutcome {
		private final ParseError theError;

		Failure(ParseError error) {
			theError = error;
		}

		@Override
		public Type getType() {
			return Type.FAILURE;
		}

		@Override
		public CommandSpec getCommand() {
			return theError.getCommand();
		}

		@Override
		public ParseError getError() {
			return theError;
		}

		@Override
		public int hashCode() {
			return theError.hashCode();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Failure && theError.equals(((Failure) obj).theError);
		}

		@Override
		public String toString() {
			return theError.toString();
		}
	}

	static class HelpRequested extends ParseOutcome {
		private final CommandSpec theCommand;
		private final String theHelpText;

		HelpRequested(CommandSpec command, String helpText) {
			theCommand = command;
			theHelpText = helpText;
		}

		@Override
		public Type getType() {
			return Type.HELP_REQUESTED;
		}

		@Override
		public CommandSpec getCommand() {
			return theCommand;
		}

		@Override
		public String getHelpText() {
			return theHelpText;
		}

		@Override
		public int hashCode() {
			return Objects.hash(theCommand.getPath(), theHelpText);
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof HelpRequested))
				return false;
			HelpRequested other = (HelpRequested) obj;
			return theCommand == other.theCommand && theHelpText.equals(other.theHelpText);
		}

		@Override
		public String toString() {
			return "help for " + theCommand.getPath();
		}
	}
}
