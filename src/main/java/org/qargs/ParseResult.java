package org.qargs;

import java.util.Objects;

/** The successful result of parsing a command line: the arguments bound at one command level and the result of the chosen subcommand */
public class ParseResult {
	private final Binding theBinding;
	private final ParseResult theSubcommand;

	ParseResult(Binding binding, ParseResult subcommand) {
		theBinding = binding;
		theSubcommand = subcommand;
	}

	/** @return The command this result is for */
	public CommandSpec getCommand() {
		return theBinding.getCommand();
	}

	/** @return The arguments bound to this command */
	public Binding getBinding() {
		return theBinding;
	}

	/** @return The name of the chosen subcommand (its declared name, even if it was chosen by an alias), or null */
	public String getSubcommandName() {
		return theSubcommand == null ? null : theSubcommand.getCommand().getName();
	}

	/** @return The result of the chosen subcommand, or null if none was chosen */
	public ParseResult getSubcommand() {
		return theSubcommand;
	}

	/** @return The result of the innermost chosen subcommand, or this result if no subcommand was chosen */
	public ParseResult getLeaf() {
		ParseResult leaf = this;
		while (leaf.theSubcommand != null)
			leaf = leaf.theSubcommand;
		return leaf;
	}

	/**
	 * @param argument The name of an argument of this command
	 * @return Whether the argument was specified on the command line
	 * @throws IllegalArgumentException If this command declares no such argument
	 * @see Binding#isPresent(String)
	 */
	public boolean isPresent(String argument) throws IllegalArgumentException {
		return theBinding.isPresent(argument);
	}

	/**
	 * @param argument The name of an argument of this command
	 * @return The first value bound to the argument, or null
	 * @throws IllegalArgumentException If this command declares no such argument
	 * @see Binding#getValue(String)
	 */
	public String getValue(String argument) throws IllegalArgumentException {
		return theBinding.getValue(argument);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theBinding, theSubcommand);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ParseResult))
			return false;
		ParseResult other = (ParseResult) obj;
		return theBinding.equals(other.theBinding) && Objects.equals(theSubcommand, other.theSubcommand);
	}

	@Override
	public String toString() {
		if (theSubcommand == null)
			return theBinding.toString();
		return theBinding + " " + theSubcommand;
	}
}
