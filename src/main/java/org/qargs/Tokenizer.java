package org.qargs;

import java.util.LinkedList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * <p>
 * Classifies the command-line strings for one command level into {@link Token}s. Tokenizing is lazy: the matcher pulls one token at a
 * time, because whether a plain string is {@link Token.Kind#POSITIONAL positional} or {@link Token.Kind#BARE bare} depends on how many
 * positional values have been bound so far, and because the strings after a subcommand name are tokenized against the subcommand.
 * </p>
 * <p>
 * Strings are classified left to right, looking at nothing beyond the current string:
 * <ul>
 * <li>"--" ends options. Every later string is positional or bare.</li>
 * <li>"--name=value" is {@link Token.Kind#VALUE_JOINED value-joined}, "--name" a {@link Token.Kind#LONG_FLAG long flag}.</li>
 * <li>"-abc" is a cluster of {@link Token.Kind#SHORT_FLAG short flags}. The first character in the cluster that is an option taking values
 * takes the rest of the string (without a leading '=') as its value and ends the cluster, so "-n5" and "-n=5" both give "-n" the value
 * "5".</li>
 * <li>Anything else, including "-" alone, is a value.</li>
 * </ul>
 * Identities the command does not declare are passed on unresolved for the matcher to diagnose.
 * </p>
 */
public class Tokenizer {
	private static final Pattern NEGATIVE_NUMBER = Pattern.compile("-\\d+(\\.\\d+)?([eE][+-]?\\d+)?");

	private final CommandSpec theCommand;
	private final List<String> theArgs;
	private final LinkedList<Token> theBuffer;
	private int thePosition;
	private boolean isTrailing;

	/**
	 * @param command The command to classify strings for
	 * @param args The command-line strings
	 * @param start The index of the first string to classify
	 */
	public Tokenizer(CommandSpec command, List<String> args, int start) {
		theCommand = command;
		theArgs = args;
		theBuffer = new LinkedList<>();
		thePosition = start;
	}

	/** @return The command this tokenizer classifies strings for */
	public CommandSpec getCommand() {
		return theCommand;
	}

	/** @return Whether any tokens remain */
	public boolean hasNext() {
		return !theBuffer.isEmpty() || thePosition < theArgs.size();
	}

	/** @return Whether the "--" marker has been passed, or every remaining string has otherwise been made a value */
	public boolean isTrailing() {
		return isTrailing;
	}

	/** Classifies every string not yet classified as a value, as if "--" had been passed */
	public void startTrailing() {
		isTrailing = true;
	}

	/** @return The index of the next command-line string to classify, not counting tokens already split from a cluster */
	public int getPosition() {
		return thePosition;
	}

	/**
	 * @param positionalExpected Whether a positional argument of the command is still waiting for values, which decides whether a plain
	 *        string is {@link Token.Kind#POSITIONAL} or {@link Token.Kind#BARE}
	 * @return The next token
	 * @throws ArgumentParseException If the next string is malformed
	 */
	public Token next(boolean positionalExpected) throws ArgumentParseException {
		if (!theBuffer.isEmpty())
			return theBuffer.removeFirst();
		int index = thePosition++;
		String arg = theArgs.get(index);
		if (isTrailing || !isSwitch(arg))
			return value(arg, index, positionalExpected);
		else if (arg.equals("--")) {
			isTrailing = true;
			return new Token(Token.Kind.END_OF_OPTIONS, arg, index, null, null, null, null);
		} else if (arg.startsWith("--")) {
			int equalIdx = arg.indexOf('=', 2);
			if (equalIdx == 2)
				throw new ArgumentParseException(ParseError.malformedToken(theCommand, arg, index));
			else if (equalIdx > 0) {
				String name = arg.substring(2, equalIdx);
				return new Token(Token.Kind.VALUE_JOINED, arg, index, null, name, arg.substring(equalIdx + 1), theCommand.forLong(name));
			} else {
				String name = arg.substring(2);
				return new Token(Token.Kind.LONG_FLAG, arg, index, null, name, null, theCommand.forLong(name));
			}
		} else {
			splitCluster(arg, index);
			return theBuffer.removeFirst();
		}
	}

	private void splitCluster(String arg, int index) {
		for (int c = 1; c < arg.length(); c++) {
			char ch = arg.charAt(c);
			ArgumentSpec spec = theCommand.forShort(ch);
			boolean last = c == arg.length() - 1;
			if (!last && (arg.charAt(c + 1) == '=' || (spec != null && spec.takesValues()))) {
				int valueStart = arg.charAt(c + 1) == '=' ? c + 2 : c + 1;
				theBuffer.add(new Token(Token.Kind.VALUE_JOINED, arg, index, ch, null, arg.substring(valueStart), spec));
				return;
			}
			theBuffer.add(new Token(Token.Kind.SHORT_FLAG, arg, index, ch, null, null, spec));
		}
	}

	private Token value(String arg, int index, boolean positionalExpected) {
		return new Token(positionalExpected ? Token.Kind.POSITIONAL : Token.Kind.BARE, arg, index, null, null, arg, null);
	}

	/**
	 * @return Whether the next command-line string can be consumed as a value for an option, i.e. it is not a flag, an option or the "--"
	 *         marker. Always false while tokens split from a cluster are pending.
	 */
	public boolean hasValue() {
		if (!theBuffer.isEmpty() || thePosition >= theArgs.size())
			return false;
		return isTrailing || !isSwitch(theArgs.get(thePosition));
	}

	/**
	 * Consumes the next command-line string as a value for an option. Must only be called if {@link #hasValue()}.
	 *
	 * @return The value
	 */
	public String nextValue() {
		if (!hasValue())
			throw new IllegalStateException("No value available");
		return theArgs.get(thePosition++);
	}

	/**
	 * Hands the strings not yet classified to a subcommand. This tokenizer is exhausted afterward.
	 *
	 * @param subcommand The subcommand to classify the remaining strings for
	 * @return A tokenizer for the remaining strings
	 */
	public Tokenizer handOff(CommandSpec subcommand) {
		if (!theBuffer.isEmpty())
			throw new IllegalStateException("Cannot hand off in the middle of a cluster");
		Tokenizer sub = new Tokenizer(subcommand, theArgs, thePosition);
		thePosition = theArgs.size();
		return sub;
	}

	/** @return The number of command-line strings not yet classified */
	public int getRemaining() {
		return theArgs.size() - thePosition;
	}

	private boolean isSwitch(String arg) {
		if (arg.length() < 2 || arg.charAt(0) != '-')
			return false;
		else if (theCommand.getSettings().isAllowingNegativeNumbers() && NEGATIVE_NUMBER.matcher(arg).matches())
			return false;
		return true;
	}
}
