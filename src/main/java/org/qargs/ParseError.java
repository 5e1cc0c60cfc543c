package org.qargs;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A description of why a command line could not be parsed, precise enough to show the user exactly what was wrong. A parse ends with at
 * most one error.
 */
public class ParseError {
	private final ParseErrorKind theKind;
	private final CommandSpec theCommand;
	private final String theArgument;
	private final String theOtherArgument;
	private final String theToken;
	private final int theArgIndex;
	private final String theSuggestion;
	private final String theMessage;
	private final String theGroup;

	ParseError(ParseErrorKind kind, CommandSpec command, String argument, String otherArgument, String token, int argIndex,
		String suggestion, String message) {
		this(kind, command, argument, otherArgument, token, argIndex, suggestion, message, null);
	}

	ParseError(ParseErrorKind kind, CommandSpec command, String argument, String otherArgument, String token, int argIndex,
		String suggestion, String message, String group) {
		theKind = kind;
		theCommand = command;
		theArgument = argument;
		theOtherArgument = otherArgument;
		theToken = token;
		theArgIndex = argIndex;
		theSuggestion = suggestion;
		theMessage = message;
		theGroup = group;
	}

	/** @return The kind of this error */
	public ParseErrorKind getKind() {
		return theKind;
	}

	/** @return The command at whose level the error occurred */
	public CommandSpec getCommand() {
		return theCommand;
	}

	/** @return The {@link ArgumentSpec#getName() name} of the offending argument, or null if the offending token matches no argument */
	public String getArgument() {
		return theArgument;
	}

	/** @return For {@link ParseErrorKind#CONFLICTING_ARGUMENTS} and requirements, the name of the second argument involved, or null */
	public String getOtherArgument() {
		return theOtherArgument;
	}

	/** @return The offending command-line text, or null for errors detected after binding */
	public String getToken() {
		return theToken;
	}

	/** @return The index in the parsed argument list of the offending string, or -1 */
	public int getArgIndex() {
		return theArgIndex;
	}

	/** @return For {@link ParseErrorKind#UNKNOWN_ARGUMENT}, the known identity nearest the offending token, or null */
	public String getSuggestion() {
		return theSuggestion;
	}

	/** @return For errors caused by a {@link GroupSpec group}, the name of the group, or null */
	public String getGroup() {
		return theGroup;
	}

	/** @return A human-readable description of the error */
	public String getMessage() {
		return theMessage;
	}

	/** @return The usage line of the command at whose level the error occurred */
	public String getUsage() {
		return HelpWriter.usage(theCommand);
	}

	@Override
	public int hashCode() {
		return Objects.hash(theKind, theCommand.getPath(), theArgument, theToken, theArgIndex);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ParseError))
			return false;
		ParseError other = (ParseError) obj;
		return theKind == other.theKind && theCommand == other.theCommand && Objects.equals(theArgument, other.theArgument)
			&& Objects.equals(theOtherArgument, other.theOtherArgument) && Objects.equals(theToken, other.theToken)
			&& theArgIndex == other.theArgIndex && Objects.equals(theSuggestion, other.theSuggestion)
			&& theMessage.equals(other.theMessage) && Objects.equals(theGroup, other.theGroup);
	}

	@Override
	public String toString() {
		return "error: " + theMessage;
	}

	static ParseError malformedToken(CommandSpec command, String text, int argIndex) {
		return new ParseError(ParseErrorKind.MALFORMED_TOKEN, command, null, null, text, argIndex, null,
			"Malformed argument '" + text + "': a long form must be named before its '='");
	}

	static ParseError unknownArgument(CommandSpec command, String identity, int argIndex, String suggestion) {
		StringBuilder msg = new StringBuilder("Found argument '").append(identity)
			.append("' which wasn't expected, or isn't valid in this context");
		if (suggestion != null)
			msg.append("\n\tDid you mean '").append(suggestion).append("'?");
		return new ParseError(ParseErrorKind.UNKNOWN_ARGUMENT, command, null, null, identity, argIndex, suggestion, msg.toString());
	}

	static ParseError missingValue(CommandSpec command, ArgumentSpec arg, String text, int argIndex, int supplied) {
		String msg;
		if (supplied == 0)
			msg = "The argument '" + arg + "' requires a value but none was supplied";
		else
			msg = "The argument '" + arg + "' requires at least " + arg.getMinValues() + " values, but " + supplied + " w"
				+ (supplied == 1 ? "as" : "ere") + " supplied";
		return new ParseError(ParseErrorKind.MISSING_VALUE, command, arg.getName(), null, text, argIndex, null, msg);
	}

	static ParseError tooManyOccurrences(CommandSpec command, ArgumentSpec arg, String text, int argIndex) {
		return new ParseError(ParseErrorKind.TOO_MANY_OCCURRENCES, command, arg.getName(), null, text, argIndex, null,
			"The argument '" + arg + "' was provided more than once, but cannot be used multiple times");
	}

	static ParseError invalidValue(CommandSpec command, ArgumentSpec arg, String value, String text, int argIndex) {
		StringBuilder msg = new StringBuilder("'").append(value).append("' isn't a valid value for '").append(arg).append("'\n\t[values: ");
		QargsUtils.print(msg, ", ", arg.getPossibleValues(), null).append(']');
		return new ParseError(ParseErrorKind.INVALID_VALUE, command, arg.getName(), null, text, argIndex, null, msg.toString());
	}

	static ParseError unexpectedValue(CommandSpec command, ArgumentSpec arg, String value, String text, int argIndex) {
		return new ParseError(ParseErrorKind.UNEXPECTED_VALUE, command, arg.getName(), null, text, argIndex, null,
			"The flag '" + arg + "' does not take a value, but '" + value + "' was supplied");
	}

	static ParseError missingRequired(CommandSpec command, ArgumentSpec arg) {
		return new ParseError(ParseErrorKind.MISSING_REQUIRED, command, arg.getName(), null, null, -1, null,
			"The following required argument was not provided: " + (arg.isPositional() ? "<" + arg.getValueName() + ">" : arg.toString()));
	}

	static ParseError conflicting(CommandSpec command, GroupSpec group, ArgumentSpec first, ArgumentSpec second) {
		return new ParseError(ParseErrorKind.CONFLICTING_ARGUMENTS, command, first.getName(), second.getName(), null, -1, null,
			"The argument '" + first.getDisplayName() + "' cannot be used with '" + second.getDisplayName() + "'", group.getName());
	}

	static ParseError requirementUnmet(CommandSpec command, GroupSpec group, ArgumentSpec trigger, ArgumentSpec missing) {
		return new ParseError(ParseErrorKind.GROUP_REQUIREMENT_UNMET, command, trigger.getName(), missing.getName(), null, -1, null,
			"The argument '" + trigger.getDisplayName() + "' requires '" + missing.getDisplayName() + "', which was not provided",
			group.getName());
	}

	static ParseError oneRequiredUnmet(CommandSpec command, GroupSpec group) {
		StringBuilder msg = new StringBuilder("One of ");
		QargsUtils.printConversational(msg, group.getMembers(), "or",
			(m, str) -> str.append('\'').append(command.getArgument(m).getDisplayName()).append('\''));
		msg.append(" must be provided");
		return new ParseError(ParseErrorKind.GROUP_REQUIREMENT_UNMET, command, null, null, null, -1, null, msg.toString(),
			group.getName());
	}

	static ParseError missingSubcommand(CommandSpec command) {
		StringBuilder msg = new StringBuilder("'").append(command.getPath()).append("' requires a subcommand, but one was not provided");
		List<String> visible = new ArrayList<>();
		for (CommandSpec sub : command.getSubcommands().values()) {
			if (!sub.isHidden())
				visible.add(sub.getName());
		}
		if (!visible.isEmpty())
			QargsUtils.print(msg.append("\n\t[subcommands: "), ", ", visible, null).append(']');
		return new ParseError(ParseErrorKind.MISSING_SUBCOMMAND, command, null, null, null, -1, null, msg.toString());
	}
}
