package org.qargs;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Binds the tokens of one command level to the command's arguments in a single left-to-right pass with no backtracking, recursing into a
 * subcommand when one is named. Binding stops at the first error.
 */
class ArgumentMatcher {
	private static final Logger log = Logger.getLogger(ArgumentMatcher.class);

	private static class MatchBuilder {
		final ArgumentSpec argument;
		final List<String> values;
		int occurrences;

		MatchBuilder(ArgumentSpec argument) {
			this.argument = argument;
			values = new ArrayList<>(argument.takesValues() ? 2 : 0);
		}

		ArgumentMatch build() {
			return new ArgumentMatch(argument, values, occurrences, ArgumentMatch.Source.EXPLICIT);
		}
	}

	private final CommandSpec theCommand;
	private final Tokenizer theTokens;
	private final Map<String, MatchBuilder> theMatches;
	private int thePositionalIndex;
	private int thePositionalFill;
	private int thePositionalIndexOfFill;

	ArgumentMatcher(Tokenizer tokens) {
		theCommand = tokens.getCommand();
		theTokens = tokens;
		theMatches = new HashMap<>();
	}

	/**
	 * @return The unvalidated bindings of this command level and of any chosen subcommands
	 * @throws ArgumentParseException If the tokens cannot be bound
	 * @throws HelpRequestedException If the tokens request help
	 */
	ParseResult bind() throws ArgumentParseException, HelpRequestedException {
		if (theCommand.getSettings().isHelpOnEmpty() && theTokens.getRemaining() == 0) {
			log.debug(theCommand.getPath() + ": no arguments, showing help");
			throw help(theCommand);
		}
		while (theTokens.hasNext()) {
			Token token = theTokens.next(getSlot() != null);
			switch (token.getKind()) {
			case END_OF_OPTIONS:
				break;
			case SHORT_FLAG:
			case LONG_FLAG:
			case VALUE_JOINED:
				matchSwitch(token);
				break;
			case POSITIONAL:
			case BARE:
				CommandSpec sub = matchValue(token);
				if (sub != null) {
					Binding binding = finish();
					log.debug(theCommand.getPath() + ": subcommand " + sub.getName());
					ParseResult subResult = new ArgumentMatcher(theTokens.handOff(sub)).bind();
					return new ParseResult(binding, subResult);
				}
				break;
			}
		}
		return new ParseResult(finish(), null);
	}

	private void matchSwitch(Token token) throws ArgumentParseException, HelpRequestedException {
		ArgumentSpec arg = token.getArgument();
		if (arg == null) {
			if (isHelp(token)) {
				log.debug(theCommand.getPath() + ": " + token.getIdentity() + " requests help");
				throw help(theCommand);
			}
			String suggestion = token.getLongName() != null ? Suggestions.forLong(theCommand, token.getLongName()) : null;
			throw error(ParseError.unknownArgument(theCommand, token.getIdentity(), token.getArgIndex(), suggestion));
		}
		dropOverridden(arg);
		MatchBuilder match = theMatches.computeIfAbsent(arg.getName(), __ -> new MatchBuilder(arg));
		if (match.occurrences > 0 && !arg.isMultiple())
			throw error(ParseError.tooManyOccurrences(theCommand, arg, token.getText(), token.getArgIndex()));
		match.occurrences++;
		if (arg.isFlag()) {
			if (token.getKind() == Token.Kind.VALUE_JOINED)
				throw error(ParseError.unexpectedValue(theCommand, arg, token.getValue(), token.getText(), token.getArgIndex()));
			log.debug(theCommand.getPath() + ": " + token.getIdentity() + " -> " + arg.getName() + " (" + match.occurrences + ")");
			return;
		}

		int supplied = 0;
		if (token.getKind() == Token.Kind.VALUE_JOINED) {
			addValue(match, token.getValue(), token.getText(), token.getArgIndex());
			supplied++;
		}
		while (supplied < arg.getMinValues()) {
			if (!theTokens.hasValue())
				throw error(ParseError.missingValue(theCommand, arg, token.getText(), token.getArgIndex(), supplied));
			int index = theTokens.getPosition();
			String value = theTokens.nextValue();
			addValue(match, value, value, index);
			supplied++;
		}
		// A joined value stands on its own; only a bare switch greedily takes values beyond its minimum
		if (token.getKind() != Token.Kind.VALUE_JOINED) {
			while (supplied < arg.getMaxValues() && theTokens.hasValue()) {
				int index = theTokens.getPosition();
				String value = theTokens.nextValue();
				addValue(match, value, value, index);
				supplied++;
			}
		}
		log.debug(theCommand.getPath() + ": " + token.getIdentity() + " -> " + arg.getName() + match.values);
	}

	private void dropOverridden(ArgumentSpec arg) {
		Iterator<MatchBuilder> matches = theMatches.values().iterator();
		while (matches.hasNext()) {
			MatchBuilder other = matches.next();
			if (other.argument != arg && arg.overridesWith(other.argument)) {
				log.debug(theCommand.getPath() + ": " + arg.getName() + " overrides " + other.argument.getName());
				matches.remove();
			}
		}
	}

	private boolean isHelp(Token token) {
		switch (token.getKind()) {
		case SHORT_FLAG:
			return token.getShortName().charValue() == 'h' && theCommand.isShortHelpAvailable();
		case LONG_FLAG:
			return token.getLongName().equals("help") && theCommand.isLongHelpAvailable();
		default:
			return false;
		}
	}

	/**
	 * Decides between the positional and subcommand readings of a value. A positional that has not reached its minimum value count takes
	 * the value if it is required or has already started filling. Otherwise a subcommand with the value as its name wins, then the next
	 * positional that wants a value.
	 */
	private CommandSpec matchValue(Token token) throws ArgumentParseException, HelpRequestedException {
		String text = token.getValue();
		ArgumentSpec slot = getSlot();
		// A positional that is required or already partly filled keeps the value until it reaches its minimum
		boolean slotNeedsValue = slot != null && (slot.isRequired() || thePositionalFill > 0) && thePositionalFill < slot.getMinValues();
		if (!theTokens.isTrailing() && !slotNeedsValue) {
			if (text.equals("help") && theCommand.isHelpSubcommandAvailable())
				throw helpSubcommand();
			CommandSpec sub = theCommand.getSubcommand(text);
			if (sub != null)
				return sub;
		}
		if (slot == null)
			throw error(ParseError.unknownArgument(theCommand, text, token.getArgIndex(),
				theTokens.isTrailing() ? null : Suggestions.forSubcommand(theCommand, text)));

		MatchBuilder match = theMatches.computeIfAbsent(slot.getName(), __ -> new MatchBuilder(slot));
		addValue(match, text, token.getText(), token.getArgIndex());
		match.occurrences++;
		thePositionalFill++;
		thePositionalIndexOfFill = token.getArgIndex();
		log.debug(theCommand.getPath() + ": " + text + " -> " + slot.getName() + " (" + thePositionalFill + ")");
		if (theCommand.getSettings().isTrailingVarArg() && !theTokens.isTrailing()
			&& thePositionalIndex == theCommand.getPositionals().size() - 1) {
			log.debug(theCommand.getPath() + ": the rest belongs to " + slot.getName());
			theTokens.startTrailing();
		}
		if (thePositionalFill >= slot.getMaxValues()) {
			thePositionalIndex++;
			thePositionalFill = 0;
		}
		return null;
	}

	private HelpRequestedException helpSubcommand() throws ArgumentParseException {
		CommandSpec target = theCommand;
		while (theTokens.hasNext()) {
			Token token = theTokens.next(false);
			if (token.getKind() == Token.Kind.END_OF_OPTIONS)
				continue;
			CommandSpec sub = token.isSwitch() ? null : target.getSubcommand(token.getValue());
			if (sub == null)
				throw error(ParseError.unknownArgument(target, token.getIdentity(), token.getArgIndex(),
					token.isSwitch() ? null : Suggestions.forSubcommand(target, token.getValue())));
			target = sub;
		}
		log.debug(theCommand.getPath() + ": help requested for " + target.getPath());
		return help(target);
	}

	/** @return The positional argument the next value would fill, or null if all are full */
	private ArgumentSpec getSlot() {
		List<ArgumentSpec> positionals = theCommand.getPositionals();
		return thePositionalIndex < positionals.size() ? positionals.get(thePositionalIndex) : null;
	}

	private void addValue(MatchBuilder match, String value, String text, int argIndex) throws ArgumentParseException {
		ArgumentSpec arg = match.argument;
		if (arg.getValueDelimiter() != null) {
			for (String piece : split(value, arg.getValueDelimiter().charValue()))
				match.values.add(accept(arg, piece, text, argIndex));
		} else
			match.values.add(accept(arg, value, text, argIndex));
	}

	private String accept(ArgumentSpec arg, String value, String text, int argIndex) throws ArgumentParseException {
		String accepted = arg.acceptValue(value);
		if (accepted == null)
			throw error(ParseError.invalidValue(theCommand, arg, value, text, argIndex));
		return accepted;
	}

	static List<String> split(String value, char delimiter) {
		List<String> pieces = new ArrayList<>(5);
		int start = 0;
		for (int i = 0; i < value.length(); i++) {
			if (value.charAt(i) == delimiter) {
				pieces.add(value.substring(start, i));
				start = i + 1;
			}
		}
		pieces.add(value.substring(start));
		return pieces;
	}

	/** Checks the positional being filled, then applies defaults to every argument that was not specified */
	private Binding finish() throws ArgumentParseException {
		ArgumentSpec slot = getSlot();
		if (slot != null && thePositionalFill > 0 && thePositionalFill < slot.getMinValues())
			throw error(ParseError.missingValue(theCommand, slot, null, thePositionalIndexOfFill, thePositionalFill));
		Map<String, ArgumentMatch> matches = new LinkedHashMap<>();
		for (ArgumentSpec arg : theCommand.getArguments()) {
			MatchBuilder match = theMatches.get(arg.getName());
			if (match != null)
				matches.put(arg.getName(), match.build());
			else if (arg.getDefaultValue() != null) {
				List<String> values;
				if (arg.getValueDelimiter() != null)
					values = split(arg.getDefaultValue(), arg.getValueDelimiter().charValue());
				else
					values = Collections.singletonList(arg.getDefaultValue());
				List<String> accepted = new ArrayList<>(values.size());
				for (String value : values) {
					String canonical = arg.acceptValue(value);
					accepted.add(canonical != null ? canonical : value);
				}
				matches.put(arg.getName(), new ArgumentMatch(arg, accepted, 0, ArgumentMatch.Source.DEFAULT));
				log.debug(theCommand.getPath() + ": " + arg.getName() + " defaulted to " + accepted);
			}
		}
		return new Binding(theCommand, matches);
	}

	private ArgumentParseException error(ParseError error) {
		log.debug(theCommand.getPath() + ": " + error.getKind() + " " + error.getMessage());
		return new ArgumentParseException(error);
	}

	private static HelpRequestedException help(CommandSpec command) {
		return new HelpRequestedException(command, HelpWriter.help(command));
	}
}
