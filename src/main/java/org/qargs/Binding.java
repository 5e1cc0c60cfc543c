package org.qargs;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.collect.ImmutableMap;

/**
 * The arguments of one command level bound by a parse: for each argument that was specified or defaulted, its values and how many times
 * it was specified. Arguments that were neither are absent.
 */
public class Binding {
	private final CommandSpec theCommand;
	private final ImmutableMap<String, ArgumentMatch> theMatches;

	Binding(CommandSpec command, Map<String, ArgumentMatch> matches) {
		theCommand = command;
		theMatches = ImmutableMap.copyOf(matches);
	}

	/** @return The command whose arguments this binding is for */
	public CommandSpec getCommand() {
		return theCommand;
	}

	/** @return Each specified or defaulted argument's match, by argument name, in argument declaration order */
	public Map<String, ArgumentMatch> getMatches() {
		return theMatches;
	}

	/**
	 * @param argument The name of the argument
	 * @return The argument's match, or null if it was neither specified nor defaulted
	 * @throws IllegalArgumentException If the command declares no such argument
	 */
	public ArgumentMatch getMatch(String argument) throws IllegalArgumentException {
		theCommand.getArgument(argument);
		return theMatches.get(argument);
	}

	/**
	 * @param argument The name of the argument
	 * @return Whether the argument was specified on the command line. Defaulted arguments are not present.
	 * @throws IllegalArgumentException If the command declares no such argument
	 */
	public boolean isPresent(String argument) throws IllegalArgumentException {
		return getOccurrences(argument) > 0;
	}

	/**
	 * @param argument The name of the argument
	 * @return Whether the argument was specified or defaulted
	 * @throws IllegalArgumentException If the command declares no such argument
	 */
	public boolean has(String argument) throws IllegalArgumentException {
		return getMatch(argument) != null;
	}

	/**
	 * @param argument The name of the argument
	 * @return The number of times the argument was specified
	 * @throws IllegalArgumentException If the command declares no such argument
	 */
	public int getOccurrences(String argument) throws IllegalArgumentException {
		ArgumentMatch match = getMatch(argument);
		return match == null ? 0 : match.getOccurrences();
	}

	/**
	 * @param argument The name of the argument
	 * @return The first value bound to the argument, or null if it has none
	 * @throws IllegalArgumentException If the command declares no such argument
	 */
	public String getValue(String argument) throws IllegalArgumentException {
		ArgumentMatch match = getMatch(argument);
		return match == null || match.getValues().isEmpty() ? null : match.getValues().get(0);
	}

	/**
	 * @param argument The name of the argument
	 * @return All values bound to the argument, in command-line order
	 * @throws IllegalArgumentException If the command declares no such argument
	 */
	public List<String> getValues(String argument) throws IllegalArgumentException {
		ArgumentMatch match = getMatch(argument);
		return match == null ? Collections.emptyList() : match.getValues();
	}

	/** @return Whether no argument was specified or defaulted */
	public boolean isEmpty() {
		return theMatches.isEmpty();
	}

	@Override
	public int hashCode() {
		return theMatches.hashCode();
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Binding))
			return false;
		Binding other = (Binding) obj;
		return theCommand == other.theCommand && theMatches.equals(other.theMatches);
	}

	@Override
	public String toString() {
		return QargsUtils.print(new StringBuilder(theCommand.getName()).append('{'), ", ", theMatches.values(), null).append('}')
			.toString();
	}
}
