package org.qargs;

import java.util.Collections;

/**
 * Finds the known identity nearest to an unknown one, for "did you mean" hints. Only called once a parse has already failed. Only
 * identities that help lists are suggested.
 */
public class Suggestions {
	private Suggestions() {}

	/**
	 * @param unknown The unknown name
	 * @param candidates The known names, in preference order for ties
	 * @param maxDistance The greatest edit distance at which a candidate may be suggested
	 * @return The candidate nearest to the unknown name, or null if none is near enough. A candidate is never suggested if more than half of
	 *         it would need to change.
	 */
	public static String nearest(String unknown, Iterable<String> candidates, int maxDistance) {
		String best = null;
		int bestDistance = Integer.MAX_VALUE;
		for (String candidate : candidates) {
			int distance = QargsUtils.editDistance(unknown, candidate);
			if (distance > maxDistance || distance * 2 > candidate.length())
				continue;
			if (distance < bestDistance) {
				best = candidate;
				bestDistance = distance;
			}
		}
		return best;
	}

	/**
	 * @param command The command the unknown long form was given to
	 * @param longName The unknown long form, without the leading "--"
	 * @return The nearest long form the command accepts, with the leading "--", or null
	 */
	public static String forLong(CommandSpec command, String longName) {
		int max = command.getSettings().getSuggestionDistance();
		if (max == 0)
			return null;
		String nearest = nearest(longName, command.getVisibleLongNames(), max);
		if (nearest == null && command.isLongHelpAvailable())
			nearest = nearest(longName, Collections.singletonList("help"), max);
		return nearest == null ? null : "--" + nearest;
	}

	/**
	 * @param command The command the unknown value was given to
	 * @param text The unknown value
	 * @return The nearest subcommand name the command accepts, or null
	 */
	public static String forSubcommand(CommandSpec command, String text) {
		int max = command.getSettings().getSuggestionDistance();
		if (max == 0)
			return null;
		return nearest(text, command.getVisibleSubcommandNames(), max);
	}
}
