package org.qargs;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/** The values bound to one argument by a parse */
public class ArgumentMatch {
	/** Where a match's values came from */
	public enum Source {
		/** The argument was specified on the command line */
		EXPLICIT,
		/** The argument was not specified and its default value was bound */
		DEFAULT;
	}

	private final ArgumentSpec theArgument;
	private final ImmutableList<String> theValues;
	private final int theOccurrences;
	private final Source theSource;

	ArgumentMatch(ArgumentSpec argument, List<String> values, int occurrences, Source source) {
		theArgument = argument;
		theValues = ImmutableList.copyOf(values);
		theOccurrences = occurrences;
		theSource = source;
	}

	/** @return The argument the values are bound to */
	public ArgumentSpec getArgument() {
		return theArgument;
	}

	/** @return The values bound to the argument, in command-line order. Empty for flags. */
	public List<String> getValues() {
		return theValues;
	}

	/** @return The number of times the argument was specified. 0 for a defaulted argument. */
	public int getOccurrences() {
		return theOccurrences;
	}

	/** @return Where the values came from */
	public Source getSource() {
		return theSource;
	}

	@Override
	public int hashCode() {
		return Objects.hash(theArgument.getName(), theValues, theOccurrences, theSource);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof ArgumentMatch))
			return false;
		ArgumentMatch other = (ArgumentMatch) obj;
		return theArgument == other.theArgument && theValues.equals(other.theValues) && theOccurrences == other.theOccurrences
			&& theSource == other.theSource;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder(theArgument.getName());
		if (theArgument.isFlag())
			str.append('(').append(theOccurrences).append(')');
		else
			str.append(theValues);
		if (theSource == Source.DEFAULT)
			str.append("(default)");
		return str.toString();
	}
}
