package org.qargs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.qargs.SpecConfigException.ConfigErrorKind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * <p>
 * An immutable declaration of a single argument accepted by a {@link CommandSpec}.
 * </p>
 * <p>
 * Flags and options are identified on the command line by a short form (e.g. "-v"), a long form (e.g. "--verbose"), or both. Positional
 * arguments are identified by their {@link #getIndex() index} among the command's positionals. Every argument also has a
 * {@link #getName() name}, which is how it is referred to by groups and in a {@link Binding}.
 * </p>
 */
public class ArgumentSpec {
	/** The {@link #getMaxValues() maximum value count} of an argument that accepts any number of values */
	public static final int UNBOUNDED = Integer.MAX_VALUE;

	private final String theName;
	private final ArgumentKind theKind;
	private final Character theShortName;
	private final String theLongName;
	private final ImmutableList<String> theAliases;
	private final ImmutableList<String> theVisibleAliases;
	private final boolean isRequired;
	private final boolean isMultiple;
	private final int theMinValues;
	private final int theMaxValues;
	private final String theDefaultValue;
	private final ImmutableSet<String> thePossibleValues;
	private final boolean isIgnoringCase;
	private final Character theValueDelimiter;
	private final int theIndex;
	private final String theDescription;
	private final String theValueName;
	private final boolean isHidden;
	private final ImmutableSet<String> theGroups;
	private final ImmutableSet<String> theOverrides;

	ArgumentSpec(Builder builder, int index, Collection<String> groups) {
		theName = builder.theName;
		theKind = builder.theKind;
		theShortName = builder.theShortName;
		theLongName = builder.theLongName;
		theAliases = ImmutableList.copyOf(builder.theAliases);
		theVisibleAliases = ImmutableList.copyOf(builder.theVisibleAliases);
		isRequired = builder.isRequired;
		isMultiple = builder.isMultiple;
		theMinValues = builder.theMinValues;
		theMaxValues = builder.theMaxValues;
		theDefaultValue = builder.theDefaultValue;
		thePossibleValues = builder.thePossibleValues == null ? null : ImmutableSet.copyOf(builder.thePossibleValues);
		isIgnoringCase = builder.isIgnoringCase;
		theValueDelimiter = builder.theValueDelimiter;
		theIndex = index;
		theDescription = builder.theDescription;
		theValueName = builder.theValueName != null ? builder.theValueName : theName.toUpperCase();
		isHidden = builder.isHidden;
		theGroups = ImmutableSet.copyOf(groups);
		theOverrides = ImmutableSet.copyOf(builder.theOverrides);
	}

	/** @return The name by which this argument is referred to in groups and bindings */
	public String getName() {
		return theName;
	}

	/** @return The shape of this argument */
	public ArgumentKind getKind() {
		return theKind;
	}

	/** @return Whether this argument is a value-less {@link ArgumentKind#FLAG flag} */
	public boolean isFlag() {
		return theKind == ArgumentKind.FLAG;
	}

	/** @return Whether this argument is a named {@link ArgumentKind#OPTION option} that takes values */
	public boolean isOption() {
		return theKind == ArgumentKind.OPTION;
	}

	/** @return Whether this argument is a {@link ArgumentKind#POSITIONAL positional} argument */
	public boolean isPositional() {
		return theKind == ArgumentKind.POSITIONAL;
	}

	/** @return The single-character form of this argument ("-v"), or null if it has none */
	public Character getShortName() {
		return theShortName;
	}

	/** @return The long form of this argument ("--verbose"), or null if it has none */
	public String getLongName() {
		return theLongName;
	}

	/** @return Other long forms that are accepted for this argument but not shown in help */
	public List<String> getAliases() {
		return theAliases;
	}

	/** @return Other long forms that are accepted for this argument and listed in help */
	public List<String> getVisibleAliases() {
		return theVisibleAliases;
	}

	/** @return Whether this argument must be specified (or defaulted) for a parse to succeed */
	public boolean isRequired() {
		return isRequired;
	}

	/**
	 * @return For flags and options, whether this argument may be specified more than once. For positionals, whether this argument absorbs
	 *         all remaining positional values.
	 */
	public boolean isMultiple() {
		return isMultiple;
	}

	/** @return The minimum number of values this argument consumes per occurrence */
	public int getMinValues() {
		return theMinValues;
	}

	/** @return The maximum number of values this argument consumes per occurrence, or {@link #UNBOUNDED} */
	public int getMaxValues() {
		return theMaxValues;
	}

	/** @return Whether this argument takes any values */
	public boolean takesValues() {
		return theMaxValues > 0;
	}

	/** @return Whether this argument accepts any number of values */
	public boolean isUnbounded() {
		return theMaxValues == UNBOUNDED;
	}

	/** @return The value bound to this argument if it is not specified, or null */
	public String getDefaultValue() {
		return theDefaultValue;
	}

	/** @return The closed set of values this argument accepts, or null if any value is accepted */
	public Set<String> getPossibleValues() {
		return thePossibleValues;
	}

	/** @return Whether {@link #getPossibleValues() possible values} are matched without regard to case */
	public boolean isIgnoringCase() {
		return isIgnoringCase;
	}

	/** @return The character on which each supplied value is split into multiple values, or null */
	public Character getValueDelimiter() {
		return theValueDelimiter;
	}

	/** @return The 1-based index of this positional argument among its command's positionals, or 0 for flags and options */
	public int getIndex() {
		return theIndex;
	}

	/** @return The help text for this argument, or null */
	public String getDescription() {
		return theDescription;
	}

	/** @return The placeholder for this argument's values in usage text, e.g. "FILE" */
	public String getValueName() {
		return theValueName;
	}

	/** @return Whether this argument is omitted from help text */
	public boolean isHidden() {
		return isHidden;
	}

	/** @return The names of the groups this argument is a member of */
	public Set<String> getGroups() {
		return theGroups;
	}

	/**
	 * @return The names of the arguments this argument overrides. When two arguments where either overrides the other are both specified,
	 *         the one specified last wins and the other is dropped as if it had not been specified.
	 */
	public Set<String> getOverrides() {
		return theOverrides;
	}

	/**
	 * @param other The other argument
	 * @return Whether specifying either of this argument or the other one drops an earlier occurrence of the other
	 */
	public boolean overridesWith(ArgumentSpec other) {
		return theOverrides.contains(other.getName()) || other.getOverrides().contains(theName);
	}

	/**
	 * @param value The value to test
	 * @return The value as it should be bound (the declared spelling if case is ignored), or null if the value is not one of this
	 *         argument's {@link #getPossibleValues() possible values}
	 */
	public String acceptValue(String value) {
		if (thePossibleValues == null)
			return value;
		else if (thePossibleValues.contains(value))
			return value;
		else if (isIgnoringCase) {
			for (String pv : thePossibleValues) {
				if (pv.equalsIgnoreCase(value))
					return pv;
			}
		}
		return null;
	}

	/** @return How this argument is typed on the command line, for messages, e.g. "--name" or "&lt;FILE&gt;" */
	public String getDisplayName() {
		if (theLongName != null)
			return "--" + theLongName;
		else if (theShortName != null)
			return "-" + theShortName;
		else
			return "<" + theValueName + ">";
	}

	/** @return The value placeholder(s) for this argument, e.g. "&lt;NAME&gt;" or "&lt;FILE&gt;..." */
	public String printValues() {
		if (!takesValues())
			return "";
		StringBuilder str = new StringBuilder();
		int printed = Math.max(theMinValues, 1);
		for (int i = 0; i < printed; i++) {
			if (i > 0)
				str.append(' ');
			str.append('<').append(theValueName).append('>');
		}
		if (theMaxValues > printed || (isMultiple && !isPositional()))
			str.append("...");
		return str.toString();
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder();
		if (theShortName != null) {
			str.append('-').append(theShortName.charValue());
			if (theLongName != null)
				str.append(", ");
		}
		if (theLongName != null)
			str.append("--").append(theLongName);
		if (takesValues()) {
			if (str.length() > 0)
				str.append(' ');
			str.append(printValues());
		}
		return str.toString();
	}

	/** Collects the declaration of an {@link ArgumentSpec} */
	public static class Builder {
		final String theName;
		final ArgumentKind theKind;
		Character theShortName;
		String theLongName;
		final List<String> theAliases;
		final List<String> theVisibleAliases;
		boolean isRequired;
		boolean isMultiple;
		int theMinValues;
		int theMaxValues;
		private boolean isArityDeclared;
		String theDefaultValue;
		Set<String> thePossibleValues;
		boolean isIgnoringCase;
		Character theValueDelimiter;
		int theIndex;
		String theDescription;
		String theValueName;
		boolean isHidden;
		final Set<String> theOverrides;

		Builder(String name, ArgumentKind kind) {
			theName = name;
			theKind = kind;
			theAliases = new ArrayList<>(2);
			theVisibleAliases = new ArrayList<>(2);
			theOverrides = new LinkedHashSet<>(2);
			switch (kind) {
			case FLAG:
				theLongName = name;
				theMinValues = theMaxValues = 0;
				break;
			case OPTION:
				theLongName = name;
				theMinValues = theMaxValues = 1;
				break;
			case POSITIONAL:
				theMinValues = theMaxValues = 1;
				break;
			}
		}

		/**
		 * @param shortName The single-character form of the argument, e.g. 'v' for "-v"
		 * @return This builder
		 */
		public Builder withShort(char shortName) {
			theShortName = shortName;
			return this;
		}

		/**
		 * @param longName The long form of the argument (without the leading "--"), or null for a short-only argument. This defaults to
		 *        the argument's name.
		 * @return This builder
		 */
		public Builder withLong(String longName) {
			theLongName = longName;
			return this;
		}

		/**
		 * Makes the argument accessible only through its {@link #withShort(char) short form}
		 *
		 * @return This builder
		 */
		public Builder shortOnly() {
			return withLong(null);
		}

		/**
		 * @param alias Another long form to accept for the argument, not shown in help
		 * @return This builder
		 */
		public Builder alias(String alias) {
			theAliases.add(alias);
			return this;
		}

		/**
		 * @param alias Another long form to accept for the argument, listed in help
		 * @return This builder
		 */
		public Builder visibleAlias(String alias) {
			theVisibleAliases.add(alias);
			return this;
		}

		/** @return This builder, marking the argument as required */
		public Builder required() {
			isRequired = true;
			return this;
		}

		/** @return This builder, marking the argument as optional (the default) */
		public Builder optional() {
			isRequired = false;
			return this;
		}

		/**
		 * Allows a flag or option to be specified more than once, or a positional to absorb any number of values
		 *
		 * @return This builder
		 */
		public Builder multiple() {
			isMultiple = true;
			if (theKind == ArgumentKind.POSITIONAL && !isArityDeclared)
				theMaxValues = UNBOUNDED;
			return this;
		}

		/**
		 * @param minValues The minimum number of values the argument consumes per occurrence
		 * @param maxValues The maximum number of values the argument consumes per occurrence, or {@link ArgumentSpec#UNBOUNDED}
		 * @return This builder
		 */
		public Builder withValues(int minValues, int maxValues) {
			theMinValues = minValues;
			theMaxValues = maxValues;
			isArityDeclared = true;
			return this;
		}

		/**
		 * @param value The value to bind to the argument if it is not specified
		 * @return This builder
		 */
		public Builder defaultValue(String value) {
			theDefaultValue = value;
			return this;
		}

		/**
		 * @param values The closed set of values the argument accepts
		 * @return This builder
		 */
		public Builder possibleValues(String... values) {
			return possibleValues(Arrays.asList(values));
		}

		/**
		 * @param values The closed set of values the argument accepts
		 * @return This builder
		 */
		public Builder possibleValues(Collection<String> values) {
			thePossibleValues = new LinkedHashSet<>(values);
			return this;
		}

		/** @return This builder, matching {@link #possibleValues(String...) possible values} without regard to case */
		public Builder ignoreCase() {
			isIgnoringCase = true;
			return this;
		}

		/**
		 * @param delimiter The character on which each supplied value is split into multiple values, e.g. ',' for "--ids=1,2,3"
		 * @return This builder
		 */
		public Builder valueDelimiter(char delimiter) {
			theValueDelimiter = delimiter;
			return this;
		}

		/**
		 * @param index The 1-based index of the positional argument. By default positionals are indexed in declaration order.
		 * @return This builder
		 */
		public Builder index(int index) {
			theIndex = index;
			return this;
		}

		/**
		 * @param descrip The help text for the argument
		 * @return This builder
		 */
		public Builder withDescription(String descrip) {
			theDescription = descrip;
			return this;
		}

		/**
		 * @param valueName The placeholder for the argument's values in usage text. Defaults to the upper-cased argument name.
		 * @return This builder
		 */
		public Builder valueName(String valueName) {
			theValueName = valueName;
			return this;
		}

		/** @return This builder, omitting the argument from help text */
		public Builder hidden() {
			isHidden = true;
			return this;
		}

		/**
		 * Declares that this argument and each of the given flags or options cancel each other out, so that whichever is specified last is
		 * the one bound. A required argument is satisfied by one that overrides it.
		 *
		 * @param others The names of the flags or options this argument overrides
		 * @return This builder
		 */
		public Builder overrides(String... others) {
			theOverrides.addAll(Arrays.asList(others));
			return this;
		}

		void validate(String commandPath) throws SpecConfigException {
			if (theName == null || theName.isEmpty())
				throw new SpecConfigException(ConfigErrorKind.MISSING_IDENTITY, commandPath, theName, "Arguments must be named");
			if (theKind == ArgumentKind.POSITIONAL) {
				if (theShortName != null || theLongName != null || !theAliases.isEmpty() || !theVisibleAliases.isEmpty())
					throw new SpecConfigException(ConfigErrorKind.INVALID_IDENTITY, commandPath, theName,
						"Positional argument " + theName + " cannot have a short or long form");
			} else {
				if (theShortName == null && theLongName == null)
					throw new SpecConfigException(ConfigErrorKind.MISSING_IDENTITY, commandPath, theName,
						"The " + theKind.display + " " + theName + " needs a short form, a long form, or both");
				if (theShortName != null && (theShortName.charValue() == '-' || theShortName.charValue() == '='
					|| Character.isWhitespace(theShortName.charValue())))
					throw new SpecConfigException(ConfigErrorKind.INVALID_IDENTITY, commandPath, theName,
						"'" + theShortName + "' cannot be used as a short form");
				if (theLongName != null)
					validateLongName(commandPath, theLongName);
				for (String alias : theAliases)
					validateLongName(commandPath, alias);
				for (String alias : theVisibleAliases)
					validateLongName(commandPath, alias);
			}
			if (theIndex != 0 && theKind != ArgumentKind.POSITIONAL)
				throw new SpecConfigException(ConfigErrorKind.INVALID_POSITIONAL_ORDERING, commandPath, theName,
					"Only positional arguments may declare an index");
			if (theKind == ArgumentKind.FLAG) {
				if (theMaxValues != 0 || theValueDelimiter != null || thePossibleValues != null)
					throw new SpecConfigException(ConfigErrorKind.INVALID_ARITY, commandPath, theName,
						"Flag " + theName + " cannot take values");
				if (theDefaultValue != null)
					throw new SpecConfigException(ConfigErrorKind.INVALID_DEFAULT, commandPath, theName,
						"Flag " + theName + " cannot have a default value");
			} else {
				if (theMinValues < 1 || theMaxValues < theMinValues)
					throw new SpecConfigException(ConfigErrorKind.INVALID_ARITY, commandPath, theName,
						"Invalid value count range for " + theName + ": " + theMinValues + ".." + theMaxValues);
				if (thePossibleValues != null && thePossibleValues.isEmpty())
					throw new SpecConfigException(ConfigErrorKind.INVALID_ARITY, commandPath, theName,
						"Argument " + theName + " declares an empty set of possible values");
				if (theDefaultValue != null && thePossibleValues != null && !acceptsDefault())
					throw new SpecConfigException(ConfigErrorKind.INVALID_DEFAULT, commandPath, theName,
						"Default value \"" + theDefaultValue + "\" of " + theName + " is not one of its possible values " + thePossibleValues);
			}
		}

		private boolean acceptsDefault() {
			List<String> values;
			if (theValueDelimiter != null)
				values = ArgumentMatcher.split(theDefaultValue, theValueDelimiter.charValue());
			else
				values = Collections.singletonList(theDefaultValue);
			for (String value : values) {
				if (!isPossible(value))
					return false;
			}
			return true;
		}

		private boolean isPossible(String value) {
			if (thePossibleValues.contains(value))
				return true;
			if (isIgnoringCase) {
				for (String pv : thePossibleValues) {
					if (pv.equalsIgnoreCase(value))
						return true;
				}
			}
			return false;
		}

		private void validateLongName(String commandPath, String longName) {
			if (longName.isEmpty() || longName.startsWith("-") || longName.indexOf('=') >= 0)
				throw new SpecConfigException(ConfigErrorKind.INVALID_IDENTITY, commandPath, theName,
					"\"" + longName + "\" cannot be used as a long form");
			for (int c = 0; c < longName.length(); c++) {
				if (Character.isWhitespace(longName.charAt(c)))
					throw new SpecConfigException(ConfigErrorKind.INVALID_IDENTITY, commandPath, theName,
						"\"" + longName + "\" cannot be used as a long form");
			}
		}

		ArgumentSpec create(int index, Collection<String> groups) {
			return new ArgumentSpec(this, index, groups);
		}
	}
}
