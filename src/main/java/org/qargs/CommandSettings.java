package org.qargs;

/**
 * Parsing behaviors of a {@link CommandSpec}. Subcommands inherit their parent's settings except for those they override, with the
 * exceptions of {@link #isSubcommandRequired()}, {@link #isHelpOnEmpty()} and {@link #isTrailingVarArg()}, which apply only to the command
 * they are set on.
 */
public class CommandSettings {
	/** The edit distance within which an unknown name is matched to a suggestion when nothing else is configured */
	public static final int DEFAULT_SUGGESTION_DISTANCE = 2;

	/** The settings of a root command that configures nothing */
	public static final CommandSettings DEFAULT = new CommandSettings(true, true, false, false, false, false, DEFAULT_SUGGESTION_DISTANCE,
		HelpSettings.DEFAULT);

	private final boolean isAutoHelp;
	private final boolean isHelpSubcommand;
	private final boolean isHelpOnEmpty;
	private final boolean isSubcommandRequired;
	private final boolean isAllowingNegativeNumbers;
	private final boolean isTrailingVarArg;
	private final int theSuggestionDistance;
	private final HelpSettings theHelp;

	CommandSettings(boolean autoHelp, boolean helpSubcommand, boolean helpOnEmpty, boolean subcommandRequired,
		boolean allowNegativeNumbers, boolean trailingVarArg, int suggestionDistance, HelpSettings help) {
		isAutoHelp = autoHelp;
		isHelpSubcommand = helpSubcommand;
		isHelpOnEmpty = helpOnEmpty;
		isSubcommandRequired = subcommandRequired;
		isAllowingNegativeNumbers = allowNegativeNumbers;
		isTrailingVarArg = trailingVarArg;
		theSuggestionDistance = suggestionDistance;
		theHelp = help;
	}

	/** @return Whether "-h" and "--help" request help for the command, where the author has not declared those forms */
	public boolean isAutoHelp() {
		return isAutoHelp;
	}

	/** @return Whether "help [subcommand...]" requests help, where the command has subcommands */
	public boolean isHelpSubcommand() {
		return isHelpSubcommand;
	}

	/** @return Whether parsing an empty argument list for the command requests its help */
	public boolean isHelpOnEmpty() {
		return isHelpOnEmpty;
	}

	/** @return Whether the command fails to parse if no subcommand is chosen */
	public boolean isSubcommandRequired() {
		return isSubcommandRequired;
	}

	/** @return Whether strings like "-5" or "-2.5" are parsed as values rather than flags */
	public boolean isAllowingNegativeNumbers() {
		return isAllowingNegativeNumbers;
	}

	/**
	 * @return Whether every string after the first value of the command's last positional argument is a value of that positional, even if it
	 *         looks like a flag or names a subcommand
	 */
	public boolean isTrailingVarArg() {
		return isTrailingVarArg;
	}

	/** @return The maximum edit distance between an unknown name and a known one for the known one to be suggested */
	public int getSuggestionDistance() {
		return theSuggestionDistance;
	}

	/** @return The layout of the command's help text */
	public HelpSettings getHelp() {
		return theHelp;
	}

	@Override
	public String toString() {
		return "autoHelp=" + isAutoHelp + ", helpSubcommand=" + isHelpSubcommand + ", helpOnEmpty=" + isHelpOnEmpty
			+ ", subcommandRequired=" + isSubcommandRequired + ", negativeNumbers=" + isAllowingNegativeNumbers + ", trailingVarArg=" + isTrailingVarArg + ", suggestions="
			+ theSuggestionDistance + ", help=(" + theHelp + ")";
	}

	/** Overrides some settings for a command, inheriting the rest from its parent */
	public static class Builder {
		private Boolean isAutoHelp;
		private Boolean isHelpSubcommand;
		private Boolean isHelpOnEmpty;
		private boolean isSubcommandRequired;
		private Boolean isAllowingNegativeNumbers;
		private boolean isTrailingVarArg;
		private Integer theSuggestionDistance;
		private HelpSettings theHelp;

		Builder() {}

		/**
		 * @param autoHelp Whether "-h" and "--help" request help
		 * @return This builder
		 */
		public Builder autoHelp(boolean autoHelp) {
			isAutoHelp = autoHelp;
			return this;
		}

		/**
		 * @param helpSubcommand Whether "help [subcommand...]" requests help
		 * @return This builder
		 */
		public Builder helpSubcommand(boolean helpSubcommand) {
			isHelpSubcommand = helpSubcommand;
			return this;
		}

		/**
		 * @param helpOnEmpty Whether an empty argument list requests help. Unlike most settings, this is not inherited by subcommands.
		 * @return This builder
		 */
		public Builder helpOnEmpty(boolean helpOnEmpty) {
			isHelpOnEmpty = helpOnEmpty;
			return this;
		}

		/**
		 * @param required Whether a subcommand must be chosen
		 * @return This builder
		 */
		public Builder subcommandRequired(boolean required) {
			isSubcommandRequired = required;
			return this;
		}

		/**
		 * @param allow Whether strings like "-5" are values rather than flags
		 * @return This builder
		 */
		public Builder allowNegativeNumbers(boolean allow) {
			isAllowingNegativeNumbers = allow;
			return this;
		}

		/**
		 * @param trailing Whether the strings after the first value of the last positional all belong to it. The last positional must accept
		 *        multiple values. Not inherited by subcommands.
		 * @return This builder
		 */
		public Builder trailingVarArg(boolean trailing) {
			isTrailingVarArg = trailing;
			return this;
		}

		/**
		 * @param distance The maximum edit distance for suggestions, or 0 to never suggest
		 * @return This builder
		 */
		public Builder suggestionDistance(int distance) {
			if (distance < 0)
				throw new IllegalArgumentException("Suggestion distance cannot be negative: " + distance);
			theSuggestionDistance = distance;
			return this;
		}

		/**
		 * @param help The layout of help text
		 * @return This builder
		 */
		public Builder help(HelpSettings help) {
			theHelp = help;
			return this;
		}

		CommandSettings resolve(CommandSettings parent) {
			if (parent == null)
				parent = DEFAULT;
			return new CommandSettings(//
				isAutoHelp != null ? isAutoHelp : parent.isAutoHelp, //
				isHelpSubcommand != null ? isHelpSubcommand : parent.isHelpSubcommand, //
				isHelpOnEmpty != null && isHelpOnEmpty.booleanValue(), //
				isSubcommandRequired, //
				isAllowingNegativeNumbers != null ? isAllowingNegativeNumbers : parent.isAllowingNegativeNumbers, //
				isTrailingVarArg, //
				theSuggestionDistance != null ? theSuggestionDistance : parent.theSuggestionDistance, //
				theHelp != null ? theHelp : parent.theHelp);
		}
	}
}
