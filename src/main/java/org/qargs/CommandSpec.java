package org.qargs;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.apache.log4j.Logger;
import org.qargs.SpecConfigException.ConfigErrorKind;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * <p>
 * The immutable description of a command: the flags, options and positional arguments it accepts, the groups that relate them, and its
 * subcommands, each of which is a CommandSpec of its own.
 * </p>
 * <p>
 * A CommandSpec is built once with {@link #build(String)} and may then be shared freely, including between threads parsing concurrently.
 * All of its declarations are checked when it is built, so a CommandSpec that exists is valid.
 * </p>
 */
public class CommandSpec {
	private static final Logger log = Logger.getLogger(CommandSpec.class);

	private final String theName;
	private final CommandSpec theParent;
	private final ImmutableList<String> theAliases;
	private final ImmutableList<String> theVisibleAliases;
	private final String theAbout;
	private final String theAuthor;
	private final String theBeforeHelp;
	private final String theAfterHelp;
	private final String theHelpTemplate;
	private final boolean isHidden;
	private final CommandSettings theSettings;
	private final ImmutableList<ArgumentSpec> theArguments;
	private final ImmutableMap<String, ArgumentSpec> theArgumentsByName;
	private final ImmutableMap<Character, ArgumentSpec> theShortNames;
	private final ImmutableMap<String, ArgumentSpec> theLongNames;
	private final ImmutableList<ArgumentSpec> thePositionals;
	private final ImmutableList<GroupSpec> theGroups;
	private final ImmutableMap<String, CommandSpec> theSubcommands;
	private final ImmutableMap<String, CommandSpec> theSubcommandLookup;

	private CommandSpec(Builder builder, CommandSpec parent) {
		theName = builder.theName;
		theParent = parent;
		String path = parent == null ? theName : parent.getPath() + " " + theName;
		theAliases = ImmutableList.copyOf(builder.theAliases);
		theVisibleAliases = ImmutableList.copyOf(builder.theVisibleAliases);
		theAbout = builder.theAbout;
		theAuthor = builder.theAuthor;
		theBeforeHelp = builder.theBeforeHelp;
		theAfterHelp = builder.theAfterHelp;
		theHelpTemplate = builder.theHelpTemplate;
		isHidden = builder.isHidden;
		theSettings = builder.theSettings.resolve(parent == null ? null : parent.theSettings);

		// Arguments
		Map<String, List<String>> argGroups = new HashMap<>();
		for (GroupDeclaration group : builder.theGroups) {
			for (String member : group.members)
				argGroups.computeIfAbsent(member, __ -> new ArrayList<>(2)).add(group.name);
		}
		Map<String, ArgumentSpec.Builder> declared = new LinkedHashMap<>();
		Map<Character, String> shortNames = new HashMap<>();
		Map<String, String> longNames = new HashMap<>();
		List<ArgumentSpec.Builder> positionals = new ArrayList<>();
		for (ArgumentSpec.Builder arg : builder.theArguments) {
			arg.validate(path);
			if (declared.put(arg.theName, arg) != null)
				throw fail(ConfigErrorKind.DUPLICATE_IDENTITY, path, arg.theName, "Duplicate argument name: " + arg.theName);
			if (arg.theShortName != null) {
				String other = shortNames.put(arg.theShortName, arg.theName);
				if (other != null)
					throw fail(ConfigErrorKind.DUPLICATE_IDENTITY, path, arg.theName,
						"Arguments " + other + " and " + arg.theName + " share the short form -" + arg.theShortName);
			}
			List<String> longForms = new ArrayList<>(1 + arg.theAliases.size() + arg.theVisibleAliases.size());
			if (arg.theLongName != null)
				longForms.add(arg.theLongName);
			longForms.addAll(arg.theAliases);
			longForms.addAll(arg.theVisibleAliases);
			for (String longForm : longForms) {
				String other = longNames.put(longForm, arg.theName);
				if (other != null)
					throw fail(ConfigErrorKind.DUPLICATE_IDENTITY, path, arg.theName,
						(other.equals(arg.theName) ? "Argument " + other : "Arguments " + other + " and " + arg.theName)
							+ " share the long form --" + longForm);
			}
			if (arg.theKind == ArgumentKind.POSITIONAL)
				positionals.add(arg);
		}
		int[] indexes = indexPositionals(path, positionals);

		ImmutableList.Builder<ArgumentSpec> arguments = ImmutableList.builder();
		ImmutableMap.Builder<String, ArgumentSpec> byName = ImmutableMap.builder();
		ImmutableMap.Builder<Character, ArgumentSpec> byShort = ImmutableMap.builder();
		ImmutableMap.Builder<String, ArgumentSpec> byLong = ImmutableMap.builder();
		ArgumentSpec[] positionalSpecs = new ArgumentSpec[positionals.size()];
		for (ArgumentSpec.Builder argBuilder : declared.values()) {
			int index = 0;
			if (argBuilder.theKind == ArgumentKind.POSITIONAL)
				index = indexes[positionals.indexOf(argBuilder)];
			ArgumentSpec arg = argBuilder.create(index, argGroups.getOrDefault(argBuilder.theName, Collections.emptyList()));
			arguments.add(arg);
			byName.put(arg.getName(), arg);
			if (arg.getShortName() != null)
				byShort.put(arg.getShortName(), arg);
			if (arg.getLongName() != null)
				byLong.put(arg.getLongName(), arg);
			for (String alias : arg.getAliases())
				byLong.put(alias, arg);
			for (String alias : arg.getVisibleAliases())
				byLong.put(alias, arg);
			if (index > 0)
				positionalSpecs[index - 1] = arg;
		}
		theArguments = arguments.build();
		theArgumentsByName = byName.build();
		theShortNames = byShort.build();
		theLongNames = byLong.build();
		thePositionals = ImmutableList.copyOf(positionalSpecs);
		for (ArgumentSpec arg : theArguments) {
			for (String other : arg.getOverrides()) {
				ArgumentSpec overridden = theArgumentsByName.get(other);
				if (overridden == null)
					throw fail(ConfigErrorKind.INVALID_OVERRIDE, path, arg.getName(),
						"Argument " + arg.getName() + " overrides unknown argument " + other);
				else if (overridden == arg || arg.isPositional() || overridden.isPositional())
					throw fail(ConfigErrorKind.INVALID_OVERRIDE, path, arg.getName(),
						"Argument " + arg.getName() + " cannot override " + other + ": only distinct flags and options override each other");
			}
		}
		if (theSettings.isTrailingVarArg() && (thePositionals.isEmpty() || thePositionals.get(thePositionals.size() - 1).getMaxValues() < 2))
			throw fail(ConfigErrorKind.INVALID_POSITIONAL_ORDERING, path, theName,
				"Trailing values need a last positional argument that accepts multiple values");

		// Groups
		ImmutableList.Builder<GroupSpec> groups = ImmutableList.builder();
		Map<String, GroupDeclaration> groupNames = new HashMap<>();
		for (GroupDeclaration group : builder.theGroups) {
			if (groupNames.put(group.name, group) != null)
				throw fail(ConfigErrorKind.DUPLICATE_IDENTITY, path, group.name, "Duplicate group name: " + group.name);
			int minMembers = group.kind == GroupSpec.Kind.ONE_REQUIRED ? 1 : 2;
			if (group.members.size() < minMembers)
				throw fail(ConfigErrorKind.INVALID_GROUP, path, group.name,
					"A " + group.kind.display + " group needs at least " + minMembers + " member" + (minMembers == 1 ? "" : "s") + ": "
						+ group.name);
			List<String> seen = new ArrayList<>(group.members.size());
			for (String member : group.members) {
				if (!theArgumentsByName.containsKey(member))
					throw fail(ConfigErrorKind.UNKNOWN_GROUP_MEMBER, path, group.name,
						"Group " + group.name + " references unknown argument " + member);
				else if (seen.contains(member))
					throw fail(ConfigErrorKind.INVALID_GROUP, path, group.name, "Group " + group.name + " lists " + member + " twice");
				seen.add(member);
			}
			groups.add(new GroupSpec(group.name, group.kind, group.members));
		}
		theGroups = groups.build();

		// Subcommands
		ImmutableMap.Builder<String, CommandSpec> subcommands = ImmutableMap.builder();
		Map<String, CommandSpec> lookup = new LinkedHashMap<>();
		for (Builder subBuilder : builder.theSubcommands) {
			if (subBuilder.theName == null || subBuilder.theName.isEmpty() || subBuilder.theName.startsWith("-"))
				throw fail(ConfigErrorKind.INVALID_IDENTITY, path, subBuilder.theName,
					"\"" + subBuilder.theName + "\" cannot be used as a subcommand name");
			CommandSpec sub = new CommandSpec(subBuilder, this);
			List<String> names = new ArrayList<>(1 + sub.theAliases.size() + sub.theVisibleAliases.size());
			names.add(sub.theName);
			names.addAll(sub.theAliases);
			names.addAll(sub.theVisibleAliases);
			for (String name : names) {
				if (lookup.put(name, sub) != null)
					throw fail(ConfigErrorKind.DUPLICATE_IDENTITY, path, sub.theName, "Duplicate subcommand name: " + name);
			}
			subcommands.put(sub.theName, sub);
		}
		theSubcommands = subcommands.build();
		theSubcommandLookup = ImmutableMap.copyOf(lookup);
	}

	private static int[] indexPositionals(String path, List<ArgumentSpec.Builder> positionals) {
		int[] indexes = new int[positionals.size()];
		for (int i = 0; i < indexes.length; i++)
			indexes[i] = positionals.get(i).theIndex != 0 ? positionals.get(i).theIndex : i + 1;
		ArgumentSpec.Builder[] ordered = new ArgumentSpec.Builder[indexes.length];
		for (int i = 0; i < indexes.length; i++) {
			if (indexes[i] < 1 || indexes[i] > indexes.length)
				throw fail(ConfigErrorKind.INVALID_POSITIONAL_ORDERING, path, positionals.get(i).theName,
					"Positional " + positionals.get(i).theName + " has index " + indexes[i] + ", but there are only " + indexes.length
						+ " positional argument" + (indexes.length == 1 ? "" : "s"));
			if (ordered[indexes[i] - 1] != null)
				throw fail(ConfigErrorKind.INVALID_POSITIONAL_ORDERING, path, positionals.get(i).theName, "Positionals "
					+ ordered[indexes[i] - 1].theName + " and " + positionals.get(i).theName + " share the index " + indexes[i]);
			ordered[indexes[i] - 1] = positionals.get(i);
		}
		boolean optionalSeen = false;
		for (int i = 0; i < ordered.length; i++) {
			ArgumentSpec.Builder pos = ordered[i];
			if (pos.theMaxValues == ArgumentSpec.UNBOUNDED && i < ordered.length - 1)
				throw fail(ConfigErrorKind.INVALID_POSITIONAL_ORDERING, path, pos.theName,
					"Only the last positional argument may accept any number of values, but " + pos.theName + " is followed by "
						+ ordered[i + 1].theName);
			if (pos.isRequired && optionalSeen)
				throw fail(ConfigErrorKind.INVALID_POSITIONAL_ORDERING, path, pos.theName,
					"Required positional " + pos.theName + " cannot follow an optional positional argument");
			optionalSeen |= !pos.isRequired;
		}
		return indexes;
	}

	private static SpecConfigException fail(ConfigErrorKind kind, String path, String subject, String message) {
		SpecConfigException ex = new SpecConfigException(kind, path, subject, message);
		log.debug("Rejected declarations of " + path, ex);
		return ex;
	}

	/** @return The name of this command, as typed to choose it as a subcommand */
	public String getName() {
		return theName;
	}

	/** @return The command this command is a subcommand of, or null for the root command */
	public CommandSpec getParent() {
		return theParent;
	}

	/** @return The names of this command and each of its parents, root first, separated by spaces */
	public String getPath() {
		return theParent == null ? theName : theParent.getPath() + " " + theName;
	}

	/** @return This command and each of its parents, root first */
	public List<CommandSpec> getCommandChain() {
		LinkedList<CommandSpec> chain = new LinkedList<>();
		for (CommandSpec cmd = this; cmd != null; cmd = cmd.theParent)
			chain.addFirst(cmd);
		return Collections.unmodifiableList(chain);
	}

	/** @return Other names that choose this command, not shown in help */
	public List<String> getAliases() {
		return theAliases;
	}

	/** @return Other names that choose this command, listed in help */
	public List<String> getVisibleAliases() {
		return theVisibleAliases;
	}

	/** @return A short description of this command, or null */
	public String getAbout() {
		return theAbout;
	}

	/** @return The author of this command, or null */
	public String getAuthor() {
		return theAuthor;
	}

	/** @return Text printed in help before everything else, or null */
	public String getBeforeHelp() {
		return theBeforeHelp;
	}

	/** @return Text printed in help after everything else, or null */
	public String getAfterHelp() {
		return theAfterHelp;
	}

	/** @return The template help text is printed with, or null for the default layout. See {@link HelpWriter}. */
	public String getHelpTemplate() {
		return theHelpTemplate;
	}

	/** @return Whether this command is omitted from its parent's help */
	public boolean isHidden() {
		return isHidden;
	}

	/** @return The parsing behaviors of this command */
	public CommandSettings getSettings() {
		return theSettings;
	}

	/** @return All arguments declared on this command, in declaration order */
	public List<ArgumentSpec> getArguments() {
		return theArguments;
	}

	/**
	 * @param name The name of the argument
	 * @return The argument declared with the given name
	 * @throws IllegalArgumentException If no such argument is declared on this command
	 */
	public ArgumentSpec getArgument(String name) throws IllegalArgumentException {
		ArgumentSpec arg = theArgumentsByName.get(name);
		if (arg == null)
			throw new IllegalArgumentException("No such argument: \"" + name + "\" in " + getPath());
		return arg;
	}

	/**
	 * @param name The name of the argument
	 * @return The argument declared with the given name, or null if there is no such argument
	 */
	public ArgumentSpec getArgumentIfExists(String name) {
		return theArgumentsByName.get(name);
	}

	/**
	 * @param shortName The short form to look up
	 * @return The flag or option with the given short form, or null
	 */
	public ArgumentSpec forShort(char shortName) {
		return theShortNames.get(shortName);
	}

	/**
	 * @param longName The long form or alias to look up
	 * @return The flag or option with the given long form or alias, or null
	 */
	public ArgumentSpec forLong(String longName) {
		return theLongNames.get(longName);
	}

	/** @return The long forms and visible aliases of the arguments listed in this command's help, in declaration order */
	public List<String> getVisibleLongNames() {
		List<String> names = new ArrayList<>(theLongNames.size());
		for (ArgumentSpec arg : theArguments) {
			if (arg.isHidden())
				continue;
			if (arg.getLongName() != null)
				names.add(arg.getLongName());
			names.addAll(arg.getVisibleAliases());
		}
		return names;
	}

	/** @return The positional arguments of this command, in index order */
	public List<ArgumentSpec> getPositionals() {
		return thePositionals;
	}

	/** @return The groups declared on this command, in declaration order */
	public List<GroupSpec> getGroups() {
		return theGroups;
	}

	/** @return This command's subcommands by name, in declaration order */
	public Map<String, CommandSpec> getSubcommands() {
		return theSubcommands;
	}

	/**
	 * @param name The name or alias of the subcommand
	 * @return The subcommand chosen by the given name, or null
	 */
	public CommandSpec getSubcommand(String name) {
		return theSubcommandLookup.get(name);
	}

	/** @return The names and visible aliases of the subcommands listed in this command's help, in declaration order */
	public List<String> getVisibleSubcommandNames() {
		List<String> names = new ArrayList<>(theSubcommandLookup.size());
		for (CommandSpec sub : theSubcommands.values()) {
			if (sub.isHidden())
				continue;
			names.add(sub.getName());
			names.addAll(sub.getVisibleAliases());
		}
		return names;
	}

	/** @return Whether "-h" requests help for this command */
	public boolean isShortHelpAvailable() {
		return theSettings.isAutoHelp() && !theShortNames.containsKey('h');
	}

	/** @return Whether "--help" requests help for this command */
	public boolean isLongHelpAvailable() {
		return theSettings.isAutoHelp() && !theLongNames.containsKey("help");
	}

	/** @return Whether "help [subcommand...]" requests help for this command */
	public boolean isHelpSubcommandAvailable() {
		return theSettings.isHelpSubcommand() && !theSubcommands.isEmpty() && !theSubcommandLookup.containsKey("help");
	}

	@Override
	public String toString() {
		return getPath();
	}

	/**
	 * @param name The name of the command (typically the program name for a root command)
	 * @return A builder to declare the command's arguments, groups and subcommands
	 */
	public static Builder build(String name) {
		return new Builder(name);
	}

	static class GroupDeclaration {
		final String name;
		final GroupSpec.Kind kind;
		final List<String> members;

		GroupDeclaration(String name, GroupSpec.Kind kind, List<String> members) {
			this.name = name;
			this.kind = kind;
			this.members = members;
		}
	}

	/** Collects the declarations of a {@link CommandSpec} */
	public static class Builder {
		final String theName;
		final List<String> theAliases;
		final List<String> theVisibleAliases;
		String theAbout;
		String theAuthor;
		String theBeforeHelp;
		String theAfterHelp;
		String theHelpTemplate;
		boolean isHidden;
		final CommandSettings.Builder theSettings;
		final List<ArgumentSpec.Builder> theArguments;
		final List<GroupDeclaration> theGroups;
		final List<Builder> theSubcommands;

		Builder(String name) {
			theName = name;
			theAliases = new ArrayList<>(2);
			theVisibleAliases = new ArrayList<>(2);
			theSettings = new CommandSettings.Builder();
			theArguments = new ArrayList<>();
			theGroups = new ArrayList<>();
			theSubcommands = new ArrayList<>();
		}

		/**
		 * Declares a value-less flag argument, whose long form is its name unless configured otherwise
		 *
		 * @param name The name of the flag
		 * @param configure Configures the flag, may be null
		 * @return This builder
		 */
		public Builder flag(String name, Consumer<ArgumentSpec.Builder> configure) {
			return add(name, ArgumentKind.FLAG, configure);
		}

		/**
		 * Declares an option argument, taking 1 value unless configured otherwise, whose long form is its name unless configured otherwise
		 *
		 * @param name The name of the option
		 * @param configure Configures the option, may be null
		 * @return This builder
		 */
		public Builder option(String name, Consumer<ArgumentSpec.Builder> configure) {
			return add(name, ArgumentKind.OPTION, configure);
		}

		/**
		 * Declares a positional argument, indexed after all positionals declared before it unless configured otherwise
		 *
		 * @param name The name of the positional
		 * @param configure Configures the positional, may be null
		 * @return This builder
		 */
		public Builder positional(String name, Consumer<ArgumentSpec.Builder> configure) {
			return add(name, ArgumentKind.POSITIONAL, configure);
		}

		private Builder add(String name, ArgumentKind kind, Consumer<ArgumentSpec.Builder> configure) {
			ArgumentSpec.Builder arg = new ArgumentSpec.Builder(name, kind);
			if (configure != null)
				configure.accept(arg);
			theArguments.add(arg);
			return this;
		}

		/**
		 * @param name The name of the group
		 * @param kind The relationship among the group's members
		 * @param members The names of the arguments in the group
		 * @return This builder
		 */
		public Builder group(String name, GroupSpec.Kind kind, String... members) {
			theGroups.add(new GroupDeclaration(name, kind, Arrays.asList(members)));
			return this;
		}

		/**
		 * @param name The name of the group
		 * @param members The names of arguments of which no two may be specified together
		 * @return This builder
		 */
		public Builder conflict(String name, String... members) {
			return group(name, GroupSpec.Kind.CONFLICT, members);
		}

		/**
		 * @param name The name of the group
		 * @param trigger The name of the argument whose presence requires the others
		 * @param required The names of the arguments required by the trigger
		 * @return This builder
		 */
		public Builder requires(String name, String trigger, String... required) {
			String[] members = new String[required.length + 1];
			members[0] = trigger;
			System.arraycopy(required, 0, members, 1, required.length);
			return group(name, GroupSpec.Kind.REQUIRES, members);
		}

		/**
		 * @param name The name of the group
		 * @param members The names of arguments of which at least one must be specified
		 * @return This builder
		 */
		public Builder oneRequired(String name, String... members) {
			return group(name, GroupSpec.Kind.ONE_REQUIRED, members);
		}

		/**
		 * @param name The name of the subcommand
		 * @param configure Declares the subcommand's arguments, groups and subcommands
		 * @return This builder
		 */
		public Builder subcommand(String name, Consumer<Builder> configure) {
			Builder sub = new Builder(name);
			if (configure != null)
				configure.accept(sub);
			theSubcommands.add(sub);
			return this;
		}

		/**
		 * @param alias Another name that chooses this command as a subcommand, not shown in help
		 * @return This builder
		 */
		public Builder alias(String alias) {
			theAliases.add(alias);
			return this;
		}

		/**
		 * @param alias Another name that chooses this command as a subcommand, listed in help
		 * @return This builder
		 */
		public Builder visibleAlias(String alias) {
			theVisibleAliases.add(alias);
			return this;
		}

		/**
		 * @param about A short description of the command
		 * @return This builder
		 */
		public Builder about(String about) {
			theAbout = about;
			return this;
		}

		/**
		 * @param author The author of the command
		 * @return This builder
		 */
		public Builder author(String author) {
			theAuthor = author;
			return this;
		}

		/**
		 * @param text Text to print in help before everything else
		 * @return This builder
		 */
		public Builder beforeHelp(String text) {
			theBeforeHelp = text;
			return this;
		}

		/**
		 * @param text Text to print in help after everything else
		 * @return This builder
		 */
		public Builder afterHelp(String text) {
			theAfterHelp = text;
			return this;
		}

		/**
		 * @param template The template to print help with. See {@link HelpWriter} for the tags it may contain.
		 * @return This builder
		 */
		public Builder helpTemplate(String template) {
			theHelpTemplate = template;
			return this;
		}

		/** @return This builder, omitting the command from its parent's help */
		public Builder hidden() {
			isHidden = true;
			return this;
		}

		/**
		 * @param configure Overrides parsing behaviors of the command
		 * @return This builder
		 */
		public Builder withSettings(Consumer<CommandSettings.Builder> configure) {
			configure.accept(theSettings);
			return this;
		}

		/**
		 * @return The validated command
		 * @throws SpecConfigException If any of the declarations of this command or its subcommands are invalid
		 */
		public CommandSpec build() throws SpecConfigException {
			return new CommandSpec(this, null);
		}
	}
}
