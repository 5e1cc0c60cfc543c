package org.qargs;

import org.apache.log4j.Logger;

/**
 * Checks a bound {@link ParseResult} against the constraints of its commands. Each level is checked in a fixed order (required arguments,
 * conflicts, requirements, one-required groups, then the subcommand requirement) before the level below it, and the first violation found
 * is the one reported. A required argument is satisfied by a present argument that overrides it.
 */
class ArgumentValidator {
	private static final Logger log = Logger.getLogger(ArgumentValidator.class);

	private ArgumentValidator() {}

	static void validate(ParseResult result) throws ArgumentParseException {
		for (ParseResult level = result; level != null; level = level.getSubcommand())
			validateLevel(level);
	}

	private static void validateLevel(ParseResult level) throws ArgumentParseException {
		CommandSpec command = level.getCommand();
		Binding binding = level.getBinding();
		for (ArgumentSpec arg : command.getArguments()) {
			if (arg.isRequired() && !binding.has(arg.getName()) && !isOverridden(command, binding, arg))
				throw fail(ParseError.missingRequired(command, arg));
		}
		for (GroupSpec group : command.getGroups()) {
			if (group.getKind() != GroupSpec.Kind.CONFLICT)
				continue;
			ArgumentSpec first = null;
			// Members are reported in argument declaration order, whatever order the group lists them in
			for (ArgumentSpec arg : command.getArguments()) {
				if (!group.getMembers().contains(arg.getName()) || !binding.isPresent(arg.getName()))
					continue;
				if (first == null)
					first = arg;
				else
					throw fail(ParseError.conflicting(command, group, first, arg));
			}
		}
		for (GroupSpec group : command.getGroups()) {
			if (group.getKind() != GroupSpec.Kind.REQUIRES || !binding.isPresent(group.getTrigger()))
				continue;
			for (String required : group.getRequired()) {
				if (!binding.isPresent(required))
					throw fail(ParseError.requirementUnmet(command, group, command.getArgument(group.getTrigger()),
						command.getArgument(required)));
			}
		}
		for (GroupSpec group : command.getGroups()) {
			if (group.getKind() != GroupSpec.Kind.ONE_REQUIRED)
				continue;
			boolean any = false;
			for (String member : group.getMembers()) {
				if (binding.isPresent(member)) {
					any = true;
					break;
				}
			}
			if (!any)
				throw fail(ParseError.oneRequiredUnmet(command, group));
		}
		if (command.getSettings().isSubcommandRequired() && level.getSubcommand() == null)
			throw fail(ParseError.missingSubcommand(command));
	}

	private static boolean isOverridden(CommandSpec command, Binding binding, ArgumentSpec arg) {
		for (ArgumentSpec other : command.getArguments()) {
			if (other != arg && other.overridesWith(arg) && binding.isPresent(other.getName()))
				return true;
		}
		return false;
	}

	private static ArgumentParseException fail(ParseError error) {
		log.debug(error.getCommand().getPath() + ": " + error.getKind() + " " + error.getMessage());
		return new ArgumentParseException(error);
	}
}
