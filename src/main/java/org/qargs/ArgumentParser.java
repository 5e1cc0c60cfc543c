package org.qargs;

import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * <p>
 * Parses command lines against a {@link CommandSpec}.
 * </p>
 * <p>
 * Example:
 *
 * <pre>
 * CommandSpec app = CommandSpec.build("app")//
 * 	.flag("verbose", f -&gt; f.withShort('v').multiple())//
 * 	.option("name", o -&gt; o.withShort('n').required())//
 * 	.positional("file", p -&gt; p.multiple())//
 * 	.build();
 * ParseOutcome outcome = ArgumentParser.parse(app, "-vv", "--name=x", "a.txt", "b.txt");
 * if (outcome.isSuccess())
 * 	outcome.getResult().getBinding().getValues("file"); // [a.txt, b.txt]
 * </pre>
 * </p>
 * <p>
 * Parsing is a single left-to-right pass over the strings that binds them to the command's arguments, descending into any subcommand
 * named along the way, followed by validation of the command's groups and required arguments, outermost command first. The parse stops at
 * the first problem.
 * </p>
 */
public class ArgumentParser {
	private static final Logger log = Logger.getLogger(ArgumentParser.class);

	private ArgumentParser() {}

	/**
	 * @param command The command to parse for
	 * @param args The command-line strings, not including the program name
	 * @return The outcome of the parse. Problems with the strings are reported as {@link ParseOutcome.Type#FAILURE failures}, never thrown.
	 */
	public static ParseOutcome parse(CommandSpec command, String... args) {
		return parse(command, Arrays.asList(args));
	}

	/**
	 * @param command The command to parse for
	 * @param args The command-line strings, not including the program name
	 * @return The outcome of the parse. Problems with the strings are reported as {@link ParseOutcome.Type#FAILURE failures}, never thrown.
	 */
	public static ParseOutcome parse(CommandSpec command, List<String> args) {
		try {
			return ParseOutcome.success(parseOrThrow(command, args));
		} catch (ArgumentParseException e) {
			return ParseOutcome.failure(e.getError());
		} catch (HelpRequestedException e) {
			return ParseOutcome.help(e.getCommand(), e.getHelpText());
		}
	}

	/**
	 * @param command The command to parse for
	 * @param args The command-line strings, not including the program name
	 * @return The bound and validated result
	 * @throws ArgumentParseException If the strings cannot be parsed
	 * @throws HelpRequestedException If the strings request help
	 */
	public static ParseResult parseOrThrow(CommandSpec command, List<String> args) throws ArgumentParseException, HelpRequestedException {
		if (log.isDebugEnabled())
			log.debug("Parsing " + args + " for " + command.getPath());
		ParseResult result = new ArgumentMatcher(new Tokenizer(command, args, 0)).bind();
		ArgumentValidator.validate(result);
		return result;
	}
}
