package org.qargs;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.junit.Assert.assertThat;
import static org.qargs.QargsTestUtils.assertFailure;
import static org.qargs.QargsTestUtils.assertHelp;
import static org.qargs.QargsTestUtils.assertSuccess;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/** Tests binding of command lines with {@link ArgumentParser} */
public class ArgumentParserTest {
	private CommandSpec theApp;

	/** Declares the command most tests parse for */
	@Before
	public void setup() {
		theApp = CommandSpec.build("app")//
			.flag("verbose", f -> f.withShort('v').multiple())//
			.option("name", o -> o.withShort('n').required())//
			.positional("file", p -> p.multiple())//
			.build();
	}

	/** Tests flags, options and positionals bound together */
	@Test
	public void testBasicBinding() {
		Binding binding = assertSuccess(ArgumentParser.parse(theApp, "-vv", "--name=x", "a.txt", "b.txt")).getBinding();
		Assert.assertEquals(2, binding.getOccurrences("verbose"));
		Assert.assertTrue(binding.getValues("verbose").isEmpty());
		Assert.assertEquals(Arrays.asList("x"), binding.getValues("name"));
		Assert.assertEquals(1, binding.getOccurrences("name"));
		Assert.assertEquals(Arrays.asList("a.txt", "b.txt"), binding.getValues("file"));
		Assert.assertEquals(Arrays.asList("verbose", "name", "file"), Arrays.asList(binding.getMatches().keySet().toArray()));

		binding = assertSuccess(ArgumentParser.parse(theApp, "--name", "y")).getBinding();
		Assert.assertFalse(binding.isPresent("verbose"));
		Assert.assertNull(binding.getMatch("file"));
		Assert.assertEquals(Collections.emptyList(), binding.getValues("file"));
		Assert.assertEquals("y", binding.getValue("name"));
	}

	/** Tests that a binding refuses names the command does not declare */
	@Test(expected = IllegalArgumentException.class)
	public void testUndeclaredName() {
		assertSuccess(ArgumentParser.parse(theApp, "--name", "y")).getBinding().getValue("nope");
	}

	/** Tests that the same command line always gives the same outcome */
	@Test
	public void testIdempotence() {
		Assert.assertEquals(ArgumentParser.parse(theApp, "-v", "-n", "x", "f"), ArgumentParser.parse(theApp, "-v", "-n", "x", "f"));
		Assert.assertEquals(ArgumentParser.parse(theApp, "-v"), ArgumentParser.parse(theApp, "-v"));
	}

	/** Tests that a missing required option is reported after binding */
	@Test
	public void testMissingRequired() {
		ParseError error = assertFailure(ArgumentParser.parse(theApp, "-v"), ParseErrorKind.MISSING_REQUIRED);
		Assert.assertEquals("name", error.getArgument());
		Assert.assertEquals(-1, error.getArgIndex());
		Assert.assertSame(theApp, error.getCommand());
		assertThat(error.getMessage(), containsString("-n, --name <NAME>"));
		Assert.assertEquals("app [FLAGS] --name <NAME> [FILE]...", error.getUsage());
	}

	/** Tests that a cluster of short flags binds like the flags given separately */
	@Test
	public void testClusters() {
		CommandSpec cmd = CommandSpec.build("cmd")//
			.flag("a", f -> f.withShort('a').shortOnly())//
			.flag("b", f -> f.withShort('b').shortOnly())//
			.flag("c", f -> f.withShort('c').shortOnly())//
			.option("out", o -> o.withShort('o'))//
			.build();
		ParseResult clustered = assertSuccess(ArgumentParser.parse(cmd, "-abc"));
		Assert.assertEquals(assertSuccess(ArgumentParser.parse(cmd, "-a", "-b", "-c")), clustered);
		Assert.assertTrue(clustered.isPresent("c"));

		// An option in a cluster takes the rest of the cluster as its value
		Binding binding = assertSuccess(ArgumentParser.parse(cmd, "-aofile")).getBinding();
		Assert.assertTrue(binding.isPresent("a"));
		Assert.assertFalse(binding.isPresent("b"));
		Assert.assertEquals("file", binding.getValue("out"));

		binding = assertSuccess(ArgumentParser.parse(cmd, "-bo", "file")).getBinding();
		Assert.assertEquals("file", binding.getValue("out"));
	}

	/** Tests the equivalent ways of giving a short option its value */
	@Test
	public void testShortValueForms() {
		ParseResult expected = assertSuccess(ArgumentParser.parse(theApp, "-n", "5"));
		Assert.assertEquals("5", expected.getValue("name"));
		Assert.assertEquals(expected, assertSuccess(ArgumentParser.parse(theApp, "-n5")));
		Assert.assertEquals(expected, assertSuccess(ArgumentParser.parse(theApp, "-n=5")));
		Assert.assertEquals(expected, assertSuccess(ArgumentParser.parse(theApp, "--name=5")));
	}

	/** Tests that everything after "--" is positional */
	@Test
	public void testEndOfOptions() {
		Binding binding = assertSuccess(ArgumentParser.parse(theApp, "--name", "x", "--", "-v", "--name", "--")).getBinding();
		Assert.assertFalse(binding.isPresent("verbose"));
		Assert.assertEquals("x", binding.getValue("name"));
		Assert.assertEquals(Arrays.asList("-v", "--name", "--"), binding.getValues("file"));

		// "-" alone is a value
		binding = assertSuccess(ArgumentParser.parse(theApp, "-n", "x", "-")).getBinding();
		Assert.assertEquals(Arrays.asList("-"), binding.getValues("file"));
	}

	/** Tests closed value sets */
	@Test
	public void testPossibleValues() {
		CommandSpec cmd = CommandSpec.build("cmd")//
			.option("color", o -> o.possibleValues("always", "never", "auto"))//
			.option("mode", o -> o.possibleValues("Fast", "Slow").ignoreCase())//
			.build();
		Assert.assertEquals("never", assertSuccess(ArgumentParser.parse(cmd, "--color", "never")).getValue("color"));
		ParseError error = assertFailure(ArgumentParser.parse(cmd, "--color=sometimes"), ParseErrorKind.INVALID_VALUE);
		Assert.assertEquals("color", error.getArgument());
		Assert.assertEquals("--color=sometimes", error.getToken());
		assertThat(error.getMessage(), containsString("[values: always, never, auto]"));
		assertFailure(ArgumentParser.parse(cmd, "--color=ALWAYS"), ParseErrorKind.INVALID_VALUE);

		// Case-insensitive values bind with the declared spelling
		Assert.assertEquals("Fast", assertSuccess(ArgumentParser.parse(cmd, "--mode=fAST")).getValue("mode"));
	}

	/** Tests that a flag given a value is rejected */
	@Test
	public void testUnexpectedValue() {
		ParseError error = assertFailure(ArgumentParser.parse(theApp, "-n", "x", "--verbose=yes"), ParseErrorKind.UNEXPECTED_VALUE);
		Assert.assertEquals("verbose", error.getArgument());
		Assert.assertEquals(2, error.getArgIndex());
		error = assertFailure(ArgumentParser.parse(theApp, "-v=yes", "-n", "x"), ParseErrorKind.UNEXPECTED_VALUE);
		Assert.assertEquals(0, error.getArgIndex());
	}

	/** Tests that a non-repeatable argument given twice is rejected */
	@Test
	public void testTooManyOccurrences() {
		ParseError error = assertFailure(ArgumentParser.parse(theApp, "--name", "a", "-n", "b"), ParseErrorKind.TOO_MANY_OCCURRENCES);
		Assert.assertEquals("name", error.getArgument());
		Assert.assertEquals("-n", error.getToken());
		Assert.assertEquals(2, error.getArgIndex());
	}

	/** Tests unknown switches and the suggestions offered for them */
	@Test
	public void testUnknownArguments() {
		ParseError error = assertFailure(ArgumentParser.parse(theApp, "--nmae", "x"), ParseErrorKind.UNKNOWN_ARGUMENT);
		Assert.assertEquals("--nmae", error.getToken());
		Assert.assertEquals(0, error.getArgIndex());
		Assert.assertEquals("--name", error.getSuggestion());
		assertThat(error.getMessage(), containsString("Did you mean '--name'?"));

		error = assertFailure(ArgumentParser.parse(theApp, "-n", "x", "--zzzzzz"), ParseErrorKind.UNKNOWN_ARGUMENT);
		Assert.assertEquals(2, error.getArgIndex());
		assertThat(error.getSuggestion(), is(nullValue()));

		error = assertFailure(ArgumentParser.parse(theApp, "-vx"), ParseErrorKind.UNKNOWN_ARGUMENT);
		Assert.assertEquals("-x", error.getToken());
		Assert.assertNull(error.getSuggestion());

		CommandSpec quiet = CommandSpec.build("quiet")//
			.option("name", null)//
			.withSettings(s -> s.suggestionDistance(0))//
			.build();
		Assert.assertNull(assertFailure(ArgumentParser.parse(quiet, "--nmae", "x"), ParseErrorKind.UNKNOWN_ARGUMENT).getSuggestion());

		CommandSpec noPositionals = CommandSpec.build("np").flag("all", null).build();
		error = assertFailure(ArgumentParser.parse(noPositionals, "--all", "stray"), ParseErrorKind.UNKNOWN_ARGUMENT);
		Assert.assertEquals("stray", error.getToken());
		Assert.assertEquals(1, error.getArgIndex());
	}

	/** Tests a long form with no name before its '=' */
	@Test
	public void testMalformedToken() {
		ParseError error = assertFailure(ArgumentParser.parse(theApp, "-n", "x", "--=y"), ParseErrorKind.MALFORMED_TOKEN);
		Assert.assertEquals(ParseErrorKind.Category.TOKEN, error.getKind().category);
		Assert.assertEquals("--=y", error.getToken());
		Assert.assertEquals(2, error.getArgIndex());
	}

	/** Tests options taking several values per occurrence */
	@Test
	public void testMultipleValues() {
		CommandSpec cmd = CommandSpec.build("cmd")//
			.flag("verbose", f -> f.withShort('v'))//
			.option("files", o -> o.withValues(1, ArgumentSpec.UNBOUNDED))//
			.option("point", o -> o.withValues(2, 2).multiple())//
			.option("ids", o -> o.valueDelimiter(','))//
			.build();
		Binding binding = assertSuccess(ArgumentParser.parse(cmd, "--files", "a", "b", "-v", "--point", "1", "2", "--point=3", "4"))
			.getBinding();
		Assert.assertEquals(Arrays.asList("a", "b"), binding.getValues("files"));
		Assert.assertTrue(binding.isPresent("verbose"));
		Assert.assertEquals(Arrays.asList("1", "2", "3", "4"), binding.getValues("point"));
		Assert.assertEquals(2, binding.getOccurrences("point"));

		ParseError error = assertFailure(ArgumentParser.parse(cmd, "--point", "1", "-v"), ParseErrorKind.MISSING_VALUE);
		Assert.assertEquals("point", error.getArgument());
		Assert.assertEquals("--point", error.getToken());
		Assert.assertEquals(0, error.getArgIndex());
		assertFailure(ArgumentParser.parse(cmd, "--files"), ParseErrorKind.MISSING_VALUE);

		binding = assertSuccess(ArgumentParser.parse(cmd, "--ids=1,2,3")).getBinding();
		Assert.assertEquals(Arrays.asList("1", "2", "3"), binding.getValues("ids"));
		Assert.assertEquals(1, binding.getOccurrences("ids"));
	}

	/** Tests positionals taking a fixed number of values */
	@Test
	public void testPositionalArity() {
		CommandSpec cmd = CommandSpec.build("cmd")//
			.positional("pair", p -> p.withValues(2, 2))//
			.positional("rest", p -> p.multiple())//
			.build();
		Binding binding = assertSuccess(ArgumentParser.parse(cmd, "a", "b", "c", "d")).getBinding();
		Assert.assertEquals(Arrays.asList("a", "b"), binding.getValues("pair"));
		Assert.assertEquals(Arrays.asList("c", "d"), binding.getValues("rest"));

		ParseError error = assertFailure(ArgumentParser.parse(cmd, "a"), ParseErrorKind.MISSING_VALUE);
		Assert.assertEquals("pair", error.getArgument());
		Assert.assertEquals(0, error.getArgIndex());
	}

	/** Tests values bound to arguments that were not given */
	@Test
	public void testDefaults() {
		CommandSpec cmd = CommandSpec.build("cmd")//
			.option("level", o -> o.defaultValue("3"))//
			.option("tags", o -> o.defaultValue("a:b").valueDelimiter(':'))//
			.positional("target", p -> p.required().defaultValue("all"))//
			.build();
		Binding binding = assertSuccess(ArgumentParser.parse(cmd)).getBinding();
		Assert.assertEquals("3", binding.getValue("level"));
		Assert.assertFalse(binding.isPresent("level"));
		Assert.assertTrue(binding.has("level"));
		Assert.assertEquals(ArgumentMatch.Source.DEFAULT, binding.getMatch("level").getSource());
		Assert.assertEquals(0, binding.getOccurrences("level"));
		Assert.assertEquals(Arrays.asList("a", "b"), binding.getValues("tags"));
		Assert.assertEquals("all", binding.getValue("target"));

		binding = assertSuccess(ArgumentParser.parse(cmd, "--level", "5", "x")).getBinding();
		Assert.assertEquals("5", binding.getValue("level"));
		Assert.assertEquals(ArgumentMatch.Source.EXPLICIT, binding.getMatch("level").getSource());
		Assert.assertEquals("x", binding.getValue("target"));
	}

	/** Tests hidden and visible long aliases */
	@Test
	public void testAliases() {
		CommandSpec cmd = CommandSpec.build("cmd")//
			.option("name", o -> o.alias("nom").visibleAlias("nombre"))//
			.build();
		Assert.assertEquals("x", assertSuccess(ArgumentParser.parse(cmd, "--nom", "x")).getValue("name"));
		Assert.assertEquals("y", assertSuccess(ArgumentParser.parse(cmd, "--nombre=y")).getValue("name"));
	}

	/** Tests arguments that override each other, the last one specified winning */
	@Test
	public void testOverrides() {
		CommandSpec cmd = CommandSpec.build("cmd")//
			.flag("color", f -> f.overrides("no-color"))//
			.flag("no-color", null)//
			.option("format", o -> o.required().overrides("json"))//
			.flag("json", null)//
			.build();
		Binding binding = assertSuccess(ArgumentParser.parse(cmd, "--color", "--no-color", "--format", "text")).getBinding();
		Assert.assertFalse(binding.isPresent("color"));
		Assert.assertTrue(binding.isPresent("no-color"));
		Assert.assertEquals("text", binding.getValue("format"));

		// Either side of the declaration may override the other
		binding = assertSuccess(ArgumentParser.parse(cmd, "--no-color", "--color", "--format", "text")).getBinding();
		Assert.assertTrue(binding.isPresent("color"));
		Assert.assertFalse(binding.isPresent("no-color"));

		// A flag overridden and given again is bound once more, not counted as a repeat
		binding = assertSuccess(ArgumentParser.parse(cmd, "--color", "--no-color", "--color", "--json")).getBinding();
		Assert.assertEquals(1, binding.getOccurrences("color"));
		Assert.assertFalse(binding.isPresent("no-color"));

		// A required argument is satisfied by one that overrides it
		binding = assertSuccess(ArgumentParser.parse(cmd, "--format", "text", "--json")).getBinding();
		Assert.assertFalse(binding.isPresent("format"));
		Assert.assertTrue(binding.isPresent("json"));
		binding = assertSuccess(ArgumentParser.parse(cmd, "--json", "--format", "text")).getBinding();
		Assert.assertEquals("text", binding.getValue("format"));
		Assert.assertFalse(binding.isPresent("json"));

		assertFailure(ArgumentParser.parse(cmd, "--color"), ParseErrorKind.MISSING_REQUIRED);
		assertFailure(ArgumentParser.parse(cmd, "--json", "--json"), ParseErrorKind.TOO_MANY_OCCURRENCES);
	}

	/** Tests a last positional that takes every string after its first value */
	@Test
	public void testTrailingValues() {
		CommandSpec exec = CommandSpec.build("exec")//
			.flag("verbose", f -> f.withShort('v'))//
			.positional("program", p -> p.required())//
			.positional("args", p -> p.multiple())//
			.subcommand("list", null)//
			.withSettings(s -> s.trailingVarArg(true))//
			.build();
		Binding binding = assertSuccess(ArgumentParser.parse(exec, "ls", "-v", "x", "-la", "--color", "list", "--")).getBinding();
		Assert.assertEquals("ls", binding.getValue("program"));
		Assert.assertTrue(binding.isPresent("verbose"));
		Assert.assertEquals(Arrays.asList("x", "-la", "--color", "list", "--"), binding.getValues("args"));

		// Switches before the last positional starts are still switches
		assertFailure(ArgumentParser.parse(exec, "ls", "-la"), ParseErrorKind.UNKNOWN_ARGUMENT);

		CommandSpec plain = CommandSpec.build("exec")//
			.positional("program", p -> p.required())//
			.positional("args", p -> p.multiple())//
			.build();
		assertFailure(ArgumentParser.parse(plain, "ls", "x", "-la"), ParseErrorKind.UNKNOWN_ARGUMENT);
	}

	/** Tests values that look like negative numbers */
	@Test
	public void testNegativeNumbers() {
		CommandSpec strict = CommandSpec.build("strict")//
			.option("offset", null)//
			.build();
		assertFailure(ArgumentParser.parse(strict, "--offset", "-5"), ParseErrorKind.MISSING_VALUE);

		CommandSpec lenient = CommandSpec.build("lenient")//
			.option("offset", null)//
			.positional("n", null)//
			.withSettings(s -> s.allowNegativeNumbers(true))//
			.build();
		Binding binding = assertSuccess(ArgumentParser.parse(lenient, "--offset", "-5", "-2.5e3")).getBinding();
		Assert.assertEquals("-5", binding.getValue("offset"));
		Assert.assertEquals("-2.5e3", binding.getValue("n"));
		assertFailure(ArgumentParser.parse(lenient, "-x"), ParseErrorKind.UNKNOWN_ARGUMENT);
	}

	/** Tests the auto-generated help switches */
	@Test
	public void testHelpSwitches() {
		String help = assertHelp(ArgumentParser.parse(theApp, "-h"), "app");
		Assert.assertEquals(HelpWriter.help(theApp), help);
		// Help wins over problems that would only be found later
		assertHelp(ArgumentParser.parse(theApp, "-vh"), "app");
		assertHelp(ArgumentParser.parse(theApp, "--help", "--nope"), "app");
		// But not over problems found earlier
		assertFailure(ArgumentParser.parse(theApp, "--nope", "--help"), ParseErrorKind.UNKNOWN_ARGUMENT);

		CommandSpec own = CommandSpec.build("own")//
			.flag("host", f -> f.withShort('h'))//
			.build();
		Assert.assertTrue(assertSuccess(ArgumentParser.parse(own, "-h")).isPresent("host"));
		assertHelp(ArgumentParser.parse(own, "--help"), "own");

		CommandSpec none = CommandSpec.build("none")//
			.withSettings(s -> s.autoHelp(false))//
			.build();
		assertFailure(ArgumentParser.parse(none, "--help"), ParseErrorKind.UNKNOWN_ARGUMENT);
	}

	/** Tests help for an empty command line */
	@Test
	public void testHelpOnEmpty() {
		CommandSpec cmd = CommandSpec.build("cmd")//
			.option("name", o -> o.required())//
			.subcommand("sub", null)//
			.withSettings(s -> s.helpOnEmpty(true))//
			.build();
		assertHelp(ArgumentParser.parse(cmd), "cmd");
		assertFailure(ArgumentParser.parse(cmd, "--name"), ParseErrorKind.MISSING_VALUE);
		// Not inherited
		ParseResult result = assertSuccess(ArgumentParser.parse(cmd, "--name", "x", "sub"));
		Assert.assertEquals("sub", result.getSubcommandName());
	}

	/** Tests {@link ArgumentParser#parseOrThrow(CommandSpec, java.util.List)} */
	@Test
	public void testParseOrThrow() throws HelpRequestedException {
		try {
			ArgumentParser.parseOrThrow(theApp, Arrays.asList("-v"));
			Assert.fail("Expected a parse error");
		} catch (ArgumentParseException e) {
			Assert.assertEquals(ParseErrorKind.MISSING_REQUIRED, e.getError().getKind());
			Assert.assertEquals(e.getError().getMessage(), e.getMessage());
		}
		try {
			ArgumentParser.parseOrThrow(theApp, Arrays.asList("--help"));
			Assert.fail("Expected a help request");
		} catch (ArgumentParseException e) {
			throw new AssertionError("Expected a help request", e);
		} catch (HelpRequestedException e) {
			Assert.assertSame(theApp, e.getCommand());
		}
	}
}
