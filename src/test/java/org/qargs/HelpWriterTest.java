package org.qargs;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.not;
import static org.junit.Assert.assertThat;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/** Tests usage and help rendered by {@link HelpWriter} */
public class HelpWriterTest {
	private CommandSpec theApp;

	/** Declares a command with one of everything */
	@Before
	public void setup() {
		theApp = CommandSpec.build("app")//
			.about("Does things")//
			.author("Jane Doe <jane@example.com>")//
			.flag("verbose", f -> f.withShort('v').multiple().withDescription("Prints more"))//
			.flag("dry-run", f -> f.withDescription("Changes nothing"))//
			.flag("secret", f -> f.hidden())//
			.option("name", o -> o.withShort('n').required().withDescription("The name"))//
			.option("color", o -> o.possibleValues("always", "never").defaultValue("never").withDescription("When to color"))//
			.positional("file", p -> p.required().multiple().withDescription("Input files"))//
			.subcommand("build", b -> b.about("Builds things").visibleAlias("b"))//
			.subcommand("internal", i -> i.hidden())//
			.afterHelp("See the manual for more.")//
			.build();
	}

	/** Tests the usage line */
	@Test
	public void testUsage() {
		Assert.assertEquals("app [FLAGS] [OPTIONS] --name <NAME> <FILE>... [SUBCOMMAND]", HelpWriter.usage(theApp));
		Assert.assertEquals("app build [FLAGS]", HelpWriter.usage(theApp.getSubcommand("build")));
	}

	/** Tests the default help layout */
	@Test
	public void testHelp() {
		String expected = String.join("\n", //
			"app", //
			"Jane Doe <jane@example.com>", //
			"Does things", //
			"", //
			"USAGE:", //
			"    app [FLAGS] [OPTIONS] --name <NAME> <FILE>... [SUBCOMMAND]", //
			"", //
			"ARGS:", //
			"    <FILE>...    Input files", //
			"", //
			"OPTIONS:", //
			"    -n, --name <NAME>      The name", //
			"        --color <COLOR>    When to color [default: never] [values: always, never]", //
			"", //
			"FLAGS:", //
			"    -v, --verbose    Prints more", //
			"        --dry-run    Changes nothing", //
			"    -h, --help       Prints help information", //
			"", //
			"SUBCOMMANDS:", //
			"    build    Builds things [aliases: b]", //
			"    help     Prints this message or the help of the given subcommand(s)", //
			"", //
			"See the manual for more.");
		Assert.assertEquals(expected, HelpWriter.help(theApp));
		// Rendering is deterministic
		Assert.assertEquals(HelpWriter.help(theApp), HelpWriter.help(theApp));
		assertThat(HelpWriter.help(theApp), not(containsString("secret")));
		assertThat(HelpWriter.help(theApp), not(containsString("internal")));
	}

	/** Tests help of a subcommand */
	@Test
	public void testSubcommandHelp() {
		String expected = String.join("\n", //
			"app build", //
			"Builds things", //
			"", //
			"USAGE:", //
			"    app build [FLAGS]", //
			"", //
			"FLAGS:", //
			"    -h, --help    Prints help information");
		Assert.assertEquals(expected, HelpWriter.help(theApp.getSubcommand("build")));
	}

	/** Tests sections that are empty or hold only long forms */
	@Test
	public void testSparseHelp() {
		CommandSpec bare = CommandSpec.build("bare")//
			.withSettings(s -> s.autoHelp(false))//
			.build();
		Assert.assertEquals("bare\n\nUSAGE:\n    bare", HelpWriter.help(bare));

		CommandSpec longOnly = CommandSpec.build("l")//
			.flag("dry-run", f -> f.withDescription("Changes nothing"))//
			.flag("force", null)//
			.beforeHelp("Careful!")//
			.withSettings(s -> s.autoHelp(false))//
			.build();
		String expected = String.join("\n", //
			"Careful!", //
			"", //
			"l", //
			"", //
			"USAGE:", //
			"    l [FLAGS]", //
			"", //
			"FLAGS:", //
			"    --dry-run    Changes nothing", //
			"    --force");
		Assert.assertEquals(expected, HelpWriter.help(longOnly));
	}

	/** Tests wrapping of long descriptions and hiding of annotations */
	@Test
	public void testLayoutSettings() {
		CommandSpec narrow = CommandSpec.build("w")//
			.flag("x", f -> f.withShort('x').withDescription("one two three four five six seven eight"))//
			.withSettings(s -> s.autoHelp(false).help(new HelpSettings(40, true, true)))//
			.build();
		String expected = String.join("\n", //
			"w", //
			"", //
			"USAGE:", //
			"    w [FLAGS]", //
			"", //
			"FLAGS:", //
			"    -x, --x    one two three four five", //
			"               six seven eight");
		Assert.assertEquals(expected, HelpWriter.help(narrow));

		CommandSpec plain = CommandSpec.build("p")//
			.option("color", o -> o.possibleValues("always", "never").defaultValue("never").withDescription("When to color"))//
			.withSettings(s -> s.help(new HelpSettings(0, false, false)))//
			.build();
		assertThat(HelpWriter.help(plain), containsString("    --color <COLOR>    When to color\n"));
		assertThat(HelpWriter.help(plain), not(containsString("[default")));
	}

	/** Tests help templates */
	@Test
	public void testTemplate() {
		CommandSpec cmd = CommandSpec.build("tpl")//
			.about("Templated")//
			.flag("quiet", f -> f.withShort('q').withDescription("Shh"))//
			.subcommand("run", null)//
			.withSettings(s -> s.autoHelp(false))//
			.helpTemplate("{bin} - {about}\n{usage}\n{flags}\n{unknown} {oops")//
			.build();
		Assert.assertEquals("tpl - Templated\ntpl [FLAGS] [SUBCOMMAND]\n    -q, --quiet    Shh\n{unknown} {oops", HelpWriter.help(cmd));
		Assert.assertEquals(HelpWriter.help(cmd), QargsTestUtils.assertHelp(ArgumentParser.parse(cmd, "help"), "tpl"));
	}
}
