package org.qargs;

import java.util.function.Supplier;

import org.junit.Assert;
import org.qargs.SpecConfigException.ConfigErrorKind;

/** Assertions shared by the Qargs tests */
public class QargsTestUtils {
	private QargsTestUtils() {}

	/**
	 * @param outcome The parse outcome to check
	 * @return The parse result
	 */
	public static ParseResult assertSuccess(ParseOutcome outcome) {
		if (!outcome.isSuccess())
			Assert.fail("Expected a successful parse, but got " + outcome);
		return outcome.getResult();
	}

	/**
	 * @param outcome The parse outcome to check
	 * @param kind The expected kind of error
	 * @return The parse error
	 */
	public static ParseError assertFailure(ParseOutcome outcome, ParseErrorKind kind) {
		if (outcome.getType() != ParseOutcome.Type.FAILURE)
			Assert.fail("Expected " + kind + ", but got " + outcome);
		ParseError error = outcome.getError();
		Assert.assertEquals(error.getMessage(), kind, error.getKind());
		return error;
	}

	/**
	 * @param outcome The parse outcome to check
	 * @param commandPath The path of the command help is expected for
	 * @return The help text
	 */
	public static String assertHelp(ParseOutcome outcome, String commandPath) {
		if (!outcome.isHelpRequested())
			Assert.fail("Expected help for " + commandPath + ", but got " + outcome);
		Assert.assertEquals(commandPath, outcome.getCommand().getPath());
		return outcome.getHelpText();
	}

	/**
	 * @param kind The expected kind of declaration error
	 * @param build Builds the command, expected to fail
	 * @return The thrown exception
	 */
	public static SpecConfigException assertConfigError(ConfigErrorKind kind, Supplier<CommandSpec> build) {
		try {
			CommandSpec built = build.get();
			Assert.fail("Expected " + kind + ", but built " + built);
			return null;
		} catch (SpecConfigException e) {
			Assert.assertEquals(e.getMessage(), kind, e.getKind());
			return e;
		}
	}
}
