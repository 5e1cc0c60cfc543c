package org.qargs;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;
import org.junit.runners.Suite.SuiteClasses;

/** A suite of tests for the Qargs library */
@RunWith(Suite.class)
@SuiteClasses({ //
	QargsUtilsTest.class, //
	CommandSpecTest.class, //
	TokenizerTest.class, //
	ArgumentParserTest.class, //
	SubcommandTest.class, //
	ArgumentValidatorTest.class, //
	HelpWriterTest.class, //
	UsingMatchesTest.class//
})
public class QargsTests {
}
