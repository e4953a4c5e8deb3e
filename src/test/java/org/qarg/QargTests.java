package org.qarg;

import org.junit.runner.RunWith;
import org.junit.runners.Suite;
import org.junit.runners.Suite.SuiteClasses;
import org.qarg.help.ErrorReporterTest;
import org.qarg.help.UsageFormatterTest;
import org.qarg.parse.ArgumentMatcherTest;
import org.qarg.parse.PrecedenceResolverTest;
import org.qarg.parse.TokenizerTest;
import org.qarg.shape.NamesTest;
import org.qarg.shape.ShapeBuilderTest;
import org.qarg.value.ValueTypesTest;

/** A suite of tests for the qarg library */
@RunWith(Suite.class)
@SuiteClasses({ //
	ValueTypesTest.class, //
	NamesTest.class, //
	ShapeBuilderTest.class, //
	TokenizerTest.class, //
	ArgumentMatcherTest.class, //
	PrecedenceResolverTest.class, //
	UsageFormatterTest.class, //
	ErrorReporterTest.class, //
	ArgParserTest.class, //
	TerminalParserTest.class//
})
public class QargTests {
}
