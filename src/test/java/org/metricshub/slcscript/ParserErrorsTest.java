package org.metricshub.slcscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.util.Arrays;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;
import org.metricshub.slcscript.commands.CommandRegistry;
import org.metricshub.slcscript.frontend.Parser;
import org.metricshub.slcscript.iterables.IterableRegistry;
import org.metricshub.slcscript.iterables.PredefinedIterable;

@RunWith(Parameterized.class)
public class ParserErrorsTest {

	@Parameters(name = "{0}")
	public static Iterable<Object[]> lines() {
		return Arrays
				.asList(
						new Object[][] {
								{ "unknown a", "Command 'unknown' was not found" },
								{ "[", "No directive keywords were used" },
								{ "[ print a ]", "No directive keywords were used" },
								{ "[ print a if print b", "Missing closing square bracket for directive" },
								{ "[ print a if", "If condition expression is missing" },
								{ "[ unknown if print b ]", "Command 'unknown' was not found" },
								{ "[ [ print a ] if print b ]", "No directive keywords were used\nin if branch expression" },
								{ "[ print a if [ print b ] ]", "No directive keywords were used\nin if condition expression" },
								{ "[ print a if unknown ]", "Command 'unknown' was not found\nin if condition expression" },
								{ "[ print a if print b else", "Else branch expression is missing" },
								{
										"[ print a if print b else unknown ]",
										"Command 'unknown' was not found\nin else branch expression" },
								{ "[ print a foreach", "Iterable object name is missing" },
								{ "[ print a foreach ]", "Iterable object name is missing" },
								{ "[ print a foreach nothing ]", "'nothing' is not a valid iterable object name" },
								{ "[ print a foreach nullprovider ]", "Provider for 'nullprovider' iterable object is null" },
								{
										"[ print a foreach nullresult ]",
										"Provider for 'nullresult' iterable object returned null" },
								{
										"[ [ print a ] foreach items ]",
										"No directive keywords were used\nin foreach loop body expression" },
								{ "[ print a delayby ]", "Delay duration is missing" },
								{ "[ print a delayby 12x ]", "'12x' is not a valid delay duration" },
								{ "[ print a delayby 99999999999 ]", "'99999999999' is not a valid delay duration" },
								{ "[ [ print a ] delayby 10 ]", "No directive keywords were used\nin delay body expression" },
								{ "print a #? Nowhere", "'Nowhere' is not a valid scope name" },
								{ "[ print a if print b ] extra", "An unexpected token remained after parsing (TokenType: TEXT)" },
								{
										"[ print a if print b else [ print c ] ]",
										"No directive keywords were used\nin else branch expression" } });
	}

	@Parameter(0)
	public String line;

	@Parameter(1)
	public String expectedError;

	@Test
	public void testError() {
		CommandRegistry commands = new CommandRegistry();
		commands.register(new TestCommand("print"));
		IterableRegistry iterables = new IterableRegistry();
		iterables.register("items", () -> new PredefinedIterable<String>(Arrays.asList("a"), null));
		iterables.register("nullprovider", null);
		iterables.register("nullresult", () -> null);
		Parser parser = new Parser(commands, iterables);

		assertNull(parser.parse(ParserTest.tokens(line)));
		assertEquals(expectedError, parser.getErrorMessage());
	}
}
