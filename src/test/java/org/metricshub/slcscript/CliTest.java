package org.metricshub.slcscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.slcscript.util.ScriptFileSource;
import org.metricshub.slcscript.util.ScriptSource;

public class CliTest {

	private static final String NL = System.lineSeparator();

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

	private String run(String... args) throws IOException {
		PrintStream out = new PrintStream(bytes, true, "UTF-8");
		Cli.create(args, out);
		return output();
	}

	private String output() throws UnsupportedEncodingException {
		return bytes.toString("UTF-8");
	}

	private static void assertInvalid(String expectedMessage, String... args) {
		try {
			Cli.parseCommandLineArguments(args);
			fail("Expected an IllegalArgumentException for " + Arrays.toString(args));
		} catch (IllegalArgumentException e) {
			assertEquals(expectedMessage, e.getMessage());
		}
	}

	@Test
	public void testInlineScript() throws IOException {
		assertEquals("hi there from slcscript" + NL, run("print $(1) from $(0)", "hi there"));
	}

	@Test
	public void testScriptFile() throws IOException {
		File script = folder.newFile("hello.slcs");
		Files.write(script.toPath(), "echo hello $(1)\necho $(0)".getBytes(StandardCharsets.UTF_8));
		assertEquals("hello you" + NL + "hello.slcs" + NL, run("-f", script.getPath(), "you"));
	}

	@Test
	public void testPermissions() throws IOException {
		assertEquals("", run("#! admin\nprint hidden"));
		assertEquals("shown" + NL, run("-p", "admin", "#! admin\nprint shown"));
		assertEquals("shown" + NL, run("-p", "*", "#! anything\nprint shown"));
	}

	@Test
	public void testScriptsDirectory() throws IOException {
		File directory = folder.newFolder("scripts");
		Files.write(new File(directory, "greet.slcs").toPath(), "print hello $(1)".getBytes(StandardCharsets.UTF_8));
		Files.write(new File(directory, "ignored.txt").toPath(), "print ignored".getBytes(StandardCharsets.UTF_8));
		assertEquals("hello world" + NL, run("-d", directory.getPath(), "greet world"));

		try {
			Cli.create(new String[] { "-d", directory.getPath(), "ignored" }, new PrintStream(bytes, true, "UTF-8"));
			fail("Expected the script to fail");
		} catch (ScriptRuntimeException e) {
			assertEquals("Command 'ignored' was not found", e.getMessage());
		}
	}

	@Test
	public void testScopeIterable() throws IOException {
		assertEquals(
				"0:REMOTE_ADMIN" + NL + "1:CONSOLE" + NL + "2:GAME_CONSOLE" + NL,
				run("[ print $(id):$(name) foreach scope ]"));
	}

	@Test
	public void testSynchronousDelay() throws IOException {
		assertEquals("later" + NL + "now" + NL, run("--delay-threads", "0", "[ print later delayby 10 ]\nprint now"));
	}

	@Test
	public void testFailure() throws IOException {
		try {
			run("print ok\n\nnope");
			fail("Expected the script to fail");
		} catch (ScriptRuntimeException e) {
			assertEquals("Command 'nope' was not found", e.getMessage());
			assertEquals(3, e.getLineNumber());
		}
		assertEquals("ok" + NL, output());
	}

	@Test
	public void testParse() {
		Cli cli = Cli
				.parseCommandLineArguments(
						new String[] { "-p", "a", "-p", "B", "--limit", "3", "--delay-threads", "2", "script", "x", "-y" });
		assertEquals(Arrays.asList("x", "-y"), cli.getScriptArguments());
		assertTrue(cli.getPermissions().contains("A"));
		assertTrue(cli.getPermissions().contains("b"));
		assertEquals(3, cli.getSettings().getScriptExecutionsLimit());
		assertEquals(2, cli.getSettings().getDelayThreads());
		assertEquals(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, cli.getScriptSource().getDescription());
		assertNull(cli.getScriptsDirectory());
		assertFalse(cli.isPrintUsage());
	}

	@Test
	public void testParseScriptFile() {
		Cli cli = Cli.parseCommandLineArguments(new String[] { "-f", "some.slcs", "-", "-x" });
		assertTrue(cli.getScriptSource() instanceof ScriptFileSource);
		assertEquals(Arrays.asList("-x"), cli.getScriptArguments());
	}

	@Test
	public void testPermissionsResolverOption() {
		Cli cli = Cli
				.parseCommandLineArguments(
						new String[] { "--permissions-resolver", "com.example.Resolver", "print a" });
		assertEquals("com.example.Resolver", cli.getSettings().getPermissionsResolverClass());
	}

	@Test
	public void testInvalidArguments() throws IOException {
		assertInvalid("Unknown parameter: -x", "-x", "print a");
		assertInvalid("Need additional argument for -f", "-f");
		assertInvalid("Need additional argument for --limit", "--limit");
		assertInvalid("Invalid number for --limit: many", "--limit", "many", "print a");
		assertInvalid("SLC script not provided.", "-p", "admin");
		assertInvalid("zero-length argument at position 1", "", "print a");
		assertInvalid("When printing help/usage output, we do not accept other arguments.", "-h", "print a");
		File file = folder.newFile("plain.txt");
		assertInvalid("Not a directory: " + file.toPath(), "-d", file.getPath(), "print a");
	}

	@Test
	public void testUsage() throws IOException {
		assertTrue(run("-h").startsWith("Usage:" + NL));
		assertTrue(Cli.parseCommandLineArguments(new String[0]).isPrintUsage());
		assertTrue(Cli.parseCommandLineArguments(new String[] { "-?" }).isPrintUsage());
	}
}
