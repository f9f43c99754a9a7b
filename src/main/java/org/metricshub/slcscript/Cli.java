package org.metricshub.slcscript;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * SLC Script
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.metricshub.slcscript.commands.ArgumentSegment;
import org.metricshub.slcscript.commands.CommandRegistry;
import org.metricshub.slcscript.commands.CommandType;
import org.metricshub.slcscript.commands.FileScriptCommand;
import org.metricshub.slcscript.commands.PrintCommand;
import org.metricshub.slcscript.commands.SimpleCommandSender;
import org.metricshub.slcscript.iterables.IterableRegistry;
import org.metricshub.slcscript.util.ScriptFileSource;
import org.metricshub.slcscript.util.ScriptSettings;
import org.metricshub.slcscript.util.ScriptSource;

/**
 * Command-line interface for SLC Script.
 */
public final class Cli {

	private static final String JAR_NAME;

	/** Name of the sender scripts run for */
	public static final String CONSOLE_SENDER_NAME = "console";

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "slcscript.jar";
		}
		JAR_NAME = myName;
	}

	private final ScriptSettings settings = new ScriptSettings();
	private final PrintStream out;

	private ScriptSource scriptSource;
	private final List<String> scriptArguments = new ArrayList<String>();
	private final Set<String> permissions = new TreeSet<String>(String.CASE_INSENSITIVE_ORDER);
	private Path scriptsDirectory;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance using the supplied stream.
	 *
	 * @param out stream where <code>print</code> writes
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
	}

	/**
	 * Returns the mutable {@link ScriptSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ScriptSettings getSettings() {
		return settings;
	}

	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	/**
	 * @return copy of the arguments passed to the script
	 */
	public List<String> getScriptArguments() {
		return new ArrayList<String>(scriptArguments);
	}

	/**
	 * @return copy of the permissions granted to the console sender
	 */
	public Set<String> getPermissions() {
		Set<String> copy = new TreeSet<String>(String.CASE_INSENSITIVE_ORDER);
		copy.addAll(permissions);
		return copy;
	}

	public Path getScriptsDirectory() {
		return scriptsDirectory;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the script and its arguments follow
				break;
			} else if (arg.equals("-")) {
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load script from file
				checkParameterHasArgument(args, argIdx);
				scriptSource = new ScriptFileSource(args[++argIdx]);
			} else if (arg.equals("-d")) {
				// -d directory : register script files as commands
				checkParameterHasArgument(args, argIdx);
				scriptsDirectory = Path.of(args[++argIdx]);
				if (!Files.isDirectory(scriptsDirectory)) {
					throw new IllegalArgumentException("Not a directory: " + scriptsDirectory);
				}
			} else if (arg.equals("-p")) {
				// -p permission : grant a permission to the console sender
				checkParameterHasArgument(args, argIdx);
				permissions.add(args[++argIdx]);
			} else if (arg.equals("--permissions-resolver")) {
				checkParameterHasArgument(args, argIdx);
				settings.setPermissionsResolverClass(args[++argIdx]);
			} else if (arg.equals("--limit")) {
				checkParameterHasArgument(args, argIdx);
				settings.setScriptExecutionsLimit(parseInt(args[argIdx], args[++argIdx]));
			} else if (arg.equals("--delay-threads")) {
				checkParameterHasArgument(args, argIdx);
				settings.setDelayThreads(parseInt(args[argIdx], args[++argIdx]));
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("SLC script not provided.");
			}
			scriptSource = new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(args[argIdx++]));
		}

		while (argIdx < args.length) {
			scriptArguments.add(args[argIdx++]);
		}
	}

	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static int parseInt(String option, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid number for " + option + ": " + value, e);
		}
	}

	/**
	 * Executes the script based on the previously parsed arguments.
	 *
	 * @throws IOException when a script cannot be read
	 * @throws ScriptRuntimeException when the script fails
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}

		CommandRegistry commands = new CommandRegistry();
		commands.register(new PrintCommand(out));
		IterableRegistry iterables = new IterableRegistry();
		iterables.registerEnum("scope", CommandType.class);

		try (SlcScript engine = new SlcScript(settings, commands, iterables)) {
			if (scriptsDirectory != null) {
				registerScriptFiles(engine, commands);
			}

			String name = scriptSource instanceof ScriptFileSource
					? ((ScriptFileSource) scriptSource).getFilePath().getFileName().toString()
					: "slcscript";
			ArgumentSegment arguments = ArgumentSegment.ofInvocation(name, scriptArguments.toArray(new String[0]));
			ScriptResult result = engine
					.execute(scriptSource, arguments, new SimpleCommandSender(CONSOLE_SENDER_NAME, permissions));

			if (!result.isSuccess()) {
				throw ScriptRuntimeException.of(result);
			}
		}
	}

	private void registerScriptFiles(SlcScript engine, CommandRegistry commands) throws IOException {
		String glob = "*" + settings.getScriptFileExtension();
		try (DirectoryStream<Path> files = Files.newDirectoryStream(scriptsDirectory, glob)) {
			for (Path file : files) {
				commands.register(new FileScriptCommand(file, engine), settings.getAllowedScopes());
			}
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f script-filename]" +
								" [-d scripts-directory]" +
								" [-p permission]..." +
								" [--permissions-resolver class]" +
								" [--limit n]" +
								" [--delay-threads n]" +
								" [script]" +
								" [argument]...");
		dest.println();
		dest.println(" -f filename = Use contents of filename for script.");
		dest.println(" -d directory = Register every *.slcs file of directory as a command.");
		dest.println(" -p permission = Grant a permission to the console sender ('*' grants all of them).");
		dest.println(" --permissions-resolver class = Check permissions with a custom resolver class.");
		dest.println(" --limit n = Maximum concurrent executions of one script file command.");
		dest.println(" --delay-threads n = Threads running delayed expressions, 0 runs them immediately.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for program output
	 * @return configured and executed CLI instance
	 * @throws IOException when a script cannot be read
	 */
	public static Cli create(String[] args, PrintStream os) throws IOException {
		Cli cli = new Cli(os);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (ScriptRuntimeException e) {
			if (e.getLineNumber() >= 0) {
				System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
