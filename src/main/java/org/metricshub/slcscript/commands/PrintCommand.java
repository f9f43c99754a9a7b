package org.metricshub.slcscript.commands;

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

import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Writer;
import java.util.function.Consumer;

/**
 * <code>print</code> (alias <code>echo</code>): writes its arguments,
 * separated by spaces, as one line.
 */
public class PrintCommand implements Command {

	private final Consumer<String> output;

	public PrintCommand(PrintStream out) {
		this(out::println);
	}

	public PrintCommand(Writer writer) {
		this(line -> {
			PrintWriter printer = writer instanceof PrintWriter ? (PrintWriter) writer : new PrintWriter(writer);
			printer.println(line);
			printer.flush();
		});
	}

	public PrintCommand(Consumer<String> output) {
		this.output = output;
	}

	@Override
	public String getName() {
		return "print";
	}

	@Override
	public String[] getAliases() {
		return new String[] { "echo" };
	}

	@Override
	public String getDescription() {
		return "Prints its arguments";
	}

	@Override
	public CommandResult execute(ArgumentSegment arguments, CommandSender sender) {
		String line = String.join(" ", arguments.toList());
		output.accept(line);
		return CommandResult.success(line);
	}
}
