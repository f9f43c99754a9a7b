package org.metricshub.slcscript.frontend;

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
import org.metricshub.slcscript.commands.Command;

/**
 * Invocation of a host command.
 * <p>
 * <code>arguments[0]</code> is the name the command was invoked with, the
 * remaining elements are its arguments as written in the script.
 * </p>
 */
public class CommandExpr extends Expr {

	private final Command command;
	private final String[] arguments;
	private boolean hasVariables;

	/**
	 * <p>
	 * Constructor for CommandExpr.
	 * </p>
	 *
	 * @param command resolved command
	 * @param arguments invoked name followed by the arguments
	 * @param hasVariables whether arguments hold <code>$(name)</code>
	 *        placeholders to substitute before execution
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public CommandExpr(Command command, String[] arguments, boolean hasVariables) {
		this.command = command;
		this.arguments = arguments;
		this.hasVariables = hasVariables;
	}

	public Command getCommand() {
		return command;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public String[] getArguments() {
		return arguments;
	}

	public boolean hasVariables() {
		return hasVariables;
	}

	public void setHasVariables(boolean hasVariables) {
		this.hasVariables = hasVariables;
	}

	@Override
	public <T> T accept(ExprVisitor<T> visitor) {
		return visitor.visitCommandExpr(this);
	}
}
