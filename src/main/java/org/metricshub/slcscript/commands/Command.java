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

/**
 * A host command scripts can invoke.
 */
public interface Command {

	/**
	 * @return name the command is invoked with
	 */
	String getName();

	/**
	 * @return alternative names, never <code>null</code>
	 */
	default String[] getAliases() {
		return new String[0];
	}

	/**
	 * @return short help text
	 */
	default String getDescription() {
		return "";
	}

	/**
	 * Runs the command.
	 *
	 * @param arguments arguments following the command name; the name itself
	 *        is the element just before the segment
	 * @param sender who invoked the command
	 * @return success flag and response
	 */
	CommandResult execute(ArgumentSegment arguments, CommandSender sender);
}
