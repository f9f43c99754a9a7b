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
 * Outcome of a command execution: whether it succeeded and the response
 * returned to the sender.
 */
public final class CommandResult {

	private final boolean success;
	private final String message;

	private CommandResult(boolean success, String message) {
		this.success = success;
		this.message = message == null ? "" : message;
	}

	public static CommandResult success(String message) {
		return new CommandResult(true, message);
	}

	public static CommandResult failure(String message) {
		return new CommandResult(false, message);
	}

	public boolean isSuccess() {
		return success;
	}

	/**
	 * @return the response, never <code>null</code>
	 */
	public String getMessage() {
		return message;
	}

	@Override
	public String toString() {
		return (success ? "success: " : "failure: ") + message;
	}
}
