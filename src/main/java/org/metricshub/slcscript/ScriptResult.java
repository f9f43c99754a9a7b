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

/**
 * Outcome of a script execution. The script succeeded when
 * {@link #getErrorMessage()} is <code>null</code>.
 */
public final class ScriptResult {

	private static final ScriptResult SUCCESS = new ScriptResult(null, 0);

	private final String errorMessage;
	private final int line;

	private ScriptResult(String errorMessage, int line) {
		this.errorMessage = errorMessage;
		this.line = line;
	}

	public static ScriptResult success() {
		return SUCCESS;
	}

	/**
	 * @param errorMessage what went wrong
	 * @param line script line the error was reported on
	 * @return a failed result
	 */
	public static ScriptResult failure(String errorMessage, int line) {
		return new ScriptResult(errorMessage == null ? "Script execution failed" : errorMessage, line);
	}

	public boolean isSuccess() {
		return errorMessage == null;
	}

	/**
	 * @return the error, <code>null</code> on success
	 */
	public String getErrorMessage() {
		return errorMessage;
	}

	/**
	 * @return the failing line, <code>0</code> on success
	 */
	public int getLine() {
		return line;
	}

	@Override
	public String toString() {
		return isSuccess() ? "success" : "line " + line + ": " + errorMessage;
	}
}
