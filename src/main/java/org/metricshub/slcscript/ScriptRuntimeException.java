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
 * Thrown when an SLC Script fails, at the boundaries where a
 * {@link ScriptResult} cannot be returned (command line). It carries the line
 * the failure was reported on.
 */
public class ScriptRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	/**
	 * <p>
	 * Constructor for ScriptRuntimeException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public ScriptRuntimeException(String msg) {
		super(msg);
		this.lineNumber = -1;
	}

	public ScriptRuntimeException(String msg, Throwable cause) {
		super(msg, cause);
		this.lineNumber = -1;
	}

	/**
	 * <p>
	 * Constructor for ScriptRuntimeException.
	 * </p>
	 *
	 * @param lineno a int
	 * @param msg a {@link java.lang.String} object
	 */
	public ScriptRuntimeException(int lineno, String msg) {
		super(msg);
		this.lineNumber = lineno;
	}

	/**
	 * Builds the exception reporting a failed result.
	 *
	 * @param result failed result
	 * @return the exception
	 */
	public static ScriptRuntimeException of(ScriptResult result) {
		return new ScriptRuntimeException(result.getLine(), result.getErrorMessage());
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
