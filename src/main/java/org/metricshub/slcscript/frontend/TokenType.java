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

/**
 * Lexical categories of SLC Script.
 */
public enum TokenType {
	/** Internal marker: the current token was fully consumed, nothing to emit. */
	NONE,
	/** <code>[</code> opening a directive */
	LEFT_SQUARE,
	/** <code>]</code> closing a directive */
	RIGHT_SQUARE,
	/** <code>#?</code> scope guard marker */
	SCOPE_GUARD,
	/** Text holding at least one <code>$(name)</code> placeholder */
	VARIABLE,
	/** Plain text */
	TEXT,
	/** Reserved */
	NUMBER,
	/** Reserved */
	PERCENTAGE,
	/** <code>if</code> */
	IF,
	/** <code>else</code> */
	ELSE,
	/** <code>foreach</code> */
	FOREACH,
	/** <code>delayby</code> */
	DELAY_BY,
	/** Reserved */
	FOR_RANDOM,
	/** Reserved */
	SEQUENCE;

	/**
	 * @return whether this type is a keyword, reserved ones included
	 */
	public boolean isKeyword() {
		return compareTo(IF) >= 0;
	}

	/**
	 * @return whether a token of this type carries a word (text, variable or
	 *         keyword)
	 */
	public boolean isWord() {
		return compareTo(VARIABLE) >= 0;
	}
}
