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

import java.util.Objects;

/**
 * Immutable lexical unit: a type, its text and the script line it was read
 * from.
 */
public final class Token {

	private final TokenType type;
	private final String value;
	private final int line;

	/**
	 * <p>
	 * Constructor for Token.
	 * </p>
	 *
	 * @param type token type
	 * @param value token text, <code>null</code> is stored as an empty string
	 * @param line script line
	 */
	public Token(TokenType type, String value, int line) {
		this.type = Objects.requireNonNull(type, "Token type must not be null");
		this.value = value == null ? "" : value;
		this.line = line;
	}

	public TokenType getType() {
		return type;
	}

	/**
	 * @return the token text, never <code>null</code>
	 */
	public String getValue() {
		return value;
	}

	public int getLine() {
		return line;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return type == other.type && line == other.line && value.equals(other.value);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, value, line);
	}

	@Override
	public String toString() {
		return type + "(" + value + ")@" + line;
	}
}
