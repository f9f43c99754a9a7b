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

import java.util.Locale;

/**
 * Command surfaces a command can be invoked from. A script scope is a
 * non-empty set of these.
 */
public enum CommandType {
	/** Remote admin console. */
	REMOTE_ADMIN("RemoteAdmin"),
	/** Server console. */
	CONSOLE("Console"),
	/** In-game client console. */
	GAME_CONSOLE("GameConsole");

	private final String scopeName;

	CommandType(String scopeName) {
		this.scopeName = scopeName;
	}

	/**
	 * @return the name used for this surface in <code>#?</code> guards
	 */
	public String getScopeName() {
		return scopeName;
	}

	/**
	 * Looks up a surface by its guard name, ignoring case.
	 *
	 * @param name name such as <code>RemoteAdmin</code> or <code>console</code>
	 * @return the matching surface, or <code>null</code> if there is none
	 */
	public static CommandType fromScopeName(String name) {
		if (name == null) {
			return null;
		}
		String lower = name.toLowerCase(Locale.ROOT);
		for (CommandType type : values()) {
			if (type.scopeName.toLowerCase(Locale.ROOT).equals(lower)) {
				return type;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return scopeName;
	}
}
