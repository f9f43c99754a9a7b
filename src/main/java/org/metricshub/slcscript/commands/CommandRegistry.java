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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Host commands available to scripts, one table per {@link CommandType}.
 * Names and aliases are matched case-insensitively.
 */
public final class CommandRegistry {

	/**
	 * Order in which the surfaces of a scope are searched.
	 */
	private static final List<CommandType> LOOKUP_ORDER = Collections
			.unmodifiableList(List.of(CommandType.REMOTE_ADMIN, CommandType.CONSOLE, CommandType.GAME_CONSOLE));

	private final Map<CommandType, ConcurrentMap<String, Command>> handlers = new EnumMap<CommandType, ConcurrentMap<String, Command>>(
			CommandType.class);

	public CommandRegistry() {
		for (CommandType type : CommandType.values()) {
			handlers.put(type, new ConcurrentHashMap<String, Command>());
		}
	}

	private static String key(String name) {
		return name.toLowerCase(Locale.ROOT);
	}

	/**
	 * Registers a command, under its name and aliases, in each given surface.
	 *
	 * @param command command to register
	 * @param types surfaces to register into; all of them when empty
	 * @throws IllegalStateException when a name is already taken by another
	 *         command in one of the surfaces
	 */
	public void register(Command command, CommandType... types) {
		register(command, types.length == 0 ? EnumSet.allOf(CommandType.class) : EnumSet.of(types[0], types));
	}

	/**
	 * Registers a command, under its name and aliases, in each given surface.
	 *
	 * @param command command to register
	 * @param types surfaces to register into
	 * @throws IllegalStateException when a name is already taken by another
	 *         command in one of the surfaces
	 */
	public void register(Command command, Collection<CommandType> types) {
		Objects.requireNonNull(command, "Command must not be null");
		String name = command.getName();
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Command name must not be empty");
		}
		for (CommandType type : types) {
			ConcurrentMap<String, Command> table = handlers.get(type);
			putName(table, type, name, command);
			String[] aliases = command.getAliases();
			if (aliases != null) {
				for (String alias : aliases) {
					if (alias != null && !alias.isBlank()) {
						putName(table, type, alias, command);
					}
				}
			}
		}
	}

	private static void putName(ConcurrentMap<String, Command> table, CommandType type, String name, Command command) {
		Command existing = table.putIfAbsent(key(name), command);
		if (existing != null && existing != command) {
			throw new IllegalStateException(
					"Command name '" + name + "' already mapped to " + existing.getName() + " in " + type);
		}
	}

	/**
	 * Removes a command from each given surface.
	 *
	 * @param command command to remove
	 * @param types surfaces to remove from; all of them when empty
	 * @return whether the command was registered in at least one of them
	 */
	public boolean unregister(Command command, CommandType... types) {
		if (command == null) {
			return false;
		}
		Set<CommandType> targets = types.length == 0 ? EnumSet.allOf(CommandType.class) : EnumSet.of(types[0], types);
		boolean removed = false;
		for (CommandType type : targets) {
			removed |= handlers.get(type).values().removeIf(c -> c == command);
		}
		return removed;
	}

	/**
	 * Looks up a command in the surfaces of a scope, in remote admin, server
	 * console, game console order.
	 *
	 * @param scope surfaces to search
	 * @param name invoked name or alias
	 * @return the command, or <code>null</code> for blank or unknown names
	 */
	public Command getCommand(Set<CommandType> scope, String name) {
		if (name == null || name.isBlank() || scope == null) {
			return null;
		}
		String key = key(name);
		for (CommandType type : LOOKUP_ORDER) {
			if (scope.contains(type)) {
				Command command = handlers.get(type).get(key);
				if (command != null) {
					return command;
				}
			}
		}
		return null;
	}

	/**
	 * Returns a snapshot of the commands of one surface sorted by name.
	 *
	 * @param type surface to list
	 * @return immutable view of the commands, aliases included
	 */
	public Map<String, Command> listCommands(CommandType type) {
		List<Map.Entry<String, Command>> entries = new ArrayList<Map.Entry<String, Command>>(
				handlers.get(type).entrySet());
		entries.sort(Map.Entry.comparingByKey());
		Map<String, Command> snapshot = new LinkedHashMap<String, Command>();
		for (Map.Entry<String, Command> entry : entries) {
			snapshot.put(entry.getKey(), entry.getValue());
		}
		return Collections.unmodifiableMap(snapshot);
	}
}
