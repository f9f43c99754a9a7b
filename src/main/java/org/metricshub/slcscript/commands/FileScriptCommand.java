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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.metricshub.slcscript.ScriptResult;
import org.metricshub.slcscript.SlcScript;
import org.metricshub.slcscript.permissions.PermissionException;
import org.metricshub.slcscript.util.ScriptFileSource;
import org.metricshub.slcscript.util.ScriptLogger;
import org.slf4j.Logger;

/**
 * Command running a script file, named after the file.
 * <p>
 * The script source is read on the first execution and shared by concurrent
 * executions; it is dropped once no execution is running, so edits to the
 * file are picked up by the next call. The number of concurrent executions of
 * one command is limited by
 * {@link org.metricshub.slcscript.util.ScriptSettings#getScriptExecutionsLimit()}.
 * </p>
 */
public class FileScriptCommand implements Command {

	private static final Logger LOG = ScriptLogger.getLogger(FileScriptCommand.class);

	/** Description of commands without one */
	public static final String DEFAULT_DESCRIPTION = "Custom script command.";

	private static final ConcurrentMap<Path, String> LOADED_SCRIPTS = new ConcurrentHashMap<Path, String>();

	private final Path file;
	private final String name;
	private final String fileName;
	private final SlcScript engine;
	private final AtomicInteger calls = new AtomicInteger();

	private int arity;
	private String[] requiredPermissions;

	/**
	 * <p>
	 * Constructor for FileScriptCommand.
	 * </p>
	 *
	 * @param file script file
	 * @param engine runtime executing the script
	 */
	public FileScriptCommand(Path file, SlcScript engine) {
		this.file = Objects.requireNonNull(file, "Script file must not be null").toAbsolutePath().normalize();
		this.engine = Objects.requireNonNull(engine, "Script runtime must not be null");
		this.fileName = this.file.getFileName().toString();
		int dot = fileName.lastIndexOf('.');
		this.name = dot > 0 ? fileName.substring(0, dot) : fileName;
	}

	/**
	 * @param file script file
	 * @return whether a source is cached for the given file, that is whether
	 *         an execution of it is running
	 */
	public static boolean isLoaded(Path file) {
		return LOADED_SCRIPTS.containsKey(file.toAbsolutePath().normalize());
	}

	public Path getFile() {
		return file;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public String getDescription() {
		return DEFAULT_DESCRIPTION;
	}

	public int getArity() {
		return arity;
	}

	/**
	 * @param arity minimum number of arguments
	 */
	public void setArity(int arity) {
		if (arity < 0) {
			throw new IllegalArgumentException("Arity must not be negative: " + arity);
		}
		this.arity = arity;
	}

	public String[] getRequiredPermissions() {
		return requiredPermissions == null ? null : requiredPermissions.clone();
	}

	/**
	 * @param requiredPermissions permissions a sender needs to run the script
	 */
	public void setRequiredPermissions(String... requiredPermissions) {
		this.requiredPermissions = requiredPermissions == null ? null : requiredPermissions.clone();
	}

	@Override
	public CommandResult execute(ArgumentSegment arguments, CommandSender sender) {
		if (requiredPermissions != null) {
			for (String permission : requiredPermissions) {
				try {
					if (!engine.getPermissionsResolver().checkPermission(sender, permission)) {
						return CommandResult.failure("Missing permission: '" + permission + "'. Access denied");
					}
				} catch (PermissionException e) {
					return CommandResult.failure(e.getMessage());
				}
			}
		}

		if (arguments.size() < arity) {
			return CommandResult.failure(
					"Missing argument: script expected " + arity + " arguments, but sender provided " + arguments.size());
		}

		return executeScript(arguments, sender);
	}

	private CommandResult executeScript(ArgumentSegment arguments, CommandSender sender) {
		if (calls.incrementAndGet() > engine.getSettings().getScriptExecutionsLimit()) {
			release();
			return CommandResult.failure("Script execution terminated due to exceeded concurrent executions limit");
		}

		ScriptResult result;

		try {
			String source = loadSource();

			if (source == null) {
				return CommandResult.failure("Cannot read script from file '" + fileName + "'");
			}

			result = engine.execute(source, arguments, sender);
		} finally {
			release();
		}

		if (result.isSuccess()) {
			return CommandResult.success("Script executed successfully.");
		}

		return CommandResult.failure(result.getErrorMessage() + "\nat " + fileName + ":" + result.getLine());
	}

	private void release() {
		if (calls.decrementAndGet() < 1 && LOADED_SCRIPTS.remove(file) != null) {
			LOG.debug("Evicted cached source of {}", file);
		}
	}

	private String loadSource() {
		String source = LOADED_SCRIPTS.get(file);

		if (source != null) {
			return source;
		}

		try {
			source = new ScriptFileSource(file).readText();
		} catch (IOException | UncheckedIOException e) {
			LOG.warn("Cannot read script file {}", file, e);
			return null;
		}

		String existing = LOADED_SCRIPTS.putIfAbsent(file, source);
		return existing == null ? source : existing;
	}

	@Override
	public String toString() {
		return name + " (" + file + ")";
	}
}
