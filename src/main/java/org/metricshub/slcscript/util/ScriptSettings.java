package org.metricshub.slcscript.util;

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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;
import org.metricshub.slcscript.commands.CommandType;

/**
 * A simple container for the parameters of an SLC Script runtime.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when embedding SLC Script programmatically, from within Java code.
 */
public class ScriptSettings {

	/** Default value of {@link #getScriptExecutionsLimit()} */
	public static final int DEFAULT_SCRIPT_EXECUTIONS_LIMIT = 10;

	/** Default value of {@link #getScriptFileExtension()} */
	public static final String DEFAULT_SCRIPT_FILE_EXTENSION = ".slcs";

	/**
	 * Fully qualified class name of a custom
	 * {@link org.metricshub.slcscript.permissions.PermissionsResolver};
	 * <code>null</code> means the default resolver.
	 */
	private String permissionsResolverClass = null;

	/**
	 * Permission names the default resolver accepts;
	 * <code>null</code> means any name is accepted.
	 */
	private Set<String> knownPermissions = null;

	/**
	 * Command surfaces file script commands are registered into;
	 * all of them by default.
	 */
	private Set<CommandType> allowedScopes = EnumSet.allOf(CommandType.class);

	/**
	 * How many executions of the same file script may run at once.
	 */
	private int scriptExecutionsLimit = DEFAULT_SCRIPT_EXECUTIONS_LIMIT;

	/**
	 * Size of the thread pool running <code>delayby</code> bodies;
	 * <code>0</code> runs delayed bodies synchronously.
	 */
	private int delayThreads = 1;

	/**
	 * How long closing the runtime waits for pending delayed bodies.
	 */
	private long shutdownTimeoutMillis = 5000L;

	/**
	 * Extension of script files.
	 */
	private String scriptFileExtension = DEFAULT_SCRIPT_FILE_EXTENSION;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("permissionsResolverClass = ").append(getPermissionsResolverClass()).append(newLine);
		desc.append("knownPermissions = ").append(getKnownPermissions()).append(newLine);
		desc.append("allowedScopes = ").append(getAllowedScopes()).append(newLine);
		desc.append("scriptExecutionsLimit = ").append(getScriptExecutionsLimit()).append(newLine);
		desc.append("delayThreads = ").append(getDelayThreads()).append(newLine);
		desc.append("shutdownTimeoutMillis = ").append(getShutdownTimeoutMillis()).append(newLine);
		desc.append("scriptFileExtension = ").append(getScriptFileExtension()).append(newLine);

		return desc.toString();
	}

	public String getPermissionsResolverClass() {
		return permissionsResolverClass;
	}

	public void setPermissionsResolverClass(String permissionsResolverClass) {
		this.permissionsResolverClass = permissionsResolverClass;
	}

	/**
	 * @return unmodifiable view of the known permission names, or
	 *         <code>null</code> when any name is accepted
	 */
	public Set<String> getKnownPermissions() {
		return knownPermissions == null ? null : Collections.unmodifiableSet(knownPermissions);
	}

	/**
	 * Sets the permission names the default resolver knows about. Names are
	 * matched case-insensitively.
	 *
	 * @param knownPermissions permission names, or <code>null</code> to accept any
	 */
	public void setKnownPermissions(Set<String> knownPermissions) {
		if (knownPermissions == null) {
			this.knownPermissions = null;
			return;
		}
		Set<String> names = new TreeSet<String>(String.CASE_INSENSITIVE_ORDER);
		names.addAll(knownPermissions);
		this.knownPermissions = names;
	}

	/**
	 * @return the allowed scopes, never empty
	 */
	public Set<CommandType> getAllowedScopes() {
		return Collections.unmodifiableSet(allowedScopes);
	}

	/**
	 * Sets the command surfaces file scripts are registered into. An empty or
	 * <code>null</code> set means all of them.
	 *
	 * @param allowedScopes allowed scopes
	 */
	public void setAllowedScopes(Set<CommandType> allowedScopes) {
		if (allowedScopes == null || allowedScopes.isEmpty()) {
			this.allowedScopes = EnumSet.allOf(CommandType.class);
		} else {
			this.allowedScopes = EnumSet.copyOf(allowedScopes);
		}
	}

	public int getScriptExecutionsLimit() {
		return scriptExecutionsLimit;
	}

	public void setScriptExecutionsLimit(int scriptExecutionsLimit) {
		this.scriptExecutionsLimit = scriptExecutionsLimit;
	}

	public int getDelayThreads() {
		return delayThreads;
	}

	public void setDelayThreads(int delayThreads) {
		if (delayThreads < 0) {
			throw new IllegalArgumentException("delayThreads must not be negative: " + delayThreads);
		}
		this.delayThreads = delayThreads;
	}

	public long getShutdownTimeoutMillis() {
		return shutdownTimeoutMillis;
	}

	public void setShutdownTimeoutMillis(long shutdownTimeoutMillis) {
		this.shutdownTimeoutMillis = shutdownTimeoutMillis;
	}

	public String getScriptFileExtension() {
		return scriptFileExtension;
	}

	public void setScriptFileExtension(String scriptFileExtension) {
		this.scriptFileExtension = scriptFileExtension == null || scriptFileExtension.isEmpty()
				? DEFAULT_SCRIPT_FILE_EXTENSION
				: scriptFileExtension;
	}
}
