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

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * {@link CommandSender} holding a fixed set of permissions. The
 * <code>*</code> permission grants everything.
 */
public class SimpleCommandSender implements CommandSender {

	/** Permission granting every other permission */
	public static final String ALL_PERMISSIONS = "*";

	private final String name;
	private final Set<String> permissions = new TreeSet<String>(String.CASE_INSENSITIVE_ORDER);

	public SimpleCommandSender(String name, String... permissions) {
		this(name, Arrays.asList(permissions));
	}

	public SimpleCommandSender(String name, Collection<String> permissions) {
		this.name = name;
		this.permissions.addAll(permissions);
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public boolean hasPermission(String permission) {
		return permissions.contains(ALL_PERMISSIONS) || permissions.contains(permission);
	}

	/**
	 * @return the granted permission names
	 */
	public Set<String> getPermissions() {
		return Collections.unmodifiableSet(permissions);
	}

	@Override
	public String toString() {
		return name;
	}
}
