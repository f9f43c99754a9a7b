package org.metricshub.slcscript.permissions;

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

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import org.metricshub.slcscript.commands.CommandSender;

/**
 * Resolver asking the sender itself through
 * {@link CommandSender#hasPermission(String)}.
 * <p>
 * When built with a set of known permission names, names outside of it are
 * rejected with a {@link PermissionException} instead of being reported as
 * missing.
 * </p>
 */
public class DefaultPermissionsResolver implements PermissionsResolver {

	private final Set<String> knownPermissions;

	/**
	 * Creates a resolver accepting any permission name.
	 */
	public DefaultPermissionsResolver() {
		this.knownPermissions = null;
	}

	/**
	 * Creates a resolver accepting only the given permission names.
	 *
	 * @param knownPermissions valid names, matched case-insensitively;
	 *        <code>null</code> accepts any name
	 */
	public DefaultPermissionsResolver(Collection<String> knownPermissions) {
		if (knownPermissions == null) {
			this.knownPermissions = null;
		} else {
			Set<String> names = new TreeSet<String>(String.CASE_INSENSITIVE_ORDER);
			names.addAll(knownPermissions);
			this.knownPermissions = Collections.unmodifiableSet(names);
		}
	}

	@Override
	public boolean checkPermission(CommandSender sender, String permission) {
		if (sender == null) {
			throw new PermissionException("Cannot verify permission '" + permission + "', command sender is null");
		}
		if (permission == null || permission.isBlank()) {
			throw new PermissionException("Permission name '" + permission + "' is invalid");
		}
		if (knownPermissions != null && !knownPermissions.contains(permission)) {
			throw new PermissionException("Permission '" + permission + "' does not exist");
		}
		return sender.hasPermission(permission);
	}
}
