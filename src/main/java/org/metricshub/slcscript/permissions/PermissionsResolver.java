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

import org.metricshub.slcscript.commands.CommandSender;

/**
 * Decides whether a sender holds a named permission. Used by
 * <code>#!</code> permission guards and by file script commands.
 * <p>
 * Implementations loaded by class name need a public no-argument constructor.
 * </p>
 */
public interface PermissionsResolver {

	/**
	 * @param sender sender to check
	 * @param permission permission name as written in the script
	 * @return <code>true</code> when granted, <code>false</code> when missing
	 * @throws PermissionException when the check itself cannot be performed
	 */
	boolean checkPermission(CommandSender sender, String permission);
}
