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

/**
 * Thrown by a {@link PermissionsResolver} that cannot decide whether a
 * permission is granted, as opposed to a permission that is simply missing.
 */
public class PermissionException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * <p>
	 * Constructor for PermissionException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public PermissionException(String msg) {
		super(msg);
	}

	public PermissionException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
