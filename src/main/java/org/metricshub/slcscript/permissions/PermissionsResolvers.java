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

import java.lang.reflect.InvocationTargetException;
import org.metricshub.slcscript.util.ScriptLogger;
import org.metricshub.slcscript.util.ScriptSettings;
import org.slf4j.Logger;

/**
 * Creates the {@link PermissionsResolver} described by {@link ScriptSettings}.
 */
public final class PermissionsResolvers {

	private static final Logger LOG = ScriptLogger.getLogger(PermissionsResolvers.class);

	private PermissionsResolvers() {}

	/**
	 * Returns the custom resolver named by
	 * {@link ScriptSettings#getPermissionsResolverClass()}, or a
	 * {@link DefaultPermissionsResolver} restricted to
	 * {@link ScriptSettings#getKnownPermissions()} when none is named.
	 *
	 * @param settings runtime settings
	 * @return the resolver to use
	 * @throws IllegalArgumentException when the class does not exist or is not a
	 *         resolver
	 * @throws IllegalStateException when the class cannot be instantiated
	 */
	public static PermissionsResolver create(ScriptSettings settings) {
		String className = settings.getPermissionsResolverClass();
		if (className == null || className.isBlank()) {
			return new DefaultPermissionsResolver(settings.getKnownPermissions());
		}
		PermissionsResolver resolver = instantiateByClassName(className.trim());
		LOG.info("Using permissions resolver {}", resolver.getClass().getName());
		return resolver;
	}

	/**
	 * Instantiates a resolver through its public no-argument constructor.
	 *
	 * @param name fully qualified class name
	 * @return the new resolver
	 */
	public static PermissionsResolver instantiateByClassName(String name) {
		Class<?> clazz;
		try {
			clazz = Class.forName(name);
		} catch (ClassNotFoundException ex) {
			throw new IllegalArgumentException("Unknown permissions resolver '" + name + "'", ex);
		}
		if (!PermissionsResolver.class.isAssignableFrom(clazz)) {
			throw new IllegalArgumentException(
					"'" + name + "' does not implement " + PermissionsResolver.class.getName());
		}
		try {
			return clazz.asSubclass(PermissionsResolver.class).getDeclaredConstructor().newInstance();
		} catch (InstantiationException | IllegalAccessException | NoSuchMethodException e) {
			throw new IllegalStateException("Cannot instantiate permissions resolver " + name, e);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw new IllegalStateException("Cannot instantiate permissions resolver " + name, cause);
		}
	}
}
