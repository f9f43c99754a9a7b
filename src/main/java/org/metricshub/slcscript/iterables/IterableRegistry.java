package org.metricshub.slcscript.iterables;

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
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Named providers of the iterables <code>foreach</code> directives iterate
 * over. Names are matched case-insensitively.
 * <p>
 * Besides registered names, <code>start..end</code> (for instance
 * <code>1..10</code> or <code>5..-5</code>) resolves to an integer range
 * exposing <code>i</code>.
 * </p>
 */
public class IterableRegistry {

	/** Largest number of elements a range name may produce */
	public static final long MAX_RANGE_SIZE = 1_000_000L;

	private static final Pattern RANGE_PATTERN = Pattern.compile("^(-?\\d+)\\.\\.(-?\\d+)$");

	private final Map<String, Supplier<ScriptIterable>> providers = Collections
			.synchronizedMap(new TreeMap<String, Supplier<ScriptIterable>>(String.CASE_INSENSITIVE_ORDER));

	/**
	 * Registers or replaces a provider.
	 *
	 * @param name iterable name
	 * @param provider creates a fresh iterable for each <code>foreach</code>,
	 *        may be <code>null</code>
	 * @return the previous provider, if any
	 */
	public Supplier<ScriptIterable> register(String name, Supplier<ScriptIterable> provider) {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("Iterable name must not be empty");
		}
		return providers.put(name, provider);
	}

	/**
	 * Registers the constants of an enum, see {@link EnumIterable}.
	 *
	 * @param name iterable name
	 * @param enumType enum to iterate
	 * @param <E> enum type
	 */
	public <E extends Enum<E>> void registerEnum(String name, Class<E> enumType) {
		register(name, () -> EnumIterable.get(enumType));
	}

	/**
	 * @param name iterable name
	 * @return whether the name was registered
	 */
	public boolean unregister(String name) {
		if (name == null) {
			return false;
		}
		synchronized (providers) {
			if (!providers.containsKey(name)) {
				return false;
			}
			providers.remove(name);
			return true;
		}
	}

	/**
	 * @param name iterable name
	 * @return whether the name is registered or is a valid range
	 */
	public boolean contains(String name) {
		if (name == null) {
			return false;
		}
		return providers.containsKey(name) || parseRange(name) != null;
	}

	/**
	 * Returns the provider of an iterable.
	 * <p>
	 * Use {@link #contains(String)} to tell unknown names from names registered
	 * with a <code>null</code> provider.
	 * </p>
	 *
	 * @param name iterable name
	 * @return the provider, <code>null</code> when unknown or registered as
	 *         <code>null</code>
	 */
	public Supplier<ScriptIterable> getProvider(String name) {
		if (name == null) {
			return null;
		}
		synchronized (providers) {
			if (providers.containsKey(name)) {
				return providers.get(name);
			}
		}
		int[] range = parseRange(name);
		if (range == null) {
			return null;
		}
		return () -> RangeIterables.standardRange(range[0], range[1]);
	}

	/**
	 * @return sorted snapshot of the registered names
	 */
	public Map<String, Supplier<ScriptIterable>> listProviders() {
		synchronized (providers) {
			Map<String, Supplier<ScriptIterable>> snapshot = new TreeMap<String, Supplier<ScriptIterable>>(
					String.CASE_INSENSITIVE_ORDER);
			snapshot.putAll(providers);
			return Collections.unmodifiableMap(snapshot);
		}
	}

	private static int[] parseRange(String name) {
		Matcher matcher = RANGE_PATTERN.matcher(name);
		if (!matcher.matches()) {
			return null;
		}
		int start;
		int end;
		try {
			start = Integer.parseInt(matcher.group(1));
			end = Integer.parseInt(matcher.group(2));
		} catch (NumberFormatException e) {
			return null;
		}
		if (Math.abs((long) end - start) >= MAX_RANGE_SIZE) {
			return null;
		}
		return new int[] { start, end };
	}
}
