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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Iterates over the constants of an enum, exposing <code>id</code> (the
 * ordinal) and <code>name</code>.
 * <p>
 * A constant named <code>None</code> usually stands for "no value" and is
 * skipped unless requested.
 * </p>
 *
 * @param <E> enum type
 */
public class EnumIterable<E extends Enum<E>> extends IterableListBase<E> {

	static final String NONE_CONSTANT = "None";

	/**
	 * <p>
	 * Constructor for EnumIterable.
	 * </p>
	 *
	 * @param enumType enum to iterate
	 * @param enableNone whether a constant named <code>None</code> is included
	 */
	public EnumIterable(Class<E> enumType, boolean enableNone) {
		super(() -> constants(enumType, enableNone));
	}

	public static <E extends Enum<E>> EnumIterable<E> get(Class<E> enumType) {
		return new EnumIterable<E>(enumType, false);
	}

	public static <E extends Enum<E>> EnumIterable<E> getWithNone(Class<E> enumType) {
		return new EnumIterable<E>(enumType, true);
	}

	private static <E extends Enum<E>> List<E> constants(Class<E> enumType, boolean enableNone) {
		List<E> values = new ArrayList<E>();

		for (E value : enumType.getEnumConstants()) {
			if (enableNone || !NONE_CONSTANT.equals(value.name())) {
				values.add(value);
			}
		}

		return values;
	}

	@Override
	protected void loadVariables(Map<String, String> targetVariables, E item) {
		targetVariables.put("id", Integer.toString(item.ordinal()));
		targetVariables.put("name", item.name());
	}
}
