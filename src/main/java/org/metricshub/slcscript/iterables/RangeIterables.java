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
 * Integer ranges, exposing the current number as <code>i</code>.
 */
public final class RangeIterables {

	private RangeIterables() {}

	/**
	 * Creates an iterable over all integers between two bounds, both included.
	 *
	 * @param start first number
	 * @param end last number, may be lower than <code>start</code> for a
	 *        descending range
	 * @return the range
	 */
	public static ScriptIterable standardRange(int start, int end) {
		if (start == end) {
			return SingleItemIterable.of(start, RangeIterables::loadVariables);
		}

		return new ListIterable<Integer>(() -> getRange(start, end), RangeIterables::loadVariables);
	}

	static void loadVariables(Map<String, String> targetVariables, Integer number) {
		targetVariables.put("i", number.toString());
	}

	/**
	 * @param start first number
	 * @param end last number
	 * @return the numbers from <code>start</code> to <code>end</code>
	 */
	public static List<Integer> getRange(int start, int end) {
		boolean descending = end < start;
		long size = (descending ? (long) start - end : (long) end - start) + 1;

		if (size > Integer.MAX_VALUE - 8) {
			throw new IllegalArgumentException("Range " + start + ".." + end + " is too large");
		}

		List<Integer> range = new ArrayList<Integer>((int) size);
		int value = start;

		for (int i = 0; i < size; ++i) {
			range.add(value);
			value = descending ? value - 1 : value + 1;
		}

		return range;
	}
}
