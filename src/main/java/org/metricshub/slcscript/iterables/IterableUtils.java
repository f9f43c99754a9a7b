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
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random selection helpers shared by the iterables.
 */
public final class IterableUtils {

	private IterableUtils() {}

	/**
	 * Shuffles a list in place.
	 *
	 * @param data list to shuffle
	 * @param <T> element type
	 * @return <code>data</code>
	 */
	public static <T> List<T> shuffle(List<T> data) {
		return shuffle(data, ThreadLocalRandom.current());
	}

	/**
	 * Fisher-Yates shuffle of a list, in place.
	 *
	 * @param data list to shuffle
	 * @param random source of randomness
	 * @param <T> element type
	 * @return <code>data</code>
	 */
	public static <T> List<T> shuffle(List<T> data, Random random) {
		for (int i = data.size() - 1; i > 0; --i) {
			Collections.swap(data, i, random.nextInt(i + 1));
		}

		return data;
	}

	public static <T> List<T> shuffle(List<T> data, int amount) {
		return shuffle(data, amount, ThreadLocalRandom.current());
	}

	/**
	 * Picks <code>min(amount, data.size())</code> random elements. The list is
	 * scanned from its end and partially shuffled on the way, so it is modified.
	 *
	 * @param data elements to pick from
	 * @param amount number of elements to pick
	 * @param random source of randomness
	 * @param <T> element type
	 * @return new list with the picked elements
	 */
	public static <T> List<T> shuffle(List<T> data, int amount, Random random) {
		int size = Math.max(0, Math.min(amount, data.size()));
		List<T> result = new ArrayList<T>(size);

		for (int i = data.size() - 1; i > 0 && result.size() < size; --i) {
			int key = random.nextInt(i + 1);
			result.add(data.get(key));
			data.set(key, data.get(i));
		}

		if (result.size() < size) {
			result.add(data.get(0));
		}

		return result;
	}

	public static <T> List<T> shuffle(List<T> data, float percent) {
		return shuffle(data, percent, ThreadLocalRandom.current());
	}

	/**
	 * Picks a random fraction of the elements.
	 *
	 * @param data elements to pick from
	 * @param percent fraction to pick, <code>1.0f</code> for all of them
	 * @param random source of randomness
	 * @param <T> element type
	 * @return new list with <code>(int) (percent * data.size())</code> elements
	 */
	public static <T> List<T> shuffle(List<T> data, float percent, Random random) {
		return shuffle(data, (int) (percent * data.size()), random);
	}

	/**
	 * Applies randomization settings.
	 *
	 * @param data elements, possibly shuffled in place
	 * @param settings what to pick
	 * @param random source of randomness
	 * @param <T> element type
	 * @return the selected elements
	 */
	public static <T> List<T> apply(List<T> data, IterableSettings settings, Random random) {
		if (settings == null || settings.isEmpty()) {
			return data;
		}

		if (settings.isPrecise()) {
			return settings.getAmount() > 0 ? shuffle(data, settings.getAmount(), random) : shuffle(data, random);
		}

		return settings.getPercent() > 0.0f ? shuffle(data, settings.getPercent(), random) : shuffle(data, random);
	}
}
