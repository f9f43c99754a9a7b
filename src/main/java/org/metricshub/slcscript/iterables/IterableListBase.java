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
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Base for iterables fetching their elements lazily from a supplier.
 * <p>
 * Elements are fetched on the first call to {@link #isAtEnd()} after creation
 * or after {@link #randomize(IterableSettings)}; <code>null</code> elements
 * are dropped. {@link #reset()} replays the same elements.
 * </p>
 *
 * @param <T> element type
 */
public abstract class IterableListBase<T> implements ScriptIterable {

	private final Supplier<? extends Iterable<T>> source;
	private final Random random;

	private List<T> objects;
	private IterableSettings randomSettings = new IterableSettings();
	private int count;
	private int current;

	/**
	 * @param source supplier of the elements, <code>null</code> for an empty
	 *        iterable
	 */
	protected IterableListBase(Supplier<? extends Iterable<T>> source) {
		this(source, null);
	}

	/**
	 * @param source supplier of the elements, <code>null</code> for an empty
	 *        iterable
	 * @param random source of randomness, <code>null</code> for the thread-local
	 *        one
	 */
	protected IterableListBase(Supplier<? extends Iterable<T>> source, Random random) {
		this.source = source;
		this.random = random;
	}

	@Override
	public boolean isAtEnd() {
		if (source == null) {
			return true;
		}

		if (objects == null) {
			objects = IterableUtils.apply(fetch(), randomSettings, random == null ? ThreadLocalRandom.current() : random);
			count = objects.size();
			current = 0;
		}

		return current >= count;
	}

	private List<T> fetch() {
		List<T> list = new ArrayList<T>();
		Iterable<T> items = source.get();

		if (items != null) {
			for (T item : items) {
				if (item != null) {
					list.add(item);
				}
			}
		}

		return list;
	}

	@Override
	public int getCount() {
		return count;
	}

	@Override
	public boolean loadNext(Map<String, String> targetVariables) {
		if (isAtEnd()) {
			return false;
		}

		T item = objects.get(current++);

		if (targetVariables != null) {
			loadVariables(targetVariables, item);
		}

		return true;
	}

	@Override
	public void randomize(IterableSettings settings) {
		objects = null;
		count = 0;
		randomSettings = settings == null ? new IterableSettings() : settings;
	}

	@Override
	public void reset() {
		current = 0;
	}

	/**
	 * Exposes one element to the loop body.
	 *
	 * @param targetVariables map receiving the variables
	 * @param item current element, never <code>null</code>
	 */
	protected abstract void loadVariables(Map<String, String> targetVariables, T item);
}
