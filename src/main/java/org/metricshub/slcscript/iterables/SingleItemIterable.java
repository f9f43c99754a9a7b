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

import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Iterable with exactly one element, either known upfront or fetched when it
 * is loaded. Randomization only rewinds.
 *
 * @param <T> element type
 */
public class SingleItemIterable<T> implements ScriptIterable {

	private final Supplier<T> source;
	private final BiConsumer<Map<String, String>, T> mapper;
	private final int count;
	private T item;
	private boolean atEnd;

	private SingleItemIterable(Supplier<T> source, T item, int count, BiConsumer<Map<String, String>, T> mapper) {
		this.source = source;
		this.item = item;
		this.count = count;
		this.mapper = mapper;
		this.atEnd = count == 0;
	}

	/**
	 * @param item the element
	 * @param mapper writes the variables of the element, may be
	 *        <code>null</code>
	 * @param <T> element type
	 * @return an iterable over <code>item</code>
	 */
	public static <T> SingleItemIterable<T> of(T item, BiConsumer<Map<String, String>, T> mapper) {
		return new SingleItemIterable<T>(null, item, 1, mapper);
	}

	/**
	 * @param source called each time the element is loaded; <code>null</code>
	 *        for an empty iterable
	 * @param mapper writes the variables of the element, may be
	 *        <code>null</code>
	 * @param <T> element type
	 * @return an iterable over the supplied element
	 */
	public static <T> SingleItemIterable<T> lazy(Supplier<T> source, BiConsumer<Map<String, String>, T> mapper) {
		return new SingleItemIterable<T>(source, null, source == null ? 0 : 1, mapper);
	}

	@Override
	public boolean isAtEnd() {
		return atEnd;
	}

	@Override
	public int getCount() {
		return count;
	}

	@Override
	public boolean loadNext(Map<String, String> targetVariables) {
		if (atEnd) {
			return false;
		}

		if (source != null) {
			item = source.get();
		}

		if (mapper != null && targetVariables != null) {
			mapper.accept(targetVariables, item);
		}

		atEnd = true;
		return true;
	}

	@Override
	public void randomize(IterableSettings settings) {
		reset();
	}

	@Override
	public void reset() {
		atEnd = count == 0;
	}
}
