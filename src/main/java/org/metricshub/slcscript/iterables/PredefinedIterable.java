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
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Iterable over elements known upfront. Randomization is not supported and
 * only rewinds.
 *
 * @param <T> element type
 */
public class PredefinedIterable<T> implements ScriptIterable {

	private final List<T> source;
	private final BiConsumer<Map<String, String>, T> mapper;
	private int current;

	/**
	 * <p>
	 * Constructor for PredefinedIterable.
	 * </p>
	 *
	 * @param source elements, copied; <code>null</code> for an empty iterable
	 * @param mapper writes the variables of an element, may be <code>null</code>
	 */
	public PredefinedIterable(Collection<? extends T> source, BiConsumer<Map<String, String>, T> mapper) {
		this.source = source == null ? null : new ArrayList<T>(source);
		this.mapper = mapper;
	}

	@Override
	public boolean isAtEnd() {
		return source == null || current >= source.size();
	}

	@Override
	public int getCount() {
		return source == null ? 0 : source.size();
	}

	@Override
	public boolean loadNext(Map<String, String> targetVariables) {
		if (isAtEnd()) {
			return false;
		}

		T item = source.get(current++);

		if (mapper != null && targetVariables != null) {
			mapper.accept(targetVariables, item);
		}

		return true;
	}

	@Override
	public void randomize(IterableSettings settings) {
		reset();
	}

	@Override
	public void reset() {
		current = 0;
	}
}
