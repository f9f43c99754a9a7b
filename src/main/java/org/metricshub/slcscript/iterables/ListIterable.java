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
import java.util.Random;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * Lazy iterable whose variables are produced by a mapping function.
 *
 * @param <T> element type
 */
public class ListIterable<T> extends IterableListBase<T> {

	private final BiConsumer<Map<String, String>, T> mapper;

	/**
	 * <p>
	 * Constructor for ListIterable.
	 * </p>
	 *
	 * @param source supplier of the elements
	 * @param mapper writes the variables of an element, may be <code>null</code>
	 */
	public ListIterable(Supplier<? extends Iterable<T>> source, BiConsumer<Map<String, String>, T> mapper) {
		super(source);
		this.mapper = mapper;
	}

	public ListIterable(Supplier<? extends Iterable<T>> source, BiConsumer<Map<String, String>, T> mapper, Random random) {
		super(source, random);
		this.mapper = mapper;
	}

	@Override
	protected void loadVariables(Map<String, String> targetVariables, T item) {
		if (mapper != null) {
			mapper.accept(targetVariables, item);
		}
	}
}
