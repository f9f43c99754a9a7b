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

/**
 * Sequence of elements a <code>foreach</code> directive iterates over.
 * <p>
 * Each element is exposed to the loop body as a set of named variables,
 * written into the map given to {@link #loadNext(Map)}. Implementations are
 * lazy: the elements are usually fetched on the first call to
 * {@link #isAtEnd()}, so {@link #getCount()} is only meaningful afterwards.
 * </p>
 */
public interface ScriptIterable {

	/**
	 * @return whether all elements were loaded
	 */
	boolean isAtEnd();

	/**
	 * @return number of elements to iterate
	 */
	int getCount();

	/**
	 * Moves to the next element and writes its variables.
	 *
	 * @param targetVariables map receiving the variables, may be
	 *        <code>null</code> to only advance
	 * @return <code>false</code> when there was no element left
	 */
	boolean loadNext(Map<String, String> targetVariables);

	/**
	 * Shuffles all elements before the next iteration.
	 */
	default void randomize() {
		randomize(new IterableSettings(-1));
	}

	/**
	 * Keeps a random selection of elements.
	 *
	 * @param amount number of elements to keep, all of them shuffled when not
	 *        positive
	 */
	default void randomize(int amount) {
		randomize(new IterableSettings(amount));
	}

	/**
	 * Keeps a random fraction of elements.
	 *
	 * @param percent fraction to keep, <code>0.5f</code> for half of them
	 */
	default void randomize(float percent) {
		randomize(new IterableSettings(percent));
	}

	void randomize(IterableSettings settings);

	/**
	 * Rewinds to the first element, keeping the current selection.
	 */
	void reset();
}
