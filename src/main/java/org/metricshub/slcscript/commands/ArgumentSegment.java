package org.metricshub.slcscript.commands;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A window over an array of command arguments, starting at {@link #getOffset()}
 * and holding {@link #size()} elements.
 * <p>
 * Command handlers receive the arguments that follow the invoked command name,
 * so the name itself usually sits just before the window, at
 * <code>offset - 1</code>. Scripts address it as <code>$(0)</code>.
 * </p>
 * The backing array is shared, not copied.
 */
public final class ArgumentSegment {

	/** Segment without a backing array */
	public static final ArgumentSegment NONE = new ArgumentSegment(null, 0, 0);

	private final String[] array;
	private final int offset;
	private final int count;

	/**
	 * Creates a segment covering everything after <code>offset</code>.
	 *
	 * @param array backing array, may be <code>null</code>
	 * @param offset index of the first element of the segment
	 */
	public ArgumentSegment(String[] array, int offset) {
		this(array, offset, array == null ? 0 : Math.max(0, array.length - offset));
	}

	/**
	 * <p>
	 * Constructor for ArgumentSegment.
	 * </p>
	 *
	 * @param array backing array, may be <code>null</code>
	 * @param offset index of the first element of the segment
	 * @param count number of elements of the segment
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public ArgumentSegment(String[] array, int offset, int count) {
		if (array != null && (offset < 0 || count < 0 || offset + count > array.length)) {
			throw new IllegalArgumentException(
					"Segment [" + offset + ", " + (offset + count) + ") does not fit an array of length " + array.length);
		}
		this.array = array;
		this.offset = offset;
		this.count = count;
	}

	/**
	 * Builds the segment a command handler would receive for the given
	 * invocation: <code>name</code> sits at index 0 and the arguments follow.
	 *
	 * @param name invoked command or script name
	 * @param arguments arguments provided by the sender
	 * @return a segment with offset 1
	 */
	public static ArgumentSegment ofInvocation(String name, String... arguments) {
		String[] all = new String[arguments.length + 1];
		all[0] = name;
		System.arraycopy(arguments, 0, all, 1, arguments.length);
		return new ArgumentSegment(all, 1);
	}

	/**
	 * @return the backing array, <code>null</code> when there is none
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public String[] getArray() {
		return array;
	}

	public int getOffset() {
		return offset;
	}

	public int size() {
		return count;
	}

	public boolean isEmpty() {
		return count == 0;
	}

	/**
	 * @param index zero-based index relative to the offset; <code>-1</code>
	 *        addresses the element just before the segment
	 * @return the element
	 */
	public String get(int index) {
		if (array == null) {
			throw new IllegalStateException("Argument segment has no backing array");
		}
		if (index < -offset || index >= count) {
			throw new IndexOutOfBoundsException("Index " + index + " out of segment of size " + count);
		}
		return array[offset + index];
	}

	/**
	 * @return copy of the elements of the segment
	 */
	public List<String> toList() {
		if (array == null) {
			return Collections.emptyList();
		}
		List<String> list = new ArrayList<String>(count);
		for (int i = 0; i < count; i++) {
			list.add(array[offset + i]);
		}
		return list;
	}

	@Override
	public String toString() {
		return toList().toString();
	}
}
