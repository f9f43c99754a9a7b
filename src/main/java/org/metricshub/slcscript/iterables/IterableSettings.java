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

/**
 * How an iterable picks random elements: a precise amount, or a fraction of
 * all elements.
 */
public final class IterableSettings {

	private final int amount;
	private final float percent;

	/**
	 * Settings that leave the elements untouched.
	 */
	public IterableSettings() {
		this(0);
	}

	public IterableSettings(int amount) {
		this.amount = amount;
		this.percent = 0.0f;
	}

	public IterableSettings(float percent) {
		this.amount = 0;
		this.percent = percent;
	}

	public int getAmount() {
		return amount;
	}

	public float getPercent() {
		return percent;
	}

	/**
	 * @return whether an amount rather than a fraction is used
	 */
	public boolean isPrecise() {
		return percent == 0.0f;
	}

	/**
	 * @return whether no randomization is requested
	 */
	public boolean isEmpty() {
		return isPrecise() && amount == 0;
	}

	/**
	 * @return whether a selection would keep at least one element
	 */
	public boolean isValid() {
		return isPrecise() ? amount > 0 : percent > 0.0f;
	}

	@Override
	public String toString() {
		return isPrecise() ? Integer.toString(amount) : (percent * 100.0f) + "%";
	}
}
