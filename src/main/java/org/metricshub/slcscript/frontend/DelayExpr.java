package org.metricshub.slcscript.frontend;

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
 * <code>[body delayby duration name]</code>
 */
public class DelayExpr extends Expr {

	private final Expr body;
	private final int duration;
	private final String name;

	/**
	 * <p>
	 * Constructor for DelayExpr.
	 * </p>
	 *
	 * @param body expression to run later
	 * @param duration delay in milliseconds
	 * @param name label used when reporting failures, may be <code>null</code>
	 */
	public DelayExpr(Expr body, int duration, String name) {
		this.body = body;
		this.duration = duration;
		this.name = name;
	}

	public Expr getBody() {
		return body;
	}

	public int getDuration() {
		return duration;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T> T accept(ExprVisitor<T> visitor) {
		return visitor.visitDelayExpr(this);
	}
}
