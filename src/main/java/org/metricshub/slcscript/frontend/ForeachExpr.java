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

import org.metricshub.slcscript.iterables.ScriptIterable;

/**
 * <code>[body foreach iterable]</code>
 */
public class ForeachExpr extends Expr {

	private final Expr body;
	private final ScriptIterable iterable;

	/**
	 * <p>
	 * Constructor for ForeachExpr.
	 * </p>
	 *
	 * @param body expression run once per element
	 * @param iterable elements to iterate, owned by this node
	 */
	public ForeachExpr(Expr body, ScriptIterable iterable) {
		this.body = body;
		this.iterable = iterable;
	}

	public Expr getBody() {
		return body;
	}

	public ScriptIterable getIterable() {
		return iterable;
	}

	@Override
	public <T> T accept(ExprVisitor<T> visitor) {
		return visitor.visitForeachExpr(this);
	}
}
