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
 * <code>[then if condition else otherwise]</code>
 */
public class IfExpr extends Expr {

	private final Expr then;
	private final Expr condition;
	private final Expr otherwise;

	/**
	 * <p>
	 * Constructor for IfExpr.
	 * </p>
	 *
	 * @param then expression run when the condition succeeds
	 * @param condition expression whose success is tested
	 * @param otherwise expression run when the condition fails, may be
	 *        <code>null</code>
	 */
	public IfExpr(Expr then, Expr condition, Expr otherwise) {
		this.then = then;
		this.condition = condition;
		this.otherwise = otherwise;
	}

	public Expr getThen() {
		return then;
	}

	public Expr getCondition() {
		return condition;
	}

	public Expr getOtherwise() {
		return otherwise;
	}

	@Override
	public <T> T accept(ExprVisitor<T> visitor) {
		return visitor.visitIfExpr(this);
	}
}
