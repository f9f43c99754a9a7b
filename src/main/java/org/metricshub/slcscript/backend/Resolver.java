package org.metricshub.slcscript.backend;

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

import org.metricshub.slcscript.frontend.CommandExpr;
import org.metricshub.slcscript.frontend.DelayExpr;
import org.metricshub.slcscript.frontend.Expr;
import org.metricshub.slcscript.frontend.ExprVisitor;
import org.metricshub.slcscript.frontend.ForeachExpr;
import org.metricshub.slcscript.frontend.IfExpr;

/**
 * Static pass run between parsing and interpretation.
 * <p>
 * Variables only get values inside a <code>foreach</code> body, so commands
 * outside of any loop keep their <code>$(name)</code> placeholders verbatim
 * and skip substitution.
 * </p>
 */
public class Resolver implements ExprVisitor<Void> {

	private int depth;

	/**
	 * Resolves a whole tree.
	 *
	 * @param expr root expression, ignored when <code>null</code>
	 */
	public void resolve(Expr expr) {
		depth = 0;

		if (expr != null) {
			expr.accept(this);
		}
	}

	@Override
	public Void visitCommandExpr(CommandExpr expr) {
		if (expr.hasVariables()) {
			expr.setHasVariables(depth > 0);
		}
		return null;
	}

	@Override
	public Void visitIfExpr(IfExpr expr) {
		visit(expr.getThen());
		visit(expr.getCondition());
		visit(expr.getOtherwise());
		return null;
	}

	@Override
	public Void visitForeachExpr(ForeachExpr expr) {
		++depth;
		visit(expr.getBody());
		--depth;
		return null;
	}

	@Override
	public Void visitDelayExpr(DelayExpr expr) {
		visit(expr.getBody());
		return null;
	}

	private void visit(Expr expr) {
		if (expr != null) {
			expr.accept(this);
		}
	}
}
