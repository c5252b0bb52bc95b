package org.metricshub.jbasic.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * JBasic
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
 * <code>IF left relop right THEN statement</code>. The condition is a
 * {@link BinaryOp} whose operator is relational; the consequent is a full
 * statement, executed only when the condition is true.
 */
public final class IfStatement extends Statement {

	private final BinaryOp condition;
	private final Statement consequent;

	public IfStatement(BinaryOp condition, Statement consequent) {
		if (!condition.getOperator().isRelational()) {
			throw new IllegalArgumentException("IF condition must use a relational operator: " + condition);
		}
		this.condition = condition;
		this.consequent = consequent;
	}

	public BinaryOp getCondition() {
		return condition;
	}

	public Statement getConsequent() {
		return consequent;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitIf(this);
	}

	@Override
	public String toString() {
		return "IF " + condition + " THEN " + consequent;
	}
}
