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
 * A prefix operator applied to one operand. Binds tighter than any binary
 * operator, so <code>-A*B</code> is <code>(-A)*B</code>.
 */
public final class UnaryOp extends Expression {

	/** Prefix operators of the dialect. */
	public enum Kind {
		NEGATE("-");

		private final String symbol;

		Kind(String symbol) {
			this.symbol = symbol;
		}

		public String getSymbol() {
			return symbol;
		}
	}

	private final Kind kind;
	private final Expression operand;

	public UnaryOp(Kind kind, Expression operand) {
		this.kind = kind;
		this.operand = operand;
	}

	public Kind getKind() {
		return kind;
	}

	public Expression getOperand() {
		return operand;
	}

	@Override
	public <R> R accept(ExpressionVisitor<R> visitor) {
		return visitor.visitUnaryOp(this);
	}

	@Override
	int precedence() {
		return UNARY;
	}

	@Override
	public String toString() {
		return kind.getSymbol() + render(operand, UNARY);
	}
}
