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
 * Binary operators, with their source symbol and binding strength.
 * Relational operators are only allowed as the condition of an
 * <code>IF</code> statement.
 */
public enum Operator {
	ADD("+", Expression.ADDITIVE),
	SUBTRACT("-", Expression.ADDITIVE),
	MULTIPLY("*", Expression.MULTIPLICATIVE),
	DIVIDE("/", Expression.MULTIPLICATIVE),
	EQ("=", Expression.RELATIONAL),
	NE("<>", Expression.RELATIONAL),
	LT("<", Expression.RELATIONAL),
	LE("<=", Expression.RELATIONAL),
	GT(">", Expression.RELATIONAL),
	GE(">=", Expression.RELATIONAL);

	private final String symbol;
	private final int precedence;

	Operator(String symbol, int precedence) {
		this.symbol = symbol;
		this.precedence = precedence;
	}

	public String getSymbol() {
		return symbol;
	}

	int getPrecedence() {
		return precedence;
	}

	public boolean isRelational() {
		return precedence == Expression.RELATIONAL;
	}
}
