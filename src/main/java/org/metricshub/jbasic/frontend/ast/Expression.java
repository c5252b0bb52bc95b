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
 * Base of the expression tree. Every concrete expression accepts an
 * {@link ExpressionVisitor}, so that code evaluating or inspecting
 * expressions must handle every kind.
 * <p>
 * {@link #toString()} renders the expression back to BASIC source, with
 * just the parentheses needed to keep the tree shape when parsed again.
 */
public abstract class Expression {

	/** Binding strength of relational operators. */
	static final int RELATIONAL = 1;
	/** Binding strength of <code>+</code> and <code>-</code>. */
	static final int ADDITIVE = 2;
	/** Binding strength of <code>*</code> and <code>/</code>. */
	static final int MULTIPLICATIVE = 3;
	/** Binding strength of unary minus. */
	static final int UNARY = 4;
	/** Literals and variables never need parentheses. */
	static final int PRIMARY = 5;

	Expression() {}

	/**
	 * Dispatches to the visitor method matching this expression kind.
	 *
	 * @param visitor the visitor
	 * @param <R> visitor result type
	 * @return what the visitor returned
	 */
	public abstract <R> R accept(ExpressionVisitor<R> visitor);

	/**
	 * @return the binding strength of the outermost operator of this expression
	 */
	abstract int precedence();

	/**
	 * Renders a child expression, wrapped in parentheses when it binds less
	 * tightly than {@code minimum}.
	 */
	static String render(Expression child, int minimum) {
		if (child.precedence() < minimum) {
			return "(" + child + ")";
		}
		return child.toString();
	}
}
