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
 * <code>FOR V=start TO limit [STEP step]</code>. The step is {@code null}
 * when omitted, meaning 1.
 */
public final class ForStatement extends Statement {

	private final char variable;
	private final Expression start;
	private final Expression limit;
	private final Expression step;

	public ForStatement(char variable, Expression start, Expression limit, Expression step) {
		this.variable = variable;
		this.start = start;
		this.limit = limit;
		this.step = step;
	}

	public char getVariable() {
		return variable;
	}

	public Expression getStart() {
		return start;
	}

	public Expression getLimit() {
		return limit;
	}

	/**
	 * @return the step expression, or {@code null} if the statement has none
	 */
	public Expression getStep() {
		return step;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitFor(this);
	}

	@Override
	public String toString() {
		String s = "FOR " + variable + "=" + start + " TO " + limit;
		return step == null ? s : s + " STEP " + step;
	}
}
