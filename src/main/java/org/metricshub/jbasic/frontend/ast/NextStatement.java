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
 * <code>NEXT [V]</code>. Without a variable, it closes the innermost loop.
 */
public final class NextStatement extends Statement {

	private final Character variable;

	/**
	 * @param variable the loop variable, or {@code null} for a bare <code>NEXT</code>
	 */
	public NextStatement(Character variable) {
		this.variable = variable;
	}

	/**
	 * @return the loop variable, or {@code null} for a bare <code>NEXT</code>
	 */
	public Character getVariable() {
		return variable;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitNext(this);
	}

	@Override
	public String toString() {
		return variable == null ? "NEXT" : "NEXT " + variable.charValue();
	}
}
