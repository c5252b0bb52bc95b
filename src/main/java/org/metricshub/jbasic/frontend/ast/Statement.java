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
 * Base of the statement variants. A statement is dispatched through a
 * {@link StatementVisitor}, which must handle every kind: adding a kind
 * means adding a visitor method, so every executor is checked at compile
 * time.
 * <p>
 * {@link #toString()} renders the statement in canonical upper-case
 * source form, which is what <code>LIST</code> and program saving write.
 */
public abstract class Statement {

	Statement() {}

	/**
	 * Dispatches to the visitor method matching this statement kind.
	 *
	 * @param visitor the visitor
	 * @param <R> visitor result type
	 * @return what the visitor returned
	 */
	public abstract <R> R accept(StatementVisitor<R> visitor);
}
