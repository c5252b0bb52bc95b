package org.metricshub.jbasic.frontend;

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

import org.metricshub.jbasic.frontend.ast.ParserException;
import org.metricshub.jbasic.frontend.ast.Statement;

/**
 * Result of {@link BasicParser#parseLine(String)}: the optional line
 * number and the statement, which is {@code null} when the body was empty.
 */
public final class ParsedLine {

	private final int lineNumber;
	private final Statement statement;

	ParsedLine(int lineNumber, Statement statement) {
		this.lineNumber = lineNumber;
		this.statement = statement;
	}

	/**
	 * @return the line number, or {@code -1} for an unnumbered line
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the statement, or {@code null} if the line had no body
	 */
	public Statement getStatement() {
		return statement;
	}

	public boolean isNumbered() {
		return lineNumber != ParserException.NO_LINE;
	}

	public boolean isEmpty() {
		return statement == null;
	}

	@Override
	public String toString() {
		String body = statement == null ? "" : statement.toString();
		return isNumbered() ? lineNumber + " " + body : body;
	}
}
