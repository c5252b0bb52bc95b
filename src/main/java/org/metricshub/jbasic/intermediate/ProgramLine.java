package org.metricshub.jbasic.intermediate;

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

import org.metricshub.jbasic.frontend.ast.Statement;

/**
 * A line number paired with its statement, as enumerated by
 * {@link ProgramStore}.
 */
public final class ProgramLine {

	private final int lineNumber;
	private final Statement statement;

	public ProgramLine(int lineNumber, Statement statement) {
		this.lineNumber = lineNumber;
		this.statement = statement;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public Statement getStatement() {
		return statement;
	}

	/** Renders the line the way it is listed and saved. */
	@Override
	public String toString() {
		return lineNumber + " " + statement;
	}
}
