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
 * Thrown when a BASIC line cannot be turned into a statement.
 * It carries the number of the line being parsed, or {@link #NO_LINE}
 * for a line entered without a line number.
 */
public class ParserException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** Line number reported for unnumbered (immediate) lines. */
	public static final int NO_LINE = -1;

	private final int lineNumber;

	/**
	 * @param msg description of the problem
	 * @param lineNumber number of the offending line, or {@link #NO_LINE}
	 */
	public ParserException(String msg, int lineNumber) {
		super(msg);
		this.lineNumber = lineNumber;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * the line had none.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
