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

/**
 * One record of a program text that could not be loaded.
 */
public final class LoadFailure {

	private final int sourceLine;
	private final String text;
	private final ParserException exception;

	LoadFailure(int sourceLine, String text, ParserException exception) {
		this.sourceLine = sourceLine;
		this.text = text;
		this.exception = exception;
	}

	/**
	 * @return the 1-based position of the record in the program text
	 */
	public int getSourceLine() {
		return sourceLine;
	}

	/**
	 * @return the record as read
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return the BASIC line number of the record, or {@code -1} if it had none
	 */
	public int getLineNumber() {
		return exception.getLineNumber();
	}

	public ParserException getException() {
		return exception;
	}

	@Override
	public String toString() {
		String where = getLineNumber() >= 0 ? "line " + getLineNumber() : "record " + sourceLine;
		return exception.getClass().getSimpleName() + " (" + where + "): " + exception.getMessage();
	}
}
