package org.metricshub.jbasic.jrt;

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
 * A runtime exception thrown while a BASIC program executes. It is
 * provided to conveniently distinguish between BASIC runtime
 * failures, identified by their {@link RuntimeError}, and other runtime
 * exceptions.
 */
public class BasicRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final RuntimeError error;

	private final int lineNumber;

	/**
	 * @param error the kind of failure
	 * @param msg a {@link java.lang.String} object
	 */
	public BasicRuntimeException(RuntimeError error, String msg) {
		super(msg);
		this.error = error;
		this.lineNumber = -1;
	}

	/**
	 * @param lineno the BASIC line being executed
	 * @param error the kind of failure
	 * @param msg a {@link java.lang.String} object
	 */
	public BasicRuntimeException(int lineno, RuntimeError error, String msg) {
		super(msg);
		this.error = error;
		this.lineNumber = lineno;
	}

	public RuntimeError getError() {
		return error;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * Returns this exception tagged with the line that was executing. The
	 * returned exception keeps the stack trace of this one.
	 *
	 * @param lineno the executing line
	 * @return this exception if it already carries that line, a copy otherwise
	 */
	public BasicRuntimeException atLine(int lineno) {
		if (lineno == lineNumber) {
			return this;
		}
		BasicRuntimeException tagged = new BasicRuntimeException(lineno, error, getMessage());
		tagged.setStackTrace(getStackTrace());
		return tagged;
	}
}
