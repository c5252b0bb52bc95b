package org.metricshub.jbasic.backend;

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

import org.metricshub.jbasic.jrt.BasicRuntimeException;

/**
 * How a run ended: either completed (the program ran past its last line or
 * executed <code>END</code>) or aborted by a runtime error at some line.
 */
public final class ExecutionResult {

	private static final ExecutionResult COMPLETED = new ExecutionResult(-1, null);

	private final int lineNumber;
	private final BasicRuntimeException error;

	private ExecutionResult(int lineNumber, BasicRuntimeException error) {
		this.lineNumber = lineNumber;
		this.error = error;
	}

	public static ExecutionResult completed() {
		return COMPLETED;
	}

	/**
	 * @param lineNumber the line that failed, {@code -1} for an immediate statement
	 * @param error the failure
	 * @return an aborted result
	 */
	public static ExecutionResult abortedAt(int lineNumber, BasicRuntimeException error) {
		return new ExecutionResult(lineNumber, error.atLine(lineNumber));
	}

	public boolean isCompleted() {
		return error == null;
	}

	public boolean isAborted() {
		return error != null;
	}

	/**
	 * @return the line that failed, or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the failure, or {@code null} if the run completed
	 */
	public BasicRuntimeException getError() {
		return error;
	}

	@Override
	public String toString() {
		if (isCompleted()) {
			return "Completed";
		}
		return "Aborted at line " + lineNumber + ": " + error.getMessage();
	}
}
