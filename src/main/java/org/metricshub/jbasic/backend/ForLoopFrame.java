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

/**
 * An active <code>FOR</code> loop: its variable, limit and step, and the
 * line a continuing <code>NEXT</code> jumps back to.
 */
public final class ForLoopFrame {

	private final char variable;
	private final int limit;
	private final int step;
	private final int bodyEntryLine;

	ForLoopFrame(char variable, int limit, int step, int bodyEntryLine) {
		this.variable = variable;
		this.limit = limit;
		this.step = step;
		this.bodyEntryLine = bodyEntryLine;
	}

	public char getVariable() {
		return variable;
	}

	public int getLimit() {
		return limit;
	}

	public int getStep() {
		return step;
	}

	/**
	 * @return the line following the <code>FOR</code>, or
	 *         {@link Executor#HALTED} if it was the last line
	 */
	public int getBodyEntryLine() {
		return bodyEntryLine;
	}

	/**
	 * Whether a loop variable holding {@code value} runs the body again.
	 *
	 * @param value the incremented value of the variable
	 * @return {@code true} if the loop continues
	 */
	boolean continuesWith(long value) {
		return (step > 0 && value <= limit) || (step < 0 && value >= limit);
	}

	@Override
	public String toString() {
		return "FOR " + variable + " TO " + limit + " STEP " + step + " @" + bodyEntryLine;
	}
}
