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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Runtime stacks used by the {@link Executor}: the return lines pushed by
 * <code>GOSUB</code> and the frames of the active <code>FOR</code> loops.
 */
class RuntimeStack {

	private final Deque<Integer> returnLines = new ArrayDeque<Integer>();
	private final Deque<ForLoopFrame> loops = new ArrayDeque<ForLoopFrame>();

	void pushReturn(int lineNumber) {
		returnLines.push(Integer.valueOf(lineNumber));
	}

	/** returns the line to resume at, or {@code null} if the stack is empty */
	Integer popReturn() {
		return returnLines.poll();
	}

	int returnDepth() {
		return returnLines.size();
	}

	void pushLoop(ForLoopFrame frame) {
		loops.push(frame);
	}

	void popLoop() {
		loops.pop();
	}

	int loopDepth() {
		return loops.size();
	}

	/**
	 * Finds the innermost loop of a variable, discarding the loops nested
	 * inside it. When no loop matches, every frame is discarded.
	 *
	 * @param variable the loop variable, {@code null} for the innermost loop
	 * @return the frame, left on top of the stack, or {@code null}
	 */
	ForLoopFrame findLoop(Character variable) {
		while (!loops.isEmpty()) {
			ForLoopFrame top = loops.peek();
			if (variable == null || top.getVariable() == variable.charValue()) {
				return top;
			}
			loops.pop();
		}
		return null;
	}

	/**
	 * Drops the loop of a variable, and the loops nested inside it, if the
	 * variable has an active loop. Other frames are left alone.
	 */
	void discardLoop(char variable) {
		boolean active = false;
		for (Iterator<ForLoopFrame> it = loops.iterator(); it.hasNext();) {
			if (it.next().getVariable() == variable) {
				active = true;
				break;
			}
		}
		if (active) {
			while (loops.pop().getVariable() != variable) {
				// nested loop of another variable
			}
		}
	}

	void clear() {
		returnLines.clear();
		loops.clear();
	}

	@Override
	public String toString() {
		return "returnLines = " + returnLines + ", loops = " + loops;
	}
}
