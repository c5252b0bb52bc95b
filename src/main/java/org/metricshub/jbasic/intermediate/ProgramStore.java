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

import java.util.Iterator;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import org.metricshub.jbasic.frontend.ast.Statement;

/**
 * The statements of a program, keyed and ordered by line number.
 * <p>
 * Ordering is always numeric, never insertion order. All lookups are
 * O(log n). Iteration is a lazy, read-only view in ascending line order,
 * and may be restarted any number of times.
 * <p>
 * The store is only changed by program editing and loading; the
 * executor reads it but never writes to it.
 */
public class ProgramStore implements Iterable<ProgramLine> {

	private final NavigableMap<Integer, Statement> lines = new TreeMap<Integer, Statement>();

	/**
	 * Stores a statement, replacing any statement already at that line.
	 *
	 * @param lineNumber a positive line number
	 * @param statement the statement to store
	 * @return the statement previously stored at that line, or {@code null}
	 */
	public Statement insertOrReplace(int lineNumber, Statement statement) {
		checkLineNumber(lineNumber);
		if (statement == null) {
			throw new IllegalArgumentException("statement must not be null");
		}
		return lines.put(Integer.valueOf(lineNumber), statement);
	}

	/**
	 * @param lineNumber the line to delete
	 * @return the removed statement, or {@code null} if the line did not exist
	 */
	public Statement remove(int lineNumber) {
		return lines.remove(Integer.valueOf(lineNumber));
	}

	/**
	 * @param lineNumber the line to look up
	 * @return the statement at that line, or {@code null} if there is none
	 */
	public Statement get(int lineNumber) {
		return lines.get(Integer.valueOf(lineNumber));
	}

	public boolean contains(int lineNumber) {
		return lines.containsKey(Integer.valueOf(lineNumber));
	}

	/**
	 * @param lineNumber any line number, stored or not
	 * @return the smallest stored line number greater than {@code lineNumber},
	 *         or {@code null} if there is none
	 */
	public Integer successorOf(int lineNumber) {
		return lines.higherKey(Integer.valueOf(lineNumber));
	}

	/**
	 * @return the smallest stored line number, or {@code null} if the program
	 *         is empty
	 */
	public Integer firstLine() {
		return lines.isEmpty() ? null : lines.firstKey();
	}

	public int size() {
		return lines.size();
	}

	public boolean isEmpty() {
		return lines.isEmpty();
	}

	/** Deletes every line. */
	public void clear() {
		lines.clear();
	}

	/**
	 * Replaces the content of this store with the lines of another one.
	 *
	 * @param other the program to copy
	 */
	public void replaceWith(ProgramStore other) {
		if (other == this) {
			return;
		}
		lines.clear();
		lines.putAll(other.lines);
	}

	@Override
	public Iterator<ProgramLine> iterator() {
		final Iterator<Map.Entry<Integer, Statement>> entries = lines.entrySet().iterator();
		return new Iterator<ProgramLine>() {
			@Override
			public boolean hasNext() {
				return entries.hasNext();
			}

			@Override
			public ProgramLine next() {
				Map.Entry<Integer, Statement> entry = entries.next();
				return new ProgramLine(entry.getKey().intValue(), entry.getValue());
			}
		};
	}

	private static void checkLineNumber(int lineNumber) {
		if (lineNumber <= 0) {
			throw new IllegalArgumentException("Line number must be positive: " + lineNumber);
		}
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		for (ProgramLine line : this) {
			sb.append(line).append('\n');
		}
		return sb.toString();
	}
}
