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

import java.util.Arrays;

/**
 * The variables of a running program: 26 integer slots named
 * <code>A</code> to <code>Z</code>. Every slot exists from the start and
 * reads 0 until assigned.
 */
public class Environment {

	/** Number of variables. */
	public static final int SIZE = 26;

	private final int[] values = new int[SIZE];

	/**
	 * @param name a variable name, <code>A</code> to <code>Z</code> in either case
	 * @return the current value, 0 if never assigned
	 */
	public int get(char name) {
		return values[slot(name)];
	}

	/**
	 * @param name a variable name, <code>A</code> to <code>Z</code> in either case
	 * @param value the new value
	 */
	public void set(char name, int value) {
		values[slot(name)] = value;
	}

	/** Resets every variable to 0. */
	public void clear() {
		Arrays.fill(values, 0);
	}

	private static int slot(char name) {
		char upper = Character.toUpperCase(name);
		if (upper < 'A' || upper > 'Z') {
			throw new IllegalArgumentException("Invalid variable name: " + name);
		}
		return upper - 'A';
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("{");
		for (int i = 0; i < SIZE; i++) {
			if (values[i] != 0) {
				if (sb.length() > 1) {
					sb.append(", ");
				}
				sb.append((char) ('A' + i)).append('=').append(values[i]);
			}
		}
		return sb.append('}').toString();
	}
}
