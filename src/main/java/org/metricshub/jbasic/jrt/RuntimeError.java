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
 * The runtime failures that abort a program run.
 */
public enum RuntimeError {
	/** <code>GOTO</code>, <code>GOSUB</code> or a return address names a missing line. */
	UNDEFINED_LINE("Undefined line"),
	DIVISION_BY_ZERO("Division by zero"),
	RETURN_WITHOUT_GOSUB("RETURN without GOSUB"),
	/** No active loop matches the variable of a <code>NEXT</code>. */
	NEXT_WITHOUT_FOR("NEXT without FOR"),
	/** <code>INPUT</code> needed a value but the input source is exhausted. */
	END_OF_INPUT("End of input");

	private final String description;

	RuntimeError(String description) {
		this.description = description;
	}

	public String getDescription() {
		return description;
	}
}
