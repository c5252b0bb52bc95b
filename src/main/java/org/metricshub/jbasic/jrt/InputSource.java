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

import java.util.OptionalInt;

/**
 * Supplies the values requested by <code>INPUT</code>, one integer per
 * request. The call blocks until a value is available.
 */
public interface InputSource {

	/**
	 * Requests a value for one variable.
	 *
	 * @param variable the variable being read, for prompting
	 * @return the value, or an empty optional if the entry was not a valid
	 *         integer (the caller asks again)
	 * @throws BasicRuntimeException with {@link RuntimeError#END_OF_INPUT}
	 *         if no more input is available
	 */
	OptionalInt readInteger(char variable);
}
