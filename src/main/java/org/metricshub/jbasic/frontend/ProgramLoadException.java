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

import java.util.Collections;
import java.util.List;

/**
 * Thrown when some records of a program could not be parsed. The records
 * that did parse have been loaded; the failures are attached.
 */
public class ProgramLoadException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient List<LoadFailure> failures;

	/**
	 * @param description where the program came from
	 * @param failures the records that failed, at least one
	 */
	public ProgramLoadException(String description, List<LoadFailure> failures) {
		super(failures.size() + " line(s) of " + description + " failed to load. First: " + failures.get(0));
		this.failures = Collections.unmodifiableList(failures);
	}

	public List<LoadFailure> getFailures() {
		return failures;
	}

	/**
	 * @return the BASIC line number of the first failure, or {@code -1}
	 */
	public int getLineNumber() {
		return failures.get(0).getLineNumber();
	}
}
