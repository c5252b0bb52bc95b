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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.jbasic.intermediate.ProgramStore;

/**
 * What {@link ProgramLoader} produced: the program made of every record
 * that parsed, and the records that did not.
 */
public final class LoadResult {

	private final ProgramStore program;
	private final List<LoadFailure> failures;

	LoadResult(ProgramStore program, List<LoadFailure> failures) {
		this.program = program;
		this.failures = Collections.unmodifiableList(new ArrayList<LoadFailure>(failures));
	}

	public ProgramStore getProgram() {
		return program;
	}

	public List<LoadFailure> getFailures() {
		return failures;
	}

	public boolean hasFailures() {
		return !failures.isEmpty();
	}
}
