package org.metricshub.jbasic.frontend.ast;

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

/** <code>INPUT A, B, ...</code>: reads one integer per variable, in order. */
public final class InputStatement extends Statement {

	private final List<Character> variables;

	public InputStatement(List<Character> variables) {
		if (variables.isEmpty()) {
			throw new IllegalArgumentException("INPUT requires at least one variable");
		}
		this.variables = Collections.unmodifiableList(new ArrayList<Character>(variables));
	}

	public List<Character> getVariables() {
		return variables;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitInput(this);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("INPUT");
		for (int i = 0; i < variables.size(); i++) {
			sb.append(i == 0 ? " " : ", ").append(variables.get(i).charValue());
		}
		return sb.toString();
	}
}
