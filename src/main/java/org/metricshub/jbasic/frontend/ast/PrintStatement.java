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

/**
 * <code>PRINT item, item, ...</code>: items are {@link StringLiteral}s,
 * written as is, or integer expressions. The rendered items are written
 * side by side as one output line.
 */
public final class PrintStatement extends Statement {

	private final List<Expression> items;

	public PrintStatement(List<Expression> items) {
		this.items = Collections.unmodifiableList(new ArrayList<Expression>(items));
	}

	public List<Expression> getItems() {
		return items;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor) {
		return visitor.visitPrint(this);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("PRINT");
		for (int i = 0; i < items.size(); i++) {
			sb.append(i == 0 ? " " : ", ").append(items.get(i));
		}
		return sb.toString();
	}
}
