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

/**
 * Visitor over every kind of {@link Statement}.
 *
 * @param <R> result type
 */
public interface StatementVisitor<R> {

	R visitRem(RemStatement statement);

	R visitPrint(PrintStatement statement);

	R visitLet(LetStatement statement);

	R visitIf(IfStatement statement);

	R visitGoto(GotoStatement statement);

	R visitGosub(GosubStatement statement);

	R visitReturn(ReturnStatement statement);

	R visitInput(InputStatement statement);

	R visitFor(ForStatement statement);

	R visitNext(NextStatement statement);

	R visitEnd(EndStatement statement);

	R visitList(ListStatement statement);

	R visitRun(RunStatement statement);

	R visitClear(ClearStatement statement);
}
