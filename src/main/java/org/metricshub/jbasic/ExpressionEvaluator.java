package org.metricshub.jbasic;

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

import org.metricshub.jbasic.backend.Evaluator;
import org.metricshub.jbasic.frontend.BasicParser;
import org.metricshub.jbasic.jrt.Environment;

/**
 * Utility class to evaluate standalone BASIC expressions.
 */
public final class ExpressionEvaluator {

	private ExpressionEvaluator() {}

	/**
	 * Evaluates an arithmetic expression with every variable at 0.
	 *
	 * @param expression e.g. <code>"(1+2)*-3"</code>
	 * @return its value
	 */
	public static int eval(String expression) {
		return eval(expression, new Environment());
	}

	public static int eval(String expression, Environment environment) {
		return new Evaluator(environment).evaluate(new BasicParser().parseExpression(expression));
	}
}
