package org.metricshub.jbasic.backend;

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

import org.metricshub.jbasic.frontend.ast.BinaryOp;
import org.metricshub.jbasic.frontend.ast.Expression;
import org.metricshub.jbasic.frontend.ast.ExpressionVisitor;
import org.metricshub.jbasic.frontend.ast.IntLiteral;
import org.metricshub.jbasic.frontend.ast.StringLiteral;
import org.metricshub.jbasic.frontend.ast.UnaryOp;
import org.metricshub.jbasic.frontend.ast.VariableRef;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.Environment;
import org.metricshub.jbasic.jrt.RuntimeError;

/**
 * Reduces an expression tree to an integer, reading variables from an
 * {@link Environment}.
 * <p>
 * Arithmetic is 32-bit two's complement: <code>+</code>, <code>-</code>
 * and <code>*</code> wrap around on overflow, <code>/</code> truncates
 * toward zero. Relational operators yield 1 when true and 0 when false.
 * The left operand is always evaluated completely before the right one.
 */
public class Evaluator implements ExpressionVisitor<Integer> {

	private final Environment environment;

	public Evaluator(Environment environment) {
		this.environment = environment;
	}

	/**
	 * @param expression the expression to evaluate
	 * @return its value
	 * @throws BasicRuntimeException on division by zero
	 */
	public int evaluate(Expression expression) {
		return expression.accept(this).intValue();
	}

	@Override
	public Integer visitIntLiteral(IntLiteral literal) {
		return Integer.valueOf(literal.getValue());
	}

	@Override
	public Integer visitStringLiteral(StringLiteral literal) {
		throw new IllegalStateException("A string has no integer value: " + literal);
	}

	@Override
	public Integer visitVariableRef(VariableRef variable) {
		return Integer.valueOf(environment.get(variable.getName()));
	}

	@Override
	public Integer visitUnaryOp(UnaryOp unaryOp) {
		int operand = evaluate(unaryOp.getOperand());
		switch (unaryOp.getKind()) {
		case NEGATE:
			return Integer.valueOf(-operand);
		default:
			throw new Error("Invalid unary operator: " + unaryOp.getKind());
		}
	}

	@Override
	public Integer visitBinaryOp(BinaryOp binaryOp) {
		int left = evaluate(binaryOp.getLeft());
		int right = evaluate(binaryOp.getRight());
		return Integer.valueOf(apply(binaryOp, left, right));
	}

	private static int apply(BinaryOp binaryOp, int left, int right) {
		switch (binaryOp.getOperator()) {
		case ADD:
			return left + right;
		case SUBTRACT:
			return left - right;
		case MULTIPLY:
			return left * right;
		case DIVIDE:
			if (right == 0) {
				throw new BasicRuntimeException(RuntimeError.DIVISION_BY_ZERO, "Division by zero in " + binaryOp);
			}
			return left / right;
		case EQ:
			return toInt(left == right);
		case NE:
			return toInt(left != right);
		case LT:
			return toInt(left < right);
		case LE:
			return toInt(left <= right);
		case GT:
			return toInt(left > right);
		case GE:
			return toInt(left >= right);
		default:
			throw new Error("Invalid operator: " + binaryOp.getOperator());
		}
	}

	private static int toInt(boolean b) {
		return b ? 1 : 0;
	}
}
