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

import java.util.OptionalInt;
import org.metricshub.jbasic.frontend.ast.ClearStatement;
import org.metricshub.jbasic.frontend.ast.EndStatement;
import org.metricshub.jbasic.frontend.ast.Expression;
import org.metricshub.jbasic.frontend.ast.ForStatement;
import org.metricshub.jbasic.frontend.ast.GosubStatement;
import org.metricshub.jbasic.frontend.ast.GotoStatement;
import org.metricshub.jbasic.frontend.ast.IfStatement;
import org.metricshub.jbasic.frontend.ast.InputStatement;
import org.metricshub.jbasic.frontend.ast.LetStatement;
import org.metricshub.jbasic.frontend.ast.ListStatement;
import org.metricshub.jbasic.frontend.ast.NextStatement;
import org.metricshub.jbasic.frontend.ast.PrintStatement;
import org.metricshub.jbasic.frontend.ast.RemStatement;
import org.metricshub.jbasic.frontend.ast.ReturnStatement;
import org.metricshub.jbasic.frontend.ast.RunStatement;
import org.metricshub.jbasic.frontend.ast.Statement;
import org.metricshub.jbasic.frontend.ast.StatementVisitor;
import org.metricshub.jbasic.frontend.ast.StringLiteral;
import org.metricshub.jbasic.intermediate.ProgramLine;
import org.metricshub.jbasic.intermediate.ProgramStore;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.Environment;
import org.metricshub.jbasic.jrt.InputSource;
import org.metricshub.jbasic.jrt.OutputSink;
import org.metricshub.jbasic.jrt.RuntimeError;
import org.metricshub.jbasic.util.BasicLogger;
import org.slf4j.Logger;

/**
 * The BASIC statement executor.
 * <p>
 * It owns the whole execution context of one interpreter: the variables,
 * the <code>GOSUB</code> and <code>FOR</code> stacks and the program
 * pointer. The program store is only read. Independent instances share no
 * state.
 * <p>
 * The program is driven by an iterative loop over an explicit pointer.
 * Each statement is dispatched by a {@link StatementVisitor} that returns
 * where execution continues: a line number, {@link #HALTED}, or a request
 * to restart the program. Only <code>IF</code> dispatches its consequent
 * recursively.
 * <p>
 * Instances are not thread-safe.
 */
public class Executor {

	private static final Logger LOGGER = BasicLogger.getLogger(Executor.class);

	/**
	 * Pointer value meaning "halted". Line numbers are positive, so it never
	 * names a line.
	 */
	public static final int HALTED = 0;

	/** Pointer value returned by <code>RUN</code>: reset and start over. */
	static final int RESTART = -1;

	/** Line reported for errors raised by an immediate statement. */
	public static final int IMMEDIATE = -1;

	private final ProgramStore program;
	private final OutputSink output;
	private final InputSource input;
	private final Environment environment = new Environment();
	private final RuntimeStack runtimeStack = new RuntimeStack();
	private final Evaluator evaluator = new Evaluator(environment);
	private final Dispatcher dispatcher = new Dispatcher();

	/** Line being executed, or {@link #HALTED}. */
	private int pointer = HALTED;

	/** Fall-through successor of the statement being executed. */
	private int nextLine = HALTED;

	/**
	 * @param program the program to execute, never modified
	 * @param output where <code>PRINT</code> and <code>LIST</code> write
	 * @param input where <code>INPUT</code> reads
	 */
	public Executor(ProgramStore program, OutputSink output, InputSource input) {
		this.program = program;
		this.output = output;
		this.input = input;
	}

	/**
	 * Runs the stored program from its first line, after resetting the
	 * variables and both stacks.
	 *
	 * @return {@link ExecutionResult#completed()} when the program ends or
	 *         executes <code>END</code>, otherwise the line and the error
	 *         that aborted it
	 */
	public ExecutionResult run() {
		return drive(RESTART);
	}

	/**
	 * Executes one statement that is not part of the program, against the
	 * current variables and stacks. If the statement transfers control
	 * (<code>GOTO</code>, <code>GOSUB</code>, <code>RETURN</code>, a
	 * continuing <code>NEXT</code>), the stored program runs from the
	 * target without any reset. <code>RUN</code> behaves as {@link #run()}.
	 *
	 * @param statement the statement to execute
	 * @return how execution ended; an error raised by the statement itself is
	 *         reported at line {@link #IMMEDIATE}
	 */
	public ExecutionResult execute(Statement statement) {
		pointer = IMMEDIATE;
		nextLine = HALTED;
		int target;
		try {
			target = statement.accept(dispatcher);
		} catch (BasicRuntimeException e) {
			LOGGER.debug("Immediate statement {} failed: {}", statement, e.getMessage());
			pointer = HALTED;
			return ExecutionResult.abortedAt(IMMEDIATE, e);
		}
		return drive(target);
	}

	/**
	 * Writes the program to the output, one <code>line statement</code>
	 * per output line, in ascending order.
	 */
	public void list() {
		for (ProgramLine line : program) {
			output.println(line.toString());
		}
	}

	/**
	 * @return the variables of this interpreter
	 */
	public Environment getEnvironment() {
		return environment;
	}

	/**
	 * @return {@code true} unless a statement is executing
	 */
	public boolean isHalted() {
		return pointer == HALTED;
	}

	int returnDepth() {
		return runtimeStack.returnDepth();
	}

	int loopDepth() {
		return runtimeStack.loopDepth();
	}

	private void reset() {
		environment.clear();
		runtimeStack.clear();
	}

	private static int orHalted(Integer lineNumber) {
		return lineNumber == null ? HALTED : lineNumber.intValue();
	}

	private ExecutionResult drive(int start) {
		int line = start;
		try {
			while (true) {
				if (line == RESTART) {
					reset();
					line = orHalted(program.firstLine());
					LOGGER.debug("Running program of {} lines from line {}", program.size(), line);
				}
				Statement statement = line == HALTED ? null : program.get(line);
				if (statement == null) {
					// past the end, or END
					break;
				}
				pointer = line;
				nextLine = orHalted(program.successorOf(line));
				LOGGER.trace("{} {}", line, statement);
				try {
					line = statement.accept(dispatcher);
				} catch (BasicRuntimeException e) {
					LOGGER.debug("Aborted at line {}: {}", pointer, e.getMessage());
					return ExecutionResult.abortedAt(pointer, e);
				}
			}
		} finally {
			pointer = HALTED;
		}
		LOGGER.debug("Program completed");
		return ExecutionResult.completed();
	}

	private int evaluate(Expression expression) {
		return evaluator.evaluate(expression);
	}

	/**
	 * Evaluates a jump target and checks that it names a stored line.
	 */
	private int resolveTarget(Expression target) {
		int lineNumber = evaluate(target);
		if (lineNumber <= 0 || !program.contains(lineNumber)) {
			throw new BasicRuntimeException(RuntimeError.UNDEFINED_LINE, "Undefined line " + lineNumber);
		}
		return lineNumber;
	}

	/**
	 * Executes a single statement and tells where execution continues.
	 */
	private final class Dispatcher implements StatementVisitor<Integer> {

		private Integer advance() {
			return Integer.valueOf(nextLine);
		}

		@Override
		public Integer visitRem(RemStatement statement) {
			return advance();
		}

		@Override
		public Integer visitPrint(PrintStatement statement) {
			StringBuilder sb = new StringBuilder();
			for (Expression item : statement.getItems()) {
				if (item instanceof StringLiteral) {
					sb.append(((StringLiteral) item).getValue());
				} else {
					sb.append(evaluate(item));
				}
			}
			output.println(sb.toString());
			return advance();
		}

		@Override
		public Integer visitLet(LetStatement statement) {
			environment.set(statement.getVariable(), evaluate(statement.getValue()));
			return advance();
		}

		@Override
		public Integer visitIf(IfStatement statement) {
			if (evaluate(statement.getCondition()) != 0) {
				return statement.getConsequent().accept(this);
			}
			return advance();
		}

		@Override
		public Integer visitGoto(GotoStatement statement) {
			return Integer.valueOf(resolveTarget(statement.getTarget()));
		}

		@Override
		public Integer visitGosub(GosubStatement statement) {
			int target = resolveTarget(statement.getTarget());
			runtimeStack.pushReturn(nextLine);
			return Integer.valueOf(target);
		}

		@Override
		public Integer visitReturn(ReturnStatement statement) {
			Integer returnLine = runtimeStack.popReturn();
			if (returnLine == null) {
				throw new BasicRuntimeException(RuntimeError.RETURN_WITHOUT_GOSUB, "RETURN without GOSUB");
			}
			return returnLine;
		}

		@Override
		public Integer visitInput(InputStatement statement) {
			for (Character variable : statement.getVariables()) {
				char name = variable.charValue();
				OptionalInt value = input.readInteger(name);
				while (!value.isPresent()) {
					LOGGER.debug("Malformed input for {}, asking again", variable);
					value = input.readInteger(name);
				}
				environment.set(name, value.getAsInt());
			}
			return advance();
		}

		@Override
		public Integer visitFor(ForStatement statement) {
			int start = evaluate(statement.getStart());
			int limit = evaluate(statement.getLimit());
			int step = statement.getStep() == null ? 1 : evaluate(statement.getStep());
			char variable = statement.getVariable();
			environment.set(variable, start);
			runtimeStack.discardLoop(variable);
			runtimeStack.pushLoop(new ForLoopFrame(variable, limit, step, nextLine));
			return advance();
		}

		@Override
		public Integer visitNext(NextStatement statement) {
			ForLoopFrame frame = runtimeStack.findLoop(statement.getVariable());
			if (frame == null) {
				String name = statement.getVariable() == null ? "" : " " + statement.getVariable();
				throw new BasicRuntimeException(RuntimeError.NEXT_WITHOUT_FOR, "NEXT" + name + " without FOR");
			}
			char variable = frame.getVariable();
			long value = (long) environment.get(variable) + frame.getStep();
			environment.set(variable, (int) value);
			if (frame.continuesWith(value)) {
				return Integer.valueOf(frame.getBodyEntryLine());
			}
			runtimeStack.popLoop();
			return advance();
		}

		@Override
		public Integer visitEnd(EndStatement statement) {
			return Integer.valueOf(HALTED);
		}

		@Override
		public Integer visitList(ListStatement statement) {
			list();
			return advance();
		}

		@Override
		public Integer visitRun(RunStatement statement) {
			return Integer.valueOf(RESTART);
		}

		@Override
		public Integer visitClear(ClearStatement statement) {
			environment.clear();
			return advance();
		}
	}
}
