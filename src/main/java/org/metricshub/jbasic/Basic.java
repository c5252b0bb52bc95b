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

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.jbasic.backend.ExecutionResult;
import org.metricshub.jbasic.backend.Executor;
import org.metricshub.jbasic.frontend.BasicParser;
import org.metricshub.jbasic.frontend.LoadResult;
import org.metricshub.jbasic.frontend.ParsedLine;
import org.metricshub.jbasic.frontend.ProgramLoadException;
import org.metricshub.jbasic.frontend.ProgramLoader;
import org.metricshub.jbasic.intermediate.ProgramStore;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.OutputSink;
import org.metricshub.jbasic.jrt.PrintStreamOutputSink;
import org.metricshub.jbasic.jrt.ReaderInputSource;
import org.metricshub.jbasic.util.BasicLogger;
import org.metricshub.jbasic.util.BasicSettings;
import org.metricshub.jbasic.util.ProgramWriter;
import org.metricshub.jbasic.util.ScriptFileSource;
import org.metricshub.jbasic.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and execution of BASIC programs.
 * <p>
 * A {@code Basic} instance is one interpreter session: one program, kept
 * between runs, and one {@link Executor} owning the variables. Lines are
 * entered the way a user types them:
 * <ul>
 * <li>a numbered line is stored in the program, replacing the line with
 * the same number, and a number alone deletes that line;
 * <li><code>LOAD file</code> and <code>SAVE file</code> replace or persist
 * the whole program (the file name may be quoted);
 * <li>anything else is executed immediately.
 * </ul>
 * Input and output streams are taken from the {@link BasicSettings}.
 * <p>
 * Programs can also be run in one call:
 *
 * <pre>
 * String output = Basic.run("10 PRINT 6*7", "");
 * </pre>
 */
public class Basic {

	private static final Logger LOGGER = BasicLogger.getLogger(Basic.class);

	private static final Pattern LOAD_COMMAND = Pattern.compile("(?i)LOAD\\s+\"?([^\"]+?)\"?\\s*");
	private static final Pattern SAVE_COMMAND = Pattern.compile("(?i)SAVE\\s+\"?([^\"]+?)\"?\\s*");

	private final BasicParser parser = new BasicParser();
	private final ProgramLoader loader = new ProgramLoader();
	private final ProgramStore program = new ProgramStore();
	private final ReaderInputSource inputSource;
	private final Executor executor;

	/**
	 * Creates a session reading from {@link System#in} and writing to
	 * {@link System#out}.
	 */
	public Basic() {
		this(new BasicSettings());
	}

	/**
	 * Creates a session with the streams and prompts of the specified
	 * settings.
	 *
	 * @param settings the session parameters
	 */
	public Basic(BasicSettings settings) {
		OutputSink output = new PrintStreamOutputSink(settings.getOutputStream());
		BufferedReader reader = new BufferedReader(new InputStreamReader(settings.getInput(), StandardCharsets.UTF_8));
		this.inputSource = new ReaderInputSource(
				reader,
				settings.isPromptForInput() ? output : null,
				settings.getInputPrompt());
		this.executor = new Executor(program, output, inputSource);
	}

	/**
	 * Processes one line as typed in an interactive session.
	 *
	 * @param line the text of the line
	 * @return the outcome of the statement if one was executed,
	 *         {@link ExecutionResult#completed()} otherwise
	 * @throws org.metricshub.jbasic.frontend.ast.ParserException if the line
	 *         cannot be parsed
	 * @throws ProgramLoadException if <code>LOAD</code> met lines it could not
	 *         parse; the other lines are loaded
	 * @throws IOException if <code>LOAD</code> or <code>SAVE</code> fails to
	 *         access its file
	 */
	public ExecutionResult enterLine(String line) throws IOException {
		String text = line.trim();
		if (text.isEmpty()) {
			return ExecutionResult.completed();
		}
		Matcher m = LOAD_COMMAND.matcher(text);
		if (m.matches()) {
			LoadResult result = load(new ScriptFileSource(m.group(1)));
			if (result.hasFailures()) {
				throw new ProgramLoadException(m.group(1), result.getFailures());
			}
			return ExecutionResult.completed();
		}
		m = SAVE_COMMAND.matcher(text);
		if (m.matches()) {
			try (Writer writer = Files.newBufferedWriter(Paths.get(m.group(1)), StandardCharsets.UTF_8)) {
				save(writer);
			}
			return ExecutionResult.completed();
		}
		ParsedLine parsed = parser.parseLine(text);
		if (parsed.isNumbered()) {
			if (parsed.isEmpty()) {
				program.remove(parsed.getLineNumber());
			} else {
				program.insertOrReplace(parsed.getLineNumber(), parsed.getStatement());
			}
			return ExecutionResult.completed();
		}
		if (parsed.isEmpty()) {
			return ExecutionResult.completed();
		}
		return executor.execute(parsed.getStatement());
	}

	/**
	 * Replaces the program with the lines read from a source. Lines that fail
	 * to parse are reported in the result and left out.
	 *
	 * @param source where the program text comes from
	 * @return the loaded program and the failures
	 * @throws IOException upon an IO error
	 */
	public LoadResult load(ScriptSource source) throws IOException {
		LoadResult result = loader.load(source);
		program.replaceWith(result.getProgram());
		return result;
	}

	/**
	 * Writes the program in its line-oriented text form.
	 *
	 * @param writer destination, flushed but not closed
	 * @throws IOException upon an IO error
	 */
	public void save(Writer writer) throws IOException {
		ProgramWriter.write(program, writer);
	}

	/**
	 * Runs the program from its first line with fresh variables.
	 *
	 * @return how the run ended
	 */
	public ExecutionResult run() {
		return executor.run();
	}

	/**
	 * Writes the program listing to the output.
	 */
	public void list() {
		executor.list();
	}

	public ProgramStore getProgram() {
		return program;
	}

	/**
	 * Returns the input of this session. Interactive front ends read their
	 * command lines from it, so that lines typed for <code>INPUT</code> and
	 * command lines come from the same buffer.
	 *
	 * @return the input source
	 */
	public ReaderInputSource getInputSource() {
		return inputSource;
	}

	/**
	 * Loads and runs a program, and returns what it printed.
	 * <code>INPUT</code> reads from {@code input}, one value per line,
	 * without prompting.
	 *
	 * @param script the program text
	 * @param input the program input
	 * @return the output of the program
	 * @throws IOException upon an IO error
	 * @throws ProgramLoadException if a line of the program cannot be parsed
	 * @throws BasicRuntimeException if the run is aborted
	 */
	public static String run(String script, String input) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		BasicSettings settings = new BasicSettings();
		settings.setInput(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
		settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		settings.setPromptForInput(false);
		Basic basic = new Basic(settings);
		LoadResult loaded = basic.load(new ScriptSource(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, new StringReader(script)));
		if (loaded.hasFailures()) {
			throw new ProgramLoadException(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, loaded.getFailures());
		}
		ExecutionResult result = basic.run();
		LOGGER.debug("Run of command-line program: {}", result);
		if (result.isAborted()) {
			throw result.getError();
		}
		return out.toString(StandardCharsets.UTF_8.name());
	}
}
