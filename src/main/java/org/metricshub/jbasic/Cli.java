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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import org.metricshub.jbasic.backend.ExecutionResult;
import org.metricshub.jbasic.frontend.LoadFailure;
import org.metricshub.jbasic.frontend.LoadResult;
import org.metricshub.jbasic.frontend.ProgramLoadException;
import org.metricshub.jbasic.frontend.ast.ParserException;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.util.BasicSettings;
import org.metricshub.jbasic.util.ScriptFileSource;

/**
 * Command-line interface for JBasic.
 * <p>
 * With a program file, the program is loaded and run (or listed with
 * <code>-l</code>). Without one, or with <code>-i</code>, an interactive
 * session reads lines from the input until its end.
 */
public final class Cli {

	/** Exit code of a run that completed. */
	public static final int EXIT_OK = 0;

	/** Exit code of a run aborted by a runtime error. */
	public static final int EXIT_RUNTIME_ERROR = 1;

	/** Exit code when the program file has lines that fail to parse. */
	public static final int EXIT_LOAD_ERROR = 2;

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "JBasic.jar";
		}
		JAR_NAME = myName;
	}

	private final BasicSettings settings = new BasicSettings();
	private final PrintStream out;
	private final PrintStream err;

	private ScriptFileSource programFile;
	private boolean interactive;
	private boolean listOnly;
	private boolean printUsage;
	private int exitCode = EXIT_OK;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which program input and session lines are read
	 * @param out stream where program output is written
	 * @param err stream where errors are reported
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link BasicSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public BasicSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program file named on the command line, or {@code null}
	 */
	public ScriptFileSource getProgramFile() {
		return programFile;
	}

	public boolean isInteractive() {
		return interactive;
	}

	public boolean isListOnly() {
		return listOnly;
	}

	/**
	 * @return the exit code of the last {@link #run()}
	 */
	public int getExitCode() {
		return exitCode;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// program file name
				break;
			} else if (arg.equals("-i")) {
				// -i : interactive session, after loading the program file if any
				interactive = true;
			} else if (arg.equals("-l")) {
				// -l : list the program instead of running it
				listOnly = true;
			} else if (arg.equals("--no-prompt")) {
				settings.setPromptForInput(false);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (argIdx < args.length) {
			programFile = new ScriptFileSource(args[argIdx++]);
			if (!new File(programFile.getFilePath()).isFile()) {
				throw new IllegalArgumentException("Program file not found: " + programFile.getFilePath());
			}
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Only one program file is accepted. Unexpected: " + args[argIdx]);
		}
		if (listOnly && programFile == null) {
			throw new IllegalArgumentException("-l requires a program file");
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @return the exit code, also available through {@link #getExitCode()}
	 * @throws IOException if the program file or the input cannot be read
	 */
	public int run() throws IOException {
		exitCode = EXIT_OK;
		if (printUsage) {
			usage(out);
			return exitCode;
		}

		Basic basic = new Basic(settings);
		if (programFile != null) {
			LoadResult loaded = basic.load(programFile);
			if (loaded.hasFailures()) {
				for (LoadFailure failure : loaded.getFailures()) {
					err.println(failure);
				}
				exitCode = EXIT_LOAD_ERROR;
				return exitCode;
			}
			if (listOnly) {
				basic.list();
			} else if (!interactive) {
				ExecutionResult result = basic.run();
				if (result.isAborted()) {
					report(result.getError());
					exitCode = EXIT_RUNTIME_ERROR;
				}
				return exitCode;
			}
		}
		if (interactive || programFile == null) {
			session(basic);
		}
		return exitCode;
	}

	/**
	 * Reads lines until the end of the input, entering each one into the
	 * session. Errors are reported and the session goes on.
	 */
	private void session(Basic basic) throws IOException {
		out.println(settings.getReadyMessage());
		String line;
		while ((line = basic.getInputSource().readLine()) != null) {
			try {
				ExecutionResult result = basic.enterLine(line);
				if (result.isAborted()) {
					report(result.getError());
				}
			} catch (ProgramLoadException e) {
				for (LoadFailure failure : e.getFailures()) {
					err.println(failure);
				}
			} catch (ParserException e) {
				report(e, e.getLineNumber());
			} catch (IOException e) {
				report(e, -1);
			}
		}
	}

	private void report(BasicRuntimeException e) {
		report(e, e.getLineNumber());
	}

	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	private void report(Exception e, int lineNumber) {
		if (lineNumber >= 0) {
			err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), lineNumber, e.getMessage());
		} else {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("java -jar " + JAR_NAME + " [-i] [-l] [--no-prompt] [program-file]");
		dest.println();
		dest.println(" program-file = Load this program and run it.");
		dest.println("                Without it, an interactive session starts.");
		dest.println(" -i = Start an interactive session after loading the program file.");
		dest.println(" -l = List the program file instead of running it.");
		dest.println(" --no-prompt = Do not print a prompt when INPUT waits for a value.");
		dest.println();
		dest.println("In an interactive session, a numbered line is stored in the program,");
		dest.println("a line number alone deletes that line, LOAD file and SAVE file read");
		dest.println("and write the program, and any other line is executed immediately.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for program input
	 * @param os output stream for program output
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws IOException if execution fails to read its input
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		int code;
		try {
			Cli cli = new Cli();
			cli.parse(args);
			code = cli.run();
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			code = EXIT_RUNTIME_ERROR;
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			code = EXIT_RUNTIME_ERROR;
		}
		if (code != EXIT_OK) {
			System.exit(code);
		}
	}
}
