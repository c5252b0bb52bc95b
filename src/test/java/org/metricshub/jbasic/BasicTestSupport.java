package org.metricshub.jbasic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.jbasic.backend.ExecutionResult;
import org.metricshub.jbasic.frontend.LoadResult;
import org.metricshub.jbasic.jrt.RuntimeError;
import org.metricshub.jbasic.util.BasicSettings;
import org.metricshub.jbasic.util.ScriptSource;

/**
 * Fluent builders for tests that run a BASIC program, either through the
 * {@link Basic} facade or through the {@link Cli}.
 *
 * <pre>
 * BasicTestSupport
 * 		.basicTest("counts to 3")
 * 		.program("10 FOR I=1 TO 3", "20 PRINT I", "30 NEXT I")
 * 		.expectLines("1", "2", "3")
 * 		.runAndAssert();
 * </pre>
 */
public final class BasicTestSupport {

	private static final Path SHARED_TEMP_DIR;

	static {
		try {
			SHARED_TEMP_DIR = Files.createTempDirectory("jbasic-shared");
			SHARED_TEMP_DIR.toFile().deleteOnExit();
		} catch (IOException ex) {
			throw new ExceptionInInitializerError(ex);
		}
	}

	private BasicTestSupport() {}

	public static BasicTestBuilder basicTest(String description) {
		return new BasicTestBuilder(description);
	}

	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	public static Path sharedTempDirectory() {
		return SHARED_TEMP_DIR;
	}

	/**
	 * Writes a program into a new file of the shared temporary directory.
	 *
	 * @param lines the program lines
	 * @return the file
	 * @throws IOException if the file cannot be written
	 */
	public static Path writeProgram(String... lines) throws IOException {
		Path file = Files.createTempFile(SHARED_TEMP_DIR, "program", ".bas");
		file.toFile().deleteOnExit();
		Files.write(file, Arrays.asList(lines), StandardCharsets.UTF_8);
		return file;
	}

	static List<String> normalizeOutputLines(String output) {
		if (output.isEmpty()) {
			return Collections.emptyList();
		}
		String normalized = output.replace("\r\n", "\n").replace("\r", "\n");
		if (normalized.endsWith("\n")) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		return Arrays.asList(normalized.split("\n", -1));
	}

	public static final class TestResult {
		private final String description;
		private final String output;
		private final String errorOutput;
		private final int exitCode;
		private final ExecutionResult executionResult;
		private final BaseTestBuilder<?> expected;

		TestResult(
				String description,
				String output,
				String errorOutput,
				int exitCode,
				ExecutionResult executionResult,
				BaseTestBuilder<?> expected) {
			this.description = description;
			this.output = output;
			this.errorOutput = errorOutput;
			this.exitCode = exitCode;
			this.executionResult = executionResult;
			this.expected = expected;
		}

		public String output() {
			return output;
		}

		public String errorOutput() {
			return errorOutput;
		}

		public int exitCode() {
			return exitCode;
		}

		public String[] lines() {
			return normalizeOutputLines(output).toArray(new String[0]);
		}

		/**
		 * @return the outcome of the run; {@code null} for CLI tests
		 */
		public ExecutionResult executionResult() {
			return executionResult;
		}

		public void assertExpected() {
			if (expected.expectedLines != null) {
				assertEquals("Unexpected output for " + description, expected.expectedLines, normalizeOutputLines(output));
			} else if (expected.expectedOutput != null) {
				assertEquals("Unexpected output for " + description, expected.expectedOutput, output);
			}
			assertEquals("Unexpected exit code for " + description, expected.expectedExitCode, exitCode);
			if (expected.expectedError != null) {
				assertNotNull("Expected an error for " + description, executionResult);
				assertTrue("Expected " + description + " to abort but it completed", executionResult.isAborted());
				assertEquals("Unexpected error for " + description, expected.expectedError, executionResult.getError().getError());
				assertEquals("Unexpected abort line for " + description, expected.expectedAbortLine, executionResult.getLineNumber());
			}
			for (String fragment : expected.expectedErrorFragments) {
				assertTrue(
						"Expected error output of " + description + " to contain '" + fragment + "' but got: " + errorOutput,
						errorOutput.contains(fragment));
			}
		}
	}

	abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		protected final String description;
		protected final List<String> programLines = new ArrayList<>();
		protected final StringBuilder input = new StringBuilder();
		protected List<String> expectedLines;
		protected String expectedOutput;
		protected int expectedExitCode;
		protected RuntimeError expectedError;
		protected int expectedAbortLine;
		protected final List<String> expectedErrorFragments = new ArrayList<>();

		BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		protected B self() {
			return (B) this;
		}

		public B program(String... lines) {
			programLines.addAll(Arrays.asList(lines));
			return self();
		}

		/**
		 * Adds lines to the standard input, one value or command per line.
		 */
		public B input(String... lines) {
			for (String line : lines) {
				input.append(line).append('\n');
			}
			return self();
		}

		public B expectLines(String... lines) {
			this.expectedLines = Arrays.asList(lines);
			return self();
		}

		public B expectOutput(String output) {
			this.expectedOutput = output;
			return self();
		}

		public B expectExitCode(int code) {
			this.expectedExitCode = code;
			return self();
		}

		public B expectErrorContaining(String fragment) {
			expectedErrorFragments.add(fragment);
			return self();
		}

		protected String programText() {
			StringBuilder sb = new StringBuilder();
			for (String line : programLines) {
				sb.append(line).append('\n');
			}
			return sb.toString();
		}

		public abstract TestResult run() throws Exception;

		public void runAndAssert() throws Exception {
			run().assertExpected();
		}
	}

	/**
	 * Loads the program into a fresh {@link Basic} session and runs it.
	 * Input prompts are off unless {@link #withPrompt()} is called.
	 */
	public static final class BasicTestBuilder extends BaseTestBuilder<BasicTestBuilder> {
		private boolean prompt;

		private BasicTestBuilder(String description) {
			super(description);
		}

		public BasicTestBuilder withPrompt() {
			this.prompt = true;
			return this;
		}

		/**
		 * Expects the run to be aborted, with exit code 1 as the CLI reports it.
		 */
		public BasicTestBuilder expectAbort(int lineNumber, RuntimeError error) {
			this.expectedError = error;
			this.expectedAbortLine = lineNumber;
			this.expectedExitCode = Cli.EXIT_RUNTIME_ERROR;
			return this;
		}

		@Override
		public TestResult run() throws Exception {
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			BasicSettings settings = new BasicSettings();
			settings.setInput(new ByteArrayInputStream(input.toString().getBytes(StandardCharsets.UTF_8)));
			settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
			settings.setPromptForInput(prompt);
			Basic basic = new Basic(settings);
			LoadResult loaded = basic.load(new ScriptSource(description, new StringReader(programText())));
			assertTrue("Program of " + description + " failed to load: " + loaded.getFailures(), !loaded.hasFailures());
			ExecutionResult result = basic.run();
			int exitCode = result.isAborted() ? Cli.EXIT_RUNTIME_ERROR : Cli.EXIT_OK;
			return new TestResult(
					description,
					out.toString(StandardCharsets.UTF_8.name()),
					result.isAborted() ? result.toString() : "",
					exitCode,
					result,
					this);
		}
	}

	/**
	 * Runs the {@link Cli} with the given arguments. When a program was
	 * given, it is written to a temporary file passed as the last argument.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> arguments = new ArrayList<>();

		private CliTestBuilder(String description) {
			super(description);
		}

		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		@Override
		public TestResult run() throws Exception {
			List<String> args = new ArrayList<>(arguments);
			if (!programLines.isEmpty()) {
				args.add(writeProgram(programLines.toArray(new String[0])).toString());
			}
			ByteArrayOutputStream out = new ByteArrayOutputStream();
			ByteArrayOutputStream err = new ByteArrayOutputStream();
			Cli cli = Cli
					.create(
							args.toArray(new String[0]),
							new ByteArrayInputStream(input.toString().getBytes(StandardCharsets.UTF_8)),
							new PrintStream(out, true, StandardCharsets.UTF_8.name()),
							new PrintStream(err, true, StandardCharsets.UTF_8.name()));
			return new TestResult(
					description,
					out.toString(StandardCharsets.UTF_8.name()),
					err.toString(StandardCharsets.UTF_8.name()),
					cli.getExitCode(),
					null,
					this);
		}
	}
}
