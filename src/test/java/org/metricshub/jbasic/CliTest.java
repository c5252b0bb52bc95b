package org.metricshub.jbasic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;

public class CliTest {

	@Test
	public void testRunProgramFile() throws Exception {
		BasicTestSupport
				.cliTest("run a program file")
				.program("10 FOR I=1 TO 3", "20 PRINT I*I", "30 NEXT I")
				.expectLines("1", "4", "9")
				.runAndAssert();
	}

	@Test
	public void testListProgramFile() throws Exception {
		BasicTestSupport
				.cliTest("-l lists the program")
				.argument("-l")
				.program("20 print \"world\"", "10 rem hello")
				.expectLines("10 REM hello", "20 PRINT \"world\"")
				.runAndAssert();
	}

	@Test
	public void testInputPrompt() throws Exception {
		BasicTestSupport
				.cliTest("INPUT prompts on stdout")
				.program("10 INPUT A", "20 PRINT -A")
				.input("8")
				.expectLines("? -8")
				.runAndAssert();
	}

	@Test
	public void testNoPrompt() throws Exception {
		BasicTestSupport
				.cliTest("--no-prompt")
				.argument("--no-prompt")
				.program("10 INPUT A", "20 PRINT -A")
				.input("8")
				.expectLines("-8")
				.runAndAssert();
	}

	@Test
	public void testRuntimeErrorExitCode() throws Exception {
		BasicTestSupport
				.cliTest("runtime error")
				.program("10 PRINT 1", "20 RETURN", "30 PRINT 3")
				.expectLines("1")
				.expectExitCode(Cli.EXIT_RUNTIME_ERROR)
				.expectErrorContaining("BasicRuntimeException (line 20): RETURN without GOSUB")
				.runAndAssert();
	}

	@Test
	public void testLoadErrorExitCode() throws Exception {
		BasicTestSupport
				.cliTest("syntax errors are all reported, nothing runs")
				.program("10 PRINT 1", "20 PRINT 1 +", "30 GOTO", "40 PRINT 4")
				.expectLines()
				.expectExitCode(Cli.EXIT_LOAD_ERROR)
				.expectErrorContaining("(line 20)")
				.expectErrorContaining("(line 30)")
				.runAndAssert();
	}

	@Test
	public void testInteractiveSession() throws Exception {
		BasicTestSupport
				.cliTest("interactive session")
				.input("20 PRINT \"B\", X", "10 LET X=1", "RUN", "LIST", "PRINT 6*7")
				.expectLines("Ready.", "B1", "10 LET X=1", "20 PRINT \"B\", X", "42")
				.runAndAssert();
	}

	@Test
	public void testInteractiveSessionReportsErrorsAndGoesOn() throws Exception {
		BasicTestSupport
				.cliTest("errors in a session")
				.input("PRINT 1/0", "10 GOTO 50", "RUN", "FOO", "PRINT \"still here\"")
				.expectLines("Ready.", "still here")
				.expectErrorContaining("BasicRuntimeException: Division by zero")
				.expectErrorContaining("BasicRuntimeException (line 10): Undefined line 50")
				.expectErrorContaining("ParserException: Unknown keyword: FOO")
				.runAndAssert();
	}

	@Test
	public void testInteractiveInputSharesStdin() throws Exception {
		BasicTestSupport
				.cliTest("INPUT in a session reads the next line")
				.argument("--no-prompt")
				.input("10 INPUT A", "20 PRINT A+1", "RUN", "41", "PRINT A")
				.expectLines("Ready.", "42", "41")
				.runAndAssert();
	}

	@Test
	public void testInteractiveAfterLoadingFile() throws Exception {
		BasicTestSupport
				.cliTest("-i with a program file does not run it")
				.argument("-i")
				.program("10 PRINT \"loaded\"")
				.input("LIST", "RUN")
				.expectLines("Ready.", "10 PRINT \"loaded\"", "loaded")
				.runAndAssert();
	}

	@Test
	public void testSessionLoadsAndSaves() throws Exception {
		Path source = BasicTestSupport.writeProgram("10 PRINT \"from file\"");
		Path target = BasicTestSupport.sharedTempDirectory().resolve("cli-saved.bas");
		target.toFile().deleteOnExit();
		BasicTestSupport
				.cliTest("LOAD and SAVE")
				.input("LOAD \"" + source + "\"", "20 END", "SAVE " + target, "RUN")
				.expectLines("Ready.", "from file")
				.runAndAssert();
		assertEquals("10 PRINT \"from file\"\n20 END\n", new String(Files.readAllBytes(target), "UTF-8"));
	}

	@Test
	public void testUsage() throws Exception {
		BasicTestSupport.TestResult result = BasicTestSupport.cliTest("usage").argument("-h").run();
		assertEquals(Cli.EXIT_OK, result.exitCode());
		assertTrue(result.output().startsWith("Usage:"));
	}

	@Test
	public void testParseArguments() throws Exception {
		Path file = BasicTestSupport.writeProgram("10 END");
		Cli cli = new Cli();
		cli.parse(new String[] { "-i", "--no-prompt", file.toString() });
		assertTrue(cli.isInteractive());
		assertFalse(cli.isListOnly());
		assertFalse(cli.getSettings().isPromptForInput());
		assertEquals(file.toString(), cli.getProgramFile().getFilePath());
	}

	@Test
	public void testInvalidArguments() throws Exception {
		Path file = BasicTestSupport.writeProgram("10 END");
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-x" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-h", "-i" }));
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-l" }));
		assertThrows(
				IllegalArgumentException.class,
				() -> new Cli().parse(new String[] { file.toString(), file.toString() }));
		assertThrows(
				IllegalArgumentException.class,
				() -> new Cli().parse(new String[] { file.resolveSibling("missing.bas").toString() }));
	}
}
