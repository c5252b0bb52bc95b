package org.metricshub.jbasic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.jbasic.backend.ExecutionResult;
import org.metricshub.jbasic.frontend.ProgramLoadException;
import org.metricshub.jbasic.frontend.ast.ParserException;
import org.metricshub.jbasic.jrt.BasicRuntimeException;
import org.metricshub.jbasic.jrt.RuntimeError;
import org.metricshub.jbasic.util.BasicSettings;

public class BasicTest {

	private final ByteArrayOutputStream out = new ByteArrayOutputStream();

	private Basic session(String input) throws Exception {
		BasicSettings settings = new BasicSettings();
		settings.setInput(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
		settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		settings.setPromptForInput(false);
		return new Basic(settings);
	}

	private List<String> outputLines() throws Exception {
		return BasicTestSupport.normalizeOutputLines(out.toString(StandardCharsets.UTF_8.name()));
	}

	@Test
	public void testPrintWithTrailingComma() throws Exception {
		BasicTestSupport
				.basicTest("PRINT with a trailing comma")
				.program("10 LET A=4", "20 PRINT \"A=\", A,", "30 END")
				.expectLines("A=4")
				.runAndAssert();
	}

	@Test
	public void testLetPrintEnd() throws Exception {
		BasicTestSupport
				.basicTest("LET, PRINT, END")
				.program("10 LET A=5", "20 PRINT A*2", "30 END")
				.expectLines("10")
				.runAndAssert();
	}

	@Test
	public void testCountUp() throws Exception {
		BasicTestSupport
				.basicTest("FOR 1 TO 3")
				.program("10 FOR I=1 TO 3", "20 PRINT I", "30 NEXT I", "40 END")
				.expectLines("1", "2", "3")
				.runAndAssert();
	}

	@Test
	public void testCountDown() throws Exception {
		BasicTestSupport
				.basicTest("FOR 5 TO 1 STEP -1")
				.program("10 FOR I=5 TO 1 STEP -1", "20 PRINT I", "30 NEXT I", "40 END")
				.expectLines("5", "4", "3", "2", "1")
				.runAndAssert();
	}

	@Test
	public void testDivisionByZero() throws Exception {
		BasicTestSupport
				.basicTest("division by zero")
				.program("10 PRINT \"before\"", "20 LET A=10/(B-B)", "30 PRINT \"after\"")
				.expectLines("before")
				.expectAbort(20, RuntimeError.DIVISION_BY_ZERO)
				.runAndAssert();
	}

	@Test
	public void testGotoUndefinedLine() throws Exception {
		BasicTestSupport
				.basicTest("GOTO nowhere")
				.program("10 GOTO 15", "20 PRINT \"never\"")
				.expectLines()
				.expectAbort(10, RuntimeError.UNDEFINED_LINE)
				.runAndAssert();
	}

	@Test
	public void testInputWithPrompt() throws Exception {
		BasicTestSupport
				.basicTest("INPUT prompts again on bad entry")
				.program("10 INPUT A", "20 PRINT \"twice \", A*2")
				.input("abc", "21")
				.withPrompt()
				.expectLines("? ? twice 42")
				.runAndAssert();
	}

	@Test
	public void testFibonacci() throws Exception {
		BasicTestSupport
				.basicTest("Fibonacci numbers below 100")
				.program(
						"10 REM Fibonacci",
						"20 LET A=0",
						"30 LET B=1",
						"40 IF A>100 THEN 90",
						"50 PRINT A",
						"60 LET C=A+B",
						"70 A=B",
						"80 B=C",
						"85 GOTO 40",
						"90 END")
				.expectLines("0", "1", "1", "2", "3", "5", "8", "13", "21", "34", "55", "89")
				.runAndAssert();
	}

	@Test
	public void testSubroutineWithLoop() throws Exception {
		BasicTestSupport
				.basicTest("squares through GOSUB")
				.program(
						"10 INPUT N",
						"20 FOR I=1 TO N",
						"30 GOSUB 100",
						"40 NEXT I",
						"50 END",
						"100 PRINT I, \"^2=\", I*I",
						"110 RETURN")
				.input("3")
				.expectLines("1^2=1", "2^2=4", "3^2=9")
				.runAndAssert();
	}

	@Test
	public void testEnterLineEditsTheProgram() throws Exception {
		Basic basic = session("");
		basic.enterLine("20 PRINT \"B\"");
		basic.enterLine("10 PRINT \"A\"");
		basic.enterLine("30 PRINT \"C\"");
		basic.enterLine("20 print \"b\"");
		basic.enterLine("30");
		basic.enterLine("   ");
		assertEquals(2, basic.getProgram().size());
		assertTrue(basic.enterLine("LIST").isCompleted());
		assertTrue(basic.enterLine("RUN").isCompleted());
		assertEquals(Arrays.asList("10 PRINT \"A\"", "20 PRINT \"b\"", "A", "b"), outputLines());
	}

	@Test
	public void testDeletingAMissingLineIsHarmless() throws Exception {
		Basic basic = session("");
		basic.enterLine("50");
		assertTrue(basic.getProgram().isEmpty());
	}

	@Test
	public void testImmediateExecutionBypassesTheProgram() throws Exception {
		Basic basic = session("");
		basic.enterLine("LET X=7");
		basic.enterLine("PRINT X*6");
		assertTrue(basic.getProgram().isEmpty());
		assertEquals(Arrays.asList("42"), outputLines());
	}

	@Test
	public void testImmediateErrorIsReportedWithoutLine() throws Exception {
		Basic basic = session("");
		ExecutionResult result = basic.enterLine("PRINT 1/0");
		assertTrue(result.isAborted());
		assertEquals(-1, result.getLineNumber());
		assertEquals(RuntimeError.DIVISION_BY_ZERO, result.getError().getError());
	}

	@Test
	public void testSyntaxErrorOnEntry() throws Exception {
		Basic basic = session("");
		ParserException e = assertThrows(ParserException.class, () -> basic.enterLine("10 PRINT 1 +"));
		assertEquals(10, e.getLineNumber());
		assertTrue(basic.getProgram().isEmpty());
		assertThrows(ParserException.class, () -> basic.enterLine("FROB"));
	}

	@Test
	public void testInputInSessionSharesTheInput() throws Exception {
		Basic basic = session("12\n");
		basic.enterLine("INPUT A");
		basic.enterLine("PRINT A");
		assertEquals(Arrays.asList("12"), outputLines());
		assertEquals(null, basic.getInputSource().readLine());
	}

	@Test
	public void testSaveAndLoad() throws Exception {
		Path file = BasicTestSupport.sharedTempDirectory().resolve("save-and-load.bas");
		file.toFile().deleteOnExit();
		Basic basic = session("");
		basic.enterLine("10 FOR I=1 TO 2");
		basic.enterLine("20 PRINT I");
		basic.enterLine("30 NEXT I");
		basic.enterLine("SAVE \"" + file + "\"");
		assertEquals(
				Arrays.asList("10 FOR I=1 TO 2", "20 PRINT I", "30 NEXT I"),
				Files.readAllLines(file, StandardCharsets.UTF_8));

		Basic other = session("");
		other.enterLine("99 PRINT \"gone\"");
		other.enterLine("load " + file);
		assertFalse(other.getProgram().contains(99));
		assertTrue(other.enterLine("RUN").isCompleted());
		assertEquals(Arrays.asList("1", "2"), outputLines());
	}

	@Test
	public void testLoadWithFailuresKeepsTheGoodLines() throws Exception {
		Path file = BasicTestSupport.writeProgram("10 PRINT 1", "20 PRINT (", "30 PRINT 3");
		Basic basic = session("");
		ProgramLoadException e = assertThrows(ProgramLoadException.class, () -> basic.enterLine("LOAD " + file));
		assertEquals(1, e.getFailures().size());
		assertEquals(20, e.getLineNumber());
		assertEquals(2, basic.getProgram().size());
	}

	@Test
	public void testSaveToWriter() throws Exception {
		Basic basic = session("");
		basic.enterLine("20 end");
		basic.enterLine("10 rem start");
		StringWriter writer = new StringWriter();
		basic.save(writer);
		assertEquals("10 REM start\n20 END\n", writer.toString());
	}

	@Test
	public void testRunStringProgram() throws Exception {
		assertEquals("5" + System.lineSeparator(), Basic.run("10 INPUT A\n20 PRINT A\n", "5\n"));
	}

	@Test
	public void testRunStringProgramAborts() throws Exception {
		BasicRuntimeException e = assertThrows(BasicRuntimeException.class, () -> Basic.run("10 RETURN", ""));
		assertEquals(RuntimeError.RETURN_WITHOUT_GOSUB, e.getError());
		assertEquals(10, e.getLineNumber());
	}

	@Test
	public void testRunStringProgramWithSyntaxError() throws Exception {
		ProgramLoadException e = assertThrows(ProgramLoadException.class, () -> Basic.run("10 PRINT\n20 LET = 4\n", ""));
		assertEquals(20, e.getLineNumber());
	}
}
