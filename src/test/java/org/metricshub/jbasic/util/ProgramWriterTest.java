package org.metricshub.jbasic.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import java.io.StringReader;
import java.io.StringWriter;
import org.junit.Test;
import org.metricshub.jbasic.frontend.LoadResult;
import org.metricshub.jbasic.frontend.ProgramLoader;
import org.metricshub.jbasic.intermediate.ProgramLine;
import org.metricshub.jbasic.intermediate.ProgramStore;

public class ProgramWriterTest {

	private static final String PROGRAM = String
			.join(
					"\n",
					"100 rem   print squares",
					"110 input n",
					"120 for i = 1 to n",
					"130   gosub 500",
					"140 next",
					"150 if n<0 then 110",
					"160 end",
					"500 print \"Square of \", i, \": \", i*i",
					"510 return");

	private static ProgramStore load(String text) throws Exception {
		LoadResult result = new ProgramLoader().load(new StringReader(text));
		assertFalse(result.getFailures().toString(), result.hasFailures());
		return result.getProgram();
	}

	@Test
	public void testWriteCanonicalForm() throws Exception {
		StringWriter out = new StringWriter();
		ProgramWriter.write(load(PROGRAM), out);
		assertEquals(
				"100 REM print squares\n"
						+ "110 INPUT N\n"
						+ "120 FOR I=1 TO N\n"
						+ "130 GOSUB 500\n"
						+ "140 NEXT\n"
						+ "150 IF N<0 THEN GOTO 110\n"
						+ "160 END\n"
						+ "500 PRINT \"Square of \", I, \": \", I*I\n"
						+ "510 RETURN\n",
				out.toString());
	}

	@Test
	public void testLoadOfSaveIsTheSameProgram() throws Exception {
		ProgramStore original = load(PROGRAM);
		ProgramStore reloaded = load(ProgramWriter.toText(original));
		assertEquals(original.size(), reloaded.size());
		for (ProgramLine line : original) {
			assertEquals(line.getStatement().toString(), reloaded.get(line.getLineNumber()).toString());
		}
		assertEquals(ProgramWriter.toText(original), ProgramWriter.toText(reloaded));
	}

	@Test
	public void testEmptyProgram() {
		assertEquals("", ProgramWriter.toText(new ProgramStore()));
	}
}
