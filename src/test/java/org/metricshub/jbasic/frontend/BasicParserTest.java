package org.metricshub.jbasic.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.jbasic.frontend.ast.BinaryOp;
import org.metricshub.jbasic.frontend.ast.Expression;
import org.metricshub.jbasic.frontend.ast.ForStatement;
import org.metricshub.jbasic.frontend.ast.GotoStatement;
import org.metricshub.jbasic.frontend.ast.IfStatement;
import org.metricshub.jbasic.frontend.ast.LetStatement;
import org.metricshub.jbasic.frontend.ast.LexerException;
import org.metricshub.jbasic.frontend.ast.NextStatement;
import org.metricshub.jbasic.frontend.ast.Operator;
import org.metricshub.jbasic.frontend.ast.ParserException;
import org.metricshub.jbasic.frontend.ast.PrintStatement;
import org.metricshub.jbasic.frontend.ast.RemStatement;
import org.metricshub.jbasic.frontend.ast.Statement;
import org.metricshub.jbasic.frontend.ast.StringLiteral;
import org.metricshub.jbasic.frontend.ast.UnaryOp;

public class BasicParserTest {

	private final BasicParser parser = new BasicParser();

	private Statement parse(String body) {
		return parser.parseStatement(body, 10);
	}

	private ParserException parseError(String body) {
		return assertThrows(ParserException.class, () -> parser.parseStatement(body, 70));
	}

	@Test
	public void testParseLineSplitsTheLineNumber() {
		ParsedLine line = parser.parseLine("  120 print a ");
		assertTrue(line.isNumbered());
		assertEquals(120, line.getLineNumber());
		assertEquals("PRINT A", line.getStatement().toString());
		assertEquals("120 PRINT A", line.toString());
	}

	@Test
	public void testParseLineWithoutNumber() {
		ParsedLine line = parser.parseLine("LIST");
		assertFalse(line.isNumbered());
		assertEquals(-1, line.getLineNumber());
		assertEquals("LIST", line.getStatement().toString());
	}

	@Test
	public void testLineNumberAloneHasNoStatement() {
		ParsedLine line = parser.parseLine("30");
		assertTrue(line.isNumbered());
		assertTrue(line.isEmpty());
		assertNull(line.getStatement());
	}

	@Test
	public void testLineNumberMustBePositive() {
		assertThrows(ParserException.class, () -> parser.parseLine("0 PRINT 1"));
		assertThrows(ParserException.class, () -> parser.parseLine("99999999999 PRINT 1"));
	}

	@Test
	public void testLineNumberDigitsAreAscii() {
		// Arabic-Indic "10" is not a line number
		assertThrows(LexerException.class, () -> parser.parseLine("\u0661\u0660 PRINT 1"));
	}

	@Test
	public void testErrorCarriesTheLineNumber() {
		ParserException e = assertThrows(ParserException.class, () -> parser.parseLine("40 PRINT (1"));
		assertEquals(40, e.getLineNumber());
	}

	@Test
	public void testPrintItems() {
		PrintStatement print = (PrintStatement) parse("PRINT \"A=\", A, 2*(B+1)");
		assertEquals(3, print.getItems().size());
		assertTrue(print.getItems().get(0) instanceof StringLiteral);
		assertEquals("PRINT \"A=\", A, 2*(B+1)", print.toString());
	}

	@Test
	public void testTrailingCommaEndsPrintList() {
		PrintStatement print = (PrintStatement) parse("PRINT 1, \"X\",");
		assertEquals(2, print.getItems().size());
		assertEquals("PRINT 1, \"X\"", print.toString());
		parseError("PRINT 1,,");
	}

	@Test
	public void testBarePrint() {
		PrintStatement print = (PrintStatement) parse("PRINT");
		assertTrue(print.getItems().isEmpty());
	}

	@Test
	public void testImplicitLet() {
		LetStatement let = (LetStatement) parse("x = 5");
		assertEquals('X', let.getVariable());
		assertEquals("LET X=5", let.toString());
	}

	@Test
	public void testPrecedence() {
		assertEquals("1+2*3", parser.parseExpression("1 + 2 * 3").toString());
		assertEquals("(1+2)*3", parser.parseExpression("(1 + 2) * 3").toString());
		assertEquals("1-(2-3)", parser.parseExpression("1-(2-3)").toString());
		assertEquals("1-2-3", parser.parseExpression("(1-2)-3").toString());
		assertEquals("-A*B", parser.parseExpression("-A*B").toString());
		assertEquals("-(A*B)", parser.parseExpression("-(A*B)").toString());
		assertEquals("2--3", parser.parseExpression("2 - -3").toString());
	}

	@Test
	public void testUnaryMinusBindsTightest() {
		Expression e = parser.parseExpression("-2*3");
		BinaryOp multiply = (BinaryOp) e;
		assertEquals(Operator.MULTIPLY, multiply.getOperator());
		assertTrue(multiply.getLeft() instanceof UnaryOp);
	}

	@Test
	public void testIfWithNestedStatement() {
		IfStatement statement = (IfStatement) parse("IF X=1 THEN GOTO 100");
		assertEquals(Operator.EQ, statement.getCondition().getOperator());
		assertTrue(statement.getConsequent() instanceof GotoStatement);
		assertEquals("IF X=1 THEN GOTO 100", statement.toString());

		IfStatement nested = (IfStatement) parse("if a < b then if b <> 0 then print a / b");
		assertEquals("IF A<B THEN IF B<>0 THEN PRINT A/B", nested.toString());
	}

	@Test
	public void testIfThenLineNumberIsGoto() {
		IfStatement statement = (IfStatement) parse("IF A >= 10 THEN 200");
		assertEquals("IF A>=10 THEN GOTO 200", statement.toString());
	}

	@Test
	public void testRelationalOperatorOnlyInIf() {
		parseError("LET A = 1 < 2");
		parseError("PRINT A = B");
		parseError("IF A THEN END");
	}

	@Test
	public void testFor() {
		ForStatement statement = (ForStatement) parse("FOR I = 10 TO 1 STEP -1");
		assertEquals('I', statement.getVariable());
		assertEquals("-1", statement.getStep().toString());
		assertEquals("FOR I=10 TO 1 STEP -1", statement.toString());
		assertNull(((ForStatement) parse("FOR J=1 TO N")).getStep());
	}

	@Test
	public void testNext() {
		assertEquals(Character.valueOf('I'), ((NextStatement) parse("NEXT I")).getVariable());
		assertNull(((NextStatement) parse("NEXT")).getVariable());
	}

	@Test
	public void testInputList() {
		assertEquals("INPUT A, B, C", parse("input a,b , c").toString());
		parseError("INPUT");
		parseError("INPUT A,");
	}

	@Test
	public void testRem() {
		RemStatement rem = (RemStatement) parse("REM 10 GOTO \"nowhere");
		assertEquals("10 GOTO \"nowhere", rem.getComment());
		assertEquals("REM", parse("REM").toString());
	}

	@Test
	public void testStatementsWithoutArguments() {
		assertEquals("RETURN", parse("return").toString());
		assertEquals("END", parse("End").toString());
		assertEquals("LIST", parse("LIST").toString());
		assertEquals("RUN", parse("RUN").toString());
		assertEquals("CLEAR", parse("CLEAR").toString());
	}

	@Test
	public void testUnknownKeyword() {
		ParserException e = parseError("PRIN 5");
		assertEquals(70, e.getLineNumber());
		assertTrue(e.getMessage(), e.getMessage().startsWith("Unknown keyword"));
	}

	@Test
	public void testMissingOperator() {
		assertTrue(parseError("PRINT 1 2").getMessage().startsWith("Missing operator"));
		assertTrue(parseError("LET A = B C").getMessage().startsWith("Missing operator"));
	}

	@Test
	public void testMalformedOperand() {
		assertTrue(parseError("PRINT 1 +").getMessage().startsWith("Malformed operand"));
		assertTrue(parseError("LET A = *2").getMessage().startsWith("Malformed operand"));
		assertTrue(parseError("GOTO \"ten\"").getMessage().startsWith("Malformed operand"));
	}

	@Test
	public void testUnbalancedParenthesis() {
		assertTrue(parseError("PRINT (1+2").getMessage().startsWith("Unbalanced parenthesis"));
		assertTrue(parseError("PRINT 1+2)").getMessage().startsWith("Unbalanced parenthesis"));
	}

	@Test
	public void testIntegerOutOfRange() {
		assertTrue(parseError("PRINT 2147483648").getMessage().startsWith("Integer out of range"));
		assertEquals("2147483647", parser.parseExpression("2147483647").toString());
	}

	@Test
	public void testLexicalErrorIsAParserException() {
		ParserException e = parseError("PRINT 1 ; 2");
		assertTrue(e instanceof LexerException);
		assertEquals(70, e.getLineNumber());
	}

	@Test
	public void testRenderingParsesBackToTheSameText() {
		String[] sources = {
				"PRINT \"X\", -(A+B)*C, A/(B/C)",
				"IF A+1<>B*2 THEN GOSUB 300",
				"FOR K=-A TO B-1 STEP (C-D)/2",
				"LET Z=--Z" };
		for (String source : sources) {
			String rendered = parse(source).toString();
			assertEquals(rendered, parse(rendered).toString());
		}
	}
}
