package org.metricshub.jbasic.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.jbasic.frontend.ast.LexerException;

public class BasicTokenizerTest {

	private static List<Token> tokens(String text) {
		List<Token> result = new ArrayList<Token>();
		for (Lexeme lexeme : BasicTokenizer.tokenize(text, 10)) {
			result.add(lexeme.getToken());
		}
		return result;
	}

	@Test
	public void testEmptyLineIsJustEof() {
		assertEquals(Arrays.asList(Token.EOF), tokens(""));
		assertEquals(Arrays.asList(Token.EOF), tokens("   \t "));
	}

	@Test
	public void testKeywordsAreCaseInsensitive() {
		List<Lexeme> lexemes = BasicTokenizer.tokenize("for i = 1 To 10 sTeP 2", 10);
		assertEquals(Token.KW_FOR, lexemes.get(0).getToken());
		assertEquals(Token.ID, lexemes.get(1).getToken());
		assertEquals("I", lexemes.get(1).getText());
		assertEquals(Token.KW_TO, lexemes.get(4).getToken());
		assertEquals(Token.KW_STEP, lexemes.get(6).getToken());
		assertEquals(Token.EOF, lexemes.get(lexemes.size() - 1).getToken());
	}

	@Test
	public void testOperators() {
		assertEquals(
				Arrays
						.asList(
								Token.ID,
								Token.LE,
								Token.ID,
								Token.NE,
								Token.ID,
								Token.GE,
								Token.INTEGER,
								Token.LT,
								Token.INTEGER,
								Token.GT,
								Token.INTEGER,
								Token.EQ,
								Token.EOF),
				tokens("A<=B<>C>=1<2>3="));
		assertEquals(
				Arrays
						.asList(
								Token.OPEN_PAREN,
								Token.INTEGER,
								Token.PLUS,
								Token.INTEGER,
								Token.CLOSE_PAREN,
								Token.MULT,
								Token.MINUS,
								Token.INTEGER,
								Token.DIVIDE,
								Token.INTEGER,
								Token.COMMA,
								Token.EOF),
				tokens("(1+2)*-3/4,"));
	}

	@Test
	public void testStringKeepsItsContent() {
		List<Lexeme> lexemes = BasicTokenizer.tokenize("PRINT \"Hello, World <>\"", 10);
		assertEquals(Token.STRING, lexemes.get(1).getToken());
		assertEquals("Hello, World <>", lexemes.get(1).getText());
		assertEquals(7, lexemes.get(1).getColumn());
	}

	@Test
	public void testRemSwallowsTheRestOfTheLine() {
		List<Lexeme> lexemes = BasicTokenizer.tokenize("REM   this is #not$ code  ", 10);
		assertEquals(3, lexemes.size());
		assertEquals(Token.KW_REM, lexemes.get(0).getToken());
		assertEquals(Token.COMMENT, lexemes.get(1).getToken());
		assertEquals("this is #not$ code", lexemes.get(1).getText());
		assertEquals(Token.EOF, lexemes.get(2).getToken());
	}

	@Test
	public void testLongWordIsNotAVariable() {
		List<Lexeme> lexemes = BasicTokenizer.tokenize("PRINTX", 10);
		assertEquals(Token.WORD, lexemes.get(0).getToken());
		assertEquals("PRINTX", lexemes.get(0).getText());
	}

	@Test
	public void testInvalidCharacter() {
		LexerException e = assertThrows(LexerException.class, () -> BasicTokenizer.tokenize("PRINT 1 # 2", 40));
		assertEquals(40, e.getLineNumber());
		assertEquals(9, e.getColumn());
		assertTrue(e.getMessage(), e.getMessage().contains("'#'"));
	}

	@Test
	public void testUnterminatedString() {
		LexerException e = assertThrows(LexerException.class, () -> BasicTokenizer.tokenize("PRINT \"oops", 5));
		assertEquals(7, e.getColumn());
		assertTrue(e.getMessage(), e.getMessage().startsWith("Unterminated string"));
	}

	@Test
	public void testIsKeyword() {
		assertTrue(BasicTokenizer.isKeyword("gosub"));
		assertTrue(BasicTokenizer.isKeyword("CLEAR"));
		assertFalse(BasicTokenizer.isKeyword("LOAD"));
		assertFalse(BasicTokenizer.isKeyword("A"));
	}
}
