package org.metricshub.jbasic.frontend;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.metricshub.jbasic.frontend.ast.LexerException;

/**
 * Converts the body of one BASIC line (without its line number) into a
 * list of {@link Lexeme}s, always terminated by {@link Token#EOF}.
 * <p>
 * Keywords and variable names are case-insensitive and are reported
 * upper-cased. The text following <code>REM</code> is returned verbatim as
 * a single {@link Token#COMMENT}, whatever characters it contains.
 * <p>
 * No state is carried from one line to the next.
 */
public final class BasicTokenizer {

	/**
	 * Contains a mapping of BASIC keywords to their token values.
	 * Keys are upper-case.
	 */
	private static final Map<String, Token> KEYWORDS = new HashMap<String, Token>();

	static {
		KEYWORDS.put("REM", Token.KW_REM);
		KEYWORDS.put("PRINT", Token.KW_PRINT);
		KEYWORDS.put("LET", Token.KW_LET);
		KEYWORDS.put("IF", Token.KW_IF);
		KEYWORDS.put("THEN", Token.KW_THEN);
		KEYWORDS.put("GOTO", Token.KW_GOTO);
		KEYWORDS.put("GOSUB", Token.KW_GOSUB);
		KEYWORDS.put("RETURN", Token.KW_RETURN);
		KEYWORDS.put("INPUT", Token.KW_INPUT);
		KEYWORDS.put("FOR", Token.KW_FOR);
		KEYWORDS.put("TO", Token.KW_TO);
		KEYWORDS.put("STEP", Token.KW_STEP);
		KEYWORDS.put("NEXT", Token.KW_NEXT);
		KEYWORDS.put("END", Token.KW_END);
		KEYWORDS.put("LIST", Token.KW_LIST);
		KEYWORDS.put("RUN", Token.KW_RUN);
		KEYWORDS.put("CLEAR", Token.KW_CLEAR);
	}

	private final String source;
	private final int lineNumber;
	private int index;
	private int c;
	private final StringBuilder text = new StringBuilder();

	private BasicTokenizer(String source, int lineNumber) {
		this.source = source;
		this.lineNumber = lineNumber;
		this.index = 0;
		this.c = source.isEmpty() ? -1 : source.charAt(0);
	}

	/**
	 * Tokenizes one statement body.
	 *
	 * @param source the statement text, without a line number
	 * @param lineNumber line number used in error reports, {@code -1} if none
	 * @return the tokens read, the last one being {@link Token#EOF}
	 * @throws LexerException on an invalid character or an unterminated string
	 */
	public static List<Lexeme> tokenize(String source, int lineNumber) {
		if (source == null) {
			throw new IllegalArgumentException("source must not be null");
		}
		return new BasicTokenizer(source, lineNumber).tokenizeAll();
	}

	/**
	 * Checks whether the specified word is a BASIC keyword.
	 *
	 * @param word the word to check, in any case
	 * @return {@code true} if it is a reserved word
	 */
	public static boolean isKeyword(String word) {
		return KEYWORDS.containsKey(word.toUpperCase(Locale.ROOT));
	}

	private List<Lexeme> tokenizeAll() {
		List<Lexeme> lexemes = new ArrayList<Lexeme>();
		Lexeme lexeme;
		do {
			lexeme = lexer();
			lexemes.add(lexeme);
			if (lexeme.getToken() == Token.KW_REM) {
				// the rest of the line is commentary
				String comment = source.substring(Math.min(index, source.length())).trim();
				lexemes.add(new Lexeme(Token.COMMENT, comment, index + 1));
				lexemes.add(new Lexeme(Token.EOF, "", source.length() + 1));
				break;
			}
		} while (lexeme.getToken() != Token.EOF);
		return Collections.unmodifiableList(lexemes);
	}

	/** Appends the current character to the token text and moves on. */
	private void read() {
		text.append((char) c);
		skip();
	}

	/** Moves to the next character without recording the current one. */
	private void skip() {
		index++;
		c = index < source.length() ? source.charAt(index) : -1;
	}

	private LexerException lexerException(String msg, int column) {
		return new LexerException(msg, lineNumber, column);
	}

	private Lexeme lexeme(Token token, int column) {
		return new Lexeme(token, text.toString(), column);
	}

	private Lexeme lexer() {
		// clear whitespace
		while (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
			skip();
		}
		text.setLength(0);
		int column = index + 1;
		if (c < 0) {
			return lexeme(Token.EOF, column);
		}
		switch (c) {
		case '+':
			read();
			return lexeme(Token.PLUS, column);
		case '-':
			read();
			return lexeme(Token.MINUS, column);
		case '*':
			read();
			return lexeme(Token.MULT, column);
		case '/':
			read();
			return lexeme(Token.DIVIDE, column);
		case '(':
			read();
			return lexeme(Token.OPEN_PAREN, column);
		case ')':
			read();
			return lexeme(Token.CLOSE_PAREN, column);
		case ',':
			read();
			return lexeme(Token.COMMA, column);
		case '=':
			read();
			return lexeme(Token.EQ, column);
		case '<':
			read();
			if (c == '=') {
				read();
				return lexeme(Token.LE, column);
			} else if (c == '>') {
				read();
				return lexeme(Token.NE, column);
			}
			return lexeme(Token.LT, column);
		case '>':
			read();
			if (c == '=') {
				read();
				return lexeme(Token.GE, column);
			}
			return lexeme(Token.GT, column);
		case '"':
			skip();
			while (c >= 0 && c != '"') {
				read();
			}
			if (c < 0) {
				throw lexerException("Unterminated string", column);
			}
			skip();
			return lexeme(Token.STRING, column);
		default:
			break;
		}

		if (isDigit(c)) {
			while (isDigit(c)) {
				read();
			}
			return lexeme(Token.INTEGER, column);
		}

		if (isLetter(c)) {
			while (isLetter(c)) {
				read();
			}
			String word = text.toString().toUpperCase(Locale.ROOT);
			Token kwToken = KEYWORDS.get(word);
			if (kwToken != null) {
				return new Lexeme(kwToken, word, column);
			}
			return new Lexeme(word.length() == 1 ? Token.ID : Token.WORD, word, column);
		}

		throw lexerException("Invalid character '" + ((char) c) + "'", column);
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}

	private static boolean isLetter(int ch) {
		return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
	}
}
