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

/**
 * Lexer token values produced by {@link BasicTokenizer}.
 * <p>
 * Keyword tokens are prefixed with <code>KW_</code>, the same way the
 * keyword map of the tokenizer names them.
 */
public enum Token {
	EOF,
	INTEGER,
	STRING,
	/** A single letter, i.e. a variable name. */
	ID,
	/** Any other alphabetic run. Never valid, reported by the parser. */
	WORD,
	/** The raw remainder of a line following <code>REM</code>. */
	COMMENT,

	PLUS,
	MINUS,
	MULT,
	DIVIDE,

	EQ,
	NE,
	LT,
	LE,
	GT,
	GE,

	OPEN_PAREN,
	CLOSE_PAREN,
	COMMA,

	KW_REM,
	KW_PRINT,
	KW_LET,
	KW_IF,
	KW_THEN,
	KW_GOTO,
	KW_GOSUB,
	KW_RETURN,
	KW_INPUT,
	KW_FOR,
	KW_TO,
	KW_STEP,
	KW_NEXT,
	KW_END,
	KW_LIST,
	KW_RUN,
	KW_CLEAR
}
