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
 * One token read from a source line, with the text it was read from.
 */
public final class Lexeme {

	private final Token token;
	private final String text;
	private final int column;

	/**
	 * @param token the token value
	 * @param text the source text of the token (upper-cased for keywords and
	 *        variable names, unquoted for strings)
	 * @param column 1-based column where the token starts
	 */
	public Lexeme(Token token, String text, int column) {
		this.token = token;
		this.text = text;
		this.column = column;
	}

	public Token getToken() {
		return token;
	}

	public String getText() {
		return text;
	}

	public int getColumn() {
		return column;
	}

	@Override
	public String toString() {
		return token.name() + "(" + text + ")";
	}
}
