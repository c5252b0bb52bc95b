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
import java.util.List;
import org.metricshub.jbasic.frontend.ast.BinaryOp;
import org.metricshub.jbasic.frontend.ast.ClearStatement;
import org.metricshub.jbasic.frontend.ast.EndStatement;
import org.metricshub.jbasic.frontend.ast.Expression;
import org.metricshub.jbasic.frontend.ast.ForStatement;
import org.metricshub.jbasic.frontend.ast.GosubStatement;
import org.metricshub.jbasic.frontend.ast.GotoStatement;
import org.metricshub.jbasic.frontend.ast.IfStatement;
import org.metricshub.jbasic.frontend.ast.InputStatement;
import org.metricshub.jbasic.frontend.ast.IntLiteral;
import org.metricshub.jbasic.frontend.ast.LetStatement;
import org.metricshub.jbasic.frontend.ast.ListStatement;
import org.metricshub.jbasic.frontend.ast.NextStatement;
import org.metricshub.jbasic.frontend.ast.Operator;
import org.metricshub.jbasic.frontend.ast.ParserException;
import org.metricshub.jbasic.frontend.ast.PrintStatement;
import org.metricshub.jbasic.frontend.ast.RemStatement;
import org.metricshub.jbasic.frontend.ast.ReturnStatement;
import org.metricshub.jbasic.frontend.ast.RunStatement;
import org.metricshub.jbasic.frontend.ast.Statement;
import org.metricshub.jbasic.frontend.ast.StringLiteral;
import org.metricshub.jbasic.frontend.ast.UnaryOp;
import org.metricshub.jbasic.frontend.ast.VariableRef;

/**
 * Recursive descent parser for one BASIC line.
 * <p>
 * The grammar methods are named after the production they recognize and
 * document it in a comment, in the lex/yacc tradition. Each consumes the
 * tokens of its production and leaves {@link #token} on the first token
 * that follows.
 * <p>
 * A parser instance keeps the state of the line being parsed and is
 * therefore not thread-safe; it may be reused for any number of lines.
 */
public class BasicParser {

	private List<Lexeme> lexemes;
	private int position;
	private Lexeme lexeme;
	private Token token;
	private int lineNumber;

	/**
	 * Parses a line as typed by the user or stored in a program file: an
	 * optional line number followed by a statement body.
	 *
	 * @param sourceLine the line
	 * @return the parsed line; its statement is {@code null} when the body is
	 *         empty
	 * @throws ParserException if the line number or the statement is malformed
	 */
	public ParsedLine parseLine(String sourceLine) {
		String line = sourceLine.trim();
		int digits = 0;
		while (digits < line.length() && isAsciiDigit(line.charAt(digits))) {
			digits++;
		}
		if (digits == 0) {
			if (line.isEmpty()) {
				return new ParsedLine(ParserException.NO_LINE, null);
			}
			return new ParsedLine(ParserException.NO_LINE, parseStatement(line, ParserException.NO_LINE));
		}
		int number;
		try {
			number = Integer.parseInt(line.substring(0, digits));
		} catch (NumberFormatException e) {
			throw new ParserException("Line number out of range: " + line.substring(0, digits), ParserException.NO_LINE);
		}
		if (number <= 0) {
			throw new ParserException("Line number must be positive", number);
		}
		String body = line.substring(digits).trim();
		if (body.isEmpty()) {
			return new ParsedLine(number, null);
		}
		return new ParsedLine(number, parseStatement(body, number));
	}

	/**
	 * Parses a statement body (no line number).
	 *
	 * @param body the statement text
	 * @param line the line number to report in errors, {@code -1} if none
	 * @return the statement
	 * @throws ParserException if the statement is malformed
	 */
	public Statement parseStatement(String body, int line) {
		start(body, line);
		Statement statement = STATEMENT();
		endOfLine();
		return statement;
	}

	/**
	 * Parses a standalone arithmetic expression.
	 *
	 * @param expression the expression text
	 * @return the expression tree
	 * @throws ParserException if the expression is malformed
	 */
	public Expression parseExpression(String expression) {
		start(expression, ParserException.NO_LINE);
		Expression result = EXPRESSION();
		endOfLine();
		return result;
	}

	private static boolean isAsciiDigit(char ch) {
		return ch >= '0' && ch <= '9';
	}

	private void start(String text, int line) {
		this.lineNumber = line;
		this.lexemes = BasicTokenizer.tokenize(text, line);
		this.position = 0;
		this.lexeme = lexemes.get(0);
		this.token = lexeme.getToken();
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, lineNumber);
	}

	private Token lexer() {
		if (position < lexemes.size() - 1) {
			position++;
		}
		lexeme = lexemes.get(position);
		token = lexeme.getToken();
		return token;
	}

	private Token lexer(Token expectedToken) {
		if (token != expectedToken) {
			throw parserException("Expecting " + describe(expectedToken) + ". Found: " + describeCurrent());
		}
		return lexer();
	}

	private String describeCurrent() {
		return token == Token.EOF ? "end of line" : "'" + lexeme.getText() + "'";
	}

	private static String describe(Token expected) {
		switch (expected) {
		case EQ:
			return "'='";
		case CLOSE_PAREN:
			return "')'";
		case ID:
			return "a variable name";
		default:
			return expected.name().startsWith("KW_") ? expected.name().substring(3) : expected.name();
		}
	}

	/** Reports whatever is left after a complete statement. */
	private void endOfLine() {
		switch (token) {
		case EOF:
			return;
		case CLOSE_PAREN:
			throw parserException("Unbalanced parenthesis: unexpected ')'");
		case INTEGER:
		case ID:
		case OPEN_PAREN:
			throw parserException("Missing operator before " + describeCurrent());
		default:
			throw parserException("Unexpected " + describeCurrent());
		}
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// STATEMENT : REM | PRINT | [LET] assignment | IF | GOTO | GOSUB | RETURN
	// | INPUT | FOR | NEXT | END | LIST | RUN | CLEAR
	Statement STATEMENT() {
		switch (token) {
		case KW_REM: {
			lexer();
			String comment = "";
			if (token == Token.COMMENT) {
				comment = lexeme.getText();
				lexer();
			}
			return new RemStatement(comment);
		}
		case KW_PRINT:
			lexer();
			return PRINT_LIST();
		case KW_LET:
			lexer();
			return ASSIGNMENT();
		case ID:
			return ASSIGNMENT();
		case KW_IF:
			lexer();
			return IF_STATEMENT();
		case KW_GOTO:
			lexer();
			return new GotoStatement(EXPRESSION());
		case KW_GOSUB:
			lexer();
			return new GosubStatement(EXPRESSION());
		case KW_RETURN:
			lexer();
			return new ReturnStatement();
		case KW_INPUT:
			lexer();
			return INPUT_LIST();
		case KW_FOR:
			lexer();
			return FOR_STATEMENT();
		case KW_NEXT: {
			lexer();
			Character variable = null;
			if (token == Token.ID) {
				variable = Character.valueOf(VARIABLE());
			}
			return new NextStatement(variable);
		}
		case KW_END:
			lexer();
			return new EndStatement();
		case KW_LIST:
			lexer();
			return new ListStatement();
		case KW_RUN:
			lexer();
			return new RunStatement();
		case KW_CLEAR:
			lexer();
			return new ClearStatement();
		case WORD:
			throw parserException("Unknown keyword: " + lexeme.getText());
		case EOF:
			throw parserException("Empty statement");
		default:
			throw parserException("Expecting a statement keyword. Found: " + describeCurrent());
		}
	}

	// PRINT_LIST : [ PRINT_ITEM { , PRINT_ITEM } [ , ] ]
	Statement PRINT_LIST() {
		List<Expression> items = new ArrayList<Expression>();
		if (token != Token.EOF) {
			items.add(PRINT_ITEM());
			while (token == Token.COMMA) {
				lexer();
				if (token == Token.EOF) {
					// trailing comma ends the list
					break;
				}
				items.add(PRINT_ITEM());
			}
		}
		return new PrintStatement(items);
	}

	// PRINT_ITEM : STRING | EXPRESSION
	Expression PRINT_ITEM() {
		if (token == Token.STRING) {
			String value = lexeme.getText();
			lexer();
			return new StringLiteral(value);
		}
		return EXPRESSION();
	}

	// ASSIGNMENT : ID = EXPRESSION
	Statement ASSIGNMENT() {
		char variable = VARIABLE();
		lexer(Token.EQ);
		return new LetStatement(variable, EXPRESSION());
	}

	// IF_STATEMENT : EXPRESSION RELOP EXPRESSION THEN ( INTEGER | STATEMENT )
	Statement IF_STATEMENT() {
		Expression left = EXPRESSION();
		Operator relop = RELOP();
		Expression right = EXPRESSION();
		lexer(Token.KW_THEN);
		Statement consequent;
		if (token == Token.INTEGER && lexemes.get(position + 1).getToken() == Token.EOF) {
			// IF ... THEN 100 is short for IF ... THEN GOTO 100
			consequent = new GotoStatement(PRIMARY());
		} else {
			consequent = STATEMENT();
		}
		return new IfStatement(new BinaryOp(relop, left, right), consequent);
	}

	// RELOP : = | <> | < | <= | > | >=
	Operator RELOP() {
		Operator relop;
		switch (token) {
		case EQ:
			relop = Operator.EQ;
			break;
		case NE:
			relop = Operator.NE;
			break;
		case LT:
			relop = Operator.LT;
			break;
		case LE:
			relop = Operator.LE;
			break;
		case GT:
			relop = Operator.GT;
			break;
		case GE:
			relop = Operator.GE;
			break;
		default:
			throw parserException("Missing relational operator. Found: " + describeCurrent());
		}
		lexer();
		return relop;
	}

	// INPUT_LIST : ID { , ID }
	Statement INPUT_LIST() {
		List<Character> variables = new ArrayList<Character>();
		variables.add(Character.valueOf(VARIABLE()));
		while (token == Token.COMMA) {
			lexer();
			variables.add(Character.valueOf(VARIABLE()));
		}
		return new InputStatement(variables);
	}

	// FOR_STATEMENT : ID = EXPRESSION TO EXPRESSION [ STEP EXPRESSION ]
	Statement FOR_STATEMENT() {
		char variable = VARIABLE();
		lexer(Token.EQ);
		Expression start = EXPRESSION();
		lexer(Token.KW_TO);
		Expression limit = EXPRESSION();
		Expression step = null;
		if (token == Token.KW_STEP) {
			lexer();
			step = EXPRESSION();
		}
		return new ForStatement(variable, start, limit, step);
	}

	// VARIABLE : ID
	char VARIABLE() {
		if (token != Token.ID) {
			throw parserException("Expecting a variable name. Found: " + describeCurrent());
		}
		char name = lexeme.getText().charAt(0);
		lexer();
		return name;
	}

	// EXPRESSION : TERM { ( + | - ) TERM }
	Expression EXPRESSION() {
		Expression result = TERM();
		while (token == Token.PLUS || token == Token.MINUS) {
			Operator operator = token == Token.PLUS ? Operator.ADD : Operator.SUBTRACT;
			lexer();
			result = new BinaryOp(operator, result, TERM());
		}
		return result;
	}

	// TERM : UNARY { ( * | / ) UNARY }
	Expression TERM() {
		Expression result = UNARY();
		while (token == Token.MULT || token == Token.DIVIDE) {
			Operator operator = token == Token.MULT ? Operator.MULTIPLY : Operator.DIVIDE;
			lexer();
			result = new BinaryOp(operator, result, UNARY());
		}
		return result;
	}

	// UNARY : - UNARY | PRIMARY
	Expression UNARY() {
		if (token == Token.MINUS) {
			lexer();
			return new UnaryOp(UnaryOp.Kind.NEGATE, UNARY());
		}
		return PRIMARY();
	}

	// PRIMARY : INTEGER | ID | ( EXPRESSION )
	Expression PRIMARY() {
		switch (token) {
		case INTEGER: {
			int value;
			try {
				value = Integer.parseInt(lexeme.getText());
			} catch (NumberFormatException e) {
				throw parserException("Integer out of range: " + lexeme.getText());
			}
			lexer();
			return new IntLiteral(value);
		}
		case ID:
			return new VariableRef(VARIABLE());
		case OPEN_PAREN: {
			lexer();
			Expression inner = EXPRESSION();
			if (token != Token.CLOSE_PAREN) {
				throw parserException("Unbalanced parenthesis: expecting ')'. Found: " + describeCurrent());
			}
			lexer();
			return inner;
		}
		case STRING:
			throw parserException("Malformed operand: a string is only allowed in PRINT");
		case EOF:
			throw parserException("Malformed operand: unexpected end of line");
		default:
			throw parserException("Malformed operand: " + describeCurrent());
		}
	}
	// CHECKSTYLE.ON: MethodName
}
