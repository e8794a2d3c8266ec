package org.metricshub.roboscript.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * RoboScript
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.roboscript.frontend.ast.LexerException;
import org.metricshub.roboscript.util.ScriptSource;

/**
 * Splits the text of a RoboScript program into tokens.
 * <p>
 * Whitespace and {@code #} comments (up to the end of the line) are skipped.
 * Identifiers may contain dots, so that {@code sensor.distance} is one token.
 * The resulting list always ends with an {@link TokenType#EOF} token.
 */
public class RoboLexer {

	private final String sourceDescription;
	private final Reader reader;

	private int c;
	private int line = 1;
	private int column = 0;

	private final StringBuilder text = new StringBuilder();

	/**
	 * @param scriptSource the program to tokenize
	 * @throws IOException when the source cannot be opened
	 */
	public RoboLexer(ScriptSource scriptSource) throws IOException {
		this.sourceDescription = scriptSource.getDescription();
		this.reader = scriptSource.getReader();
	}

	/**
	 * Convenience method tokenizing a program given as a string.
	 *
	 * @param script the program text
	 * @return the tokens, ending with {@link TokenType#EOF}
	 */
	public static List<Token> tokenize(String script) {
		try {
			return new RoboLexer(ScriptSource.fromString(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, script))
					.tokenize();
		} catch (IOException e) {
			// a StringReader does not fail
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Reads the whole source.
	 *
	 * @return the tokens, ending with {@link TokenType#EOF}
	 * @throws IOException upon an IO error
	 * @throws LexerException upon an invalid character or an unterminated string
	 */
	public List<Token> tokenize() throws IOException {
		List<Token> tokens = new ArrayList<Token>();
		read();
		Token token;
		do {
			token = nextToken();
			tokens.add(token);
		} while (!token.is(TokenType.EOF));
		return Collections.unmodifiableList(tokens);
	}

	private void read() throws IOException {
		if (c == '\n') {
			line++;
			column = 0;
		}
		c = reader.read();
		// completely bypass \r's
		while (c == '\r') {
			c = reader.read();
		}
		if (c >= 0) {
			column++;
		}
	}

	/**
	 * Skip all whitespaces and comments
	 *
	 * @throws IOException
	 */
	private void skipWhitespaces() throws IOException {
		while (c == ' ' || c == '\t' || c == '\n' || c == '\f' || c == '#') {
			if (c == '#') {
				while (c >= 0 && c != '\n') {
					read();
				}
				continue;
			}
			read();
		}
	}

	private Token nextToken() throws IOException {
		skipWhitespaces();
		text.setLength(0);
		int tokenLine = line;
		int tokenColumn = column;

		if (c < 0) {
			return Token.eof(tokenLine, tokenColumn + 1);
		}
		if (isDigit(c)) {
			while (isDigit(c)) {
				text.append((char) c);
				read();
			}
			return new Token(TokenType.NUMBER, text.toString(), tokenLine, tokenColumn);
		}
		if (isLetter(c) || c == '_') {
			while (isLetter(c) || isDigit(c) || c == '_' || c == '.') {
				text.append((char) c);
				read();
			}
			String word = text.toString();
			TokenType type = Keywords.isKeyword(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
			return new Token(type, word, tokenLine, tokenColumn);
		}
		if (c == '"') {
			read();
			readString();
			return new Token(TokenType.STRING, text.toString(), tokenLine, tokenColumn);
		}
		if (c == '(') {
			read();
			return new Token(TokenType.LPAREN, "(", tokenLine, tokenColumn);
		}
		if (c == ')') {
			read();
			return new Token(TokenType.RPAREN, ")", tokenLine, tokenColumn);
		}
		if (c == ',') {
			read();
			return new Token(TokenType.COMMA, ",", tokenLine, tokenColumn);
		}
		if (c == '.') {
			read();
			return new Token(TokenType.DOT, ".", tokenLine, tokenColumn);
		}
		if (c == '=' || c == '!') {
			char first = (char) c;
			read();
			if (c == '=') {
				read();
				return new Token(TokenType.OPERATOR, first + "=", tokenLine, tokenColumn);
			}
			if (first == '!') {
				throw lexerException("Invalid character", tokenLine, tokenColumn, first);
			}
			return new Token(TokenType.OPERATOR, "=", tokenLine, tokenColumn);
		}
		if (c == '<' || c == '>' || c == '+' || c == '-' || c == '*' || c == '/') {
			String op = String.valueOf((char) c);
			read();
			return new Token(TokenType.OPERATOR, op, tokenLine, tokenColumn);
		}

		throw lexerException("Invalid character", tokenLine, tokenColumn, (char) c);
	}

	/**
	 * Reads a string literal up to the closing quote and resolves the escape codes.
	 * The opening quote has already been consumed.
	 *
	 * @throws IOException
	 */
	private void readString() throws IOException {
		while (c >= 0 && c != '"') {
			if (c == '\\') {
				read();
				switch (c) {
				case 'n':
					text.append('\n');
					break;
				case 't':
					text.append('\t');
					break;
				case -1:
					// handled by the check below
					continue;
				default:
					// \\ and \" and anything else: drop the backslash
					text.append((char) c);
					break;
				}
			} else {
				text.append((char) c);
			}
			read();
		}
		if (c < 0) {
			throw lexerException("Unterminated string literal", line, column, '\0');
		}
		read();
	}

	private LexerException lexerException(String msg, int atLine, int atColumn, char ch) {
		return new LexerException(msg, sourceDescription, atLine, atColumn, ch);
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}

	private static boolean isLetter(int ch) {
		return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
	}
}
