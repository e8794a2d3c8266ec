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

/**
 * One lexical unit of a RoboScript program, with its 1-based position.
 * Immutable.
 */
public final class Token {

	private final TokenType type;
	private final String text;
	private final int line;
	private final int column;

	/**
	 * @param type lexical category
	 * @param text text of the token (string literals without quotes, escapes resolved)
	 * @param line 1-based line
	 * @param column 1-based column
	 */
	public Token(TokenType type, String text, int line, int column) {
		this.type = type;
		this.text = text;
		this.line = line;
		this.column = column;
	}

	/**
	 * Creates the end marker that terminates every token list.
	 *
	 * @param line line of the end of input
	 * @param column column of the end of input
	 * @return an {@link TokenType#EOF} token
	 */
	public static Token eof(int line, int column) {
		return new Token(TokenType.EOF, "EOF", line, column);
	}

	public TokenType getType() {
		return type;
	}

	public String getText() {
		return text;
	}

	public int getLine() {
		return line;
	}

	public int getColumn() {
		return column;
	}

	/**
	 * @param t the type to compare with
	 * @return whether this token is of type {@code t}
	 */
	public boolean is(TokenType t) {
		return type == t;
	}

	/**
	 * @param keyword a keyword of the language
	 * @return whether this token is the given keyword
	 */
	public boolean isKeyword(String keyword) {
		return type == TokenType.KEYWORD && text.equals(keyword);
	}

	@Override
	public String toString() {
		return type.name() + " = \"" + text + "\" (line " + line + ", col " + column + ")";
	}
}
