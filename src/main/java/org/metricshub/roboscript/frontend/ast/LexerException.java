package org.metricshub.roboscript.frontend.ast;

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

import org.metricshub.roboscript.RoboScriptException;

/**
 * Thrown by the lexer when the program text contains a character
 * that cannot start any token, or a string literal that is never closed.
 */
public class LexerException extends RoboScriptException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int column;
	private final char invalidChar;

	/**
	 * @param msg description of the problem
	 * @param sourceDescription name of the script source being read
	 * @param line 1-based line of the offending character
	 * @param column 1-based column of the offending character
	 * @param invalidChar the offending character, {@code '\0'} at end of input
	 */
	public LexerException(String msg, String sourceDescription, int line, int column, char invalidChar) {
		super(line, msg);
		this.sourceDescription = sourceDescription;
		this.column = column;
		this.invalidChar = invalidChar;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public int getColumn() {
		return column;
	}

	public char getInvalidChar() {
		return invalidChar;
	}

	@Override
	public String getDetails() {
		return "Source: " + sourceDescription + ", column " + column + "\nInvalid character: '"
				+ (invalidChar == '\0' ? "EOF" : String.valueOf(invalidChar)) + "'";
	}
}
