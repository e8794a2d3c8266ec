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
 * Syntax error: the token sequence does not match the grammar
 * (wrong keyword, wrong number of operands, wrong kind of token).
 * <p>
 * It carries the position of the offending token and a description
 * of what was expected and what was found instead.
 */
public class ParserException extends RoboScriptException {

	private static final long serialVersionUID = 1L;

	private final int column;
	private final String expected;
	private final String found;

	/**
	 * @param msg description of the problem
	 * @param line 1-based line of the offending token
	 * @param column 1-based column of the offending token
	 * @param expected description of the expected token
	 * @param found description of the token actually found
	 */
	public ParserException(String msg, int line, int column, String expected, String found) {
		super(line, msg);
		this.column = column;
		this.expected = expected;
		this.found = found;
	}

	public int getColumn() {
		return column;
	}

	public String getExpected() {
		return expected;
	}

	public String getFound() {
		return found;
	}

	@Override
	public String getDetails() {
		return "Column: " + column + "\nExpected: " + expected + "\nFound: " + found;
	}
}
