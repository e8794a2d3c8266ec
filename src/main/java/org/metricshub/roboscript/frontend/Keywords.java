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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Reserved words of RoboScript.
 * <p>
 * The upper-case words introduce or structure statements. The lower-case
 * words are the enumerated values of some statements (directions, LED states)
 * and are reserved as well: the lexer never reports them as identifiers.
 */
public final class Keywords {

	public static final String ROBOT = "ROBOT";
	public static final String MOVE = "MOVE";
	public static final String TURN = "TURN";
	public static final String STOP = "STOP";
	public static final String IF = "IF";
	public static final String THEN = "THEN";
	public static final String ELSE = "ELSE";
	public static final String END = "END";
	public static final String WHILE = "WHILE";
	public static final String DO = "DO";
	public static final String REPEAT = "REPEAT";
	public static final String TIMES = "TIMES";
	public static final String FUNCTION = "FUNCTION";
	public static final String CALL = "CALL";
	public static final String LED = "LED";
	public static final String SERVO = "SERVO";
	public static final String MOTOR = "MOTOR";
	public static final String SPEED = "SPEED";
	public static final String WAIT = "WAIT";
	public static final String SEND = "SEND";
	public static final String TO = "TO";
	public static final String MESSAGE = "message";

	private static final Set<String> ALL = Collections
			.unmodifiableSet(
					new HashSet<String>(
							Arrays
									.asList(
											ROBOT,
											MOVE,
											TURN,
											STOP,
											IF,
											THEN,
											ELSE,
											END,
											WHILE,
											DO,
											REPEAT,
											TIMES,
											FUNCTION,
											CALL,
											LED,
											SERVO,
											MOTOR,
											SPEED,
											WAIT,
											SEND,
											TO,
											"forward",
											"backward",
											"left",
											"right",
											"on",
											"off",
											"sensor",
											MESSAGE)));

	private static final Set<String> VALUES = Collections
			.unmodifiableSet(new HashSet<String>(Arrays.asList("forward", "backward", "left", "right", "on", "off")));

	private Keywords() {}

	/**
	 * @param word a word read from the program text
	 * @return whether the word is reserved
	 */
	public static boolean isKeyword(String word) {
		return ALL.contains(word);
	}

	/**
	 * @param word a word read from the program text
	 * @return whether the word is one of the reserved operand values (directions, LED states)
	 */
	public static boolean isValue(String word) {
		return VALUES.contains(word);
	}
}
