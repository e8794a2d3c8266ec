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

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Flat comparison {@code left operator right} tested by {@code IF} and
 * {@code WHILE}. There is no nesting and no precedence: a condition is
 * always exactly three tokens.
 */
public final class Condition extends AstNode {

	/** Comparison operators allowed in a condition. */
	public static final Set<String> OPERATORS = Collections
			.unmodifiableSet(new LinkedHashSet<String>(Arrays.asList("<", ">", "==", "!=")));

	private final String left;
	private final String operator;
	private final String right;

	/**
	 * @param left left operand, as written
	 * @param operator one of {@link #OPERATORS}
	 * @param right right operand, as written
	 */
	public Condition(String left, String operator, String right) {
		if (!OPERATORS.contains(operator)) {
			throw new IllegalArgumentException("Not a comparison operator: " + operator);
		}
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public String getLeft() {
		return left;
	}

	public String getOperator() {
		return operator;
	}

	public String getRight() {
		return right;
	}

	@Override
	public String getNodeType() {
		return "Condition";
	}

	@Override
	protected void populateMap(Map<String, Object> map) {
		map.put("left", left);
		map.put("operator", operator);
		map.put("right", right);
	}
}
