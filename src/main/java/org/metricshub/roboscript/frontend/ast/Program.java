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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Root of the syntax tree: the statements of the program, in source order,
 * which is also their execution order.
 */
public final class Program extends AstNode {

	private final List<Statement> statements;

	/**
	 * @param statements top-level statements, in source order
	 */
	public Program(List<? extends Statement> statements) {
		this.statements = copyOf(statements);
	}

	/**
	 * @return the top-level statements (unmodifiable)
	 */
	public List<Statement> getStatements() {
		return statements;
	}

	@Override
	public String getNodeType() {
		return "Program";
	}

	@Override
	protected void populateMap(Map<String, Object> map) {
		map.put("statements", toMapList(statements));
	}

	@Override
	List<List<Statement>> childLists() {
		return Collections.singletonList(statements);
	}
}
