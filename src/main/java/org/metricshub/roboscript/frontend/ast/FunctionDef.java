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
 * {@code FUNCTION name ... END}
 * <p>
 * A function may be defined after the statements that call it.
 */
public final class FunctionDef extends Statement {

	private final String name;
	private final List<Statement> body;

	public FunctionDef(String name, List<? extends Statement> body) {
		this.name = name;
		this.body = copyOf(body);
	}

	public String getName() {
		return name;
	}

	public List<Statement> getBody() {
		return body;
	}

	@Override
	public String getNodeType() {
		return "Function";
	}

	@Override
	protected void populateMap(Map<String, Object> map) {
		map.put("name", name);
		map.put("body", toMapList(body));
	}

	@Override
	List<List<Statement>> childLists() {
		return Collections.singletonList(body);
	}

	@Override
	public <R, P> R accept(StatementVisitor<R, P> visitor, P arg) {
		return visitor.visitFunctionDef(this, arg);
	}
}
