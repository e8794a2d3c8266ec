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
import java.util.List;
import java.util.Map;

/** {@code IF condition THEN ... [ELSE ...] END} */
public final class If extends Statement {

	private final Condition condition;
	private final List<Statement> thenBody;
	private final List<Statement> elseBody;

	/**
	 * @param condition the tested condition
	 * @param thenBody statements run when the condition holds
	 * @param elseBody statements run otherwise, empty when there is no {@code ELSE}
	 */
	public If(Condition condition, List<? extends Statement> thenBody, List<? extends Statement> elseBody) {
		this.condition = condition;
		this.thenBody = copyOf(thenBody);
		this.elseBody = copyOf(elseBody);
	}

	public Condition getCondition() {
		return condition;
	}

	public List<Statement> getThenBody() {
		return thenBody;
	}

	public List<Statement> getElseBody() {
		return elseBody;
	}

	@Override
	public String getNodeType() {
		return "If";
	}

	@Override
	protected void populateMap(Map<String, Object> map) {
		map.put("condition", condition.toMap());
		map.put("thenBody", toMapList(thenBody));
		map.put("elseBody", toMapList(elseBody));
	}

	@Override
	List<List<Statement>> childLists() {
		return Arrays.asList(thenBody, elseBody);
	}

	@Override
	public <R, P> R accept(StatementVisitor<R, P> visitor, P arg) {
		return visitor.visitIf(this, arg);
	}
}
