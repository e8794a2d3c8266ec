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

/**
 * A statement of a RoboScript program.
 * <p>
 * The set of statements is closed: only the classes of this package extend
 * it, and each of them dispatches to its own method of
 * {@link StatementVisitor}. A new kind of statement therefore cannot be
 * added without every visitor handling it.
 */
public abstract class Statement extends AstNode {

	Statement() {}

	/**
	 * Calls the method of {@code visitor} matching the kind of this statement.
	 *
	 * @param <R> the result type of the visitor
	 * @param <P> the argument type of the visitor
	 * @param visitor the visitor
	 * @param arg argument passed through to the visitor
	 * @return whatever the visitor returned
	 */
	public abstract <R, P> R accept(StatementVisitor<R, P> visitor, P arg);
}
