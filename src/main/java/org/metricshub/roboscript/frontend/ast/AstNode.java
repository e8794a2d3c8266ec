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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base class of every node of the RoboScript abstract syntax tree.
 * <p>
 * Nodes are immutable once constructed. Each of them can be turned into a
 * plain structure of nested {@link Map}s and {@link List}s with
 * {@link #toMap()}, where the {@code type} entry tells the kind of node.
 */
public abstract class AstNode {

	AstNode() {}

	/**
	 * @return the value of the {@code type} discriminator of this node
	 */
	public abstract String getNodeType();

	/**
	 * Converts this node, and its children, into nested maps and lists.
	 * The {@code type} entry always comes first; optional fields that are
	 * not set are omitted.
	 *
	 * @return a new, mutable map
	 */
	public final Map<String, Object> toMap() {
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		map.put("type", getNodeType());
		populateMap(map);
		return map;
	}

	/**
	 * Adds the fields of this node to the map produced by {@link #toMap()}.
	 *
	 * @param map the map to populate, already containing {@code type}
	 */
	protected abstract void populateMap(Map<String, Object> map);

	/**
	 * Dump a meaningful text representation of this
	 * abstract syntax tree node, and its children, to the output (print)
	 * stream.
	 *
	 * @param ps The print stream to dump the text representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces + toString());
		for (List<Statement> children : childLists()) {
			for (Statement child : children) {
				child.dump(ps, lvl + 1);
			}
		}
	}

	/**
	 * @return the statement lists owned by this node, empty for leaves
	 */
	List<List<Statement>> childLists() {
		return new ArrayList<List<Statement>>();
	}

	static List<Map<String, Object>> toMapList(List<Statement> statements) {
		List<Map<String, Object>> list = new ArrayList<Map<String, Object>>(statements.size());
		for (Statement statement : statements) {
			list.add(statement.toMap());
		}
		return list;
	}

	static List<Statement> copyOf(List<? extends Statement> statements) {
		if (statements == null) {
			return Collections.emptyList();
		}
		for (Statement statement : statements) {
			if (statement == null) {
				throw new IllegalArgumentException("null statement in body");
			}
		}
		return Collections.unmodifiableList(new ArrayList<Statement>(statements));
	}

	@Override
	public String toString() {
		Map<String, Object> fields = new LinkedHashMap<String, Object>();
		populateMap(fields);
		StringBuilder sb = new StringBuilder(getNodeType());
		for (Map.Entry<String, Object> entry : fields.entrySet()) {
			if (entry.getValue() instanceof List || entry.getValue() instanceof Map) {
				continue;
			}
			sb.append(' ').append(entry.getKey()).append('=').append(entry.getValue());
		}
		return sb.toString();
	}
}
