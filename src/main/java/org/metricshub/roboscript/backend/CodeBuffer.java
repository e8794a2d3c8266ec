package org.metricshub.roboscript.backend;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only list of generated lines, with an indentation counter of two
 * spaces per level.
 */
public class CodeBuffer {

	private static final String INDENT_UNIT = "  ";

	private final List<String> lines = new ArrayList<String>();
	private final int baseLevel;
	private int level;

	/**
	 * Creates an empty buffer whose lines start at the given indentation level.
	 *
	 * @param baseLevel level that {@link #outdent()} cannot go below
	 */
	public CodeBuffer(int baseLevel) {
		if (baseLevel < 0) {
			throw new IllegalArgumentException("Base indentation level must not be negative: " + baseLevel);
		}
		this.baseLevel = baseLevel;
		this.level = baseLevel;
	}

	/**
	 * Appends one line at the current indentation level.
	 *
	 * @param line the line, without indentation or line terminator
	 */
	public void addLine(String line) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < level; i++) {
			sb.append(INDENT_UNIT);
		}
		lines.add(sb.append(line).toString());
	}

	public void indent() {
		level++;
	}

	/**
	 * @throws IllegalStateException when the level would drop below the base level
	 */
	public void outdent() {
		if (level <= baseLevel) {
			throw new IllegalStateException("Unbalanced indentation: outdent() below level " + baseLevel);
		}
		level--;
	}

	public int getLevel() {
		return level;
	}

	public int getBaseLevel() {
		return baseLevel;
	}

	public boolean isEmpty() {
		return lines.isEmpty();
	}

	public List<String> getLines() {
		return Collections.unmodifiableList(lines);
	}

	/**
	 * @return all lines, each terminated by a newline
	 */
	public String getCode() {
		StringBuilder sb = new StringBuilder();
		for (String line : lines) {
			sb.append(line).append('\n');
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return getCode();
	}
}
