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
 * The three sections produced by {@link ArduinoGenerator}: the
 * <code>setup()</code> body, the <code>loop()</code> body and the hoisted
 * function definitions.
 */
public final class GeneratedCode {

	private final String initCode;
	private final String controlCode;
	private final List<String> hoistedDefinitions;

	GeneratedCode(String initCode, String controlCode, List<String> hoistedDefinitions) {
		this.initCode = initCode;
		this.controlCode = controlCode;
		this.hoistedDefinitions = Collections.unmodifiableList(new ArrayList<String>(hoistedDefinitions));
	}

	/**
	 * @return the body of <code>setup()</code>, newline terminated lines
	 */
	public String getInitCode() {
		return initCode;
	}

	/**
	 * @return the body of <code>loop()</code>, newline terminated lines;
	 *         empty when the program has no top-level statement to emit
	 */
	public String getControlCode() {
		return controlCode;
	}

	/**
	 * @return one complete function text per hoisted function, in the order
	 *         the definitions were encountered
	 */
	public List<String> getHoistedDefinitions() {
		return hoistedDefinitions;
	}
}
