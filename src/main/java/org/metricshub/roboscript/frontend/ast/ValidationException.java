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
 * Semantic error: the program is grammatically valid but illegal,
 * like an out-of-range value, an invalid enumerated value, or a call to
 * a function that is never defined.
 * <p>
 * These errors concern a whole construct or the whole program, so they
 * carry a context string instead of a source position.
 */
public class ValidationException extends RoboScriptException {

	private static final long serialVersionUID = 1L;

	private final String context;

	/**
	 * @param msg description of the problem
	 * @param context what was found, or what is available
	 */
	public ValidationException(String msg, String context) {
		super(msg);
		this.context = context;
	}

	public String getContext() {
		return context;
	}

	@Override
	public String getDetails() {
		return "Context: " + context;
	}
}
