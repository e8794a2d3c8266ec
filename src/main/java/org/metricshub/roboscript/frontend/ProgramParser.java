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

import java.io.IOException;
import org.metricshub.roboscript.frontend.ast.ParserException;
import org.metricshub.roboscript.frontend.ast.Program;
import org.metricshub.roboscript.frontend.ast.ValidationException;
import org.metricshub.roboscript.util.ScriptSource;

/**
 * Turns a RoboScript source into a validated syntax tree.
 * <p>
 * Implementations never return a partial tree: the first error aborts the
 * parse.
 */
public interface ProgramParser {

	/**
	 * Parses the whole source.
	 *
	 * @param source the program to parse
	 * @return the root of the syntax tree
	 * @throws IOException upon an IO error while reading the source
	 * @throws ParserException upon a syntax error
	 * @throws ValidationException upon a semantic error
	 */
	Program parse(ScriptSource source) throws IOException;
}
