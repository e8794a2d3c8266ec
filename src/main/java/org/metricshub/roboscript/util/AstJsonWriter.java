package org.metricshub.roboscript.util;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.metricshub.roboscript.frontend.ast.AstNode;

/**
 * Renders syntax trees as indented JSON, from the map view returned by
 * {@link AstNode#toMap()}.
 */
public final class AstJsonWriter {

	private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

	private AstJsonWriter() {}

	/**
	 * @param node root of the tree to render
	 * @return the JSON text, with keys in the order of the map view
	 */
	public static String toJson(AstNode node) {
		try {
			return MAPPER.writeValueAsString(node.toMap());
		} catch (JsonProcessingException e) {
			// the map view only holds strings, numbers, lists and maps
			throw new IllegalStateException("Unable to render " + node.getNodeType() + " as JSON", e);
		}
	}
}
