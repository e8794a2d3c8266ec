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

import java.util.Map;

/**
 * {@code MOVE forward|backward distance}
 * <p>
 * The distance is expressed in abstract units and cannot be negative.
 */
public final class Move extends Statement {

	/** Direction of a straight move. */
	public enum Direction {
		FORWARD("forward"),
		BACKWARD("backward");

		private final String text;

		Direction(String text) {
			this.text = text;
		}

		public String getText() {
			return text;
		}

		public static Direction fromText(String text) {
			for (Direction d : values()) {
				if (d.text.equals(text)) {
					return d;
				}
			}
			throw new ValidationException("Invalid movement direction: " + text, "Expected 'forward' or 'backward'");
		}
	}

	private final Direction direction;
	private final int distance;

	/**
	 * @param direction {@code forward} or {@code backward}
	 * @param distance a non-negative distance
	 * @throws ValidationException if the direction is unknown or the distance negative
	 */
	public Move(String direction, int distance) {
		this.direction = Direction.fromText(direction);
		if (distance < 0) {
			throw new ValidationException("Movement distance must be positive", "Found: " + distance);
		}
		this.distance = distance;
	}

	public Direction getDirection() {
		return direction;
	}

	public int getDistance() {
		return distance;
	}

	@Override
	public String getNodeType() {
		return "Move";
	}

	@Override
	protected void populateMap(Map<String, Object> map) {
		map.put("direction", direction.getText());
		map.put("distance", distance);
	}

	@Override
	public <R, P> R accept(StatementVisitor<R, P> visitor, P arg) {
		return visitor.visitMove(this, arg);
	}
}
