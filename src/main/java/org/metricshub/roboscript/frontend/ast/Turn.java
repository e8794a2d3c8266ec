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
 * {@code TURN left|right angle}
 * <p>
 * The angle, in degrees, is not range-checked.
 */
public final class Turn extends Statement {

	/** Side to turn to. */
	public enum Direction {
		LEFT("left"),
		RIGHT("right");

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
			throw new ValidationException("Invalid turn direction: " + text, "Expected 'left' or 'right'");
		}
	}

	private final Direction direction;
	private final int angle;

	public Turn(String direction, int angle) {
		this.direction = Direction.fromText(direction);
		this.angle = angle;
	}

	public Direction getDirection() {
		return direction;
	}

	public int getAngle() {
		return angle;
	}

	@Override
	public String getNodeType() {
		return "Turn";
	}

	@Override
	protected void populateMap(Map<String, Object> map) {
		map.put("direction", direction.getText());
		map.put("angle", angle);
	}

	@Override
	public <R, P> R accept(StatementVisitor<R, P> visitor, P arg) {
		return visitor.visitTurn(this, arg);
	}
}
