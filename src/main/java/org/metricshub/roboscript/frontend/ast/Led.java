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
 * {@code LED on|off [color]}
 * <p>
 * The color is optional and only matters when the LED is switched on.
 */
public final class Led extends Statement {

	/** LED state. */
	public enum State {
		ON("on"),
		OFF("off");

		private final String text;

		State(String text) {
			this.text = text;
		}

		public String getText() {
			return text;
		}

		static State fromText(String text) {
			for (State s : values()) {
				if (s.text.equals(text)) {
					return s;
				}
			}
			throw new ValidationException("LED state must be 'on' or 'off'", "Found: " + text);
		}
	}

	private final State state;
	private final String color;

	/**
	 * @param state {@code on} or {@code off}
	 * @param color the color, or {@code null} (an empty string means no color too)
	 */
	public Led(String state, String color) {
		this.state = State.fromText(state);
		this.color = color == null || color.isEmpty() ? null : color;
	}

	public State getState() {
		return state;
	}

	/**
	 * @return the color, or {@code null} when none was given
	 */
	public String getColor() {
		return color;
	}

	@Override
	public String getNodeType() {
		return "LED";
	}

	@Override
	protected void populateMap(Map<String, Object> map) {
		map.put("state", state.getText());
		if (color != null) {
			map.put("color", color);
		}
	}

	@Override
	public <R, P> R accept(StatementVisitor<R, P> visitor, P arg) {
		return visitor.visitLed(this, arg);
	}
}
