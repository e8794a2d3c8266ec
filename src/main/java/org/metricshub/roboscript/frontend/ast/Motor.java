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
 * {@code MOTOR left|right SPEED percentage}
 * <p>
 * Speeds outside [0, 100] are rejected, never clamped, so that
 * {@link #getSpeed()} is always within that range whichever parser
 * built the node.
 */
public final class Motor extends Statement {

	public static final String LEFT = "left";
	public static final String RIGHT = "right";

	public static final int MIN_SPEED = 0;
	public static final int MAX_SPEED = 100;

	private final String name;
	private final int speed;

	/**
	 * @param name {@code left} or {@code right}
	 * @param speed percentage of the full speed
	 * @throws ValidationException if the motor name is unknown or the speed out of range
	 */
	public Motor(String name, int speed) {
		if (!LEFT.equals(name) && !RIGHT.equals(name)) {
			throw new ValidationException("Motor name must be 'left' or 'right'", "Found: " + name);
		}
		if (speed < MIN_SPEED || speed > MAX_SPEED) {
			throw new ValidationException("Motor speed must be between 0 and 100", "Found: " + speed);
		}
		this.name = name;
		this.speed = speed;
	}

	public String getName() {
		return name;
	}

	public int getSpeed() {
		return speed;
	}

	@Override
	public String getNodeType() {
		return "Motor";
	}

	@Override
	protected void populateMap(Map<String, Object> map) {
		map.put("name", name);
		map.put("speed", speed);
	}

	@Override
	public <R, P> R accept(StatementVisitor<R, P> visitor, P arg) {
		return visitor.visitMotor(this, arg);
	}
}
