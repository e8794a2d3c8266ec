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

import org.metricshub.roboscript.util.GeneratorSettings;

/**
 * Assembles the sections of a {@link GeneratedCode} into a complete Arduino
 * sketch: pin definitions, the global <code>Servo</code>, the hoisted
 * functions, then <code>setup()</code> and <code>loop()</code>.
 */
public final class ArduinoSketch {

	/** Body of <code>loop()</code> when the program emits nothing there. */
	static final String EMPTY_LOOP_PLACEHOLDER = "  // Your robot code here\n";

	private ArduinoSketch() {}

	/**
	 * Builds the sketch text.
	 *
	 * @param code the generated sections
	 * @param settings the pin assignment written in the <code>#define</code> lines
	 * @return the sketch, newline terminated
	 */
	public static String assemble(GeneratedCode code, GeneratorSettings settings) {
		StringBuilder sketch = new StringBuilder();
		sketch.append("#include <Servo.h>\n");
		sketch.append('\n');
		sketch.append("// Pin Definitions\n");
		define(sketch, "LED_PIN", settings.getLedPin());
		define(sketch, "SERVO_PIN", settings.getServoPin());
		define(sketch, "MOTOR_LEFT_FORWARD", settings.getMotorLeftForwardPin());
		define(sketch, "MOTOR_LEFT_BACKWARD", settings.getMotorLeftBackwardPin());
		define(sketch, "MOTOR_RIGHT_FORWARD", settings.getMotorRightForwardPin());
		define(sketch, "MOTOR_RIGHT_BACKWARD", settings.getMotorRightBackwardPin());
		define(sketch, "DISTANCE_SENSOR_PIN", settings.getDistanceSensorPin());
		define(sketch, "LIGHT_SENSOR_PIN", settings.getLightSensorPin());
		sketch.append('\n');
		sketch.append("// Global Variables\n");
		sketch.append("Servo servo;\n");
		sketch.append('\n');

		for (String function : code.getHoistedDefinitions()) {
			sketch.append(function).append('\n');
		}

		sketch.append("void setup() {\n");
		sketch.append(code.getInitCode());
		sketch.append("}\n");
		sketch.append('\n');
		sketch.append("void loop() {\n");
		if (code.getControlCode().isEmpty()) {
			sketch.append(EMPTY_LOOP_PLACEHOLDER);
		} else {
			sketch.append(code.getControlCode());
		}
		sketch.append("}\n");
		return sketch.toString();
	}

	private static void define(StringBuilder sketch, String name, int pin) {
		sketch.append("#define ").append(name).append(' ').append(pin).append('\n');
	}
}
