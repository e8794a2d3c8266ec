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

import java.util.Map;
import java.util.Properties;

/**
 * A simple container for the parameters of a code generation run.
 * <p>
 * Every value is an integer with a default matching the reference robot
 * wiring. Values are set either through the setters, by name with
 * {@link #set(String, String)}, or in bulk from a properties file with
 * {@link #load(Properties)}.
 */
public class GeneratorSettings {

	/** Pin of the status LED; <code>13</code> by default. */
	private int ledPin = 13;

	/** Pin of the servo signal line; <code>9</code> by default. */
	private int servoPin = 9;

	private int motorLeftForwardPin = 5;

	private int motorLeftBackwardPin = 6;

	private int motorRightForwardPin = 10;

	private int motorRightBackwardPin = 11;

	/** Analog pin of the distance sensor; <code>14</code> (A0) by default. */
	private int distanceSensorPin = 14;

	/** Analog pin of the light sensor; <code>15</code> (A1) by default. */
	private int lightSensorPin = 15;

	/** Milliseconds of driving per movement unit; <code>10</code> by default. */
	private int msPerUnit = 10;

	/** Milliseconds of turning per degree; <code>5</code> by default. */
	private int msPerDegree = 5;

	/** Milliseconds to wait after a servo command; <code>100</code> by default. */
	private int servoSettleMs = 100;

	/** PWM value of a motor at 100% speed; <code>255</code> by default. */
	private int pwmMax = 255;

	/** Serial line speed; <code>9600</code> by default. */
	private int baudRate = 9600;

	/**
	 * Overrides the settings named in the given properties.
	 *
	 * @param properties setting names mapped to integer values
	 * @throws IllegalArgumentException if a name is unknown or a value is not an integer
	 */
	public void load(Properties properties) {
		for (Map.Entry<Object, Object> entry : properties.entrySet()) {
			set(String.valueOf(entry.getKey()).trim(), String.valueOf(entry.getValue()).trim());
		}
	}

	/**
	 * Overrides one setting.
	 *
	 * @param name name of the setting, e.g. <code>ledPin</code>
	 * @param value integer value, as text
	 * @throws IllegalArgumentException if the name is unknown or the value is not an integer
	 */
	public void set(String name, String value) {
		int intValue;
		try {
			intValue = Integer.parseInt(value);
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException("Value of setting '" + name + "' must be an integer: " + value, nfe);
		}
		switch (name) {
		case "ledPin":
			ledPin = intValue;
			break;
		case "servoPin":
			servoPin = intValue;
			break;
		case "motorLeftForwardPin":
			motorLeftForwardPin = intValue;
			break;
		case "motorLeftBackwardPin":
			motorLeftBackwardPin = intValue;
			break;
		case "motorRightForwardPin":
			motorRightForwardPin = intValue;
			break;
		case "motorRightBackwardPin":
			motorRightBackwardPin = intValue;
			break;
		case "distanceSensorPin":
			distanceSensorPin = intValue;
			break;
		case "lightSensorPin":
			lightSensorPin = intValue;
			break;
		case "msPerUnit":
			msPerUnit = intValue;
			break;
		case "msPerDegree":
			msPerDegree = intValue;
			break;
		case "servoSettleMs":
			servoSettleMs = intValue;
			break;
		case "pwmMax":
			pwmMax = intValue;
			break;
		case "baudRate":
			baudRate = intValue;
			break;
		default:
			throw new IllegalArgumentException("Unknown generator setting: " + name);
		}
	}

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("ledPin = ").append(getLedPin()).append(newLine);
		desc.append("servoPin = ").append(getServoPin()).append(newLine);
		desc.append("motorLeftForwardPin = ").append(getMotorLeftForwardPin()).append(newLine);
		desc.append("motorLeftBackwardPin = ").append(getMotorLeftBackwardPin()).append(newLine);
		desc.append("motorRightForwardPin = ").append(getMotorRightForwardPin()).append(newLine);
		desc.append("motorRightBackwardPin = ").append(getMotorRightBackwardPin()).append(newLine);
		desc.append("distanceSensorPin = ").append(getDistanceSensorPin()).append(newLine);
		desc.append("lightSensorPin = ").append(getLightSensorPin()).append(newLine);
		desc.append("msPerUnit = ").append(getMsPerUnit()).append(newLine);
		desc.append("msPerDegree = ").append(getMsPerDegree()).append(newLine);
		desc.append("servoSettleMs = ").append(getServoSettleMs()).append(newLine);
		desc.append("pwmMax = ").append(getPwmMax()).append(newLine);
		desc.append("baudRate = ").append(getBaudRate()).append(newLine);

		return desc.toString();
	}

	public int getLedPin() {
		return ledPin;
	}

	public void setLedPin(int ledPin) {
		this.ledPin = ledPin;
	}

	public int getServoPin() {
		return servoPin;
	}

	public void setServoPin(int servoPin) {
		this.servoPin = servoPin;
	}

	public int getMotorLeftForwardPin() {
		return motorLeftForwardPin;
	}

	public void setMotorLeftForwardPin(int motorLeftForwardPin) {
		this.motorLeftForwardPin = motorLeftForwardPin;
	}

	public int getMotorLeftBackwardPin() {
		return motorLeftBackwardPin;
	}

	public void setMotorLeftBackwardPin(int motorLeftBackwardPin) {
		this.motorLeftBackwardPin = motorLeftBackwardPin;
	}

	public int getMotorRightForwardPin() {
		return motorRightForwardPin;
	}

	public void setMotorRightForwardPin(int motorRightForwardPin) {
		this.motorRightForwardPin = motorRightForwardPin;
	}

	public int getMotorRightBackwardPin() {
		return motorRightBackwardPin;
	}

	public void setMotorRightBackwardPin(int motorRightBackwardPin) {
		this.motorRightBackwardPin = motorRightBackwardPin;
	}

	public int getDistanceSensorPin() {
		return distanceSensorPin;
	}

	public void setDistanceSensorPin(int distanceSensorPin) {
		this.distanceSensorPin = distanceSensorPin;
	}

	public int getLightSensorPin() {
		return lightSensorPin;
	}

	public void setLightSensorPin(int lightSensorPin) {
		this.lightSensorPin = lightSensorPin;
	}

	public int getMsPerUnit() {
		return msPerUnit;
	}

	public void setMsPerUnit(int msPerUnit) {
		this.msPerUnit = msPerUnit;
	}

	public int getMsPerDegree() {
		return msPerDegree;
	}

	public void setMsPerDegree(int msPerDegree) {
		this.msPerDegree = msPerDegree;
	}

	public int getServoSettleMs() {
		return servoSettleMs;
	}

	public void setServoSettleMs(int servoSettleMs) {
		this.servoSettleMs = servoSettleMs;
	}

	public int getPwmMax() {
		return pwmMax;
	}

	public void setPwmMax(int pwmMax) {
		this.pwmMax = pwmMax;
	}

	public int getBaudRate() {
		return baudRate;
	}

	public void setBaudRate(int baudRate) {
		this.baudRate = baudRate;
	}
}
