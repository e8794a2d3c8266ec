package org.metricshub.roboscript.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Properties;
import org.junit.Test;

public class GeneratorSettingsTest {

	@Test
	public void testDefaults() {
		GeneratorSettings settings = new GeneratorSettings();
		assertEquals(13, settings.getLedPin());
		assertEquals(9, settings.getServoPin());
		assertEquals(5, settings.getMotorLeftForwardPin());
		assertEquals(6, settings.getMotorLeftBackwardPin());
		assertEquals(10, settings.getMotorRightForwardPin());
		assertEquals(11, settings.getMotorRightBackwardPin());
		assertEquals(14, settings.getDistanceSensorPin());
		assertEquals(15, settings.getLightSensorPin());
		assertEquals(10, settings.getMsPerUnit());
		assertEquals(5, settings.getMsPerDegree());
		assertEquals(100, settings.getServoSettleMs());
		assertEquals(255, settings.getPwmMax());
		assertEquals(9600, settings.getBaudRate());
	}

	@Test
	public void testLoad() {
		Properties properties = new Properties();
		properties.setProperty("ledPin", "12");
		properties.setProperty(" msPerDegree ", " 7 ");
		GeneratorSettings settings = new GeneratorSettings();
		settings.load(properties);
		assertEquals(12, settings.getLedPin());
		assertEquals(7, settings.getMsPerDegree());
		assertEquals(9, settings.getServoPin());
	}

	@Test
	public void testSet() {
		GeneratorSettings settings = new GeneratorSettings();
		settings.set("baudRate", "115200");
		settings.set("motorRightBackwardPin", "3");
		assertEquals(115200, settings.getBaudRate());
		assertEquals(3, settings.getMotorRightBackwardPin());
	}

	@Test
	public void testInvalidSettings() {
		GeneratorSettings settings = new GeneratorSettings();
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> settings.set("turbo", "1"));
		assertEquals("Unknown generator setting: turbo", e.getMessage());
		assertThrows(IllegalArgumentException.class, () -> settings.set("ledPin", "thirteen"));
	}

	@Test
	public void testDescription() {
		String description = new GeneratorSettings().toDescriptionString();
		assertTrue(description.contains("ledPin = 13\n"));
		assertTrue(description.contains("baudRate = 9600\n"));
	}
}
