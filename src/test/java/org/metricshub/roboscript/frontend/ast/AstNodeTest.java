package org.metricshub.roboscript.frontend.ast;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.junit.Test;

public class AstNodeTest {

	@Test
	public void testTypeComesFirst() {
		Map<String, Object> map = new Servo("arm", 45).toMap();
		assertEquals(Arrays.asList("type", "name", "angle"), new ArrayList<String>(map.keySet()));
		assertEquals("Servo", map.get("type"));
		assertEquals(45, map.get("angle"));
	}

	@Test
	public void testTypeDiscriminators() {
		assertEquals("Function", new FunctionDef("f", Collections.<Statement>emptyList()).toMap().get("type"));
		assertEquals("LED", new Led("off", null).toMap().get("type"));
		assertEquals("Condition", new Condition("a", "<", "1").toMap().get("type"));
		assertEquals("Call", new Call("f").getNodeType());
		assertEquals("Send", new Send("hi").getNodeType());
	}

	@Test
	public void testLedColorOmittedWhenAbsent() {
		assertFalse(new Led("on", null).toMap().containsKey("color"));
		assertFalse(new Led("on", "").toMap().containsKey("color"));
		assertEquals("blue", new Led("on", "blue").toMap().get("color"));
	}

	@Test
	@SuppressWarnings("unchecked")
	public void testNestedStructure() {
		If node = new If(
				new Condition("sensor.distance", "<", "30"),
				Arrays.asList(new Stop()),
				Arrays.asList(new Wait(5), new Call("f")));
		Map<String, Object> map = node.toMap();
		Map<String, Object> condition = (Map<String, Object>) map.get("condition");
		assertEquals("<", condition.get("operator"));
		List<Map<String, Object>> elseBody = (List<Map<String, Object>>) map.get("elseBody");
		assertEquals(2, elseBody.size());
		assertEquals("Wait", elseBody.get(0).get("type"));
		assertEquals(5, elseBody.get(0).get("duration"));
	}

	@Test
	public void testBodiesAreImmutableCopies() {
		List<Statement> body = new ArrayList<Statement>();
		body.add(new Stop());
		Repeat repeat = new Repeat(2, body);
		body.add(new Stop());
		assertEquals(1, repeat.getBody().size());
		assertThrows(UnsupportedOperationException.class, () -> repeat.getBody().add(new Stop()));
		assertThrows(IllegalArgumentException.class, () -> new While(new Condition("a", "<", "b"), Arrays.asList((Statement) null)));
	}

	@Test
	public void testDomainChecks() {
		assertThrows(ValidationException.class, () -> new Move("forward", -1));
		assertThrows(ValidationException.class, () -> new Repeat(-1, Collections.<Statement>emptyList()));
		assertThrows(ValidationException.class, () -> new Motor("left", -1));
		assertThrows(IllegalArgumentException.class, () -> new Condition("a", "<=", "b"));
		assertEquals(720, new Turn("right", 720).getAngle());
	}

	@Test
	public void testDump() {
		Program program = new Program(
				Arrays.asList(new RobotDeclaration("r"), new Repeat(2, Arrays.asList(new Move("backward", 3)))));
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		program.dump(new PrintStream(bytes, true));
		String dump = new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		assertTrue(dump, dump.contains(" RobotDeclaration name=r"));
		assertTrue(dump, dump.contains("  Move direction=backward distance=3"));
	}
}
