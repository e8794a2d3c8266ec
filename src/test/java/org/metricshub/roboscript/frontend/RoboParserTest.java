package org.metricshub.roboscript.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.Test;
import org.metricshub.roboscript.frontend.ast.Call;
import org.metricshub.roboscript.frontend.ast.Condition;
import org.metricshub.roboscript.frontend.ast.FunctionDef;
import org.metricshub.roboscript.frontend.ast.If;
import org.metricshub.roboscript.frontend.ast.Led;
import org.metricshub.roboscript.frontend.ast.Motor;
import org.metricshub.roboscript.frontend.ast.Move;
import org.metricshub.roboscript.frontend.ast.ParserException;
import org.metricshub.roboscript.frontend.ast.Program;
import org.metricshub.roboscript.frontend.ast.Repeat;
import org.metricshub.roboscript.frontend.ast.Send;
import org.metricshub.roboscript.frontend.ast.Servo;
import org.metricshub.roboscript.frontend.ast.Stop;
import org.metricshub.roboscript.frontend.ast.Turn;
import org.metricshub.roboscript.frontend.ast.ValidationException;
import org.metricshub.roboscript.frontend.ast.Wait;
import org.metricshub.roboscript.frontend.ast.While;

public class RoboParserTest {

	private static Program parse(String script) {
		return new RoboParser().parse(RoboLexer.tokenize(script));
	}

	private static Map<String, Object> node(Object... keyValues) {
		Map<String, Object> map = new LinkedHashMap<String, Object>();
		for (int i = 0; i < keyValues.length; i += 2) {
			map.put((String) keyValues[i], keyValues[i + 1]);
		}
		return map;
	}

	@Test
	public void testRobotMoveTurnStop() {
		Program program = parse("ROBOT bot1\nMOVE forward 50\nTURN right 90\nSTOP\nEND");

		Map<String, Object> expected = node(
				"type",
				"Program",
				"statements",
				Arrays
						.asList(
								node("type", "RobotDeclaration", "name", "bot1"),
								node("type", "Move", "direction", "forward", "distance", 50),
								node("type", "Turn", "direction", "right", "angle", 90),
								node("type", "Stop")));
		assertEquals(expected, program.toMap());
	}

	@Test
	public void testParsingIsDeterministic() {
		String script = "ROBOT r\nFUNCTION f\n  LED on blue\nEND\nWHILE sensor.light > 5 DO\n  CALL f\n  WAIT 10\nEND\n";
		assertEquals(parse(script).toMap(), parse(script).toMap());
	}

	@Test
	public void testTrailingEndIsOptional() {
		assertEquals(1, parse("STOP").getStatements().size());
		assertEquals(0, parse("").getStatements().size());
		assertEquals(0, parse("END").getStatements().size());
	}

	@Test
	public void testContentAfterEndIsRejected() {
		ParserException e = assertThrows(ParserException.class, () -> parse("STOP\nEND\nSTOP"));
		assertEquals("Unexpected token after end of program", e.getMessage());
		assertEquals(3, e.getLineNumber());
	}

	@Test
	public void testElseWithoutIf() {
		ParserException e = assertThrows(ParserException.class, () -> parse("STOP ELSE STOP"));
		assertEquals("ELSE without IF", e.getMessage());
	}

	@Test
	public void testIfElse() {
		Program program = parse("IF sensor.distance < 30 THEN\n  TURN left 45\nELSE\n  MOVE forward 1\nEND");
		If ifStatement = (If) program.getStatements().get(0);
		Condition condition = ifStatement.getCondition();
		assertEquals("sensor.distance", condition.getLeft());
		assertEquals("<", condition.getOperator());
		assertEquals("30", condition.getRight());
		assertEquals(1, ifStatement.getThenBody().size());
		assertTrue(ifStatement.getThenBody().get(0) instanceof Turn);
		assertEquals(Move.Direction.FORWARD, ((Move) ifStatement.getElseBody().get(0)).getDirection());
	}

	@Test
	public void testIfWithoutElseHasEmptyElseBody() {
		If ifStatement = (If) parse("IF a == 1 THEN STOP END").getStatements().get(0);
		assertEquals(Collections.emptyList(), ifStatement.getElseBody());
	}

	@Test
	public void testIfWithoutEndIsSyntaxError() {
		ParserException e = assertThrows(ParserException.class, () -> parse("IF sensor.distance < 30 THEN STOP"));
		assertEquals("END", e.getExpected());
		assertEquals("EOF", e.getFound());
	}

	@Test
	public void testWhileAndRepeat() {
		Program program = parse("WHILE x != 0 DO REPEAT 3 TIMES WAIT 100 END END");
		While loop = (While) program.getStatements().get(0);
		assertEquals("!=", loop.getCondition().getOperator());
		Repeat repeat = (Repeat) loop.getBody().get(0);
		assertEquals(3, repeat.getTimes());
		assertEquals(100, ((Wait) repeat.getBody().get(0)).getDuration());
	}

	@Test
	public void testRepeatZeroTimes() {
		Repeat repeat = (Repeat) parse("REPEAT 0 TIMES STOP END").getStatements().get(0);
		assertEquals(0, repeat.getTimes());
		assertTrue(repeat.getBody().get(0) instanceof Stop);
	}

	@Test
	public void testInvalidComparisonOperator() {
		ParserException e = assertThrows(ParserException.class, () -> parse("IF a = 1 THEN STOP END"));
		assertEquals("Invalid comparison operator", e.getMessage());
	}

	@Test
	public void testInvalidOperand() {
		assertThrows(ParserException.class, () -> parse("IF \"a\" < 1 THEN STOP END"));
	}

	@Test
	public void testLedVariants() {
		List<?> statements = parse("LED on red\nLED on\nLED off").getStatements();
		Led red = (Led) statements.get(0);
		assertEquals(Led.State.ON, red.getState());
		assertEquals("red", red.getColor());
		assertNull(((Led) statements.get(1)).getColor());
		assertEquals(Led.State.OFF, ((Led) statements.get(2)).getState());
		assertEquals(node("type", "LED", "state", "on"), ((Led) statements.get(1)).toMap());
	}

	@Test
	public void testInvalidLedState() {
		ValidationException e = assertThrows(ValidationException.class, () -> parse("LED blink"));
		assertEquals("LED state must be 'on' or 'off'", e.getMessage());
	}

	@Test
	public void testServoMotorSend() {
		List<?> statements = parse("SERVO arm TO 90\nMOTOR left SPEED 75\nSEND message \"hello\"").getStatements();
		assertEquals("arm", ((Servo) statements.get(0)).getName());
		assertEquals(90, ((Servo) statements.get(0)).getAngle());
		assertEquals(75, ((Motor) statements.get(1)).getSpeed());
		assertEquals("hello", ((Send) statements.get(2)).getMessage());
	}

	@Test
	public void testMotorSpeedOutOfRangeIsRejected() {
		ValidationException e = assertThrows(ValidationException.class, () -> parse("MOTOR left SPEED 101"));
		assertEquals("Motor speed must be between 0 and 100", e.getMessage());
		assertEquals(100, ((Motor) parse("MOTOR right SPEED 100").getStatements().get(0)).getSpeed());
	}

	@Test
	public void testUnknownMotorIsRejected() {
		assertThrows(ValidationException.class, () -> parse("MOTOR front SPEED 50"));
	}

	@Test
	public void testInvalidDirection() {
		ValidationException e = assertThrows(ValidationException.class, () -> parse("MOVE up 10"));
		assertEquals("Invalid movement direction: up", e.getMessage());
		assertThrows(ValidationException.class, () -> parse("TURN forward 10"));
	}

	@Test
	public void testMissingNumber() {
		ParserException e = assertThrows(ParserException.class, () -> parse("MOVE forward far"));
		assertEquals("Movement distance must be a number", e.getMessage());
		assertEquals("NUMBER", e.getExpected());
		assertEquals("IDENTIFIER 'far'", e.getFound());
		assertEquals(14, e.getColumn());
	}

	@Test
	public void testNumberOutOfRange() {
		ParserException e = assertThrows(ParserException.class, () -> parse("WAIT 99999999999"));
		assertEquals("Number out of range", e.getMessage());
	}

	@Test
	public void testUnknownStatement() {
		ParserException e = assertThrows(ParserException.class, () -> parse("STOP\nJUMP 3"));
		assertEquals("Unknown statement type", e.getMessage());
		assertEquals(2, e.getLineNumber());
	}

	@Test
	public void testCallBeforeDefinition() {
		RoboParser parser = new RoboParser();
		Program program = parser.parse(RoboLexer.tokenize("CALL avoidObstacle\nFUNCTION avoidObstacle\n  STOP\nEND"));
		assertEquals("avoidObstacle", ((Call) program.getStatements().get(0)).getName());
		FunctionDef function = (FunctionDef) program.getStatements().get(1);
		assertEquals("avoidObstacle", function.getName());
		assertEquals(Collections.singleton("avoidObstacle"), parser.getDeclaredFunctions());
		assertEquals(Collections.singleton("avoidObstacle"), parser.getCalledFunctions());
	}

	@Test
	public void testUndefinedFunction() {
		ValidationException e = assertThrows(ValidationException.class, () -> parse("FUNCTION a STOP END\nCALL b"));
		assertEquals("Function 'b' is called but never defined", e.getMessage());
		assertEquals("Available functions: a", e.getContext());

		e = assertThrows(ValidationException.class, () -> parse("CALL b"));
		assertEquals("Available functions: none", e.getContext());
	}

	@Test
	public void testDuplicateFunction() {
		ValidationException e = assertThrows(ValidationException.class, () -> parse("FUNCTION f STOP END\nFUNCTION f WAIT 1 END"));
		assertEquals("Function 'f' is already defined", e.getMessage());
	}

	@Test
	public void testDottedFunctionName() {
		ParserException e = assertThrows(ParserException.class, () -> parse("FUNCTION a.b STOP END"));
		assertEquals("Function name must not contain '.'", e.getMessage());
		assertEquals("IDENTIFIER 'a.b'", e.getFound());

		assertThrows(ParserException.class, () -> parse("FUNCTION a STOP END\nCALL a.b"));
	}

	@Test
	public void testReservedFunctionName() {
		ValidationException e = assertThrows(ValidationException.class, () -> parse("FUNCTION setup STOP END"));
		assertEquals("Function name 'setup' is reserved for the sketch entry points", e.getMessage());
		assertThrows(ValidationException.class, () -> parse("FUNCTION loop WAIT 1 END"));
	}

	@Test
	public void testServoNamedAfterValueWord() {
		Servo servo = (Servo) parse("SERVO left TO 90").getStatements().get(0);
		assertEquals("left", servo.getName());
		assertEquals(90, servo.getAngle());

		assertThrows(ParserException.class, () -> parse("SERVO WAIT TO 90"));
	}

	@Test
	public void testParserStateIsResetBetweenRuns() {
		RoboParser parser = new RoboParser();
		parser.parse(RoboLexer.tokenize("FUNCTION f STOP END CALL f"));
		assertThrows(ValidationException.class, () -> parser.parse(RoboLexer.tokenize("CALL f")));
		parser.parse(RoboLexer.tokenize("FUNCTION f STOP END"));
		assertEquals(Collections.emptySet(), parser.getCalledFunctions());
	}

	@Test
	public void testMissingEofTokenIsTolerated() {
		List<Token> tokens = Arrays.asList(new Token(TokenType.KEYWORD, "STOP", 1, 1));
		assertEquals(1, new RoboParser().parse(tokens).getStatements().size());
	}

	@Test
	public void testUndefinedFunctionsHelper() {
		Set<String> called = new LinkedHashSet<String>(Arrays.asList("c", "a", "b"));
		Set<String> declared = new LinkedHashSet<String>(Arrays.asList("a"));
		assertEquals(Arrays.asList("c", "b"), Arrays.asList(RoboParser.undefinedFunctions(called, declared).toArray()));
	}
}
