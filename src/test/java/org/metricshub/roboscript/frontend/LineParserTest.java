package org.metricshub.roboscript.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.roboscript.frontend.ast.Led;
import org.metricshub.roboscript.frontend.ast.Motor;
import org.metricshub.roboscript.frontend.ast.ParserException;
import org.metricshub.roboscript.frontend.ast.Program;
import org.metricshub.roboscript.frontend.ast.Repeat;
import org.metricshub.roboscript.frontend.ast.Statement;
import org.metricshub.roboscript.frontend.ast.Stop;
import org.metricshub.roboscript.frontend.ast.ValidationException;
import org.metricshub.roboscript.frontend.ast.Wait;
import org.metricshub.roboscript.util.ScriptSource;

public class LineParserTest {

	private static Program parse(String... lines) {
		return new LineParser().parseLines(Arrays.asList(lines));
	}

	@Test
	public void testRecognizedStatements() {
		List<Statement> statements = parse(
				"  WAIT 250  ",
				"LED on green",
				"LED off",
				"MOTOR right SPEED 40",
				"STOP").getStatements();
		assertEquals(5, statements.size());
		assertEquals(250, ((Wait) statements.get(0)).getDuration());
		assertEquals("green", ((Led) statements.get(1)).getColor());
		assertNull(((Led) statements.get(2)).getColor());
		assertEquals("right", ((Motor) statements.get(3)).getName());
		assertEquals(40, ((Motor) statements.get(3)).getSpeed());
		assertTrue(statements.get(4) instanceof Stop);
	}

	@Test
	public void testCommentsAndBlankLines() {
		List<Statement> statements = parse("# header", "", "   ", "WAIT 5 # five", "STOP#now").getStatements();
		assertEquals(2, statements.size());
		assertEquals(5, ((Wait) statements.get(0)).getDuration());
	}

	@Test
	public void testOtherLinesAreSkipped() {
		List<Statement> statements = parse(
				"ROBOT r",
				"MOVE forward 10",
				"IF sensor.distance < 10 THEN",
				"SEND message \"x\"",
				"WAIT 1").getStatements();
		assertEquals(1, statements.size());
		assertTrue(statements.get(0) instanceof Wait);
	}

	@Test
	public void testNestedRepeat() {
		List<Statement> statements = parse(
				"REPEAT 2 TIMES",
				"  REPEAT 3 TIMES",
				"    LED on",
				"  END",
				"  WAIT 10",
				"END",
				"STOP").getStatements();
		assertEquals(2, statements.size());
		Repeat outer = (Repeat) statements.get(0);
		assertEquals(2, outer.getTimes());
		assertEquals(2, outer.getBody().size());
		Repeat inner = (Repeat) outer.getBody().get(0);
		assertEquals(3, inner.getTimes());
		assertTrue(inner.getBody().get(0) instanceof Led);
	}

	@Test
	public void testUnclosedRepeat() {
		ParserException e = assertThrows(ParserException.class, () -> parse("WAIT 1", "REPEAT 2 TIMES", "STOP"));
		assertEquals(2, e.getLineNumber());
		assertEquals("END", e.getExpected());
	}

	@Test
	public void testMalformedLines() {
		ParserException e = assertThrows(ParserException.class, () -> parse("STOP", "", "WAIT soon"));
		assertEquals(3, e.getLineNumber());
		assertThrows(ParserException.class, () -> parse("MOTOR left 50"));
		assertThrows(ParserException.class, () -> parse("REPEAT 2", "END"));
		assertThrows(ParserException.class, () -> parse("LED"));
	}

	@Test
	public void testValidationGoesThroughNodes() {
		assertThrows(ValidationException.class, () -> parse("MOTOR left SPEED 150"));
		assertThrows(ValidationException.class, () -> parse("LED dim"));
		assertThrows(ValidationException.class, () -> parse("WAIT -1"));
	}

	@Test
	public void testParseFromSource() throws Exception {
		Program program = new LineParser().parse(ScriptSource.fromString("test", "STOP\r\nWAIT 3\n"));
		assertEquals(2, program.getStatements().size());
	}
}
