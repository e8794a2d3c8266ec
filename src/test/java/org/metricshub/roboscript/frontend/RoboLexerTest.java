package org.metricshub.roboscript.frontend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.List;
import org.junit.Test;
import org.metricshub.roboscript.frontend.ast.LexerException;

public class RoboLexerTest {

	private static TokenType[] types(List<Token> tokens) {
		TokenType[] result = new TokenType[tokens.size()];
		for (int i = 0; i < tokens.size(); i++) {
			result[i] = tokens.get(i).getType();
		}
		return result;
	}

	@Test
	public void testKeywordsAndIdentifiers() {
		List<Token> tokens = RoboLexer.tokenize("ROBOT Rover MOVE forward 10");
		assertEquals(6, tokens.size());
		assertEquals(TokenType.KEYWORD, tokens.get(0).getType());
		assertEquals(TokenType.IDENTIFIER, tokens.get(1).getType());
		assertEquals("Rover", tokens.get(1).getText());
		assertEquals(TokenType.KEYWORD, tokens.get(2).getType());
		assertEquals(TokenType.KEYWORD, tokens.get(3).getType());
		assertEquals(TokenType.NUMBER, tokens.get(4).getType());
		assertEquals("10", tokens.get(4).getText());
		assertEquals(TokenType.EOF, tokens.get(5).getType());
	}

	@Test
	public void testKeywordsAreCaseSensitive() {
		List<Token> tokens = RoboLexer.tokenize("move MOVE");
		assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
		assertEquals(TokenType.KEYWORD, tokens.get(1).getType());
	}

	@Test
	public void testDottedIdentifier() {
		List<Token> tokens = RoboLexer.tokenize("IF sensor.distance < 20");
		assertEquals(TokenType.IDENTIFIER, tokens.get(1).getType());
		assertEquals("sensor.distance", tokens.get(1).getText());
		assertEquals(TokenType.OPERATOR, tokens.get(2).getType());
		assertEquals("<", tokens.get(2).getText());
	}

	@Test
	public void testTwoCharacterOperators() {
		List<Token> tokens = RoboLexer.tokenize("a == b != c = d > e");
		assertEquals("==", tokens.get(1).getText());
		assertEquals("!=", tokens.get(3).getText());
		assertEquals("=", tokens.get(5).getText());
		assertEquals(">", tokens.get(7).getText());
	}

	@Test
	public void testPunctuation() {
		assertEquals(
				java.util.Arrays
						.asList(
								TokenType.LPAREN,
								TokenType.IDENTIFIER,
								TokenType.COMMA,
								TokenType.NUMBER,
								TokenType.RPAREN,
								TokenType.DOT,
								TokenType.EOF),
				java.util.Arrays.asList(types(RoboLexer.tokenize("(x, 1) ."))));
	}

	@Test
	public void testStringEscapes() {
		List<Token> tokens = RoboLexer.tokenize("SEND message \"a\\tb\\nc \\\"q\\\" \\\\\"");
		Token string = tokens.get(2);
		assertEquals(TokenType.STRING, string.getType());
		assertEquals("a\tb\nc \"q\" \\", string.getText());
	}

	@Test
	public void testCommentsAreSkipped() {
		List<Token> tokens = RoboLexer.tokenize("# full line\nSTOP # trailing\n# last");
		assertEquals(2, tokens.size());
		assertTrue(tokens.get(0).isKeyword("STOP"));
		assertEquals(TokenType.EOF, tokens.get(1).getType());
	}

	@Test
	public void testPositions() {
		List<Token> tokens = RoboLexer.tokenize("STOP\r\n  WAIT 5");
		assertEquals(1, tokens.get(0).getLine());
		assertEquals(1, tokens.get(0).getColumn());
		assertEquals(2, tokens.get(1).getLine());
		assertEquals(3, tokens.get(1).getColumn());
		assertEquals(2, tokens.get(2).getLine());
		assertEquals(8, tokens.get(2).getColumn());
	}

	@Test
	public void testEmptyProgram() {
		List<Token> tokens = RoboLexer.tokenize("");
		assertEquals(1, tokens.size());
		assertEquals(TokenType.EOF, tokens.get(0).getType());
		assertEquals("EOF", tokens.get(0).getText());
	}

	@Test
	public void testToString() {
		assertEquals("NUMBER = \"42\" (line 1, col 6)", RoboLexer.tokenize("WAIT 42").get(1).toString());
	}

	@Test
	public void testInvalidCharacter() {
		LexerException e = assertThrows(LexerException.class, () -> RoboLexer.tokenize("STOP\nMOVE @"));
		assertEquals(2, e.getLineNumber());
		assertEquals(6, e.getColumn());
		assertEquals('@', e.getInvalidChar());
	}

	@Test
	public void testLoneExclamationMark() {
		assertThrows(LexerException.class, () -> RoboLexer.tokenize("a ! b"));
	}

	@Test
	public void testUnterminatedString() {
		LexerException e = assertThrows(LexerException.class, () -> RoboLexer.tokenize("SEND message \"oops"));
		assertEquals("Unterminated string literal", e.getMessage());
	}
}
