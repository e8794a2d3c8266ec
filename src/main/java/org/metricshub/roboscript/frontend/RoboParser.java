package org.metricshub.roboscript.frontend;

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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
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
import org.metricshub.roboscript.frontend.ast.RobotDeclaration;
import org.metricshub.roboscript.frontend.ast.Send;
import org.metricshub.roboscript.frontend.ast.Servo;
import org.metricshub.roboscript.frontend.ast.Statement;
import org.metricshub.roboscript.frontend.ast.Stop;
import org.metricshub.roboscript.frontend.ast.Turn;
import org.metricshub.roboscript.frontend.ast.ValidationException;
import org.metricshub.roboscript.frontend.ast.Wait;
import org.metricshub.roboscript.frontend.ast.While;
import org.metricshub.roboscript.util.RoboLogger;
import org.metricshub.roboscript.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Recursive descent parser converting the tokens of a RoboScript program
 * into a syntax tree.
 * <p>
 * Statements are dispatched on their leading keyword. Blocks ({@code IF},
 * {@code WHILE}, {@code REPEAT}, {@code FUNCTION}) are parsed until one of
 * the terminators {@code END}, {@code ELSE} or the end of the tokens, and the
 * enclosing rule then requires the terminator it expects.
 * <p>
 * Functions may be called before they are defined. Defined and called names
 * are accumulated while parsing, and the calls are checked against the
 * definitions once the whole program has been read.
 * <p>
 * An instance may be reused, but not concurrently: its state is reset at the
 * start of every parse.
 */
public class RoboParser implements ProgramParser {

	private static final Logger LOGGER = RoboLogger.getLogger(RoboParser.class);

	/** Functions generated for every sketch. */
	private static final Set<String> RESERVED_FUNCTION_NAMES = Collections
			.unmodifiableSet(new HashSet<String>(Arrays.asList("setup", "loop")));

	private List<Token> tokens;
	private int position;
	private Token token;

	private final Set<String> declaredFunctions = new LinkedHashSet<String>();
	private final Set<String> calledFunctions = new LinkedHashSet<String>();

	/** {@inheritDoc} */
	@Override
	public Program parse(ScriptSource source) throws IOException {
		return parse(new RoboLexer(source).tokenize());
	}

	/**
	 * Parse the tokens of a program. Build and return the
	 * root of the abstract syntax tree which represents the program.
	 *
	 * @param tokenList the tokens, normally ending with {@link TokenType#EOF}
	 * @return the syntax tree of the program
	 * @throws ParserException upon a syntax error
	 * @throws ValidationException upon a semantic error
	 */
	public Program parse(List<Token> tokenList) {
		if (tokenList == null) {
			throw new IllegalArgumentException("No tokens supplied");
		}
		this.tokens = tokenList;
		this.position = 0;
		this.token = tokenAt(0);
		declaredFunctions.clear();
		calledFunctions.clear();

		Program program = PROGRAM();
		validateFunctionCalls();

		LOGGER
				.debug(
						"Parsed {} top-level statements, {} function(s)",
						program.getStatements().size(),
						declaredFunctions.size());
		return program;
	}

	/**
	 * @return names defined with {@code FUNCTION} by the last parse, in definition order
	 */
	public Set<String> getDeclaredFunctions() {
		return Collections.unmodifiableSet(new LinkedHashSet<String>(declaredFunctions));
	}

	/**
	 * @return names invoked with {@code CALL} by the last parse, in order of first call
	 */
	public Set<String> getCalledFunctions() {
		return Collections.unmodifiableSet(new LinkedHashSet<String>(calledFunctions));
	}

	/**
	 * Names that are called but never defined.
	 *
	 * @param called names invoked, in the order they should be reported
	 * @param declared names defined
	 * @return {@code called} minus {@code declared}, keeping the order of {@code called}
	 */
	public static Set<String> undefinedFunctions(Set<String> called, Set<String> declared) {
		Set<String> undefined = new LinkedHashSet<String>(called);
		undefined.removeAll(declared);
		return undefined;
	}

	/**
	 * Checks that every called function has been defined somewhere in the
	 * program, wherever the definition is.
	 *
	 * @throws ValidationException naming the first undefined function
	 */
	private void validateFunctionCalls() {
		Set<String> undefined = undefinedFunctions(calledFunctions, declaredFunctions);
		if (!undefined.isEmpty()) {
			String available = declaredFunctions.isEmpty() ? "none" : String.join(", ", declaredFunctions);
			throw new ValidationException(
					"Function '" + undefined.iterator().next() + "' is called but never defined",
					"Available functions: " + available);
		}
	}

	// SUPPORTING FUNCTIONS/METHODS

	private Token tokenAt(int index) {
		if (index < tokens.size()) {
			return tokens.get(index);
		}
		// a list without its end marker behaves as if it had one
		if (tokens.isEmpty()) {
			return Token.eof(1, 1);
		}
		Token last = tokens.get(tokens.size() - 1);
		return Token.eof(last.getLine(), last.getColumn() + last.getText().length());
	}

	private Token advance() {
		Token consumed = token;
		if (!token.is(TokenType.EOF)) {
			position++;
		}
		token = tokenAt(position);
		return consumed;
	}

	private boolean isTerminator() {
		return token.is(TokenType.EOF) || token.isKeyword(Keywords.END) || token.isKeyword(Keywords.ELSE);
	}

	private void expectKeyword(String keyword) {
		if (token.isKeyword(keyword)) {
			advance();
		} else {
			throw parserException("Unexpected token", keyword);
		}
	}

	private Token expect(TokenType type, String msg) {
		if (!token.is(type)) {
			throw parserException(msg, type.name());
		}
		return advance();
	}

	/**
	 * Consumes any token but the end of input. Used for the enumerated
	 * operands (directions, states), whose value is checked by the node.
	 */
	private Token expectAny(String what) {
		if (token.is(TokenType.EOF)) {
			throw parserException("Unexpected end of input", what);
		}
		return advance();
	}

	private int expectNumber(String msg) {
		Token numberToken = token;
		expect(TokenType.NUMBER, msg);
		try {
			return Integer.parseInt(numberToken.getText());
		} catch (NumberFormatException e) {
			throw new ParserException(
					"Number out of range",
					numberToken.getLine(),
					numberToken.getColumn(),
					"NUMBER",
					numberToken.getText());
		}
	}

	// RECURSIVE DECENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// PROGRAM : BLOCK [END] EOF
	Program PROGRAM() {
		List<Statement> statements = BLOCK();
		if (token.isKeyword(Keywords.END)) {
			advance();
		}
		if (!token.is(TokenType.EOF)) {
			if (token.isKeyword(Keywords.ELSE)) {
				throw parserException("ELSE without IF", "statement keyword");
			}
			throw parserException("Unexpected token after end of program", "EOF");
		}
		return new Program(statements);
	}

	// BLOCK : STATEMENT* (up to END, ELSE or EOF)
	List<Statement> BLOCK() {
		List<Statement> statements = new ArrayList<Statement>();
		while (!isTerminator()) {
			int before = position;
			statements.add(STATEMENT());
			if (position == before) {
				// defensive only: every STATEMENT() path advances or throws
				break;
			}
		}
		return statements;
	}

	Statement STATEMENT() {
		if (token.is(TokenType.KEYWORD)) {
			switch (token.getText()) {
			case Keywords.ROBOT:
				return ROBOT_DECLARATION();
			case Keywords.MOVE:
				return MOVE_STATEMENT();
			case Keywords.TURN:
				return TURN_STATEMENT();
			case Keywords.STOP:
				return STOP_STATEMENT();
			case Keywords.IF:
				return IF_STATEMENT();
			case Keywords.WHILE:
				return WHILE_STATEMENT();
			case Keywords.REPEAT:
				return REPEAT_STATEMENT();
			case Keywords.LED:
				return LED_STATEMENT();
			case Keywords.SERVO:
				return SERVO_STATEMENT();
			case Keywords.MOTOR:
				return MOTOR_STATEMENT();
			case Keywords.WAIT:
				return WAIT_STATEMENT();
			case Keywords.FUNCTION:
				return FUNCTION_DEFINITION();
			case Keywords.CALL:
				return CALL_STATEMENT();
			case Keywords.SEND:
				return SEND_STATEMENT();
			default:
				break;
			}
		}
		throw parserException("Unknown statement type", "statement keyword");
	}

	// ROBOT_DECLARATION : ROBOT IDENTIFIER
	Statement ROBOT_DECLARATION() {
		expectKeyword(Keywords.ROBOT);
		Token name = expect(TokenType.IDENTIFIER, "Robot name must be an identifier");
		return new RobotDeclaration(name.getText());
	}

	// MOVE_STATEMENT : MOVE (forward|backward) NUMBER
	Statement MOVE_STATEMENT() {
		expectKeyword(Keywords.MOVE);
		String direction = expectAny("direction").getText();
		// the direction is checked before the distance is read
		Move.Direction.fromText(direction);
		int distance = expectNumber("Movement distance must be a number");
		return new Move(direction, distance);
	}

	// TURN_STATEMENT : TURN (left|right) NUMBER
	Statement TURN_STATEMENT() {
		expectKeyword(Keywords.TURN);
		String direction = expectAny("direction").getText();
		Turn.Direction.fromText(direction);
		int angle = expectNumber("Turn angle must be a number");
		return new Turn(direction, angle);
	}

	// STOP_STATEMENT : STOP
	Statement STOP_STATEMENT() {
		expectKeyword(Keywords.STOP);
		return new Stop();
	}

	// CONDITION : OPERAND OPERATOR OPERAND
	Condition CONDITION() {
		String left = OPERAND();
		if (!token.is(TokenType.OPERATOR) || !Condition.OPERATORS.contains(token.getText())) {
			throw parserException("Invalid comparison operator", "one of " + String.join(" ", Condition.OPERATORS));
		}
		String operator = advance().getText();
		String right = OPERAND();
		return new Condition(left, operator, right);
	}

	// OPERAND : IDENTIFIER | NUMBER
	String OPERAND() {
		if (token.is(TokenType.IDENTIFIER) || token.is(TokenType.NUMBER)) {
			return advance().getText();
		}
		throw parserException("Invalid operand in condition", "IDENTIFIER or NUMBER");
	}

	// IF_STATEMENT : IF CONDITION THEN BLOCK [ELSE BLOCK] END
	Statement IF_STATEMENT() {
		expectKeyword(Keywords.IF);
		Condition condition = CONDITION();
		expectKeyword(Keywords.THEN);
		List<Statement> thenBody = BLOCK();
		List<Statement> elseBody;
		if (token.isKeyword(Keywords.ELSE)) {
			advance();
			elseBody = BLOCK();
		} else {
			elseBody = Collections.emptyList();
		}
		expectKeyword(Keywords.END);
		return new If(condition, thenBody, elseBody);
	}

	// WHILE_STATEMENT : WHILE CONDITION DO BLOCK END
	Statement WHILE_STATEMENT() {
		expectKeyword(Keywords.WHILE);
		Condition condition = CONDITION();
		expectKeyword(Keywords.DO);
		List<Statement> body = BLOCK();
		expectKeyword(Keywords.END);
		return new While(condition, body);
	}

	// REPEAT_STATEMENT : REPEAT NUMBER TIMES BLOCK END
	Statement REPEAT_STATEMENT() {
		expectKeyword(Keywords.REPEAT);
		int times = expectNumber("Repeat count must be a number");
		expectKeyword(Keywords.TIMES);
		List<Statement> body = BLOCK();
		expectKeyword(Keywords.END);
		return new Repeat(times, body);
	}

	// LED_STATEMENT : LED (on|off) [IDENTIFIER]
	Statement LED_STATEMENT() {
		expectKeyword(Keywords.LED);
		String state = expectAny("LED state").getText();
		String color = null;
		if (token.is(TokenType.IDENTIFIER)) {
			color = advance().getText();
		}
		return new Led(state, color);
	}

	// SERVO_STATEMENT : SERVO (IDENTIFIER|forward|backward|left|right|on|off) TO NUMBER
	Statement SERVO_STATEMENT() {
		expectKeyword(Keywords.SERVO);
		Token name;
		if (token.is(TokenType.KEYWORD) && Keywords.isValue(token.getText())) {
			name = advance();
		} else {
			name = expect(TokenType.IDENTIFIER, "Servo name must be an identifier");
		}
		expectKeyword(Keywords.TO);
		int angle = expectNumber("Servo angle must be a number");
		return new Servo(name.getText(), angle);
	}

	// MOTOR_STATEMENT : MOTOR (left|right) SPEED NUMBER
	Statement MOTOR_STATEMENT() {
		expectKeyword(Keywords.MOTOR);
		String name = expectAny("motor name").getText();
		expectKeyword(Keywords.SPEED);
		int speed = expectNumber("Motor speed must be a number");
		return new Motor(name, speed);
	}

	// WAIT_STATEMENT : WAIT NUMBER
	Statement WAIT_STATEMENT() {
		expectKeyword(Keywords.WAIT);
		return new Wait(expectNumber("Wait duration must be a number"));
	}

	// FUNCTION_DEFINITION : FUNCTION IDENTIFIER BLOCK END
	Statement FUNCTION_DEFINITION() {
		expectKeyword(Keywords.FUNCTION);
		String name = functionName();
		if (RESERVED_FUNCTION_NAMES.contains(name)) {
			throw new ValidationException(
					"Function name '" + name + "' is reserved for the sketch entry points",
					"Function: " + name);
		}
		if (!declaredFunctions.add(name)) {
			throw new ValidationException("Function '" + name + "' is already defined", "Function: " + name);
		}
		List<Statement> body = BLOCK();
		expectKeyword(Keywords.END);
		return new FunctionDef(name, body);
	}

	// CALL_STATEMENT : CALL IDENTIFIER
	Statement CALL_STATEMENT() {
		expectKeyword(Keywords.CALL);
		String name = functionName();
		calledFunctions.add(name);
		return new Call(name);
	}

	// SEND_STATEMENT : SEND message STRING
	Statement SEND_STATEMENT() {
		expectKeyword(Keywords.SEND);
		expectKeyword(Keywords.MESSAGE);
		Token message = expect(TokenType.STRING, "Send message must be a string");
		return new Send(message.getText());
	}

	// CHECKSTYLE.ON: MethodName

	/**
	 * Consumes a function name. Names become C++ identifiers, so the dotted
	 * form accepted for sensor reads is refused here.
	 */
	private String functionName() {
		Token nameToken = token;
		String name = expect(TokenType.IDENTIFIER, "Function name must be an identifier").getText();
		if (name.indexOf('.') >= 0) {
			throw new ParserException(
					"Function name must not contain '.'",
					nameToken.getLine(),
					nameToken.getColumn(),
					"IDENTIFIER without '.'",
					describe(nameToken));
		}
		return name;
	}

	private ParserException parserException(String msg, String expected) {
		return new ParserException(msg, token.getLine(), token.getColumn(), expected, describe(token));
	}

	private static String describe(Token t) {
		if (t.is(TokenType.EOF)) {
			return "EOF";
		}
		return t.getType().name() + " '" + t.getText() + "'";
	}
}
