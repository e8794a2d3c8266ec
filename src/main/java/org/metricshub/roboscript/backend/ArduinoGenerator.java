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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.roboscript.frontend.ast.Call;
import org.metricshub.roboscript.frontend.ast.Condition;
import org.metricshub.roboscript.frontend.ast.FunctionDef;
import org.metricshub.roboscript.frontend.ast.If;
import org.metricshub.roboscript.frontend.ast.Led;
import org.metricshub.roboscript.frontend.ast.Motor;
import org.metricshub.roboscript.frontend.ast.Move;
import org.metricshub.roboscript.frontend.ast.Program;
import org.metricshub.roboscript.frontend.ast.Repeat;
import org.metricshub.roboscript.frontend.ast.RobotDeclaration;
import org.metricshub.roboscript.frontend.ast.Send;
import org.metricshub.roboscript.frontend.ast.Servo;
import org.metricshub.roboscript.frontend.ast.Statement;
import org.metricshub.roboscript.frontend.ast.StatementVisitor;
import org.metricshub.roboscript.frontend.ast.Stop;
import org.metricshub.roboscript.frontend.ast.Turn;
import org.metricshub.roboscript.frontend.ast.Wait;
import org.metricshub.roboscript.frontend.ast.While;
import org.metricshub.roboscript.util.GeneratorSettings;
import org.metricshub.roboscript.util.RoboLogger;
import org.slf4j.Logger;

/**
 * Translates a RoboScript syntax tree into Arduino C++ code.
 * <p>
 * The tree is walked once. Each visit receives the {@link CodeBuffer} it
 * writes to: top-level statements go to the <code>loop()</code> buffer, while
 * a function definition opens a fresh buffer for its body and leaves nothing
 * in the buffer of its caller. The generator performs no validation; the tree
 * is expected to come from a parser.
 * <p>
 * Instances are not thread-safe. Each call to {@link #generate(Program)}
 * starts from a clean state.
 */
public class ArduinoGenerator implements StatementVisitor<Void, CodeBuffer> {

	private static final Logger LOGGER = RoboLogger.getLogger(ArduinoGenerator.class);

	/** Indentation of statements inside a function body. */
	private static final int BODY_LEVEL = 1;

	private static final String HIGH = "HIGH";
	private static final String LOW = "LOW";

	private final GeneratorSettings settings;

	private List<String> hoistedDefinitions;

	/**
	 * Creates a generator using the default pin assignment and timings.
	 */
	public ArduinoGenerator() {
		this(new GeneratorSettings());
	}

	/**
	 * Creates a generator using the given pin assignment and timings.
	 *
	 * @param settings generator settings, read on every call to {@link #generate(Program)}
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Settings are shared with the caller, who may tune them between runs")
	public ArduinoGenerator(GeneratorSettings settings) {
		this.settings = settings;
	}

	/**
	 * Generates the code sections for the given program.
	 *
	 * @param program the syntax tree to translate
	 * @return the <code>setup()</code> body, the <code>loop()</code> body and
	 *         the hoisted function definitions
	 */
	public GeneratedCode generate(Program program) {
		hoistedDefinitions = new ArrayList<String>();

		CodeBuffer init = new CodeBuffer(BODY_LEVEL);
		generateSetup(init);

		CodeBuffer control = new CodeBuffer(BODY_LEVEL);
		generateBlock(program.getStatements(), control);

		LOGGER.debug(
				"Generated {} setup lines, {} loop lines and {} functions",
				init.getLines().size(),
				control.getLines().size(),
				hoistedDefinitions.size());

		return new GeneratedCode(init.getCode(), control.getCode(), hoistedDefinitions);
	}

	private void generateSetup(CodeBuffer init) {
		init.addLine("// Initialize pins");
		init.addLine(pinMode(settings.getLedPin()));
		init.addLine(pinMode(settings.getMotorLeftForwardPin()));
		init.addLine(pinMode(settings.getMotorLeftBackwardPin()));
		init.addLine(pinMode(settings.getMotorRightForwardPin()));
		init.addLine(pinMode(settings.getMotorRightBackwardPin()));
		init.addLine("servo.attach(" + settings.getServoPin() + ");");
		init.addLine("Serial.begin(" + settings.getBaudRate() + ");");
		init.addLine("Serial.println(\"Robot initialized\");");
	}

	private static String pinMode(int pin) {
		return "pinMode(" + pin + ", OUTPUT);";
	}

	private static String digitalWrite(int pin, String level) {
		return "digitalWrite(" + pin + ", " + level + ");";
	}

	private void generateBlock(List<Statement> statements, CodeBuffer out) {
		for (Statement statement : statements) {
			statement.accept(this, out);
		}
	}

	/** Emits the statements one level deeper than the current one. */
	private void generateNested(List<Statement> statements, CodeBuffer out) {
		out.indent();
		generateBlock(statements, out);
		out.outdent();
	}

	/** Sets the four drive pins, in the order left forward, right forward, left backward, right backward. */
	private void drive(CodeBuffer out, String leftForward, String rightForward, String leftBackward, String rightBackward) {
		out.addLine(digitalWrite(settings.getMotorLeftForwardPin(), leftForward));
		out.addLine(digitalWrite(settings.getMotorRightForwardPin(), rightForward));
		out.addLine(digitalWrite(settings.getMotorLeftBackwardPin(), leftBackward));
		out.addLine(digitalWrite(settings.getMotorRightBackwardPin(), rightBackward));
	}

	/**
	 * Renders a condition as a parenthesized C++ comparison, replacing the
	 * sensor identifiers with the matching <code>analogRead()</code> call.
	 *
	 * @param condition the condition to render
	 * @return e.g. <code>(analogRead(14) &lt; 20)</code>
	 */
	String renderCondition(Condition condition) {
		return "(" + lowerOperand(condition.getLeft()) + " " + condition.getOperator() + " "
				+ lowerOperand(condition.getRight()) + ")";
	}

	private String lowerOperand(String operand) {
		if (operand.contains("sensor.distance")) {
			return "analogRead(" + settings.getDistanceSensorPin() + ")";
		} else if (operand.contains("sensor.light")) {
			return "analogRead(" + settings.getLightSensorPin() + ")";
		}
		return operand;
	}

	/**
	 * Escapes a message so that it can be written between double quotes in a
	 * C++ string literal.
	 *
	 * @param message the unescaped message
	 * @return the escaped message, without the enclosing quotes
	 */
	static String escapeString(String message) {
		StringBuilder sb = new StringBuilder(message.length() + 8);
		for (int i = 0; i < message.length(); i++) {
			char c = message.charAt(i);
			switch (c) {
			case '\\':
				sb.append("\\\\");
				break;
			case '"':
				sb.append("\\\"");
				break;
			case '\n':
				sb.append("\\n");
				break;
			case '\t':
				sb.append("\\t");
				break;
			case '\r':
				sb.append("\\r");
				break;
			default:
				sb.append(c);
				break;
			}
		}
		return sb.toString();
	}

	/** {@inheritDoc} */
	@Override
	public Void visitRobotDeclaration(RobotDeclaration robot, CodeBuffer out) {
		out.addLine("// Robot: " + robot.getName());
		out.addLine("// Initializing robot systems...");
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitMove(Move move, CodeBuffer out) {
		out.addLine("// Move " + move.getDirection().getText() + ": " + move.getDistance() + " units");
		if (move.getDirection() == Move.Direction.FORWARD) {
			drive(out, HIGH, HIGH, LOW, LOW);
		} else {
			drive(out, LOW, LOW, HIGH, HIGH);
		}
		out.addLine("delay(" + (long) move.getDistance() * settings.getMsPerUnit() + ");");
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitTurn(Turn turn, CodeBuffer out) {
		out.addLine("// Turn " + turn.getDirection().getText() + ": " + turn.getAngle() + " degrees");
		if (turn.getDirection() == Turn.Direction.LEFT) {
			drive(out, LOW, HIGH, HIGH, LOW);
		} else {
			drive(out, HIGH, LOW, LOW, HIGH);
		}
		out.addLine("delay(" + (long) turn.getAngle() * settings.getMsPerDegree() + ");");
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitStop(Stop stop, CodeBuffer out) {
		out.addLine("// Stop all motors");
		out.addLine(digitalWrite(settings.getMotorLeftForwardPin(), LOW));
		out.addLine(digitalWrite(settings.getMotorLeftBackwardPin(), LOW));
		out.addLine(digitalWrite(settings.getMotorRightForwardPin(), LOW));
		out.addLine(digitalWrite(settings.getMotorRightBackwardPin(), LOW));
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitIf(If ifStatement, CodeBuffer out) {
		out.addLine("if " + renderCondition(ifStatement.getCondition()) + " {");
		generateNested(ifStatement.getThenBody(), out);
		if (!ifStatement.getElseBody().isEmpty()) {
			out.addLine("} else {");
			generateNested(ifStatement.getElseBody(), out);
		}
		out.addLine("}");
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitWhile(While whileStatement, CodeBuffer out) {
		out.addLine("while " + renderCondition(whileStatement.getCondition()) + " {");
		generateNested(whileStatement.getBody(), out);
		out.addLine("}");
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitRepeat(Repeat repeat, CodeBuffer out) {
		out.addLine("for (int i = 0; i < " + repeat.getTimes() + "; i++) {");
		generateNested(repeat.getBody(), out);
		out.addLine("}");
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitLed(Led led, CodeBuffer out) {
		if (led.getState() == Led.State.ON) {
			out.addLine("// LED on");
			if (led.getColor() != null) {
				out.addLine("// Color: " + led.getColor());
			}
			out.addLine(digitalWrite(settings.getLedPin(), HIGH));
		} else {
			out.addLine("// LED off");
			out.addLine(digitalWrite(settings.getLedPin(), LOW));
		}
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitServo(Servo servo, CodeBuffer out) {
		out.addLine("// Servo " + servo.getName() + " to angle " + servo.getAngle());
		out.addLine("servo.write(" + servo.getAngle() + ");");
		out.addLine("delay(" + settings.getServoSettleMs() + ");");
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitMotor(Motor motor, CodeBuffer out) {
		// integer division truncates: 75% of 255 is 191
		int pwm = motor.getSpeed() * settings.getPwmMax() / 100;
		int pin = Motor.LEFT.equals(motor.getName()) ? settings.getMotorLeftForwardPin() : settings.getMotorRightForwardPin();
		out.addLine("// Motor " + motor.getName() + " speed: " + motor.getSpeed() + "%");
		out.addLine("analogWrite(" + pin + ", " + pwm + ");");
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitWait(Wait wait, CodeBuffer out) {
		out.addLine("delay(" + wait.getDuration() + ");  // Wait " + wait.getDuration() + "ms");
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitFunctionDef(FunctionDef function, CodeBuffer out) {
		// reserve the slot first so that nested definitions come after this one
		int slot = hoistedDefinitions.size();
		hoistedDefinitions.add(null);

		CodeBuffer body = new CodeBuffer(BODY_LEVEL);
		generateBlock(function.getBody(), body);
		hoistedDefinitions.set(slot, "void " + function.getName() + "() {\n" + body.getCode() + "}\n");

		LOGGER.debug("Hoisted function {} ({} lines)", function.getName(), body.getLines().size());
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitCall(Call call, CodeBuffer out) {
		out.addLine(call.getName() + "();  // Call function");
		return null;
	}

	/** {@inheritDoc} */
	@Override
	public Void visitSend(Send send, CodeBuffer out) {
		out.addLine("Serial.println(\"" + escapeString(send.getMessage()) + "\");");
		return null;
	}
}
