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

/**
 * Operation over the statements of a RoboScript program, with one method per
 * kind of statement.
 *
 * @param <R> result type
 * @param <P> type of the argument passed along with each statement
 */
public interface StatementVisitor<R, P> {

	R visitRobotDeclaration(RobotDeclaration robot, P arg);

	R visitMove(Move move, P arg);

	R visitTurn(Turn turn, P arg);

	R visitStop(Stop stop, P arg);

	R visitIf(If ifStatement, P arg);

	R visitWhile(While whileStatement, P arg);

	R visitRepeat(Repeat repeat, P arg);

	R visitLed(Led led, P arg);

	R visitServo(Servo servo, P arg);

	R visitMotor(Motor motor, P arg);

	R visitWait(Wait wait, P arg);

	R visitFunctionDef(FunctionDef function, P arg);

	R visitCall(Call call, P arg);

	R visitSend(Send send, P arg);
}
