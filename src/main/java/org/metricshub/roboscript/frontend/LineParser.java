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

import java.io.BufferedReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.roboscript.frontend.ast.Led;
import org.metricshub.roboscript.frontend.ast.Motor;
import org.metricshub.roboscript.frontend.ast.ParserException;
import org.metricshub.roboscript.frontend.ast.Program;
import org.metricshub.roboscript.frontend.ast.Repeat;
import org.metricshub.roboscript.frontend.ast.Statement;
import org.metricshub.roboscript.frontend.ast.Stop;
import org.metricshub.roboscript.frontend.ast.Wait;
import org.metricshub.roboscript.util.RoboLogger;
import org.metricshub.roboscript.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Reduced-fidelity parser matching whole lines on their first word, without
 * tokenizing the program.
 * <p>
 * <strong>This parser only understands a subset of RoboScript</strong>:
 * {@code REPEAT n TIMES ... END} (nestable), {@code WAIT n},
 * {@code LED on|off [color]}, {@code MOTOR left|right SPEED n} and
 * {@code STOP}. Any other line, including {@code IF}, {@code WHILE},
 * {@code FUNCTION}, {@code CALL}, {@code SEND}, {@code MOVE}, {@code TURN}
 * and {@code SERVO}, is silently skipped. Use {@link RoboParser} unless this
 * behavior is explicitly wanted.
 * <p>
 * Lines are trimmed, {@code #} comments are removed and empty lines are
 * ignored before matching.
 */
public class LineParser implements ProgramParser {

	private static final Logger LOGGER = RoboLogger.getLogger(LineParser.class);

	/** One non-empty line of the program, with its 1-based number. */
	private static final class Line {
		private final int number;
		private final String[] words;

		private Line(int number, String text) {
			this.number = number;
			this.words = text.split("\\s+");
		}

		private String keyword() {
			return words[0];
		}

		private String text() {
			return String.join(" ", words);
		}
	}

	private List<Line> lines;
	private int index;

	/** {@inheritDoc} */
	@Override
	public Program parse(ScriptSource source) throws IOException {
		List<String> rawLines = new ArrayList<String>();
		try (BufferedReader reader = new BufferedReader(source.getReader())) {
			String raw;
			while ((raw = reader.readLine()) != null) {
				rawLines.add(raw);
			}
		}
		return parseLines(rawLines);
	}

	/**
	 * Parses the given lines of source.
	 *
	 * @param rawLines the lines of the program, as read
	 * @return the syntax tree of the recognized statements
	 * @throws ParserException upon a malformed recognized line
	 * @throws org.metricshub.roboscript.frontend.ast.ValidationException upon an out-of-domain value
	 */
	public Program parseLines(List<String> rawLines) {
		lines = new ArrayList<Line>();
		for (int i = 0; i < rawLines.size(); i++) {
			String text = stripComment(rawLines.get(i)).trim();
			if (!text.isEmpty()) {
				lines.add(new Line(i + 1, text));
			}
		}
		index = 0;

		List<Statement> statements = new ArrayList<Statement>();
		parseStatements(statements, false);
		LOGGER.debug("Line mode: parsed {} top-level statements", statements.size());
		return new Program(statements);
	}

	private static String stripComment(String line) {
		int hash = line.indexOf('#');
		return hash < 0 ? line : line.substring(0, hash);
	}

	/**
	 * Parses lines into {@code statements} until the end of the program or,
	 * when {@code inBlock}, until the {@code END} line closing the block.
	 *
	 * @return whether the closing {@code END} was found
	 */
	private boolean parseStatements(List<Statement> statements, boolean inBlock) {
		while (index < lines.size()) {
			Line line = lines.get(index++);
			switch (line.keyword()) {
			case Keywords.END:
				if (inBlock) {
					return true;
				}
				LOGGER.debug("Line mode: skipping line {}: {}", line.number, line.text());
				break;
			case Keywords.REPEAT:
				statements.add(parseRepeat(line));
				break;
			case Keywords.WAIT:
				expectWordCount(line, 2, "WAIT duration");
				statements.add(new Wait(parseNumber(line, 1)));
				break;
			case Keywords.LED:
				if (line.words.length != 2 && line.words.length != 3) {
					throw lineException(line, "LED on|off [color]");
				}
				statements.add(new Led(line.words[1], line.words.length == 3 ? line.words[2] : null));
				break;
			case Keywords.MOTOR:
				expectWordCount(line, 4, "MOTOR name SPEED value");
				if (!Keywords.SPEED.equals(line.words[2])) {
					throw lineException(line, "MOTOR name SPEED value");
				}
				statements.add(new Motor(line.words[1], parseNumber(line, 3)));
				break;
			case Keywords.STOP:
				expectWordCount(line, 1, "STOP");
				statements.add(new Stop());
				break;
			default:
				LOGGER.debug("Line mode: skipping line {}: {}", line.number, line.text());
				break;
			}
		}
		return false;
	}

	private Repeat parseRepeat(Line header) {
		expectWordCount(header, 3, "REPEAT count TIMES");
		if (!Keywords.TIMES.equals(header.words[2])) {
			throw lineException(header, "REPEAT count TIMES");
		}
		int times = parseNumber(header, 1);
		List<Statement> body = new ArrayList<Statement>();
		if (!parseStatements(body, true)) {
			throw new ParserException("REPEAT block is never closed", header.number, 1, "END", "EOF");
		}
		return new Repeat(times, body);
	}

	private static void expectWordCount(Line line, int count, String expected) {
		if (line.words.length != count) {
			throw lineException(line, expected);
		}
	}

	private static int parseNumber(Line line, int wordIndex) {
		try {
			return Integer.parseInt(line.words[wordIndex]);
		} catch (NumberFormatException e) {
			throw new ParserException("Expected a number", line.number, 1, "NUMBER", line.words[wordIndex]);
		}
	}

	private static ParserException lineException(Line line, String expected) {
		return new ParserException("Malformed " + line.keyword() + " statement", line.number, 1, expected, line.text());
	}
}
