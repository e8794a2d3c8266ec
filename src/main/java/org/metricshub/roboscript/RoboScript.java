package org.metricshub.roboscript;

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
import java.io.IOException;
import java.util.List;
import org.metricshub.roboscript.backend.ArduinoGenerator;
import org.metricshub.roboscript.backend.ArduinoSketch;
import org.metricshub.roboscript.backend.GeneratedCode;
import org.metricshub.roboscript.frontend.LineParser;
import org.metricshub.roboscript.frontend.ProgramParser;
import org.metricshub.roboscript.frontend.RoboLexer;
import org.metricshub.roboscript.frontend.RoboParser;
import org.metricshub.roboscript.frontend.Token;
import org.metricshub.roboscript.frontend.ast.Program;
import org.metricshub.roboscript.util.GeneratorSettings;
import org.metricshub.roboscript.util.ScriptSource;

/**
 * Entry point for embedding the RoboScript compiler.
 * <p>
 * A typical use compiles a program into an Arduino sketch:
 *
 * <pre>
 * String sketch = new RoboScript().compile("ROBOT Rover MOVE forward 10 STOP");
 * </pre>
 *
 * Each stage is also available on its own: {@link #tokenize(ScriptSource)},
 * {@link #parse(ScriptSource)} and {@link #generate(ScriptSource)}.
 * <p>
 * Instances are not thread-safe; use one instance per thread.
 */
public class RoboScript {

	private final GeneratorSettings settings;

	/**
	 * Whether programs are read by the reduced-fidelity {@link LineParser}
	 * instead of the {@link RoboParser}; <code>false</code> by default.
	 */
	private boolean lineMode = false;

	/**
	 * The last syntax tree produced by {@link #parse(ScriptSource)}.
	 */
	private Program lastProgram;

	/**
	 * Create a new compiler with the default generator settings.
	 */
	public RoboScript() {
		this(new GeneratorSettings());
	}

	/**
	 * Create a new compiler with the given generator settings.
	 *
	 * @param settings pin assignment and timings of the target robot
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public RoboScript(GeneratorSettings settings) {
		this.settings = settings;
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public GeneratorSettings getSettings() {
		return settings;
	}

	public boolean isLineMode() {
		return lineMode;
	}

	public void setLineMode(boolean lineMode) {
		this.lineMode = lineMode;
	}

	/**
	 * Returns the last syntax tree produced by {@link #parse(ScriptSource)}.
	 *
	 * @return the last {@link Program}, or {@code null} if nothing was parsed yet
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Program getLastProgram() {
		return lastProgram;
	}

	/**
	 * Splits a program into tokens. The source is closed afterwards.
	 *
	 * @param source the program
	 * @return the tokens, ending with an EOF token
	 * @throws IOException upon an error reading the source
	 * @throws org.metricshub.roboscript.frontend.ast.LexerException upon an invalid character
	 */
	public List<Token> tokenize(ScriptSource source) throws IOException {
		try {
			return new RoboLexer(source).tokenize();
		} finally {
			source.close();
		}
	}

	/**
	 * Parses a program with the parser selected by {@link #isLineMode()}.
	 * The source is closed afterwards.
	 *
	 * @param source the program
	 * @return its syntax tree
	 * @throws IOException upon an error reading the source
	 * @throws RoboScriptException upon a lexical, syntax or semantic error
	 */
	public Program parse(ScriptSource source) throws IOException {
		ProgramParser parser = lineMode ? new LineParser() : new RoboParser();
		try {
			lastProgram = parser.parse(source);
		} finally {
			source.close();
		}
		return lastProgram;
	}

	/**
	 * Parses a program supplied as a string.
	 *
	 * @param script the program text
	 * @return its syntax tree
	 * @throws RoboScriptException upon a lexical, syntax or semantic error
	 */
	public Program parse(String script) {
		try {
			return parse(ScriptSource.fromString(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, script));
		} catch (IOException e) {
			// a StringReader does not fail
			throw new IllegalStateException(e);
		}
	}

	/**
	 * Parses a program and generates the sections of its sketch.
	 *
	 * @param source the program
	 * @return the generated sections
	 * @throws IOException upon an error reading the source
	 * @throws RoboScriptException upon a lexical, syntax or semantic error
	 */
	public GeneratedCode generate(ScriptSource source) throws IOException {
		return new ArduinoGenerator(settings).generate(parse(source));
	}

	/**
	 * Compiles a program into a complete Arduino sketch.
	 *
	 * @param source the program
	 * @return the sketch text
	 * @throws IOException upon an error reading the source
	 * @throws RoboScriptException upon a lexical, syntax or semantic error
	 */
	public String compile(ScriptSource source) throws IOException {
		return ArduinoSketch.assemble(generate(source), settings);
	}

	/**
	 * Compiles a program supplied as a string into a complete Arduino sketch.
	 *
	 * @param script the program text
	 * @return the sketch text
	 * @throws RoboScriptException upon a lexical, syntax or semantic error
	 */
	public String compile(String script) {
		return ArduinoSketch.assemble(new ArduinoGenerator(settings).generate(parse(script)), settings);
	}
}
