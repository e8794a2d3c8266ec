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
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.roboscript.frontend.Token;
import org.metricshub.roboscript.frontend.ast.Program;
import org.metricshub.roboscript.util.AstJsonWriter;
import org.metricshub.roboscript.util.GeneratorSettings;
import org.metricshub.roboscript.util.RoboLogger;
import org.metricshub.roboscript.util.ScriptFileSource;
import org.metricshub.roboscript.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface of the RoboScript compiler.
 * <p>
 * The program is taken from the file given with <code>-f</code>, or else
 * from the first non-option argument. The resulting Arduino sketch is printed
 * to the standard output, unless <code>-o</code> names a file.
 */
public final class Cli {

	private static final Logger LOGGER = RoboLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "roboscript.jar";
		}
		JAR_NAME = myName;
	}

	private final GeneratorSettings settings = new GeneratorSettings();
	private final PrintStream out;

	private ScriptSource scriptSource;
	private File outputFile;

	private boolean dumpTokens;
	private boolean dumpSyntaxTree;
	private boolean lineMode;
	private boolean printUsage;

	/**
	 * Creates a CLI instance writing to the standard output.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance writing to the supplied stream.
	 *
	 * @param out stream where the sketch, dumps and usage are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
	}

	/**
	 * Returns the mutable {@link GeneratorSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public GeneratorSettings getSettings() {
		return settings;
	}

	/**
	 * @return the program source, or {@code null} if only the usage is printed
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	public File getOutputFile() {
		return outputFile;
	}

	public boolean isDumpTokens() {
		return dumpTokens;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	public boolean isLineMode() {
		return lineMode;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException upon an invalid argument
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: the program text follows
				break;
			} else if (arg.equals("-")) {
				++argIdx;
				break;
			} else if (arg.equals("-f")) {
				// -f filename : load program from file
				checkParameterHasArgument(args, argIdx);
				if (scriptSource != null) {
					throw new IllegalArgumentException("Only one program may be specified with -f");
				}
				ScriptFileSource fileSource = new ScriptFileSource(args[++argIdx]);
				try {
					fileSource.checkReadable();
				} catch (IOException ex) {
					throw new IllegalArgumentException(
							"Failed to read program '" + fileSource.getDescription() + "': " + ex.getMessage(),
							ex);
				}
				scriptSource = fileSource;
			} else if (arg.equals("-o")) {
				// -o filename : write the sketch to a file
				checkParameterHasArgument(args, argIdx);
				outputFile = new File(args[++argIdx]);
			} else if (arg.equals("-c")) {
				// -c filename : load generator settings
				checkParameterHasArgument(args, argIdx);
				loadSettings(settings, args[++argIdx]);
			} else if (arg.equals("-v")) {
				// -v name=val : override one generator setting
				checkParameterHasArgument(args, argIdx);
				setVariable(settings, args[++argIdx]);
			} else if (arg.equals("--dump-tokens")) {
				dumpTokens = true;
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("--line-mode")) {
				lineMode = true;
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("RoboScript program not provided.");
			}
			scriptSource = ScriptSource.fromString(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, args[argIdx++]);
		}

		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
		if (dumpTokens && lineMode) {
			throw new IllegalArgumentException("--dump-tokens cannot be combined with --line-mode");
		}

		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Generator settings:\n{}", settings.toDescriptionString());
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static final Pattern SETTING_PATTERN = Pattern.compile("([_a-zA-Z][_0-9a-zA-Z]*)=(.*)");

	/**
	 * Parses a setting override passed via <code>-v</code> and applies it to the
	 * provided settings instance.
	 *
	 * @param settings settings to mutate
	 * @param keyValue string of the form {@code name=value}
	 */
	private static void setVariable(GeneratorSettings settings, String keyValue) {
		Matcher m = SETTING_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException(
					"keyValue \"" + keyValue + "\" must be of the form \"name=value\"");
		}
		settings.set(m.group(1), m.group(2).trim());
	}

	private static void loadSettings(GeneratorSettings settings, String file) {
		Properties properties = new Properties();
		try (Reader reader = Files.newBufferedReader(new File(file).toPath(), StandardCharsets.UTF_8)) {
			properties.load(reader);
		} catch (IOException ex) {
			throw new IllegalArgumentException("Failed to read settings '" + file + "': " + ex.getMessage(), ex);
		}
		settings.load(properties);
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the program cannot be read or the sketch cannot be written
	 * @throws RoboScriptException if the program does not compile
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}

		RoboScript roboScript = new RoboScript(settings);
		roboScript.setLineMode(lineMode);

		if (dumpTokens) {
			List<Token> tokens = roboScript.tokenize(scriptSource);
			for (int i = 0; i < tokens.size(); i++) {
				out.println("[" + i + "] " + tokens.get(i));
			}
			return;
		}
		if (dumpSyntaxTree) {
			Program program = roboScript.parse(scriptSource);
			out.println(AstJsonWriter.toJson(program));
			return;
		}

		String sketch = roboScript.compile(scriptSource);
		if (outputFile != null) {
			Files.write(outputFile.toPath(), sketch.getBytes(StandardCharsets.UTF_8));
			LOGGER.debug("Sketch written to {}", outputFile);
		} else {
			out.print(sketch);
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f script-filename]" +
								" [-o output-filename]" +
								" [-c settings-filename]" +
								" [-v name=val]..." +
								" [--dump-tokens]" +
								" [--dump-syntax]" +
								" [--line-mode]" +
								" [script]");
		dest.println();
		dest.println(" -f filename = Use contents of filename for the program.");
		dest.println(" -o filename = Write the sketch to filename instead of the standard output.");
		dest.println(" -c filename = Load generator settings (pins, timings) from a properties file.");
		dest.println(" -v name=val = Override one generator setting, e.g. -v ledPin=12.");
		dest.println();
		dest.println(" --dump-tokens = Print the tokens of the program.");
		dest.println(" --dump-syntax = Print the syntax tree as JSON.");
		dest.println(" --line-mode = Use the line-based parser (REPEAT, WAIT, LED, MOTOR and STOP only).");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for the sketch, dumps and usage
	 * @return configured and executed CLI instance
	 * @throws IOException if the program cannot be read or the sketch cannot be written
	 */
	public static Cli create(String[] args, PrintStream os) throws IOException {
		Cli cli = new Cli(os);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (RoboScriptException e) {
			System.err.println(describe(e));
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}

	/**
	 * Formats a compilation error the way {@link #main(String[])} reports it.
	 *
	 * @param e the error
	 * @return the error type, line when known, message and details
	 */
	static String describe(RoboScriptException e) {
		StringBuilder sb = new StringBuilder(e.getClass().getSimpleName());
		if (e.getLineNumber() >= 0) {
			sb.append(" (line ").append(e.getLineNumber()).append(')');
		}
		sb.append(": ").append(e.getMessage());
		String details = e.getDetails();
		if (!details.isEmpty()) {
			sb.append('\n').append(details);
		}
		return sb.toString();
	}
}
