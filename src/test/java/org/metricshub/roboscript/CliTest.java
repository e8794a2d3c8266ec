package org.metricshub.roboscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.roboscript.frontend.ast.ParserException;
import org.metricshub.roboscript.frontend.ast.ValidationException;

public class CliTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testCompileToStandardOutput() {
		RoboTestSupport
				.cliTest("Inline program")
				.script("STOP")
				.expectContains("#include <Servo.h>\n", "void loop() {\n  // Stop all motors\n")
				.build()
				.runAndAssert();
	}

	@Test
	public void testProgramFromFile() throws Exception {
		File program = folder.newFile("program.robo");
		Files.write(program.toPath(), "ROBOT FileBot\nWAIT 20\n".getBytes(StandardCharsets.UTF_8));
		RoboTestSupport
				.cliTest("Program from -f")
				.argument("-f", program.getPath())
				.expectContains("  // Robot: FileBot\n", "  delay(20);  // Wait 20ms\n")
				.build()
				.runAndAssert();
	}

	@Test
	public void testOutputFile() throws Exception {
		File sketch = new File(folder.getRoot(), "robot.ino");
		RoboTestSupport
				.cliTest("Sketch to -o")
				.argument("-o", sketch.getPath())
				.script("LED on")
				.expect("")
				.build()
				.runAndAssert();
		String written = new String(Files.readAllBytes(sketch.toPath()), StandardCharsets.UTF_8);
		assertTrue(written.contains("  digitalWrite(13, HIGH);\n"));
	}

	@Test
	public void testDumpTokens() {
		RoboTestSupport
				.cliTest("--dump-tokens")
				.argument("--dump-tokens")
				.script("WAIT 5")
				.expectLines(
						"[0] KEYWORD = \"WAIT\" (line 1, col 1)",
						"[1] NUMBER = \"5\" (line 1, col 6)",
						"[2] EOF = \"EOF\" (line 1, col 7)")
				.build()
				.runAndAssert();
	}

	@Test
	public void testDumpSyntax() {
		RoboTestSupport
				.cliTest("--dump-syntax")
				.argument("--dump-syntax")
				.script("MOTOR left SPEED 75")
				.expectContains("\"type\" : \"Motor\"", "\"speed\" : 75")
				.expectNotContains("void setup()")
				.build()
				.runAndAssert();
	}

	@Test
	public void testLineMode() {
		RoboTestSupport
				.cliTest("--line-mode")
				.argument("--line-mode")
				.script("TURN left 90\nMOTOR right SPEED 50")
				.expectContains("  analogWrite(10, 127);\n")
				.expectNotContains("Turn left")
				.build()
				.runAndAssert();
	}

	@Test
	public void testSettingsFromFileAndVariables() throws Exception {
		File properties = folder.newFile("robot.properties");
		Files.write(properties.toPath(), "# wiring\nledPin=4\nbaudRate=57600\n".getBytes(StandardCharsets.UTF_8));
		RoboTestSupport
				.cliTest("-c and -v")
				.argument("-c", properties.getPath(), "-v", "baudRate=115200")
				.script("LED off")
				.expectContains("#define LED_PIN 4\n", "  Serial.begin(115200);\n", "  digitalWrite(4, LOW);\n")
				.build()
				.runAndAssert();
	}

	@Test
	public void testUsage() {
		RoboTestSupport.TestResult result = RoboTestSupport
				.cliTest("-h")
				.argument("-h")
				.build()
				.run();
		result.assertExpected();
		assertEquals("Usage:", result.lines().get(0));
		assertTrue(result.output().contains("--line-mode"));
	}

	@Test
	public void testNoArgumentsPrintsUsage() {
		assertTrue(Cli.parseCommandLineArguments(new String[0]).isPrintUsage());
	}

	@Test
	public void testInvalidArguments() {
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "--bogus" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-f" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-h", "STOP" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-v", "ledPin" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "-v", "speed=1" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "--dump-syntax" }));
		assertThrows(IllegalArgumentException.class, () -> Cli.parseCommandLineArguments(new String[] { "STOP", "extra" }));
		assertThrows(
				IllegalArgumentException.class,
				() -> Cli.parseCommandLineArguments(new String[] { "-f", new File(folder.getRoot(), "missing.robo").getPath() }));
	}

	@Test
	public void testParsedOptions() {
		Cli cli = Cli.parseCommandLineArguments(new String[] { "--dump-syntax", "--line-mode", "-v", "pwmMax=200", "STOP" });
		assertTrue(cli.isDumpSyntaxTree());
		assertTrue(cli.isLineMode());
		assertFalse(cli.isDumpTokens());
		assertEquals(200, cli.getSettings().getPwmMax());
		assertEquals("<command-line-supplied-script>", cli.getScriptSource().getDescription());
	}

	@Test
	public void testCompilationErrorsPropagate() {
		RoboTestSupport
				.cliTest("Syntax error")
				.script("REPEAT 2 TIMES STOP")
				.expectThrow(ParserException.class)
				.build()
				.runAndAssert();
	}

	@Test
	public void testErrorDescription() {
		ParserException syntax = new ParserException("Unexpected token", 3, 7, "END", "EOF");
		assertEquals(
				"ParserException (line 3): Unexpected token\nColumn: 7\nExpected: END\nFound: EOF",
				Cli.describe(syntax));

		ValidationException validation = new ValidationException("Function 'f' is called but never defined", "Available functions: none");
		assertEquals(
				"ValidationException: Function 'f' is called but never defined\nContext: Available functions: none",
				Cli.describe(validation));
	}
}
