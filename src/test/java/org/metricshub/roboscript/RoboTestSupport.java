package org.metricshub.roboscript;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.roboscript.util.GeneratorSettings;

/**
 * Fluent helpers to compile RoboScript programs in unit tests and assert on
 * the produced sketch, or on the error raised.
 *
 * <pre>
 * RoboTestSupport
 * 		.compileTest("LED on")
 * 		.script("LED on")
 * 		.expectContains("digitalWrite(13, HIGH);")
 * 		.build()
 * 		.runAndAssert();
 * </pre>
 */
public final class RoboTestSupport {

	private RoboTestSupport() {}

	/**
	 * Creates a builder for a test that compiles a program with the
	 * {@link RoboScript} API.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a new builder
	 */
	public static CompileTestBuilder compileTest(String description) {
		return new CompileTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that runs the {@link Cli} and captures its
	 * standard output.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a new builder
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * A fully configured test case.
	 */
	public interface ConfiguredTest {
		String description();

		/**
		 * Executes the test case and returns the captured result without
		 * asserting it.
		 *
		 * @return the captured output or exception
		 */
		TestResult run();

		default void runAndAssert() {
			run().assertExpected();
		}
	}

	/**
	 * Outcome of a configured test: the produced text, or the exception thrown,
	 * together with the expectations of the builder.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final Throwable thrownException;
		private final Expectations expectations;

		TestResult(String description, String output, Throwable thrownException, Expectations expectations) {
			this.description = description;
			this.output = output;
			this.thrownException = thrownException;
			this.expectations = expectations;
		}

		public String output() {
			return output;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * @return the output split into lines, without the trailing newline
		 */
		public List<String> lines() {
			if (output == null || output.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = output.replace("\r\n", "\n");
			if (normalized.endsWith("\n")) {
				normalized = normalized.substring(0, normalized.length() - 1);
			}
			return Arrays.asList(normalized.split("\n", -1));
		}

		/**
		 * Asserts the recorded outcome against the expectations of the builder.
		 */
		public void assertExpected() {
			if (expectations.exception != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception "
									+ expectations.exception.getName()
									+ " for "
									+ description
									+ " but compilation completed successfully");
				}
				if (!expectations.exception.isInstance(thrownException)) {
					throw new AssertionError(
							"Expected exception "
									+ expectations.exception.getName()
									+ " for "
									+ description
									+ " but got "
									+ thrownException.getClass().getName(),
							thrownException);
				}
				if (expectations.exceptionMessage != null) {
					assertEquals(
							"Unexpected error message for " + description,
							expectations.exceptionMessage,
							thrownException.getMessage());
				}
				return;
			}
			if (thrownException != null) {
				throw new AssertionError("Unexpected exception for " + description, thrownException);
			}
			if (expectations.output != null) {
				assertEquals("Unexpected output for " + description, expectations.output, output);
			}
			if (expectations.lines != null) {
				assertEquals("Unexpected output for " + description, expectations.lines, lines());
			}
			for (String fragment : expectations.fragments) {
				assertTrue(
						"Output of " + description + " should contain <" + fragment + "> but was:\n" + output,
						output.contains(fragment));
			}
			for (String fragment : expectations.absentFragments) {
				assertFalse(
						"Output of " + description + " should not contain <" + fragment + "> but was:\n" + output,
						output.contains(fragment));
			}
		}
	}

	private static final class Expectations {
		private String output;
		private List<String> lines;
		private final List<String> fragments = new ArrayList<String>();
		private final List<String> absentFragments = new ArrayList<String>();
		private Class<? extends Throwable> exception;
		private String exceptionMessage;
	}

	/**
	 * Expectations shared by the builders.
	 *
	 * @param <B> concrete builder type
	 */
	public abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		protected final String description;
		protected String script;
		private final Expectations expectations = new Expectations();

		BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		private B self() {
			return (B) this;
		}

		public B script(String scriptParam) {
			this.script = scriptParam;
			return self();
		}

		public B script(Path scriptFile) throws IOException {
			return script(new String(Files.readAllBytes(scriptFile), StandardCharsets.UTF_8));
		}

		public B expect(String output) {
			expectations.output = output;
			return self();
		}

		public B expectLines(String... lines) {
			expectations.lines = Arrays.asList(lines);
			return self();
		}

		public B expectLines(Path expectedFile) throws IOException {
			expectations.lines = Files.readAllLines(expectedFile, StandardCharsets.UTF_8);
			return self();
		}

		public B expectContains(String... fragments) {
			expectations.fragments.addAll(Arrays.asList(fragments));
			return self();
		}

		public B expectNotContains(String... fragments) {
			expectations.absentFragments.addAll(Arrays.asList(fragments));
			return self();
		}

		public B expectThrow(Class<? extends Throwable> exception) {
			expectations.exception = exception;
			return self();
		}

		public B expectThrow(Class<? extends Throwable> exception, String message) {
			expectations.exception = exception;
			expectations.exceptionMessage = message;
			return self();
		}

		/**
		 * Produces the text to check.
		 *
		 * @return the output of the test subject
		 * @throws Exception when the test subject fails
		 */
		protected abstract String execute() throws Exception;

		public ConfiguredTest build() {
			return new ConfiguredTest() {
				@Override
				public String description() {
					return description;
				}

				@Override
				public TestResult run() {
					String output = null;
					Throwable thrown = null;
					try {
						output = execute();
					} catch (Exception | AssertionError e) {
						thrown = e;
					}
					return new TestResult(description, output, thrown, expectations);
				}
			};
		}
	}

	/**
	 * Builder for tests compiling a program through {@link RoboScript}.
	 */
	public static final class CompileTestBuilder extends BaseTestBuilder<CompileTestBuilder> {
		private final GeneratorSettings settings = new GeneratorSettings();
		private boolean lineMode;

		private CompileTestBuilder(String description) {
			super(description);
		}

		public CompileTestBuilder withSetting(String name, String value) {
			settings.set(name, value);
			return this;
		}

		public CompileTestBuilder lineMode() {
			this.lineMode = true;
			return this;
		}

		@Override
		protected String execute() {
			if (script == null) {
				throw new IllegalStateException("No script given for " + description);
			}
			RoboScript roboScript = new RoboScript(settings);
			roboScript.setLineMode(lineMode);
			return roboScript.compile(script);
		}
	}

	/**
	 * Builder for tests running the {@link Cli}. The script, when set, is
	 * passed as the last argument.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> arguments = new ArrayList<String>();

		private CliTestBuilder(String description) {
			super(description);
		}

		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		@Override
		protected String execute() throws IOException {
			List<String> args = new ArrayList<String>(arguments);
			if (script != null) {
				args.add(script);
			}
			ByteArrayOutputStream bytes = new ByteArrayOutputStream();
			try (PrintStream out = new PrintStream(bytes, true, "UTF-8")) {
				Cli.create(args.toArray(new String[0]), out);
			}
			return new String(bytes.toByteArray(), StandardCharsets.UTF_8);
		}
	}
}
