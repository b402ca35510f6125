package org.metricshub.llmlang;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import org.metricshub.llmlang.jrt.Value;
import org.metricshub.llmlang.util.ExecuteOptions;

/**
 * Reusable helpers for building and executing LLM.lang tests. Tests describe
 * a program, its options and their expectations with a fluent builder, then
 * run it either through {@link LlmLang} ({@link #llmTest(String)}) or through
 * the {@link Cli} ({@link #cliTest(String)}), with output captured.
 */
public final class LlmTestSupport {

	private LlmTestSupport() {}

	/**
	 * Creates a builder for a test that runs a program with the
	 * {@link LlmLang} API.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static LlmTestBuilder llmTest(String description) {
		return new LlmTestBuilder(description);
	}

	/**
	 * Creates a builder for a test that runs the {@link Cli} entry point.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * A fully configured test case produced by one of the builders.
	 */
	public interface ConfiguredTest {

		String description();

		/**
		 * Executes the test case and returns the captured result without
		 * asserting it.
		 *
		 * @return the captured output, value and exit code
		 * @throws Exception when executing the test fails unexpectedly
		 */
		TestResult run() throws Exception;

		/**
		 * Executes the test case and asserts the configured expectations.
		 *
		 * @throws Exception when executing the test fails unexpectedly
		 */
		default void runAndAssert() throws Exception {
			run().assertExpected();
		}
	}

	/**
	 * Outcome of one execution, along with the expectations of its builder.
	 */
	public static final class TestResult {
		private final String description;
		private final String output;
		private final String errorOutput;
		private final Value value;
		private final int exitCode;
		private final Expectations expected;
		private final Throwable thrownException;

		TestResult(
				String description,
				String output,
				String errorOutput,
				Value value,
				int exitCode,
				Expectations expected,
				Throwable thrownException) {
			this.description = description;
			this.output = output;
			this.errorOutput = errorOutput;
			this.value = value;
			this.exitCode = exitCode;
			this.expected = expected;
			this.thrownException = thrownException;
		}

		public String description() {
			return description;
		}

		/**
		 * @return what the program printed, post-processed
		 */
		public String output() {
			return output;
		}

		/**
		 * @return what the CLI wrote to its error stream
		 */
		public String errorOutput() {
			return errorOutput;
		}

		/**
		 * @return the program value, {@code null} for CLI tests and failures
		 */
		public Value value() {
			return value;
		}

		public int exitCode() {
			return exitCode;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * @return the output split into lines, trailing newline ignored
		 */
		public List<String> lines() {
			return normalizeOutputLines(output);
		}

		/**
		 * Verifies the output, value, exit code or thrown exception against
		 * the expectations of the builder.
		 */
		public void assertExpected() {
			if (expected.exception != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception " + expected.exception.getName() + " for " + description
									+ " but execution completed successfully");
				}
				if (!expected.exception.isInstance(thrownException)) {
					AssertionError error = new AssertionError(
							"Expected exception " + expected.exception.getName() + " for " + description + " but got "
									+ thrownException.getClass().getName());
					error.initCause(thrownException);
					throw error;
				}
				return;
			}
			if (expected.lines != null) {
				assertEquals("Unexpected output for " + description, expected.lines, lines());
			} else if (expected.output != null) {
				assertEquals("Unexpected output for " + description, expected.output, output);
			}
			if (expected.value != null) {
				assertEquals("Unexpected value for " + description, expected.value, value);
			}
			int expectedExit = expected.exitCode == null ? 0 : expected.exitCode;
			assertEquals("Unexpected exit code for " + description + ": " + errorOutput, expectedExit, exitCode);
		}

		private static List<String> normalizeOutputLines(String output) {
			if (output.isEmpty()) {
				return Collections.emptyList();
			}
			String normalized = output.replace("\r\n", "\n").replace("\r", "\n");
			if (normalized.endsWith("\n")) {
				normalized = normalized.substring(0, normalized.length() - 1);
			}
			return Arrays.asList(normalized.split("\n", -1));
		}
	}

	/** What a test expects; {@code null} fields are not checked */
	static final class Expectations {
		private String output;
		private List<String> lines;
		private Value value;
		private Integer exitCode;
		private Class<? extends Throwable> exception;
	}

	/**
	 * Common part of the builders: the program and the expectations.
	 *
	 * @param <B> concrete builder type
	 */
	public abstract static class BaseTestBuilder<B extends BaseTestBuilder<B>> {
		protected final String description;
		protected final Expectations expectations = new Expectations();
		protected String script;
		protected UnaryOperator<String> postProcessor = UnaryOperator.identity();

		protected BaseTestBuilder(String description) {
			this.description = description;
		}

		@SuppressWarnings("unchecked")
		protected B self() {
			return (B) this;
		}

		/**
		 * @param scriptText LLM.lang program text
		 * @return this builder for method chaining
		 */
		public B script(String scriptText) {
			this.script = scriptText;
			return self();
		}

		public B expect(String expectedOutput) {
			expectations.output = expectedOutput;
			return self();
		}

		public B expectLines(String... expectedLines) {
			expectations.lines = new ArrayList<String>(Arrays.asList(expectedLines));
			return self();
		}

		/**
		 * Expects the output to match the lines of a UTF-8 file.
		 *
		 * @param expectedFile file holding the expected output
		 * @return this builder for method chaining
		 */
		public B expectLines(Path expectedFile) {
			try {
				String content = new String(Files.readAllBytes(expectedFile), StandardCharsets.UTF_8);
				expectations.lines = TestResult.normalizeOutputLines(content);
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
			return self();
		}

		public B expectThrow(Class<? extends Throwable> exceptionClass) {
			expectations.exception = exceptionClass;
			return self();
		}

		public B expectExitCode(int exitCode) {
			expectations.exitCode = exitCode;
			return self();
		}

		/**
		 * @param processor applied to the captured output before comparison
		 * @return this builder for method chaining
		 */
		public B postProcessWith(UnaryOperator<String> processor) {
			this.postProcessor = processor;
			return self();
		}

		public abstract ConfiguredTest build();

		/**
		 * Shortcut for {@code build().runAndAssert()}.
		 *
		 * @throws Exception when executing the test fails unexpectedly
		 */
		public void runAndAssert() throws Exception {
			build().runAndAssert();
		}

		/**
		 * Shortcut for {@code build().run()}.
		 *
		 * @return the captured result
		 * @throws Exception when executing the test fails unexpectedly
		 */
		public TestResult run() throws Exception {
			return build().run();
		}
	}

	/**
	 * Builder for tests running a program through {@link LlmLang#execute}.
	 */
	public static final class LlmTestBuilder extends BaseTestBuilder<LlmTestBuilder> {
		private final List<Consumer<ExecuteOptions>> configurers = new ArrayList<Consumer<ExecuteOptions>>();

		private LlmTestBuilder(String description) {
			super(description);
		}

		/**
		 * @param configurer adjusts the runtime options before execution
		 * @return this builder for method chaining
		 */
		public LlmTestBuilder withOptions(Consumer<ExecuteOptions> configurer) {
			configurers.add(configurer);
			return this;
		}

		public LlmTestBuilder expectValue(Value value) {
			expectations.value = value;
			return this;
		}

		@Override
		public ConfiguredTest build() {
			if (script == null) {
				throw new IllegalStateException("No program for " + description);
			}
			return new ConfiguredTest() {
				@Override
				public String description() {
					return description;
				}

				@Override
				public TestResult run() throws Exception {
					ByteArrayOutputStream out = new ByteArrayOutputStream();
					ExecuteOptions options = new ExecuteOptions();
					for (Consumer<ExecuteOptions> configurer : configurers) {
						configurer.accept(options);
					}
					Value value = null;
					Throwable thrown = null;
					try (PrintStream printStream = new PrintStream(out, true, StandardCharsets.UTF_8.name())) {
						options.setOutputStream(printStream);
						value = new LlmLang().execute(script, options).getValue();
					} catch (LlmException e) {
						if (expectations.exception == null) {
							throw e;
						}
						thrown = e;
					}
					String output = postProcessor.apply(new String(out.toByteArray(), StandardCharsets.UTF_8));
					return new TestResult(description, output, "", value, thrown == null ? 0 : 1, expectations, thrown);
				}
			};
		}
	}

	/**
	 * Builder for tests running the {@link Cli}. A failure is reported the way
	 * {@link Cli#main(String[])} does: message on the error stream, exit code 1.
	 */
	public static final class CliTestBuilder extends BaseTestBuilder<CliTestBuilder> {
		private final List<String> arguments = new ArrayList<String>();
		private String stdin = "";

		private CliTestBuilder(String description) {
			super(description);
		}

		/**
		 * @param args command-line arguments, appended in order
		 * @return this builder for method chaining
		 */
		public CliTestBuilder argument(String... args) {
			arguments.addAll(Arrays.asList(args));
			return this;
		}

		/**
		 * @param input text read by an interactive session
		 * @return this builder for method chaining
		 */
		public CliTestBuilder stdin(String input) {
			this.stdin = input;
			return this;
		}

		@Override
		public ConfiguredTest build() {
			final List<String> args = new ArrayList<String>(arguments);
			if (script != null) {
				args.add("-e");
				args.add(script);
			}
			return new ConfiguredTest() {
				@Override
				public String description() {
					return description;
				}

				@Override
				public TestResult run() throws Exception {
					ByteArrayOutputStream out = new ByteArrayOutputStream();
					ByteArrayOutputStream err = new ByteArrayOutputStream();
					int exitCode = 0;
					Throwable thrown = null;
					try (PrintStream outStream = new PrintStream(out, true, StandardCharsets.UTF_8.name());
							PrintStream errStream = new PrintStream(err, true, StandardCharsets.UTF_8.name())) {
						try {
							Cli.create(
									args.toArray(new String[0]),
									new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
									outStream,
									errStream);
						} catch (LlmException e) {
							thrown = e;
							exitCode = 1;
							errStream.println(e.getClass().getSimpleName() + " (line " + e.getLineNumber() + "): " + e.getMessage());
						} catch (IllegalArgumentException e) {
							thrown = e;
							exitCode = 1;
							errStream.println(e.getMessage());
						}
					}
					if (thrown != null && expectations.exception == null && expectations.exitCode == null) {
						throw new AssertionError("Unexpected failure for " + description, thrown);
					}
					String output = postProcessor.apply(new String(out.toByteArray(), StandardCharsets.UTF_8));
					return new TestResult(
							description,
							output,
							new String(err.toByteArray(), StandardCharsets.UTF_8),
							null,
							exitCode,
							expectations,
							thrown);
				}
			};
		}
	}
}
