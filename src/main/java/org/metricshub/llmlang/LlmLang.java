package org.metricshub.llmlang;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * LLM.lang
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 - 2026 MetricsHub
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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import org.metricshub.llmlang.backend.Engine;
import org.metricshub.llmlang.backend.ParallelExecutor;
import org.metricshub.llmlang.frontend.Lexer;
import org.metricshub.llmlang.frontend.Parser;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.jrt.Value;
import org.metricshub.llmlang.semantic.SemanticAnalyzer;
import org.metricshub.llmlang.util.CompileOptions;
import org.metricshub.llmlang.util.ExecuteOptions;
import org.metricshub.llmlang.util.LlmLogger;
import org.metricshub.llmlang.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point of the LLM.lang interpreter.
 * <p>
 * {@code compile} runs the front end (lexer, parser, semantic analyzer) and
 * {@code execute} the whole pipeline:
 *
 * <pre>
 * ExecutionResult result = new LlmLang().execute("var x = 1 + 2; x;");
 * result.getValue(); // Int(3)
 * </pre>
 *
 * Errors of every stage are unchecked {@link LlmException}s. Programs run on a
 * dedicated worker thread, bounded by {@link ExecuteOptions#getMaxTime()} when
 * set.
 */
public class LlmLang {

	private static final Logger LOGGER = LlmLogger.getLogger(LlmLang.class);

	/**
	 * The syntax tree of the last program compiled by this instance.
	 */
	private Node lastAst;

	/**
	 * Returns the syntax tree of the last program compiled by this instance.
	 *
	 * @return the last tree, or {@code null} when nothing was compiled
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Node getLastAst() {
		return lastAst;
	}

	// COMPILE

	/**
	 * Compiles an inline program with the default options.
	 *
	 * @param source program text
	 * @return the compiled program
	 */
	public CompiledProgram compile(String source) {
		return compile(source, new CompileOptions());
	}

	/**
	 * Compiles an inline program.
	 *
	 * @param source program text
	 * @param options compilation options
	 * @return the compiled program
	 */
	public CompiledProgram compile(String source, CompileOptions options) {
		return compile(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, source, options);
	}

	/**
	 * Reads and compiles a program.
	 *
	 * @param script program source
	 * @param options compilation options
	 * @return the compiled program
	 * @throws IOException when the program cannot be read
	 */
	public CompiledProgram compile(ScriptSource script, CompileOptions options) throws IOException {
		return compile(script.getDescription(), script.readText(), options);
	}

	private CompiledProgram compile(String description, String source, CompileOptions options) {
		long start = System.nanoTime();
		Node ast = new Parser(new Lexer(source, description).tokenize()).parse();
		lastAst = ast;
		new SemanticAnalyzer().analyze(ast);
		LOGGER
				.debug(
						"Compiled {} in {} ms (optimization level {}, target {})",
						description,
						TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start),
						options.getOptimizationLevel(),
						options.getTarget());
		return new CompiledProgram(description, source, ast, options);
	}

	// EXECUTE

	/**
	 * Compiles and runs an inline program with the default options.
	 *
	 * @param source program text
	 * @return the program value and statistics
	 */
	public ExecutionResult execute(String source) {
		return execute(source, new ExecuteOptions());
	}

	/**
	 * Compiles and runs an inline program.
	 *
	 * @param source program text
	 * @param options runtime options
	 * @return the program value and statistics
	 */
	public ExecutionResult execute(String source, ExecuteOptions options) {
		return execute(compile(source), options);
	}

	/**
	 * Reads, compiles and runs a program.
	 *
	 * @param script program source
	 * @param options runtime options
	 * @return the program value and statistics
	 * @throws IOException when the program cannot be read
	 */
	public ExecutionResult execute(ScriptSource script, ExecuteOptions options) throws IOException {
		return execute(compile(script, new CompileOptions()), options);
	}

	/**
	 * Runs a compiled program. The program is registered as a target of
	 * {@code @modify} under its description.
	 *
	 * @param program the compiled program
	 * @param options runtime options
	 * @return the program value and statistics
	 */
	public ExecutionResult execute(CompiledProgram program, ExecuteOptions options) {
		final Engine engine = createEngine(options);
		engine.registerSource(program.getDescription(), program.getSource(), program.getAst());
		if (options.isDebug()) {
			LOGGER.debug("Executing {} with options:\n{}", program.getDescription(), options.toDescriptionString());
		}
		long start = System.nanoTime();
		Value value = ParallelExecutor.executeWithTimeout(() -> engine.execute(program.getAst()), options.getMaxTime());
		ExecutionStats stats = new ExecutionStats(
				TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start),
				engine.getPeakMemory(),
				engine.getInstructionCount());
		LOGGER.debug("Executed {}: {}", program.getDescription(), stats);
		return new ExecutionResult(value, stats);
	}

	/**
	 * Compiles and runs an inline program, keeping only its value.
	 *
	 * @param source program text
	 * @return the program value
	 */
	public Value eval(String source) {
		return execute(source).getValue();
	}

	/**
	 * Runs an inline program and returns what it printed.
	 *
	 * @param source program text
	 * @return everything the program printed
	 */
	public String run(String source) {
		return run(source, new ExecuteOptions());
	}

	/**
	 * Runs an inline program and returns what it printed; the output stream of
	 * {@code options} is replaced.
	 *
	 * @param source program text
	 * @param options runtime options
	 * @return everything the program printed
	 */
	public String run(String source, ExecuteOptions options) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		try (PrintStream printStream = new PrintStream(out, true, StandardCharsets.UTF_8.name())) {
			options.setOutputStream(printStream);
			execute(source, options);
		} catch (UnsupportedEncodingException e) {
			throw new UncheckedIOException(e);
		}
		return new String(out.toByteArray(), StandardCharsets.UTF_8);
	}

	/**
	 * Creates the engine running one program. Subclasses may return a
	 * specialized engine.
	 *
	 * @param options runtime options
	 * @return a new engine
	 */
	protected Engine createEngine(ExecuteOptions options) {
		return new Engine(options);
	}
}
