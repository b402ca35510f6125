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
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.metricshub.llmlang.backend.Engine;
import org.metricshub.llmlang.ext.NativeFunction;
import org.metricshub.llmlang.ext.StandardLibrary;
import org.metricshub.llmlang.frontend.Parser;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.jrt.Value;
import org.metricshub.llmlang.modify.SourceGenerator;
import org.metricshub.llmlang.util.CompileOptions;
import org.metricshub.llmlang.util.ExecuteOptions;
import org.metricshub.llmlang.util.ScriptFileSource;
import org.metricshub.llmlang.util.ScriptSource;

/**
 * Command-line interface for LLM.lang: runs a program file or an inline
 * program, compiles without running, or starts an interactive session.
 */
public final class Cli {

	private static final String JAR_NAME;

	/** Description of programs typed in an interactive session */
	static final String DESCRIPTION_REPL = "<repl>";

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "llm-lang.jar";
		}
		JAR_NAME = myName;
	}

	private final ExecuteOptions executeOptions = new ExecuteOptions();
	private final CompileOptions compileOptions = new CompileOptions();
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;

	private ScriptSource scriptSource;
	private boolean compileOnly;
	private boolean dumpSyntaxTree;
	private boolean dumpSource;
	private boolean printStats;
	private boolean interactive;
	private boolean listFunctions;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream read by the interactive session
	 * @param out stream where program output and results are written
	 * @param err stream where interactive errors are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.in = in;
		this.out = out;
		this.err = err;
		executeOptions.setOutputStream(out);
	}

	/**
	 * @return the runtime options configured from the command line
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ExecuteOptions getExecuteOptions() {
		return executeOptions;
	}

	/**
	 * @return the compilation options configured from the command line
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public CompileOptions getCompileOptions() {
		return compileOptions;
	}

	/**
	 * @return the program to run, {@code null} in interactive mode
	 */
	public ScriptSource getScriptSource() {
		return scriptSource;
	}

	public boolean isCompileOnly() {
		return compileOnly;
	}

	public boolean isInteractive() {
		return interactive;
	}

	public boolean isPrintStats() {
		return printStats;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
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
				// end of options: the program file
				break;
			} else if (arg.equals("-e")) {
				// -e script : inline program
				checkParameterHasArgument(args, argIdx);
				scriptSource = ScriptSource.of(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, args[++argIdx]);
			} else if (arg.equals("-d") || arg.equals("--debug")) {
				executeOptions.setDebug(true);
			} else if (arg.equals("-m") || arg.equals("--memory-limit")) {
				// -m MB : memory budget
				checkParameterHasArgument(args, argIdx);
				executeOptions.setMaxMemory(parsePositive(arg, args[++argIdx]) * 1024L * 1024L);
			} else if (arg.equals("-t") || arg.equals("--time-limit")) {
				// -t SECONDS : time budget
				checkParameterHasArgument(args, argIdx);
				executeOptions.setMaxTime(parsePositive(arg, args[++argIdx]) * 1000L);
			} else if (arg.equals("--no-parallel")) {
				executeOptions.setParallel(false);
			} else if (arg.equals("--no-vectors")) {
				executeOptions.setVectors(false);
			} else if (arg.equals("--no-nlp")) {
				executeOptions.setNlp(false);
			} else if (arg.equals("--no-modify")) {
				executeOptions.setSelfModifying(false);
			} else if (arg.equals("-s") || arg.equals("--stats")) {
				printStats = true;
			} else if (arg.equals("-c") || arg.equals("--compile")) {
				compileOnly = true;
			} else if (arg.equals("-O")) {
				// -O level : optimization level
				checkParameterHasArgument(args, argIdx);
				compileOptions.setOptimizationLevel((int) parseNonNegative(arg, args[++argIdx]));
				compileOptions.setOptimize(compileOptions.getOptimizationLevel() > 0);
			} else if (arg.equals("--target")) {
				checkParameterHasArgument(args, argIdx);
				compileOptions.setTarget(args[++argIdx]);
			} else if (arg.equals("--debug-info")) {
				compileOptions.setDebugInfo(true);
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("--dump-source")) {
				dumpSource = true;
			} else if (arg.equals("-i") || arg.equals("--interactive")) {
				interactive = true;
			} else if (arg.equals("--list-functions")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When listing functions, we do not accept other arguments.");
				}
				listFunctions = true;
				return;
			} else if (arg.equals("-h") || arg.equals("-?")) {
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

		if (argIdx < args.length) {
			if (scriptSource != null) {
				throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
			}
			scriptSource = new ScriptFileSource(args[argIdx++]);
			if (argIdx < args.length) {
				throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
			}
		}
		if (scriptSource == null && !interactive) {
			throw new IllegalArgumentException("LLM.lang program not provided.");
		}
		if (scriptSource != null && interactive) {
			throw new IllegalArgumentException("An interactive session does not take a program.");
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

	private static long parsePositive(String option, String value) {
		long number = parseNonNegative(option, value);
		if (number == 0) {
			throw new IllegalArgumentException(option + " expects a positive number: " + value);
		}
		return number;
	}

	private static long parseNonNegative(String option, String value) {
		try {
			long number = Long.parseLong(value);
			if (number >= 0) {
				return number;
			}
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects a number: " + value, e);
		}
		throw new IllegalArgumentException(option + " expects a non-negative number: " + value);
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws Exception if compilation or execution fails
	 */
	public void run() throws Exception {
		if (printUsage) {
			usage(out);
			return;
		}
		if (listFunctions) {
			for (NativeFunction function : StandardLibrary.listFunctions().values()) {
				out.println(function);
			}
			return;
		}
		if (interactive) {
			repl();
			return;
		}

		LlmLang llm = new LlmLang();
		CompiledProgram program = llm.compile(scriptSource, compileOptions);
		if (dumpSyntaxTree) {
			program.getAst().dump(out);
		}
		if (dumpSource) {
			out.print(SourceGenerator.generate(program.getAst()));
		}
		if (compileOnly) {
			out.println("Compiled " + program.getDescription() + " (target " + compileOptions.getTarget() + ", optimization level "
					+ compileOptions.getOptimizationLevel() + ")");
			return;
		}
		if (dumpSyntaxTree || dumpSource) {
			// If only dumping information, no need to execute the program
			return;
		}
		ExecutionResult result = llm.execute(program, executeOptions);
		if (!result.getValue().equals(Value.VOID)) {
			out.println(result.getValue().toDisplayString());
		}
		if (printStats) {
			out.print(result.getStats().toDescriptionString());
		}
	}

	/**
	 * Reads programs from the input stream until {@code exit}, {@code quit} or
	 * the end of input. Input continues on the next line while braces are
	 * open. Declarations persist from one input to the next; errors are
	 * printed and the session goes on.
	 */
	private void repl() throws IOException {
		Engine engine = new Engine(executeOptions);
		BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		StringBuilder pending = new StringBuilder();
		out.println("LLM.lang interactive session. Type 'help' for help, 'exit' to quit.");
		out.print("llm> ");
		out.flush();
		String line;
		while ((line = reader.readLine()) != null) {
			String command = line.trim();
			if (pending.length() == 0 && ("exit".equals(command) || "quit".equals(command))) {
				return;
			}
			if (pending.length() == 0 && "help".equals(command)) {
				replHelp(out);
			} else if (pending.length() > 0 || !command.isEmpty()) {
				pending.append(line).append('\n');
				if (braceDepth(pending) <= 0) {
					evaluate(engine, pending.toString());
					pending.setLength(0);
				}
			}
			out.print(pending.length() == 0 ? "llm> " : "...> ");
			out.flush();
		}
		out.println();
	}

	private void evaluate(Engine engine, String source) {
		try {
			Node program = Parser.parse(source, DESCRIPTION_REPL);
			Value value = engine.execute(program);
			if (!value.equals(Value.VOID)) {
				out.println(value.toDisplayString());
			}
		} catch (LlmException e) {
			err.println(e.toDisplayString());
		}
	}

	/**
	 * @return opened minus closed braces, ignoring those in string literals
	 */
	static int braceDepth(CharSequence source) {
		int depth = 0;
		boolean inString = false;
		for (int i = 0; i < source.length(); i++) {
			char c = source.charAt(i);
			if (inString) {
				if (c == '\\') {
					i++;
				} else if (c == '"') {
					inString = false;
				}
			} else if (c == '"') {
				inString = true;
			} else if (c == '{') {
				depth++;
			} else if (c == '}') {
				depth--;
			}
		}
		return depth;
	}

	private static void replHelp(PrintStream dest) {
		dest.println("Type LLM.lang statements; a statement spanning several lines");
		dest.println("continues until its braces are closed.");
		dest.println(" help = This help screen.");
		dest.println(" exit, quit = End the session.");
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
								" [-d|--debug]" +
								" [-m|--memory-limit MB]" +
								" [-t|--time-limit SECONDS]" +
								" [--no-parallel]" +
								" [--no-vectors]" +
								" [--no-nlp]" +
								" [--no-modify]" +
								" [-s|--stats]" +
								" [-c|--compile]" +
								" [-O level]" +
								" [--target name]" +
								" [--debug-info]" +
								" [--dump-syntax]" +
								" [--dump-source]" +
								" (-e script | program-filename)");
		dest.println();
		dest.println("java -jar " + JAR_NAME + " -i|--interactive");
		dest.println("java -jar " + JAR_NAME + " --list-functions");
		dest.println();
		dest.println(" -e script = Run the program given on the command line.");
		dest.println(" -d, --debug = Log execution details at debug level.");
		dest.println(" -m, --memory-limit MB = Fail when the program uses more memory.");
		dest.println(" -t, --time-limit SECONDS = Fail when the program runs longer.");
		dest.println(" --no-parallel = Disable parallel statements.");
		dest.println(" --no-vectors = Disable vector statements.");
		dest.println(" --no-nlp = Disable natural language features.");
		dest.println(" --no-modify = Disable self-modification.");
		dest.println(" -s, --stats = Print execution time, peak memory and instruction count.");
		dest.println();
		dest.println(" -c, --compile = Check the program and halt.");
		dest.println(" -O level = Optimization level, 0 to " + CompileOptions.MAX_OPTIMIZATION_LEVEL + ".");
		dest.println(" --target name = Compilation target.");
		dest.println(" --debug-info = Record debug information.");
		dest.println(" --dump-syntax = Print the syntax tree.");
		dest.println(" --dump-source = Print the program as regenerated from its syntax tree.");
		dest.println();
		dest.println(" -i, --interactive = Start an interactive session.");
		dest.println(" --list-functions = List the standard library functions.");
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
	 * @param is input stream for interactive sessions
	 * @param os output stream for program output
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws Exception if execution fails
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws Exception {
		Cli cli = new Cli(is, os, es);
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
		} catch (LlmException e) {
			if (e.getLineNumber() >= 0) {
				System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
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
}
