package org.metricshub.llmlang.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;
import org.metricshub.llmlang.frontend.Parser;
import org.metricshub.llmlang.frontend.SourceSpan;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.frontend.ast.NodeKind;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.jrt.Value;
import org.metricshub.llmlang.modify.ModifyManager;
import org.metricshub.llmlang.util.ExecuteOptions;

public class EngineTest {

	private static Node parse(String source) {
		return Parser.parse(source, "engine.llm");
	}

	@Test
	public void testContextsAreRestoredAfterAFailure() {
		Engine engine = new Engine(new ExecuteOptions());
		LlmRuntimeException e = assertThrows(
				LlmRuntimeException.class,
				() -> engine.execute(parse("with context \"Work\" { var a = 1; } within \"Work\" { a / 0; }")));
		assertEquals(RuntimeErrorKind.DIVISION_BY_ZERO, e.getKind());
		assertEquals(ContextManager.GLOBAL, engine.getContextManager().getCurrentContextName());
		assertEquals(0, engine.getContextManager().getContextDepth());
		assertEquals(Value.integer(1), engine.getContextManager().getVariableIn("Work", "a"));
	}

	@Test
	public void testFramesArePoppedAfterAFailure() {
		Engine engine = new Engine(new ExecuteOptions());
		assertThrows(
				LlmRuntimeException.class,
				() -> engine.execute(parse("fn inner(n: Int) { return n / 0; } fn outer() { return inner(1); } outer();")));
		assertEquals(0, engine.getContextManager().getFrameDepth());
	}

	@Test
	public void testStatePersistsAcrossExecutions() {
		Engine engine = new Engine(new ExecuteOptions());
		engine.execute(parse("var counter = 1; fn bump() { counter = counter + 1; return counter; }"));
		assertEquals(Value.integer(2), engine.execute(parse("bump();")));
		assertEquals(Value.integer(3), engine.execute(parse("bump();")));
	}

	@Test
	public void testSemanticMemoryOfTheEngine() {
		Engine engine = new Engine(new ExecuteOptions());
		engine.execute(parse("@remember greeting = \"hi\";"));
		assertEquals(1, engine.getSemanticMemory().size());
		assertEquals(Value.string("hi"), engine.getSemanticMemory().recall("greeting"));
		assertTrue(engine.getPeakMemory() >= 0);
	}

	@Test
	public void testInstructionsAreCounted() {
		Engine engine = new Engine(new ExecuteOptions());
		engine.execute(parse("1 + 2;"));
		// statement, binary and two literals
		assertEquals(4, engine.getInstructionCount());
	}

	@Test
	public void testParallelPathsShareTheInstructionCounter() {
		Engine engine = new Engine(new ExecuteOptions());
		engine.execute(parse("parallel { a: { 1; } b: { 2; } } select all;"));
		// parallel, then block, statement and literal in each path
		assertEquals(7, engine.getInstructionCount());
	}

	@Test
	public void testPrintGoesToTheConfiguredStream() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ExecuteOptions options = new ExecuteOptions();
		try (PrintStream stream = new PrintStream(out, true, StandardCharsets.UTF_8.name())) {
			options.setOutputStream(stream);
			new Engine(options).execute(parse("print(\"out\", 1);"));
		}
		assertEquals("out 1", new String(out.toByteArray(), StandardCharsets.UTF_8).trim());
	}

	@Test
	public void testModifyUpdatesTheRegisteredSource() {
		ModifyManager manager = new ModifyManager();
		Engine engine = new Engine(new ExecuteOptions(), manager);
		String source = "var x = 1;\n@modify(target: \"self\", operation: \"modify\", path: \"0\", name: \"name\", value: \"y\");";
		Node program = parse(source);
		engine.registerSource("self", source, program);
		assertEquals(Value.VOID, engine.execute(program));
		assertEquals("y", manager.getAst("self").getChild(0).getAttribute("name"));
		assertTrue(manager.getSource("self").startsWith("var y = 1;"));
		assertEquals("the running tree is untouched", "x", program.getChild(0).getAttribute("name"));
	}

	@Test
	public void testMalformedTrees() {
		Engine engine = new Engine(new ExecuteOptions());
		LlmRuntimeException notAProgram = assertThrows(
				LlmRuntimeException.class,
				() -> engine.execute(new Node(NodeKind.BLOCK, SourceSpan.UNKNOWN)));
		assertEquals(RuntimeErrorKind.MALFORMED_NODE, notAProgram.getKind());

		Node program = new Node(NodeKind.PROGRAM, SourceSpan.UNKNOWN);
		program.addChild(new Node(NodeKind.LITERAL, SourceSpan.UNKNOWN).setAttribute("type", "Int"));
		LlmRuntimeException missingValue = assertThrows(LlmRuntimeException.class, () -> engine.execute(program));
		assertEquals(RuntimeErrorKind.MALFORMED_NODE, missingValue.getKind());

		Node badStrategy = parse("parallel { a: { 1; } } select cheapest;");
		LlmRuntimeException strategy = assertThrows(LlmRuntimeException.class, () -> engine.execute(badStrategy));
		assertEquals(RuntimeErrorKind.INVALID_STRATEGY, strategy.getKind());
	}

	@Test
	public void testUnknownContextAtRuntime() {
		Engine engine = new Engine(new ExecuteOptions());
		LlmRuntimeException e = assertThrows(
				LlmRuntimeException.class,
				() -> engine.execute(parse("within \"Nowhere\" { 1; }")));
		assertEquals(RuntimeErrorKind.UNDEFINED_CONTEXT, e.getKind());
		assertEquals(1, e.getLineNumber());
	}

	@Test
	public void testNoMainMeansVoid() {
		Engine engine = new Engine(new ExecuteOptions());
		assertEquals(Value.VOID, engine.execute(parse("fn helper() { return 1; }")));
		assertNull(engine.getContextManager().getFunction(Engine.MAIN_FUNCTION));
		assertEquals("helper", engine.getContextManager().getFunction("helper").getAttribute("name"));
	}
}
