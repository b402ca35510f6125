package org.metricshub.llmlang.backend;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.llmlang.frontend.Parser;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.jrt.Value;

public class ContextManagerTest {

	@Test
	public void testFramesShadowGlobals() {
		ContextManager contexts = new ContextManager();
		contexts.declareVariable("x", Value.integer(42));
		contexts.pushFrame();
		contexts.declareVariable("x", Value.integer(43));
		assertEquals(Value.integer(43), contexts.getVariable("x"));
		contexts.popFrame();
		assertEquals(Value.integer(42), contexts.getVariable("x"));
	}

	@Test
	public void testLookupFallsBackToGlobal() {
		ContextManager contexts = new ContextManager();
		contexts.declareVariable("shared", Value.string("g"));
		contexts.createContext("Work");
		contexts.enterContext("Work");
		contexts.declareVariable("local", Value.TRUE);
		assertEquals(Value.string("g"), contexts.getVariable("shared"));
		assertEquals(Value.TRUE, contexts.getVariable("local"));
		contexts.exitContext();
		assertNull(contexts.getVariable("local"));
		assertEquals(Value.TRUE, contexts.getVariableIn("Work", "local"));
	}

	@Test
	public void testAssignmentNeverCreatesBindings() {
		ContextManager contexts = new ContextManager();
		LlmRuntimeException e = assertThrows(
				LlmRuntimeException.class,
				() -> contexts.assignVariable("missing", Value.integer(1)));
		assertEquals(RuntimeErrorKind.UNDEFINED_VARIABLE, e.getKind());
		assertNull(contexts.getVariable("missing"));
	}

	@Test
	public void testGlobalIsReadOnlyFallback() {
		ContextManager contexts = new ContextManager();
		contexts.declareVariable("counter", Value.integer(1));
		contexts.createContext("Other");
		contexts.enterContext("Other");
		LlmRuntimeException e = assertThrows(
				LlmRuntimeException.class,
				() -> contexts.assignVariable("counter", Value.integer(2)));
		assertEquals(RuntimeErrorKind.UNDEFINED_VARIABLE, e.getKind());
		contexts.exitContext();
		assertEquals(Value.integer(1), contexts.getVariable("counter"));
	}

	@Test
	public void testAssignmentUpdatesInnermostBinding() {
		ContextManager contexts = new ContextManager();
		contexts.declareVariable("x", Value.integer(1));
		contexts.pushFrame();
		contexts.assignVariable("x", Value.integer(2));
		contexts.pushFrame();
		contexts.declareVariable("x", Value.integer(10));
		contexts.assignVariable("x", Value.integer(11));
		contexts.popFrame();
		contexts.popFrame();
		assertEquals(Value.integer(2), contexts.getVariable("x"));
	}

	@Test
	public void testContextStack() {
		ContextManager contexts = new ContextManager();
		assertEquals(ContextManager.GLOBAL, contexts.getCurrentContextName());
		assertTrue(contexts.createContext("A"));
		assertFalse(contexts.createContext("A"));
		contexts.createContext("B");
		contexts.enterContext("A");
		contexts.enterContext("B");
		assertEquals(2, contexts.getContextDepth());
		assertEquals("B", contexts.getCurrentContextName());
		contexts.exitContext();
		assertEquals("A", contexts.getCurrentContextName());
		contexts.exitContext();
		assertEquals(ContextManager.GLOBAL, contexts.getCurrentContextName());
		assertEquals(3, contexts.getContextNames().size());
	}

	@Test
	public void testEnteringUnknownContextFails() {
		ContextManager contexts = new ContextManager();
		LlmRuntimeException e = assertThrows(LlmRuntimeException.class, () -> contexts.enterContext("Nowhere"));
		assertEquals(RuntimeErrorKind.UNDEFINED_CONTEXT, e.getKind());
		assertEquals(0, contexts.getContextDepth());
	}

	@Test
	public void testFunctionsResolveInCurrentContextThenGlobal() {
		ContextManager contexts = new ContextManager();
		Node globalHelper = Parser.parse("fn helper() { 1; }", "test.llm").getChild(0);
		Node localHelper = Parser.parse("fn helper() { 2; }", "test.llm").getChild(0);
		contexts.registerFunction("helper", globalHelper);
		contexts.createContext("C");
		contexts.enterContext("C");
		assertSame(globalHelper, contexts.getFunction("helper"));
		contexts.registerFunction("helper", localHelper);
		assertSame(localHelper, contexts.getFunction("helper"));
		contexts.exitContext();
		assertSame(globalHelper, contexts.getFunction("helper"));
		assertSame(localHelper, contexts.getFunctionIn("C", "helper"));
		assertNull(contexts.getFunctionIn("Missing", "helper"));
	}

	@Test
	public void testSnapshotIsIndependent() {
		ContextManager contexts = new ContextManager();
		contexts.declareVariable("x", Value.integer(1));
		ContextManager copy = contexts.snapshot();
		copy.assignVariable("x", Value.integer(2));
		copy.declareVariable("y", Value.integer(3));
		copy.createContext("New");
		assertEquals(Value.integer(1), contexts.getVariable("x"));
		assertNull(contexts.getVariable("y"));
		assertFalse(contexts.hasContext("New"));
		assertEquals(Value.integer(2), copy.getVariable("x"));
	}

	@Test
	public void testApproximateSizeFollowsBindings() {
		ContextManager contexts = new ContextManager();
		assertEquals(0, contexts.getApproximateSize());
		contexts.declareVariable("s", Value.string("abcd"));
		assertEquals(5, contexts.getApproximateSize());
		contexts.assignVariable("s", Value.string("ab"));
		assertEquals(3, contexts.getApproximateSize());
		contexts.pushFrame();
		contexts.declareVariable("n", Value.integer(7));
		assertEquals(12, contexts.getApproximateSize());
		contexts.popFrame();
		assertEquals(3, contexts.getApproximateSize());
		assertEquals(0, contexts.getFrameDepth());
	}
}
