package org.metricshub.llmlang.semantic;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;
import org.metricshub.llmlang.frontend.Parser;
import org.metricshub.llmlang.frontend.SourceSpan;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.frontend.ast.NodeKind;

public class SemanticAnalyzerTest {

	private static Node analyze(String source) {
		return new SemanticAnalyzer().analyze(Parser.parse(source, "test.llm"));
	}

	private static SemanticException.Kind failure(String source) {
		return assertThrows(SemanticException.class, () -> analyze(source)).getKind();
	}

	@Test
	public void testValidProgramIsReturnedUnchanged() {
		Node program = Parser.parse("context C { fn main() { var x = 1 + 2; return x; } }", "test.llm");
		Node copy = program.deepCopy();
		assertSame(program, new SemanticAnalyzer().analyze(program));
		assertEquals(copy, program);
	}

	@Test
	public void testRedefinitions() {
		assertEquals(SemanticException.Kind.REDEFINED_VARIABLE, failure("var x = 1; var x = 2;"));
		assertEquals(SemanticException.Kind.REDEFINED_FUNCTION, failure("fn f() { } fn f() { }"));
		assertEquals(SemanticException.Kind.REDEFINED_CONTEXT, failure("context A { } context A { }"));
		assertEquals(SemanticException.Kind.REDEFINED_VARIABLE, failure("fn f(a: Int, a: Int) { }"));
	}

	@Test
	public void testStandardLibraryNamesCannotBeRedefined() {
		assertEquals(SemanticException.Kind.REDEFINED_FUNCTION, failure("fn print(x: String) { }"));
	}

	@Test
	public void testShadowingInNestedScopesIsAllowed() {
		analyze("var x = 1; fn f(x: Int) { var y = x; { var y = 2; } return y; }");
		analyze("var x = 1; if (x > 0) { var x = 2; }");
	}

	@Test
	public void testUndefinedNames() {
		assertEquals(SemanticException.Kind.UNDEFINED_VARIABLE, failure("print(y);"));
		assertEquals(SemanticException.Kind.UNDEFINED_FUNCTION, failure("nothing(1);"));
		assertEquals(SemanticException.Kind.UNDEFINED_CONTEXT, failure("within \"Nowhere\" { 1; }"));
		assertEquals(SemanticException.Kind.UNDEFINED_VARIABLE, failure("y = 3;"));
	}

	@Test
	public void testBlockVariablesDoNotLeak() {
		assertEquals(SemanticException.Kind.UNDEFINED_VARIABLE, failure("if (true) { var inner = 1; } inner;"));
		assertEquals(SemanticException.Kind.UNDEFINED_VARIABLE, failure("for (i in [1]) { } i;"));
	}

	@Test
	public void testFunctionsAreHoisted() {
		analyze("fn a() { return b(); } fn b() { return 1; } a();");
		analyze("context C { fn first() { return second(); } fn second() { return 2; } }");
	}

	@Test
	public void testFunctionBodiesSeeLaterTopLevelVariables() {
		analyze("fn show() { print(greeting); } var greeting = \"hi\"; show();");
	}

	@Test
	public void testArityIsChecked() {
		SemanticException e = assertThrows(
				SemanticException.class,
				() -> analyze("fn add(a: Int, b: Int) { return a + b; } add(1);"));
		assertEquals(SemanticException.Kind.INVALID_ARGUMENT_COUNT, e.getKind());
		assertEquals(2, e.getExpected());
		assertEquals(1, e.getActual());
		assertEquals(1, e.getLineNumber());
	}

	@Test
	public void testBuiltinArity() {
		assertEquals(SemanticException.Kind.INVALID_ARGUMENT_COUNT, failure("length(\"a\", \"b\");"));
		assertEquals(SemanticException.Kind.INVALID_ARGUMENT_COUNT, failure("print();"));
		analyze("print(1, 2, 3);");
	}

	@Test
	public void testReturnOutsideFunction() {
		assertEquals(SemanticException.Kind.RETURN_OUTSIDE_FUNCTION, failure("return 1;"));
		assertEquals(SemanticException.Kind.RETURN_OUTSIDE_FUNCTION, failure("if (true) { return 1; }"));
		analyze("fn f() { if (true) { return 1; } return 2; }");
	}

	@Test
	public void testParallelStrategy() {
		analyze("parallel { a: { 1; } } select all;");
		analyze("parallel { a: { 1; } } select best;");
		assertEquals(SemanticException.Kind.INVALID_STRATEGY, failure("parallel { a: { 1; } } select cheapest;"));
		assertEquals(SemanticException.Kind.NO_PATHS, failure("parallel { } select all;"));
	}

	@Test
	public void testSemanticTokenMustStartWithAt() {
		Node program = new Node(NodeKind.PROGRAM, SourceSpan.UNKNOWN);
		program.addChild(new Node(NodeKind.SEMANTIC, SourceSpan.UNKNOWN).setAttribute("token", "recall"));
		SemanticException e = assertThrows(SemanticException.class, () -> new SemanticAnalyzer().analyze(program));
		assertEquals(SemanticException.Kind.INVALID_SEMANTIC_TOKEN, e.getKind());
	}

	@Test
	public void testAssignmentTargets() {
		analyze("var m = mapOf(\"a\", 1); m.a = 2;");
		assertEquals(SemanticException.Kind.INVALID_ASSIGNMENT_TARGET, failure("1 = 2;"));
		assertEquals(SemanticException.Kind.INVALID_ASSIGNMENT_TARGET, failure("fn f() { } f = 1;"));
	}

	@Test
	public void testLiteralTypes() {
		analyze("var f: Float = 1;");
		analyze("var s: ~Name~ = 1;");
		assertEquals(SemanticException.Kind.INVALID_TYPE, failure("var i: Int = \"one\";"));
		assertEquals(SemanticException.Kind.INVALID_TYPE, failure("var b: Bool = 1.5;"));
	}

	@Test
	public void testWithDeclaresContext() {
		analyze("with context \"Work\" { var task = 1; } within \"Work\" { print(task); }");
		assertEquals(
				SemanticException.Kind.UNDEFINED_VARIABLE,
				failure("with context \"Work\" { var task = 1; } print(task);"));
	}

	@Test
	public void testContextMembersAreScoped() {
		analyze("context Shop { var price = 3; fn total(n: Int) { return n * price; } }");
		assertEquals(
				SemanticException.Kind.UNDEFINED_VARIABLE,
				failure("context Shop { var price = 3; } print(price);"));
	}

	@Test
	public void testDeclarationsOnlyAtTopLevel() {
		Node program = Parser.parse("fn outer() { 1; }", "test.llm");
		Node body = program.getChild(0).getChild(0);
		body.addChild(Parser.parse("fn inner() { }", "test.llm").getChild(0));
		SemanticException e = assertThrows(SemanticException.class, () -> new SemanticAnalyzer().analyze(program));
		assertEquals(SemanticException.Kind.MALFORMED_NODE, e.getKind());
	}

	@Test
	public void testErrorDisplay() {
		SemanticException e = assertThrows(SemanticException.class, () -> analyze("\n\nprint(missing);"));
		assertEquals(3, e.getLineNumber());
		assertTrue(e.toDisplayString().startsWith("Semantic error: Undefined variable: 'missing'"));
	}

	@Test
	public void testScopesAreRecorded() {
		SemanticAnalyzer analyzer = new SemanticAnalyzer();
		analyzer.analyze(Parser.parse("context A { fn f() { { 1; } } }", "test.llm"));
		ScopeArena scopes = analyzer.getScopes();
		assertEquals(ScopeArena.ROOT, scopes.getCurrent());
		assertTrue(scopes.size() >= 4);
	}
}
