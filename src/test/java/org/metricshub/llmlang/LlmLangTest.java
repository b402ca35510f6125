package org.metricshub.llmlang;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.llmlang.LlmTestSupport.llmTest;

import java.util.function.Consumer;
import org.junit.Test;
import org.metricshub.llmlang.frontend.LexerException;
import org.metricshub.llmlang.frontend.ParserException;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.jrt.Value;
import org.metricshub.llmlang.semantic.SemanticException;
import org.metricshub.llmlang.util.CompileOptions;
import org.metricshub.llmlang.util.ExecuteOptions;

public class LlmLangTest {

	private static RuntimeErrorKind runtimeFailure(String source) {
		return runtimeFailure(source, options -> {});
	}

	private static RuntimeErrorKind runtimeFailure(String source, Consumer<ExecuteOptions> configurer) {
		ExecuteOptions options = new ExecuteOptions();
		configurer.accept(options);
		return assertThrows(LlmRuntimeException.class, () -> new LlmLang().execute(source, options)).getKind();
	}

	@Test
	public void testMainOfContextIsInvoked() {
		ExecutionResult result = new LlmLang().execute("context C { fn main() { var x = 1 + 2; return x; } }");
		assertEquals(Value.integer(3), result.getValue());
		assertTrue(result.getStats().getInstructions() > 0);
		assertTrue(result.getStats().getExecutionTime() >= 0);
	}

	@Test
	public void testGlobalMainWins() throws Exception {
		llmTest("global main")
				.script("context C { fn main() { return 1; } } fn main() { return 2; }")
				.expectValue(Value.integer(2))
				.runAndAssert();
	}

	@Test
	public void testValueOfLastItem() throws Exception {
		llmTest("last item").script("var a = 2; var b = a * 21; b;").expectValue(Value.integer(42)).runAndAssert();
		llmTest("declaration value").script("var s = \"x\";").expectValue(Value.string("x")).runAndAssert();
		llmTest("empty program").script("").expectValue(Value.VOID).runAndAssert();
	}

	@Test
	public void testIntegerBounds() throws Exception {
		llmTest("smallest int").script("-9223372036854775808;").expectValue(Value.integer(Long.MIN_VALUE)).runAndAssert();
		llmTest("compound with sum").script("var x = 2; x *= 1 + 2; x;").expectValue(Value.integer(6)).runAndAssert();
	}

	@Test
	public void testPrint() throws Exception {
		llmTest("print joins with spaces")
				.script("print(\"total:\", 1 + 1, 2.5, [1, 2], true);")
				.expectLines("total: 2 2.5 [1, 2] true")
				.runAndAssert();
	}

	@Test
	public void testRunCapturesOutput() {
		assertEquals("hello\n".replace("\n", System.lineSeparator()), new LlmLang().run("print(\"hello\");"));
	}

	@Test
	public void testReturnEndsTheFunction() throws Exception {
		llmTest("return from loop")
				.script("fn find() { for (i in [1, 2, 3]) { if (i == 2) { return i * 10; } } return 0; } find();")
				.expectValue(Value.integer(20))
				.runAndAssert();
		llmTest("implicit value").script("fn f() { 5; } f();").expectValue(Value.integer(5)).runAndAssert();
	}

	@Test
	public void testWhen() throws Exception {
		String describe = "fn describe(n: Int) { when (n) { 1 => { return \"one\"; } 2 => { return \"two\"; } "
				+ "otherwise => { return \"many\"; } } } ";
		llmTest("when match").script(describe + "describe(2);").expectValue(Value.string("two")).runAndAssert();
		llmTest("when otherwise").script(describe + "describe(7);").expectValue(Value.string("many")).runAndAssert();
	}

	@Test
	public void testForAccumulates() throws Exception {
		llmTest("for loop")
				.script("var total = 0; for (n in range(1, 5)) { total += n; } total;")
				.expectValue(Value.integer(10))
				.runAndAssert();
	}

	@Test
	public void testRecursion() throws Exception {
		llmTest("factorial")
				.script("fn fact(n: Int) -> Int { if (n <= 1) { return 1; } return n * fact(n - 1); } fact(10);")
				.expectValue(Value.integer(3628800))
				.runAndAssert();
	}

	@Test
	public void testFunctionsAreHoisted() throws Exception {
		llmTest("hoisting")
				.script("var r = helper(); fn helper() { return 7; } r;")
				.expectValue(Value.integer(7))
				.runAndAssert();
	}

	@Test
	public void testHigherOrderFunctions() throws Exception {
		llmTest("map filter reduce")
				.script("fn double(x: Int) { return x * 2; } fn big(x: Int) { return x > 2; } "
						+ "fn add(a: Int, b: Int) { return a + b; } "
						+ "reduce(filter(map([1, 2, 3], double), big), add, 0);")
				.expectValue(Value.integer(10))
				.runAndAssert();
	}

	@Test
	public void testContextMembers() throws Exception {
		String shop = "context Shop { var price = 3; fn total(n: Int) { return n * price; } } "
				+ "var shop = switchContext(\"Shop\"); ";
		llmTest("context call").script(shop + "shop.total(2);").expectValue(Value.integer(6)).runAndAssert();
		llmTest("context variable").script(shop + "shop.price;").expectValue(Value.integer(3)).runAndAssert();
	}

	@Test
	public void testWithAndWithin() throws Exception {
		llmTest("with then within")
				.script("with context \"Work\" { var task = \"write\"; } within \"Work\" { print(task, currentContext()); }")
				.expectLines("write <context Work>")
				.runAndAssert();
	}

	@Test
	public void testMapProperties() throws Exception {
		llmTest("map property assignment")
				.script("var m = mapOf(\"a\", 1); m.a = 2; m.b = 3; print(m); m.a;")
				.expectLines("{a: 2, b: 3}")
				.expectValue(Value.integer(2))
				.runAndAssert();
	}

	@Test
	public void testParallelAll() throws Exception {
		llmTest("parallel all")
				.script("parallel { a: { 1; } b: { 2; } } select all;")
				.expectValue(Value.list(Value.integer(1), Value.integer(2)))
				.runAndAssert();
	}

	@Test
	public void testParallelFastest() throws Exception {
		llmTest("parallel fastest")
				.script("parallel { slow: { for (i in range(0, 20000)) { i * 2; } \"slow\"; } quick: { \"quick\"; } } select fastest;")
				.expectValue(Value.string("quick"))
				.runAndAssert();
	}

	@Test
	public void testParallelBest() throws Exception {
		llmTest("first truthy")
				.script("parallel { a: { 0; } b: { \"yes\"; } c: { \"later\"; } } select best;")
				.expectValue(Value.string("yes"))
				.runAndAssert();
		llmTest("nothing truthy")
				.script("parallel { a: { 0; } b: { \"\"; } } select best;")
				.expectValue(Value.integer(0))
				.runAndAssert();
		llmTest("failed paths are skipped")
				.script("parallel { a: { 1 / 0; } b: { 5; } } select best;")
				.expectValue(Value.integer(5))
				.runAndAssert();
	}

	@Test
	public void testParallelPathsWorkOnSnapshots() throws Exception {
		llmTest("isolated paths")
				.script("var x = 1; parallel { a: { x = 2; } b: { x = 3; } } select all; x;")
				.expectValue(Value.integer(1))
				.runAndAssert();
	}

	@Test
	public void testParallelFailures() {
		assertEquals(RuntimeErrorKind.DIVISION_BY_ZERO, runtimeFailure("parallel { a: { 1 / 0; } b: { 1; } } select all;"));
		assertEquals(RuntimeErrorKind.DIVISION_BY_ZERO, runtimeFailure("parallel { a: { 1 / 0; } } select fastest;"));
		assertEquals(
				RuntimeErrorKind.FEATURE_DISABLED,
				runtimeFailure("parallel { a: { 1; } } select all;", options -> options.setParallel(false)));
	}

	@Test
	public void testSemanticMemory() throws Exception {
		llmTest("recall by key")
				.script("@remember city = \"Paris\"; @remember country = \"France\"; @recall(\"city\");")
				.expectValue(Value.string("Paris"))
				.runAndAssert();
		llmTest("recall most recent")
				.script("@remember a = 1; @remember b = 2; @recall;")
				.expectValue(Value.integer(2))
				.runAndAssert();
		assertEquals(RuntimeErrorKind.MEMORY_NOT_FOUND, runtimeFailure("@recall(\"nothing\");"));
		assertEquals(RuntimeErrorKind.MEMORY_NOT_FOUND, runtimeFailure("@recall;"));
	}

	@Test
	public void testVectors() throws Exception {
		llmTest("vector statement")
				.script("vector v = \"hello\"; apply v to { length(currentVector()); }")
				.expectValue(Value.integer(10))
				.runAndAssert();
		llmTest("nearest")
				.script("var q = embed(\"a\"); nearest(q, [embed(\"abcdefghij\"), embed(\"a\")], 1);")
				.expectValue(Value.list(Value.integer(1)))
				.runAndAssert();
		assertEquals(
				RuntimeErrorKind.FEATURE_DISABLED,
				runtimeFailure("vector v = \"x\";", options -> options.setVectors(false)));
		assertEquals(RuntimeErrorKind.INVALID_TYPE, runtimeFailure("apply 1 to { 1; }"));
	}

	@Test
	public void testNaturalLanguage() throws Exception {
		llmTest("natural language block").script("#\"find users\"#;").expectValue(Value.string("find users")).runAndAssert();
		llmTest("intent").script("intent: \"book a flight\";").expectValue(Value.string("book a flight")).runAndAssert();
		llmTest("entities")
				.script("extractEntities(\"Alice met Bob in Paris\");")
				.expectValue(Value.list(Value.string("Alice"), Value.string("Bob"), Value.string("Paris")))
				.runAndAssert();
		assertEquals(
				RuntimeErrorKind.FEATURE_DISABLED,
				runtimeFailure("intent: \"x\";", options -> options.setNlp(false)));
	}

	@Test
	public void testSelfModificationOfTheRunningProgram() throws Exception {
		llmTest("modify yields void")
				.script("@modify(target: \"<command-line>\", operation: \"delete\", path: \"0\");")
				.expectValue(Value.VOID)
				.runAndAssert();
		assertEquals(
				RuntimeErrorKind.MODIFICATION_FAILED,
				runtimeFailure("@modify(target: \"<command-line>\", operation: \"delete\", path: \"9\");"));
		assertEquals(
				RuntimeErrorKind.FEATURE_DISABLED,
				runtimeFailure(
						"@modify(target: \"<command-line>\", operation: \"delete\", path: \"0\");",
						options -> options.setSelfModifying(false)));
	}

	@Test
	public void testRuntimeErrors() {
		assertEquals(RuntimeErrorKind.DIVISION_BY_ZERO, runtimeFailure("var zero = 0; 10 / zero;"));
		assertEquals(RuntimeErrorKind.INVALID_OPERATION, runtimeFailure("\"a\" - 1;"));
		assertEquals(RuntimeErrorKind.INVALID_TYPE, runtimeFailure("for (c in \"abc\") { c; }"));
		assertEquals(RuntimeErrorKind.UNDEFINED_PROPERTY, runtimeFailure("var m = mapOf(); m.missing;"));
		assertEquals(RuntimeErrorKind.NOT_CALLABLE, runtimeFailure("var n = 1; n();"));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT, runtimeFailure("parseInt(\"twelve\");"));
	}

	@Test
	public void testArityIsCheckedAtRuntimeForFunctionValues() {
		LlmRuntimeException e = assertThrows(
				LlmRuntimeException.class,
				() -> new LlmLang().execute("fn add(a: Int, b: Int) { return a + b; } var g = add; g(1);"));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT_COUNT, e.getKind());
		assertEquals(2, e.getExpected());
		assertEquals(1, e.getActual());
		assertEquals(1, e.getLineNumber());
	}

	@Test
	public void testCallDepthLimit() {
		assertEquals(
				RuntimeErrorKind.STACK_OVERFLOW,
				runtimeFailure("fn down(n: Int) { return down(n + 1); } down(0);", options -> options.setMaxCallDepth(50)));
	}

	@Test
	public void testMemoryLimit() {
		LlmRuntimeException e = assertThrows(LlmRuntimeException.class, () -> {
			ExecuteOptions options = new ExecuteOptions();
			options.setMaxMemory(16L);
			new LlmLang().execute("var s = \"abcdefghijklmnopqrstuvwxyz\"; s;", options);
		});
		assertEquals(RuntimeErrorKind.MEMORY_LIMIT_EXCEEDED, e.getKind());
		assertEquals(16, e.getExpected());
		assertTrue(e.getActual() > 16);
	}

	@Test
	public void testTimeLimit() {
		assertEquals(
				RuntimeErrorKind.TIME_LIMIT_EXCEEDED,
				runtimeFailure(
						"for (i in range(0, 100000)) { for (j in range(0, 100000)) { i + j; } }",
						options -> options.setMaxTime(50L)));
	}

	@Test
	public void testErrorsOfEachStage() {
		assertThrows(LexerException.class, () -> new LlmLang().execute("var s = \"open"));
		assertThrows(ParserException.class, () -> new LlmLang().execute("var = 1;"));
		assertThrows(SemanticException.class, () -> new LlmLang().execute("print(nobody);"));
	}

	@Test
	public void testErrorDisplayCarriesTheLocation() {
		LlmRuntimeException e = assertThrows(LlmRuntimeException.class, () -> new LlmLang().execute("\nvar z = 1 / 0;"));
		assertEquals(2, e.getLineNumber());
		assertTrue(e.toDisplayString(), e.toDisplayString().startsWith("Runtime error: Division by zero at <command-line>:2:"));
	}

	@Test
	public void testCompileOnly() {
		LlmLang llm = new LlmLang();
		CompileOptions options = new CompileOptions();
		options.setOptimizationLevel(1);
		CompiledProgram program = llm.compile("fn main() { return 1; }", options);
		assertEquals("fn main() { return 1; }", program.getSource());
		assertNotNull(llm.getLastAst());
		assertEquals(Value.integer(1), llm.execute(program, new ExecuteOptions()).getValue());
		assertEquals(Value.integer(1), llm.execute(program, new ExecuteOptions()).getValue());
	}

	@Test
	public void testEval() {
		assertEquals(Value.floating(0.5), new LlmLang().eval("1 / 2.0;"));
	}
}
