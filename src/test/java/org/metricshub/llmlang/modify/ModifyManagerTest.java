package org.metricshub.llmlang.modify;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import org.junit.Test;
import org.metricshub.llmlang.LlmLang;
import org.metricshub.llmlang.frontend.Parser;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.frontend.ast.NodeKind;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.jrt.Value;
import org.metricshub.llmlang.util.ExecuteOptions;
import org.metricshub.llmlang.util.ScriptFileSource;

public class ModifyManagerTest {

	private static Node parse(String source) {
		return Parser.parse(source, "test.llm");
	}

	private static File script(String content) throws Exception {
		File file = File.createTempFile("llmlang", ModifyManager.SCRIPT_EXTENSION);
		file.deleteOnExit();
		Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	@Test
	public void testParsePath() {
		assertEquals(Arrays.asList(0, 12, 3), Modification.parsePath("0.12.3"));
		assertTrue(Modification.parsePath("").isEmpty());
		assertTrue(Modification.parsePath(null).isEmpty());
		for (String invalid : new String[] { "0..1", "-1", "a", "1." }) {
			LlmRuntimeException e = assertThrows(LlmRuntimeException.class, () -> Modification.parsePath(invalid));
			assertEquals(RuntimeErrorKind.MODIFICATION_FAILED, e.getKind());
		}
	}

	@Test
	public void testFromAttributes() {
		Map<String, String> attributes = new HashMap<String, String>();
		attributes.put("operation", "insert");
		attributes.put("path", "0.0");
		attributes.put("position", "1");
		attributes.put("code", "print(1);");
		Modification insert = Modification.fromAttributes(attributes);
		assertEquals(Modification.Type.INSERT, insert.getType());
		assertEquals(Arrays.asList(0, 0), insert.getPath());
		assertEquals(1, insert.getPosition());
		assertEquals("expression statements yield their expression", NodeKind.CALL, insert.getNode().getKind());

		attributes.put("operation", "replace");
		attributes.put("code", "var a = 1; var b = 2;");
		assertEquals("several items stay a program", NodeKind.PROGRAM, Modification.fromAttributes(attributes).getNode().getKind());

		attributes.put("code", "var = ;");
		assertEquals(
				RuntimeErrorKind.MODIFICATION_FAILED,
				assertThrows(LlmRuntimeException.class, () -> Modification.fromAttributes(attributes)).getKind());

		attributes.put("operation", "rename");
		assertThrows(LlmRuntimeException.class, () -> Modification.fromAttributes(attributes));
	}

	@Test
	public void testEditorOperations() {
		Node program = parse("var a = 1; var b = 2;");
		AstEditor.apply(program, Modification.insert(Collections.<Integer>emptyList(), 2, parse("var c = 3;").getChild(0)));
		assertEquals(3, program.getChildCount());
		AstEditor.apply(program, Modification.delete(Arrays.asList(0)));
		assertEquals("b", program.getChild(0).getAttribute("name"));
		AstEditor.apply(program, Modification.replace(Arrays.asList(0, 0), parse("42;").getChild(0).getChild(0)));
		assertEquals("var b = 42;\nvar c = 3;\n", SourceGenerator.generate(program));

		Node replacement = parse("1;");
		Node newRoot = AstEditor.apply(program, Modification.replace(Collections.<Integer>emptyList(), replacement));
		assertEquals(replacement, newRoot);
		assertNotSame("replacing the root yields a copy", replacement, newRoot);
	}

	@Test
	public void testAttributeModificationIsIdempotent() {
		Node once = parse("fn f() { 1; }");
		Modification rename = Modification.modifyAttribute(Arrays.asList(0), "name", "g");
		AstEditor.apply(once, rename);
		Node twice = once.deepCopy();
		AstEditor.applyAll(twice, Arrays.asList(rename, rename));
		assertEquals(once, twice);
		assertEquals("g", twice.getChild(0).getAttribute("name"));
	}

	@Test
	public void testEditorFailures() {
		Node program = parse("var a = 1;");
		for (Modification invalid : Arrays
				.asList(
						Modification.delete(Collections.<Integer>emptyList()),
						Modification.delete(Arrays.asList(5)),
						Modification.modifyAttribute(Arrays.asList(0, 3), "name", "x"),
						Modification.insert(Arrays.asList(0), 4, parse("1;").getChild(0)))) {
			LlmRuntimeException e = assertThrows(LlmRuntimeException.class, () -> AstEditor.apply(program, invalid));
			assertEquals(RuntimeErrorKind.MODIFICATION_FAILED, e.getKind());
		}
		assertEquals("failed edits leave the tree alone", parse("var a = 1;"), program);
	}

	@Test
	public void testNegativeIndicesAreRejected() {
		Node program = parse("var a = 1;");
		for (Modification invalid : Arrays
				.asList(
						Modification.delete(Arrays.asList(-1)),
						Modification.modifyAttribute(Arrays.asList(-1), "name", "x"),
						Modification.replace(Arrays.asList(0, -1), parse("2;").getChild(0).getChild(0)),
						Modification.insert(Collections.<Integer>emptyList(), -1, parse("var b = 2;").getChild(0)))) {
			LlmRuntimeException e = assertThrows(LlmRuntimeException.class, () -> AstEditor.apply(program, invalid));
			assertEquals(RuntimeErrorKind.MODIFICATION_FAILED, e.getKind());
		}
		assertEquals(parse("var a = 1;"), program);
	}

	@Test
	public void testSnippetReplacesAnExpression() {
		Node program = parse("var x = 1 + 2;");
		AstEditor.apply(program, Modification.replace(Arrays.asList(0, 0, 1), Modification.parseSnippet("5;")));
		String generated = SourceGenerator.generate(program);
		assertEquals("var x = 1 + 5;\n", generated);
		assertEquals(parse("var x = 1 + 5;"), parse(generated));
	}

	@Test
	public void testSnippetExpressionsBecomeStatementsInBlocks() {
		Node function = parse("fn f() { 1; }");
		AstEditor.apply(function, Modification.insert(Arrays.asList(0, 0), 1, Modification.parseSnippet("2;")));
		assertEquals(parse("fn f() { 1; 2; }"), function);

		Node program = parse("1; 2;");
		AstEditor.apply(program, Modification.replace(Arrays.asList(1), Modification.parseSnippet("print(3);")));
		assertEquals(parse("1; print(3);"), program);
		assertEquals(program, parse(SourceGenerator.generate(program)));
	}

	@Test
	public void testRewrittenFileKeepsItsMeaning() throws Exception {
		File file = script("var x = 2;\nx *= 1 + 2;\nx -= 4 - 1;\nx;\n");
		Value before = new LlmLang().execute(new ScriptFileSource(file.getPath()), new ExecuteOptions()).getValue();
		assertEquals(Value.integer(3), before);

		new ModifyManager().apply(file.getPath(), Modification.modifyAttribute(Arrays.asList(0), "name", "x"));
		String rewritten = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
		assertEquals("var x = 2;\nx = x * (1 + 2);\nx = x - (4 - 1);\nx;\n", rewritten);
		Value after = new LlmLang().execute(new ScriptFileSource(file.getPath()), new ExecuteOptions()).getValue();
		assertEquals(before, after);
	}

	@Test
	public void testManagerKeepsCopies() {
		ModifyManager manager = new ModifyManager();
		Node ast = parse("var a = 1;");
		manager.register("prog", "var a = 1;", ast);
		String source = manager.apply("prog", Modification.modifyAttribute(Arrays.asList(0), "name", "renamed"));
		assertEquals("var renamed = 1;\n", source);
		assertEquals(source, manager.getSource("prog"));
		assertEquals("a", ast.getChild(0).getAttribute("name"));
		assertEquals("renamed", manager.getAst("prog").getChild(0).getAttribute("name"));
		assertNull(manager.getAst("other"));
	}

	@Test
	public void testFailedModificationKeepsTheCache() {
		ModifyManager manager = new ModifyManager();
		manager.register("prog", "var a = 1;", parse("var a = 1;"));
		assertThrows(LlmRuntimeException.class, () -> manager.apply("prog", Modification.delete(Arrays.asList(3))));
		assertEquals(parse("var a = 1;"), manager.getAst("prog"));
		assertEquals("var a = 1;", manager.getSource("prog"));
	}

	@Test
	public void testSourceWithoutTreeIsParsedOnDemand() {
		ModifyManager manager = new ModifyManager();
		manager.register("lazy", "var a = 1; var b = 2;", null);
		assertEquals("var b = 2;\n", manager.apply("lazy", Modification.delete(Arrays.asList(0))));
	}

	@Test
	public void testUnknownTarget() {
		LlmRuntimeException e = assertThrows(
				LlmRuntimeException.class,
				() -> new ModifyManager().apply("/no/such/program.llm", Modification.delete(Arrays.asList(0))));
		assertEquals(RuntimeErrorKind.MODIFICATION_FAILED, e.getKind());
	}

	@Test
	public void testUnparsableTarget() throws Exception {
		File broken = script("var = ;");
		LlmRuntimeException e = assertThrows(
				LlmRuntimeException.class,
				() -> new ModifyManager().apply(broken.getPath(), Modification.delete(Arrays.asList(0))));
		assertEquals(RuntimeErrorKind.MODIFICATION_FAILED, e.getKind());
	}

	@Test
	public void testModifiedFileIsWrittenBack() throws Exception {
		File file = script("var a = 1;\nvar b = 2;\n");
		String rewritten = new ModifyManager().apply(file.getPath(), Modification.delete(Arrays.asList(0)));
		assertEquals("var b = 2;\n", rewritten);
		assertEquals(rewritten, new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8));
	}

	@Test
	public void testProgramModifiesItsOwnFile() throws Exception {
		File file = script("");
		String path = file.getPath().replace("\\", "\\\\");
		String program = "var answer = 41;\n"
				+ "@modify(target: \"" + path + "\", operation: \"modify\", path: \"0.0\", name: \"value\", value: \"42\");\n"
				+ "answer;\n";
		Files.write(file.toPath(), program.getBytes(StandardCharsets.UTF_8));

		Value value = new LlmLang().execute(new ScriptFileSource(file.getPath()), new ExecuteOptions()).getValue();
		assertEquals("the running program is not affected", Value.integer(41), value);

		String rewritten = new String(Files.readAllBytes(file.toPath()), StandardCharsets.UTF_8);
		assertTrue(rewritten, rewritten.startsWith("var answer = 42;\n@modify("));
		Value next = new LlmLang().execute(new ScriptFileSource(file.getPath()), new ExecuteOptions()).getValue();
		assertEquals(Value.integer(42), next);
	}
}
