package org.metricshub.llmlang.ext;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.llmlang.LlmLang;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.NaturalLanguage;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.jrt.Value;

public class StandardLibraryTest {

	/**
	 * Environment that only knows native functions.
	 */
	private static final class NativeOnlyEnvironment implements NativeEnvironment {
		private final ByteArrayOutputStream out = new ByteArrayOutputStream();
		private final PrintStream printStream = new PrintStream(out, true);

		@Override
		public PrintStream getOutput() {
			return printStream;
		}

		@Override
		public String getCurrentContextName() {
			return "Test";
		}

		@Override
		public Value getCurrentVector() {
			return Value.VOID;
		}

		@Override
		public Value call(Value function, List<Value> arguments) {
			return StandardLibrary.resolve(function.getName()).invoke(arguments, this, null);
		}

		String printed() {
			return new String(out.toByteArray(), StandardCharsets.UTF_8);
		}
	}

	private final NativeOnlyEnvironment environment = new NativeOnlyEnvironment();

	private Value call(String name, Value... arguments) {
		NativeFunction function = StandardLibrary.resolve(name);
		if (function == null) {
			throw new AssertionError("No function " + name);
		}
		return function.invoke(Arrays.asList(arguments), environment, null);
	}

	private RuntimeErrorKind failure(String name, Value... arguments) {
		return assertThrows(LlmRuntimeException.class, () -> call(name, arguments)).getKind();
	}

	@Test
	public void testRegistry() {
		assertTrue(StandardLibrary.isDefined("print"));
		assertFalse(StandardLibrary.isDefined("Print"));
		assertNull(StandardLibrary.resolve(null));
		assertEquals("print/1..*", StandardLibrary.resolve("print").toString());
		assertEquals("length/1", StandardLibrary.resolve("length").toString());
		List<String> names = Arrays.asList(StandardLibrary.listFunctions().keySet().toArray(new String[0]));
		assertTrue(names.containsAll(Arrays.asList("append", "classify", "currentContext", "embed", "format", "range")));
		assertThrows(UnsupportedOperationException.class, () -> StandardLibrary.listFunctions().clear());
	}

	@Test
	public void testPrint() {
		call("print", Value.string("a"), Value.integer(1), Value.list(Value.TRUE));
		assertEquals("a 1 [true]", environment.printed().trim());
	}

	@Test
	public void testArity() {
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT_COUNT, failure("print"));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT_COUNT, failure("length"));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT_COUNT, failure("trim", Value.string("a"), Value.string("b")));
		assertThrows(IllegalArgumentException.class, () -> new NativeFunction("bad", 2, 1, (args, env) -> Value.VOID));
	}

	@Test
	public void testConversions() {
		assertEquals(Value.string("[1, 2]"), call("toString", Value.list(Value.integer(1), Value.integer(2))));
		assertEquals(Value.integer(12), call("parseInt", Value.string(" 12 ")));
		assertEquals(Value.floating(0.25), call("parseFloat", Value.string("0.25")));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT, failure("parseInt", Value.string("1.5")));
		assertEquals(Value.string("3 items at 2.50"), call("format", Value.string("%d items at %.2f"), Value.integer(3), Value.floating(2.5)));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT, failure("format", Value.string("%d"), Value.string("x")));
	}

	@Test
	public void testCollections() {
		Value list = Value.list(Value.integer(1), Value.integer(2));
		assertEquals(Value.integer(2), call("length", list));
		assertEquals(Value.integer(3), call("length", Value.string("abc")));
		assertEquals(Value.TRUE, call("isEmpty", Value.list()));
		assertEquals(Value.TRUE, call("contains", list, Value.integer(2)));
		assertEquals(Value.TRUE, call("contains", Value.string("hello"), Value.string("ell")));
		assertEquals(Value.integer(2), call("get", list, Value.integer(1)));
		assertEquals(Value.string("b"), call("get", Value.string("abc"), Value.integer(1)));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT, failure("get", list, Value.integer(2)));
		assertEquals(Value.list(Value.integer(1), Value.integer(2), Value.integer(3)), call("append", list, Value.integer(3)));
		assertEquals("the original list is unchanged", Value.integer(2), call("length", list));
		assertEquals(Value.list(Value.integer(2), Value.integer(3), Value.integer(4)), call("range", Value.integer(2), Value.integer(5)));
		assertEquals(Value.list(), call("range", Value.integer(5), Value.integer(2)));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT, failure("length", Value.integer(3)));
	}

	@Test
	public void testMaps() {
		Value map = call("mapOf", Value.string("a"), Value.integer(1), Value.string("b"), Value.integer(2));
		assertEquals(Value.list(Value.string("a"), Value.string("b")), call("keys", map));
		assertEquals(Value.integer(1), call("get", map, Value.string("a")));
		assertEquals(RuntimeErrorKind.UNDEFINED_PROPERTY, failure("get", map, Value.string("z")));
		Value updated = call("put", map, Value.string("c"), Value.integer(3));
		assertEquals(Value.integer(3), call("length", updated));
		assertEquals(Value.TRUE, call("contains", updated, Value.string("c")));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT, failure("mapOf", Value.string("odd")));
	}

	@Test
	public void testHigherOrderWithNativeFunctions() {
		Value words = Value.list(Value.string(" a "), Value.string("b "));
		assertEquals(Value.list(Value.string("a"), Value.string("b")), call("map", words, Value.function("trim")));
		assertEquals(
				Value.list(Value.string("x")),
				call("filter", Value.list(Value.string(""), Value.string("x")), Value.function("trim")));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT, failure("map", words, Value.string("trim")));
	}

	@Test
	public void testStrings() {
		assertEquals(Value.string("ell"), call("substring", Value.string("hello"), Value.integer(1), Value.integer(4)));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT, failure("substring", Value.string("hi"), Value.integer(1), Value.integer(5)));
		assertEquals(Value.integer(-1), call("indexOf", Value.string("hello"), Value.string("z")));
		assertEquals(Value.string("HI"), call("toUpperCase", Value.string("hi")));
		assertEquals(Value.string("hi"), call("toLowerCase", Value.string("HI")));
	}

	@Test
	public void testVectors() {
		Value a = call("embed", Value.string("a"));
		assertEquals(10, a.getDimensions());
		assertEquals(1.0, call("similarity", a, a).asDouble(), 1e-9);
		assertEquals(0.0, call("similarity", a, Value.vector(new double[10])).asDouble(), 0.0);
		assertEquals(RuntimeErrorKind.INVALID_OPERATION, failure("similarity", a, Value.vector(new double[2])));
		assertEquals(Value.VOID, call("currentVector"));
	}

	@Test
	public void testNaturalLanguage() {
		assertEquals(
				Value.string("sports"),
				call("classify", Value.string("The match and the sports news"), Value.list(Value.string("politics"), Value.string("sports"))));
		assertEquals(
				Value.string("one two three four five six seven eight nine ten..."),
				call("summarize", Value.string("one two three four five six seven eight nine ten eleven")));
		assertEquals(Value.string("short text"), call("summarize", Value.string("  short   text ")));
		assertEquals(Value.string("bonjour"), call("translate", Value.string("bonjour"), Value.string("en")));
		assertEquals(Value.string("prompt"), call("generate", Value.string("prompt")));
		assertEquals(
				Value.string("Paris is the capital of France."),
				call("answer", Value.string("What is the capital of France?"), Value.string("Rome is old. Paris is the capital of France.")));
		assertEquals(Value.string(NaturalLanguage.UNKNOWN_ANSWER), call("answer", Value.string("why?"), Value.string("Nothing here.")));
		assertEquals(RuntimeErrorKind.INVALID_ARGUMENT, failure("classify", Value.string("x"), Value.list()));
	}

	@Test
	public void testContexts() {
		assertEquals(Value.context("Test"), call("currentContext"));
		assertEquals(Value.context("Other"), call("switchContext", Value.string("Other")));
	}

	@Test
	public void testRegisteredFunctionsAreCallableFromPrograms() {
		StandardLibrary.register(NativeFunction.fixed("twiceForTest", 1, (args, env) -> Value.integer(args.get(0).asLong() * 2)));
		assertEquals(Value.integer(42), new LlmLang().eval("twiceForTest(21);"));
		assertThrows(IllegalArgumentException.class, () -> StandardLibrary.register(NativeFunction.fixed("", 0, (args, env) -> Value.VOID)));
	}
}
