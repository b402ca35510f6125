package org.metricshub.llmlang.ext;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IllegalFormatException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.NaturalLanguage;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.jrt.Value;
import org.metricshub.llmlang.jrt.ValueType;
import org.metricshub.llmlang.jrt.Vectors;

/**
 * Registry of the {@link NativeFunction}s every program can call.
 * <p>
 * The engine looks names up here before user-defined functions, and the
 * semantic analyzer declares every registered function with its arity.
 * Additional functions may be registered before programs are compiled.
 */
public final class StandardLibrary {

	/** Largest list {@code range} accepts to build */
	static final int MAX_RANGE_SIZE = 10_000_000;

	private static final ConcurrentMap<String, NativeFunction> REGISTERED = new ConcurrentHashMap<String, NativeFunction>();

	static {
		registerCore();
		registerCollections();
		registerStrings();
		registerVectors();
		registerNaturalLanguage();
		registerContexts();
	}

	private StandardLibrary() {}

	/**
	 * Registers a function, replacing any function of the same name.
	 *
	 * @param function the function
	 */
	public static void register(NativeFunction function) {
		Objects.requireNonNull(function, "Function must not be null");
		if (function.getName().isEmpty()) {
			throw new IllegalArgumentException("Function name must not be empty");
		}
		REGISTERED.put(function.getName(), function);
	}

	/**
	 * @param name function name, case-sensitive
	 * @return the function, or {@code null} when no such function is registered
	 */
	public static NativeFunction resolve(String name) {
		if (name == null) {
			return null;
		}
		return REGISTERED.get(name);
	}

	/**
	 * @param name function name
	 * @return whether a function of that name is registered
	 */
	public static boolean isDefined(String name) {
		return resolve(name) != null;
	}

	/**
	 * Returns a snapshot of all registered functions sorted by name.
	 *
	 * @return immutable view of the registered functions
	 */
	public static Map<String, NativeFunction> listFunctions() {
		return Collections.unmodifiableMap(new TreeMap<String, NativeFunction>(REGISTERED));
	}

	private static void registerCore() {
		register(new NativeFunction("print", 1, NativeFunction.VARIADIC, (args, env) -> {
			StringBuilder line = new StringBuilder();
			for (Value arg : args) {
				if (line.length() > 0) {
					line.append(' ');
				}
				line.append(arg.toDisplayString());
			}
			env.getOutput().println(line);
			return Value.VOID;
		}));
		register(NativeFunction.fixed("toString", 1, (args, env) -> Value.string(args.get(0).toDisplayString())));
		register(NativeFunction.fixed("parseInt", 1, (args, env) -> {
			String text = string("parseInt", args, 0).trim();
			try {
				return Value.integer(Long.parseLong(text));
			} catch (NumberFormatException e) {
				throw invalidArgument("parseInt", "Cannot parse '" + text + "' as Int", e);
			}
		}));
		register(NativeFunction.fixed("parseFloat", 1, (args, env) -> {
			String text = string("parseFloat", args, 0).trim();
			try {
				return Value.floating(Double.parseDouble(text));
			} catch (NumberFormatException e) {
				throw invalidArgument("parseFloat", "Cannot parse '" + text + "' as Float", e);
			}
		}));
		register(new NativeFunction("format", 1, NativeFunction.VARIADIC, (args, env) -> {
			String format = string("format", args, 0);
			Object[] javaArgs = new Object[args.size() - 1];
			for (int i = 1; i < args.size(); i++) {
				javaArgs[i - 1] = toJava(args.get(i));
			}
			try {
				return Value.string(String.format(Locale.US, format, javaArgs));
			} catch (IllegalFormatException e) {
				throw invalidArgument("format", "Invalid format '" + format + "': " + e.getMessage(), e);
			}
		}));
	}

	private static void registerCollections() {
		register(NativeFunction.fixed("length", 1, (args, env) -> Value.integer(sizeOf("length", args.get(0)))));
		register(NativeFunction.fixed("isEmpty", 1, (args, env) -> Value.bool(sizeOf("isEmpty", args.get(0)) == 0)));
		register(NativeFunction.fixed("contains", 2, (args, env) -> {
			Value collection = args.get(0);
			Value needle = args.get(1);
			switch (collection.getType()) {
			case STRING:
				return Value.bool(collection.asString().contains(string("contains", args, 1)));
			case LIST:
				return Value.bool(collection.asList().contains(needle));
			case MAP:
				return Value.bool(collection.asMap().containsKey(string("contains", args, 1)));
			default:
				throw invalidArgument("contains", "Cannot search in " + collection.getType().getDisplayName(), null);
			}
		}));
		register(NativeFunction.fixed("get", 2, (args, env) -> {
			Value collection = args.get(0);
			switch (collection.getType()) {
			case LIST:
				List<Value> list = collection.asList();
				return list.get(index("get", args, 1, list.size()));
			case STRING:
				String text = collection.asString();
				int at = index("get", args, 1, text.length());
				return Value.string(text.substring(at, at + 1));
			case MAP:
				String key = string("get", args, 1);
				Value value = collection.asMap().get(key);
				if (value == null) {
					throw new LlmRuntimeException(RuntimeErrorKind.UNDEFINED_PROPERTY, "Undefined property: " + key);
				}
				return value;
			default:
				throw invalidArgument("get", "Cannot index " + collection.getType().getDisplayName(), null);
			}
		}));
		register(NativeFunction.fixed("append", 2, (args, env) -> {
			List<Value> list = new ArrayList<Value>(list("append", args, 0));
			list.add(args.get(1));
			return Value.list(list);
		}));
		register(NativeFunction.fixed("keys", 1, (args, env) -> {
			List<Value> keys = new ArrayList<Value>();
			for (String key : map("keys", args, 0).keySet()) {
				keys.add(Value.string(key));
			}
			return Value.list(keys);
		}));
		register(NativeFunction.fixed("put", 3, (args, env) -> {
			Map<String, Value> map = new LinkedHashMap<String, Value>(map("put", args, 0));
			map.put(string("put", args, 1), args.get(2));
			return Value.map(map);
		}));
		register(new NativeFunction("mapOf", 0, NativeFunction.VARIADIC, (args, env) -> {
			if (args.size() % 2 != 0) {
				throw invalidArgument("mapOf", "Expects key/value pairs", null);
			}
			Map<String, Value> map = new LinkedHashMap<String, Value>();
			for (int i = 0; i < args.size(); i += 2) {
				map.put(string("mapOf", args, i), args.get(i + 1));
			}
			return Value.map(map);
		}));
		register(NativeFunction.fixed("range", 2, (args, env) -> {
			long start = integer("range", args, 0);
			long end = integer("range", args, 1);
			if (end > start && (end - start > MAX_RANGE_SIZE || end - start < 0)) {
				throw invalidArgument("range", "Range too large: " + start + ".." + end, null);
			}
			List<Value> values = new ArrayList<Value>();
			for (long i = start; i < end; i++) {
				values.add(Value.integer(i));
			}
			return Value.list(values);
		}));
		register(NativeFunction.fixed("map", 2, (args, env) -> {
			List<Value> mapped = new ArrayList<Value>();
			Value function = function("map", args, 1);
			for (Value element : list("map", args, 0)) {
				mapped.add(env.call(function, Collections.singletonList(element)));
			}
			return Value.list(mapped);
		}));
		register(NativeFunction.fixed("filter", 2, (args, env) -> {
			List<Value> kept = new ArrayList<Value>();
			Value function = function("filter", args, 1);
			for (Value element : list("filter", args, 0)) {
				if (env.call(function, Collections.singletonList(element)).isTruthy()) {
					kept.add(element);
				}
			}
			return Value.list(kept);
		}));
		register(NativeFunction.fixed("reduce", 3, (args, env) -> {
			Value function = function("reduce", args, 1);
			Value accumulator = args.get(2);
			for (Value element : list("reduce", args, 0)) {
				List<Value> pair = new ArrayList<Value>();
				pair.add(accumulator);
				pair.add(element);
				accumulator = env.call(function, pair);
			}
			return accumulator;
		}));
	}

	private static void registerStrings() {
		register(NativeFunction.fixed("substring", 3, (args, env) -> {
			String text = string("substring", args, 0);
			long start = integer("substring", args, 1);
			long end = integer("substring", args, 2);
			if (start < 0 || end > text.length() || start > end) {
				throw invalidArgument(
						"substring",
						"Range " + start + ".." + end + " out of bounds for length " + text.length(),
						null);
			}
			return Value.string(text.substring((int) start, (int) end));
		}));
		register(NativeFunction.fixed("indexOf", 2, (args, env) -> Value
				.integer(string("indexOf", args, 0).indexOf(string("indexOf", args, 1)))));
		register(NativeFunction.fixed("toLowerCase", 1, (args, env) -> Value
				.string(string("toLowerCase", args, 0).toLowerCase(Locale.ROOT))));
		register(NativeFunction.fixed("toUpperCase", 1, (args, env) -> Value
				.string(string("toUpperCase", args, 0).toUpperCase(Locale.ROOT))));
		register(NativeFunction.fixed("trim", 1, (args, env) -> Value.string(string("trim", args, 0).trim())));
	}

	private static void registerVectors() {
		register(NativeFunction.fixed("embed", 1, (args, env) -> Value.vector(Vectors.embed(string("embed", args, 0)))));
		register(NativeFunction.fixed("similarity", 2, (args, env) -> Value
				.floating(Vectors.similarity(vector("similarity", args, 0), vector("similarity", args, 1)))));
		register(NativeFunction.fixed("nearest", 3, (args, env) -> {
			double[] query = vector("nearest", args, 0);
			List<double[]> candidates = new ArrayList<double[]>();
			for (Value candidate : list("nearest", args, 1)) {
				if (!candidate.is(ValueType.VECTOR)) {
					throw invalidArgument("nearest", "Expects a List of Vectors as argument 2", null);
				}
				candidates.add(candidate.asVector());
			}
			long k = integer("nearest", args, 2);
			List<Value> indices = new ArrayList<Value>();
			for (Integer index : Vectors.nearest(query, candidates, (int) Math.min(k, Integer.MAX_VALUE))) {
				indices.add(Value.integer(index));
			}
			return Value.list(indices);
		}));
		register(NativeFunction.fixed("currentVector", 0, (args, env) -> env.getCurrentVector()));
	}

	private static void registerNaturalLanguage() {
		register(NativeFunction.fixed("extractEntities", 1, (args, env) -> {
			List<Value> entities = new ArrayList<Value>();
			for (String entity : NaturalLanguage.extractEntities(string("extractEntities", args, 0))) {
				entities.add(Value.string(entity));
			}
			return Value.list(entities);
		}));
		register(NativeFunction.fixed("classify", 2, (args, env) -> {
			List<String> categories = new ArrayList<String>();
			for (Value category : list("classify", args, 1)) {
				if (!category.is(ValueType.STRING)) {
					throw invalidArgument("classify", "Expects a List of Strings as argument 2", null);
				}
				categories.add(category.asString());
			}
			return Value.string(NaturalLanguage.classifyText(string("classify", args, 0), categories));
		}));
		register(NativeFunction.fixed("generate", 1, (args, env) -> Value
				.string(NaturalLanguage.generateText(string("generate", args, 0)))));
		register(NativeFunction.fixed("summarize", 1, (args, env) -> Value
				.string(NaturalLanguage.summarizeText(string("summarize", args, 0)))));
		register(NativeFunction.fixed("translate", 2, (args, env) -> Value
				.string(NaturalLanguage.translateText(string("translate", args, 0), string("translate", args, 1)))));
		register(NativeFunction.fixed("answer", 2, (args, env) -> Value
				.string(NaturalLanguage.answerQuestion(string("answer", args, 0), string("answer", args, 1)))));
	}

	private static void registerContexts() {
		register(NativeFunction.fixed("currentContext", 0, (args, env) -> Value.context(env.getCurrentContextName())));
		register(NativeFunction.fixed("switchContext", 1, (args, env) -> Value.context(string("switchContext", args, 0))));
	}

	// ARGUMENT HELPERS

	private static String string(String function, List<Value> args, int index) {
		return expect(function, args, index, ValueType.STRING).asString();
	}

	private static long integer(String function, List<Value> args, int index) {
		return expect(function, args, index, ValueType.INT).asLong();
	}

	private static List<Value> list(String function, List<Value> args, int index) {
		return expect(function, args, index, ValueType.LIST).asList();
	}

	private static Map<String, Value> map(String function, List<Value> args, int index) {
		return expect(function, args, index, ValueType.MAP).asMap();
	}

	private static double[] vector(String function, List<Value> args, int index) {
		return expect(function, args, index, ValueType.VECTOR).asVector();
	}

	private static Value function(String function, List<Value> args, int index) {
		return expect(function, args, index, ValueType.FUNCTION);
	}

	private static Value expect(String function, List<Value> args, int index, ValueType type) {
		Value value = args.get(index);
		if (!value.is(type)) {
			throw invalidArgument(
					function,
					"Expects " + type.getDisplayName() + " as argument " + (index + 1) + " but got "
							+ value.getType().getDisplayName(),
					null);
		}
		return value;
	}

	private static int index(String function, List<Value> args, int argument, int size) {
		long index = integer(function, args, argument);
		if (index < 0 || index >= size) {
			throw invalidArgument(function, "Index " + index + " out of bounds for length " + size, null);
		}
		return (int) index;
	}

	private static long sizeOf(String function, Value value) {
		switch (value.getType()) {
		case STRING:
			return value.asString().length();
		case LIST:
			return value.asList().size();
		case MAP:
			return value.asMap().size();
		case VECTOR:
			return value.getDimensions();
		default:
			throw invalidArgument(function, "Cannot measure " + value.getType().getDisplayName(), null);
		}
	}

	private static Object toJava(Value value) {
		switch (value.getType()) {
		case BOOL:
			return value.asBoolean();
		case INT:
			return value.asLong();
		case FLOAT:
			return value.asDouble();
		default:
			return value.toDisplayString();
		}
	}

	private static LlmRuntimeException invalidArgument(String function, String message, Throwable cause) {
		return new LlmRuntimeException(RuntimeErrorKind.INVALID_ARGUMENT, function + ": " + message, null, cause);
	}
}
