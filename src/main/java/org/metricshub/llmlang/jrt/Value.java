package org.metricshub.llmlang.jrt;

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
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable LLM.lang runtime value.
 * <p>
 * Lists and maps are unmodifiable copies and vectors are copied on the way in
 * and out, so handing a value to another binding never shares mutable state.
 * Equality is structural: floats compare bit for bit, maps ignore key order
 * and values of different types are never equal.
 */
public final class Value {

	/** The unit value of statements that produce nothing */
	public static final Value VOID = new Value(ValueType.VOID, null);

	public static final Value TRUE = new Value(ValueType.BOOL, Boolean.TRUE);

	public static final Value FALSE = new Value(ValueType.BOOL, Boolean.FALSE);

	private final ValueType type;
	private final Object payload;

	private Value(ValueType type, Object payload) {
		this.type = type;
		this.payload = payload;
	}

	public static Value bool(boolean value) {
		return value ? TRUE : FALSE;
	}

	public static Value integer(long value) {
		return new Value(ValueType.INT, Long.valueOf(value));
	}

	public static Value floating(double value) {
		return new Value(ValueType.FLOAT, Double.valueOf(value));
	}

	public static Value string(String value) {
		return new Value(ValueType.STRING, Objects.requireNonNull(value, "String value must not be null"));
	}

	public static Value list(List<Value> elements) {
		return new Value(ValueType.LIST, Collections.unmodifiableList(new ArrayList<Value>(elements)));
	}

	public static Value list(Value... elements) {
		return list(Arrays.asList(elements));
	}

	public static Value map(Map<String, Value> entries) {
		return new Value(ValueType.MAP, Collections.unmodifiableMap(new LinkedHashMap<String, Value>(entries)));
	}

	public static Value function(String name) {
		return new Value(ValueType.FUNCTION, Objects.requireNonNull(name, "Function name must not be null"));
	}

	public static Value vector(double[] components) {
		return new Value(ValueType.VECTOR, components.clone());
	}

	public static Value context(String name) {
		return new Value(ValueType.CONTEXT, Objects.requireNonNull(name, "Context name must not be null"));
	}

	public ValueType getType() {
		return type;
	}

	public boolean is(ValueType expected) {
		return type == expected;
	}

	public boolean isNumber() {
		return type == ValueType.INT || type == ValueType.FLOAT;
	}

	public boolean asBoolean() {
		return (Boolean) expect(ValueType.BOOL);
	}

	public long asLong() {
		return (Long) expect(ValueType.INT);
	}

	/**
	 * @return the numeric value of an Int or Float
	 */
	public double asDouble() {
		if (type == ValueType.INT) {
			return ((Long) payload).doubleValue();
		}
		return (Double) expect(ValueType.FLOAT);
	}

	public String asString() {
		return (String) expect(ValueType.STRING);
	}

	@SuppressWarnings("unchecked")
	public List<Value> asList() {
		return (List<Value>) expect(ValueType.LIST);
	}

	@SuppressWarnings("unchecked")
	public Map<String, Value> asMap() {
		return (Map<String, Value>) expect(ValueType.MAP);
	}

	/**
	 * @return a copy of the vector components
	 */
	public double[] asVector() {
		return ((double[]) expect(ValueType.VECTOR)).clone();
	}

	/**
	 * @return number of dimensions of a vector value
	 */
	public int getDimensions() {
		return ((double[]) expect(ValueType.VECTOR)).length;
	}

	/**
	 * @return the name carried by a Function or Context value
	 */
	public String getName() {
		if (type != ValueType.FUNCTION && type != ValueType.CONTEXT) {
			throw typeMismatch("Function or Context");
		}
		return (String) payload;
	}

	private Object expect(ValueType expected) {
		if (type != expected) {
			throw typeMismatch(expected.getDisplayName());
		}
		return payload;
	}

	private LlmRuntimeException typeMismatch(String expected) {
		return new LlmRuntimeException(
				RuntimeErrorKind.INVALID_TYPE,
				"Expected " + expected + " but got " + type.getDisplayName());
	}

	/**
	 * Truthiness: Bool as is, non-zero numbers, non-empty strings, lists and
	 * maps. Vectors, functions and contexts are true, Void is false.
	 *
	 * @return whether the value counts as true in a condition
	 */
	public boolean isTruthy() {
		switch (type) {
		case BOOL:
			return (Boolean) payload;
		case INT:
			return (Long) payload != 0L;
		case FLOAT:
			return (Double) payload != 0.0;
		case STRING:
			return !((String) payload).isEmpty();
		case LIST:
			return !asList().isEmpty();
		case MAP:
			return !asMap().isEmpty();
		case VECTOR:
		case FUNCTION:
		case CONTEXT:
			return true;
		default:
			return false;
		}
	}

	/**
	 * Approximate footprint in bytes used by the memory budget: 1 for a Bool,
	 * 8 per number or vector component, the length of strings and names, and
	 * the recursive sum for lists and maps (keys included).
	 *
	 * @return the approximate size
	 */
	public long approximateSize() {
		switch (type) {
		case BOOL:
			return 1;
		case INT:
		case FLOAT:
			return 8;
		case STRING:
		case FUNCTION:
		case CONTEXT:
			return ((String) payload).length();
		case LIST:
			long listSize = 0;
			for (Value element : asList()) {
				listSize += element.approximateSize();
			}
			return listSize;
		case MAP:
			long mapSize = 0;
			for (Map.Entry<String, Value> entry : asMap().entrySet()) {
				mapSize += entry.getKey().length() + entry.getValue().approximateSize();
			}
			return mapSize;
		case VECTOR:
			return 8L * getDimensions();
		default:
			return 0;
		}
	}

	/**
	 * Renders the value the way {@code print} and {@code toString} show it.
	 *
	 * @return the display string
	 */
	public String toDisplayString() {
		switch (type) {
		case VOID:
			return "void";
		case BOOL:
		case INT:
		case FLOAT:
		case STRING:
			return String.valueOf(payload);
		case LIST:
			StringBuilder list = new StringBuilder("[");
			for (Value element : asList()) {
				if (list.length() > 1) {
					list.append(", ");
				}
				list.append(element.toDisplayString());
			}
			return list.append(']').toString();
		case MAP:
			StringBuilder map = new StringBuilder("{");
			for (Map.Entry<String, Value> entry : asMap().entrySet()) {
				if (map.length() > 1) {
					map.append(", ");
				}
				map.append(entry.getKey()).append(": ").append(entry.getValue().toDisplayString());
			}
			return map.append('}').toString();
		case FUNCTION:
			return "<function " + payload + ">";
		case VECTOR:
			return "<vector with " + getDimensions() + " dimensions>";
		case CONTEXT:
			return "<context " + payload + ">";
		default:
			return type.getDisplayName();
		}
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Value)) {
			return false;
		}
		Value value = (Value) other;
		if (type != value.type) {
			return false;
		}
		switch (type) {
		case VOID:
			return true;
		case FLOAT:
			return Double.doubleToLongBits((Double) payload) == Double.doubleToLongBits((Double) value.payload);
		case VECTOR:
			return Arrays.equals((double[]) payload, (double[]) value.payload);
		default:
			return payload.equals(value.payload);
		}
	}

	@Override
	public int hashCode() {
		if (type == ValueType.VECTOR) {
			return 31 * type.hashCode() + Arrays.hashCode((double[]) payload);
		}
		return Objects.hash(type, payload);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		if (type == ValueType.STRING) {
			return type.getDisplayName() + "(\"" + payload + "\")";
		}
		return type.getDisplayName() + "(" + toDisplayString() + ")";
	}
}
