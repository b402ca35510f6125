package org.metricshub.llmlang.backend;

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
import java.util.List;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.jrt.Value;
import org.metricshub.llmlang.jrt.ValueType;

/**
 * Semantics of the binary and unary operators on runtime values.
 * <p>
 * Integer arithmetic is exact: overflow raises
 * {@link RuntimeErrorKind#INTEGER_OVERFLOW}. Division and remainder by zero
 * raise {@link RuntimeErrorKind#DIVISION_BY_ZERO}, for floats too.
 */
final class Operators {

	/** Largest list or string produced by a repetition */
	static final long MAX_REPEAT_SIZE = 10_000_000L;

	private Operators() {
		/* utility class */
	}

	/**
	 * Applies a binary operator. {@code and}, {@code or} and {@code .} are
	 * handled by the engine.
	 *
	 * @param operator operator symbol
	 * @param left left operand
	 * @param right right operand
	 * @return the result
	 */
	static Value binary(String operator, Value left, Value right) {
		switch (operator) {
		case "==":
			return Value.bool(left.equals(right));
		case "!=":
			return Value.bool(!left.equals(right));
		case "<":
		case ">":
		case "<=":
		case ">=":
			return compare(operator, left, right);
		case "+":
		case "-":
		case "*":
		case "/":
		case "%":
			return arithmetic(operator, left, right);
		default:
			throw new LlmRuntimeException(RuntimeErrorKind.INVALID_OPERATION, "Unknown binary operator: '" + operator + "'");
		}
	}

	/**
	 * Applies a unary operator: {@code -} on numbers and vectors, {@code !} on
	 * anything (truthiness).
	 *
	 * @param operator operator symbol
	 * @param operand the operand
	 * @return the result
	 */
	static Value unary(String operator, Value operand) {
		if ("!".equals(operator)) {
			return Value.bool(!operand.isTruthy());
		}
		if ("-".equals(operator)) {
			switch (operand.getType()) {
			case INT:
				if (operand.asLong() == Long.MIN_VALUE) {
					throw overflow("-", operand, null);
				}
				return Value.integer(-operand.asLong());
			case FLOAT:
				return Value.floating(-operand.asDouble());
			case VECTOR:
				double[] components = operand.asVector();
				for (int i = 0; i < components.length; i++) {
					components[i] = -components[i];
				}
				return Value.vector(components);
			default:
				break;
			}
		}
		throw new LlmRuntimeException(
				RuntimeErrorKind.INVALID_OPERATION,
				"Cannot apply '" + operator + "' to " + operand.getType().getDisplayName());
	}

	private static Value compare(String operator, Value left, Value right) {
		int comparison;
		if (left.isNumber() && right.isNumber()) {
			if (left.is(ValueType.INT) && right.is(ValueType.INT)) {
				comparison = Long.compare(left.asLong(), right.asLong());
			} else {
				comparison = Double.compare(left.asDouble(), right.asDouble());
			}
		} else if (left.is(ValueType.STRING) && right.is(ValueType.STRING)) {
			comparison = left.asString().compareTo(right.asString());
		} else {
			throw invalid(operator, left, right);
		}
		switch (operator) {
		case "<":
			return Value.bool(comparison < 0);
		case ">":
			return Value.bool(comparison > 0);
		case "<=":
			return Value.bool(comparison <= 0);
		default:
			return Value.bool(comparison >= 0);
		}
	}

	private static Value arithmetic(String operator, Value left, Value right) {
		if (left.is(ValueType.INT) && right.is(ValueType.INT)) {
			return integerArithmetic(operator, left, right);
		}
		if (left.isNumber() && right.isNumber()) {
			return Value.floating(floatArithmetic(operator, left.asDouble(), right.asDouble()));
		}
		if (left.is(ValueType.VECTOR) || right.is(ValueType.VECTOR)) {
			return vectorArithmetic(operator, left, right);
		}
		if ("+".equals(operator)) {
			if (left.is(ValueType.STRING) && right.is(ValueType.STRING)) {
				return Value.string(left.asString() + right.asString());
			}
			if (left.is(ValueType.LIST) && right.is(ValueType.LIST)) {
				List<Value> joined = new ArrayList<Value>(left.asList());
				joined.addAll(right.asList());
				return Value.list(joined);
			}
		}
		if ("*".equals(operator) && right.is(ValueType.INT)) {
			if (left.is(ValueType.STRING)) {
				int times = repetitions(left.asString().length(), right.asLong());
				StringBuilder repeated = new StringBuilder();
				for (int i = 0; i < times; i++) {
					repeated.append(left.asString());
				}
				return Value.string(repeated.toString());
			}
			if (left.is(ValueType.LIST)) {
				int times = repetitions(left.asList().size(), right.asLong());
				List<Value> repeated = new ArrayList<Value>();
				for (int i = 0; i < times; i++) {
					repeated.addAll(left.asList());
				}
				return Value.list(repeated);
			}
		}
		throw invalid(operator, left, right);
	}

	private static Value integerArithmetic(String operator, Value left, Value right) {
		long a = left.asLong();
		long b = right.asLong();
		try {
			switch (operator) {
			case "+":
				return Value.integer(Math.addExact(a, b));
			case "-":
				return Value.integer(Math.subtractExact(a, b));
			case "*":
				return Value.integer(Math.multiplyExact(a, b));
			case "/":
				if (b == 0) {
					throw divisionByZero();
				}
				if (a == Long.MIN_VALUE && b == -1) {
					throw overflow(operator, left, right);
				}
				return Value.integer(a / b);
			default:
				if (b == 0) {
					throw divisionByZero();
				}
				return Value.integer(b == -1 ? 0 : a % b);
			}
		} catch (ArithmeticException e) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.INTEGER_OVERFLOW,
					overflow(operator, left, right).getMessage(),
					null,
					e);
		}
	}

	private static double floatArithmetic(String operator, double a, double b) {
		switch (operator) {
		case "+":
			return a + b;
		case "-":
			return a - b;
		case "*":
			return a * b;
		case "/":
			if (b == 0.0) {
				throw divisionByZero();
			}
			return a / b;
		default:
			if (b == 0.0) {
				throw divisionByZero();
			}
			return a % b;
		}
	}

	private static Value vectorArithmetic(String operator, Value left, Value right) {
		if ("%".equals(operator)) {
			throw invalid(operator, left, right);
		}
		if (left.is(ValueType.VECTOR) && right.is(ValueType.VECTOR)) {
			double[] a = left.asVector();
			double[] b = right.asVector();
			if (a.length != b.length) {
				throw new LlmRuntimeException(
						RuntimeErrorKind.INVALID_OPERATION,
						"Vector dimensions differ: " + a.length + " and " + b.length);
			}
			for (int i = 0; i < a.length; i++) {
				a[i] = floatArithmetic(operator, a[i], b[i]);
			}
			return Value.vector(a);
		}
		if (left.is(ValueType.VECTOR) && right.is(ValueType.FLOAT)) {
			double[] a = left.asVector();
			double scalar = right.asDouble();
			for (int i = 0; i < a.length; i++) {
				a[i] = floatArithmetic(operator, a[i], scalar);
			}
			return Value.vector(a);
		}
		throw invalid(operator, left, right);
	}

	private static int repetitions(int unitSize, long times) {
		if (times < 0) {
			throw new LlmRuntimeException(RuntimeErrorKind.INVALID_OPERATION, "Cannot repeat a negative number of times: " + times);
		}
		if (unitSize > 0 && times > MAX_REPEAT_SIZE / unitSize) {
			throw new LlmRuntimeException(RuntimeErrorKind.INVALID_OPERATION, "Repetition result is too large");
		}
		return unitSize == 0 ? 0 : (int) times;
	}

	private static LlmRuntimeException invalid(String operator, Value left, Value right) {
		return new LlmRuntimeException(
				RuntimeErrorKind.INVALID_OPERATION,
				"Cannot apply '" + operator + "' to " + left.getType().getDisplayName() + " and "
						+ right.getType().getDisplayName());
	}

	private static LlmRuntimeException divisionByZero() {
		return new LlmRuntimeException(RuntimeErrorKind.DIVISION_BY_ZERO, "Division by zero");
	}

	private static LlmRuntimeException overflow(String operator, Value left, Value right) {
		String operands = right == null ? left.toDisplayString() : left.toDisplayString() + " and " + right.toDisplayString();
		return new LlmRuntimeException(RuntimeErrorKind.INTEGER_OVERFLOW, "Integer overflow in '" + operator + "' on " + operands);
	}
}
