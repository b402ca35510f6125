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

import java.util.List;
import java.util.Objects;
import org.metricshub.llmlang.frontend.SourceSpan;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.jrt.Value;

/**
 * A function implemented in Java and callable from LLM.lang programs.
 * Native functions hold no state: everything they need comes from their
 * arguments and the {@link NativeEnvironment}.
 */
public final class NativeFunction {

	/** Marker of an unbounded maximum arity */
	public static final int VARIADIC = -1;

	/**
	 * Implementation of a native function.
	 */
	@FunctionalInterface
	public interface Body {
		/**
		 * @param arguments argument values, count already verified
		 * @param environment the calling engine
		 * @return the result, {@link Value#VOID} when there is none
		 */
		Value invoke(List<Value> arguments, NativeEnvironment environment);
	}

	private final String name;
	private final int minArity;
	private final int maxArity;
	private final Body body;

	/**
	 * @param name name under which programs call the function
	 * @param minArity minimum argument count
	 * @param maxArity maximum argument count, or {@link #VARIADIC}
	 * @param body implementation
	 */
	public NativeFunction(String name, int minArity, int maxArity, Body body) {
		this.name = Objects.requireNonNull(name, "Function name must not be null");
		if (minArity < 0 || (maxArity != VARIADIC && maxArity < minArity)) {
			throw new IllegalArgumentException("Invalid arity for " + name + ": " + minArity + ".." + maxArity);
		}
		this.minArity = minArity;
		this.maxArity = maxArity;
		this.body = Objects.requireNonNull(body, "Function body must not be null");
	}

	/**
	 * Shorthand for a function taking exactly {@code arity} arguments.
	 *
	 * @param name function name
	 * @param arity argument count
	 * @param body implementation
	 * @return the function
	 */
	public static NativeFunction fixed(String name, int arity, Body body) {
		return new NativeFunction(name, arity, arity, body);
	}

	public String getName() {
		return name;
	}

	public int getMinArity() {
		return minArity;
	}

	public int getMaxArity() {
		return maxArity;
	}

	/**
	 * @return whether the function takes one exact number of arguments
	 */
	public boolean isFixedArity() {
		return minArity == maxArity;
	}

	/**
	 * Verifies the argument count and runs the function.
	 *
	 * @param arguments argument values
	 * @param environment the calling engine
	 * @param location call site, attached to errors
	 * @return the result
	 */
	public Value invoke(List<Value> arguments, NativeEnvironment environment, SourceSpan location) {
		verifyArgCount(arguments.size(), location);
		try {
			return body.invoke(arguments, environment);
		} catch (LlmRuntimeException e) {
			throw e.locatedAt(location);
		}
	}

	/**
	 * @param actual supplied argument count
	 * @param location call site
	 * @throws LlmRuntimeException of kind {@link RuntimeErrorKind#INVALID_ARGUMENT_COUNT}
	 */
	public void verifyArgCount(int actual, SourceSpan location) {
		if (isFixedArity()) {
			if (actual != minArity) {
				throw LlmRuntimeException.argumentCount(name, minArity, actual, location);
			}
		} else if (actual < minArity || (maxArity != VARIADIC && actual > maxArity)) {
			String range = maxArity == VARIADIC ? "at least " + minArity : minArity + " to " + maxArity;
			throw new LlmRuntimeException(
					RuntimeErrorKind.INVALID_ARGUMENT_COUNT,
					"Function '" + name + "' expects " + range + " argument(s) but got " + actual,
					location,
					minArity,
					actual,
					null);
		}
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		String arity = isFixedArity() ? String.valueOf(minArity)
				: minArity + ".." + (maxArity == VARIADIC ? "*" : String.valueOf(maxArity));
		return name + "/" + arity;
	}
}
