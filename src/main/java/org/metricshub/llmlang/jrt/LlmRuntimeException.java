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

import org.metricshub.llmlang.LlmException;
import org.metricshub.llmlang.frontend.SourceSpan;

/**
 * A runtime exception thrown while executing an LLM.lang program. It is
 * provided to conveniently distinguish program failures from other runtime
 * exceptions.
 * <p>
 * Arity and resource-limit failures also carry the expected (or limit) and
 * actual figures; they are {@code -1} for the other kinds.
 */
public class LlmRuntimeException extends LlmException {

	private static final long serialVersionUID = 1L;

	private final RuntimeErrorKind kind;
	private final long expected;
	private final long actual;

	public LlmRuntimeException(RuntimeErrorKind kind, String msg) {
		this(kind, msg, null, -1, -1, null);
	}

	public LlmRuntimeException(RuntimeErrorKind kind, String msg, SourceSpan location) {
		this(kind, msg, location, -1, -1, null);
	}

	public LlmRuntimeException(RuntimeErrorKind kind, String msg, SourceSpan location, Throwable cause) {
		this(kind, msg, location, -1, -1, cause);
	}

	/**
	 * Full constructor.
	 *
	 * @param kind what failed
	 * @param msg description
	 * @param location where, may be {@code null}
	 * @param expected expected count or configured limit, {@code -1} if not applicable
	 * @param actual actual count or measured amount, {@code -1} if not applicable
	 * @param cause underlying exception, may be {@code null}
	 */
	public LlmRuntimeException(
			RuntimeErrorKind kind,
			String msg,
			SourceSpan location,
			long expected,
			long actual,
			Throwable cause) {
		super(msg, location, cause);
		this.kind = kind;
		this.expected = expected;
		this.actual = actual;
	}

	/**
	 * Builds the error raised when a function receives the wrong number of
	 * arguments.
	 *
	 * @param name function name
	 * @param expected declared parameter count
	 * @param actual supplied argument count
	 * @param location call site
	 * @return the exception
	 */
	public static LlmRuntimeException argumentCount(String name, int expected, int actual, SourceSpan location) {
		return new LlmRuntimeException(
				RuntimeErrorKind.INVALID_ARGUMENT_COUNT,
				"Function '" + name + "' expects " + expected + " argument(s) but got " + actual,
				location,
				expected,
				actual,
				null);
	}

	public RuntimeErrorKind getKind() {
		return kind;
	}

	/**
	 * @return expected argument count or configured limit, {@code -1} if not applicable
	 */
	public long getExpected() {
		return expected;
	}

	/**
	 * @return actual argument count or measured amount, {@code -1} if not applicable
	 */
	public long getActual() {
		return actual;
	}

	/**
	 * Returns this exception when it already has a location, otherwise an
	 * equivalent exception located at {@code where}.
	 *
	 * @param where location to attach
	 * @return an exception with a location
	 */
	public LlmRuntimeException locatedAt(SourceSpan where) {
		if (getLineNumber() >= 0 || where == null) {
			return this;
		}
		LlmRuntimeException located = new LlmRuntimeException(kind, getMessage(), where, expected, actual, getCause());
		located.setStackTrace(getStackTrace());
		return located;
	}

	@Override
	public String getStage() {
		return "Runtime";
	}
}
