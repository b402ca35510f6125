package org.metricshub.llmlang.semantic;

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
 * Raised by the {@link SemanticAnalyzer} on the first program error it finds.
 */
public class SemanticException extends LlmException {

	private static final long serialVersionUID = 1L;

	/**
	 * What the analyzer found wrong.
	 */
	public enum Kind {
		REDEFINED_VARIABLE,
		REDEFINED_FUNCTION,
		REDEFINED_CONTEXT,
		UNDEFINED_VARIABLE,
		UNDEFINED_FUNCTION,
		UNDEFINED_CONTEXT,
		INVALID_ARGUMENT_COUNT,
		RETURN_OUTSIDE_FUNCTION,
		INVALID_STRATEGY,
		NO_PATHS,
		INVALID_SEMANTIC_TOKEN,
		INVALID_ASSIGNMENT_TARGET,
		INVALID_TYPE,
		MALFORMED_NODE
	}

	private final Kind kind;
	private final int expected;
	private final int actual;

	public SemanticException(Kind kind, String message, SourceSpan location) {
		this(kind, message, location, -1, -1);
	}

	/**
	 * @param kind what is wrong
	 * @param message description
	 * @param location where
	 * @param expected expected argument count, {@code -1} if not applicable
	 * @param actual actual argument count, {@code -1} if not applicable
	 */
	public SemanticException(Kind kind, String message, SourceSpan location, int expected, int actual) {
		super(message, location);
		this.kind = kind;
		this.expected = expected;
		this.actual = actual;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return declared parameter count for {@link Kind#INVALID_ARGUMENT_COUNT},
	 *         {@code -1} otherwise
	 */
	public int getExpected() {
		return expected;
	}

	/**
	 * @return supplied argument count for {@link Kind#INVALID_ARGUMENT_COUNT},
	 *         {@code -1} otherwise
	 */
	public int getActual() {
		return actual;
	}

	@Override
	public String getStage() {
		return "Semantic";
	}
}
