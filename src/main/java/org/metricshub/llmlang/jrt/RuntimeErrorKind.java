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

/**
 * Closed set of runtime failures reported through {@link LlmRuntimeException}.
 */
public enum RuntimeErrorKind {
	UNDEFINED_VARIABLE,
	UNDEFINED_FUNCTION,
	UNDEFINED_CONTEXT,
	UNDEFINED_PROPERTY,
	INVALID_TYPE,
	INVALID_OPERATION,
	INVALID_ARGUMENT,
	INVALID_ARGUMENT_COUNT,
	INVALID_ASSIGNMENT_TARGET,
	NOT_CALLABLE,
	DIVISION_BY_ZERO,
	INTEGER_OVERFLOW,
	/** a language feature was switched off in the execute options */
	FEATURE_DISABLED,
	INVALID_STRATEGY,
	NO_PATHS,
	MEMORY_NOT_FOUND,
	MODIFICATION_FAILED,
	/** a syntax node lacks a required child or attribute */
	MALFORMED_NODE,
	STACK_OVERFLOW,
	TIME_LIMIT_EXCEEDED,
	MEMORY_LIMIT_EXCEEDED,
	INTERRUPTED
}
