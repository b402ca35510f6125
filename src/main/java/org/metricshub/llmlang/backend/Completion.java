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

import org.metricshub.llmlang.jrt.Value;

/**
 * Outcome of executing a statement: it either completed normally with a value
 * or hit a {@code return}, which every enclosing statement sequence must
 * propagate up to the function call.
 */
final class Completion {

	static final Completion VOID = new Completion(false, Value.VOID);

	private final boolean isReturn;
	private final Value value;

	private Completion(boolean isReturn, Value value) {
		this.isReturn = isReturn;
		this.value = value;
	}

	static Completion normal(Value value) {
		return value == Value.VOID ? VOID : new Completion(false, value);
	}

	static Completion returning(Value value) {
		return new Completion(true, value);
	}

	boolean isReturn() {
		return isReturn;
	}

	Value getValue() {
		return value;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return (isReturn ? "Return(" : "Normal(") + value + ")";
	}
}
