package org.metricshub.llmlang;

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
 * The value a program evaluated to, with its execution statistics.
 */
public final class ExecutionResult {

	private final Value value;
	private final ExecutionStats stats;

	public ExecutionResult(Value value, ExecutionStats stats) {
		this.value = value;
		this.stats = stats;
	}

	public Value getValue() {
		return value;
	}

	public ExecutionStats getStats() {
		return stats;
	}

	@Override
	public String toString() {
		return "ExecutionResult{value=" + value + ", stats=" + stats + "}";
	}
}
