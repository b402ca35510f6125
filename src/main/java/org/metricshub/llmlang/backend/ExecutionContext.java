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

import java.util.LinkedHashMap;
import java.util.Map;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.jrt.Value;

/**
 * A named namespace of functions and variables. Programs always have a
 * {@link ContextManager#GLOBAL} context; {@code context}, {@code with} and
 * {@code within} create or enter others.
 */
public final class ExecutionContext {

	private final String name;
	private final Map<String, Node> functions = new LinkedHashMap<String, Node>();
	private final Map<String, Value> variables = new LinkedHashMap<String, Value>();

	ExecutionContext(String name) {
		this.name = name;
	}

	ExecutionContext copy() {
		ExecutionContext copy = new ExecutionContext(name);
		copy.functions.putAll(functions);
		copy.variables.putAll(variables);
		return copy;
	}

	public String getName() {
		return name;
	}

	Map<String, Node> getFunctions() {
		return functions;
	}

	Map<String, Value> getVariables() {
		return variables;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "context " + name + " (functions " + functions.keySet() + ", variables " + variables.keySet() + ")";
	}
}
