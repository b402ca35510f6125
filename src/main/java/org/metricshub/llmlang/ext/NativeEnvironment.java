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

import java.io.PrintStream;
import java.util.List;
import org.metricshub.llmlang.jrt.Value;

/**
 * What a {@link NativeFunction} may see of the engine calling it.
 */
public interface NativeEnvironment {

	/**
	 * @return where {@code print} writes
	 */
	PrintStream getOutput();

	/**
	 * @return name of the execution context currently active
	 */
	String getCurrentContextName();

	/**
	 * @return the vector set by the innermost {@code apply}, or
	 *         {@link Value#VOID} outside of any
	 */
	Value getCurrentVector();

	/**
	 * Calls a function value (native or user-defined) from native code, as
	 * {@code map}, {@code filter} and {@code reduce} do.
	 *
	 * @param function a Function value
	 * @param arguments argument values
	 * @return the result of the call
	 */
	Value call(Value function, List<Value> arguments);
}
