package org.metricshub.llmlang.util;

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
 * Settings of a compilation: lexing, parsing and semantic analysis, without
 * execution. The values are validated and recorded on the compiled program;
 * no machine code is produced whatever the target.
 */
public class CompileOptions {

	/** Highest accepted optimization level */
	public static final int MAX_OPTIMIZATION_LEVEL = 3;

	/**
	 * Whether optimizations are requested;
	 * <code>true</code> by default.
	 */
	private boolean optimize = true;

	/**
	 * Optimization level, between 0 and {@value #MAX_OPTIMIZATION_LEVEL};
	 * 2 by default.
	 */
	private int optimizationLevel = 2;

	/**
	 * Whether debug information is requested;
	 * <code>false</code> by default.
	 */
	private boolean debugInfo = false;

	/**
	 * Name of the compilation target;
	 * <code>"native"</code> by default.
	 */
	private String target = "native";

	/**
	 * @return a human readable representation of the option values
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();
		final char newLine = '\n';
		desc.append("optimize = ").append(isOptimize()).append(newLine);
		desc.append("optimizationLevel = ").append(getOptimizationLevel()).append(newLine);
		desc.append("debugInfo = ").append(isDebugInfo()).append(newLine);
		desc.append("target = ").append(getTarget()).append(newLine);
		return desc.toString();
	}

	public boolean isOptimize() {
		return optimize;
	}

	public void setOptimize(boolean optimize) {
		this.optimize = optimize;
	}

	public int getOptimizationLevel() {
		return optimizationLevel;
	}

	/**
	 * @param optimizationLevel level between 0 and {@value #MAX_OPTIMIZATION_LEVEL}
	 * @throws IllegalArgumentException when out of range
	 */
	public void setOptimizationLevel(int optimizationLevel) {
		if (optimizationLevel < 0 || optimizationLevel > MAX_OPTIMIZATION_LEVEL) {
			throw new IllegalArgumentException(
					"Optimization level must be between 0 and " + MAX_OPTIMIZATION_LEVEL + ": " + optimizationLevel);
		}
		this.optimizationLevel = optimizationLevel;
	}

	public boolean isDebugInfo() {
		return debugInfo;
	}

	public void setDebugInfo(boolean debugInfo) {
		this.debugInfo = debugInfo;
	}

	public String getTarget() {
		return target;
	}

	/**
	 * @param target target name, not empty
	 * @throws IllegalArgumentException when empty
	 */
	public void setTarget(String target) {
		if (target == null || target.isEmpty()) {
			throw new IllegalArgumentException("Compilation target must not be empty");
		}
		this.target = target;
	}
}
