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

/**
 * Figures measured while running a program.
 */
public final class ExecutionStats {

	private final long executionTime;
	private final long peakMemory;
	private final long instructions;

	/**
	 * @param executionTime wall time in milliseconds
	 * @param peakMemory highest approximate memory use in bytes
	 * @param instructions number of nodes executed
	 */
	public ExecutionStats(long executionTime, long peakMemory, long instructions) {
		this.executionTime = executionTime;
		this.peakMemory = peakMemory;
		this.instructions = instructions;
	}

	/**
	 * @return wall time in milliseconds
	 */
	public long getExecutionTime() {
		return executionTime;
	}

	/**
	 * @return highest approximate memory use in bytes
	 */
	public long getPeakMemory() {
		return peakMemory;
	}

	/**
	 * @return number of nodes executed, parallel paths included
	 */
	public long getInstructions() {
		return instructions;
	}

	/**
	 * @return the statistics as printed by {@code --stats}
	 */
	public String toDescriptionString() {
		return "Execution time: " + executionTime + " ms\n"
				+ "Peak memory: " + peakMemory + " bytes\n"
				+ "Instructions: " + instructions + "\n";
	}

	@Override
	public String toString() {
		return "ExecutionStats{executionTime=" + executionTime + ", peakMemory=" + peakMemory + ", instructions=" + instructions + "}";
	}
}
