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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * A simple container for the parameters of a single LLM.lang execution.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking LLM.lang programmatically, from within Java code.
 */
public class ExecuteOptions {

	/** Default number of threads running parallel paths */
	public static final int DEFAULT_PARALLELISM = 4;

	/** Default maximum depth of nested function calls */
	public static final int DEFAULT_MAX_CALL_DEPTH = 512;

	/**
	 * Whether the engine logs its progress at debug level and dumps
	 * statistics when done; <code>false</code> by default.
	 */
	private boolean debug = false;

	/**
	 * Approximate memory budget in bytes;
	 * <code>null</code> (unlimited) by default.
	 */
	private Long maxMemory = null;

	/**
	 * Wall-clock budget in milliseconds;
	 * <code>null</code> (unlimited) by default.
	 */
	private Long maxTime = null;

	/**
	 * Whether {@code parallel} statements may run;
	 * <code>true</code> by default.
	 */
	private boolean parallel = true;

	/**
	 * Whether vector features ({@code vector}, {@code apply}) are enabled;
	 * <code>true</code> by default.
	 */
	private boolean vectors = true;

	/**
	 * Whether natural-language features ({@code intent}, {@code #"..."#}) are
	 * enabled; <code>true</code> by default.
	 */
	private boolean nlp = true;

	/**
	 * Whether {@code @modify} may edit programs;
	 * <code>true</code> by default.
	 */
	private boolean selfModifying = true;

	/**
	 * Maximum number of threads running the paths of one {@code parallel}
	 * statement; {@value #DEFAULT_PARALLELISM} by default.
	 */
	private int parallelism = DEFAULT_PARALLELISM;

	/**
	 * Maximum depth of nested function calls;
	 * {@value #DEFAULT_MAX_CALL_DEPTH} by default.
	 */
	private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;

	/**
	 * Output stream of {@code print};
	 * <code>System.out</code> by default.
	 */
	private PrintStream outputStream = System.out;

	/**
	 * @return a human readable representation of the option values
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();
		final char newLine = '\n';
		desc.append("debug = ").append(isDebug()).append(newLine);
		desc.append("maxMemory = ").append(getMaxMemory()).append(newLine);
		desc.append("maxTime = ").append(getMaxTime()).append(newLine);
		desc.append("parallel = ").append(isParallel()).append(newLine);
		desc.append("vectors = ").append(isVectors()).append(newLine);
		desc.append("nlp = ").append(isNlp()).append(newLine);
		desc.append("selfModifying = ").append(isSelfModifying()).append(newLine);
		desc.append("parallelism = ").append(getParallelism()).append(newLine);
		desc.append("maxCallDepth = ").append(getMaxCallDepth()).append(newLine);
		return desc.toString();
	}

	public boolean isDebug() {
		return debug;
	}

	public void setDebug(boolean debug) {
		this.debug = debug;
	}

	/**
	 * @return the memory budget in bytes, or {@code null} when unlimited
	 */
	public Long getMaxMemory() {
		return maxMemory;
	}

	/**
	 * @param maxMemory memory budget in bytes, {@code null} for no limit
	 */
	public void setMaxMemory(Long maxMemory) {
		this.maxMemory = maxMemory;
	}

	/**
	 * @return the time budget in milliseconds, or {@code null} when unlimited
	 */
	public Long getMaxTime() {
		return maxTime;
	}

	/**
	 * @param maxTime time budget in milliseconds, {@code null} for no limit
	 */
	public void setMaxTime(Long maxTime) {
		this.maxTime = maxTime;
	}

	public boolean isParallel() {
		return parallel;
	}

	public void setParallel(boolean parallel) {
		this.parallel = parallel;
	}

	public boolean isVectors() {
		return vectors;
	}

	public void setVectors(boolean vectors) {
		this.vectors = vectors;
	}

	public boolean isNlp() {
		return nlp;
	}

	public void setNlp(boolean nlp) {
		this.nlp = nlp;
	}

	public boolean isSelfModifying() {
		return selfModifying;
	}

	public void setSelfModifying(boolean selfModifying) {
		this.selfModifying = selfModifying;
	}

	public int getParallelism() {
		return parallelism;
	}

	/**
	 * @param parallelism number of threads, at least 1
	 */
	public void setParallelism(int parallelism) {
		if (parallelism < 1) {
			throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
		}
		this.parallelism = parallelism;
	}

	public int getMaxCallDepth() {
		return maxCallDepth;
	}

	/**
	 * @param maxCallDepth maximum call depth, at least 1
	 */
	public void setMaxCallDepth(int maxCallDepth) {
		if (maxCallDepth < 1) {
			throw new IllegalArgumentException("Maximum call depth must be at least 1: " + maxCallDepth);
		}
		this.maxCallDepth = maxCallDepth;
	}

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param outputStream the output stream to set
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream outputStream) {
		this.outputStream = outputStream;
	}
}
