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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Source of the SLF4J loggers used by the interpreter.
 * <p>
 * Every logger is named after its class, so the whole interpreter logs
 * under {@link #ROOT_LOGGER_NAME}: the engine reports context creation
 * and parallel path selection, the parallel executor reports branch
 * timings, and the modification manager reports each program it rewrites
 * on disk. Embedders pick the verbosity with their
 * own SLF4J binding; the test suite routes everything through
 * slf4j-simple, configured by {@code simplelogger.properties}.
 * <p>
 * SLF4J's own initialization chatter (missing or duplicate bindings) is
 * limited to warnings.
 */
public final class LlmLogger {

	/**
	 * Name of the logger that every interpreter logger descends from
	 */
	public static final String ROOT_LOGGER_NAME = "org.metricshub.llmlang";

	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
	}

	/**
	 * Private constructor to prevent instantiation.
	 */
	private LlmLogger() {
		// utility class
	}

	/**
	 * @param clazz interpreter class that logs
	 * @return the logger named after {@code clazz}
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}
}
