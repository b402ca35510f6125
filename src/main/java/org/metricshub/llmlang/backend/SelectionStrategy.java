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

import java.util.Locale;

/**
 * How a {@code parallel} statement turns the results of its paths into one
 * value.
 */
public enum SelectionStrategy {
	/** List of every result, in declaration order */
	ALL,
	/** Result of the successful path with the lowest wall time */
	FASTEST,
	/**
	 * Result of the first path, in declaration order, whose result is truthy;
	 * the first successful path when none is
	 */
	BEST;

	/**
	 * @param name strategy name as written after {@code select}
	 * @return the strategy, or {@code null} when the name is unknown
	 */
	public static SelectionStrategy fromName(String name) {
		if (name == null) {
			return null;
		}
		for (SelectionStrategy strategy : values()) {
			if (strategy.getName().equals(name)) {
				return strategy;
			}
		}
		return null;
	}

	/**
	 * @return the name as written in source
	 */
	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
