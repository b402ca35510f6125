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
 * Runtime type of a {@link Value}.
 */
public enum ValueType {
	VOID("Void"),
	BOOL("Bool"),
	INT("Int"),
	FLOAT("Float"),
	STRING("String"),
	LIST("List"),
	MAP("Map"),
	FUNCTION("Function"),
	VECTOR("Vector"),
	CONTEXT("Context");

	private final String displayName;

	ValueType(String displayName) {
		this.displayName = displayName;
	}

	/**
	 * @return the name of the type as written in LLM.lang source
	 */
	public String getDisplayName() {
		return displayName;
	}
}
