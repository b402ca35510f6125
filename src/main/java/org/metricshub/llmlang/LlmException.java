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

import org.metricshub.llmlang.frontend.SourceSpan;

/**
 * Base class of every error raised while compiling or running an LLM.lang
 * program. Each pipeline stage has its own subclass carrying a closed
 * {@code Kind} enumeration, so callers can either catch this class or
 * the stage they care about.
 */
public abstract class LlmException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final transient SourceSpan location;

	protected LlmException(String message, SourceSpan location) {
		super(message);
		this.location = location == null ? SourceSpan.UNKNOWN : location;
	}

	protected LlmException(String message, SourceSpan location, Throwable cause) {
		super(message, cause);
		this.location = location == null ? SourceSpan.UNKNOWN : location;
	}

	/**
	 * @return name of the stage that raised the error ({@code Lexer},
	 *         {@code Parser}, {@code Semantic} or {@code Runtime})
	 */
	public abstract String getStage();

	/**
	 * @return where the error happened, {@link SourceSpan#UNKNOWN} if nowhere
	 *         in particular
	 */
	public SourceSpan getLocation() {
		return location;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return location.getStartLine() > 0 ? location.getStartLine() : -1;
	}

	/**
	 * Formats the error as {@code "<Stage> error: message at file:line:column"}.
	 *
	 * @return the display string
	 */
	public String toDisplayString() {
		if (getLineNumber() < 0) {
			return getStage() + " error: " + getMessage();
		}
		return getStage() + " error: " + getMessage() + " at " + location;
	}
}
