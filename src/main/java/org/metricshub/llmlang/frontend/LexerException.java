package org.metricshub.llmlang.frontend;

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

import org.metricshub.llmlang.LlmException;

/**
 * Raised by the {@link Lexer} on the first malformed piece of input.
 */
public class LexerException extends LlmException {

	private static final long serialVersionUID = 1L;

	/**
	 * What went wrong while scanning.
	 */
	public enum Kind {
		UNEXPECTED_CHARACTER,
		UNTERMINATED_STRING,
		UNTERMINATED_COMMENT,
		UNTERMINATED_NATURAL_LANGUAGE,
		UNTERMINATED_SEMANTIC_TYPE,
		INVALID_NUMBER
	}

	private final Kind kind;

	public LexerException(Kind kind, String message, SourceSpan location) {
		super(message, location);
		this.kind = kind;
	}

	public Kind getKind() {
		return kind;
	}

	@Override
	public String getStage() {
		return "Lexer";
	}
}
