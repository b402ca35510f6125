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
 * Raised by the {@link Parser} on the first token that does not fit the
 * grammar.
 */
public class ParserException extends LlmException {

	private static final long serialVersionUID = 1L;

	/**
	 * What went wrong while parsing.
	 */
	public enum Kind {
		UNEXPECTED_TOKEN,
		UNEXPECTED_END_OF_INPUT,
		INVALID_SYNTAX
	}

	private final Kind kind;
	private final transient Token token;
	private final String expected;

	public ParserException(Kind kind, String message, Token token, String expected) {
		super(message, token == null ? null : token.getLocation());
		this.kind = kind;
		this.token = token;
		this.expected = expected;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * @return the offending token
	 */
	public Token getToken() {
		return token;
	}

	/**
	 * @return description of what the parser expected, may be {@code null}
	 */
	public String getExpected() {
		return expected;
	}

	@Override
	public String getStage() {
		return "Parser";
	}
}
