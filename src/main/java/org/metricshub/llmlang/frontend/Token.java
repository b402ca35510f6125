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

import java.util.Objects;

/**
 * One lexical token: its kind, its textual value and where it was read.
 */
public final class Token {

	private final TokenKind kind;
	private final String value;
	private final SourceSpan location;

	public Token(TokenKind kind, String value, SourceSpan location) {
		this.kind = Objects.requireNonNull(kind, "Token kind must not be null");
		this.value = value == null ? "" : value;
		this.location = location == null ? SourceSpan.UNKNOWN : location;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getValue() {
		return value;
	}

	public SourceSpan getLocation() {
		return location;
	}

	/**
	 * @param expectedKind kind to compare with
	 * @param expectedValue value to compare with
	 * @return whether this token has the given kind and value
	 */
	public boolean is(TokenKind expectedKind, String expectedValue) {
		return kind == expectedKind && value.equals(expectedValue);
	}

	public boolean isKeyword(String keyword) {
		return is(TokenKind.KEYWORD, keyword);
	}

	public boolean isOperator(String operator) {
		return is(TokenKind.OPERATOR, operator);
	}

	public boolean isDelimiter(String delimiter) {
		return is(TokenKind.DELIMITER, delimiter);
	}

	/**
	 * Human readable rendition used in error messages.
	 *
	 * @return description of the token
	 */
	public String describe() {
		if (kind == TokenKind.EOF) {
			return "end of input";
		}
		return kind.name() + " '" + value + "'";
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return kind + "(" + value + ")@" + location;
	}
}
