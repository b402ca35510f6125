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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns LLM.lang source text into a list of {@link Token}s.
 * <p>
 * The scanner walks the source string by index in a single forward pass
 * and stops at the first error. The returned list always ends with exactly
 * one {@link TokenKind#EOF} token.
 */
public class Lexer {

	/** Reserved words of the language */
	public static final Set<String> KEYWORDS = Collections
			.unmodifiableSet(
					new HashSet<String>(
							Arrays
									.asList(
											"context",
											"fn",
											"var",
											"if",
											"else",
											"when",
											"otherwise",
											"parallel",
											"select",
											"return",
											"with",
											"within",
											"intent",
											"examples",
											"transform",
											"into",
											"apply",
											"for",
											"in",
											"true",
											"false",
											"null",
											"and",
											"or",
											"not",
											"vector",
											"to",
											"Int",
											"Float",
											"String",
											"Bool",
											"List",
											"Map",
											"Vector",
											"Context",
											"fastest",
											"best",
											"all",
											"path")));

	private static final Set<String> TWO_CHAR_OPERATORS = new HashSet<String>(
			Arrays.asList("+=", "-=", "->", "*=", "/=", "%=", "==", "=>", "!=", "<=", ">=", "&&", "||"));

	private static final String SINGLE_CHAR_OPERATORS = "+-*/%=!<>&|^";

	private static final String DELIMITERS = "(){}[];,.:";

	private final String source;
	private final String file;
	private final int length;

	private int pos;
	private int line = 1;
	private int column = 1;

	// start of the token being scanned
	private int tokenLine;
	private int tokenColumn;

	/**
	 * Creates a lexer for an anonymous source (reported as {@code <input>}).
	 *
	 * @param source the program text
	 */
	public Lexer(String source) {
		this(source, SourceSpan.DEFAULT_FILE);
	}

	/**
	 * Creates a lexer.
	 *
	 * @param source the program text
	 * @param file description of the source used in locations
	 */
	public Lexer(String source, String file) {
		this.source = source == null ? "" : source;
		this.file = file == null ? SourceSpan.DEFAULT_FILE : file;
		this.length = this.source.length();
	}

	/**
	 * Scans the whole source.
	 *
	 * @return the tokens, terminated by one EOF token
	 * @throws LexerException on the first lexical error
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<Token>();
		while (true) {
			skipWhitespaceAndComments();
			markTokenStart();
			if (pos >= length) {
				tokens.add(new Token(TokenKind.EOF, "", SourceSpan.at(line, column, file)));
				return tokens;
			}
			tokens.add(nextToken());
		}
	}

	private Token nextToken() {
		char c = source.charAt(pos);
		if (isIdentifierStart(c)) {
			String word = readIdentifier();
			return token(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, word);
		}
		if (isDigit(c)) {
			return readNumber();
		}
		if (c == '"') {
			return readString();
		}
		if (c == '#' && peek(1) == '"') {
			return readNaturalLanguage();
		}
		if (c == '@') {
			advance();
			if (pos >= length || !isIdentifierStart(source.charAt(pos))) {
				throw lexerException(LexerException.Kind.UNEXPECTED_CHARACTER, "Expected a name after '@'");
			}
			return token(TokenKind.SEMANTIC, "@" + readIdentifier());
		}
		if (c == '~') {
			return readSemanticType();
		}
		if (pos + 1 < length && TWO_CHAR_OPERATORS.contains(source.substring(pos, pos + 2))) {
			String op = source.substring(pos, pos + 2);
			advance();
			advance();
			return token(TokenKind.OPERATOR, op);
		}
		if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0) {
			advance();
			return token(TokenKind.OPERATOR, String.valueOf(c));
		}
		if (DELIMITERS.indexOf(c) >= 0) {
			advance();
			return token(TokenKind.DELIMITER, String.valueOf(c));
		}
		int codePoint = source.codePointAt(pos);
		throw lexerException(
				LexerException.Kind.UNEXPECTED_CHARACTER,
				"Unexpected character: '" + new String(Character.toChars(codePoint)) + "'");
	}

	private void skipWhitespaceAndComments() {
		while (pos < length) {
			char c = source.charAt(pos);
			if (Character.isWhitespace(c)) {
				advance();
			} else if (c == '/' && peek(1) == '/') {
				while (pos < length && source.charAt(pos) != '\n') {
					advance();
				}
			} else if (c == '/' && peek(1) == '*') {
				skipBlockComment();
			} else {
				return;
			}
		}
	}

	// block comments nest: /* outer /* inner */ still outer */
	private void skipBlockComment() {
		markTokenStart();
		advance();
		advance();
		int depth = 1;
		while (depth > 0) {
			if (pos >= length) {
				throw lexerException(LexerException.Kind.UNTERMINATED_COMMENT, "Unterminated block comment");
			}
			char c = source.charAt(pos);
			if (c == '/' && peek(1) == '*') {
				advance();
				advance();
				depth++;
			} else if (c == '*' && peek(1) == '/') {
				advance();
				advance();
				depth--;
			} else {
				advance();
			}
		}
	}

	private String readIdentifier() {
		int start = pos;
		while (pos < length && isIdentifierPart(source.charAt(pos))) {
			advance();
		}
		return source.substring(start, pos);
	}

	private Token readNumber() {
		int start = pos;
		boolean isFloat = false;
		while (pos < length && isDigit(source.charAt(pos))) {
			advance();
		}
		if (peek(0) == '.' && isDigit(peek(1))) {
			isFloat = true;
			advance();
			while (pos < length && isDigit(source.charAt(pos))) {
				advance();
			}
		}
		char e = peek(0);
		if (e == 'e' || e == 'E') {
			char next = peek(1);
			if (isDigit(next) || ((next == '+' || next == '-') && isDigit(peek(2)))) {
				isFloat = true;
				advance();
				if (next == '+' || next == '-') {
					advance();
				}
				while (pos < length && isDigit(source.charAt(pos))) {
					advance();
				}
			}
		}
		String text = source.substring(start, pos);
		if (isFloat) {
			double value = Double.parseDouble(text);
			if (Double.isInfinite(value)) {
				throw lexerException(LexerException.Kind.INVALID_NUMBER, "Invalid number: " + text);
			}
			return token(TokenKind.FLOAT_LITERAL, text);
		}
		try {
			// 9223372036854775808 passes here, the parser accepts it after a minus only
			Long.parseLong("-" + text);
		} catch (NumberFormatException e1) {
			throw lexerException(LexerException.Kind.INVALID_NUMBER, "Invalid number: " + text);
		}
		return token(TokenKind.INT_LITERAL, text);
	}

	/**
	 * Reads a double-quoted string and decodes its escape sequences.
	 * Unknown escapes keep the escaped character.
	 */
	private Token readString() {
		advance();
		StringBuilder text = new StringBuilder();
		while (true) {
			if (pos >= length) {
				throw lexerException(LexerException.Kind.UNTERMINATED_STRING, "Unterminated string");
			}
			char c = source.charAt(pos);
			if (c == '"') {
				advance();
				return token(TokenKind.STRING_LITERAL, text.toString());
			}
			if (c == '\\') {
				advance();
				if (pos >= length) {
					throw lexerException(LexerException.Kind.UNTERMINATED_STRING, "Unterminated string");
				}
				char escaped = source.charAt(pos);
				switch (escaped) {
				case 'n':
					text.append('\n');
					break;
				case 't':
					text.append('\t');
					break;
				case 'r':
					text.append('\r');
					break;
				case '0':
					text.append('\0');
					break;
				default:
					text.appendCodePoint(source.codePointAt(pos));
					break;
				}
				advance();
			} else {
				text.appendCodePoint(source.codePointAt(pos));
				advance();
			}
		}
	}

	// #"free text"#
	private Token readNaturalLanguage() {
		advance();
		advance();
		int start = pos;
		while (true) {
			if (pos >= length) {
				throw lexerException(
						LexerException.Kind.UNTERMINATED_NATURAL_LANGUAGE,
						"Unterminated natural language block");
			}
			if (source.charAt(pos) == '"' && peek(1) == '#') {
				String text = source.substring(start, pos);
				advance();
				advance();
				return token(TokenKind.NATURAL_LANGUAGE, text);
			}
			advance();
		}
	}

	// ~Name~
	private Token readSemanticType() {
		advance();
		int start = pos;
		while (true) {
			if (pos >= length || source.charAt(pos) == '\n') {
				throw lexerException(LexerException.Kind.UNTERMINATED_SEMANTIC_TYPE, "Unterminated semantic type");
			}
			if (source.charAt(pos) == '~') {
				String name = source.substring(start, pos);
				advance();
				return token(TokenKind.SEMANTIC_TYPE, name);
			}
			advance();
		}
	}

	private void advance() {
		int codePoint = source.codePointAt(pos);
		pos += Character.charCount(codePoint);
		if (codePoint == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
	}

	private char peek(int offset) {
		int index = pos + offset;
		return index < length ? source.charAt(index) : '\0';
	}

	private void markTokenStart() {
		tokenLine = line;
		tokenColumn = column;
	}

	private Token token(TokenKind kind, String value) {
		return new Token(kind, value, new SourceSpan(tokenLine, tokenColumn, line, column, file));
	}

	private LexerException lexerException(LexerException.Kind kind, String msg) {
		return new LexerException(kind, msg, new SourceSpan(tokenLine, tokenColumn, line, column, file));
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierPart(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
