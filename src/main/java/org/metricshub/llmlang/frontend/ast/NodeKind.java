package org.metricshub.llmlang.frontend.ast;

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
 * Every kind of syntax node. Children carry structure and attributes carry
 * scalars; the comment of each constant lists both.
 */
public enum NodeKind {
	/** children: top-level contexts, functions and statements */
	PROGRAM,
	/** attributes: name; children: functions and variables */
	CONTEXT,
	/** attributes: name, return_type?; children: parameters then the body block */
	FUNCTION,
	/** attributes: name, type */
	PARAMETER,
	/** attributes: name, type?; children: initializer */
	VARIABLE,
	/** children: one expression or block */
	STATEMENT,
	/** children: statements */
	BLOCK,
	/** children: condition, then block, optional else (block or if) */
	IF,
	/** children: subject, cases */
	WHEN,
	/** children: pattern (expression or otherwise), block */
	CASE,
	/** catch-all pattern of a when case */
	OTHERWISE,
	/** attributes: variable; children: collection, block */
	FOR,
	/** children: optional value */
	RETURN,
	/** attributes: name; children: block */
	WITH,
	/** attributes: name; children: block */
	WITHIN,
	/** children: intent expression */
	INTENT,
	/** attributes: strategy; children: paths */
	PARALLEL,
	/** attributes: name; children: block */
	PATH,
	/** children: vector expression, block */
	APPLY,
	/** attributes: token plus token specific keys; children: optional value */
	SEMANTIC,
	/** children: target, value */
	ASSIGNMENT,
	/** attributes: operator (and name for member access); children: left, right */
	BINARY,
	/** attributes: operator; children: operand */
	UNARY,
	/** attributes: type, value */
	LITERAL,
	/** attributes: name */
	IDENTIFIER,
	/** children: callee then arguments */
	CALL,
	/** attributes: value */
	NATURAL_LANGUAGE,
	/** attributes: name; children: text expression */
	VECTOR,
	/** children: parenthesized expression */
	GROUPING,
	/** children: elements */
	LIST
}
