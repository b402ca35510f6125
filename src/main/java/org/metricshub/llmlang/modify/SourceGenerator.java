package org.metricshub.llmlang.modify;

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

import java.util.Map;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.frontend.ast.NodeKind;

/**
 * Pretty-prints a syntax tree back to LLM.lang source, four spaces per
 * indentation level.
 * <p>
 * The output re-parses to a tree equal to the input (locations aside), which
 * is what lets self-modified programs be written back to disk.
 */
public final class SourceGenerator {

	private static final String INDENT = "    ";

	/** Calls and member access */
	private static final int CALL_PRECEDENCE = 9;
	private static final int PRIMARY_PRECEDENCE = 10;

	private SourceGenerator() {
		/* utility class */
	}

	/**
	 * Generates source for any node: whole programs and statements are
	 * rendered as lines, expressions as a single fragment.
	 *
	 * @param node the node to print
	 * @return the source text
	 */
	public static String generate(Node node) {
		StringBuilder out = new StringBuilder();
		switch (node.getKind()) {
		case PROGRAM:
			for (Node item : node.getChildren()) {
				statement(item, 0, out);
			}
			break;
		case BLOCK:
			out.append(block(node, 0));
			break;
		case PARAMETER:
			out.append(parameter(node));
			break;
		case CASE:
			out.append(whenCase(node, 0));
			break;
		case PATH:
			out.append(path(node, 0));
			break;
		case CONTEXT:
		case FUNCTION:
		case VARIABLE:
		case STATEMENT:
		case IF:
		case WHEN:
		case FOR:
		case RETURN:
		case WITH:
		case WITHIN:
		case INTENT:
		case PARALLEL:
		case APPLY:
		case SEMANTIC:
		case VECTOR:
			statement(node, 0, out);
			break;
		default:
			out.append(expression(node));
			break;
		}
		return out.toString();
	}

	private static void statement(Node node, int depth, StringBuilder out) {
		String indent = indent(depth);
		switch (node.getKind()) {
		case CONTEXT:
			out.append(indent).append("context ").append(node.getAttribute("name")).append(" {\n");
			for (Node member : node.getChildren()) {
				statement(member, depth + 1, out);
			}
			out.append(indent).append("}\n");
			break;
		case FUNCTION:
			out.append(indent).append(function(node, depth)).append('\n');
			break;
		case VARIABLE:
			out.append(indent).append("var ").append(node.getAttribute("name"));
			if (node.hasAttribute("type")) {
				out.append(": ").append(node.getAttribute("type"));
			}
			out.append(" = ").append(expression(node.getChild(0))).append(";\n");
			break;
		case STATEMENT:
			Node inner = node.getChild(0);
			if (inner != null && inner.getKind() == NodeKind.BLOCK) {
				out.append(indent).append(block(inner, depth)).append('\n');
			} else {
				out.append(indent).append(expression(inner)).append(";\n");
			}
			break;
		case IF:
			out.append(indent).append(ifStatement(node, depth)).append('\n');
			break;
		case WHEN:
			out.append(indent).append("when (").append(expression(node.getChild(0))).append(") {\n");
			for (int i = 1; i < node.getChildCount(); i++) {
				out.append(indent(depth + 1)).append(whenCase(node.getChild(i), depth + 1)).append('\n');
			}
			out.append(indent).append("}\n");
			break;
		case FOR:
			out
					.append(indent)
					.append("for (")
					.append(node.getAttribute("variable"))
					.append(" in ")
					.append(expression(node.getChild(0)))
					.append(") ")
					.append(block(node.getChild(1), depth))
					.append('\n');
			break;
		case RETURN:
			if (node.getChildCount() == 0) {
				out.append(indent).append("return;\n");
			} else {
				out.append(indent).append("return ").append(expression(node.getChild(0))).append(";\n");
			}
			break;
		case WITH:
			out
					.append(indent)
					.append("with context ")
					.append(quote(node.getAttribute("name")))
					.append(' ')
					.append(block(node.getChild(0), depth))
					.append('\n');
			break;
		case WITHIN:
			out
					.append(indent)
					.append("within ")
					.append(quote(node.getAttribute("name")))
					.append(' ')
					.append(block(node.getChild(0), depth))
					.append('\n');
			break;
		case INTENT:
			out.append(indent).append("intent: ").append(expression(node.getChild(0))).append(";\n");
			break;
		case PARALLEL:
			out.append(indent).append("parallel {\n");
			for (Node path : node.getChildren()) {
				out.append(indent(depth + 1)).append(path(path, depth + 1)).append('\n');
			}
			out.append(indent).append("} select ").append(node.getAttribute("strategy")).append(";\n");
			break;
		case APPLY:
			out
					.append(indent)
					.append("apply ")
					.append(expression(node.getChild(0)))
					.append(" to ")
					.append(block(node.getChild(1), depth))
					.append('\n');
			break;
		case VECTOR:
			out
					.append(indent)
					.append("vector ")
					.append(node.getAttribute("name"))
					.append(" = ")
					.append(expression(node.getChild(0)))
					.append(";\n");
			break;
		case SEMANTIC:
			out.append(indent).append(semantic(node)).append('\n');
			break;
		case BLOCK:
			out.append(indent).append(block(node, depth)).append('\n');
			break;
		default:
			// a bare expression where a statement is expected
			out.append(indent).append(expression(node)).append(";\n");
			break;
		}
	}

	private static String function(Node node, int depth) {
		StringBuilder text = new StringBuilder("fn ").append(node.getAttribute("name")).append('(');
		Node body = null;
		boolean first = true;
		for (Node child : node.getChildren()) {
			if (child.getKind() == NodeKind.PARAMETER) {
				if (!first) {
					text.append(", ");
				}
				text.append(parameter(child));
				first = false;
			} else {
				body = child;
			}
		}
		text.append(')');
		if (node.hasAttribute("return_type")) {
			text.append(" -> ").append(node.getAttribute("return_type"));
		}
		return text.append(' ').append(body == null ? "{\n" + indent(depth) + "}" : block(body, depth)).toString();
	}

	private static String parameter(Node node) {
		return node.getAttribute("name") + ": " + node.getAttribute("type");
	}

	private static String block(Node node, int depth) {
		StringBuilder text = new StringBuilder("{\n");
		for (Node statement : node.getChildren()) {
			statement(statement, depth + 1, text);
		}
		return text.append(indent(depth)).append('}').toString();
	}

	private static String ifStatement(Node node, int depth) {
		StringBuilder text = new StringBuilder("if (")
				.append(expression(node.getChild(0)))
				.append(") ")
				.append(block(node.getChild(1), depth));
		Node elseBranch = node.getChild(2);
		if (elseBranch != null) {
			text.append(" else ");
			if (elseBranch.getKind() == NodeKind.IF) {
				text.append(ifStatement(elseBranch, depth));
			} else {
				text.append(block(elseBranch, depth));
			}
		}
		return text.toString();
	}

	private static String whenCase(Node node, int depth) {
		Node pattern = node.getChild(0);
		String head = pattern.getKind() == NodeKind.OTHERWISE ? "otherwise" : expression(pattern);
		return head + " => " + block(node.getChild(1), depth);
	}

	private static String path(Node node, int depth) {
		return node.getAttribute("name") + ": " + block(node.getChild(0), depth);
	}

	private static String semantic(Node node) {
		String token = node.getAttribute("token");
		if ("@remember".equals(token)) {
			return token + " " + node.getAttribute("name") + " = " + expression(node.getChild(0)) + ";";
		}
		if ("@recall".equals(token)) {
			return node.hasAttribute("key") ? token + "(" + quote(node.getAttribute("key")) + ");" : token + ";";
		}
		StringBuilder text = new StringBuilder(token).append('(');
		boolean first = true;
		for (Map.Entry<String, String> attribute : node.getAttributes().entrySet()) {
			if ("token".equals(attribute.getKey())) {
				continue;
			}
			if (!first) {
				text.append(", ");
			}
			text.append(attribute.getKey()).append(": ").append(quote(attribute.getValue()));
			first = false;
		}
		return text.append(");").toString();
	}

	private static String expression(Node node) {
		if (node == null) {
			return "null";
		}
		switch (node.getKind()) {
		case ASSIGNMENT:
			return expression(node.getChild(0)) + " = " + expression(node.getChild(1));
		case BINARY:
			String operator = node.getAttribute("operator");
			int precedence = precedence(node);
			if (".".equals(operator)) {
				return operand(node.getChild(0), precedence, false) + "." + node.getAttribute("name");
			}
			return operand(node.getChild(0), precedence, false) + " " + operator + " "
					+ operand(node.getChild(1), precedence, true);
		case UNARY:
			return node.getAttribute("operator") + operand(node.getChild(0), precedence(node), false);
		case LITERAL:
			return literal(node);
		case IDENTIFIER:
			return node.getAttribute("name");
		case CALL:
			StringBuilder call = new StringBuilder(operand(node.getChild(0), CALL_PRECEDENCE, false)).append('(');
			for (int i = 1; i < node.getChildCount(); i++) {
				if (i > 1) {
					call.append(", ");
				}
				call.append(expression(node.getChild(i)));
			}
			return call.append(')').toString();
		case NATURAL_LANGUAGE:
			return "#\"" + node.getAttribute("value") + "\"#";
		case GROUPING:
			return "(" + expression(node.getChild(0)) + ")";
		case LIST:
			StringBuilder list = new StringBuilder("[");
			for (int i = 0; i < node.getChildCount(); i++) {
				if (i > 0) {
					list.append(", ");
				}
				list.append(expression(node.getChild(i)));
			}
			return list.append(']').toString();
		case OTHERWISE:
			return "otherwise";
		case STATEMENT:
			Node inner = node.getChild(0);
			if (inner != null && inner.getKind() != NodeKind.BLOCK) {
				return expression(inner);
			}
			return generate(node).trim();
		default:
			// statements nested where an expression is expected
			return generate(node).trim();
		}
	}

	/**
	 * Prints an operand, in parentheses when it binds more loosely than its
	 * parent operator. Operators are left-associative, so a right operand of
	 * the same precedence needs them too.
	 */
	private static String operand(Node node, int parentPrecedence, boolean right) {
		String text = expression(node);
		int precedence = precedence(node);
		if (precedence < parentPrecedence || (right && precedence == parentPrecedence)) {
			return "(" + text + ")";
		}
		return text;
	}

	private static int precedence(Node node) {
		if (node == null) {
			return PRIMARY_PRECEDENCE;
		}
		switch (node.getKind()) {
		case ASSIGNMENT:
			return 1;
		case BINARY:
			switch (String.valueOf(node.getAttribute("operator"))) {
			case "or":
				return 2;
			case "and":
				return 3;
			case "==":
			case "!=":
				return 4;
			case "<":
			case ">":
			case "<=":
			case ">=":
				return 5;
			case "+":
			case "-":
				return 6;
			case "*":
			case "/":
			case "%":
				return 7;
			default:
				return CALL_PRECEDENCE;
			}
		case UNARY:
			return 8;
		case LITERAL:
			// -9223372036854775808 is a literal, but reads like a unary minus
			String value = node.getAttribute("value");
			return value != null && value.startsWith("-") ? 8 : PRIMARY_PRECEDENCE;
		default:
			return PRIMARY_PRECEDENCE;
		}
	}

	private static String literal(Node node) {
		String type = node.getAttribute("type");
		String value = node.getAttribute("value");
		if ("String".equals(type)) {
			return quote(value);
		}
		if ("Null".equals(type)) {
			return "null";
		}
		return value;
	}

	/**
	 * Quotes a string the way the lexer reads it back.
	 *
	 * @param value raw string
	 * @return the double-quoted, escaped literal
	 */
	static String quote(String value) {
		StringBuilder text = new StringBuilder("\"");
		String raw = value == null ? "" : value;
		for (int i = 0; i < raw.length(); i++) {
			char c = raw.charAt(i);
			switch (c) {
			case '"':
				text.append("\\\"");
				break;
			case '\\':
				text.append("\\\\");
				break;
			case '\n':
				text.append("\\n");
				break;
			case '\t':
				text.append("\\t");
				break;
			case '\r':
				text.append("\\r");
				break;
			case '\0':
				text.append("\\0");
				break;
			default:
				text.append(c);
				break;
			}
		}
		return text.append('"').toString();
	}

	private static String indent(int depth) {
		StringBuilder text = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			text.append(INDENT);
		}
		return text.toString();
	}
}
