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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.metricshub.llmlang.LlmException;
import org.metricshub.llmlang.frontend.Parser;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.frontend.ast.NodeKind;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;

/**
 * One edit of a syntax tree, addressed by a path of child indices from the
 * root.
 */
public final class Modification {

	/** Description given to code snippets parsed for a modification */
	public static final String SNIPPET_FILE = "<modification>";

	/**
	 * Kinds of edit.
	 */
	public enum Type {
		/** Replace the node at the path */
		REPLACE,
		/** Insert a child into the node at the path */
		INSERT,
		/** Remove the node at the path from its parent */
		DELETE,
		/** Set one attribute of the node at the path */
		MODIFY_ATTRIBUTE
	}

	private final Type type;
	private final List<Integer> path;
	private final Node node;
	private final int position;
	private final String name;
	private final String value;

	private Modification(Type type, List<Integer> path, Node node, int position, String name, String value) {
		this.type = type;
		this.path = Collections.unmodifiableList(new ArrayList<Integer>(path));
		this.node = node;
		this.position = position;
		this.name = name;
		this.value = value;
	}

	public static Modification replace(List<Integer> path, Node node) {
		return new Modification(Type.REPLACE, path, Objects.requireNonNull(node, "Replacement must not be null"), -1, null, null);
	}

	public static Modification insert(List<Integer> path, int position, Node node) {
		return new Modification(Type.INSERT, path, Objects.requireNonNull(node, "Inserted node must not be null"), position, null, null);
	}

	public static Modification delete(List<Integer> path) {
		return new Modification(Type.DELETE, path, null, -1, null, null);
	}

	public static Modification modifyAttribute(List<Integer> path, String name, String value) {
		return new Modification(
				Type.MODIFY_ATTRIBUTE,
				path,
				null,
				-1,
				Objects.requireNonNull(name, "Attribute name must not be null"),
				Objects.requireNonNull(value, "Attribute value must not be null"));
	}

	/**
	 * Parses a dot-separated path such as {@code "0.1.2"}; the empty string is
	 * the root.
	 *
	 * @param path textual path
	 * @return child indices
	 * @throws LlmRuntimeException {@link RuntimeErrorKind#MODIFICATION_FAILED}
	 *         on anything but non-negative integers
	 */
	public static List<Integer> parsePath(String path) {
		List<Integer> indices = new ArrayList<Integer>();
		if (path == null || path.trim().isEmpty()) {
			return indices;
		}
		for (String segment : path.trim().split("\\.", -1)) {
			indices.add(parseIndex(segment, "path segment"));
		}
		return indices;
	}

	/**
	 * Builds a modification from the attributes of an {@code @modify}
	 * statement. The {@code code} snippet is parsed as a program; a program of
	 * one item yields that item.
	 *
	 * @param attributes {@code operation}, {@code path} and the keys the
	 *        operation needs
	 * @return the modification
	 */
	public static Modification fromAttributes(Map<String, String> attributes) {
		String operation = attributes.get("operation");
		List<Integer> path = parsePath(attributes.get("path"));
		if ("replace".equals(operation)) {
			return replace(path, parseSnippet(require(attributes, "code")));
		}
		if ("insert".equals(operation)) {
			int position = parseIndex(require(attributes, "position"), "position");
			return insert(path, position, parseSnippet(require(attributes, "code")));
		}
		if ("delete".equals(operation)) {
			return delete(path);
		}
		if ("modify".equals(operation)) {
			return modifyAttribute(path, require(attributes, "name"), require(attributes, "value"));
		}
		throw new LlmRuntimeException(RuntimeErrorKind.MODIFICATION_FAILED, "Unknown modification operation: '" + operation + "'");
	}

	/**
	 * An expression statement such as {@code 5;} yields its expression;
	 * {@link AstEditor} wraps it back when it lands among statements.
	 *
	 * @param code LLM.lang source
	 * @return its only top-level item, or the whole program
	 */
	public static Node parseSnippet(String code) {
		Node program;
		try {
			program = Parser.parse(code, SNIPPET_FILE);
		} catch (LlmException e) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.MODIFICATION_FAILED,
					"Invalid replacement code: " + e.toDisplayString(),
					null,
					e);
		}
		if (program.getChildCount() != 1) {
			return program;
		}
		Node item = program.getChild(0);
		Node expression = item.getChild(0);
		if (item.getKind() == NodeKind.STATEMENT && expression != null && expression.getKind() != NodeKind.BLOCK) {
			return expression;
		}
		return item;
	}

	private static String require(Map<String, String> attributes, String key) {
		String value = attributes.get(key);
		if (value == null) {
			throw new LlmRuntimeException(RuntimeErrorKind.MODIFICATION_FAILED, "Missing modification argument: '" + key + "'");
		}
		return value;
	}

	private static int parseIndex(String text, String what) {
		try {
			int index = Integer.parseInt(text.trim());
			if (index >= 0) {
				return index;
			}
		} catch (NumberFormatException e) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.MODIFICATION_FAILED,
					"Invalid " + what + ": '" + text + "'",
					null,
					e);
		}
		throw new LlmRuntimeException(RuntimeErrorKind.MODIFICATION_FAILED, "Invalid " + what + ": '" + text + "'");
	}

	public Type getType() {
		return type;
	}

	public List<Integer> getPath() {
		return path;
	}

	/**
	 * @return the replacement or inserted node, {@code null} for the other types
	 */
	public Node getNode() {
		return node;
	}

	public int getPosition() {
		return position;
	}

	public String getName() {
		return name;
	}

	public String getValue() {
		return value;
	}

	@Override
	public String toString() {
		StringBuilder description = new StringBuilder(type.name()).append(" at ").append(path);
		if (type == Type.INSERT) {
			description.append(" position ").append(position);
		} else if (type == Type.MODIFY_ATTRIBUTE) {
			description.append(' ').append(name).append('=').append(value);
		}
		return description.toString();
	}
}
