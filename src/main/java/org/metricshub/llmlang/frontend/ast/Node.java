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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.metricshub.llmlang.frontend.SourceSpan;

/**
 * A syntax tree node: a kind, a location, ordered children and string
 * attributes.
 * <p>
 * Equality is structural and ignores locations, so a tree re-parsed from
 * generated source equals the original tree. The mutators are meant for the
 * self-modification subsystem; the rest of the pipeline treats trees as
 * read-only.
 */
public final class Node {

	private final NodeKind kind;
	private final SourceSpan location;
	private final List<Node> children = new ArrayList<Node>();
	private final Map<String, String> attributes = new LinkedHashMap<String, String>();

	public Node(NodeKind kind, SourceSpan location) {
		this.kind = Objects.requireNonNull(kind, "Node kind must not be null");
		this.location = location == null ? SourceSpan.UNKNOWN : location;
	}

	public NodeKind getKind() {
		return kind;
	}

	public SourceSpan getLocation() {
		return location;
	}

	/**
	 * @return read-only view of the children
	 */
	public List<Node> getChildren() {
		return Collections.unmodifiableList(children);
	}

	public int getChildCount() {
		return children.size();
	}

	/**
	 * @param index child index
	 * @return the child, or {@code null} when there is no such child
	 */
	public Node getChild(int index) {
		return index >= 0 && index < children.size() ? children.get(index) : null;
	}

	/**
	 * @return read-only view of the attributes
	 */
	public Map<String, String> getAttributes() {
		return Collections.unmodifiableMap(attributes);
	}

	/**
	 * @param name attribute name
	 * @return the value, or {@code null} when absent
	 */
	public String getAttribute(String name) {
		return attributes.get(name);
	}

	public boolean hasAttribute(String name) {
		return attributes.containsKey(name);
	}

	/**
	 * Appends a child.
	 *
	 * @param child the child (ignored when {@code null})
	 * @return this node
	 */
	public Node addChild(Node child) {
		if (child != null) {
			children.add(child);
		}
		return this;
	}

	/**
	 * Sets an attribute.
	 *
	 * @param name attribute name
	 * @param value attribute value
	 * @return this node
	 */
	public Node setAttribute(String name, String value) {
		attributes.put(Objects.requireNonNull(name, "Attribute name must not be null"), value);
		return this;
	}

	/**
	 * Replaces the child at {@code index}.
	 *
	 * @param index existing child index
	 * @param child new child
	 */
	public void setChild(int index, Node child) {
		children.set(index, Objects.requireNonNull(child, "Child must not be null"));
	}

	/**
	 * Inserts a child; {@code index} may equal the child count to append.
	 *
	 * @param index insertion position
	 * @param child new child
	 */
	public void insertChild(int index, Node child) {
		children.add(index, Objects.requireNonNull(child, "Child must not be null"));
	}

	/**
	 * @param index existing child index
	 * @return the removed child
	 */
	public Node removeChild(int index) {
		return children.remove(index);
	}

	/**
	 * @return a deep copy of this subtree, locations included
	 */
	public Node deepCopy() {
		Node copy = new Node(kind, location);
		copy.attributes.putAll(attributes);
		for (Node child : children) {
			copy.children.add(child.deepCopy());
		}
		return copy;
	}

	/**
	 * Prints an indented rendition of the tree, one node per line.
	 *
	 * @param out destination
	 */
	public void dump(PrintStream out) {
		dump(out, 0);
	}

	private void dump(PrintStream out, int depth) {
		StringBuilder line = new StringBuilder();
		for (int i = 0; i < depth; i++) {
			line.append("  ");
		}
		line.append(this);
		out.println(line);
		for (Node child : children) {
			child.dump(out, depth + 1);
		}
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof Node)) {
			return false;
		}
		Node node = (Node) other;
		return kind == node.kind && attributes.equals(node.attributes) && children.equals(node.children);
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, attributes, children);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return attributes.isEmpty() ? kind.name() : kind.name() + attributes;
	}
}
