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

import java.util.List;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.frontend.ast.NodeKind;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;

/**
 * Applies {@link Modification}s to a syntax tree, in place.
 */
public final class AstEditor {

	private AstEditor() {
		/* utility class */
	}

	/**
	 * Applies one modification. Inserted and replacing nodes are copied, so the
	 * modification can be applied again.
	 *
	 * @param root tree to edit
	 * @param modification the edit
	 * @return the root of the edited tree: {@code root} itself, unless the root
	 *         was replaced
	 * @throws LlmRuntimeException {@link RuntimeErrorKind#MODIFICATION_FAILED}
	 *         when the path or position does not exist
	 */
	public static Node apply(Node root, Modification modification) {
		List<Integer> path = modification.getPath();
		switch (modification.getType()) {
		case REPLACE:
			if (path.isEmpty()) {
				return modification.getNode().deepCopy();
			}
			Node parent = resolve(root, path.subList(0, path.size() - 1));
			parent.setChild(childIndex(parent, path), fit(parent, modification.getNode()));
			return root;
		case INSERT:
			Node target = resolve(root, path);
			if (modification.getPosition() < 0 || modification.getPosition() > target.getChildCount()) {
				throw failure(
						"Invalid position " + modification.getPosition() + " for a node with " + target.getChildCount()
								+ " children");
			}
			target.insertChild(modification.getPosition(), fit(target, modification.getNode()));
			return root;
		case DELETE:
			if (path.isEmpty()) {
				throw failure("Cannot delete the root node");
			}
			Node owner = resolve(root, path.subList(0, path.size() - 1));
			owner.removeChild(childIndex(owner, path));
			return root;
		default:
			resolve(root, path).setAttribute(modification.getName(), modification.getValue());
			return root;
		}
	}

	/**
	 * Applies modifications one after the other. Not transactional: when one
	 * fails, the earlier ones remain applied to {@code root}.
	 *
	 * @param root tree to edit
	 * @param modifications the edits, in order
	 * @return the root of the edited tree
	 */
	public static Node applyAll(Node root, List<Modification> modifications) {
		Node current = root;
		for (Modification modification : modifications) {
			current = apply(current, modification);
		}
		return current;
	}

	/**
	 * @param root tree to walk
	 * @param path child indices
	 * @return the node at {@code path}
	 */
	public static Node resolve(Node root, List<Integer> path) {
		Node node = root;
		for (int depth = 0; depth < path.size(); depth++) {
			int index = path.get(depth);
			if (index < 0 || index >= node.getChildCount()) {
				throw failure(
						"Invalid index " + index + " at depth " + depth + ": " + node.getKind() + " has "
								+ node.getChildCount() + " children");
			}
			node = node.getChild(index);
		}
		return node;
	}

	private static int childIndex(Node parent, List<Integer> path) {
		int index = path.get(path.size() - 1);
		if (index < 0 || index >= parent.getChildCount()) {
			throw failure("Invalid index " + index + ": " + parent.getKind() + " has " + parent.getChildCount() + " children");
		}
		return index;
	}

	/**
	 * Copies {@code node} into the shape its new parent holds: statements
	 * among the items of a program or block, expressions anywhere else.
	 */
	private static Node fit(Node parent, Node node) {
		Node copy = node.deepCopy();
		boolean statementSlot = parent.getKind() == NodeKind.PROGRAM || parent.getKind() == NodeKind.BLOCK;
		if (statementSlot && isExpression(copy.getKind())) {
			return new Node(NodeKind.STATEMENT, copy.getLocation()).addChild(copy);
		}
		Node inner = copy.getChild(0);
		if (!statementSlot && copy.getKind() == NodeKind.STATEMENT && inner != null && inner.getKind() != NodeKind.BLOCK) {
			return inner;
		}
		return copy;
	}

	private static boolean isExpression(NodeKind kind) {
		switch (kind) {
		case ASSIGNMENT:
		case BINARY:
		case UNARY:
		case LITERAL:
		case IDENTIFIER:
		case CALL:
		case NATURAL_LANGUAGE:
		case GROUPING:
		case LIST:
			return true;
		default:
			return false;
		}
	}

	private static LlmRuntimeException failure(String message) {
		return new LlmRuntimeException(RuntimeErrorKind.MODIFICATION_FAILED, message);
	}
}
