package org.metricshub.llmlang.semantic;

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
import java.util.List;
import java.util.Map;
import org.metricshub.llmlang.backend.SelectionStrategy;
import org.metricshub.llmlang.ext.NativeFunction;
import org.metricshub.llmlang.ext.StandardLibrary;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.frontend.ast.NodeKind;

/**
 * Checks a parsed program before it runs: names are declared before use and
 * not declared twice in a scope, calls to known functions pass the right
 * number of arguments, {@code return} only appears in functions, and so on.
 * <p>
 * Functions and contexts are hoisted: a program or context body declares all
 * of them first. Function bodies are analyzed last, once every variable
 * around them is declared, since they only run when called.
 * <p>
 * The tree is returned unchanged. An analyzer instance is single use.
 */
public class SemanticAnalyzer {

	private final ScopeArena arena = new ScopeArena();
	private final List<Integer> deferredScopes = new ArrayList<Integer>();
	private final List<Node> deferredFunctions = new ArrayList<Node>();
	private int functionDepth;

	public SemanticAnalyzer() {
		for (Map.Entry<String, NativeFunction> entry : StandardLibrary.listFunctions().entrySet()) {
			NativeFunction function = entry.getValue();
			arena.declare(Symbol.builtin(entry.getKey(), function.getMinArity(), function.getMaxArity()));
		}
	}

	/**
	 * Analyzes a whole program.
	 *
	 * @param program a {@link NodeKind#PROGRAM} node
	 * @return the same tree
	 * @throws SemanticException on the first error
	 */
	public Node analyze(Node program) {
		if (program == null || program.getKind() != NodeKind.PROGRAM) {
			throw malformed(program, "Expected a Program node");
		}
		hoist(program.getChildren());
		for (Node item : program.getChildren()) {
			if (item.getKind() == NodeKind.CONTEXT) {
				analyzeContext(item);
			} else if (item.getKind() != NodeKind.FUNCTION) {
				analyzeStatement(item);
			}
		}
		for (int i = 0; i < deferredFunctions.size(); i++) {
			arena.setCurrent(deferredScopes.get(i));
			analyzeFunctionBody(deferredFunctions.get(i));
		}
		arena.setCurrent(ScopeArena.ROOT);
		return program;
	}

	/**
	 * @return the scopes built by the last analysis
	 */
	public ScopeArena getScopes() {
		return arena;
	}

	// DECLARATIONS

	private void hoist(List<Node> items) {
		for (Node item : items) {
			if (item.getKind() == NodeKind.FUNCTION) {
				declareFunction(item);
			} else if (item.getKind() == NodeKind.CONTEXT) {
				String name = requireAttribute(item, "name");
				int scope = newScope(ScopeArena.ROOT);
				if (!arena.declareIn(ScopeArena.ROOT, Symbol.context(name, scope))) {
					throw new SemanticException(
							SemanticException.Kind.REDEFINED_CONTEXT,
							"Context '" + name + "' is already defined",
							item.getLocation());
				}
			}
		}
	}

	private void declareFunction(Node function) {
		String name = requireAttribute(function, "name");
		List<String> parameterTypes = new ArrayList<String>();
		for (Node child : function.getChildren()) {
			if (child.getKind() == NodeKind.PARAMETER) {
				parameterTypes.add(requireAttribute(child, "type"));
			}
		}
		if (StandardLibrary.isDefined(name) || !arena.declare(Symbol.function(name, parameterTypes, function.getAttribute("return_type")))) {
			throw new SemanticException(
					SemanticException.Kind.REDEFINED_FUNCTION,
					"Function '" + name + "' is already defined",
					function.getLocation());
		}
		deferredScopes.add(arena.getCurrent());
		deferredFunctions.add(function);
	}

	private void analyzeContext(Node context) {
		Symbol symbol = arena.lookup(Symbol.Kind.CONTEXT, requireAttribute(context, "name"));
		int previous = arena.getCurrent();
		arena.setCurrent(symbol.getScope());
		try {
			hoist(context.getChildren());
			for (Node member : context.getChildren()) {
				if (member.getKind() == NodeKind.VARIABLE) {
					analyzeStatement(member);
				} else if (member.getKind() != NodeKind.FUNCTION) {
					throw malformed(member, "Unexpected " + member.getKind() + " node in a context");
				}
			}
		} finally {
			arena.setCurrent(previous);
		}
	}

	private void analyzeFunctionBody(Node function) {
		arena.push();
		functionDepth++;
		try {
			Node body = null;
			for (Node child : function.getChildren()) {
				if (child.getKind() == NodeKind.PARAMETER) {
					String name = requireAttribute(child, "name");
					if (!arena.declare(Symbol.variable(name, child.getAttribute("type")))) {
						throw new SemanticException(
								SemanticException.Kind.REDEFINED_VARIABLE,
								"Parameter '" + name + "' is declared twice",
								child.getLocation());
					}
				} else if (child.getKind() == NodeKind.BLOCK) {
					body = child;
				}
			}
			if (body == null) {
				throw malformed(function, "Function '" + function.getAttribute("name") + "' has no body");
			}
			analyzeBlock(body);
		} finally {
			functionDepth--;
			arena.pop();
		}
	}

	// STATEMENTS

	private void analyzeBlock(Node block) {
		arena.push();
		try {
			analyzeStatements(block);
		} finally {
			arena.pop();
		}
	}

	private void analyzeStatements(Node block) {
		if (block.getKind() != NodeKind.BLOCK) {
			throw malformed(block, "Expected a Block node");
		}
		for (Node statement : block.getChildren()) {
			analyzeStatement(statement);
		}
	}

	private void analyzeStatement(Node node) {
		switch (node.getKind()) {
		case VARIABLE:
			analyzeVariable(node);
			break;
		case STATEMENT:
			Node inner = requireChild(node, 0);
			if (inner.getKind() == NodeKind.BLOCK) {
				analyzeBlock(inner);
			} else {
				analyzeExpression(inner);
			}
			break;
		case BLOCK:
			analyzeBlock(node);
			break;
		case IF:
			analyzeExpression(requireChild(node, 0));
			analyzeBlock(requireChild(node, 1));
			Node elseBranch = node.getChild(2);
			if (elseBranch != null) {
				analyzeStatement(elseBranch);
			}
			break;
		case WHEN:
			analyzeExpression(requireChild(node, 0));
			for (int i = 1; i < node.getChildCount(); i++) {
				Node caseNode = node.getChild(i);
				if (caseNode.getKind() != NodeKind.CASE) {
					throw malformed(caseNode, "Expected a Case node");
				}
				Node pattern = requireChild(caseNode, 0);
				if (pattern.getKind() != NodeKind.OTHERWISE) {
					analyzeExpression(pattern);
				}
				analyzeBlock(requireChild(caseNode, 1));
			}
			break;
		case FOR:
			analyzeExpression(requireChild(node, 0));
			arena.push();
			try {
				arena.declare(Symbol.variable(requireAttribute(node, "variable"), null));
				analyzeBlock(requireChild(node, 1));
			} finally {
				arena.pop();
			}
			break;
		case RETURN:
			if (functionDepth == 0) {
				throw new SemanticException(
						SemanticException.Kind.RETURN_OUTSIDE_FUNCTION,
						"'return' outside of a function",
						node.getLocation());
			}
			if (node.getChild(0) != null) {
				analyzeExpression(node.getChild(0));
			}
			break;
		case WITH:
			String created = requireAttribute(node, "name");
			Symbol context = arena.lookup(Symbol.Kind.CONTEXT, created);
			if (context == null) {
				context = Symbol.context(created, newScope(ScopeArena.ROOT));
				arena.declareIn(ScopeArena.ROOT, context);
			}
			analyzeInContext(context, requireChild(node, 0));
			break;
		case WITHIN:
			String name = requireAttribute(node, "name");
			Symbol existing = arena.lookup(Symbol.Kind.CONTEXT, name);
			if (existing == null) {
				throw new SemanticException(
						SemanticException.Kind.UNDEFINED_CONTEXT,
						"Undefined context: '" + name + "'",
						node.getLocation());
			}
			analyzeInContext(existing, requireChild(node, 0));
			break;
		case INTENT:
			analyzeExpression(requireChild(node, 0));
			break;
		case PARALLEL:
			analyzeParallel(node);
			break;
		case APPLY:
			analyzeExpression(requireChild(node, 0));
			analyzeBlock(requireChild(node, 1));
			break;
		case VECTOR:
			analyzeExpression(requireChild(node, 0));
			declareVariable(requireAttribute(node, "name"), "Vector", node);
			break;
		case SEMANTIC:
			analyzeSemantic(node);
			break;
		case CONTEXT:
		case FUNCTION:
			throw malformed(node, node.getKind() + " declarations are only allowed at the top level");
		default:
			analyzeExpression(node);
			break;
		}
	}

	private void analyzeVariable(Node node) {
		String name = requireAttribute(node, "name");
		Node initializer = requireChild(node, 0);
		analyzeExpression(initializer);
		String type = node.getAttribute("type");
		if (type != null && initializer.getKind() == NodeKind.LITERAL) {
			checkLiteralType(type, initializer);
		}
		declareVariable(name, type, node);
	}

	private void declareVariable(String name, String type, Node node) {
		if (!arena.declare(Symbol.variable(name, type))) {
			throw new SemanticException(
					SemanticException.Kind.REDEFINED_VARIABLE,
					"Variable '" + name + "' is already defined in this scope",
					node.getLocation());
		}
	}

	private static void checkLiteralType(String declared, Node literal) {
		String actual = literal.getAttribute("type");
		if (actual == null || "Null".equals(actual) || declared.startsWith("~")) {
			return;
		}
		if (declared.equals(actual) || ("Float".equals(declared) && "Int".equals(actual))) {
			return;
		}
		if ("Int".equals(actual) || "Float".equals(actual) || "String".equals(actual) || "Bool".equals(actual)) {
			throw new SemanticException(
					SemanticException.Kind.INVALID_TYPE,
					"Cannot initialize a " + declared + " with a " + actual + " literal",
					literal.getLocation());
		}
	}

	/**
	 * Outside functions, the body of {@code with} and {@code within} declares
	 * into the context itself. Inside a function, it declares into the call
	 * frame, like any block.
	 */
	private void analyzeInContext(Symbol context, Node body) {
		if (functionDepth > 0) {
			analyzeBlock(body);
			return;
		}
		int previous = arena.getCurrent();
		arena.setCurrent(context.getScope());
		try {
			analyzeStatements(body);
		} finally {
			arena.setCurrent(previous);
		}
	}

	private void analyzeParallel(Node node) {
		String strategy = node.getAttribute("strategy");
		if (SelectionStrategy.fromName(strategy) == null) {
			throw new SemanticException(
					SemanticException.Kind.INVALID_STRATEGY,
					"Invalid selection strategy: '" + strategy + "', expected all, fastest or best",
					node.getLocation());
		}
		if (node.getChildCount() == 0) {
			throw new SemanticException(SemanticException.Kind.NO_PATHS, "Parallel statement has no paths", node.getLocation());
		}
		for (Node path : node.getChildren()) {
			if (path.getKind() != NodeKind.PATH) {
				throw malformed(path, "Expected a Path node");
			}
			analyzeBlock(requireChild(path, 0));
		}
	}

	private void analyzeSemantic(Node node) {
		String token = requireAttribute(node, "token");
		if (!token.startsWith("@")) {
			throw new SemanticException(
					SemanticException.Kind.INVALID_SEMANTIC_TOKEN,
					"Semantic token must start with '@': " + token,
					node.getLocation());
		}
		switch (token) {
		case "@remember":
			requireAttribute(node, "name");
			analyzeExpression(requireChild(node, 0));
			break;
		case "@recall":
			break;
		case "@modify":
			requireAttribute(node, "target");
			requireAttribute(node, "operation");
			break;
		default:
			throw new SemanticException(
					SemanticException.Kind.INVALID_SEMANTIC_TOKEN,
					"Unknown semantic token: " + token,
					node.getLocation());
		}
	}

	// EXPRESSIONS

	private void analyzeExpression(Node node) {
		switch (node.getKind()) {
		case LITERAL:
			requireAttribute(node, "type");
			requireAttribute(node, "value");
			break;
		case NATURAL_LANGUAGE:
			requireAttribute(node, "value");
			break;
		case IDENTIFIER:
			String name = requireAttribute(node, "name");
			if (arena.lookup(Symbol.Kind.VARIABLE, name) == null && arena.lookup(Symbol.Kind.FUNCTION, name) == null) {
				throw new SemanticException(
						SemanticException.Kind.UNDEFINED_VARIABLE,
						"Undefined variable: '" + name + "'",
						node.getLocation());
			}
			break;
		case GROUPING:
			analyzeExpression(requireChild(node, 0));
			break;
		case UNARY:
			requireAttribute(node, "operator");
			analyzeExpression(requireChild(node, 0));
			break;
		case BINARY:
			String operator = requireAttribute(node, "operator");
			analyzeExpression(requireChild(node, 0));
			if (".".equals(operator)) {
				requireAttribute(node, "name");
			} else {
				analyzeExpression(requireChild(node, 1));
			}
			break;
		case LIST:
			for (Node element : node.getChildren()) {
				analyzeExpression(element);
			}
			break;
		case ASSIGNMENT:
			analyzeAssignmentTarget(requireChild(node, 0));
			analyzeExpression(requireChild(node, 1));
			break;
		case CALL:
			analyzeCall(node);
			break;
		default:
			throw malformed(node, "Unexpected " + node.getKind() + " node in an expression");
		}
	}

	private void analyzeAssignmentTarget(Node target) {
		if (target.getKind() == NodeKind.IDENTIFIER) {
			String name = requireAttribute(target, "name");
			Symbol variable = arena.lookup(Symbol.Kind.VARIABLE, name);
			if (variable != null && variable.isMutable()) {
				return;
			}
			if (variable == null && arena.lookup(Symbol.Kind.FUNCTION, name) == null) {
				throw new SemanticException(
						SemanticException.Kind.UNDEFINED_VARIABLE,
						"Cannot assign to undefined variable: '" + name + "'",
						target.getLocation());
			}
		} else if (target.getKind() == NodeKind.BINARY && ".".equals(target.getAttribute("operator"))) {
			analyzeExpression(target);
			return;
		}
		throw new SemanticException(
				SemanticException.Kind.INVALID_ASSIGNMENT_TARGET,
				"Invalid assignment target: " + target.getKind(),
				target.getLocation());
	}

	private void analyzeCall(Node call) {
		Node callee = requireChild(call, 0);
		int argumentCount = call.getChildCount() - 1;
		if (callee.getKind() == NodeKind.IDENTIFIER) {
			String name = requireAttribute(callee, "name");
			Symbol function = arena.lookup(Symbol.Kind.FUNCTION, name);
			if (function != null) {
				if (!function.acceptsArity(argumentCount)) {
					throw new SemanticException(
							SemanticException.Kind.INVALID_ARGUMENT_COUNT,
							"Function '" + name + "' expects " + describeArity(function) + " argument(s) but got " + argumentCount,
							call.getLocation(),
							function.getMinArity(),
							argumentCount);
				}
			} else if (arena.lookup(Symbol.Kind.VARIABLE, name) == null) {
				throw new SemanticException(
						SemanticException.Kind.UNDEFINED_FUNCTION,
						"Undefined function: '" + name + "'",
						callee.getLocation());
			}
		} else {
			analyzeExpression(callee);
		}
		for (int i = 1; i < call.getChildCount(); i++) {
			analyzeExpression(call.getChild(i));
		}
	}

	private static String describeArity(Symbol function) {
		if (function.getMinArity() == function.getMaxArity()) {
			return String.valueOf(function.getMinArity());
		}
		if (function.getMaxArity() < 0) {
			return "at least " + function.getMinArity();
		}
		return function.getMinArity() + " to " + function.getMaxArity();
	}

	// HELPERS

	private int newScope(int parent) {
		int previous = arena.getCurrent();
		arena.setCurrent(parent);
		int scope = arena.push();
		arena.setCurrent(previous);
		return scope;
	}

	private static Node requireChild(Node node, int index) {
		Node child = node.getChild(index);
		if (child == null) {
			throw malformed(node, node.getKind() + " node is missing child #" + index);
		}
		return child;
	}

	private static String requireAttribute(Node node, String name) {
		String value = node.getAttribute(name);
		if (value == null) {
			throw malformed(node, node.getKind() + " node is missing attribute '" + name + "'");
		}
		return value;
	}

	private static SemanticException malformed(Node node, String message) {
		return new SemanticException(SemanticException.Kind.MALFORMED_NODE, message, node == null ? null : node.getLocation());
	}
}
