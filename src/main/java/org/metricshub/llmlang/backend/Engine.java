package org.metricshub.llmlang.backend;

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
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.metricshub.llmlang.ext.NativeEnvironment;
import org.metricshub.llmlang.ext.NativeFunction;
import org.metricshub.llmlang.ext.StandardLibrary;
import org.metricshub.llmlang.frontend.SourceSpan;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.frontend.ast.NodeKind;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.NaturalLanguage;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.jrt.SemanticMemory;
import org.metricshub.llmlang.jrt.Value;
import org.metricshub.llmlang.jrt.ValueType;
import org.metricshub.llmlang.jrt.Vectors;
import org.metricshub.llmlang.modify.Modification;
import org.metricshub.llmlang.modify.ModifyManager;
import org.metricshub.llmlang.util.ExecuteOptions;
import org.metricshub.llmlang.util.LlmLogger;
import org.slf4j.Logger;

/**
 * The tree-walking interpreter of LLM.lang.
 * <p>
 * Every node goes through {@link #executeNode(Node)}, which counts one
 * instruction, enforces the time and memory budgets of the
 * {@link ExecuteOptions} and then dispatches on the node kind. Statements
 * produce a {@link Completion}, so that a {@code return} nested in any block
 * ends the enclosing function call.
 * <p>
 * An engine runs one program on one thread. Each path of a
 * {@code parallel} statement runs in a forked engine working on a snapshot of
 * the bindings and of the semantic memory; forks share the instruction
 * counter, the peak memory and the self-modification caches.
 */
public class Engine implements NativeEnvironment {

	private static final Logger LOGGER = LlmLogger.getLogger(Engine.class);

	/** Name of the function invoked when a program only declares things */
	public static final String MAIN_FUNCTION = "main";

	private final ExecuteOptions options;
	private final ContextManager contexts;
	private final SemanticMemory memory;
	private final ModifyManager modifyManager;
	private final ParallelExecutor parallelExecutor;
	private final AtomicLong instructions;
	private final AtomicLong peakMemory;

	private long deadlineNanos;
	private boolean hasDeadline;
	private int callDepth;
	private Value currentVector;

	/**
	 * @param options runtime options
	 */
	public Engine(ExecuteOptions options) {
		this(options, new ModifyManager());
	}

	/**
	 * @param options runtime options
	 * @param modifyManager caches used by {@code @modify}
	 */
	public Engine(ExecuteOptions options, ModifyManager modifyManager) {
		this.options = options;
		this.contexts = new ContextManager();
		this.memory = new SemanticMemory();
		this.modifyManager = modifyManager;
		this.parallelExecutor = new ParallelExecutor(options.getParallelism());
		this.instructions = new AtomicLong();
		this.peakMemory = new AtomicLong();
	}

	/**
	 * Forks an engine for one parallel path.
	 */
	private Engine(Engine parent) {
		this.options = parent.options;
		this.contexts = parent.contexts.snapshot();
		this.memory = new SemanticMemory(parent.memory);
		this.modifyManager = parent.modifyManager;
		this.parallelExecutor = parent.parallelExecutor;
		this.instructions = parent.instructions;
		this.peakMemory = parent.peakMemory;
		this.deadlineNanos = parent.deadlineNanos;
		this.hasDeadline = parent.hasDeadline;
		this.callDepth = parent.callDepth;
		this.currentVector = parent.currentVector;
	}

	/**
	 * Makes the running program available to {@code @modify} under its name.
	 *
	 * @param name usually the description of the program source
	 * @param source program text
	 * @param ast its syntax tree
	 */
	public void registerSource(String name, String source, Node ast) {
		modifyManager.register(name, source, ast);
	}

	/**
	 * Executes a whole program.
	 * <p>
	 * The result is the value of the last top-level item. When the program
	 * only declares functions and contexts, its {@value #MAIN_FUNCTION}
	 * function is called (looked up in {@code global} first, then in the
	 * contexts in declaration order) and its result is the program result.
	 *
	 * @param program a {@link NodeKind#PROGRAM} node
	 * @return the program result
	 * @throws LlmRuntimeException when execution fails
	 */
	public Value execute(Node program) {
		if (program == null || program.getKind() != NodeKind.PROGRAM) {
			throw malformed(program, "Expected a Program node");
		}
		if (options.getMaxTime() != null) {
			hasDeadline = true;
			deadlineNanos = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(options.getMaxTime());
		}
		try {
			hoistDeclarations(program);
			Value result = Value.VOID;
			boolean declarationsOnly = true;
			for (Node item : program.getChildren()) {
				Completion completion = executeNode(item);
				result = completion.getValue();
				if (item.getKind() != NodeKind.FUNCTION && item.getKind() != NodeKind.CONTEXT) {
					declarationsOnly = false;
				}
				if (completion.isReturn()) {
					return result;
				}
			}
			if (declarationsOnly) {
				Value mainResult = invokeMain();
				if (mainResult != null) {
					return mainResult;
				}
			}
			return result;
		} catch (StackOverflowError e) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.STACK_OVERFLOW,
					"Stack overflow at call depth " + callDepth,
					null,
					options.getMaxCallDepth(),
					callDepth,
					e);
		}
	}

	/**
	 * Registers top-level functions, and creates declared contexts with their
	 * functions, so that calls may precede declarations.
	 */
	private void hoistDeclarations(Node program) {
		for (Node item : program.getChildren()) {
			if (item.getKind() == NodeKind.FUNCTION) {
				contexts.registerFunction(requireAttribute(item, "name"), item);
			} else if (item.getKind() == NodeKind.CONTEXT) {
				String name = requireAttribute(item, "name");
				contexts.createContext(name);
				contexts.enterContext(name);
				try {
					for (Node member : item.getChildren()) {
						if (member.getKind() == NodeKind.FUNCTION) {
							contexts.registerFunction(requireAttribute(member, "name"), member);
						}
					}
				} finally {
					contexts.exitContext();
				}
			}
		}
	}

	private Value invokeMain() {
		Node main = contexts.getFunctionIn(ContextManager.GLOBAL, MAIN_FUNCTION);
		if (main != null) {
			return callFunction(main, Collections.<Value>emptyList(), main.getLocation());
		}
		for (String name : contexts.getContextNames()) {
			main = contexts.getFunctionIn(name, MAIN_FUNCTION);
			if (main != null) {
				LOGGER.debug("Invoking {}() of context '{}'", MAIN_FUNCTION, name);
				contexts.enterContext(name);
				try {
					return callFunction(main, Collections.<Value>emptyList(), main.getLocation());
				} finally {
					contexts.exitContext();
				}
			}
		}
		return null;
	}

	/**
	 * Counts, checks the budgets and executes one node.
	 *
	 * @param node node to execute
	 * @return how the node completed
	 */
	Completion executeNode(Node node) {
		if (node == null) {
			throw new LlmRuntimeException(RuntimeErrorKind.MALFORMED_NODE, "Missing required node");
		}
		tick();
		try {
			return dispatch(node);
		} catch (LlmRuntimeException e) {
			throw e.locatedAt(node.getLocation());
		}
	}

	private Value evaluate(Node node) {
		return executeNode(node).getValue();
	}

	private Completion dispatch(Node node) {
		switch (node.getKind()) {
		case PROGRAM:
		case BLOCK:
			return executeSequence(node.getChildren());
		case CONTEXT:
			return executeContext(node);
		case FUNCTION:
			contexts.registerFunction(requireAttribute(node, "name"), node);
			return Completion.VOID;
		case VARIABLE:
			Value initial = evaluate(requireChild(node, 0));
			contexts.declareVariable(requireAttribute(node, "name"), initial);
			return Completion.normal(initial);
		case STATEMENT:
			return executeNode(requireChild(node, 0));
		case IF:
			if (evaluate(requireChild(node, 0)).isTruthy()) {
				return executeNode(requireChild(node, 1));
			}
			return node.getChild(2) == null ? Completion.VOID : executeNode(node.getChild(2));
		case WHEN:
			return executeWhen(node);
		case FOR:
			return executeFor(node);
		case RETURN:
			return Completion.returning(node.getChild(0) == null ? Value.VOID : evaluate(node.getChild(0)));
		case WITH:
			return executeWith(node);
		case WITHIN:
			return executeWithin(node);
		case INTENT:
			requireFeature(options.isNlp(), "Natural language processing");
			return Completion.normal(NaturalLanguage.processIntent(expectString(evaluate(requireChild(node, 0)), "intent")));
		case PARALLEL:
			return executeParallel(node);
		case APPLY:
			return executeApply(node);
		case VECTOR:
			return executeVector(node);
		case SEMANTIC:
			return executeSemantic(node);
		case ASSIGNMENT:
			Value assigned = evaluate(requireChild(node, 1));
			assign(requireChild(node, 0), assigned);
			return Completion.normal(assigned);
		case BINARY:
			return Completion.normal(executeBinary(node));
		case UNARY:
			return Completion
					.normal(Operators.unary(requireAttribute(node, "operator"), evaluate(requireChild(node, 0))));
		case LITERAL:
			return Completion.normal(literal(node));
		case IDENTIFIER:
			return Completion.normal(resolveIdentifier(requireAttribute(node, "name")));
		case CALL:
			return Completion.normal(executeCall(node));
		case NATURAL_LANGUAGE:
			requireFeature(options.isNlp(), "Natural language processing");
			return Completion.normal(NaturalLanguage.processNaturalLanguage(requireAttribute(node, "value")));
		case GROUPING:
			return executeNode(requireChild(node, 0));
		case LIST:
			List<Value> elements = new ArrayList<Value>();
			for (Node element : node.getChildren()) {
				elements.add(evaluate(element));
			}
			return Completion.normal(Value.list(elements));
		default:
			// Parameter, Case, Otherwise and Path only occur under their parent
			throw malformed(node, "Unexpected " + node.getKind() + " node");
		}
	}

	private void tick() {
		instructions.incrementAndGet();
		if (Thread.currentThread().isInterrupted()) {
			throw new LlmRuntimeException(RuntimeErrorKind.INTERRUPTED, "Execution was interrupted");
		}
		if (hasDeadline && System.nanoTime() - deadlineNanos > 0) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.TIME_LIMIT_EXCEEDED,
					"Execution exceeded the time limit of " + options.getMaxTime() + " ms",
					null,
					options.getMaxTime(),
					options.getMaxTime() + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - deadlineNanos),
					null);
		}
		long used = contexts.getApproximateSize() + memory.getUsage();
		peakMemory.accumulateAndGet(used, Math::max);
		Long maxMemory = options.getMaxMemory();
		if (maxMemory != null && used > maxMemory) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.MEMORY_LIMIT_EXCEEDED,
					"Memory usage of " + used + " bytes exceeds the limit of " + maxMemory + " bytes",
					null,
					maxMemory,
					used,
					null);
		}
	}

	// STATEMENTS

	private Completion executeSequence(List<Node> statements) {
		Value last = Value.VOID;
		for (Node statement : statements) {
			Completion completion = executeNode(statement);
			if (completion.isReturn()) {
				return completion;
			}
			last = completion.getValue();
		}
		return Completion.normal(last);
	}

	private Completion executeContext(Node node) {
		String name = requireAttribute(node, "name");
		if (contexts.createContext(name)) {
			LOGGER.debug("Created context '{}'", name);
		}
		contexts.enterContext(name);
		try {
			for (Node member : node.getChildren()) {
				if (member.getKind() == NodeKind.FUNCTION || member.getKind() == NodeKind.VARIABLE) {
					executeNode(member);
				} else {
					throw malformed(member, "Unexpected " + member.getKind() + " node in context '" + name + "'");
				}
			}
		} finally {
			contexts.exitContext();
		}
		return Completion.VOID;
	}

	private Completion executeWhen(Node node) {
		Value subject = evaluate(requireChild(node, 0));
		for (int i = 1; i < node.getChildCount(); i++) {
			Node caseNode = node.getChild(i);
			if (caseNode.getKind() != NodeKind.CASE) {
				throw malformed(caseNode, "Expected a Case node");
			}
			Node pattern = requireChild(caseNode, 0);
			if (pattern.getKind() == NodeKind.OTHERWISE || evaluate(pattern).equals(subject)) {
				return executeNode(requireChild(caseNode, 1));
			}
		}
		return Completion.VOID;
	}

	private Completion executeFor(Node node) {
		String variable = requireAttribute(node, "variable");
		Value collection = evaluate(requireChild(node, 0));
		if (!collection.is(ValueType.LIST)) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.INVALID_TYPE,
					"Cannot iterate over " + collection.getType().getDisplayName() + ", expected List");
		}
		Node body = requireChild(node, 1);
		Value last = Value.VOID;
		for (Value element : collection.asList()) {
			contexts.declareVariable(variable, element);
			Completion completion = executeNode(body);
			if (completion.isReturn()) {
				return completion;
			}
			last = completion.getValue();
		}
		return Completion.normal(last);
	}

	private Completion executeWith(Node node) {
		String name = requireAttribute(node, "name");
		if (contexts.createContext(name)) {
			LOGGER.debug("Created context '{}'", name);
		}
		contexts.enterContext(name);
		try {
			return executeNode(requireChild(node, 0));
		} finally {
			contexts.exitContext();
		}
	}

	private Completion executeWithin(Node node) {
		contexts.enterContext(requireAttribute(node, "name"));
		try {
			return executeNode(requireChild(node, 0));
		} finally {
			contexts.exitContext();
		}
	}

	private Completion executeApply(Node node) {
		requireFeature(options.isVectors(), "Vector operations");
		Value vector = evaluate(requireChild(node, 0));
		if (!vector.is(ValueType.VECTOR)) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.INVALID_TYPE,
					"apply expects a Vector but got " + vector.getType().getDisplayName());
		}
		Value previous = currentVector;
		currentVector = vector;
		try {
			return executeNode(requireChild(node, 1));
		} finally {
			currentVector = previous;
		}
	}

	private Completion executeVector(Node node) {
		requireFeature(options.isVectors(), "Vector operations");
		Value source = evaluate(requireChild(node, 0));
		Value vector;
		if (source.is(ValueType.STRING)) {
			vector = Value.vector(Vectors.embed(source.asString()));
		} else if (source.is(ValueType.VECTOR)) {
			vector = source;
		} else {
			throw new LlmRuntimeException(
					RuntimeErrorKind.INVALID_TYPE,
					"vector expects a String or a Vector but got " + source.getType().getDisplayName());
		}
		contexts.declareVariable(requireAttribute(node, "name"), vector);
		return Completion.normal(vector);
	}

	private Completion executeSemantic(Node node) {
		String token = requireAttribute(node, "token");
		switch (token) {
		case "@remember":
			Value value = evaluate(requireChild(node, 0));
			memory.remember(requireAttribute(node, "name"), value);
			return Completion.normal(value);
		case "@recall":
			String key = node.getAttribute("key");
			Value recalled = key == null ? memory.recallMostRecent() : memory.recall(key);
			if (recalled == null) {
				throw new LlmRuntimeException(
						RuntimeErrorKind.MEMORY_NOT_FOUND,
						key == null ? "Semantic memory is empty" : "Nothing remembered under '" + key + "'");
			}
			return Completion.normal(recalled);
		case "@modify":
			requireFeature(options.isSelfModifying(), "Self-modification");
			String target = requireAttribute(node, "target");
			Modification modification = Modification.fromAttributes(node.getAttributes());
			modifyManager.apply(target, modification);
			return Completion.VOID;
		default:
			throw malformed(node, "Unknown semantic token: " + token);
		}
	}

	// PARALLEL

	private Completion executeParallel(Node node) {
		requireFeature(options.isParallel(), "Parallel execution");
		String strategyName = node.getAttribute("strategy");
		SelectionStrategy strategy = SelectionStrategy.fromName(strategyName);
		if (strategy == null) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.INVALID_STRATEGY,
					"Invalid selection strategy: '" + strategyName + "', expected all, fastest or best");
		}
		if (node.getChildCount() == 0) {
			throw new LlmRuntimeException(RuntimeErrorKind.NO_PATHS, "Parallel statement has no paths");
		}
		List<ParallelExecutor.Branch<Value>> branches = new ArrayList<ParallelExecutor.Branch<Value>>();
		for (Node path : node.getChildren()) {
			if (path.getKind() != NodeKind.PATH) {
				throw malformed(path, "Expected a Path node");
			}
			final Node body = requireChild(path, 0);
			final Engine fork = new Engine(this);
			branches.add(new ParallelExecutor.Branch<Value>(requireAttribute(path, "name"), () -> fork.executeNode(body).getValue()));
		}
		Long timeout = null;
		if (hasDeadline) {
			timeout = Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime()));
		}
		List<ParallelExecutor.BranchResult<Value>> results = parallelExecutor.execute(branches, timeout);
		return Completion.normal(select(strategy, results));
	}

	private Value select(SelectionStrategy strategy, List<ParallelExecutor.BranchResult<Value>> results) {
		if (strategy == SelectionStrategy.ALL) {
			List<Value> values = new ArrayList<Value>();
			for (ParallelExecutor.BranchResult<Value> result : results) {
				if (!result.isSuccess()) {
					throw result.getError();
				}
				values.add(result.getValue());
			}
			return Value.list(values);
		}

		ParallelExecutor.BranchResult<Value> selected = null;
		for (ParallelExecutor.BranchResult<Value> result : results) {
			if (!result.isSuccess()) {
				continue;
			}
			if (strategy == SelectionStrategy.FASTEST) {
				if (selected == null || result.getElapsedNanos() < selected.getElapsedNanos()) {
					selected = result;
				}
			} else if (selected == null) {
				selected = result;
			} else if (!selected.getValue().isTruthy() && result.getValue().isTruthy()) {
				selected = result;
			}
		}
		if (strategy == SelectionStrategy.BEST && selected != null && !selected.getValue().isTruthy()) {
			// no truthy result: the first successful path wins
			for (ParallelExecutor.BranchResult<Value> result : results) {
				if (result.isSuccess()) {
					selected = result;
					break;
				}
			}
		}
		if (selected == null) {
			throw results.get(0).getError();
		}
		for (ParallelExecutor.BranchResult<Value> result : results) {
			if (!result.isSuccess()) {
				LOGGER.warn("Path '{}' failed and was ignored by '{}': {}", result.getName(), strategy.getName(), result.getError().getMessage());
			}
		}
		LOGGER.debug("Selected path '{}' with strategy '{}'", selected.getName(), strategy.getName());
		return selected.getValue();
	}

	// EXPRESSIONS

	private Value executeBinary(Node node) {
		String operator = requireAttribute(node, "operator");
		switch (operator) {
		case "and":
			return Value.bool(evaluate(requireChild(node, 0)).isTruthy() && evaluate(requireChild(node, 1)).isTruthy());
		case "or":
			return Value.bool(evaluate(requireChild(node, 0)).isTruthy() || evaluate(requireChild(node, 1)).isTruthy());
		case ".":
			return member(evaluate(requireChild(node, 0)), requireAttribute(node, "name"));
		default:
			Value left = evaluate(requireChild(node, 0));
			Value right = evaluate(requireChild(node, 1));
			return Operators.binary(operator, left, right);
		}
	}

	private Value member(Value object, String name) {
		if (object.is(ValueType.MAP)) {
			Value value = object.asMap().get(name);
			if (value != null) {
				return value;
			}
		} else if (object.is(ValueType.CONTEXT)) {
			String context = object.getName();
			if (!contexts.hasContext(context)) {
				throw new LlmRuntimeException(RuntimeErrorKind.UNDEFINED_CONTEXT, "Undefined context: '" + context + "'");
			}
			Value value = contexts.getVariableIn(context, name);
			if (value != null) {
				return value;
			}
			if (contexts.getFunctionIn(context, name) != null) {
				return Value.function(name);
			}
		}
		throw new LlmRuntimeException(
				RuntimeErrorKind.UNDEFINED_PROPERTY,
				"Undefined property '" + name + "' on " + object.getType().getDisplayName());
	}

	private void assign(Node target, Value value) {
		if (target.getKind() == NodeKind.IDENTIFIER) {
			contexts.assignVariable(requireAttribute(target, "name"), value);
			return;
		}
		if (target.getKind() == NodeKind.BINARY && ".".equals(target.getAttribute("operator"))) {
			Node objectNode = requireChild(target, 0);
			Value object = evaluate(objectNode);
			if (object.is(ValueType.MAP)) {
				Map<String, Value> entries = new LinkedHashMap<String, Value>(object.asMap());
				entries.put(requireAttribute(target, "name"), value);
				assign(objectNode, Value.map(entries));
				return;
			}
			throw new LlmRuntimeException(
					RuntimeErrorKind.INVALID_ASSIGNMENT_TARGET,
					"Cannot set property '" + target.getAttribute("name") + "' on " + object.getType().getDisplayName());
		}
		throw new LlmRuntimeException(
				RuntimeErrorKind.INVALID_ASSIGNMENT_TARGET,
				"Invalid assignment target: " + target.getKind());
	}

	private static Value literal(Node node) {
		String type = requireAttribute(node, "type");
		String text = requireAttribute(node, "value");
		try {
			switch (type) {
			case "Int":
				return Value.integer(Long.parseLong(text));
			case "Float":
				return Value.floating(Double.parseDouble(text));
			case "String":
				return Value.string(text);
			case "Bool":
				return Value.bool(Boolean.parseBoolean(text));
			case "Null":
				return Value.VOID;
			default:
				throw malformed(node, "Unknown literal type: " + type);
			}
		} catch (NumberFormatException e) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.MALFORMED_NODE,
					"Invalid " + type + " literal: '" + text + "'",
					node.getLocation(),
					e);
		}
	}

	private Value resolveIdentifier(String name) {
		Value value = contexts.getVariable(name);
		if (value != null) {
			return value;
		}
		if (StandardLibrary.isDefined(name) || contexts.getFunction(name) != null) {
			return Value.function(name);
		}
		throw new LlmRuntimeException(RuntimeErrorKind.UNDEFINED_VARIABLE, "Undefined variable: '" + name + "'");
	}

	// CALLS

	private Value executeCall(Node node) {
		Node callee = requireChild(node, 0);
		SourceSpan location = node.getLocation();

		if (callee.getKind() == NodeKind.IDENTIFIER) {
			String name = requireAttribute(callee, "name");
			NativeFunction nativeFunction = StandardLibrary.resolve(name);
			if (nativeFunction != null) {
				return nativeFunction.invoke(arguments(node), this, location);
			}
			Node function = contexts.getFunction(name);
			if (function != null) {
				return callFunction(function, arguments(node), location);
			}
			if (contexts.getVariable(name) == null) {
				throw new LlmRuntimeException(RuntimeErrorKind.UNDEFINED_FUNCTION, "Undefined function: '" + name + "'");
			}
		} else if (callee.getKind() == NodeKind.BINARY && ".".equals(callee.getAttribute("operator"))) {
			Value object = evaluate(requireChild(callee, 0));
			if (object.is(ValueType.CONTEXT)) {
				return callInContext(object.getName(), requireAttribute(callee, "name"), arguments(node), location);
			}
			Value function = member(object, requireAttribute(callee, "name"));
			return callValue(function, arguments(node), location);
		}
		Value function = evaluate(callee);
		return callValue(function, arguments(node), location);
	}

	private List<Value> arguments(Node call) {
		List<Value> arguments = new ArrayList<Value>();
		for (int i = 1; i < call.getChildCount(); i++) {
			arguments.add(evaluate(call.getChild(i)));
		}
		return arguments;
	}

	private Value callInContext(String context, String name, List<Value> arguments, SourceSpan location) {
		Node function = contexts.getFunctionIn(context, name);
		if (function == null) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.UNDEFINED_FUNCTION,
					"Undefined function '" + name + "' in context '" + context + "'");
		}
		contexts.enterContext(context);
		try {
			return callFunction(function, arguments, location);
		} finally {
			contexts.exitContext();
		}
	}

	private Value callValue(Value function, List<Value> arguments, SourceSpan location) {
		if (!function.is(ValueType.FUNCTION)) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.NOT_CALLABLE,
					"Value of type " + function.getType().getDisplayName() + " is not callable",
					location);
		}
		String name = function.getName();
		NativeFunction nativeFunction = StandardLibrary.resolve(name);
		if (nativeFunction != null) {
			return nativeFunction.invoke(arguments, this, location);
		}
		Node declaration = contexts.getFunction(name);
		if (declaration == null) {
			throw new LlmRuntimeException(RuntimeErrorKind.UNDEFINED_FUNCTION, "Undefined function: '" + name + "'", location);
		}
		return callFunction(declaration, arguments, location);
	}

	/**
	 * Calls a user function: binds the arguments in a new frame, runs the body
	 * and always pops the frame.
	 *
	 * @return the returned value, or the value of the last statement
	 */
	private Value callFunction(Node function, List<Value> arguments, SourceSpan location) {
		String name = requireAttribute(function, "name");
		List<Node> parameters = new ArrayList<Node>();
		Node body = null;
		for (Node child : function.getChildren()) {
			if (child.getKind() == NodeKind.PARAMETER) {
				parameters.add(child);
			} else if (child.getKind() == NodeKind.BLOCK) {
				body = child;
			}
		}
		if (body == null) {
			throw malformed(function, "Function '" + name + "' has no body");
		}
		if (arguments.size() != parameters.size()) {
			throw LlmRuntimeException.argumentCount(name, parameters.size(), arguments.size(), location);
		}
		if (callDepth >= options.getMaxCallDepth()) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.STACK_OVERFLOW,
					"Maximum call depth of " + options.getMaxCallDepth() + " exceeded in '" + name + "'",
					location,
					options.getMaxCallDepth(),
					callDepth + 1L,
					null);
		}
		callDepth++;
		contexts.pushFrame();
		try {
			for (int i = 0; i < parameters.size(); i++) {
				contexts.declareVariable(requireAttribute(parameters.get(i), "name"), arguments.get(i));
			}
			return executeNode(body).getValue();
		} finally {
			contexts.popFrame();
			callDepth--;
		}
	}

	// NativeEnvironment

	/** {@inheritDoc} */
	@Override
	public PrintStream getOutput() {
		return options.getOutputStream();
	}

	/** {@inheritDoc} */
	@Override
	public String getCurrentContextName() {
		return contexts.getCurrentContextName();
	}

	/** {@inheritDoc} */
	@Override
	public Value getCurrentVector() {
		return currentVector == null ? Value.VOID : currentVector;
	}

	/** {@inheritDoc} */
	@Override
	public Value call(Value function, List<Value> arguments) {
		return callValue(function, arguments, null);
	}

	// STATISTICS

	/**
	 * @return nodes executed so far, parallel paths included
	 */
	public long getInstructionCount() {
		return instructions.get();
	}

	/**
	 * @return highest approximate memory use observed, in bytes
	 */
	public long getPeakMemory() {
		return peakMemory.get();
	}

	/**
	 * @return the bindings of this engine
	 */
	public ContextManager getContextManager() {
		return contexts;
	}

	/**
	 * @return the semantic memory of this engine
	 */
	public SemanticMemory getSemanticMemory() {
		return memory;
	}

	// HELPERS

	private static void requireFeature(boolean enabled, String feature) {
		if (!enabled) {
			throw new LlmRuntimeException(RuntimeErrorKind.FEATURE_DISABLED, feature + " is disabled");
		}
	}

	private static String expectString(Value value, String what) {
		if (!value.is(ValueType.STRING)) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.INVALID_TYPE,
					what + " expects a String but got " + value.getType().getDisplayName());
		}
		return value.asString();
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

	private static LlmRuntimeException malformed(Node node, String message) {
		return new LlmRuntimeException(RuntimeErrorKind.MALFORMED_NODE, message, node == null ? null : node.getLocation());
	}
}
