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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.jrt.Value;

/**
 * Bindings of a running program: the registry of named execution contexts,
 * the stack of entered contexts and the stack of function-call frames.
 * <p>
 * Name lookup goes through the frames from the innermost outwards, then the
 * current context, then {@link #GLOBAL}. Assignment follows the same order but
 * never falls back to {@link #GLOBAL} from another context, and never creates
 * a binding.
 * <p>
 * Pure data: no I/O, not thread-safe. Parallel paths work on a
 * {@link #snapshot()}.
 */
public class ContextManager {

	/** Name of the context that always exists */
	public static final String GLOBAL = "global";

	private final Map<String, ExecutionContext> contexts = new LinkedHashMap<String, ExecutionContext>();
	private final Deque<String> contextStack = new ArrayDeque<String>();
	private final Deque<Map<String, Value>> frames = new ArrayDeque<Map<String, Value>>();
	private String current = GLOBAL;

	// approximate bytes held by every binding
	private long size;

	public ContextManager() {
		contexts.put(GLOBAL, new ExecutionContext(GLOBAL));
	}

	/**
	 * @return an independent deep copy of all bindings and stacks
	 */
	public ContextManager snapshot() {
		ContextManager copy = new ContextManager();
		copy.contexts.clear();
		for (Map.Entry<String, ExecutionContext> entry : contexts.entrySet()) {
			copy.contexts.put(entry.getKey(), entry.getValue().copy());
		}
		copy.contextStack.addAll(contextStack);
		for (Iterator<Map<String, Value>> it = frames.descendingIterator(); it.hasNext();) {
			copy.frames.push(new HashMap<String, Value>(it.next()));
		}
		copy.current = current;
		copy.size = size;
		return copy;
	}

	// CONTEXTS

	/**
	 * Creates a context unless one of that name exists.
	 *
	 * @param name context name
	 * @return whether a new context was created
	 */
	public boolean createContext(String name) {
		if (contexts.containsKey(name)) {
			return false;
		}
		contexts.put(name, new ExecutionContext(name));
		return true;
	}

	public boolean hasContext(String name) {
		return contexts.containsKey(name);
	}

	/**
	 * @return names of all contexts, in creation order
	 */
	public List<String> getContextNames() {
		return new ArrayList<String>(contexts.keySet());
	}

	public String getCurrentContextName() {
		return current;
	}

	/**
	 * Makes an existing context current. Must be paired with
	 * {@link #exitContext()}, in a {@code finally} block.
	 *
	 * @param name context to enter
	 * @throws LlmRuntimeException when the context does not exist
	 */
	public void enterContext(String name) {
		if (!contexts.containsKey(name)) {
			throw new LlmRuntimeException(RuntimeErrorKind.UNDEFINED_CONTEXT, "Undefined context: '" + name + "'");
		}
		contextStack.push(current);
		current = name;
	}

	/**
	 * Restores the context that was current before the last
	 * {@link #enterContext(String)}.
	 */
	public void exitContext() {
		assert !contextStack.isEmpty() : "exitContext() without enterContext()";
		current = contextStack.pop();
	}

	/**
	 * @return number of entered, not yet exited contexts
	 */
	public int getContextDepth() {
		return contextStack.size();
	}

	// FRAMES

	/**
	 * Opens a new innermost scope, for a function call.
	 */
	public void pushFrame() {
		frames.push(new HashMap<String, Value>());
	}

	/**
	 * Discards the innermost scope and its bindings.
	 */
	public void popFrame() {
		assert !frames.isEmpty() : "popFrame() without pushFrame()";
		for (Map.Entry<String, Value> binding : frames.pop().entrySet()) {
			size -= sizeOf(binding.getKey(), binding.getValue());
		}
	}

	public int getFrameDepth() {
		return frames.size();
	}

	// VARIABLES

	/**
	 * Binds a name in the innermost frame, or in the current context when no
	 * frame is open. Redeclaring a name replaces its value.
	 *
	 * @param name variable name
	 * @param value value
	 */
	public void declareVariable(String name, Value value) {
		Map<String, Value> scope = frames.isEmpty() ? contexts.get(current).getVariables() : frames.peek();
		Value previous = scope.put(name, value);
		if (previous != null) {
			size -= sizeOf(name, previous);
		}
		size += sizeOf(name, value);
	}

	/**
	 * @param name variable name
	 * @return the bound value, or {@code null} when the name is unbound
	 */
	public Value getVariable(String name) {
		for (Map<String, Value> frame : frames) {
			Value value = frame.get(name);
			if (value != null) {
				return value;
			}
		}
		Value value = contexts.get(current).getVariables().get(name);
		if (value != null) {
			return value;
		}
		return contexts.get(GLOBAL).getVariables().get(name);
	}

	/**
	 * @param context context name
	 * @param name variable name
	 * @return the variable bound in that very context, or {@code null}
	 */
	public Value getVariableIn(String context, String name) {
		ExecutionContext executionContext = contexts.get(context);
		return executionContext == null ? null : executionContext.getVariables().get(name);
	}

	/**
	 * Rebinds an existing variable.
	 *
	 * @param name variable name
	 * @param value new value
	 * @throws LlmRuntimeException when the name is not bound
	 */
	public void assignVariable(String name, Value value) {
		for (Map<String, Value> frame : frames) {
			if (frame.containsKey(name)) {
				replace(frame, name, value);
				return;
			}
		}
		Map<String, Value> variables = contexts.get(current).getVariables();
		if (variables.containsKey(name)) {
			replace(variables, name, value);
			return;
		}
		throw new LlmRuntimeException(
				RuntimeErrorKind.UNDEFINED_VARIABLE,
				"Cannot assign to undefined variable: '" + name + "'");
	}

	private void replace(Map<String, Value> scope, String name, Value value) {
		Value previous = scope.put(name, value);
		size += sizeOf(name, value) - sizeOf(name, previous);
	}

	// FUNCTIONS

	/**
	 * Registers a function in the current context.
	 *
	 * @param name function name
	 * @param function the {@code Function} node
	 */
	public void registerFunction(String name, Node function) {
		contexts.get(current).getFunctions().put(name, function);
	}

	/**
	 * @param name function name
	 * @return the function of the current context, else of {@link #GLOBAL},
	 *         or {@code null}
	 */
	public Node getFunction(String name) {
		Node function = contexts.get(current).getFunctions().get(name);
		if (function != null) {
			return function;
		}
		return contexts.get(GLOBAL).getFunctions().get(name);
	}

	/**
	 * @param context context name
	 * @param name function name
	 * @return the function registered in that very context, or {@code null}
	 */
	public Node getFunctionIn(String context, String name) {
		ExecutionContext executionContext = contexts.get(context);
		return executionContext == null ? null : executionContext.getFunctions().get(name);
	}

	/**
	 * @return approximate number of bytes held by all bindings
	 */
	public long getApproximateSize() {
		return size;
	}

	private static long sizeOf(String name, Value value) {
		return value == null ? 0 : name.length() + value.approximateSize();
	}
}
