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
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * All scopes of one analysis, stored in a list and addressed by index. Each
 * scope records the index of its parent ({@link #NO_PARENT} for the root).
 * <p>
 * Popping a scope only moves the current index back to the parent: the
 * record stays in the arena, so a scope can be made current again later,
 * e.g. to analyze a function body once all the declarations around it are
 * known.
 */
public final class ScopeArena {

	/** Parent index of the root scope */
	public static final int NO_PARENT = -1;

	/** Index of the root scope */
	public static final int ROOT = 0;

	private static final class Scope {
		private final int parent;
		private final Map<Symbol.Kind, Map<String, Symbol>> symbols = new EnumMap<Symbol.Kind, Map<String, Symbol>>(Symbol.Kind.class);

		private Scope(int parent) {
			this.parent = parent;
			for (Symbol.Kind kind : Symbol.Kind.values()) {
				symbols.put(kind, new HashMap<String, Symbol>());
			}
		}
	}

	private final List<Scope> scopes = new ArrayList<Scope>();
	private int current;

	public ScopeArena() {
		scopes.add(new Scope(NO_PARENT));
		current = ROOT;
	}

	/**
	 * Opens a child of the current scope and makes it current.
	 *
	 * @return index of the new scope
	 */
	public int push() {
		scopes.add(new Scope(current));
		current = scopes.size() - 1;
		return current;
	}

	/**
	 * Makes the parent of the current scope current.
	 */
	public void pop() {
		if (current == ROOT) {
			throw new IllegalStateException("Cannot pop the root scope");
		}
		current = scopes.get(current).parent;
	}

	public int getCurrent() {
		return current;
	}

	/**
	 * @param index an existing scope, which becomes current
	 */
	public void setCurrent(int index) {
		if (index < 0 || index >= scopes.size()) {
			throw new IndexOutOfBoundsException("No scope #" + index);
		}
		current = index;
	}

	/**
	 * @param index scope index
	 * @return index of its parent, {@link #NO_PARENT} for the root
	 */
	public int getParent(int index) {
		return scopes.get(index).parent;
	}

	/**
	 * @return number of scopes ever opened, root included
	 */
	public int size() {
		return scopes.size();
	}

	/**
	 * Declares a symbol in the current scope.
	 *
	 * @param symbol the symbol
	 * @return {@code false} when the scope already holds a symbol of that kind
	 *         and name
	 */
	public boolean declare(Symbol symbol) {
		return declareIn(current, symbol);
	}

	/**
	 * Declares a symbol in a given scope.
	 *
	 * @param scope scope index
	 * @param symbol the symbol
	 * @return {@code false} when the scope already holds a symbol of that kind
	 *         and name
	 */
	public boolean declareIn(int scope, Symbol symbol) {
		Map<String, Symbol> table = scopes.get(scope).symbols.get(symbol.getKind());
		if (table.containsKey(symbol.getName())) {
			return false;
		}
		table.put(symbol.getName(), symbol);
		return true;
	}

	/**
	 * Looks a name up from the current scope to the root.
	 *
	 * @param kind namespace
	 * @param name the name
	 * @return the innermost symbol, or {@code null}
	 */
	public Symbol lookup(Symbol.Kind kind, String name) {
		for (int index = current; index != NO_PARENT; index = scopes.get(index).parent) {
			Symbol symbol = scopes.get(index).symbols.get(kind).get(name);
			if (symbol != null) {
				return symbol;
			}
		}
		return null;
	}

	/**
	 * @param kind namespace
	 * @param name the name
	 * @return the symbol of the current scope only, or {@code null}
	 */
	public Symbol lookupLocal(Symbol.Kind kind, String name) {
		return scopes.get(current).symbols.get(kind).get(name);
	}
}
