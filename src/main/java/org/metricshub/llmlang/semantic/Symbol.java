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

import java.util.Collections;
import java.util.List;

/**
 * A name known to the analyzer: a variable, a function or a context.
 */
public final class Symbol {

	/**
	 * Namespaces of symbols. A scope may hold a variable and a function of the
	 * same name.
	 */
	public enum Kind {
		VARIABLE,
		FUNCTION,
		CONTEXT
	}

	private final Kind kind;
	private final String name;
	private final String type;
	private final boolean mutable;
	private final List<String> parameterTypes;
	private final int minArity;
	private final int maxArity;
	private final int scope;

	private Symbol(Kind kind, String name, String type, boolean mutable, List<String> parameterTypes, int minArity, int maxArity, int scope) {
		this.kind = kind;
		this.name = name;
		this.type = type;
		this.mutable = mutable;
		this.parameterTypes = parameterTypes;
		this.minArity = minArity;
		this.maxArity = maxArity;
		this.scope = scope;
	}

	/**
	 * @param name variable name
	 * @param type declared type, {@code null} when inferred
	 * @return a mutable variable symbol
	 */
	public static Symbol variable(String name, String type) {
		return new Symbol(Kind.VARIABLE, name, type, true, Collections.<String>emptyList(), 0, 0, -1);
	}

	/**
	 * @param name function name
	 * @param parameterTypes declared parameter types
	 * @param returnType declared return type, {@code null} if none
	 * @return a user function symbol, of fixed arity
	 */
	public static Symbol function(String name, List<String> parameterTypes, String returnType) {
		List<String> types = Collections.unmodifiableList(parameterTypes);
		return new Symbol(Kind.FUNCTION, name, returnType, false, types, types.size(), types.size(), -1);
	}

	/**
	 * @param name function name
	 * @param minArity fewest arguments
	 * @param maxArity most arguments, {@code -1} for no limit
	 * @return a built-in function symbol
	 */
	public static Symbol builtin(String name, int minArity, int maxArity) {
		return new Symbol(Kind.FUNCTION, name, null, false, Collections.<String>emptyList(), minArity, maxArity, -1);
	}

	/**
	 * @param name context name
	 * @param scope index of the scope holding the context members
	 * @return a context symbol
	 */
	public static Symbol context(String name, int scope) {
		return new Symbol(Kind.CONTEXT, name, null, false, Collections.<String>emptyList(), 0, 0, scope);
	}

	public Kind getKind() {
		return kind;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return declared type of a variable, or return type of a function;
	 *         {@code null} when not declared
	 */
	public String getType() {
		return type;
	}

	public boolean isMutable() {
		return mutable;
	}

	public List<String> getParameterTypes() {
		return parameterTypes;
	}

	public int getMinArity() {
		return minArity;
	}

	public int getMaxArity() {
		return maxArity;
	}

	/**
	 * @param count number of arguments at a call site
	 * @return whether the function accepts that many arguments
	 */
	public boolean acceptsArity(int count) {
		return count >= minArity && (maxArity < 0 || count <= maxArity);
	}

	/**
	 * @return for a context, the scope holding its members; {@code -1} otherwise
	 */
	public int getScope() {
		return scope;
	}

	@Override
	public String toString() {
		return kind + " " + name;
	}
}
