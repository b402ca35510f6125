package org.metricshub.llmlang;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.util.CompileOptions;

/**
 * A program that went through lexing, parsing and semantic analysis, ready to
 * be executed any number of times.
 */
public final class CompiledProgram {

	private final String description;
	private final String source;
	private final Node ast;
	private final CompileOptions options;

	CompiledProgram(String description, String source, Node ast, CompileOptions options) {
		this.description = description;
		this.source = source;
		this.ast = ast;
		this.options = options;
	}

	/**
	 * @return description of the source (file name or {@code <command-line>})
	 */
	public String getDescription() {
		return description;
	}

	/**
	 * @return the program text
	 */
	public String getSource() {
		return source;
	}

	/**
	 * @return the analyzed syntax tree, shared with the engines that run it
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public Node getAst() {
		return ast;
	}

	/**
	 * @return the options the program was compiled with
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public CompileOptions getOptions() {
		return options;
	}
}
