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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import org.metricshub.llmlang.LlmException;
import org.metricshub.llmlang.frontend.Parser;
import org.metricshub.llmlang.frontend.ast.Node;
import org.metricshub.llmlang.jrt.LlmRuntimeException;
import org.metricshub.llmlang.jrt.RuntimeErrorKind;
import org.metricshub.llmlang.util.LlmLogger;
import org.slf4j.Logger;

/**
 * Keeps the source text and syntax tree of every program that
 * {@code @modify} may target, and applies modifications to them.
 * <p>
 * Targets are looked up in the caches first, then read from disk. Each
 * modification is applied to a copy of the cached tree, which replaces the
 * cached one only once the edit and the source regeneration succeeded. When
 * the target name ends with {@value #SCRIPT_EXTENSION}, the regenerated source
 * is also written back to that file.
 * <p>
 * Instances are shared by parallel paths, hence synchronized.
 */
public class ModifyManager {

	private static final Logger LOGGER = LlmLogger.getLogger(ModifyManager.class);

	/** Extension of program files that get rewritten on disk */
	public static final String SCRIPT_EXTENSION = ".llm";

	private final Map<String, String> sourceCache = new HashMap<String, String>();
	private final Map<String, Node> astCache = new HashMap<String, Node>();

	/**
	 * Caches a program under a name, usually the description of its source.
	 *
	 * @param name target name
	 * @param source program text
	 * @param ast its syntax tree, copied; {@code null} to parse on demand
	 */
	public synchronized void register(String name, String source, Node ast) {
		sourceCache.put(name, source);
		if (ast == null) {
			astCache.remove(name);
		} else {
			astCache.put(name, ast.deepCopy());
		}
	}

	/**
	 * @param name target name
	 * @return the cached source, or {@code null}
	 */
	public synchronized String getSource(String name) {
		return sourceCache.get(name);
	}

	/**
	 * @param name target name
	 * @return a copy of the cached tree, or {@code null}
	 */
	public synchronized Node getAst(String name) {
		Node ast = astCache.get(name);
		return ast == null ? null : ast.deepCopy();
	}

	/**
	 * Applies one modification to a target program.
	 *
	 * @param target program name or file path
	 * @param modification the edit
	 * @return the regenerated source
	 * @throws LlmRuntimeException {@link RuntimeErrorKind#MODIFICATION_FAILED}
	 *         when the target cannot be loaded, parsed, edited or written back
	 */
	public synchronized String apply(String target, Modification modification) {
		Node ast = astCache.get(target);
		if (ast == null) {
			ast = parse(target, loadSource(target));
		}
		Node modified = AstEditor.apply(ast.deepCopy(), modification);
		String source = SourceGenerator.generate(modified);

		astCache.put(target, modified);
		sourceCache.put(target, source);
		LOGGER.debug("Applied {} to '{}'", modification, target);

		if (target.endsWith(SCRIPT_EXTENSION)) {
			write(target, source);
		}
		return source;
	}

	private String loadSource(String target) {
		String source = sourceCache.get(target);
		if (source != null) {
			return source;
		}
		Path path = Paths.get(target);
		if (!Files.isRegularFile(path)) {
			throw new LlmRuntimeException(RuntimeErrorKind.MODIFICATION_FAILED, "Unknown modification target: '" + target + "'");
		}
		try {
			source = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.MODIFICATION_FAILED,
					"Failed to read modification target '" + target + "': " + e.getMessage(),
					null,
					e);
		}
		sourceCache.put(target, source);
		return source;
	}

	private static Node parse(String target, String source) {
		try {
			return Parser.parse(source, target);
		} catch (LlmException e) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.MODIFICATION_FAILED,
					"Cannot parse modification target '" + target + "': " + e.toDisplayString(),
					null,
					e);
		}
	}

	private static void write(String target, String source) {
		try {
			Files.write(Paths.get(target), source.getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.MODIFICATION_FAILED,
					"Failed to write modified program to '" + target + "': " + e.getMessage(),
					null,
					e);
		}
		LOGGER.info("Wrote modified program to {}", target);
	}
}
