package org.metricshub.llmlang.util;

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
import java.io.Reader;
import java.io.StringReader;

/**
 * One LLM.lang program source: a description used in error locations and a
 * {@link Reader} over the program text. This is usually either a string,
 * given on the command line with {@code -e}, or a {@code *.llm} file.
 */
public class ScriptSource {

	/** Description of programs given inline on the command line */
	public static final String DESCRIPTION_COMMAND_LINE_SCRIPT = "<command-line>";

	private final String description;
	private final Reader reader;

	/**
	 * @param description how the source is reported in locations
	 * @param reader the program text
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * Convenience factory for in-memory programs.
	 *
	 * @param description how the source is reported in locations
	 * @param text the program text
	 * @return the source
	 */
	public static ScriptSource of(String description, String text) {
		return new ScriptSource(description, new StringReader(text));
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the program contents.
	 *
	 * @return The reader which contains the program contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Reads the whole program and closes the reader.
	 *
	 * @return the program text
	 * @throws IOException when reading fails
	 */
	public String readText() throws IOException {
		StringBuilder text = new StringBuilder();
		try (Reader in = getReader()) {
			char[] buffer = new char[4096];
			int read;
			while ((read = in.read(buffer)) >= 0) {
				text.append(buffer, 0, read);
			}
		}
		return text.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
