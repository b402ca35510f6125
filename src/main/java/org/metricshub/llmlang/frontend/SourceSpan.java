package org.metricshub.llmlang.frontend;

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

import java.util.Objects;

/**
 * Location of a token or syntax node in its source.
 * Lines and columns are 1-based; columns count Unicode code points.
 * Spans are purely descriptive: they never take part in node equality.
 */
public final class SourceSpan {

	/** File name used when the source has no better description */
	public static final String DEFAULT_FILE = "<input>";

	/** Span used for synthesized values that have no source position */
	public static final SourceSpan UNKNOWN = new SourceSpan(0, 0, 0, 0, DEFAULT_FILE);

	private final int startLine;
	private final int startColumn;
	private final int endLine;
	private final int endColumn;
	private final String file;

	/**
	 * Creates a span.
	 *
	 * @param startLine first line (1-based)
	 * @param startColumn first column (1-based)
	 * @param endLine last line
	 * @param endColumn column just past the last character
	 * @param file source description, {@link #DEFAULT_FILE} when {@code null}
	 */
	public SourceSpan(int startLine, int startColumn, int endLine, int endColumn, String file) {
		this.startLine = startLine;
		this.startColumn = startColumn;
		this.endLine = endLine;
		this.endColumn = endColumn;
		this.file = file == null ? DEFAULT_FILE : file;
	}

	/**
	 * Creates an empty span at one position.
	 *
	 * @param line line (1-based)
	 * @param column column (1-based)
	 * @param file source description
	 * @return the span
	 */
	public static SourceSpan at(int line, int column, String file) {
		return new SourceSpan(line, column, line, column, file);
	}

	/**
	 * Returns a span starting where this one starts and ending where
	 * {@code end} ends.
	 *
	 * @param end the last span to cover
	 * @return the merged span
	 */
	public SourceSpan through(SourceSpan end) {
		return new SourceSpan(startLine, startColumn, end.endLine, end.endColumn, file);
	}

	public int getStartLine() {
		return startLine;
	}

	public int getStartColumn() {
		return startColumn;
	}

	public int getEndLine() {
		return endLine;
	}

	public int getEndColumn() {
		return endColumn;
	}

	public String getFile() {
		return file;
	}

	@Override
	public boolean equals(Object other) {
		if (this == other) {
			return true;
		}
		if (!(other instanceof SourceSpan)) {
			return false;
		}
		SourceSpan span = (SourceSpan) other;
		return startLine == span.startLine
				&& startColumn == span.startColumn
				&& endLine == span.endLine
				&& endColumn == span.endColumn
				&& file.equals(span.file);
	}

	@Override
	public int hashCode() {
		return Objects.hash(startLine, startColumn, endLine, endColumn, file);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return file + ":" + startLine + ":" + startColumn;
	}
}
