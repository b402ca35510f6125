package org.metricshub.llmlang.jrt;

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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Key/value store behind {@code @remember} and {@code @recall}.
 * Keeps insertion order so that the most recent entry can be recalled
 * without a key. Not thread-safe: every engine owns its own instance.
 */
public class SemanticMemory {

	private final LinkedHashMap<String, Value> entries = new LinkedHashMap<String, Value>();
	private long usage;

	public SemanticMemory() {}

	/**
	 * Copy constructor, used to give parallel paths their own memory.
	 *
	 * @param other memory to copy
	 */
	public SemanticMemory(SemanticMemory other) {
		entries.putAll(other.entries);
		usage = other.usage;
	}

	/**
	 * Stores a value, replacing and re-ordering an earlier one under the same key.
	 *
	 * @param key memory key
	 * @param value value to remember
	 */
	public void remember(String key, Value value) {
		Value previous = entries.remove(key);
		if (previous != null) {
			usage -= key.length() + previous.approximateSize();
		}
		entries.put(key, value);
		usage += key.length() + value.approximateSize();
	}

	/**
	 * @param key memory key
	 * @return the remembered value, or {@code null}
	 */
	public Value recall(String key) {
		return entries.get(key);
	}

	/**
	 * @return the most recently remembered value, or {@code null} when empty
	 */
	public Value recallMostRecent() {
		Value last = null;
		for (Map.Entry<String, Value> entry : entries.entrySet()) {
			last = entry.getValue();
		}
		return last;
	}

	public int size() {
		return entries.size();
	}

	/**
	 * @return approximate number of bytes held (keys and values)
	 */
	public long getUsage() {
		return usage;
	}
}
