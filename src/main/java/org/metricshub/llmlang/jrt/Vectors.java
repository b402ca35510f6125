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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Deterministic stand-in for an embedding model and the vector arithmetic
 * built on it.
 */
public final class Vectors {

	/** Number of dimensions produced by {@link #embed(String)} */
	public static final int DIMENSIONS = 10;

	private Vectors() {
		/* utility class */
	}

	/**
	 * Embeds text: each of the first {@value #DIMENSIONS} code points divided
	 * by 1000, zero padded, then L2-normalized.
	 *
	 * @param text text to embed
	 * @return a unit vector, or the zero vector for empty text
	 */
	public static double[] embed(String text) {
		double[] vector = new double[DIMENSIONS];
		int dimension = 0;
		int offset = 0;
		while (offset < text.length() && dimension < DIMENSIONS) {
			int codePoint = text.codePointAt(offset);
			vector[dimension++] = codePoint / 1000.0;
			offset += Character.charCount(codePoint);
		}
		double norm = norm(vector);
		if (norm > 0) {
			for (int i = 0; i < vector.length; i++) {
				vector[i] /= norm;
			}
		}
		return vector;
	}

	/**
	 * Cosine similarity clamped to [0, 1]; 0 when either vector is zero.
	 *
	 * @param a first vector
	 * @param b second vector, same dimension
	 * @return the similarity
	 */
	public static double similarity(double[] a, double[] b) {
		checkSameDimensions(a, b);
		double normA = norm(a);
		double normB = norm(b);
		if (normA == 0 || normB == 0) {
			return 0;
		}
		double dot = 0;
		for (int i = 0; i < a.length; i++) {
			dot += a[i] * b[i];
		}
		double cosine = dot / (normA * normB);
		return Math.max(0, Math.min(1, cosine));
	}

	/**
	 * Returns the indices of the {@code k} candidates most similar to
	 * {@code query}, best first; ties keep candidate order.
	 *
	 * @param query the reference vector
	 * @param candidates vectors to rank
	 * @param k how many indices to return at most
	 * @return candidate indices
	 */
	public static List<Integer> nearest(double[] query, List<double[]> candidates, int k) {
		List<Integer> indices = new ArrayList<Integer>();
		final double[] scores = new double[candidates.size()];
		for (int i = 0; i < candidates.size(); i++) {
			scores[i] = similarity(query, candidates.get(i));
			indices.add(i);
		}
		Collections.sort(indices, Comparator.comparingDouble((Integer i) -> scores[i]).reversed());
		return new ArrayList<Integer>(indices.subList(0, Math.max(0, Math.min(k, indices.size()))));
	}

	/**
	 * @param vector components
	 * @return the Euclidean norm
	 */
	public static double norm(double[] vector) {
		double sum = 0;
		for (double component : vector) {
			sum += component * component;
		}
		return Math.sqrt(sum);
	}

	static void checkSameDimensions(double[] a, double[] b) {
		if (a.length != b.length) {
			throw new LlmRuntimeException(
					RuntimeErrorKind.INVALID_OPERATION,
					"Vector dimensions differ: " + a.length + " and " + b.length);
		}
	}
}
