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
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Deterministic, keyword-based stand-ins for the language-model routines of
 * the runtime. No model is ever called: the same input always gives the same
 * output.
 */
public final class NaturalLanguage {

	/** Answer given when no context sentence relates to a question */
	public static final String UNKNOWN_ANSWER = "I don't know.";

	private static final int SUMMARY_WORDS = 10;

	private NaturalLanguage() {
		/* utility class */
	}

	/**
	 * Evaluates a {@code #"..."#} block.
	 *
	 * @param text the inner text
	 * @return the text itself
	 */
	public static Value processNaturalLanguage(String text) {
		return Value.string(text);
	}

	/**
	 * Evaluates an {@code intent:} statement.
	 *
	 * @param intent the intent text
	 * @return the intent text
	 */
	public static Value processIntent(String intent) {
		return Value.string(intent);
	}

	/**
	 * @param text text to scan
	 * @return distinct capitalized words, in order of appearance
	 */
	public static List<String> extractEntities(String text) {
		Set<String> entities = new LinkedHashSet<String>();
		for (String word : words(text)) {
			if (Character.isUpperCase(word.codePointAt(0))) {
				entities.add(word);
			}
		}
		return new ArrayList<String>(entities);
	}

	/**
	 * Picks the category whose name occurs most often in the text; the first
	 * category wins ties and the no-match case.
	 *
	 * @param text text to classify
	 * @param categories candidate categories, not empty
	 * @return the chosen category
	 */
	public static String classifyText(String text, List<String> categories) {
		if (categories.isEmpty()) {
			throw new LlmRuntimeException(RuntimeErrorKind.INVALID_ARGUMENT, "No categories to classify into");
		}
		List<String> words = words(text.toLowerCase(Locale.ROOT));
		String best = categories.get(0);
		int bestCount = 0;
		for (String category : categories) {
			String needle = category.toLowerCase(Locale.ROOT);
			int count = 0;
			for (String word : words) {
				if (word.equals(needle)) {
					count++;
				}
			}
			if (count > bestCount) {
				best = category;
				bestCount = count;
			}
		}
		return best;
	}

	/**
	 * @param prompt generation prompt
	 * @return the prompt
	 */
	public static String generateText(String prompt) {
		return prompt;
	}

	/**
	 * @param text text to summarize
	 * @return its first ten words, followed by "..." when text was dropped
	 */
	public static String summarizeText(String text) {
		List<String> words = new ArrayList<String>();
		for (String word : text.trim().split("\\s+")) {
			if (!word.isEmpty()) {
				words.add(word);
			}
		}
		if (words.size() <= SUMMARY_WORDS) {
			return String.join(" ", words);
		}
		return String.join(" ", words.subList(0, SUMMARY_WORDS)) + "...";
	}

	/**
	 * @param text text to translate
	 * @param targetLanguage ignored
	 * @return the text unchanged
	 */
	public static String translateText(String text, String targetLanguage) {
		return text;
	}

	/**
	 * Returns the sentence of {@code context} sharing the most words with the
	 * question.
	 *
	 * @param question the question
	 * @param context text to search
	 * @return the best sentence, or {@link #UNKNOWN_ANSWER}
	 */
	public static String answerQuestion(String question, String context) {
		Set<String> questionWords = new HashSet<String>(words(question.toLowerCase(Locale.ROOT)));
		String answer = UNKNOWN_ANSWER;
		int bestOverlap = 0;
		for (String sentence : context.split("(?<=[.!?])\\s+")) {
			int overlap = 0;
			for (String word : new HashSet<String>(words(sentence.toLowerCase(Locale.ROOT)))) {
				if (questionWords.contains(word)) {
					overlap++;
				}
			}
			if (overlap > bestOverlap) {
				bestOverlap = overlap;
				answer = sentence.trim();
			}
		}
		return answer;
	}

	private static List<String> words(String text) {
		List<String> words = new ArrayList<String>();
		for (String word : text.split("[^\\p{L}\\p{N}_']+")) {
			if (!word.isEmpty()) {
				words.add(word);
			}
		}
		return words;
	}
}
