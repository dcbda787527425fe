package org.pilens.pi.processing.classify;

/*
 * This file is part of PILens.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * PILens is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * PILens is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PILens.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.pilens.pi.om.ClassificationResult;
import org.pilens.pi.processing.extract.TextCleaner;

/**
 * Ordered-rule classification of narrative section text.
 *
 * <p>All methods are pure and never throw for null, empty or unmatched input.</p>
 */
public final class RiskClassifier {

	/** At most this many boost flags are counted toward confidence. */
	public static final int MAX_BOOSTS = 2;
	public static final int MAX_SCORE = 3;

	private RiskClassifier() {
	}

	/**
	 * Scores {@code text} against {@code table}. The text is normalized with
	 * {@link TextCleaner#normalizeForMatch(String)} first; the first rule (highest score
	 * first) that matches wins.
	 *
	 * @return {@code (0,"none")} for null/blank text, {@code (0,"unclear")} when nothing matches
	 */
	public static ClassificationResult classify(String text, RuleTable table) {
		if (StringUtils.isBlank(text)) return ClassificationResult.none();

		String normalized = TextCleaner.normalizeForMatch(text);
		if (normalized.isEmpty()) return ClassificationResult.none();
		if (table == null) return ClassificationResult.unclear();

		for (RiskRule rule : table.rules()) {
			if (rule.matches(normalized)) {
				return new ClassificationResult(rule.score(), rule.tag());
			}
		}
		return ClassificationResult.unclear();
	}

	/**
	 * Evaluates each evidence pattern against the text as given. Unlike {@link #classify}
	 * the text is not normalized, so a phrase broken across lines can still be caught by
	 * a DOTALL pattern but spelling variants are not folded.
	 *
	 * @return flag name to match result, in dictionary order; empty for null/blank text
	 */
	public static Map<String, Boolean> extractFlags(String text, EvidencePatterns evidence) {
		if (StringUtils.isBlank(text) || evidence == null) return Collections.emptyMap();

		Map<String, Boolean> flags = new LinkedHashMap<>();
		for (Map.Entry<String, Pattern> e : evidence.patterns().entrySet()) {
			flags.put(e.getKey(), e.getValue().matcher(text).find());
		}
		return flags;
	}

	/**
	 * Rule score clamped to 0..3, plus one for each of the first two boost keys that are set,
	 * capped at 3.
	 */
	public static int confidence(int score, Map<String, Boolean> flags, List<String> boostKeys) {
		int base = Math.max(0, Math.min(MAX_SCORE, score));
		int boosts = 0;
		if (flags != null && boostKeys != null) {
			for (String key : boostKeys) {
				if (boosts >= MAX_BOOSTS) break;
				if (Boolean.TRUE.equals(flags.get(key))) boosts++;
			}
		}
		return Math.min(MAX_SCORE, base + boosts);
	}

	/** {@link #classify} using the profile's rule table. */
	public static ClassificationResult classify(String text, RiskProfile profile) {
		return classify(text, profile == null ? null : profile.rules());
	}
}
