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

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One classification rule: when {@code pattern} is found, the text scores {@code score}
 * and is tagged {@code tag}.
 */
public record RiskRule(int score, Pattern pattern, String tag) {

	/** Flags used for every rule and evidence pattern. */
	public static final int FLAGS = Pattern.MULTILINE | Pattern.DOTALL | Pattern.UNICODE_CHARACTER_CLASS;

	public RiskRule {
		Objects.requireNonNull(pattern, "pattern");
		Objects.requireNonNull(tag, "tag");
		if (score < 0 || score > 3) {
			throw new IllegalArgumentException("Rule score must be within 0..3: " + score);
		}
	}

	public static RiskRule of(int score, String regex, String tag) {
		return new RiskRule(score, Pattern.compile(regex, FLAGS), tag);
	}

	public boolean matches(CharSequence text) {
		return pattern.matcher(text).find();
	}
}
