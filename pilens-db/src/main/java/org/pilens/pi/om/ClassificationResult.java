package org.pilens.pi.om;

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

/**
 * Outcome of rule classification: the ordinal score (0..3) and the tag of the rule that fired.
 */
public record ClassificationResult(int score, String ruleTag) {

	public static final String NONE = "none";
	public static final String UNCLEAR = "unclear";

	private static final ClassificationResult NO_TEXT = new ClassificationResult(0, NONE);
	private static final ClassificationResult NO_MATCH = new ClassificationResult(0, UNCLEAR);

	/** Result for absent or blank text. */
	public static ClassificationResult none() {
		return NO_TEXT;
	}

	/** Result for text that no rule matched. */
	public static ClassificationResult unclear() {
		return NO_MATCH;
	}
}
