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

/**
 * Maps 0..3 scores to the Toranomon-style labels used in the risk table.
 */
public final class ToranomonScheme {

	public static final String NAME = "toranomon";

	private static final String[] PREGNANCY = { "不明", "B", "C", "D/X" };
	private static final String[] NURSING = { "不明", "情報提供", "有益性考慮", "授乳中止" };

	private ToranomonScheme() {
	}

	public static String pregnancyLabel(int score) {
		return PREGNANCY[clamp(score)];
	}

	public static String nursingLabel(int score) {
		return NURSING[clamp(score)];
	}

	private static int clamp(int score) {
		return Math.max(0, Math.min(RiskClassifier.MAX_SCORE, score));
	}
}
