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

/**
 * Named evidence patterns (e.g. {@code has_human_terato}), in a fixed order, plus the keys
 * that raise the confidence score.
 */
public final class EvidencePatterns {

	private static final EvidencePatterns EMPTY = new EvidencePatterns(Map.of(), List.of());

	private final Map<String, Pattern> patterns;
	private final List<String> boostKeys;

	public EvidencePatterns(Map<String, Pattern> patterns, List<String> boostKeys) {
		this.patterns = Collections.unmodifiableMap(new LinkedHashMap<>(patterns));
		this.boostKeys = List.copyOf(boostKeys);
	}

	public static EvidencePatterns empty() {
		return EMPTY;
	}

	public Map<String, Pattern> patterns() {
		return patterns;
	}

	/** Flags that each add one point of confidence (the first two are used). */
	public List<String> boostKeys() {
		return boostKeys;
	}

	public int size() {
		return patterns.size();
	}
}
