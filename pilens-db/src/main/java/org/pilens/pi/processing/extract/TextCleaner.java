package org.pilens.pi.processing.extract;

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

import java.util.regex.Pattern;

/**
 * Whitespace normalization shared by the extractors and the classifier.
 */
public final class TextCleaner {

	private static final Pattern SPACE_RUNS = Pattern.compile("[ \\t\\u3000]+");
	private static final Pattern BLANK_LINES = Pattern.compile("\\n{3,}");
	private static final Pattern ANY_WS = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

	private TextCleaner() {
	}

	/**
	 * Narrative normalization: CRLF/CR to LF, runs of spaces/tabs/ideographic spaces to one
	 * space, three or more newlines to a blank line, then strip. Wording is left untouched.
	 */
	public static String normalizeWhitespace(String s) {
		if (s == null) return null;
		String t = s.replace("\r\n", "\n").replace("\r", "\n");
		t = SPACE_RUNS.matcher(t).replaceAll(" ");
		t = BLANK_LINES.matcher(t).replaceAll("\n\n");
		return t.strip();
	}

	/**
	 * Match-only normalization for rule classification: everything on one line, single
	 * spaces, and the spelling variants of 上回る folded. Never applied to stored text.
	 */
	public static String normalizeForMatch(String s) {
		if (s == null) return "";
		String t = s.replace('\u3000', ' ').replace('\r', ' ').replace('\n', ' ');
		t = ANY_WS.matcher(t).replaceAll(" ");
		t = t.replace("上まわる", "上回る").replace("上廻る", "上回る");
		return t.strip();
	}

	/** Strip and map blank to null. */
	public static String stripToNull(String s) {
		if (s == null) return null;
		String t = s.strip();
		return t.isEmpty() ? null : t;
	}
}
