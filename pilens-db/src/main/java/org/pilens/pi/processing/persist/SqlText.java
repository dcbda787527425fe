package org.pilens.pi.processing.persist;

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
 * Renders Java values as PostgreSQL literals for the emitted scripts.
 */
public final class SqlText {

	// ANSI-portable control char filter (keep LF/CR/TAB only)
	private static final Pattern NON_PORTABLE_CTRLS = Pattern.compile("[\\p{Cntrl}&&[^\\n\\r\\t]]");

	private SqlText() {
	}

	/**
	 * Sanitize free text for a single-quoted SQL literal:
	 * - Normalizes CRLF/CR to LF
	 * - Removes non-portable control chars
	 * - Strips unpaired surrogates
	 * - Doubles single quotes
	 */
	public static String sanitize(String input) {
		if (input == null) return "";
		String s = input.replace("\r\n", "\n").replace("\r", "\n");
		s = NON_PORTABLE_CTRLS.matcher(s).replaceAll("");
		s = stripUnpairedSurrogates(s);
		return s.replace("'", "''");
	}

	/** {@code 'text'}, or {@code NULL} for null. */
	public static String literal(String s) {
		return s == null ? "NULL" : "'" + sanitize(s) + "'";
	}

	/** {@code 'json'::jsonb}, or {@code NULL} for null. */
	public static String jsonb(String json) {
		return json == null ? "NULL" : literal(json) + "::jsonb";
	}

	public static String bool(boolean b) {
		return b ? "TRUE" : "FALSE";
	}

	/** Remove any unpaired surrogate code units from the string. */
	static String stripUnpairedSurrogates(String s) {
		if (s == null || s.isEmpty()) return s;
		StringBuilder b = new StringBuilder(s.length());
		for (int i = 0; i < s.length();) {
			char ch = s.charAt(i);
			if (Character.isHighSurrogate(ch)) {
				if (i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1))) {
					b.append(ch).append(s.charAt(i + 1));
					i += 2;
				} else {
					i += 1; // drop lone high surrogate
				}
			} else if (Character.isLowSurrogate(ch)) {
				i += 1; // drop lone low surrogate
			} else {
				b.append(ch);
				i += 1;
			}
		}
		return b.toString();
	}
}
