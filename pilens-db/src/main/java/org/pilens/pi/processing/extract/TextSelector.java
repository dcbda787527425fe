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

import java.util.Locale;
import java.util.regex.Pattern;

import org.w3c.dom.Element;

/**
 * Picks the "best" text of a node: the Japanese language variant if there is one,
 * otherwise the node's own text.
 */
public final class TextSelector {

	private static final Pattern LEADING_SEP = Pattern.compile("^[、，,\\s\\u3000]+");
	private static final Pattern TRAILING_SEP = Pattern.compile("[、，,\\s\\u3000]+$");
	private static final Pattern TRAILING_ETC = Pattern.compile("(等|など)$");
	private static final Pattern LEADING_ETC = Pattern.compile("^(等|など)");

	private TextSelector() {
	}

	/**
	 * Full subtree text of the first {@code pi:Lang} child tagged {@code ja} (or
	 * {@code ja-*}), else the node's direct text, else null.
	 */
	public static String selectText(Element node) {
		if (node == null) return null;
		String ja = japaneseVariantText(node);
		return ja != null ? ja : selectDirectText(node);
	}

	/** Direct text only, stripped; null when blank. */
	public static String selectDirectText(Element node) {
		return TextCleaner.stripToNull(PiTree.directText(node));
	}

	/** Direct text of the first element at {@code path}; null when missing or blank. */
	public static String textAt(Element node, String path) {
		return selectDirectText(PiTree.findFirst(node, path));
	}

	/** Stripped full text of the first Japanese {@code pi:Lang} child with content. */
	public static String japaneseVariantText(Element node) {
		for (Element lang : PiTree.findAll(node, "pi:Lang")) {
			if (isJapanese(PiTree.langOf(lang))) {
				String s = TextCleaner.stripToNull(PiTree.allText(lang));
				if (s != null) return s;
			}
		}
		return null;
	}

	public static boolean isJapanese(String lang) {
		return lang != null && lang.toLowerCase(Locale.ROOT).startsWith("ja");
	}

	/** {@link #selectText(Element)} followed by {@link #normalizeLabel(String)}. */
	public static String labelText(Element node) {
		return normalizeLabel(selectText(node));
	}

	/**
	 * Cleans a partner/group label: trims whitespace and list separators, drops entries that
	 * are only 等 / など ("and others"), and removes one trailing and one leading 等 / など.
	 *
	 * @return the cleaned label, or null if nothing meaningful is left
	 */
	public static String normalizeLabel(String s) {
		if (s == null) return null;
		String t = s.strip();
		t = LEADING_SEP.matcher(t).replaceFirst("");
		t = TRAILING_SEP.matcher(t).replaceFirst("");
		if (t.isEmpty()) return null;

		if ("等".equals(t) || "など".equals(t)) return null;

		t = TRAILING_ETC.matcher(t).replaceFirst("").strip();
		t = LEADING_ETC.matcher(t).replaceFirst("").strip();
		return t.isEmpty() ? null : t;
	}
}
