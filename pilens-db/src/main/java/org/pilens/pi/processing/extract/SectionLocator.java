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

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.pilens.pi.om.SectionExtraction;
import org.pilens.pi.om.WomenSection;
import org.pilens.pi.util.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Collects narrative text of sections identified by local tag name only (pregnancy and
 * nursing sections change namespace between schema revisions).
 *
 * <p>All {@code Lang} descendants of every hit are read. Japanese variants come first,
 * other languages after; each group is deduplicated in order and joined with a blank line.
 * Labels are not cleaned here: this is prose, not partner names.</p>
 */
public final class SectionLocator {

	private static final String PARAGRAPH_SEP = "\n\n";

	private SectionLocator() {
	}

	public static SectionExtraction extract(Element root, WomenSection section) {
		return extract(root, section.localNames());
	}

	/**
	 * @param root  subtree to search (the node itself included)
	 * @param names acceptable local tag names
	 */
	public static SectionExtraction extract(Element root, Collection<String> names) {
		List<Element> hits = PiTree.findByLocalName(root, names);
		if (hits.isEmpty()) return SectionExtraction.absent();

		String firstId = PiTree.attribute(hits.get(0), "id");

		Set<String> ja = new LinkedHashSet<>();
		Set<String> other = new LinkedHashSet<>();
		for (Element hit : hits) {
			for (Element lang : PiTree.findByLocalName(hit, Set.of(PiTree.LANG))) {
				String t = TextCleaner.normalizeWhitespace(PiTree.allText(lang));
				if (t == null || t.isEmpty()) continue;
				if (TextSelector.isJapanese(PiTree.langOf(lang))) {
					ja.add(t);
				} else {
					other.add(t);
				}
			}
		}

		if (ja.isEmpty() && other.isEmpty()) {
			String raw = TextCleaner.normalizeWhitespace(PiTree.allText(hits.get(0)));
			return new SectionExtraction(TextCleaner.stripToNull(raw), firstId);
		}

		List<String> parts = new ArrayList<>(2);
		if (!ja.isEmpty()) parts.add(String.join(PARAGRAPH_SEP, ja));
		if (!other.isEmpty()) parts.add(String.join(PARAGRAPH_SEP, other));
		return new SectionExtraction(TextCleaner.stripToNull(String.join(PARAGRAPH_SEP, parts)), firstId);
	}

	/**
	 * Same as {@link #extract(Element, Collection)} on a stored XML string. Blank or
	 * unparsable input gives an absent result.
	 */
	public static SectionExtraction extract(String xml, Collection<String> names) {
		if (xml == null || xml.isBlank()) return SectionExtraction.absent();
		Document doc;
		try {
			doc = SecureXml.parse(xml);
		} catch (Exception e) {
			Logger.debug("XML parse error in section lookup: {}", e.getMessage());
			return SectionExtraction.absent();
		}
		return extract(doc.getDocumentElement(), names);
	}
}
