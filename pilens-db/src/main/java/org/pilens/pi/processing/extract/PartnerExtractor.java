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
import java.util.LinkedHashSet;
import java.util.List;

import org.pilens.pi.om.PartnerGroup;
import org.w3c.dom.Element;

/**
 * Reads the {@code pi:DrugName} block of an interaction {@code pi:Drug} element.
 *
 * <pre>
 * &lt;Drug&gt;
 *   &lt;DrugName&gt;
 *     &lt;Detail&gt;&lt;Lang xml:lang="ja"&gt;強い CYP3A阻害剤&lt;/Lang&gt;&lt;/Detail&gt;      -- group
 *     &lt;SimpleList&gt;
 *       &lt;Item&gt;&lt;Detail&gt;&lt;Lang xml:lang="ja"&gt;イトラコナゾール&lt;/Lang&gt;&lt;/Detail&gt;&lt;/Item&gt; -- items
 *     &lt;/SimpleList&gt;
 *   &lt;/DrugName&gt;
 * </pre>
 */
public final class PartnerExtractor {

	private PartnerExtractor() {
	}

	/**
	 * @param drug a {@code pi:Drug} element
	 * @return class label (first usable {@code Detail} wins) and the deduplicated substance names
	 */
	public static PartnerGroup extract(Element drug) {
		Element drugName = PiTree.findFirst(drug, "pi:DrugName");
		if (drugName == null) return PartnerGroup.empty();
		return new PartnerGroup(group(drugName), items(drugName));
	}

	/** Label of the first direct {@code pi:Detail} that yields one; later candidates are ignored. */
	static String group(Element drugName) {
		for (Element det : PiTree.findAll(drugName, "pi:Detail")) {
			String s = TextSelector.labelText(det);
			if (s != null) return s;
		}
		return null;
	}

	/** Normalized substance names in document order, first occurrence kept. */
	public static List<String> items(Element drugName) {
		List<String> raw = new ArrayList<>();
		for (Element det : PiTree.findAll(drugName, "pi:SimpleList/pi:Item/pi:Detail")) {
			String s = TextSelector.labelText(det);
			if (s != null) raw.add(s);
		}
		return dedupe(raw);
	}

	/** Drops later repeats, preserving first-seen order. */
	public static List<String> dedupe(List<String> values) {
		return new ArrayList<>(new LinkedHashSet<>(values));
	}
}
