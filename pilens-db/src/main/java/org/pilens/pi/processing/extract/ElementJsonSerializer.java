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
import java.util.List;
import java.util.Map;

import org.pilens.pi.om.SerializedNode;
import org.w3c.dom.Element;

/**
 * Converts any element subtree into a {@link SerializedNode}, keeping attributes, trimmed
 * text, child order and the text that sits between sibling elements. Whitespace-only text
 * and comments are dropped.
 */
public final class ElementJsonSerializer {

	private ElementJsonSerializer() {
	}

	public static SerializedNode serialize(Element el) {
		if (el == null) return null;

		Map<String, String> attr = PiTree.attributes(el);
		String text = TextCleaner.stripToNull(PiTree.directText(el));

		List<SerializedNode> children = new ArrayList<>();
		for (Element ch : PiTree.children(el)) {
			children.add(serialize(ch));
			String tail = TextCleaner.stripToNull(PiTree.tailText(ch));
			if (tail != null) {
				children.add(SerializedNode.tail(tail));
			}
		}
		return new SerializedNode(PiTree.clarkName(el), attr, text, children);
	}
}
