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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

class TextSelectorTest {

	private static Element detail(String inner) {
		return PiTree.findFirst(XmlFixtures.root("<Detail>" + inner + "</Detail>"), "pi:Detail");
	}

	@Test
	void japanese_variant_wins_and_returns_full_subtree_text() {
		Element d = detail("direct<Lang xml:lang=\"en\">English</Lang>"
				+ "<Lang xml:lang=\"ja\">  <Emphasis>重要</Emphasis>な注意  </Lang>");
		assertEquals("重要な注意", TextSelector.selectText(d));
	}

	@Test
	void language_prefix_and_case_are_accepted() {
		assertEquals("日本語", TextSelector.selectText(detail("<Lang xml:lang=\"JA-jp\">日本語</Lang>")));
	}

	@Test
	void falls_back_to_direct_text_then_null() {
		assertEquals("直接", TextSelector.selectText(detail("  直接 <Lang xml:lang=\"en\">English</Lang>")));
		assertNull(TextSelector.selectText(detail("<Lang xml:lang=\"en\">English</Lang>")));
		assertNull(TextSelector.selectText(null));
	}

	@Test
	void selectDirectText_never_descends() {
		assertNull(TextSelector.selectDirectText(detail("<Lang xml:lang=\"ja\">日本語</Lang>")));
	}

	@Test
	void normalizeLabel_strips_etc_tokens_and_separators() {
		assertEquals("イトラコナゾール", TextSelector.normalizeLabel("イトラコナゾール等"));
		assertEquals("リファンピシン", TextSelector.normalizeLabel("、リファンピシンなど\u3000"));
		assertEquals("抗コリン剤", TextSelector.normalizeLabel("等抗コリン剤"));
		assertNull(TextSelector.normalizeLabel("等"));
		assertNull(TextSelector.normalizeLabel(" など "));
		assertNull(TextSelector.normalizeLabel("  "));
		assertNull(TextSelector.normalizeLabel(null));
	}
}
