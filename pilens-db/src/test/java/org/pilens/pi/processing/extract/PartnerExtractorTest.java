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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.pilens.pi.om.PartnerGroup;
import org.w3c.dom.Element;

class PartnerExtractorTest {

	private static Element drug(String xml) {
		return PiTree.findFirst(XmlFixtures.root(xml), "pi:Drug");
	}

	@Test
	void reads_group_label_and_items() {
		PartnerGroup pg = PartnerExtractor.extract(drug(XmlFixtures.drug("強い CYP3A阻害剤", "イトラコナゾール等", "リトナビル")));
		assertEquals("強い CYP3A阻害剤", pg.group());
		assertEquals(List.of("イトラコナゾール", "リトナビル"), pg.items());
	}

	@Test
	void items_are_deduplicated_keeping_first_order() {
		PartnerGroup pg = PartnerExtractor.extract(drug(XmlFixtures.drug(null, "A", "B", "A", "C")));
		assertNull(pg.group());
		assertEquals(List.of("A", "B", "C"), pg.items());
	}

	@Test
	void first_detail_with_a_usable_label_wins() {
		PartnerGroup pg = PartnerExtractor.extract(drug("<Drug><DrugName>"
				+ XmlFixtures.jaDetail("等") + XmlFixtures.jaDetail("抗コリン剤") + XmlFixtures.jaDetail("三環系抗うつ剤")
				+ "</DrugName></Drug>"));
		assertEquals("抗コリン剤", pg.group());
		assertTrue(pg.items().isEmpty());
	}

	@Test
	void drug_without_name_block_is_empty() {
		PartnerGroup pg = PartnerExtractor.extract(drug("<Drug><ClinSymptomsAndMeasures/></Drug>"));
		assertNull(pg.group());
		assertTrue(pg.items().isEmpty());
	}

	@Test
	void dedupe_keeps_first_seen() {
		assertEquals(List.of("x", "y"), PartnerExtractor.dedupe(List.of("x", "y", "x", "y")));
	}
}
