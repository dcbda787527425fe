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
import org.pilens.pi.om.SerializedNode;
import org.pilens.pi.processing.persist.JsonColumns;
import org.w3c.dom.Element;

class ElementJsonSerializerTest {

	private static final String T = "{" + PiTree.PI_NS + "}";

	@Test
	void keeps_attributes_text_children_and_tail_text_in_order() {
		Element root = XmlFixtures.root(
				"<Detail id=\"d1\">  前文 <Emphasis>強調</Emphasis> 後文 <!-- c --><Lang xml:lang=\"ja\">本文</Lang>\n</Detail>");
		SerializedNode node = ElementJsonSerializer.serialize(PiTree.findFirst(root, "pi:Detail"));

		assertEquals(T + "Detail", node.getTag());
		assertEquals("d1", node.getAttr().get("id"));
		assertEquals("前文", node.getText());

		List<SerializedNode> ch = node.getChildren();
		assertEquals(3, ch.size());
		assertEquals(T + "Emphasis", ch.get(0).getTag());
		assertEquals("強調", ch.get(0).getText());
		assertTrue(ch.get(1).isTail());
		assertEquals("後文", ch.get(1).getText());
		assertEquals(T + "Lang", ch.get(2).getTag());
		assertEquals("ja", ch.get(2).getAttr().get("{" + PiTree.XML_NS + "}lang"));
	}

	@Test
	void empty_parts_are_left_out_of_the_json() {
		Element root = XmlFixtures.root("<Storage>\n  </Storage>");
		SerializedNode node = ElementJsonSerializer.serialize(PiTree.findFirst(root, "pi:Storage"));

		assertNull(node.getAttr());
		assertNull(node.getText());
		assertNull(node.getChildren());
		assertEquals("{\"tag\":\"" + T + "Storage\"}", JsonColumns.toJson(node));
	}

	@Test
	void serializing_twice_gives_the_same_node_and_json() {
		Element root = XmlFixtures.root(
				"<Detail id=\"d1\">前文<Emphasis>強調</Emphasis>後文<Lang xml:lang=\"ja\">本文</Lang>末尾</Detail>");
		Element detail = PiTree.findFirst(root, "pi:Detail");

		SerializedNode first = ElementJsonSerializer.serialize(detail);
		SerializedNode second = ElementJsonSerializer.serialize(detail);

		assertEquals(first, second);
		assertEquals(JsonColumns.toJson(first), JsonColumns.toJson(second));
		assertTrue(first.getChildren().stream().anyMatch(SerializedNode::isTail));
	}

	@Test
	void null_element_serializes_to_null() {
		assertNull(ElementJsonSerializer.serialize(null));
	}
}
