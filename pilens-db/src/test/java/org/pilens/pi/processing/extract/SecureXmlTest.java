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
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;

class SecureXmlTest {

	@TempDir
	Path tmp;

	@Test
	void document_with_doctype_is_parsed_without_loading_the_dtd() throws Exception {
		Path xml = tmp.resolve("pi.xml");
		Files.writeString(xml, "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
				+ "<!DOCTYPE PackageInsert SYSTEM \"missing/pi.dtd\">\n"
				+ "<PackageInsert xmlns=\"" + PiTree.PI_NS + "\"><PackageInsertNo>PI-1</PackageInsertNo></PackageInsert>",
				StandardCharsets.UTF_8);

		Document doc = SecureXml.parse(xml);
		assertEquals("PI-1", PiTree.findFirst(doc.getDocumentElement(), "pi:PackageInsertNo").getTextContent());
	}

	@Test
	void internal_entities_expand() throws Exception {
		Document doc = SecureXml.parse("<!DOCTYPE r [<!ENTITY maker \"製薬\">]><r>&maker;株式会社</r>");
		assertEquals("製薬株式会社", doc.getDocumentElement().getTextContent());
	}

	@Test
	void external_entities_are_not_resolved() throws Exception {
		Path secret = tmp.resolve("secret.txt");
		Files.writeString(secret, "top-secret", StandardCharsets.UTF_8);

		Document doc = SecureXml.parse("<!DOCTYPE r [<!ENTITY s SYSTEM \"" + secret.toUri() + "\">]><r>[&s;]</r>");
		assertFalse(doc.getDocumentElement().getTextContent().contains("top-secret"));
	}
}
