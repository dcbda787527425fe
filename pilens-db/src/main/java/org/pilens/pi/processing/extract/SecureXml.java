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

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerConfigurationException;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.pilens.pi.util.Logger;
import org.w3c.dom.Document;
import org.w3c.dom.Node;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

/**
 * Namespace-aware DOM parsing with external DTDs and external entities disabled, plus the reverse
 * direction (node to string).
 */
public final class SecureXml {

	/**
	 * Thread-local, hardened DOM builder. A DOCTYPE is accepted and internal entities expand
	 * within the secure-processing limits; external DTDs and external entities are never loaded.
	 */
	private static final ThreadLocal<DocumentBuilder> TL_DOM = ThreadLocal.withInitial(() -> {
		try {
			DocumentBuilderFactory f = DocumentBuilderFactory.newInstance();
			f.setNamespaceAware(true);
			f.setValidating(false);
			f.setXIncludeAware(false);
			f.setExpandEntityReferences(true);
			f.setCoalescing(false);
			f.setIgnoringComments(false);

			f.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			f.setFeature("http://apache.org/xml/features/disallow-doctype-decl", false);
			f.setFeature("http://xml.org/sax/features/external-general-entities", false);
			f.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
			f.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);

			try {
				f.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
				f.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
			} catch (IllegalArgumentException notSupported) {
				Logger.debug("DOM factory ignores external access attributes: {}", notSupported.getMessage());
			}
			return f.newDocumentBuilder();
		} catch (Exception e) {
			throw new IllegalStateException("Failed to init secure XML builder", e);
		}
	});

	private SecureXml() {
	}

	public static Document parse(Path file) throws IOException, SAXException {
		try (InputStream in = Files.newInputStream(file)) {
			DocumentBuilder b = TL_DOM.get();
			b.reset();
			Document doc = b.parse(in, file.toUri().toString());
			doc.getDocumentElement().normalize();
			return doc;
		}
	}

	public static Document parse(String xml) throws IOException, SAXException {
		DocumentBuilder b = TL_DOM.get();
		b.reset();
		Document doc = b.parse(new InputSource(new StringReader(xml)));
		doc.getDocumentElement().normalize();
		return doc;
	}

	/** Serializes a node (usually the document element) without an XML declaration. */
	public static String toXmlString(Node node) throws TransformerException {
		TransformerFactory factory = TransformerFactory.newInstance();
		try {
			factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
			factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
			factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
		} catch (IllegalArgumentException | TransformerConfigurationException notSupported) {
			Logger.debug("Transformer factory hardening not supported: {}", notSupported.getMessage());
		}

		Transformer transformer = factory.newTransformer();
		transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
		transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");

		StringWriter writer = new StringWriter();
		transformer.transform(new DOMSource(node), new StreamResult(writer));
		return writer.toString();
	}
}
