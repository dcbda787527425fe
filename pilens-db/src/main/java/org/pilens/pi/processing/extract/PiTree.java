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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import javax.xml.XMLConstants;

import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Read-only access to a parsed package insert DOM.
 *
 * <p>Two lookup modes are offered and kept apart on purpose:</p>
 * <ul>
 *   <li>{@link #findFirst(Element, String)} / {@link #findAll(Element, String)} resolve
 *       prefixed paths ({@code pi:Interactions/pi:ContraIndicatedCombinations//pi:Drug})
 *       against the fixed {@link #PREFIXES} table;</li>
 *   <li>{@link #findByLocalName(Element, Collection)} ignores namespaces and matches the
 *       local tag name only. Section tags move between namespaces across revisions of the
 *       PMDA schema, so this is the only safe way to locate them.</li>
 * </ul>
 *
 * <p>None of the lookups throw for a {@code null} node or a missing match.</p>
 */
public final class PiTree {

	/** PMDA prescription drug package insert namespace. */
	public static final String PI_NS = "http://info.pmda.go.jp/namespace/prescription_drugs/package_insert/1.0";
	public static final String XML_NS = XMLConstants.XML_NS_URI;

	/** Prefix table used by path expressions. */
	public static final Map<String, String> PREFIXES = Map.of("pi", PI_NS, "xml", XML_NS);

	/** Local name of language-variant elements. */
	public static final String LANG = "Lang";

	private PiTree() {
	}

	// ---------------------------------------------------------------- paths

	/** First element matching {@code path} under {@code node}, or null. */
	public static Element findFirst(Element node, String path) {
		List<Element> all = findAll(node, path);
		return all.isEmpty() ? null : all.get(0);
	}

	/**
	 * All elements matching {@code path} under {@code node}, document order, no duplicates.
	 * An empty step ({@code a//b}) matches at any depth below the current context.
	 */
	public static List<Element> findAll(Element node, String path) {
		if (node == null || path == null || path.isBlank()) return Collections.emptyList();

		List<Element> context = List.of(node);
		boolean descend = false;
		for (String step : path.split("/", -1)) {
			if (step.isEmpty()) {
				descend = true;
				continue;
			}
			String[] qn = resolve(step);
			LinkedHashSet<Element> next = new LinkedHashSet<>();
			for (Element ctx : context) {
				if (descend) {
					collectDescendants(ctx, qn[0], qn[1], next);
				} else {
					for (Element ch : children(ctx)) {
						if (matches(ch, qn[0], qn[1])) next.add(ch);
					}
				}
			}
			descend = false;
			if (next.isEmpty()) return Collections.emptyList();
			context = new ArrayList<>(next);
		}
		return context;
	}

	/** Splits {@code prefix:Local} into {namespaceUri, localName}. */
	private static String[] resolve(String step) {
		int colon = step.indexOf(':');
		if (colon < 0) return new String[] { null, step };
		String prefix = step.substring(0, colon);
		String uri = PREFIXES.get(prefix);
		if (uri == null) {
			throw new IllegalArgumentException("Unknown namespace prefix '" + prefix + "' in step: " + step);
		}
		return new String[] { uri, step.substring(colon + 1) };
	}

	private static boolean matches(Element el, String ns, String local) {
		return Objects.equals(emptyToNull(el.getNamespaceURI()), ns) && local.equals(localName(el));
	}

	private static void collectDescendants(Element ctx, String ns, String local, Set<Element> out) {
		for (Element ch : children(ctx)) {
			if (matches(ch, ns, local)) out.add(ch);
			collectDescendants(ch, ns, local, out);
		}
	}

	// ------------------------------------------------------ namespace-agnostic

	/**
	 * Depth-first search of {@code node} and all its descendants for elements whose
	 * local name is in {@code names}, regardless of namespace.
	 */
	public static List<Element> findByLocalName(Element node, Collection<String> names) {
		List<Element> hits = new ArrayList<>();
		if (node == null || names == null || names.isEmpty()) return hits;
		visitLocal(node, names, hits);
		return hits;
	}

	private static void visitLocal(Element el, Collection<String> names, List<Element> hits) {
		if (names.contains(localName(el))) hits.add(el);
		for (Element ch : children(el)) {
			visitLocal(ch, names, hits);
		}
	}

	// ---------------------------------------------------------------- node info

	/** Tag name without namespace prefix/URI. */
	public static String localName(Node n) {
		if (n == null) return "";
		String local = n.getLocalName();
		if (local != null) return local;
		String name = n.getNodeName();
		int colon = name.indexOf(':');
		return colon < 0 ? name : name.substring(colon + 1);
	}

	/** {@code {uri}local}, or just {@code local} when the node has no namespace. */
	public static String clarkName(Node n) {
		String ns = emptyToNull(n.getNamespaceURI());
		return ns == null ? localName(n) : "{" + ns + "}" + localName(n);
	}

	/** Direct element children in document order. */
	public static List<Element> children(Element el) {
		List<Element> out = new ArrayList<>();
		if (el == null) return out;
		NodeList nl = el.getChildNodes();
		for (int i = 0; i < nl.getLength(); i++) {
			Node n = nl.item(i);
			if (n.getNodeType() == Node.ELEMENT_NODE) out.add((Element) n);
		}
		return out;
	}

	/** Attributes keyed by Clark name; namespace declarations are left out. */
	public static Map<String, String> attributes(Element el) {
		Map<String, String> out = new LinkedHashMap<>();
		if (el == null) return out;
		NamedNodeMap attrs = el.getAttributes();
		for (int i = 0; i < attrs.getLength(); i++) {
			Attr a = (Attr) attrs.item(i);
			if (XMLConstants.XMLNS_ATTRIBUTE_NS_URI.equals(a.getNamespaceURI())
					|| XMLConstants.XMLNS_ATTRIBUTE.equals(a.getName())
					|| a.getName().startsWith(XMLConstants.XMLNS_ATTRIBUTE + ":")) {
				continue;
			}
			out.put(clarkName(a), a.getValue());
		}
		return out;
	}

	/** Value of an unqualified attribute, or null when it is missing. */
	public static String attribute(Element el, String name) {
		if (el == null || !el.hasAttribute(name)) return null;
		return el.getAttribute(name);
	}

	/** {@code xml:lang}, falling back to a plain {@code lang} attribute. */
	public static String langOf(Element el) {
		if (el == null) return null;
		if (el.hasAttributeNS(XML_NS, "lang")) return el.getAttributeNS(XML_NS, "lang");
		if (el.hasAttribute("xml:lang")) return el.getAttribute("xml:lang");
		return attribute(el, "lang");
	}

	/** Text before the first child element; comments and PIs are skipped. Null if none. */
	public static String directText(Element el) {
		if (el == null) return null;
		StringBuilder sb = null;
		for (Node n = el.getFirstChild(); n != null; n = n.getNextSibling()) {
			if (n.getNodeType() == Node.ELEMENT_NODE) break;
			if (isText(n)) {
				if (sb == null) sb = new StringBuilder();
				sb.append(n.getNodeValue());
			}
		}
		return sb == null ? null : sb.toString();
	}

	/** Text between {@code el} and its next element sibling. Null if none. */
	public static String tailText(Element el) {
		if (el == null) return null;
		StringBuilder sb = null;
		for (Node n = el.getNextSibling(); n != null; n = n.getNextSibling()) {
			if (n.getNodeType() == Node.ELEMENT_NODE) break;
			if (isText(n)) {
				if (sb == null) sb = new StringBuilder();
				sb.append(n.getNodeValue());
			}
		}
		return sb == null ? null : sb.toString();
	}

	/** Concatenation of every descendant text node. */
	public static String allText(Element el) {
		if (el == null) return null;
		String s = el.getTextContent();
		return s == null ? "" : s;
	}

	private static boolean isText(Node n) {
		return n.getNodeType() == Node.TEXT_NODE || n.getNodeType() == Node.CDATA_SECTION_NODE;
	}

	private static String emptyToNull(String s) {
		return (s == null || s.isEmpty()) ? null : s;
	}
}
