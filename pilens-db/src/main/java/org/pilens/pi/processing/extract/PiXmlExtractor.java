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
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.xml.transform.TransformerException;

import org.pilens.pi.om.InteractionSummary;
import org.pilens.pi.om.PackageInsert;
import org.pilens.pi.om.PiDocument;
import org.pilens.pi.om.WomenSection;
import org.pilens.pi.processing.classify.WomenRiskAssessor;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

/**
 * Parses one package insert XML file into a {@link PiDocument}: one row per brand,
 * the JSON sections, the flattened interactions, the pregnancy/nursing sections and
 * their risk classification.
 */
public class PiXmlExtractor {

	/** Column name to top-level section path, in column order. */
	public static final Map<String, String> JSON_SECTIONS;
	static {
		Map<String, String> m = new LinkedHashMap<>();
		m.put("approval_etc_json", "pi:ApprovalEtc");
		m.put("indications_json", "pi:IndicationsOrEfficacy");
		m.put("info_dose_admin_json", "pi:InfoDoseAdmin");
		m.put("interactions_json", "pi:Interactions");
		m.put("adverse_reactions_json", "pi:AdverseReactions");
		m.put("composition_json", "pi:Composition");
		m.put("property_json", "pi:Properties");
		JSON_SECTIONS = Collections.unmodifiableMap(m);
	}

	private static final String BRANDS = "pi:ApprovalEtc/pi:DetailBrandName";

	private final WomenRiskAssessor assessor;

	public PiXmlExtractor(WomenRiskAssessor assessor) {
		this.assessor = assessor;
	}

	/**
	 * @throws IOException          when the file cannot be read
	 * @throws SAXException         when the file is not well-formed XML
	 * @throws TransformerException when the document cannot be written back to a string
	 */
	public PiDocument extract(Path xmlPath) throws IOException, SAXException, TransformerException {
		Document doc = SecureXml.parse(xmlPath);
		return extract(doc.getDocumentElement(), xmlPath.toString());
	}

	public PiDocument extract(Element root, String sourcePath) throws TransformerException {
		PiDocument out = new PiDocument();
		out.setSourcePath(sourcePath);

		PackageInsert header = header(root);
		header.setRawXmlPath(sourcePath);
		header.setDocXml(SecureXml.toXmlString(root));
		for (Map.Entry<String, String> e : JSON_SECTIONS.entrySet()) {
			header.getSections().put(e.getKey(), ElementJsonSerializer.serialize(PiTree.findFirst(root, e.getValue())));
		}

		InteractionSummary interactions = InteractionFlattener.collect(root);
		out.setInteractions(interactions);
		header.setInteractionsFlat(interactions.flat());

		List<Element> brands = PiTree.findAll(root, BRANDS);
		if (brands.isEmpty()) {
			out.getRows().add(header);
		} else {
			for (Element brand : brands) {
				PackageInsert row = header.copyDocumentFields();
				fillBrand(row, brand);
				out.getRows().add(row);
			}
		}

		for (WomenSection s : WomenSection.values()) {
			out.getWomenSections().put(s, SectionLocator.extract(root, s));
		}
		if (assessor != null) {
			out.setRisk(assessor.assess(out.section(WomenSection.PREGNANT), out.section(WomenSection.NURSING)));
		}
		return out;
	}

	/** Document-level fields shared by every brand row. */
	static PackageInsert header(Element root) {
		PackageInsert p = new PackageInsert();
		String no = TextSelector.textAt(root, "pi:PackageInsertNo");
		p.setPackageInsertNo(no == null ? "" : no);
		p.setCompanyIdentifier(TextSelector.textAt(root, "pi:CompanyIdentifier"));
		p.setPreparedYm(TextSelector.textAt(root, "pi:DateOfPreparationOrRevision/pi:PreparationOrRevision/pi:YearMonth"));
		p.setGenericNameJa(detailOrText(root, "pi:GenericName"));
		p.setTherapeuticClassJa(detailOrText(root, "pi:TherapeuticClassification"));
		return p;
	}

	static void fillBrand(PackageInsert row, Element brand) {
		String yj = TextSelector.textAt(brand, "pi:BrandCode/pi:YJCode");
		row.setYjCode(yj == null ? "" : yj);
		row.setBrandNameJa(selectOrText(brand, "pi:ApprovalBrandName"));
		row.setBrandNameHiragana(TextSelector.textAt(brand, "pi:BrandNameInHiragana/pi:NameInHiragana"));
		row.setTrademarkEn(TextSelector.textAt(brand, "pi:TrademarkInEnglish/pi:TrademarkName"));
		row.setApprovalNo(TextSelector.textAt(brand, "pi:ApprovalAndLicenseNo/pi:ApprovalNo"));
		row.setStartMarketing(TextSelector.textAt(brand, "pi:StartingDateOfMarketing"));

		String standard = TextSelector.selectText(
				PiTree.findFirst(brand, "pi:StandardName/pi:StandardNameCategory/pi:StandardNameDetail"));
		row.setStandardNameJa(standard != null ? standard : TextSelector.textAt(brand, "pi:StandardName"));
		row.setStorageMethod(selectOrText(brand, "pi:Storage/pi:StorageMethod"));
		row.setShelfLife(selectOrText(brand, "pi:Storage/pi:ShelfLife"));
	}

	/** Language-preferred text of {@code path/pi:Detail}, else the direct text of {@code path}. */
	private static String detailOrText(Element node, String path) {
		String s = TextSelector.selectText(PiTree.findFirst(node, path + "/pi:Detail"));
		return s != null ? s : TextSelector.textAt(node, path);
	}

	private static String selectOrText(Element node, String path) {
		String s = TextSelector.selectText(PiTree.findFirst(node, path));
		return s != null ? s : TextSelector.textAt(node, path);
	}
}
