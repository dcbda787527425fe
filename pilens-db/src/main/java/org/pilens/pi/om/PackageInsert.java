package org.pilens.pi.om;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * One output row of the raw-data table: a package insert as sold under one brand
 * (keyed by package insert number and YJ code).
 */
@Data
public class PackageInsert {

	// Keys
	private String packageInsertNo;
	private String yjCode;

	// Document level
	private String companyIdentifier;
	private String preparedYm;
	private String genericNameJa;
	private String therapeuticClassJa;

	// Brand level
	private String brandNameJa;
	private String brandNameHiragana;
	private String trademarkEn;
	private String standardNameJa;
	private String approvalNo;
	private String startMarketing;
	private String storageMethod;
	private String shelfLife;

	/** JSON sections keyed by column name, e.g. {@code interactions_json}; values may be null. */
	private Map<String, SerializedNode> sections;

	private List<InteractionRecord> interactionsFlat;

	private String docXml;
	private String rawXmlPath;

	public PackageInsert() {
		this.packageInsertNo = "";
		this.yjCode = "";
		this.sections = new LinkedHashMap<>();
		this.interactionsFlat = new ArrayList<>();
	}

	/** Copy carrying the document-level fields only; brand fields are left empty. */
	public PackageInsert copyDocumentFields() {
		PackageInsert p = new PackageInsert();
		p.setPackageInsertNo(packageInsertNo);
		p.setCompanyIdentifier(companyIdentifier);
		p.setPreparedYm(preparedYm);
		p.setGenericNameJa(genericNameJa);
		p.setTherapeuticClassJa(therapeuticClassJa);
		p.setSections(new LinkedHashMap<>(sections));
		p.setInteractionsFlat(new ArrayList<>(interactionsFlat));
		p.setDocXml(docXml);
		p.setRawXmlPath(rawXmlPath);
		return p;
	}
}
