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

import org.pilens.pi.om.InteractionCategory;
import org.pilens.pi.om.InteractionRecord;
import org.pilens.pi.om.InteractionSummary;
import org.pilens.pi.om.PartnerGroup;
import org.w3c.dom.Element;

/**
 * Flattens the contraindicated (10.1) and caution (10.2) combination tables into one
 * {@link InteractionRecord} per partner and category.
 *
 * <p>A drug block with N listed substances gives N records sharing group, symptoms and
 * mechanism; a block with only a class label gives one record whose partner is the label;
 * a block with neither gives nothing.</p>
 */
public final class InteractionFlattener {

	static final String SUMMARY_PATH = "pi:Interactions/pi:SummaryOfCombination//pi:Detail";

	private static final String SYMPTOMS = "pi:ClinSymptomsAndMeasures";
	private static final String MECHANISM = "pi:MechanismAndRiskFactors";

	private InteractionFlattener() {
	}

	/**
	 * @param root the package insert document element
	 */
	public static InteractionSummary collect(Element root) {
		if (root == null) return InteractionSummary.empty();

		List<String> summary = new ArrayList<>();
		for (Element det : PiTree.findAll(root, SUMMARY_PATH)) {
			String s = TextSelector.selectText(det);
			if (s != null) summary.add(s);
		}

		List<InteractionRecord> flat = new ArrayList<>();
		for (InteractionCategory category : InteractionCategory.values()) {
			for (Element drug : PiTree.findAll(root, category.drugPath())) {
				flat.addAll(flatten(drug, category));
			}
		}
		return new InteractionSummary(summary, flat);
	}

	/** Records for a single {@code pi:Drug} block. */
	public static List<InteractionRecord> flatten(Element drug, InteractionCategory category) {
		PartnerGroup pg = PartnerExtractor.extract(drug);
		String symptoms = detailText(drug, SYMPTOMS);
		String mechanism = detailText(drug, MECHANISM);

		List<InteractionRecord> out = new ArrayList<>();
		if (!pg.items().isEmpty()) {
			for (String partner : pg.items()) {
				out.add(new InteractionRecord(partner, pg.group(), symptoms, mechanism, category));
			}
		} else if (pg.group() != null) {
			out.add(new InteractionRecord(pg.group(), pg.group(), symptoms, mechanism, category));
		}
		return out;
	}

	/** {@code <block>/pi:Detail} language-preferred text, else the block's own text. */
	private static String detailText(Element drug, String block) {
		String s = TextSelector.selectText(PiTree.findFirst(drug, block + "/pi:Detail"));
		return s != null ? s : TextSelector.textAt(drug, block);
	}
}
