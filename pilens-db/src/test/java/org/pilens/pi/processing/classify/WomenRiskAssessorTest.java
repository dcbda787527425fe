package org.pilens.pi.processing.classify;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.pilens.pi.conf.RiskRuleLoader;
import org.pilens.pi.om.ClassificationResult;
import org.pilens.pi.om.SectionExtraction;
import org.pilens.pi.om.WomenRiskAssessment;
import org.pilens.pi.om.WomenSection;

class WomenRiskAssessorTest {

	private static WomenRiskAssessor assessor;

	@BeforeAll
	static void loadBundledRules() {
		assessor = new WomenRiskAssessor(RiskRuleLoader.pregnancyProfile(null), RiskRuleLoader.nursingProfile(null));
	}

	private static SectionExtraction text(String s) {
		return new SectionExtraction(s, null);
	}

	@Test
	void not_recommended_pregnancy_and_stop_lactation() {
		WomenRiskAssessment r = assessor.assess(
				text("妊婦には投与しないことが望ましい。"),
				text("授乳を中止させること。"));

		assertEquals(new ClassificationResult(2, "not_recommended"), r.getPregnant());
		assertEquals("C", r.getPregnantLabel());
		assertEquals(new ClassificationResult(3, "stop_lactation"), r.getNursing());
		assertEquals("授乳中止", r.getNursingLabel());
		assertEquals(3, r.getOverallScore());
	}

	@Test
	void benefit_over_risk_maps_to_b() {
		WomenRiskAssessment r = assessor.assess(
				text("治療上の有益性が危険性を上まわると判断される場合にのみ投与すること。"), null);

		assertEquals("benefit_over_risk_or_caution", r.getPregnant().ruleTag());
		assertEquals("B", r.getPregnantLabel());
		assertEquals(ClassificationResult.none(), r.getNursing());
		assertEquals("不明", r.getNursingLabel());
		assertTrue(r.getNursingFlags().isEmpty());
		assertEquals(0, r.getNursingConfidence());
	}

	@Test
	void unmatched_text_is_unclear_with_unknown_label() {
		WomenRiskAssessment r = assessor.assess(text("該当する記載はない。"), SectionExtraction.absent());
		assertEquals(ClassificationResult.unclear(), r.getPregnant());
		assertEquals("不明", r.getPregnantLabel());
		assertEquals(0, r.getOverallScore());
	}

	@Test
	void human_and_animal_findings_both_boost_confidence() {
		WomenRiskAssessment r = assessor.assess(
				text("ヒトで胎児毒性が報告されている。ラットで催奇形性が認められた。"), null);

		assertEquals(ClassificationResult.unclear(), r.getPregnant());
		assertEquals(Boolean.TRUE, r.getPregnantFlags().get("has_human_terato"));
		assertEquals(Boolean.TRUE, r.getPregnantFlags().get("has_animal_terato"));
		assertEquals(2, r.getPregnantConfidence());
	}

	@Test
	@SuppressWarnings("unchecked")
	void evidence_document_holds_rules_flags_and_confidence() {
		WomenRiskAssessment r = assessor.assess(text("禁忌"), text("母乳中へ移行する。"));
		Map<String, Object> ev = r.evidence();

		assertEquals(List.of("pregnant_rule", "nursing_rule", "preg", "nurs"), List.copyOf(ev.keySet()));
		assertEquals("contraindicated", ev.get("pregnant_rule"));
		assertEquals("info_only", ev.get("nursing_rule"));
		Map<String, Object> nurs = (Map<String, Object>) ev.get("nurs");
		assertEquals(Boolean.TRUE, nurs.get("milk_transfer_detected"));
		assertEquals(2, nurs.get("confidence"));
	}

	@Test
	void missing_profiles_fall_back_to_empty_tables() {
		WomenRiskAssessor bare = new WomenRiskAssessor(null, null);
		assertTrue(bare.profile(WomenSection.PREGNANT).rules().isEmpty());

		WomenRiskAssessment r = bare.assess(text("禁忌"), null);
		assertEquals(ClassificationResult.unclear(), r.getPregnant());
		assertTrue(r.getPregnantFlags().isEmpty());
	}

	@Test
	void toranomon_labels_clamp_out_of_range_scores() {
		assertEquals("不明", ToranomonScheme.pregnancyLabel(-1));
		assertEquals("D/X", ToranomonScheme.pregnancyLabel(9));
		assertEquals("有益性考慮", ToranomonScheme.nursingLabel(2));
	}
}
