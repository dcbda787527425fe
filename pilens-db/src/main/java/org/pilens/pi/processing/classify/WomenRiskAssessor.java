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

import java.util.Map;

import org.pilens.pi.om.ClassificationResult;
import org.pilens.pi.om.SectionExtraction;
import org.pilens.pi.om.WomenRiskAssessment;
import org.pilens.pi.om.WomenSection;

/**
 * Classifies the pregnancy and nursing sections of a document with their respective profiles.
 * Immutable once built and safe to share across worker threads.
 */
public class WomenRiskAssessor {

	private final RiskProfile pregnancy;
	private final RiskProfile nursing;

	public WomenRiskAssessor(RiskProfile pregnancy, RiskProfile nursing) {
		this.pregnancy = pregnancy == null ? new RiskProfile("pregnancy", null, null) : pregnancy;
		this.nursing = nursing == null ? new RiskProfile("nursing", null, null) : nursing;
	}

	public RiskProfile profile(WomenSection section) {
		return section == WomenSection.PREGNANT ? pregnancy : nursing;
	}

	public WomenRiskAssessment assess(SectionExtraction pregnant, SectionExtraction nursingSection) {
		String pregText = pregnant == null ? null : pregnant.text();
		String nursText = nursingSection == null ? null : nursingSection.text();

		ClassificationResult p = RiskClassifier.classify(pregText, pregnancy.rules());
		ClassificationResult n = RiskClassifier.classify(nursText, nursing.rules());
		Map<String, Boolean> pFlags = RiskClassifier.extractFlags(pregText, pregnancy.evidence());
		Map<String, Boolean> nFlags = RiskClassifier.extractFlags(nursText, nursing.evidence());

		WomenRiskAssessment out = new WomenRiskAssessment();
		out.setPregnant(p);
		out.setNursing(n);
		out.getPregnantFlags().putAll(pFlags);
		out.getNursingFlags().putAll(nFlags);
		out.setPregnantConfidence(RiskClassifier.confidence(p.score(), pFlags, pregnancy.evidence().boostKeys()));
		out.setNursingConfidence(RiskClassifier.confidence(n.score(), nFlags, nursing.evidence().boostKeys()));
		out.setScheme(ToranomonScheme.NAME);
		out.setPregnantLabel(ToranomonScheme.pregnancyLabel(p.score()));
		out.setNursingLabel(ToranomonScheme.nursingLabel(n.score()));
		return out;
	}
}
