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

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Data;

/**
 * Risk classification of the pregnancy and nursing sections of one document.
 */
@Data
public class WomenRiskAssessment {

	private ClassificationResult pregnant;
	private ClassificationResult nursing;

	private Map<String, Boolean> pregnantFlags;
	private Map<String, Boolean> nursingFlags;

	private int pregnantConfidence;
	private int nursingConfidence;

	private String scheme;
	private String pregnantLabel;
	private String nursingLabel;

	public WomenRiskAssessment() {
		this.pregnant = ClassificationResult.none();
		this.nursing = ClassificationResult.none();
		this.pregnantFlags = new LinkedHashMap<>();
		this.nursingFlags = new LinkedHashMap<>();
	}

	/** Maximum of the per-section scores. */
	public int getOverallScore() {
		return Math.max(pregnant.score(), nursing.score());
	}

	/**
	 * Evidence document stored alongside the labels:
	 * {@code {pregnant_rule, nursing_rule, preg: {flags.., confidence}, nurs: {flags.., confidence}}}.
	 */
	public Map<String, Object> evidence() {
		Map<String, Object> preg = new LinkedHashMap<>(pregnantFlags);
		preg.put("confidence", pregnantConfidence);
		Map<String, Object> nurs = new LinkedHashMap<>(nursingFlags);
		nurs.put("confidence", nursingConfidence);

		Map<String, Object> out = new LinkedHashMap<>();
		out.put("pregnant_rule", pregnant.ruleTag());
		out.put("nursing_rule", nursing.ruleTag());
		out.put("preg", preg);
		out.put("nurs", nurs);
		return out;
	}
}
