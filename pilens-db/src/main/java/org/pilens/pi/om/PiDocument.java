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
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.Data;

/**
 * Everything extracted from one package insert XML file.
 */
@Data
public class PiDocument {

	private String sourcePath;

	/** One row per brand; a single row with an empty YJ code if the insert lists no brand. */
	private List<PackageInsert> rows;

	private InteractionSummary interactions;

	private Map<WomenSection, SectionExtraction> womenSections;

	private WomenRiskAssessment risk;

	public PiDocument() {
		this.rows = new ArrayList<>();
		this.interactions = InteractionSummary.empty();
		this.womenSections = new EnumMap<>(WomenSection.class);
		this.risk = new WomenRiskAssessment();
	}

	public SectionExtraction section(WomenSection s) {
		return womenSections.getOrDefault(s, SectionExtraction.absent());
	}

	/** {@code {"pregnant": id, "nursing": id}} for the sections that had an id; null when none did. */
	public Map<String, String> sourceIds() {
		Map<String, String> ids = new LinkedHashMap<>();
		for (WomenSection s : WomenSection.values()) {
			String id = section(s).sourceId();
			if (id != null) ids.put(s.key(), id);
		}
		return ids.isEmpty() ? null : ids;
	}
}
