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

import java.util.Set;

/**
 * Narrative sections about use in pregnant and nursing women, with every local tag name
 * the PMDA schema revisions have used for them.
 */
public enum WomenSection {

	PREGNANT("pregnant", Set.of("UseInPregnant", "UseInPregnantWomen", "Pregnant")),
	NURSING("nursing", Set.of("UseInNursing", "UseInNursingMothers", "Nursing", "BreastFeeding"));

	private final String key;
	private final Set<String> localNames;

	WomenSection(String key, Set<String> localNames) {
		this.key = key;
		this.localNames = localNames;
	}

	/** Short key used in JSON documents ({@code src_ids}). */
	public String key() {
		return key;
	}

	public Set<String> localNames() {
		return localNames;
	}
}
