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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a drug-interaction statement. Serialized as the PMDA wording.
 */
public enum InteractionCategory {

	/** 10.1 併用禁忌 – must not be co-administered. */
	CONTRAINDICATED("併用禁忌", "pi:Interactions/pi:ContraIndicatedCombinations//pi:Drug"),

	/** 10.2 併用注意 – co-administer with caution. */
	CAUTION("併用注意", "pi:Interactions/pi:PrecautionsForCombinations//pi:Drug");

	private final String label;
	private final String drugPath;

	InteractionCategory(String label, String drugPath) {
		this.label = label;
		this.drugPath = drugPath;
	}

	@JsonValue
	public String label() {
		return label;
	}

	/** Path (relative to the document element) of every drug block of this category. */
	public String drugPath() {
		return drugPath;
	}

	@Override
	public String toString() {
		return label;
	}
}
