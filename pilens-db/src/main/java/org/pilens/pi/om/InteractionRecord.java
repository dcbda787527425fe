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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One flattened interaction: a single partner substance (or the class label when the
 * block lists no individual substances) in one category.
 */
@JsonPropertyOrder({ "partner", "group", "symptoms", "mechanism", "category" })
public record InteractionRecord(String partner, String group, String symptoms, String mechanism,
		InteractionCategory category) {

	/** True when there is nothing worth storing. */
	@JsonIgnore
	public boolean isEmpty() {
		return partner == null && group == null && symptoms == null && mechanism == null;
	}
}
