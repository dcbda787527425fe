package org.pilens.pi.processing.persist;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON rendering of the jsonb columns. The mapper is configured once and shared.
 */
public final class JsonColumns {

	private static final ObjectMapper MAPPER = new ObjectMapper();

	private JsonColumns() {
	}

	/** Compact JSON for {@code value}; null stays null so the column gets SQL NULL. */
	public static String toJson(Object value) {
		if (value == null) return null;
		try {
			return MAPPER.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Cannot serialize " + value.getClass().getSimpleName() + " to JSON", e);
		}
	}
}
