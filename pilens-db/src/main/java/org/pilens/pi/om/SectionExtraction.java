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

/**
 * Collected text of every matching section in a document plus the {@code id} of the first
 * match. Either part may be null.
 */
public record SectionExtraction(String text, String sourceId) {

	private static final SectionExtraction ABSENT = new SectionExtraction(null, null);

	public static SectionExtraction absent() {
		return ABSENT;
	}

	public boolean hasText() {
		return text != null && !text.isEmpty();
	}
}
