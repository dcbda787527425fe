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

import java.util.List;

/**
 * Interaction section of one document: the narrative summaries and the flattened records.
 */
public record InteractionSummary(List<String> summary, List<InteractionRecord> flat) {

	public InteractionSummary {
		summary = summary == null ? List.of() : List.copyOf(summary);
		flat = flat == null ? List.of() : List.copyOf(flat);
	}

	public static InteractionSummary empty() {
		return new InteractionSummary(List.of(), List.of());
	}
}
