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
 * Class label (e.g. 強い CYP3A阻害剤) and the individual substances listed under it.
 */
public record PartnerGroup(String group, List<String> items) {

	public PartnerGroup {
		items = items == null ? List.of() : List.copyOf(items);
	}

	public static PartnerGroup empty() {
		return new PartnerGroup(null, List.of());
	}
}
