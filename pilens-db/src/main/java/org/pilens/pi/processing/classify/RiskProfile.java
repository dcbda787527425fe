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

/**
 * Rule table and evidence dictionary for one section kind (pregnancy or nursing).
 */
public record RiskProfile(String name, RuleTable rules, EvidencePatterns evidence) {

	public RiskProfile {
		rules = rules == null ? RuleTable.empty() : rules;
		evidence = evidence == null ? EvidencePatterns.empty() : evidence;
	}
}
