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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Immutable, priority-ordered list of {@link RiskRule}s. Rules are kept in descending score
 * order; rules with equal score keep the order they were given in. The first rule that
 * matches wins.
 */
public final class RuleTable {

	private static final RuleTable EMPTY = new RuleTable("empty", List.of());

	private final String name;
	private final List<RiskRule> rules;

	public RuleTable(String name, List<RiskRule> rules) {
		this.name = name;
		List<RiskRule> sorted = new ArrayList<>(rules == null ? List.of() : rules);
		sorted.sort(Comparator.comparingInt(RiskRule::score).reversed());
		this.rules = List.copyOf(sorted);
	}

	public static RuleTable empty() {
		return EMPTY;
	}

	public String name() {
		return name;
	}

	public List<RiskRule> rules() {
		return rules;
	}

	public boolean isEmpty() {
		return rules.isEmpty();
	}

	public int size() {
		return rules.size();
	}

	@Override
	public String toString() {
		return "RuleTable[" + name + ", " + rules.size() + " rules]";
	}
}
