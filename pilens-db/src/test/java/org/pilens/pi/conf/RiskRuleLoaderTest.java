package org.pilens.pi.conf;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pilens.pi.processing.classify.EvidencePatterns;
import org.pilens.pi.processing.classify.RiskProfile;
import org.pilens.pi.processing.classify.RiskRule;
import org.pilens.pi.processing.classify.RuleTable;

class RiskRuleLoaderTest {

	@TempDir
	Path tmp;

	@Test
	void bundled_tables_load_in_score_order() {
		RiskProfile preg = RiskRuleLoader.pregnancyProfile(null);
		assertEquals("pregnancy", preg.name());
		assertEquals(List.of("contraindicated", "not_recommended", "benefit_over_risk_or_caution"),
				preg.rules().rules().stream().map(RiskRule::tag).collect(Collectors.toList()));
		assertEquals(List.of("has_human_terato", "has_animal_terato"), preg.evidence().boostKeys());
		assertEquals(6, preg.evidence().size());

		RiskProfile nurs = RiskRuleLoader.nursingProfile(null);
		assertEquals(3, nurs.rules().size());
		assertEquals(List.of("milk_transfer_detected", "adverse_infant_effects"), nurs.evidence().boostKeys());
	}

	@Test
	void bad_rows_are_skipped() throws Exception {
		String csv = "score,tag,pattern\n"
				+ "3,ok_high,\"禁忌\"\n"
				+ "x,bad_score,\"a\"\n"
				+ "2,bad_regex,\"(unclosed\"\n"
				+ "5,out_of_range,\"b\"\n"
				+ "\n"
				+ "# comment line\n"
				+ "1,ok_low,\"慎重\"\n";
		RuleTable t = RiskRuleLoader.readRules("t", new StringReader(csv));
		assertEquals(List.of("ok_high", "ok_low"), t.rules().stream().map(RiskRule::tag).collect(Collectors.toList()));
	}

	@Test
	void evidence_boost_column_is_optional() throws Exception {
		EvidencePatterns ev = RiskRuleLoader.readEvidence(new StringReader(
				"KEY,PATTERN\nfoo,\"f+\"\nbroken,\"[\"\nbar,\"b\"\n"));
		assertEquals(List.of("foo", "bar"), List.copyOf(ev.patterns().keySet()));
		assertTrue(ev.boostKeys().isEmpty());
	}

	@Test
	void missing_resource_gives_empty_table() {
		assertTrue(RiskRuleLoader.loadRules("none", null, "rules/does_not_exist.csv").isEmpty());
		assertEquals(0, RiskRuleLoader.loadEvidence(null, "rules/does_not_exist.csv").size());
	}

	@Test
	void config_override_file_replaces_bundled_table() throws Exception {
		Path rules = tmp.resolve("preg.csv");
		Files.writeString(rules, "score,tag,pattern\n2,custom,\"特別\"\n", StandardCharsets.UTF_8);

		Properties p = new Properties();
		p.setProperty("PREGNANCY_RULES", rules.toString());
		RiskProfile preg = RiskRuleLoader.pregnancyProfile(new ConfigLoader(p));

		assertEquals(1, preg.rules().size());
		assertEquals("custom", preg.rules().rules().get(0).tag());
		assertFalse(preg.evidence().patterns().isEmpty());
	}

	@Test
	void unreadable_override_gives_empty_table() {
		RuleTable t = RiskRuleLoader.loadRules("x", tmp.resolve("missing.csv").toString(), RiskRuleLoader.PREGNANCY_RULES);
		assertTrue(t.isEmpty());
	}
}
