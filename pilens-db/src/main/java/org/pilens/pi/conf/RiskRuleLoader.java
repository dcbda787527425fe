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

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.pilens.pi.processing.classify.EvidencePatterns;
import org.pilens.pi.processing.classify.RiskProfile;
import org.pilens.pi.processing.classify.RiskRule;
import org.pilens.pi.processing.classify.RuleTable;
import org.pilens.pi.util.Logger;

/**
 * Reads rule tables and evidence dictionaries from CSV.
 *
 * <p>Rule files have the header {@code score,tag,pattern}; evidence files have
 * {@code key,pattern,boost} where {@code boost} is {@code true} for keys that raise
 * confidence. Rows that cannot be parsed are logged and skipped. A missing resource
 * yields an empty table.</p>
 */
public final class RiskRuleLoader {

	public static final String PREGNANCY_RULES = "rules/pregnancy_rules.csv";
	public static final String NURSING_RULES = "rules/nursing_rules.csv";
	public static final String PREGNANCY_EVIDENCE = "rules/pregnancy_evidence.csv";
	public static final String NURSING_EVIDENCE = "rules/nursing_evidence.csv";

	private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
			.setHeader()
			.setSkipHeaderRecord(true)
			.setIgnoreHeaderCase(true)
			.setIgnoreEmptyLines(true)
			.setCommentMarker('#')
			.build();

	private RiskRuleLoader() {
	}

	/** Pregnancy profile from config overrides, falling back to the bundled tables. */
	public static RiskProfile pregnancyProfile(ConfigLoader config) {
		return new RiskProfile("pregnancy",
				loadRules("pregnancy", config == null ? null : config.getPregnancyRulesFile(), PREGNANCY_RULES),
				loadEvidence(config == null ? null : config.getPregnancyEvidenceFile(), PREGNANCY_EVIDENCE));
	}

	/** Nursing profile from config overrides, falling back to the bundled tables. */
	public static RiskProfile nursingProfile(ConfigLoader config) {
		return new RiskProfile("nursing",
				loadRules("nursing", config == null ? null : config.getNursingRulesFile(), NURSING_RULES),
				loadEvidence(config == null ? null : config.getNursingEvidenceFile(), NURSING_EVIDENCE));
	}

	/** Loads from {@code file} when given, otherwise from the classpath {@code resource}. */
	public static RuleTable loadRules(String name, String file, String resource) {
		try (Reader r = open(file, resource)) {
			if (r == null) return new RuleTable(name, List.of());
			return readRules(name, r);
		} catch (IOException e) {
			Logger.error("Failed to read rule table {}: {}", file != null ? file : resource, e.getMessage());
			return new RuleTable(name, List.of());
		}
	}

	public static EvidencePatterns loadEvidence(String file, String resource) {
		try (Reader r = open(file, resource)) {
			if (r == null) return EvidencePatterns.empty();
			return readEvidence(r);
		} catch (IOException e) {
			Logger.error("Failed to read evidence patterns {}: {}", file != null ? file : resource, e.getMessage());
			return EvidencePatterns.empty();
		}
	}

	static RuleTable readRules(String name, Reader reader) throws IOException {
		List<RiskRule> rules = new ArrayList<>();
		try (CSVParser csv = new CSVParser(reader, FORMAT)) {
			for (CSVRecord rec : csv) {
				try {
					int score = Integer.parseInt(rec.get("score").trim());
					rules.add(RiskRule.of(score, rec.get("pattern"), rec.get("tag").trim()));
				} catch (IllegalArgumentException e) {
					// covers NumberFormatException, PatternSyntaxException and missing columns
					Logger.error("Skipping rule at line {} of {}: {}", rec.getRecordNumber() + 1, name, e.getMessage());
				}
			}
		}
		return new RuleTable(name, rules);
	}

	static EvidencePatterns readEvidence(Reader reader) throws IOException {
		Map<String, Pattern> patterns = new LinkedHashMap<>();
		List<String> boosts = new ArrayList<>();
		try (CSVParser csv = new CSVParser(reader, FORMAT)) {
			for (CSVRecord rec : csv) {
				String key = rec.get("key").trim();
				try {
					patterns.put(key, Pattern.compile(rec.get("pattern"), RiskRule.FLAGS));
				} catch (PatternSyntaxException e) {
					Logger.error("Skipping evidence pattern '{}': {}", key, e.getDescription());
					continue;
				}
				if (rec.isMapped("boost") && rec.isSet("boost") && Boolean.parseBoolean(rec.get("boost").trim())) {
					boosts.add(key);
				}
			}
		}
		return new EvidencePatterns(patterns, boosts);
	}

	private static Reader open(String file, String resource) throws IOException {
		if (file != null && !file.isBlank()) {
			return Files.newBufferedReader(Path.of(file.trim()), StandardCharsets.UTF_8);
		}
		InputStream in = RiskRuleLoader.class.getClassLoader().getResourceAsStream(resource);
		if (in == null) {
			Logger.error("Unable to find resource on classpath: {}", resource);
			return null;
		}
		return new InputStreamReader(in, StandardCharsets.UTF_8);
	}
}
