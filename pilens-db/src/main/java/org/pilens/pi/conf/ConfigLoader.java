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

import java.io.FileInputStream;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.pilens.pi.util.Logger;

/**
 * Loads configuration for the package insert extractor from a {@code .properties} file.
 * <p>
 * By default, this loader reads <code>config/pilens.properties</code> from the
 * classpath. You can override this by setting the system property
 * <code>pilens.config</code> to an absolute path, or by using the
 * {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Notes</h3>
 * <ul>
 * <li>All directory-like values are normalized to end with a trailing slash
 * (e.g. <code>/path/to/dir/</code>).</li>
 * <li>Rule table locations are optional; when unset the tables bundled under
 * <code>rules/</code> on the classpath are used.</li>
 * <li>Use {@link #validate()} during startup to check for missing required
 * keys.</li>
 * </ul>
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/pilens.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "pilens.config";

	// ---- Property keys -------------------------------------------------------
	private static final String K_PI_PATH = "PI_PATH";
	private static final String K_SQL_OUTPUT_PATH = "SQL_OUTPUT_PATH";
	private static final String K_CSV_OUTPUT_PATH = "CSV_OUTPUT_PATH";
	private static final String K_EXTRACT_ZIPS = "EXTRACT_ZIPS";
	private static final String K_PARALLEL_DOCUMENT_LIMIT = "PARALLEL_DOCUMENT_LIMIT";
	private static final String K_PROGRESS_EVERY = "PROGRESS_EVERY";

	// Target tables
	private static final String K_RAWDATA_TABLE = "RAWDATA_TABLE";
	private static final String K_INTERACTION_TABLE = "INTERACTION_TABLE";
	private static final String K_WOMEN_TABLE = "WOMEN_TABLE";
	private static final String K_WOMEN_RISK_TABLE = "WOMEN_RISK_TABLE";

	// Rule table overrides (file paths)
	private static final String K_PREGNANCY_RULES = "PREGNANCY_RULES";
	private static final String K_NURSING_RULES = "NURSING_RULES";
	private static final String K_PREGNANCY_EVIDENCE = "PREGNANCY_EVIDENCE";
	private static final String K_NURSING_EVIDENCE = "NURSING_EVIDENCE";

	private static final int DEFAULT_PROGRESS_EVERY = 500;

	// --------------------------------------------------------------------------

	private final Properties properties = new Properties();

	/**
	 * Create a loader that reads the default classpath resource:
	 * {@value #DEFAULT_CLASSPATH_RESOURCE}. If a system property
	 * {@value #SYS_PROP_CONFIG_PATH} is set, it takes precedence and the file at
	 * that path is used instead.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Create a loader that reads a specific file on disk.
	 *
	 * @param filePath absolute or relative path to a .properties file
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/** Wraps already-loaded properties; used by tests and embedding callers. */
	public ConfigLoader(Properties props) {
		if (props != null) properties.putAll(props);
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Validates presence of keys that the application requires to run. This does
	 * not fail; it returns a list of human-readable issues so the caller can decide
	 * how to proceed.
	 *
	 * @return list of error strings; empty if all required keys look OK
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		requireNonBlank(K_PI_PATH, issues);
		requireNonBlank(K_SQL_OUTPUT_PATH, issues);
		requireNonBlank(K_CSV_OUTPUT_PATH, issues);

		String sqlOut = properties.getProperty(K_SQL_OUTPUT_PATH);
		String csvOut = properties.getProperty(K_CSV_OUTPUT_PATH);
		if (sqlOut != null && csvOut != null) {
			String nSql = normalizedDir(sqlOut);
			String nCsv = normalizedDir(csvOut);
			if (!nSql.isBlank() && nSql.equals(nCsv)) {
				issues.add("CSV_OUTPUT_PATH must differ from SQL_OUTPUT_PATH.");
			}
		}

		for (String key : List.of(K_PREGNANCY_RULES, K_NURSING_RULES, K_PREGNANCY_EVIDENCE, K_NURSING_EVIDENCE)) {
			String v = getOptional(key, null);
			if (v != null && !Files.isReadable(Path.of(v))) {
				issues.add("Rule file for " + key + " is not readable: " + v);
			}
		}
		return issues;
	}

	/**
	 * Number of documents processed concurrently. Defaults to ~25% of available
	 * cores if not set; never exceeds the core count.
	 */
	public int getParallelDocumentLimit() {
		int cores = Math.max(1, Runtime.getRuntime().availableProcessors());
		int defaultLimit = Math.max(1, (int) Math.floor(cores / 4.0));

		String raw = getOptional(K_PARALLEL_DOCUMENT_LIMIT, null);
		if (raw != null) {
			try {
				int val = Integer.parseInt(raw.trim());
				if (val <= 0)
					return defaultLimit;
				return Math.min(val, cores);
			} catch (NumberFormatException nfe) {
				Logger.warn("Invalid integer for parallel limit: '{}'. Using default {}", raw, defaultLimit);
			}
		}
		return defaultLimit;
	}

	/** Log a progress line every N documents. */
	public int getProgressEvery() {
		String raw = getOptional(K_PROGRESS_EVERY, null);
		if (raw == null) return DEFAULT_PROGRESS_EVERY;
		try {
			int val = Integer.parseInt(raw);
			return val > 0 ? val : DEFAULT_PROGRESS_EVERY;
		} catch (NumberFormatException nfe) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", K_PROGRESS_EVERY, raw, DEFAULT_PROGRESS_EVERY);
			return DEFAULT_PROGRESS_EVERY;
		}
	}

	/** Unzip every archive under {@link #getPiPath()} before scanning. Default true. */
	public boolean isExtractZips() {
		return Boolean.parseBoolean(getOptional(K_EXTRACT_ZIPS, "true"));
	}

	/** Root folder holding the package insert XML (or ZIP) files. */
	public String getPiPath() {
		return normalizedDir(getRequired(K_PI_PATH));
	}

	/** Directory for generated SQL files. */
	public String getSqlOutputPath() {
		return normalizedDir(getRequired(K_SQL_OUTPUT_PATH));
	}

	/** Directory for generated CSV files. */
	public String getCsvOutputPath() {
		return normalizedDir(getRequired(K_CSV_OUTPUT_PATH));
	}

	public String getRawdataTable() {
		return getOptional(K_RAWDATA_TABLE, "public.sgml_rawdata");
	}

	public String getInteractionTable() {
		return getOptional(K_INTERACTION_TABLE, "public.sgml_interaction");
	}

	public String getWomenTable() {
		return getOptional(K_WOMEN_TABLE, "public.sgml_women");
	}

	public String getWomenRiskTable() {
		return getOptional(K_WOMEN_RISK_TABLE, "public.sgml_women_risk_labels");
	}

	/** Optional override for the pregnancy rule CSV; null means the bundled table. */
	public String getPregnancyRulesFile() {
		return getOptional(K_PREGNANCY_RULES, null);
	}

	public String getNursingRulesFile() {
		return getOptional(K_NURSING_RULES, null);
	}

	public String getPregnancyEvidenceFile() {
		return getOptional(K_PREGNANCY_EVIDENCE, null);
	}

	public String getNursingEvidenceFile() {
		return getOptional(K_NURSING_EVIDENCE, null);
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = new FileInputStream(file.toFile())) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null || v.isBlank()) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private static String normalizedDir(String path) {
		if (path == null || path.isBlank())
			return path;
		String p = path.trim();
		if (!p.endsWith("/"))
			p = p + "/";
		return p;
	}

	private void requireNonBlank(String key, List<String> issues) {
		String v = properties.getProperty(key);
		if (v == null || v.trim().isEmpty()) {
			issues.add("Missing required property: " + key);
		}
	}
}
