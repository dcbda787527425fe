package org.pilens.pi;

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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.pilens.pi.conf.ConfigLoader;
import org.pilens.pi.conf.RiskRuleLoader;
import org.pilens.pi.processing.PiProcessingPipeline;
import org.pilens.pi.processing.classify.RiskProfile;
import org.pilens.pi.processing.classify.WomenRiskAssessor;
import org.pilens.pi.processing.extract.PiXmlExtractor;
import org.pilens.pi.processing.persist.InteractionCsvSink;
import org.pilens.pi.processing.persist.PiRecordSink;
import org.pilens.pi.processing.persist.PiSqlStatements;
import org.pilens.pi.processing.persist.SqlFileSink;
import org.pilens.pi.processing.support.FailedFiles;
import org.pilens.pi.processing.support.GlobalTrackers;
import org.pilens.pi.util.Logger;
import org.pilens.pi.util.ZipFileExtractor;

/**
 * Main entry point for PILens package insert extraction.
 *
 * PMDA package insert data:
 * https://www.pmda.go.jp/PmdaSearch/iyakuSearch/
 */
public class PiLensMain {

	private final ConfigLoader cfg;

	public PiLensMain(ConfigLoader cfg) {
		this.cfg = cfg;
	}

	/**
	 * Application entry point. Exits with status 1 when the configuration is incomplete,
	 * 2 when any file failed.
	 */
	public static void main(String[] args) throws IOException {
		ConfigLoader cfg = args.length > 0 ? new ConfigLoader(Path.of(args[0])) : new ConfigLoader();
		List<String> issues = cfg.validate();
		if (!issues.isEmpty()) {
			issues.forEach(i -> Logger.error("Config: {}", i));
			System.exit(1);
		}
		GlobalTrackers result = new PiLensMain(cfg).run();
		if (result.errors.get() > 0) {
			System.exit(2);
		}
	}

	/**
	 * Unzips (optionally), collects the XML files, extracts and classifies each one, and
	 * writes the SQL scripts and CSV files.
	 */
	public GlobalTrackers run() throws IOException {
		Path root = Path.of(cfg.getPiPath());
		if (!Files.isDirectory(root)) {
			throw new IllegalStateException("PI_PATH is not a directory: " + root);
		}

		if (cfg.isExtractZips()) {
			Logger.info("Extracting ZIP files under {} ...", root);
			new ZipFileExtractor(root).extractAll();
		}

		List<Path> files = PiProcessingPipeline.listXmlFiles(root);
		if (files.isEmpty()) {
			Logger.warn("No XML files found under {}", root);
			return new GlobalTrackers();
		}

		RiskProfile pregnancy = RiskRuleLoader.pregnancyProfile(cfg);
		RiskProfile nursing = RiskRuleLoader.nursingProfile(cfg);
		Logger.info("Rule tables: pregnancy={} rules/{} flags, nursing={} rules/{} flags",
				pregnancy.rules().size(), pregnancy.evidence().size(), nursing.rules().size(), nursing.evidence().size());

		PiXmlExtractor extractor = new PiXmlExtractor(new WomenRiskAssessor(pregnancy, nursing));
		Path sqlOut = Path.of(cfg.getSqlOutputPath());
		Path csvOut = Path.of(cfg.getCsvOutputPath());

		List<PiRecordSink> sinks = new ArrayList<>();
		try (FailedFiles failed = new FailedFiles(csvOut)) {
			sinks.add(new SqlFileSink(sqlOut, PiSqlStatements.from(cfg)));
			sinks.add(new InteractionCsvSink(csvOut));

			PiProcessingPipeline pipeline = new PiProcessingPipeline(extractor, sinks, failed,
					cfg.getParallelDocumentLimit(), cfg.getProgressEvery());
			GlobalTrackers result = pipeline.run(files);
			Logger.info("failed csv: {} ({} entries)", csvOut.resolve(FailedFiles.FILE_NAME), failed.getCount());
			return result;
		} finally {
			for (PiRecordSink sink : sinks) {
				try {
					sink.close();
				} catch (IOException e) {
					Logger.error("Failed to close {}: {}", e, sink.getClass().getSimpleName(), e.getMessage());
				}
			}
		}
	}
}
