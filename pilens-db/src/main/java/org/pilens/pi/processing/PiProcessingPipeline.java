package org.pilens.pi.processing;

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
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.lang3.StringUtils;
import org.pilens.pi.om.ClassificationResult;
import org.pilens.pi.om.PiDocument;
import org.pilens.pi.om.WomenRiskAssessment;
import org.pilens.pi.om.WomenSection;
import org.pilens.pi.processing.extract.PiXmlExtractor;
import org.pilens.pi.processing.persist.PiRecordSink;
import org.pilens.pi.processing.support.Eta;
import org.pilens.pi.processing.support.FailedFiles;
import org.pilens.pi.processing.support.GlobalTrackers;
import org.pilens.pi.util.Logger;

/**
 * Runs the extractor over a set of XML files and hands each document to the sinks.
 *
 * <p>Documents are independent: they are processed in parallel on a bounded pool, each one
 * sequentially. A failing file is logged, recorded in {@code failed_files.csv} and skipped.</p>
 *
 * <p>Every sink renders the document before any sink writes, so an extraction or rendering
 * failure reaches no output. An I/O error while writing can still leave the document in the
 * sinks written before the failing one.</p>
 */
public class PiProcessingPipeline {

	/** How many unclear pregnancy texts are echoed to the DEBUG log per run. */
	private static final int UNCLEAR_SAMPLES = 5;
	private static final int SAMPLE_CHARS = 120;

	private final PiXmlExtractor extractor;
	private final List<PiRecordSink> sinks;
	private final FailedFiles failed;
	private final int parallelism;
	private final int progressEvery;

	private final GlobalTrackers trackers = new GlobalTrackers();
	private final AtomicInteger unclearSampled = new AtomicInteger();

	public PiProcessingPipeline(PiXmlExtractor extractor, List<PiRecordSink> sinks, FailedFiles failed,
			int parallelism, int progressEvery) {
		this.extractor = extractor;
		this.sinks = List.copyOf(sinks);
		this.failed = failed;
		this.parallelism = Math.max(1, parallelism);
		this.progressEvery = Math.max(1, progressEvery);
	}

	/** All {@code *.xml} files below {@code root}, sorted. */
	public static List<Path> listXmlFiles(Path root) {
		try (Stream<Path> s = Files.walk(root)) {
			return s.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xml"))
					.sorted()
					.collect(Collectors.toList());
		} catch (IOException e) {
			throw new UncheckedIOException("Cannot list XML files under " + root, e);
		}
	}

	public GlobalTrackers run(List<Path> files) {
		final int total = files.size();
		final long t0 = System.nanoTime();
		Logger.info("Start import: total_xml={}, parallelism={}", total, parallelism);

		ForkJoinPool pool = new ForkJoinPool(parallelism);
		try {
			pool.submit(() -> files.parallelStream().forEach(f -> {
				processOne(f);
				int done = trackers.done.incrementAndGet();
				if (done % progressEvery == 0 || done == total) {
					double elapsed = (System.nanoTime() - t0) / 1e9;
					Logger.info("{} errors={} rows={}", Eta.progress(done, total, elapsed), trackers.errors.get(),
							trackers.rows.get());
				}
			})).get();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			Logger.warn("Processing interrupted after {} files", trackers.done.get());
		} catch (ExecutionException e) {
			throw new IllegalStateException("Worker failed outside per-file handling", e.getCause());
		} finally {
			pool.shutdown();
		}

		logSummary(total, (System.nanoTime() - t0) / 1e9);
		return trackers;
	}

	/** Extracts one file and sends it to every sink; never throws. */
	void processOne(Path file) {
		long start = System.nanoTime();
		try {
			PiDocument doc = extractor.extract(file);
			List<PiRecordSink.PendingWrite> writes = new ArrayList<>(sinks.size());
			for (PiRecordSink sink : sinks) {
				writes.add(sink.prepare(doc));
			}
			for (PiRecordSink.PendingWrite w : writes) {
				w.write();
			}
			track(doc);
			long nanos = System.nanoTime() - start;
			trackers.recordTiming(file.toString(), nanos);
			Logger.debug("{} rows={} time={}s", file.getFileName(), doc.getRows().size(),
					String.format(Locale.ROOT, "%.2f", nanos / 1e9));
		} catch (Exception e) {
			double seconds = (System.nanoTime() - start) / 1e9;
			trackers.errors.incrementAndGet();
			Logger.error("[ERROR] {}: {}", e, file, e.getMessage());
			if (failed != null) failed.record(file.toString(), e, seconds);
		}
	}

	private void track(PiDocument doc) {
		trackers.rows.addAndGet(doc.getRows().size());
		trackers.interactions.addAndGet((long) doc.getInteractions().flat().size() * doc.getRows().size());
		if (doc.section(WomenSection.PREGNANT).hasText()) trackers.withPregnant.incrementAndGet();
		if (doc.section(WomenSection.NURSING).hasText()) trackers.withNursing.incrementAndGet();

		WomenRiskAssessment risk = doc.getRisk();
		trackers.countRule(trackers.pregnantRules, risk.getPregnant().ruleTag());
		trackers.countRule(trackers.nursingRules, risk.getNursing().ruleTag());

		if (ClassificationResult.UNCLEAR.equals(risk.getPregnant().ruleTag()) && Logger.isEnabled(Logger.Level.DEBUG)
				&& unclearSampled.incrementAndGet() <= UNCLEAR_SAMPLES) {
			Logger.debug("[pregnant unclear sample] {} text={}...", doc.getSourcePath(),
					StringUtils.abbreviate(doc.section(WomenSection.PREGNANT).text(), SAMPLE_CHARS));
		}
	}

	private void logSummary(int total, double seconds) {
		int done = trackers.done.get();
		int errors = trackers.errors.get();
		int ok = done - errors;
		double avg = ok > 0 ? trackers.busyNanos.get() / 1e9 / ok : 0.0;
		String slowest = trackers.getSlowestFile();
		Logger.info("===== SUMMARY =====\n"
				+ "total xml: {}\n"
				+ "success files: {}\n"
				+ "errors: {}\n"
				+ "total rows: {}\n"
				+ "interaction records: {}\n"
				+ "with pregnant section: {}, with nursing section: {}\n"
				+ "pregnant rules: {}\n"
				+ "nursing rules: {}\n"
				+ "total time: {}s\n"
				+ "avg per file: {}s\n"
				+ "slowest: {}s -> {}",
				total, ok, errors, trackers.rows.get(), trackers.interactions.get(),
				trackers.withPregnant.get(), trackers.withNursing.get(),
				trackers.pregnantRules, trackers.nursingRules,
				String.format(Locale.ROOT, "%.2f", seconds),
				String.format(Locale.ROOT, "%.2f", avg),
				String.format(Locale.ROOT, "%.2f", trackers.getSlowestNanos() / 1e9),
				slowest.isEmpty() ? "" : Path.of(slowest).getFileName());
	}
}
