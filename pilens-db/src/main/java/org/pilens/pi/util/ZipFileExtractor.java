package org.pilens.pi.util;

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

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Extracts every ZIP archive found under a folder (recursively) into the folder that
 * holds the archive. PMDA ships package inserts as nested ZIP bundles; after this pass
 * the XML files sit next to their archives.
 */
public class ZipFileExtractor {

	/** IO is the bottleneck; allow multiple threads per core to overlap disk. */
	private static final int THREAD_COUNT = Math.max(4, Runtime.getRuntime().availableProcessors() * 2);

	/** Progress log cadence (zip files). */
	private static final int PROGRESS_EVERY = 100;

	private final Path rootDir;

	public ZipFileExtractor(Path rootDir) {
		this.rootDir = rootDir;
	}

	/**
	 * Extracts all archives found under the root. A broken archive is logged and skipped.
	 *
	 * @return number of archives extracted without error
	 */
	public int extractAll() throws IOException {
		if (!Files.isDirectory(rootDir)) {
			Logger.error("ZIP root does not exist: {}", rootDir);
			return 0;
		}

		List<Path> zips;
		try (Stream<Path> s = Files.walk(rootDir)) {
			zips = s.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip"))
					.sorted()
					.collect(Collectors.toList());
		}
		if (zips.isEmpty()) {
			Logger.info("No ZIP files found under {}", rootDir);
			return 0;
		}

		Logger.info("Extracting {} ZIP file(s) under {}", zips.size(), rootDir);
		ExecutorService pool = Executors.newFixedThreadPool(Math.min(THREAD_COUNT, zips.size()));
		AtomicInteger ok = new AtomicInteger();
		AtomicInteger completed = new AtomicInteger();
		for (Path zip : zips) {
			pool.submit(() -> {
				try {
					extract(zip, zip.getParent());
					ok.incrementAndGet();
				} catch (IOException | RuntimeException ex) {
					Logger.error("Error extracting {}: {}", ex, zip, ex.getMessage());
				} finally {
					int done = completed.incrementAndGet();
					if (done % PROGRESS_EVERY == 0) {
						Logger.info("[ZipFileExtractor] Processed {} ZIPs...", done);
					}
				}
			});
		}
		pool.shutdown();
		try {
			pool.awaitTermination(Long.MAX_VALUE, TimeUnit.NANOSECONDS);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			pool.shutdownNow();
			throw new IOException("Interrupted while extracting ZIP files", e);
		}
		Logger.info("ZIP extraction complete ({} of {} archives).", ok.get(), zips.size());
		return ok.get();
	}

	/**
	 * Extracts one archive into {@code outputDir}. Entries that would land outside
	 * {@code outputDir} are skipped.
	 *
	 * @return number of files written
	 */
	public static int extract(Path zipPath, Path outputDir) throws IOException {
		Path base = outputDir.toAbsolutePath().normalize();
		int written = 0;
		try (ZipInputStream zis = new ZipInputStream(new BufferedInputStream(Files.newInputStream(zipPath)))) {
			ZipEntry entry;
			byte[] buffer = new byte[64 * 1024];
			while ((entry = zis.getNextEntry()) != null) {
				try {
					String entryName = entry.getName().replace('\\', '/');

					// Normalize & defend against Zip Slip
					Path target = base.resolve(entryName).normalize();
					if (!target.startsWith(base)) {
						Logger.error("Skipping suspicious entry (Zip Slip): {} in {}", entryName, zipPath.getFileName());
						continue;
					}
					if (entry.isDirectory()) {
						Files.createDirectories(target);
						continue;
					}

					Path parent = target.getParent();
					if (parent != null)
						Files.createDirectories(parent);

					try (OutputStream bos = new BufferedOutputStream(Files.newOutputStream(target))) {
						int read;
						while ((read = zis.read(buffer)) != -1) {
							bos.write(buffer, 0, read);
						}
					}
					written++;
				} finally {
					zis.closeEntry();
				}
			}
		}
		return written;
	}
}
