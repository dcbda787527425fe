package org.pilens.pi.processing.support;

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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.pilens.pi.util.Logger;

/**
 * CSV log of the files that could not be processed: {@code file,error,exception,seconds}.
 */
public class FailedFiles implements AutoCloseable {

	public static final String FILE_NAME = "failed_files.csv";

	private final CSVPrinter printer;
	private int count;

	public FailedFiles(Path outputDir) throws IOException {
		Files.createDirectories(outputDir);
		this.printer = new CSVPrinter(Files.newBufferedWriter(outputDir.resolve(FILE_NAME), StandardCharsets.UTF_8),
				CSVFormat.DEFAULT.builder().setHeader("file", "error", "exception", "seconds").build());
	}

	public synchronized void record(String file, Throwable error, double seconds) {
		String message = error.getMessage() == null ? "" : error.getMessage().replace('\n', ' ');
		try {
			printer.printRecord(file, message, error.getClass().getSimpleName(), String.format(Locale.ROOT, "%.2f", seconds));
			printer.flush();
			count++;
		} catch (IOException e) {
			Logger.error("Cannot append to {}: {}", FILE_NAME, e.getMessage());
		}
	}

	public synchronized int getCount() {
		return count;
	}

	@Override
	public synchronized void close() throws IOException {
		printer.close(true);
	}
}
