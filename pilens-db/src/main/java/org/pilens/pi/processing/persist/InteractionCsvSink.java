package org.pilens.pi.processing.persist;

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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.pilens.pi.om.InteractionRecord;
import org.pilens.pi.om.PackageInsert;
import org.pilens.pi.om.PiDocument;

/**
 * Flat CSV of the interaction records, one line per brand and record.
 */
public class InteractionCsvSink implements PiRecordSink {

	public static final String FILE_NAME = "interactions_flat.csv";

	static final String[] HEADER = { "package_insert_no", "yj_code", "section_type", "partner_group_ja",
			"partner_name_ja", "symptoms_measures_ja", "mechanism_ja" };

	private final CSVPrinter printer;

	public InteractionCsvSink(Path outputDir) throws IOException {
		Files.createDirectories(outputDir);
		this.printer = new CSVPrinter(Files.newBufferedWriter(outputDir.resolve(FILE_NAME), StandardCharsets.UTF_8),
				CSVFormat.DEFAULT.builder().setHeader(HEADER).build());
	}

	@Override
	public PendingWrite prepare(PiDocument doc) {
		List<List<String>> lines = new ArrayList<>();
		for (PackageInsert row : doc.getRows()) {
			for (InteractionRecord r : row.getInteractionsFlat()) {
				if (r.isEmpty()) continue;
				lines.add(Arrays.asList(row.getPackageInsertNo(), row.getYjCode(),
						r.category() == null ? null : r.category().label(),
						r.group(), r.partner(), r.symptoms(), r.mechanism()));
			}
		}
		return () -> print(lines);
	}

	private synchronized void print(List<List<String>> lines) throws IOException {
		for (List<String> line : lines) {
			printer.printRecord(line);
		}
	}

	@Override
	public synchronized void close() throws IOException {
		printer.close(true);
	}
}
