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
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.pilens.pi.om.InteractionRecord;
import org.pilens.pi.om.PackageInsert;
import org.pilens.pi.om.PiDocument;
import org.pilens.pi.util.Logger;

/**
 * Writes PostgreSQL scripts for an external loader: {@code schema.sql} plus one upsert
 * script per table. Each script is a single transaction. Rows are keyed by (package insert
 * number, YJ code): the last document written for a key wins, and its interaction set
 * replaces the earlier one.
 */
public class SqlFileSink implements PiRecordSink {

	public static final String SCHEMA = "SCHEMA";
	public static final String RAWDATA = "RAWDATA";
	public static final String INTERACTION = "INTERACTION";
	public static final String WOMEN = "WOMEN";
	public static final String WOMEN_RISK = "WOMEN_RISK";

	/** Writer key to file name. */
	public static final Map<String, String> FILES = Map.of(
			SCHEMA, "schema.sql",
			RAWDATA, "rawdata.sql",
			INTERACTION, "interaction.sql",
			WOMEN, "women.sql",
			WOMEN_RISK, "women_risk.sql");

	private final PiSqlStatements statements;
	private final SqlWriters writers;

	private final AtomicLong rawRows = new AtomicLong();
	private final AtomicLong interactionRows = new AtomicLong();

	public SqlFileSink(Path outputDir, PiSqlStatements statements) throws IOException {
		this.statements = statements;
		Files.createDirectories(outputDir);

		Map<String, PrintWriter> w = new LinkedHashMap<>();
		try {
			for (String key : List.of(SCHEMA, RAWDATA, INTERACTION, WOMEN, WOMEN_RISK)) {
				w.put(key, new PrintWriter(Files.newBufferedWriter(outputDir.resolve(FILES.get(key)), StandardCharsets.UTF_8)));
			}
		} catch (IOException e) {
			w.values().forEach(PrintWriter::close);
			throw e;
		}
		this.writers = new SqlWriters(w);
		writers.write(SCHEMA, statements.schema());
	}

	@Override
	public PendingWrite prepare(PiDocument doc) {
		List<String> raw = new ArrayList<>();
		List<String> inter = new ArrayList<>();
		List<String> women = new ArrayList<>();
		List<String> risk = new ArrayList<>();
		long[] interCount = new long[1];
		for (PackageInsert row : doc.getRows()) {
			raw.add(statements.rawdataUpsert(row));
			inter.add(statements.interactionDelete(row.getPackageInsertNo(), row.getYjCode()));
			for (InteractionRecord r : row.getInteractionsFlat()) {
				String sql = statements.interactionInsert(row.getPackageInsertNo(), row.getYjCode(), r);
				if (sql != null) {
					inter.add(sql);
					interCount[0]++;
				}
			}
			women.add(statements.womenUpsert(row, doc));
			risk.add(statements.womenRiskUpsert(row, doc.getRisk()));
		}

		// One batch per document keeps the same document last for a key in every script.
		Map<String, List<String>> batch = new LinkedHashMap<>();
		batch.put(RAWDATA, raw);
		batch.put(INTERACTION, inter);
		batch.put(WOMEN, women);
		batch.put(WOMEN_RISK, risk);
		return () -> {
			writers.writeAll(batch);
			rawRows.addAndGet(raw.size());
			interactionRows.addAndGet(interCount[0]);
		};
	}

	public long getRawRows() {
		return rawRows.get();
	}

	public long getInteractionRows() {
		return interactionRows.get();
	}

	@Override
	public void close() {
		writers.close();
		Logger.info("SQL scripts closed: rawdata rows={}, interaction rows={}", rawRows.get(), interactionRows.get());
	}
}
