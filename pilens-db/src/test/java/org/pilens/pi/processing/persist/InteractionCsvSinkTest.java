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

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pilens.pi.om.InteractionCategory;
import org.pilens.pi.om.InteractionRecord;
import org.pilens.pi.om.PackageInsert;
import org.pilens.pi.om.PiDocument;

class InteractionCsvSinkTest {

	@TempDir
	Path tmp;

	@Test
	void one_line_per_brand_and_record_with_header() throws Exception {
		PiDocument doc = new PiDocument();
		PackageInsert row = new PackageInsert();
		row.setPackageInsertNo("PI-1");
		row.setYjCode("Y1");
		row.getInteractionsFlat().add(new InteractionRecord("イトラコナゾール", "強い CYP3A阻害剤", "QT延長, 死亡例", "代謝阻害",
				InteractionCategory.CONTRAINDICATED));
		row.getInteractionsFlat().add(new InteractionRecord(null, null, null, null, InteractionCategory.CAUTION));
		doc.getRows().add(row);

		try (InteractionCsvSink sink = new InteractionCsvSink(tmp)) {
			sink.accept(doc);
		}

		List<CSVRecord> records;
		try (Reader r = Files.newBufferedReader(tmp.resolve(InteractionCsvSink.FILE_NAME), StandardCharsets.UTF_8);
				CSVParser p = new CSVParser(r, CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build())) {
			assertEquals(List.of(InteractionCsvSink.HEADER), p.getHeaderNames());
			records = p.getRecords();
		}

		assertEquals(1, records.size());
		CSVRecord rec = records.get(0);
		assertEquals("PI-1", rec.get("package_insert_no"));
		assertEquals("Y1", rec.get("yj_code"));
		assertEquals("併用禁忌", rec.get("section_type"));
		assertEquals("強い CYP3A阻害剤", rec.get("partner_group_ja"));
		assertEquals("イトラコナゾール", rec.get("partner_name_ja"));
		assertEquals("QT延長, 死亡例", rec.get("symptoms_measures_ja"));
		assertEquals("代謝阻害", rec.get("mechanism_ja"));
	}

	@Test
	void nothing_is_printed_before_the_pending_write_runs() throws Exception {
		PiDocument doc = new PiDocument();
		PackageInsert row = new PackageInsert();
		row.setPackageInsertNo("PI-1");
		row.setYjCode("Y1");
		row.getInteractionsFlat().add(new InteractionRecord("A", "G", null, null, InteractionCategory.CAUTION));
		doc.getRows().add(row);

		try (InteractionCsvSink sink = new InteractionCsvSink(tmp)) {
			sink.prepare(doc);
		}

		List<String> lines = Files.readAllLines(tmp.resolve(InteractionCsvSink.FILE_NAME), StandardCharsets.UTF_8);
		assertEquals(List.of(String.join(",", InteractionCsvSink.HEADER)), lines);
	}
}
