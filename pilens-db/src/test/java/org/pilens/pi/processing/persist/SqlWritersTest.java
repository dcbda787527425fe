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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class SqlWritersTest {

	@Test
	void wraps_each_stream_in_one_transaction() {
		StringWriter a = new StringWriter();
		StringWriter b = new StringWriter();
		Map<String, PrintWriter> m = new LinkedHashMap<>();
		m.put("A", new PrintWriter(a));
		m.put("B", new PrintWriter(b));

		SqlWriters w = new SqlWriters(m);
		w.write("A", "SELECT 1;");
		w.close();
		w.close();

		String nl = System.lineSeparator();
		assertEquals("BEGIN;" + nl + "SELECT 1;" + nl + "COMMIT;" + nl, a.toString());
		assertEquals("BEGIN;" + nl + "COMMIT;" + nl, b.toString());
	}

	@Test
	void batch_lands_in_every_stream_in_key_order() {
		StringWriter a = new StringWriter();
		StringWriter b = new StringWriter();
		Map<String, PrintWriter> m = new LinkedHashMap<>();
		m.put("A", new PrintWriter(a));
		m.put("B", new PrintWriter(b));

		SqlWriters w = new SqlWriters(m);
		Map<String, List<String>> batch = new LinkedHashMap<>();
		batch.put("B", List.of("DELETE FROM t;", "INSERT INTO t VALUES (1);"));
		batch.put("A", List.of("SELECT 2;"));
		w.writeAll(batch);
		w.close();

		String nl = System.lineSeparator();
		assertEquals("BEGIN;" + nl + "SELECT 2;" + nl + "COMMIT;" + nl, a.toString());
		assertEquals("BEGIN;" + nl + "DELETE FROM t;" + nl + "INSERT INTO t VALUES (1);" + nl + "COMMIT;" + nl,
				b.toString());
	}

	@Test
	void unknown_key_is_rejected() {
		SqlWriters w = new SqlWriters(Map.of("A", new PrintWriter(new StringWriter())));
		assertThrows(IllegalArgumentException.class, () -> w.write("B", "SELECT 1;"));
	}
}
