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

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Thin wrapper around multiple {@link PrintWriter} instances that:
 * <ul>
 *   <li>Emits a transaction preamble ("BEGIN;") to each stream,</li>
 *   <li>Appends statements per key through a locked {@link #write(String, String)}, or
 *   one document's statements for every key at once through {@link #writeAll(Map)},</li>
 *   <li>Flushes and closes all writers with a trailing "COMMIT;".</li>
 * </ul>
 *
 * <p>Note: This class does not manage file creation; callers should open the
 * {@code PrintWriter}s with desired encodings and pass them in.</p>
 */
public class SqlWriters implements AutoCloseable {

	static final String SQL_BEGIN = "BEGIN;";
	static final String SQL_COMMIT = "COMMIT;";

	private final Map<String, PrintWriter> writers = new LinkedHashMap<>();
	private boolean closed;

	public SqlWriters(Map<String, PrintWriter> w) {
		Objects.requireNonNull(w, "writers");
		writers.putAll(w);
		writers.values().forEach(pw -> pw.println(SQL_BEGIN));
	}

	/** Appends one statement; statements written to the same key never interleave. */
	public void write(String key, String sql) {
		PrintWriter pw = writers.get(key);
		if (pw == null) {
			throw new IllegalArgumentException("No SQL writer registered for " + key);
		}
		synchronized (pw) {
			pw.println(sql);
		}
	}

	/**
	 * Appends a batch of statements across several keys as one unit: no other batch lands
	 * between them in any script.
	 */
	public synchronized void writeAll(Map<String, List<String>> batch) {
		batch.forEach((key, statements) -> statements.forEach(sql -> write(key, sql)));
	}

	/** Print "COMMIT;", flush, and close all writers. Further calls do nothing. */
	@Override
	public synchronized void close() {
		if (closed) return;
		closed = true;
		writers.values().forEach(pw -> {
			pw.println(SQL_COMMIT);
			pw.flush();
			pw.close();
		});
	}
}
