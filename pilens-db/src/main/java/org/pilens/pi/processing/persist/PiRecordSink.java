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

import org.pilens.pi.om.PiDocument;

/**
 * Receives the records extracted from one package insert. Rows are keyed by
 * (package insert number, YJ code). Implementations must be safe to call from several
 * worker threads at once.
 */
public interface PiRecordSink extends AutoCloseable {

	/**
	 * Renders everything this sink stores for {@code doc} without touching the output. A
	 * failure here leaves the output unchanged; the returned write appends the document.
	 */
	PendingWrite prepare(PiDocument doc) throws IOException;

	default void accept(PiDocument doc) throws IOException {
		prepare(doc).write();
	}

	/** A rendered document waiting to be appended. */
	@FunctionalInterface
	interface PendingWrite {
		void write() throws IOException;
	}

	@Override
	void close() throws IOException;
}
