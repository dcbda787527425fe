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

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe run counters shared by the pipeline workers. Designed for single-JVM batch runs.
 */
public final class GlobalTrackers {

	public final AtomicInteger done = new AtomicInteger();
	public final AtomicInteger errors = new AtomicInteger();
	public final AtomicLong rows = new AtomicLong();
	public final AtomicLong interactions = new AtomicLong();

	// Section hit counters
	public final AtomicInteger withPregnant = new AtomicInteger();
	public final AtomicInteger withNursing = new AtomicInteger();

	/** Pregnancy scores seen, keyed by rule tag. */
	public final ConcurrentMap<String, Integer> pregnantRules = new ConcurrentHashMap<>();
	public final ConcurrentMap<String, Integer> nursingRules = new ConcurrentHashMap<>();

	// Timings, in nanoseconds
	public final AtomicLong busyNanos = new AtomicLong();
	private long slowestNanos;
	private String slowestFile = "";

	public GlobalTrackers() { /* default */ }

	public void countRule(ConcurrentMap<String, Integer> map, String tag) {
		map.merge(tag, 1, Integer::sum);
	}

	public synchronized void recordTiming(String file, long nanos) {
		busyNanos.addAndGet(nanos);
		if (nanos > slowestNanos) {
			slowestNanos = nanos;
			slowestFile = file;
		}
	}

	public synchronized long getSlowestNanos() {
		return slowestNanos;
	}

	public synchronized String getSlowestFile() {
		return slowestFile;
	}
}
