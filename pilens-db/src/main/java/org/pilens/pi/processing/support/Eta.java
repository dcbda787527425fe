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

import java.util.Locale;

/**
 * Progress and remaining-time formatting for the pipeline log.
 */
public final class Eta {

	private Eta() {
	}

	/** {@code 1h02m03s}, {@code 02m03s}, or {@code --:--} for a negative estimate. */
	public static String format(double seconds) {
		if (seconds < 0 || Double.isNaN(seconds)) return "--:--";
		long total = (long) seconds;
		long h = total / 3600;
		long m = (total % 3600) / 60;
		long s = total % 60;
		if (h > 0) return String.format(Locale.ROOT, "%dh%02dm%02ds", h, m, s);
		return String.format(Locale.ROOT, "%02dm%02ds", m, s);
	}

	/** Remaining seconds given elapsed time and the share of work done; -1 when unknown. */
	public static double remaining(double elapsedSeconds, int done, int total) {
		if (total <= 0 || done <= 0) return -1;
		double rate = (double) done / total;
		return elapsedSeconds / rate - elapsedSeconds;
	}

	/** {@code [done/total  42.0% ETA:01m10s]} */
	public static String progress(int done, int total, double elapsedSeconds) {
		double pct = total > 0 ? done * 100.0 / total : 100.0;
		return String.format(Locale.ROOT, "[%d/%d %5.1f%% ETA:%s]", done, total, pct, format(remaining(elapsedSeconds, done, total)));
	}
}
