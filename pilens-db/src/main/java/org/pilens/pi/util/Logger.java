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

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Small static logger used across PILens.
 *
 * <p>Each line carries a timestamp, the thread name and the level. INFO and
 * below go to stdout, WARN and ERROR to stderr. Messages use {@code {}}
 * placeholders.</p>
 *
 * <p>System properties (read once at class load):</p>
 * <ul>
 *   <li><b>pilens.log.level</b> – minimum level to print (default: INFO)</li>
 *   <li><b>pilens.log.datetime</b> – timestamp pattern (default: yyyy-MM-dd HH:mm:ss)</li>
 *   <li><b>pilens.log.file</b> – optional file that receives a copy of every line</li>
 * </ul>
 */
public final class Logger {

	/** Log levels in increasing order of severity. */
	public enum Level {
		TRACE, DEBUG, INFO, WARN, ERROR;

		static Level parse(String s, Level fallback) {
			if (s == null) return fallback;
			try {
				return Level.valueOf(s.trim().toUpperCase(Locale.ROOT));
			} catch (IllegalArgumentException ex) {
				return fallback;
			}
		}
	}

	private static volatile Level minLevel =
			Level.parse(System.getProperty("pilens.log.level"), Level.INFO);

	private static final DateTimeFormatter TS =
			DateTimeFormatter.ofPattern(System.getProperty("pilens.log.datetime", "yyyy-MM-dd HH:mm:ss"));

	private static final PrintWriter FILE_SINK = openFileSink(System.getProperty("pilens.log.file"));

	private Logger() {}

	public static void trace(String msg, Object... args) { log(Level.TRACE, null, msg, args); }
	public static void debug(String msg, Object... args) { log(Level.DEBUG, null, msg, args); }
	public static void info (String msg, Object... args) { log(Level.INFO , null, msg, args); }
	public static void warn (String msg, Object... args) { log(Level.WARN , null, msg, args); }
	public static void error(String msg, Object... args) { log(Level.ERROR, null, msg, args); }

	public static void warn (String msg, Throwable t, Object... args) { log(Level.WARN , t, msg, args); }
	public static void error(String msg, Throwable t, Object... args) { log(Level.ERROR, t, msg, args); }

	public static boolean isEnabled(Level level) {
		return level.ordinal() >= minLevel.ordinal();
	}

	/** Runtime override, used by the command line and by tests. */
	public static void setLevel(Level level) {
		if (level != null) minLevel = level;
	}

	private static void log(Level level, Throwable t, String msg, Object... args) {
		if (!isEnabled(level)) return;

		final String line = "[" + LocalDateTime.now().format(TS) + "] ["
				+ Thread.currentThread().getName() + "] " + level + " " + format(msg, args);
		final PrintStream out = (level.ordinal() >= Level.WARN.ordinal()) ? System.err : System.out;

		synchronized (Logger.class) {
			out.println(line);
			if (t != null) t.printStackTrace(out);

			if (FILE_SINK != null) {
				FILE_SINK.println(line);
				if (t != null) t.printStackTrace(FILE_SINK);
				FILE_SINK.flush();
			}
		}
	}

	/**
	 * Replaces each "{}" with the next argument. Surplus arguments are appended.
	 */
	static String format(String template, Object... args) {
		if (template == null) return "null";
		if (args == null || args.length == 0) return template;

		StringBuilder sb = new StringBuilder(template.length() + args.length * 8);
		int argIdx = 0;
		for (int i = 0; i < template.length(); i++) {
			char c = template.charAt(i);
			if (c == '{' && i + 1 < template.length() && template.charAt(i + 1) == '}' && argIdx < args.length) {
				sb.append(String.valueOf(args[argIdx++]));
				i++;
			} else {
				sb.append(c);
			}
		}
		while (argIdx < args.length) {
			sb.append(' ').append(String.valueOf(args[argIdx++]));
		}
		return sb.toString();
	}

	private static PrintWriter openFileSink(String file) {
		if (file == null || file.isBlank()) return null;
		try {
			Path p = Path.of(file.trim());
			if (p.getParent() != null) Files.createDirectories(p.getParent());
			return new PrintWriter(new OutputStreamWriter(new FileOutputStream(p.toFile(), true), StandardCharsets.UTF_8));
		} catch (IOException | RuntimeException e) {
			System.err.println("[Logger] cannot open log file " + file + ": " + e.getMessage());
			return null;
		}
	}
}
