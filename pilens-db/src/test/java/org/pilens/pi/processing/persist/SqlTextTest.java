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
import static org.junit.jupiter.api.Assertions.assertFalse;

import org.junit.jupiter.api.Test;

class SqlTextTest {

	// Convenience alias
	private static String S(String s) {
		return SqlText.sanitize(s);
	}

	@Test
	void preservesNewlinesAndEscapesSingleQuotes() {
		assertEquals("O''Brien\nSecond line", S("O'Brien\nSecond line"));
	}

	@Test
	void stripsControlCharsButKeepsLfCrTab() {
		String out = S("line\u0000one\nline\u0001two\rline\tthree");
		// standalone \r is normalized to \n
		assertEquals("lineone\nlinetwo\nline\tthree", out);
		assertFalse(out.contains("\u0000"));
		assertFalse(out.contains("\u0001"));
	}

	@Test
	void normalizesCrLfAndCrToLf() {
		assertEquals("a\nb\nc", S("a\r\nb\rc"));
	}

	@Test
	void backslashesAndQuoteRunsAreLeftToTheLiteral() {
		// standard_conforming_strings: backslash is an ordinary character
		assertEquals("path\\to\\file\\", S("path\\to\\file\\"));
		assertEquals("O''''''''Brien", S("O''''Brien"));
	}

	@Test
	void avoidsDanglingSurrogates() {
		assertEquals("emoji start ", S("emoji start \uD83D"));
		assertEquals("lone  low", S("lone \uDE03 low"));
		String ok = "smile 😃";
		assertEquals(ok, S(ok));
	}

	@Test
	void japaneseTextPassesThrough() {
		assertEquals("妊婦には投与しないこと。", S("妊婦には投与しないこと。"));
	}

	@Test
	void literalsAndJsonb() {
		assertEquals("NULL", SqlText.literal(null));
		assertEquals("''", SqlText.literal(""));
		assertEquals("'it''s'", SqlText.literal("it's"));
		assertEquals("NULL", SqlText.jsonb(null));
		assertEquals("'{\"a\":\"b''c\"}'::jsonb", SqlText.jsonb("{\"a\":\"b'c\"}"));
		assertEquals("TRUE", SqlText.bool(true));
		assertEquals("FALSE", SqlText.bool(false));
	}

	@Test
	void nullAndEmptyAreSafe() {
		assertEquals("", S(null));
		assertEquals("", S(""));
	}
}
