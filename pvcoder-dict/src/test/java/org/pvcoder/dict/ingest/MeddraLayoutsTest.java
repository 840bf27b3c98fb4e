package org.pvcoder.dict.ingest;

/*
 * This file is part of PVCoder.
 *
 * Copyright (C) 2025 GlaxoSmithKline
 *
 * PVCoder is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * PVCoder is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with PVCoder.  If not, see <https://www.gnu.org/licenses/>.
 */

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.DictionaryException.ErrorKind;
import org.pvcoder.dict.DictionaryFixtures;

class MeddraLayoutsTest {

	@TempDir
	Path tmp;

	private static <T> List<T> readAll(ParsedFile<T> parsed) {
		List<T> out = new ArrayList<>();
		parsed.forEach(out::add);
		return out;
	}

	@Test
	@DisplayName("SOC lines map code, name and abbreviation")
	void soc_lines() throws Exception {
		Path f = DictionaryFixtures.write(tmp, "soc.asc", "10007541$Cardiac disorders$Card$");
		try (ParsedFile<SocRecord> parsed = DelimitedFileParser.open(f, MeddraLayouts.SOC)) {
			List<SocRecord> rows = readAll(parsed);
			assertEquals(List.of(new SocRecord(10007541, "Cardiac disorders", "Card")), rows);
		}
	}

	@Test
	@DisplayName("Malformed lines are skipped and counted, good lines survive")
	void skips_and_counts_malformed_lines() throws Exception {
		Path f = DictionaryFixtures.write(tmp, "pt.asc",
				DictionaryFixtures.pt("10043071", "Tachycardia", "10007541"),
				"not-a-code$Broken$$10007541$",
				"10000001$$$10007541$",
				"10000002$Too few",
				DictionaryFixtures.pt("10033557", "Palpitations", ""),
				"10000003$Bad SOC$$abc$",
				"");
		try (ParsedFile<PtRecord> parsed = DelimitedFileParser.open(f, MeddraLayouts.PT)) {
			List<PtRecord> rows = readAll(parsed);

			assertEquals(2, rows.size());
			assertEquals(Integer.valueOf(10007541), rows.get(0).getPrimarySocCode());
			assertNull(rows.get(1).getPrimarySocCode(), "blank primary SOC is allowed");
			assertEquals(2, parsed.getAcceptedLines());
			assertEquals(4, parsed.getSkippedLines());
		}
	}

	@Test
	@DisplayName("LLT currency comes from the tenth column")
	void llt_currency_flag() throws Exception {
		Path f = DictionaryFixtures.write(tmp, "llt.asc",
				DictionaryFixtures.llt("10019305", "Heart racing", "10043071", true),
				DictionaryFixtures.llt("10043074", "Tachycardia paroxysmal", "10043071", false),
				"10000009$Short line$10043071$");
		try (ParsedFile<LltRecord> parsed = DelimitedFileParser.open(f, MeddraLayouts.LLT)) {
			List<LltRecord> rows = readAll(parsed);

			assertEquals(2, rows.size());
			assertTrue(rows.get(0).isCurrent());
			assertFalse(rows.get(1).isCurrent());
			assertEquals(10043071, rows.get(1).getPtCode());
			assertEquals(1, parsed.getSkippedLines());
		}
	}

	@Test
	@DisplayName("A parsed file can be iterated only once")
	void one_shot_iteration() throws Exception {
		Path f = DictionaryFixtures.write(tmp, "hlt_pt.asc", "10042600$10043071$");
		try (ParsedFile<RelationRecord> parsed = DelimitedFileParser.open(f, MeddraLayouts.HLT_PT)) {
			assertEquals(1, readAll(parsed).size());
			assertThrows(IllegalStateException.class, parsed::iterator);
		}
	}

	@Test
	@DisplayName("Quotes are data, not field delimiters")
	void quotes_are_literal() throws Exception {
		Path f = DictionaryFixtures.write(tmp, "hlgt.asc", "10000004$\"Quoted\" term$");
		try (ParsedFile<TermRecord> parsed = DelimitedFileParser.open(f, MeddraLayouts.HLGT)) {
			assertEquals("\"Quoted\" term", readAll(parsed).get(0).getName());
		}
	}

	@Test
	@DisplayName("Invalid UTF-8 is replaced instead of failing the file")
	void lenient_decoding() throws Exception {
		Path f = tmp.resolve("hlt.asc");
		byte[] prefix = "10000005$Caf".getBytes(StandardCharsets.US_ASCII);
		byte[] suffix = "$\n".getBytes(StandardCharsets.US_ASCII);
		byte[] bytes = new byte[prefix.length + 1 + suffix.length];
		System.arraycopy(prefix, 0, bytes, 0, prefix.length);
		bytes[prefix.length] = (byte) 0xE9; // Latin-1 e-acute
		System.arraycopy(suffix, 0, bytes, prefix.length + 1, suffix.length);
		Files.write(f, bytes);

		try (ParsedFile<TermRecord> parsed = DelimitedFileParser.open(f, MeddraLayouts.HLT)) {
			List<TermRecord> rows = readAll(parsed);
			assertEquals(1, rows.size());
			assertTrue(rows.get(0).getName().startsWith("Caf"));
		}
	}

	@Test
	void missing_file_is_file_not_found() {
		DictionaryException ex = assertThrows(DictionaryException.class,
				() -> DelimitedFileParser.open(tmp.resolve("soc.asc"), MeddraLayouts.SOC));
		assertEquals(ErrorKind.FILE_NOT_FOUND, ex.getKind());
	}

	@Test
	void code_accepts_only_short_numbers() {
		assertEquals(Integer.valueOf(10007541), MeddraLayouts.code(" 10007541 "));
		assertNull(MeddraLayouts.code("1000754100"));
		assertNull(MeddraLayouts.code("-1"));
		assertNull(MeddraLayouts.code(""));
		assertNull(MeddraLayouts.code(null));
	}
}
