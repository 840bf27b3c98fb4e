package org.pvcoder.dict;

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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PVCoderMainTest {

	@TempDir
	Path tmp;

	private TerminologyEngine engine;
	private PVCoderMain main;
	private ByteArrayOutputStream buffer;

	@BeforeEach
	void setUp() {
		engine = DictionaryFixtures.engine("cli");
		main = new PVCoderMain(engine);
	}

	private int run(String... args) {
		buffer = new ByteArrayOutputStream();
		try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
			return main.run(args, out);
		}
	}

	private String output() {
		return buffer.toString(StandardCharsets.UTF_8);
	}

	private long importAndActivate() throws Exception {
		DictionaryFixtures.writeMeddra(tmp);
		assertEquals(PVCoderMain.EXIT_OK, run("meddra", "import", "27.0", tmp.toString(), "--date", "2024-03-01"));
		long id = engine.meddra().listVersions().get(0).getId();
		assertEquals(PVCoderMain.EXIT_OK, run("meddra", "activate", String.valueOf(id)));
		return id;
	}

	@Test
	@DisplayName("Import reports counts and leaves the version inactive")
	void import_then_list() throws Exception {
		DictionaryFixtures.writeMeddra(tmp);

		assertEquals(PVCoderMain.EXIT_OK, run("meddra", "import", "27.0", tmp.toString(), "--by", "tester"));
		assertTrue(output().contains("10 leaf terms, 4 terms, 0 lines skipped"), output());
		assertTrue(engine.meddra().getActiveVersion().isEmpty());

		assertEquals(PVCoderMain.EXIT_OK, run("meddra", "versions"));
		assertTrue(output().contains("27.0"));
		assertTrue(output().startsWith(" "), "inactive versions carry no marker");
	}

	@Test
	void versions_when_empty() {
		assertEquals(PVCoderMain.EXIT_OK, run("MedDRA", "versions"));
		assertEquals("No MedDRA versions", output().trim());
	}

	@Test
	void activate_marks_the_version() throws Exception {
		long id = importAndActivate();

		assertTrue(output().contains("Activated version " + id));
		run("meddra", "versions");
		assertTrue(output().startsWith("*"));
	}

	@Test
	void search_prints_ranked_results() throws Exception {
		importAndActivate();

		assertEquals(PVCoderMain.EXIT_OK, run("meddra", "search", "tachy", "--limit", "2"));
		String[] lines = output().split("\\R");
		assertEquals(3, lines.length);
		assertTrue(lines[0].contains("Tachyarrhythmia"), lines[0]);
		assertEquals("2 result(s)", lines[2]);
	}

	@Test
	void browse_and_code() throws Exception {
		importAndActivate();

		assertEquals(PVCoderMain.EXIT_OK, run("meddra", "browse"));
		assertTrue(output().startsWith("+ SOC-" + DictionaryFixtures.CARDIAC_SOC + " Cardiac disorders"));

		assertEquals(PVCoderMain.EXIT_OK,
				run("meddra", "code", DictionaryFixtures.HEART_RACING_LLT, "heart", "was", "racing", "--coder", "c1"));
		assertTrue(output().contains("Verbatim: heart was racing"));
		assertTrue(output().contains("Primary path: yes"));
		assertFalse(output().contains("Product:"));
		assertNull(engine.meddra().resolveCoding(DictionaryFixtures.HEART_RACING_LLT, "racing", null).getProduct());
	}

	@Test
	@DisplayName("WHO Drug coding prints the product with its ingredient strengths")
	void whodrug_code_prints_product() throws Exception {
		DictionaryFixtures.writeWhoDrug(tmp);
		assertEquals(PVCoderMain.EXIT_OK, run("whodrug", "import", "2025 MAR 1", tmp.toString()));
		long id = engine.whoDrug().listVersions().get(0).getId();
		assertEquals(PVCoderMain.EXIT_OK, run("whodrug", "activate", String.valueOf(id)));

		assertEquals(PVCoderMain.EXIT_OK, run("whodrug", "code", "000200010030", "panadol", "extra"));
		assertTrue(output().contains("Product:  000200010030 Panadol Extra [GB, Tablet]"), output());
		assertTrue(output().contains("  Caffeine 65 mg"), output());
		assertTrue(output().contains("  Paracetamol 500 mg"), output());
	}

	@Test
	@DisplayName("Dictionary errors exit with 1, usage errors with 2")
	void exit_codes() throws Exception {
		assertEquals(PVCoderMain.EXIT_USAGE, run());
		assertTrue(output().startsWith("Usage:"));
		assertEquals(PVCoderMain.EXIT_USAGE, run("snomed", "versions"));
		assertEquals(PVCoderMain.EXIT_USAGE, run("meddra", "versions", "--verbose"));
		assertEquals(PVCoderMain.EXIT_USAGE, run("meddra", "activate", "abc"));
		assertEquals(PVCoderMain.EXIT_USAGE, run("meddra", "frobnicate"));

		assertEquals(PVCoderMain.EXIT_FAILED, run("meddra", "activate", "42"));
		assertTrue(output().startsWith("Error [NOT_FOUND]"), output());
		assertEquals(PVCoderMain.EXIT_FAILED, run("meddra", "code", "10019305", "racing"));
		assertTrue(output().contains("NO_ACTIVE_VERSION"));
		assertEquals(PVCoderMain.EXIT_FAILED, run("meddra", "import", "x", tmp.resolve("missing").toString()));
	}

	@Test
	void parse_separates_options_from_positionals() {
		List<String> positional = new ArrayList<>();
		Map<String, String> options = new HashMap<>();

		PVCoderMain.parse(new String[] { "whodrug", "--all", "search", "--country", "GB", "panadol" }, positional,
				options);

		assertEquals(List.of("whodrug", "search", "panadol"), positional);
		assertEquals("true", options.get("all"));
		assertEquals("GB", options.get("country"));
	}
}
