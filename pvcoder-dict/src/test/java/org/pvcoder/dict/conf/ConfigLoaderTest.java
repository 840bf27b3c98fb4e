package org.pvcoder.dict.conf;

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
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

	@TempDir
	Path tmp;

	private String priorSysProp;

	@AfterEach
	void cleanupSysProp() {
		if (priorSysProp == null) {
			System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		} else {
			System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, priorSysProp);
		}
	}

	// --- helpers -------------------------------------------------------------

	private Path writePropsFile(Properties p, String filename) throws IOException {
		Path f = tmp.resolve(filename);
		try (var out = Files.newOutputStream(f)) {
			p.store(out, "test");
		}
		return f;
	}

	private Properties minimalRequiredProps() {
		Properties p = new Properties();
		p.setProperty("DB_URL", "jdbc:h2:mem:cfg;MODE=MySQL");
		p.setProperty("DB_USER", "sa");
		return p;
	}

	// --- tests ---------------------------------------------------------------

	@Test
	void loads_from_file_and_applies_defaults() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("DB_PASS", "   ");
		Path f = writePropsFile(p, "conf1.properties");

		ConfigLoader loader = new ConfigLoader(f);

		assertEquals("jdbc:h2:mem:cfg;MODE=MySQL", loader.getDbUrl());
		assertEquals("sa", loader.getDbUser());
		assertEquals("", loader.getDbPass());
		assertNull(loader.getDbDriver());
		assertEquals(ConfigLoader.DEFAULT_CONNECT_RETRIES, loader.getDbConnectRetries());
		assertEquals(ConfigLoader.DEFAULT_BATCH_SIZE, loader.getImportBatchSize());
		assertEquals(ConfigLoader.DEFAULT_QUEUE_CAPACITY, loader.getImportQueueCapacity());
		assertEquals(ConfigLoader.DEFAULT_SEARCH_LIMIT, loader.getSearchDefaultLimit());
		assertEquals(ConfigLoader.DEFAULT_SEARCH_MAX_LIMIT, loader.getSearchMaxLimit());
		assertTrue(loader.validate().isEmpty());
	}

	@Test
	void validate_reports_missing_required() throws Exception {
		Path f = writePropsFile(new Properties(), "conf_missing.properties");

		List<String> issues = new ConfigLoader(f).validate();

		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: DB_URL")));
		assertTrue(issues.stream().anyMatch(s -> s.contains("Missing required property: DB_USER")));
	}

	@Test
	void validate_flags_bad_numbers_and_inverted_limits() {
		Properties p = minimalRequiredProps();
		p.setProperty("IMPORT_BATCH_SIZE", "-5");
		p.setProperty("IMPORT_QUEUE_CAPACITY", "lots");
		p.setProperty("DB_CONNECT_RETRIES", "x");
		p.setProperty("SEARCH_DEFAULT_LIMIT", "200");
		p.setProperty("SEARCH_MAX_LIMIT", "100");

		ConfigLoader loader = new ConfigLoader(p);
		List<String> issues = loader.validate();

		assertTrue(issues.stream().anyMatch(s -> s.startsWith("IMPORT_BATCH_SIZE must be a positive integer")));
		assertTrue(issues.stream().anyMatch(s -> s.startsWith("IMPORT_QUEUE_CAPACITY must be a positive integer")));
		assertTrue(issues.stream().anyMatch(s -> s.startsWith("DB_CONNECT_RETRIES must be an integer")));
		assertTrue(issues.contains("SEARCH_DEFAULT_LIMIT must not exceed SEARCH_MAX_LIMIT."));

		// getters fall back to defaults for unusable values
		assertEquals(ConfigLoader.DEFAULT_BATCH_SIZE, loader.getImportBatchSize());
		assertEquals(ConfigLoader.DEFAULT_QUEUE_CAPACITY, loader.getImportQueueCapacity());
	}

	@Test
	void system_property_override_loads_external_file() throws Exception {
		Properties p = minimalRequiredProps();
		p.setProperty("SEARCH_MAX_LIMIT", "321");
		Path f = writePropsFile(p, "override.properties");

		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		System.setProperty(ConfigLoader.SYS_PROP_CONFIG_PATH, f.toAbsolutePath().toString());

		ConfigLoader loader = new ConfigLoader();

		assertEquals(321, loader.getSearchMaxLimit());
	}

	@Test
	void default_constructor_reads_classpath_resource() {
		priorSysProp = System.getProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);
		System.clearProperty(ConfigLoader.SYS_PROP_CONFIG_PATH);

		ConfigLoader loader = new ConfigLoader();

		assertTrue(loader.getDbUrl().startsWith("jdbc:h2:mem:"));
		assertEquals(20, loader.getSearchDefaultLimit());
		assertTrue(loader.validate().isEmpty());
	}

	@Test
	void required_getters_throw_when_missing() {
		ConfigLoader loader = new ConfigLoader(new Properties());

		assertThrows(IllegalStateException.class, loader::getDbUrl);
		assertThrows(IllegalStateException.class, loader::getDbUser);
	}

	@Test
	void unreadable_file_is_rejected() {
		assertThrows(IllegalArgumentException.class, () -> new ConfigLoader(tmp.resolve("absent.properties")));
	}
}
