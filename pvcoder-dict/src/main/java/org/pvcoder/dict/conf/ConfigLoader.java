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

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

import org.pvcoder.dict.util.Logger;

/**
 * Loads PVCoder settings from a {@code .properties} file.
 * <p>
 * By default this reads <code>config/pvcoder.properties</code> from the classpath.
 * Set the system property <code>pvcoder.config</code> to a file path to use an
 * external file instead, or use the {@link #ConfigLoader(Path)} constructor.
 *
 * <h3>Keys</h3>
 * <ul>
 * <li><code>DB_URL</code>, <code>DB_USER</code> (required), <code>DB_PASS</code>,
 * <code>DB_DRIVER</code>, <code>DB_CONNECT_RETRIES</code></li>
 * <li><code>IMPORT_BATCH_SIZE</code>, <code>IMPORT_QUEUE_CAPACITY</code></li>
 * <li><code>SEARCH_DEFAULT_LIMIT</code>, <code>SEARCH_MAX_LIMIT</code></li>
 * </ul>
 * Call {@link #validate()} at startup; it lists problems instead of throwing.
 */
public final class ConfigLoader {

	/** Default classpath resource. */
	public static final String DEFAULT_CLASSPATH_RESOURCE = "config/pvcoder.properties";

	/** System property to point to an external config file. */
	public static final String SYS_PROP_CONFIG_PATH = "pvcoder.config";

	// ---- Property keys --------------------------------------------------------
	private static final String K_DB_URL = "DB_URL";
	private static final String K_DB_USER = "DB_USER";
	private static final String K_DB_PASS = "DB_PASS";
	private static final String K_DB_DRIVER = "DB_DRIVER";
	private static final String K_DB_CONNECT_RETRIES = "DB_CONNECT_RETRIES";

	private static final String K_IMPORT_BATCH_SIZE = "IMPORT_BATCH_SIZE";
	private static final String K_IMPORT_QUEUE_CAPACITY = "IMPORT_QUEUE_CAPACITY";

	private static final String K_SEARCH_DEFAULT_LIMIT = "SEARCH_DEFAULT_LIMIT";
	private static final String K_SEARCH_MAX_LIMIT = "SEARCH_MAX_LIMIT";

	// ---- Defaults -------------------------------------------------------------
	static final int DEFAULT_CONNECT_RETRIES = 3;
	static final int DEFAULT_BATCH_SIZE = 1_000;
	static final int DEFAULT_QUEUE_CAPACITY = 4;
	static final int DEFAULT_SEARCH_LIMIT = 50;
	static final int DEFAULT_SEARCH_MAX_LIMIT = 500;

	private final Properties properties = new Properties();

	/**
	 * Reads {@value #DEFAULT_CLASSPATH_RESOURCE} from the classpath unless
	 * {@value #SYS_PROP_CONFIG_PATH} names a readable file.
	 */
	public ConfigLoader() {
		String external = System.getProperty(SYS_PROP_CONFIG_PATH);
		if (external != null && !external.isBlank()) {
			Path p = Path.of(external.trim());
			if (Files.isReadable(p)) {
				loadFromFile(p);
				return;
			}
			Logger.warn("System property {} points to an unreadable path: {}", SYS_PROP_CONFIG_PATH, p);
		}
		loadFromClasspath(DEFAULT_CLASSPATH_RESOURCE);
	}

	/**
	 * Reads a specific file on disk.
	 *
	 * @throws IllegalArgumentException if the file is not readable
	 */
	public ConfigLoader(Path filePath) {
		if (filePath == null || !Files.isReadable(filePath)) {
			throw new IllegalArgumentException("Config file is null or not readable: " + filePath);
		}
		loadFromFile(filePath);
	}

	/** Wraps already-loaded properties; used by embedding hosts and tests. */
	public ConfigLoader(Properties source) {
		if (source != null) {
			properties.putAll(source);
		}
	}

	// -------------------------- Public API -------------------------------------

	/**
	 * Checks required keys and numeric settings.
	 *
	 * @return human-readable issues; empty when the configuration is usable
	 */
	public List<String> validate() {
		List<String> issues = new ArrayList<>();

		requireNonBlank(K_DB_URL, issues);
		requireNonBlank(K_DB_USER, issues);

		requirePositiveIfSet(K_IMPORT_BATCH_SIZE, issues);
		requirePositiveIfSet(K_IMPORT_QUEUE_CAPACITY, issues);
		requirePositiveIfSet(K_SEARCH_DEFAULT_LIMIT, issues);
		requirePositiveIfSet(K_SEARCH_MAX_LIMIT, issues);

		String retries = getOptional(K_DB_CONNECT_RETRIES, null);
		if (retries != null && parseIntOrNull(retries) == null) {
			issues.add("DB_CONNECT_RETRIES must be an integer: '" + retries + "'");
		}

		if (getSearchDefaultLimit() > getSearchMaxLimit()) {
			issues.add("SEARCH_DEFAULT_LIMIT must not exceed SEARCH_MAX_LIMIT.");
		}
		return issues;
	}

	/** JDBC URL of the dictionary database. */
	public String getDbUrl() {
		return getRequired(K_DB_URL);
	}

	/** Database username. */
	public String getDbUser() {
		return getRequired(K_DB_USER);
	}

	/** Database password; blank means none. */
	public String getDbPass() {
		return getOptional(K_DB_PASS, "");
	}

	/** Optional JDBC driver class; {@code null} relies on driver auto-registration. */
	public String getDbDriver() {
		return getOptional(K_DB_DRIVER, null);
	}

	public int getDbConnectRetries() {
		return Math.max(0, getInt(K_DB_CONNECT_RETRIES, DEFAULT_CONNECT_RETRIES));
	}

	/** Rows per JDBC batch during bulk loads. */
	public int getImportBatchSize() {
		return getPositiveInt(K_IMPORT_BATCH_SIZE, DEFAULT_BATCH_SIZE);
	}

	/** Chunks buffered between the file reader and the database writer. */
	public int getImportQueueCapacity() {
		return getPositiveInt(K_IMPORT_QUEUE_CAPACITY, DEFAULT_QUEUE_CAPACITY);
	}

	public int getSearchDefaultLimit() {
		return getPositiveInt(K_SEARCH_DEFAULT_LIMIT, DEFAULT_SEARCH_LIMIT);
	}

	public int getSearchMaxLimit() {
		return getPositiveInt(K_SEARCH_MAX_LIMIT, DEFAULT_SEARCH_MAX_LIMIT);
	}

	// -------------------------- Internals --------------------------------------

	private void loadFromClasspath(String resource) {
		try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
			if (in == null) {
				Logger.error("Unable to find resource on classpath: {}", resource);
				return;
			}
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from classpath: {} :: {}", resource, ex.getMessage());
		}
	}

	private void loadFromFile(Path file) {
		try (InputStream in = Files.newInputStream(file)) {
			properties.load(in);
		} catch (Exception ex) {
			Logger.error("Failed to load properties from file: {} :: {}", file, ex.getMessage());
		}
	}

	private String getRequired(String key) {
		String v = getOptional(key, null);
		if (v == null) {
			throw new IllegalStateException("Missing required property: " + key);
		}
		return v;
	}

	private String getOptional(String key, String defaultVal) {
		String v = properties.getProperty(key);
		if (v == null)
			return defaultVal;
		v = v.trim();
		return v.isEmpty() ? defaultVal : v;
	}

	private int getInt(String key, int defaultVal) {
		String raw = getOptional(key, null);
		if (raw == null)
			return defaultVal;
		Integer val = parseIntOrNull(raw);
		if (val == null) {
			Logger.warn("Invalid integer for {}: '{}'. Using default {}", key, raw, defaultVal);
			return defaultVal;
		}
		return val;
	}

	private int getPositiveInt(String key, int defaultVal) {
		int val = getInt(key, defaultVal);
		return val > 0 ? val : defaultVal;
	}

	private static Integer parseIntOrNull(String raw) {
		try {
			return Integer.parseInt(raw.trim());
		} catch (NumberFormatException nfe) {
			return null;
		}
	}

	private void requireNonBlank(String key, List<String> issues) {
		if (getOptional(key, null) == null) {
			issues.add("Missing required property: " + key);
		}
	}

	private void requirePositiveIfSet(String key, List<String> issues) {
		String raw = getOptional(key, null);
		if (raw == null)
			return;
		Integer val = parseIntOrNull(raw);
		if (val == null || val <= 0) {
			issues.add(key + " must be a positive integer: '" + raw + "'");
		}
	}
}
