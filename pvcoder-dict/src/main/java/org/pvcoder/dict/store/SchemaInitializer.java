package org.pvcoder.dict.store;

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

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.util.Logger;

/**
 * Applies {@code db/schema.sql}. Every statement is {@code IF NOT EXISTS}, so
 * running it on each start-up is harmless.
 */
public final class SchemaInitializer {

	public static final String SCHEMA_RESOURCE = "db/schema.sql";

	private SchemaInitializer() {
	}

	public static void apply(DictionaryDatabase database) {
		List<String> statements = statements(loadScript());
		database.inTransaction(conn -> {
			try (Statement st = conn.createStatement()) {
				for (String sql : statements) {
					st.execute(sql);
				}
			}
			return null;
		});
		Logger.debug("Dictionary schema ready ({} statements) on {}", statements.size(), database.getUrl());
	}

	/** Splits a script on {@code ;}, dropping comment lines and empty statements. */
	static List<String> statements(String script) {
		StringBuilder body = new StringBuilder();
		for (String line : script.split("\\R")) {
			if (!line.trim().startsWith("--")) {
				body.append(line).append('\n');
			}
		}
		List<String> out = new ArrayList<>();
		for (String part : body.toString().split(";")) {
			if (StringUtils.isNotBlank(part)) {
				out.add(part.trim());
			}
		}
		return out;
	}

	private static String loadScript() {
		try (InputStream in = SchemaInitializer.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
			if (in == null) {
				throw DictionaryException.storage("Schema resource missing from classpath: " + SCHEMA_RESOURCE, null);
			}
			return new String(in.readAllBytes(), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw DictionaryException.storage("Cannot read " + SCHEMA_RESOURCE + ": " + ex.getMessage(), ex);
		}
	}
}
