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

import java.sql.PreparedStatement;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.HierarchyLevel;
import org.pvcoder.dict.om.HierarchyNode;
import org.pvcoder.dict.om.VersionedCode;
import org.pvcoder.dict.util.Db;

/** Shared plumbing for the two hierarchy stores. */
abstract class AbstractHierarchyStore implements HierarchyStore {

	/** LIKE escape character used by every pattern built here. */
	static final String LIKE_ESCAPE = " ESCAPE '!'";

	protected final DictionaryDatabase database;
	private final DictionaryType dictionary;

	AbstractHierarchyStore(DictionaryDatabase database, DictionaryType dictionary) {
		this.database = database;
		this.dictionary = dictionary;
	}

	@Override
	public DictionaryType getDictionary() {
		return dictionary;
	}

	/** Escapes {@code !}, {@code %} and {@code _} so they match literally. */
	static String escapeLike(String s) {
		return StringUtils.replaceEach(s, new String[] { "!", "%", "_" }, new String[] { "!!", "!%", "!_" });
	}

	static String containsPattern(String normalizedQuery) {
		return "%" + escapeLike(normalizedQuery) + "%";
	}

	static String prefixPattern(String normalizedQuery) {
		return escapeLike(normalizedQuery) + "%";
	}

	void checkLevel(HierarchyLevel level) {
		if (level == null || level.getDictionary() != dictionary) {
			throw new IllegalArgumentException(level + " is not a " + dictionary.getDisplayName() + " level");
		}
	}

	/** MedDRA codes that are not integers cannot exist, so lookups short-circuit. */
	static boolean isBindable(HierarchyLevel level, VersionedCode key) {
		return key != null && StringUtils.isNotBlank(key.getCode())
				&& (!level.isNumericCode() || (key.getCode().length() <= 9 && StringUtils.isNumeric(key.getCode())));
	}

	static void bindCode(PreparedStatement ps, int index, HierarchyLevel level, String code) throws Exception {
		if (level.isNumericCode()) {
			ps.setInt(index, Integer.parseInt(code));
		} else {
			ps.setString(index, code);
		}
	}

	List<HierarchyNode> nodes(String sql, Db.ParamSetter params, Db.RowMapper<HierarchyNode> mapper) {
		return database.withConnection(conn -> Db.runQuery(conn, sql, params, mapper));
	}

	Optional<HierarchyNode> node(String sql, Db.ParamSetter params, Db.RowMapper<HierarchyNode> mapper) {
		return database.withConnection(conn -> Db.queryOne(conn, sql, params, mapper));
	}

	/** Binds version id and code as parameters 1 and 2. */
	static Db.ParamSetter versionAndCode(HierarchyLevel level, VersionedCode key) {
		return ps -> {
			ps.setLong(1, key.getVersionId());
			bindCode(ps, 2, level, key.getCode());
		};
	}
}
