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

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.DictionaryVersion;
import org.pvcoder.dict.om.LoadState;
import org.pvcoder.dict.util.Db;

/**
 * SQL for one dictionary type's version table. The active flag lives only in
 * this table and is changed only inside a transaction.
 */
public class VersionRepository {

	private static final String COLUMNS =
			"id, label, release_date, import_date, is_active, load_state, leaf_count, term_count, imported_by";

	private final DictionaryDatabase database;
	private final DictionaryType dictionary;
	private final String table;

	public VersionRepository(DictionaryDatabase database, DictionaryType dictionary) {
		this.database = database;
		this.dictionary = dictionary;
		this.table = dictionary.getVersionTable();
	}

	public DictionaryType getDictionary() {
		return dictionary;
	}

	public long insert(String label, LocalDate releaseDate, String importedBy) {
		String sql = "INSERT INTO " + table
				+ " (label, release_date, import_date, is_active, load_state, leaf_count, term_count, imported_by)"
				+ " VALUES (?, ?, ?, FALSE, ?, 0, 0, ?)";
		return database.withConnection(conn -> Db.insertReturningKey(conn, sql, ps -> {
			ps.setString(1, label);
			if (releaseDate == null) {
				ps.setNull(2, Types.DATE);
			} else {
				ps.setDate(2, Date.valueOf(releaseDate));
			}
			ps.setTimestamp(3, Timestamp.from(Instant.now()));
			ps.setString(4, LoadState.PROVISIONING.name());
			ps.setString(5, importedBy);
		}));
	}

	public Optional<DictionaryVersion> findById(long id) {
		String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE id = ?";
		return database.withConnection(conn -> Db.queryOne(conn, sql, ps -> ps.setLong(1, id), this::map));
	}

	public Optional<DictionaryVersion> findActive() {
		String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE is_active = TRUE";
		return database.withConnection(conn -> Db.queryOne(conn, sql, null, this::map));
	}

	/** Newest label first; ties by id, newest first. */
	public List<DictionaryVersion> findAll() {
		String sql = "SELECT " + COLUMNS + " FROM " + table + " ORDER BY label DESC, id DESC";
		return database.withConnection(conn -> Db.runQuery(conn, sql, null, this::map));
	}

	/** Clears every active flag and sets the one on {@code id}, atomically. */
	public void activate(long id) {
		database.inTransaction(conn -> {
			Db.execute(conn, "UPDATE " + table + " SET is_active = FALSE WHERE is_active = TRUE", null);
			int updated = Db.execute(conn, "UPDATE " + table + " SET is_active = TRUE WHERE id = ?",
					ps -> ps.setLong(1, id));
			if (updated != 1) {
				throw DictionaryException.notFound(dictionary.getDisplayName() + " version not found: " + id);
			}
			return null;
		});
	}

	/**
	 * Deletes the version's relationship rows, then its term rows, then the version
	 * row, in one transaction. The version row is only removed while inactive;
	 * otherwise everything rolls back.
	 *
	 * @return whether the version was deleted
	 */
	public boolean deleteCascade(long id) {
		List<String> dataTables = dictionary == DictionaryType.MEDDRA ? MeddraTables.DELETE_ORDER
				: WhoDrugTables.DELETE_ORDER;
		try {
			return database.inTransaction(conn -> {
				for (String dataTable : dataTables) {
					Db.execute(conn, "DELETE FROM " + dataTable + " WHERE version_id = ?", ps -> ps.setLong(1, id));
				}
				int deleted = Db.execute(conn, "DELETE FROM " + table + " WHERE id = ? AND is_active = FALSE",
						ps -> ps.setLong(1, id));
				if (deleted != 1) {
					throw DictionaryException.invalidState("Version " + id + " is active or no longer exists");
				}
				return Boolean.TRUE;
			});
		} catch (DictionaryException ex) {
			if (ex.getKind() == DictionaryException.ErrorKind.INVALID_STATE) {
				return false;
			}
			throw ex;
		}
	}

	public void updateLoadState(long id, LoadState state) {
		database.withConnection(conn -> Db.execute(conn, "UPDATE " + table + " SET load_state = ? WHERE id = ?", ps -> {
			ps.setString(1, state.name());
			ps.setLong(2, id);
		}));
	}

	/** Recomputes leaf and term counts from the loaded rows. */
	public void updateCounts(long id) {
		String leafTable = dictionary == DictionaryType.MEDDRA ? MeddraTables.LEAF_TABLE : WhoDrugTables.LEAF_TABLE;
		String termTable = dictionary == DictionaryType.MEDDRA ? MeddraTables.TERM_TABLE : WhoDrugTables.TERM_TABLE;
		String sql = "UPDATE " + table
				+ " SET leaf_count = (SELECT COUNT(*) FROM " + leafTable + " WHERE version_id = ?),"
				+ " term_count = (SELECT COUNT(*) FROM " + termTable + " WHERE version_id = ?)"
				+ " WHERE id = ?";
		database.withConnection(conn -> Db.execute(conn, sql, ps -> {
			ps.setLong(1, id);
			ps.setLong(2, id);
			ps.setLong(3, id);
		}));
	}

	/** Counts active versions; used to check the single-active rule. */
	public int countActive() {
		String sql = "SELECT COUNT(*) FROM " + table + " WHERE is_active = TRUE";
		return database.withConnection(conn -> Db.runQuery(conn, sql, null, rs -> rs.getInt(1)).get(0));
	}

	private DictionaryVersion map(ResultSet rs) throws Exception {
		Date release = rs.getDate("release_date");
		Timestamp imported = rs.getTimestamp("import_date");
		return new DictionaryVersion(
				rs.getLong("id"),
				dictionary,
				rs.getString("label"),
				release == null ? null : release.toLocalDate(),
				imported == null ? null : imported.toInstant(),
				rs.getBoolean("is_active"),
				LoadState.valueOf(rs.getString("load_state")),
				rs.getInt("leaf_count"),
				rs.getInt("term_count"),
				rs.getString("imported_by"));
	}
}
