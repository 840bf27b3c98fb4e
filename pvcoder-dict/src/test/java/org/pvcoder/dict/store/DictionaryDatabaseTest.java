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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.DictionaryException.ErrorKind;
import org.pvcoder.dict.DictionaryFixtures;
import org.pvcoder.dict.util.Db;

class DictionaryDatabaseTest {

	private DictionaryDatabase db;

	@BeforeEach
	void setUp() {
		db = DictionaryFixtures.database("connection");
		db.withConnection(conn -> Db.execute(conn, "CREATE TABLE load_note (id INT PRIMARY KEY, note VARCHAR(40))", null));
	}

	private List<String> notes() {
		return db.withConnection(conn -> Db.runQuery(conn, "SELECT note FROM load_note ORDER BY id", null,
				rs -> rs.getString(1)));
	}

	@Test
	@DisplayName("A single update outside a transaction is committed on its own")
	void single_update_commits() {
		int updated = db.withConnection(conn -> Db.execute(conn, "INSERT INTO load_note VALUES (?, ?)", ps -> {
			ps.setInt(1, 1);
			ps.setString(2, "loaded");
		}));

		assertEquals(1, updated);
		assertEquals(List.of("loaded"), notes());
	}

	@Test
	@DisplayName("A failing transaction leaves none of its rows behind")
	void transaction_rolls_back_on_failure() {
		DictionaryException stop = DictionaryException.invalidState("stop");

		DictionaryException ex = assertThrows(DictionaryException.class, () -> db.inTransaction(conn -> {
			Db.execute(conn, "INSERT INTO load_note VALUES (1, 'first')", null);
			Db.execute(conn, "INSERT INTO load_note VALUES (2, 'second')", null);
			throw stop;
		}));

		assertSame(stop, ex);
		assertEquals(List.of(), notes());

		db.inTransaction(conn -> Db.execute(conn, "INSERT INTO load_note VALUES (3, 'kept')", null));
		assertEquals(List.of("kept"), notes());
	}

	@Test
	void sql_failures_surface_as_storage_errors() {
		DictionaryException read = assertThrows(DictionaryException.class,
				() -> db.withConnection(conn -> Db.execute(conn, "INSERT INTO missing_table VALUES (1)", null)));
		assertEquals(ErrorKind.STORAGE, read.getKind());

		DictionaryException write = assertThrows(DictionaryException.class, () -> db.inTransaction(conn -> {
			Db.execute(conn, "INSERT INTO load_note VALUES (4, 'a')", null);
			return Db.execute(conn, "INSERT INTO load_note VALUES (4, 'b')", null);
		}));
		assertEquals(ErrorKind.STORAGE, write.getKind());
		assertEquals(List.of(), notes());
	}
}
