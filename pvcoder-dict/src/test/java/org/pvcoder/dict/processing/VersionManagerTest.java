package org.pvcoder.dict.processing;

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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.DictionaryException.ErrorKind;
import org.pvcoder.dict.DictionaryFixtures;
import org.pvcoder.dict.ingest.SocRecord;
import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.DictionaryVersion;
import org.pvcoder.dict.om.LoadState;
import org.pvcoder.dict.store.BulkLoader;
import org.pvcoder.dict.store.DictionaryDatabase;
import org.pvcoder.dict.store.MeddraTables;
import org.pvcoder.dict.store.VersionRepository;
import org.pvcoder.dict.util.Db;

class VersionManagerTest {

	private DictionaryDatabase db;
	private VersionRepository repository;
	private VersionManager versions;

	@BeforeEach
	void setUp() {
		db = DictionaryFixtures.database("versions");
		repository = new VersionRepository(db, DictionaryType.MEDDRA);
		versions = new VersionManager(repository);
	}

	private long loadedVersion(String label) {
		long id = versions.create(label, LocalDate.of(2024, 3, 1), "tester");
		new BulkLoader(db, 10, 1).load(id, List.of(new SocRecord(10007541, "Cardiac disorders", "Card")),
				MeddraTables.SOC, null);
		versions.recomputeCounts(id);
		versions.markLoaded(id);
		return id;
	}

	private int socRows(long versionId) {
		return db.withConnection(conn -> Db.runQuery(conn, "SELECT COUNT(*) FROM meddra_soc WHERE version_id = ?",
				ps -> ps.setLong(1, versionId), rs -> rs.getInt(1)).get(0));
	}

	@Test
	@DisplayName("A new version is inactive, provisioning and empty")
	void create_defaults() {
		long id = versions.create(" 27.0 ", null, null);

		DictionaryVersion v = versions.require(id);
		assertEquals("27.0", v.getLabel());
		assertFalse(v.isActive());
		assertEquals(LoadState.PROVISIONING, v.getLoadState());
		assertEquals(0, v.getLeafCount());
		assertEquals(0, v.getTermCount());
		assertEquals(DictionaryType.MEDDRA, v.getDictionary());
	}

	@Test
	void create_requires_label() {
		assertThrows(IllegalArgumentException.class, () -> versions.create("  ", null, null));
	}

	@Test
	@DisplayName("Activating moves the single active flag")
	void single_active_version() {
		long first = loadedVersion("26.1");
		long second = loadedVersion("27.0");

		versions.activate(second);
		versions.activate(first);

		assertEquals(first, versions.getActive().orElseThrow().getId());
		assertFalse(versions.require(second).isActive());
		assertEquals(1, repository.countActive());

		versions.activate(first);
		assertEquals(1, repository.countActive());
	}

	@Test
	void activate_unknown_is_not_found() {
		DictionaryException ex = assertThrows(DictionaryException.class, () -> versions.activate(999));
		assertEquals(ErrorKind.NOT_FOUND, ex.getKind());
	}

	@Test
	@DisplayName("Only loaded versions can be activated")
	void activate_requires_loaded() {
		long provisioning = versions.create("27.0", null, null);
		long failed = versions.create("27.1", null, null);
		versions.markFailed(failed);

		assertEquals(ErrorKind.INVALID_STATE,
				assertThrows(DictionaryException.class, () -> versions.activate(provisioning)).getKind());
		assertEquals(ErrorKind.INVALID_STATE,
				assertThrows(DictionaryException.class, () -> versions.activate(failed)).getKind());
		assertTrue(versions.getActive().isEmpty());
	}

	@Test
	@DisplayName("Deleting the active version fails and leaves its data untouched")
	void delete_active_is_refused() {
		long id = loadedVersion("27.0");
		versions.activate(id);

		DictionaryException ex = assertThrows(DictionaryException.class, () -> versions.delete(id));

		assertEquals(ErrorKind.INVALID_STATE, ex.getKind());
		assertTrue(versions.getById(id).isPresent());
		assertEquals(1, socRows(id));
	}

	@Test
	@DisplayName("Deleting an inactive version removes its rows and nothing else")
	void delete_cascades() {
		long keep = loadedVersion("26.1");
		long drop = loadedVersion("27.0");

		versions.delete(drop);

		assertTrue(versions.getById(drop).isEmpty());
		assertEquals(0, socRows(drop));
		assertEquals(1, socRows(keep));
	}

	@Test
	void delete_unknown_is_invalid_state() {
		assertEquals(ErrorKind.INVALID_STATE,
				assertThrows(DictionaryException.class, () -> versions.delete(42)).getKind());
	}

	@Test
	void list_orders_by_label_descending() {
		versions.create("25.0", null, null);
		versions.create("27.0", null, null);
		versions.create("26.1", null, null);

		List<String> labels = versions.list().stream().map(DictionaryVersion::getLabel).toList();
		assertEquals(List.of("27.0", "26.1", "25.0"), labels);
	}

	@Test
	@DisplayName("Version resolution: explicit id, active, or a typed failure")
	void resolve_versions() {
		assertEquals(ErrorKind.NO_ACTIVE_VERSION,
				assertThrows(DictionaryException.class, () -> versions.resolve(null)).getKind());
		assertEquals(ErrorKind.NOT_FOUND,
				assertThrows(DictionaryException.class, () -> versions.resolve(77L)).getKind());
		assertTrue(versions.effectiveVersionId(null).isEmpty());

		long id = loadedVersion("27.0");
		versions.activate(id);
		assertEquals(id, versions.resolve(null).getId());
		assertEquals(id, versions.effectiveVersionId(null).orElseThrow());
	}
}
