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

import java.util.List;

import org.pvcoder.dict.conf.ConfigLoader;
import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.processing.DictionaryImporter;
import org.pvcoder.dict.processing.ImportPlan;
import org.pvcoder.dict.processing.SearchEngine;
import org.pvcoder.dict.processing.VersionManager;
import org.pvcoder.dict.store.BulkLoader;
import org.pvcoder.dict.store.DictionaryDatabase;
import org.pvcoder.dict.store.HierarchyStore;
import org.pvcoder.dict.store.MeddraHierarchyStore;
import org.pvcoder.dict.store.SchemaInitializer;
import org.pvcoder.dict.store.VersionRepository;
import org.pvcoder.dict.store.WhoDrugHierarchyStore;
import org.pvcoder.dict.util.Logger;

/**
 * Wires both dictionaries against one database. The schema is created on
 * construction if it does not exist yet.
 */
public class TerminologyEngine {

	private final DictionaryDatabase database;
	private final TerminologyDictionary meddra;
	private final WhoDrugDictionary whoDrug;

	/**
	 * @throws IllegalStateException when {@link ConfigLoader#validate()} reports problems
	 */
	public TerminologyEngine(ConfigLoader cfg) {
		List<String> issues = cfg.validate();
		if (!issues.isEmpty()) {
			throw new IllegalStateException("Invalid configuration: " + String.join("; ", issues));
		}
		this.database = DictionaryDatabase.fromConfig(cfg);
		SchemaInitializer.apply(database);

		BulkLoader loader = new BulkLoader(database, cfg.getImportBatchSize(), cfg.getImportQueueCapacity());
		int defaultLimit = cfg.getSearchDefaultLimit();
		int maxLimit = cfg.getSearchMaxLimit();

		VersionManager meddraVersions = new VersionManager(new VersionRepository(database, DictionaryType.MEDDRA));
		HierarchyStore meddraStore = new MeddraHierarchyStore(database);
		this.meddra = new TerminologyDictionary(meddraStore, meddraVersions,
				new DictionaryImporter(ImportPlan.forDictionary(DictionaryType.MEDDRA), meddraVersions, loader),
				new SearchEngine(meddraStore, meddraVersions, defaultLimit, maxLimit));

		VersionManager whoDrugVersions = new VersionManager(new VersionRepository(database, DictionaryType.WHODRUG));
		WhoDrugHierarchyStore whoDrugStore = new WhoDrugHierarchyStore(database);
		this.whoDrug = new WhoDrugDictionary(whoDrugStore, whoDrugVersions,
				new DictionaryImporter(ImportPlan.forDictionary(DictionaryType.WHODRUG), whoDrugVersions, loader),
				new SearchEngine(whoDrugStore, whoDrugVersions, defaultLimit, maxLimit));

		Logger.info("Terminology engine ready on {}", database.getUrl());
	}

	public TerminologyDictionary meddra() {
		return meddra;
	}

	public WhoDrugDictionary whoDrug() {
		return whoDrug;
	}

	public TerminologyDictionary dictionary(DictionaryType type) {
		return type == DictionaryType.MEDDRA ? meddra : whoDrug;
	}

	public DictionaryDatabase getDatabase() {
		return database;
	}
}
