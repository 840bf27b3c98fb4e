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

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.DictionaryVersion;
import org.pvcoder.dict.om.LoadState;
import org.pvcoder.dict.store.VersionRepository;
import org.pvcoder.dict.util.Logger;

/**
 * Lifecycle of a dictionary version:
 * {@code PROVISIONING -> LOADED (inactive) -> [activate] -> LOADED (active)}.
 * Activating another version returns the previous one to inactive. Deletion is
 * terminal and only legal while inactive.
 */
public class VersionManager {

	private final VersionRepository repository;

	public VersionManager(VersionRepository repository) {
		this.repository = repository;
	}

	public DictionaryType getDictionary() {
		return repository.getDictionary();
	}

	/** Allocates an inactive, provisioning version with zero counts. */
	public long create(String label, LocalDate releaseDate, String importedBy) {
		if (StringUtils.isBlank(label)) {
			throw new IllegalArgumentException("Version label is required");
		}
		long id = repository.insert(label.trim(), releaseDate, StringUtils.trimToNull(importedBy));
		Logger.info("Created {} version {} ({})", getDictionary().getDisplayName(), id, label.trim());
		return id;
	}

	/**
	 * Makes {@code id} the only active version of this dictionary.
	 *
	 * @throws DictionaryException NOT_FOUND for an unknown id, INVALID_STATE when the version is not loaded
	 */
	public void activate(long id) {
		DictionaryVersion version = require(id);
		if (version.getLoadState() != LoadState.LOADED) {
			throw DictionaryException.invalidState("Version " + id + " is " + version.getLoadState()
					+ " and cannot be activated");
		}
		if (version.isActive()) {
			Logger.debug("{} version {} is already active", getDictionary().getDisplayName(), id);
			return;
		}
		repository.activate(id);
		Logger.info("Activated {} version {} ({})", getDictionary().getDisplayName(), id, version.getLabel());
	}

	/**
	 * Deletes an inactive version and all of its rows.
	 *
	 * @throws DictionaryException INVALID_STATE for an unknown or active version
	 */
	public void delete(long id) {
		DictionaryVersion version = repository.findById(id)
				.orElseThrow(() -> DictionaryException.invalidState("Unknown version: " + id));
		if (version.isActive()) {
			throw DictionaryException.invalidState("Version " + id + " is active and cannot be deleted");
		}
		if (!repository.deleteCascade(id)) {
			throw DictionaryException.invalidState("Version " + id + " became active and was not deleted");
		}
		Logger.info("Deleted {} version {} ({})", getDictionary().getDisplayName(), id, version.getLabel());
	}

	public Optional<DictionaryVersion> getActive() {
		return repository.findActive();
	}

	public Optional<DictionaryVersion> getById(long id) {
		return repository.findById(id);
	}

	public List<DictionaryVersion> list() {
		return repository.findAll();
	}

	/** @throws DictionaryException NOT_FOUND for an unknown id */
	public DictionaryVersion require(long id) {
		return repository.findById(id).orElseThrow(
				() -> DictionaryException.notFound(getDictionary().getDisplayName() + " version not found: " + id));
	}

	/**
	 * The explicit version when given, otherwise the active one.
	 *
	 * @throws DictionaryException NOT_FOUND for an unknown explicit id, NO_ACTIVE_VERSION when nothing is active
	 */
	public DictionaryVersion resolve(Long versionId) {
		if (versionId != null) {
			return require(versionId);
		}
		return getActive().orElseThrow(() -> new DictionaryException(DictionaryException.ErrorKind.NO_ACTIVE_VERSION,
				"No active " + getDictionary().getDisplayName() + " version"));
	}

	/** The explicit version id when given, otherwise the active one's; empty when neither exists. */
	public Optional<Long> effectiveVersionId(Long versionId) {
		if (versionId != null) {
			return Optional.of(versionId);
		}
		return getActive().map(DictionaryVersion::getId);
	}

	void markLoaded(long id) {
		repository.updateLoadState(id, LoadState.LOADED);
	}

	void markFailed(long id) {
		repository.updateLoadState(id, LoadState.FAILED);
	}

	void recomputeCounts(long id) {
		repository.updateCounts(id);
	}
}
