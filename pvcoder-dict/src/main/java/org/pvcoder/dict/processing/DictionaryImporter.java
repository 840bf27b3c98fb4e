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

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.commons.lang3.StringUtils;
import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.DictionaryVersion;
import org.pvcoder.dict.om.DistributionFile;
import org.pvcoder.dict.om.ImportProgress;
import org.pvcoder.dict.om.ImportStatus;
import org.pvcoder.dict.store.BulkLoader;
import org.pvcoder.dict.util.Logger;

/**
 * Loads a dictionary release into a new, inactive version.
 *
 * <p>All file paths are checked before the version row is created. Each file is
 * loaded in its own transaction; when one fails the version is left in
 * {@code FAILED} state with whatever earlier files committed, and can be
 * deleted. A successful import never activates the version.</p>
 *
 * <p>Only one import per dictionary runs at a time.</p>
 */
public class DictionaryImporter {

	private final ImportPlan plan;
	private final VersionManager versions;
	private final BulkLoader loader;
	private final ImportProgressTracker tracker;
	private final AtomicBoolean running = new AtomicBoolean();

	public DictionaryImporter(ImportPlan plan, VersionManager versions, BulkLoader loader) {
		if (plan.getDictionary() != versions.getDictionary()) {
			throw new IllegalArgumentException("Import plan is for " + plan.getDictionary()
					+ " but versions are for " + versions.getDictionary());
		}
		this.plan = plan;
		this.versions = versions;
		this.loader = loader;
		this.tracker = new ImportProgressTracker(plan.getDictionary());
	}

	public DictionaryType getDictionary() {
		return plan.getDictionary();
	}

	/** @return the running or last import's progress, {@code null} if none has started */
	public ImportProgress getProgress() {
		return tracker.snapshot();
	}

	public boolean isRunning() {
		return running.get();
	}

	/** Imports the distribution files found in {@code directory}. */
	public DictionaryVersion importDirectory(String label, LocalDate releaseDate, String importedBy, Path directory) {
		return importFiles(label, releaseDate, importedBy, plan.discover(directory));
	}

	/**
	 * Imports the given distribution files into a new version.
	 *
	 * @return the loaded, inactive version with its leaf and term counts
	 * @throws DictionaryException FILE_NOT_FOUND or UNSUPPORTED_FORMAT before anything is written,
	 *                             INVALID_STATE when another import is running, otherwise the
	 *                             failing file's kind with the file name prefixed to the message
	 */
	public DictionaryVersion importFiles(String label, LocalDate releaseDate, String importedBy,
			Map<DistributionFile, Path> files) {
		if (StringUtils.isBlank(label)) {
			throw new IllegalArgumentException("Version label is required");
		}
		String name = getDictionary().getDisplayName();
		if (!running.compareAndSet(false, true)) {
			throw DictionaryException.invalidState("A " + name + " import is already running");
		}

		Long versionId = null;
		long started = System.currentTimeMillis();
		try {
			tracker.start();
			Map<ImportPlan.Step<?>, Path> scheduled = plan.schedule(files);
			tracker.planned(scheduled.size());

			versionId = versions.create(label, releaseDate, importedBy);
			tracker.versionCreated(versionId);

			for (Map.Entry<ImportPlan.Step<?>, Path> entry : scheduled.entrySet()) {
				loadFile(versionId, entry.getKey(), entry.getValue());
			}

			tracker.finalizing();
			versions.recomputeCounts(versionId);
			versions.markLoaded(versionId);
			tracker.completed();

			DictionaryVersion version = versions.require(versionId);
			Logger.info("{} version {} ({}) imported in {} ms: {} leaf terms, {} terms", name, versionId,
					version.getLabel(), System.currentTimeMillis() - started, version.getLeafCount(),
					version.getTermCount());
			return version;
		} catch (RuntimeException ex) {
			tracker.failed(ex.getMessage());
			if (versionId != null) {
				markFailed(versionId, ex);
			}
			Logger.error("{} import '{}' failed: {}", name, label, ex.getMessage());
			throw ex;
		} finally {
			running.set(false);
		}
	}

	private void loadFile(long versionId, ImportPlan.Step<?> step, Path path) {
		String fileName = path.getFileName().toString();
		ImportStatus status = step.getFile().isRelationship() ? ImportStatus.LOADING_RELATIONSHIPS
				: ImportStatus.LOADING_TERMS;
		tracker.beginFile(fileName, status);
		Logger.info("Loading {} into {}", fileName, step.getTarget().getTable());
		long rows;
		try {
			rows = step.run(loader, versionId, path, tracker);
		} catch (DictionaryException ex) {
			throw new DictionaryException(ex.getKind(), fileName + ": " + ex.getMessage(), ex);
		} catch (RuntimeException ex) {
			throw DictionaryException.storage(fileName + ": " + ex.getMessage(), ex);
		}
		tracker.fileDone();
		Logger.info("Loaded {} rows from {}", rows, fileName);
	}

	private void markFailed(long versionId, RuntimeException cause) {
		try {
			versions.markFailed(versionId);
		} catch (RuntimeException ex) {
			cause.addSuppressed(ex);
			Logger.warn("Could not mark version {} as failed: {}", versionId, ex.getMessage());
		}
	}
}
