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

import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.ImportProgress;
import org.pvcoder.dict.om.ImportStatus;

/**
 * Holds the progress of the running (or last) import. Writers are the import
 * thread; readers poll {@link #snapshot()} from anywhere and get an immutable
 * copy.
 */
public class ImportProgressTracker {

	private final DictionaryType dictionary;
	private volatile ImportProgress current;

	public ImportProgressTracker(DictionaryType dictionary) {
		this.dictionary = dictionary;
	}

	/** @return the latest snapshot, or {@code null} before the first import */
	public ImportProgress snapshot() {
		return current;
	}

	synchronized void start() {
		current = ImportProgress.starting(dictionary, 0);
	}

	synchronized void planned(int totalFiles) {
		current = current.withTotalFiles(totalFiles);
	}

	synchronized void versionCreated(long versionId) {
		current = current.withVersionId(versionId);
	}

	synchronized void beginFile(String fileName, ImportStatus status) {
		current = current.withCurrentFile(fileName).withStatus(status);
	}

	synchronized void recordsLoaded(long count) {
		current = current.withRecordsImported(current.getRecordsImported() + count);
	}

	synchronized void linesSkipped(long count) {
		if (count > 0) {
			current = current.withLinesSkipped(current.getLinesSkipped() + count);
		}
	}

	synchronized void fileDone() {
		current = current.withFilesProcessed(current.getFilesProcessed() + 1);
	}

	synchronized void finalizing() {
		current = current.withStatus(ImportStatus.FINALIZING).withCurrentFile(null);
	}

	synchronized void completed() {
		current = current.withStatus(ImportStatus.COMPLETED);
	}

	/** Marks the import failed, keeping the first error message if one was already recorded. */
	synchronized void failed(String message) {
		if (current == null) {
			current = ImportProgress.starting(dictionary, 0);
		}
		String error = current.getError() != null ? current.getError() : message;
		current = current.withStatus(ImportStatus.FAILED).withError(error);
	}
}
