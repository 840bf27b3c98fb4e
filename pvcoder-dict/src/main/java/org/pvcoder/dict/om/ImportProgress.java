package org.pvcoder.dict.om;

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

import lombok.Value;
import lombok.With;

/**
 * Polled snapshot of the running (or last) import. {@code error} keeps the first
 * failure message, prefixed with the file that failed.
 */
@Value
@With
public class ImportProgress {

	DictionaryType dictionary;
	Long versionId;
	ImportStatus status;
	String currentFile;
	int filesProcessed;
	int totalFiles;
	long recordsImported;
	long linesSkipped;
	String error;

	public static ImportProgress starting(DictionaryType dictionary, int totalFiles) {
		return new ImportProgress(dictionary, null, ImportStatus.PENDING, null, 0, totalFiles, 0L, 0L, null);
	}
}
