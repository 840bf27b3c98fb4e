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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.DictionaryException.ErrorKind;
import org.pvcoder.dict.ingest.DelimitedFileParser;
import org.pvcoder.dict.ingest.FileLayout;
import org.pvcoder.dict.ingest.MeddraLayouts;
import org.pvcoder.dict.ingest.ParsedFile;
import org.pvcoder.dict.ingest.WhoDrugLayouts;
import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.DistributionFile;
import org.pvcoder.dict.store.BulkLoader;
import org.pvcoder.dict.store.LoadTarget;
import org.pvcoder.dict.store.MeddraTables;
import org.pvcoder.dict.store.WhoDrugTables;
import org.pvcoder.dict.util.Logger;

/**
 * The ordered file-to-table steps of one dictionary's import. Term files come
 * before the relationship files that reference their codes.
 */
public final class ImportPlan {

	/** One distribution file parsed with a layout and loaded into a table. */
	public static final class Step<T> {

		private final DistributionFile file;
		private final FileLayout<T> layout;
		private final LoadTarget<T> target;

		Step(DistributionFile file, FileLayout<T> layout, LoadTarget<T> target) {
			this.file = file;
			this.layout = layout;
			this.target = target;
		}

		public DistributionFile getFile() {
			return file;
		}

		public LoadTarget<T> getTarget() {
			return target;
		}

		/**
		 * Parses and loads one file in one transaction.
		 *
		 * @return rows loaded
		 * @throws DictionaryException UNSUPPORTED_FORMAT when the file has lines but none parse
		 */
		long run(BulkLoader loader, long versionId, Path path, ImportProgressTracker tracker) {
			ParsedFile<T> parsed = DelimitedFileParser.open(path, layout);
			try {
				long loaded = loader.load(versionId, parsed, target, tracker::recordsLoaded);
				long skipped = parsed.getSkippedLines();
				tracker.linesSkipped(skipped);
				if (loaded == 0 && skipped > 0) {
					throw new DictionaryException(ErrorKind.UNSUPPORTED_FORMAT,
							"none of " + skipped + " lines match the " + layout.getName() + " layout");
				}
				if (skipped > 0) {
					Logger.warn("Skipped {} malformed lines in {}", skipped, path.getFileName());
				}
				return loaded;
			} finally {
				try {
					parsed.close();
				} catch (IOException ex) {
					Logger.warn("Could not close {}: {}", path, ex.getMessage());
				}
			}
		}
	}

	private static final List<DistributionFile> WHODRUG_DISCOVERY_ORDER = List.of(
			DistributionFile.WHODRUG_PRODUCT_INGREDIENTS,
			DistributionFile.WHODRUG_INGREDIENTS,
			DistributionFile.WHODRUG_ATC,
			DistributionFile.WHODRUG_PRODUCTS);

	private final DictionaryType dictionary;
	private final List<Step<?>> steps;

	private ImportPlan(DictionaryType dictionary, List<Step<?>> steps) {
		this.dictionary = dictionary;
		this.steps = List.copyOf(steps);
	}

	public static ImportPlan forDictionary(DictionaryType dictionary) {
		return dictionary == DictionaryType.MEDDRA ? meddra() : whoDrug();
	}

	static ImportPlan meddra() {
		List<Step<?>> steps = new ArrayList<>();
		steps.add(new Step<>(DistributionFile.MEDDRA_SOC, MeddraLayouts.SOC, MeddraTables.SOC));
		steps.add(new Step<>(DistributionFile.MEDDRA_HLGT, MeddraLayouts.HLGT, MeddraTables.HLGT));
		steps.add(new Step<>(DistributionFile.MEDDRA_HLT, MeddraLayouts.HLT, MeddraTables.HLT));
		steps.add(new Step<>(DistributionFile.MEDDRA_PT, MeddraLayouts.PT, MeddraTables.PT));
		steps.add(new Step<>(DistributionFile.MEDDRA_LLT, MeddraLayouts.LLT, MeddraTables.LLT));
		steps.add(new Step<>(DistributionFile.MEDDRA_SOC_HLGT, MeddraLayouts.SOC_HLGT, MeddraTables.SOC_HLGT));
		steps.add(new Step<>(DistributionFile.MEDDRA_HLGT_HLT, MeddraLayouts.HLGT_HLT, MeddraTables.HLGT_HLT));
		steps.add(new Step<>(DistributionFile.MEDDRA_HLT_PT, MeddraLayouts.HLT_PT, MeddraTables.HLT_PT));
		return new ImportPlan(DictionaryType.MEDDRA, steps);
	}

	static ImportPlan whoDrug() {
		List<Step<?>> steps = new ArrayList<>();
		steps.add(new Step<>(DistributionFile.WHODRUG_ATC, WhoDrugLayouts.ATC, WhoDrugTables.ATC));
		steps.add(new Step<>(DistributionFile.WHODRUG_INGREDIENTS, WhoDrugLayouts.INGREDIENTS,
				WhoDrugTables.INGREDIENTS));
		steps.add(new Step<>(DistributionFile.WHODRUG_PRODUCTS, WhoDrugLayouts.PRODUCTS, WhoDrugTables.PRODUCTS));
		steps.add(new Step<>(DistributionFile.WHODRUG_PRODUCT_INGREDIENTS, WhoDrugLayouts.PRODUCT_INGREDIENTS,
				WhoDrugTables.PRODUCT_INGREDIENTS));
		return new ImportPlan(DictionaryType.WHODRUG, steps);
	}

	public DictionaryType getDictionary() {
		return dictionary;
	}

	public List<Step<?>> getSteps() {
		return steps;
	}

	/**
	 * Pairs each step with its file, in load order, checking every path before
	 * anything is written. Absent optional files are left out.
	 *
	 * @throws DictionaryException UNSUPPORTED_FORMAT for another dictionary's file,
	 *                             FILE_NOT_FOUND listing every missing required file
	 */
	public Map<Step<?>, Path> schedule(Map<DistributionFile, Path> files) {
		if (files == null) {
			throw new IllegalArgumentException("File paths are required");
		}
		for (DistributionFile f : files.keySet()) {
			if (f.getDictionary() != dictionary) {
				throw new DictionaryException(ErrorKind.UNSUPPORTED_FORMAT, f.getDefaultFileName() + " belongs to "
						+ f.getDictionary().getDisplayName() + ", not " + dictionary.getDisplayName());
			}
		}

		Map<Step<?>, Path> scheduled = new LinkedHashMap<>();
		List<String> missing = new ArrayList<>();
		for (Step<?> step : steps) {
			Path path = files.get(step.getFile());
			boolean readable = path != null && Files.isRegularFile(path) && Files.isReadable(path);
			if (readable) {
				scheduled.put(step, path);
			} else if (step.getFile().isRequired()) {
				missing.add(step.getFile().getDefaultFileName() + (path == null ? "" : " (" + path + ")"));
			} else if (path != null) {
				Logger.warn("Optional file {} is not readable and will be skipped: {}",
						step.getFile().getDefaultFileName(), path);
			}
		}
		if (!missing.isEmpty()) {
			throw new DictionaryException(ErrorKind.FILE_NOT_FOUND,
					"Missing or unreadable " + dictionary.getDisplayName() + " files: " + String.join(", ", missing));
		}
		return scheduled;
	}

	/**
	 * Finds the distribution files in {@code dir}: exact names for MedDRA, name
	 * patterns for WHO Drug. Each directory entry is claimed by at most one file.
	 */
	public Map<DistributionFile, Path> discover(Path dir) {
		if (dir == null || !Files.isDirectory(dir)) {
			throw new DictionaryException(ErrorKind.FILE_NOT_FOUND, "Not a directory: " + dir);
		}
		List<Path> entries;
		try (Stream<Path> listing = Files.list(dir)) {
			entries = listing.filter(Files::isRegularFile).sorted().toList();
		} catch (IOException ex) {
			throw new DictionaryException(ErrorKind.FILE_NOT_FOUND, "Cannot list " + dir + ": " + ex.getMessage(), ex);
		}

		List<DistributionFile> order = dictionary == DictionaryType.WHODRUG ? WHODRUG_DISCOVERY_ORDER
				: DistributionFile.forDictionary(dictionary);
		Map<DistributionFile, Path> found = new EnumMap<>(DistributionFile.class);
		Set<Path> claimed = new HashSet<>();
		for (DistributionFile file : order) {
			for (Path entry : entries) {
				if (!claimed.contains(entry) && file.matchesFileName(entry.getFileName().toString())) {
					found.put(file, entry);
					claimed.add(entry);
					break;
				}
			}
		}
		Logger.debug("Discovered {} {} files in {}", found.size(), dictionary.getDisplayName(), dir);
		return found;
	}
}
