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

import java.util.List;
import java.util.Locale;

/**
 * The two supported terminologies. Each keeps its own version table, so the
 * active version is tracked per type.
 */
public enum DictionaryType {

	MEDDRA("meddra_versions", "MedDRA"),
	WHODRUG("whodrug_versions", "WHO Drug");

	private final String versionTable;
	private final String displayName;

	DictionaryType(String versionTable, String displayName) {
		this.versionTable = versionTable;
		this.displayName = displayName;
	}

	public String getVersionTable() {
		return versionTable;
	}

	public String getDisplayName() {
		return displayName;
	}

	/** Root level for browsing and path enumeration. */
	public HierarchyLevel topLevel() {
		return this == MEDDRA ? HierarchyLevel.SOC : HierarchyLevel.ATC1;
	}

	/**
	 * WHO Drug products need not have a usable ATC code, so coding accepts a path
	 * that stops short of ATC level 1. MedDRA terms always reach a SOC.
	 */
	public boolean codesPartialPaths() {
		return this == WHODRUG;
	}

	/** Levels tried, in order, when a code is resolved without an explicit level. */
	public List<HierarchyLevel> codingLevels() {
		return this == MEDDRA
				? List.of(HierarchyLevel.LLT, HierarchyLevel.PT)
				: List.of(HierarchyLevel.PRODUCT, HierarchyLevel.INGREDIENT);
	}

	/** Accepts {@code meddra}, {@code whodrug} or {@code who-drug}, case-insensitively. */
	public static DictionaryType parse(String s) {
		if (s == null) {
			throw new IllegalArgumentException("Dictionary type is required");
		}
		String norm = s.trim().toUpperCase(Locale.ROOT).replace("-", "").replace("_", "").replace(" ", "");
		for (DictionaryType t : values()) {
			if (t.name().equals(norm)) {
				return t;
			}
		}
		throw new IllegalArgumentException("Unknown dictionary type: " + s);
	}
}
