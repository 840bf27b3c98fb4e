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

import java.util.Locale;

/**
 * Levels of both hierarchies together with the table that stores their nodes.
 * <p>
 * MedDRA runs SOC, HLGT, HLT, PT, LLT. WHO Drug runs ATC1 to ATC5, then
 * products, then ingredients. All ATC levels share {@code whodrug_atc} and are
 * told apart by {@code atc_level}.
 */
public enum HierarchyLevel {

	SOC(DictionaryType.MEDDRA, "meddra_soc", "soc_code", "soc_name", true, 0),
	HLGT(DictionaryType.MEDDRA, "meddra_hlgt", "hlgt_code", "hlgt_name", true, 0),
	HLT(DictionaryType.MEDDRA, "meddra_hlt", "hlt_code", "hlt_name", true, 0),
	PT(DictionaryType.MEDDRA, "meddra_pt", "pt_code", "pt_name", true, 0),
	LLT(DictionaryType.MEDDRA, "meddra_llt", "llt_code", "llt_name", true, 0),

	ATC1(DictionaryType.WHODRUG, "whodrug_atc", "atc_code", "atc_name", false, 1),
	ATC2(DictionaryType.WHODRUG, "whodrug_atc", "atc_code", "atc_name", false, 2),
	ATC3(DictionaryType.WHODRUG, "whodrug_atc", "atc_code", "atc_name", false, 3),
	ATC4(DictionaryType.WHODRUG, "whodrug_atc", "atc_code", "atc_name", false, 4),
	ATC5(DictionaryType.WHODRUG, "whodrug_atc", "atc_code", "atc_name", false, 5),
	PRODUCT(DictionaryType.WHODRUG, "whodrug_product", "drug_code", "drug_name", false, 0),
	INGREDIENT(DictionaryType.WHODRUG, "whodrug_ingredient", "ingredient_id", "ingredient_name", false, 0);

	private final DictionaryType dictionary;
	private final String table;
	private final String codeColumn;
	private final String nameColumn;
	private final boolean numericCode;
	private final int atcLevel;

	HierarchyLevel(DictionaryType dictionary, String table, String codeColumn, String nameColumn,
			boolean numericCode, int atcLevel) {
		this.dictionary = dictionary;
		this.table = table;
		this.codeColumn = codeColumn;
		this.nameColumn = nameColumn;
		this.numericCode = numericCode;
		this.atcLevel = atcLevel;
	}

	public DictionaryType getDictionary() {
		return dictionary;
	}

	public String getTable() {
		return table;
	}

	public String getCodeColumn() {
		return codeColumn;
	}

	public String getNameColumn() {
		return nameColumn;
	}

	/** MedDRA codes are integers; WHO Drug codes are opaque strings. */
	public boolean isNumericCode() {
		return numericCode;
	}

	/** 1-5 for ATC levels, 0 otherwise. */
	public int getAtcLevel() {
		return atcLevel;
	}

	public boolean isAtc() {
		return atcLevel > 0;
	}

	/** The level below this one, or {@code null} for LLT and INGREDIENT. */
	public HierarchyLevel next() {
		switch (this) {
		case SOC: return HLGT;
		case HLGT: return HLT;
		case HLT: return PT;
		case PT: return LLT;
		case ATC1: return ATC2;
		case ATC2: return ATC3;
		case ATC3: return ATC4;
		case ATC4: return ATC5;
		case ATC5: return PRODUCT;
		case PRODUCT: return INGREDIENT;
		default: return null;
		}
	}

	public boolean isLeaf() {
		return next() == null;
	}

	public boolean isTop() {
		return this == dictionary.topLevel();
	}

	public VersionedCode key(long versionId, String code) {
		return VersionedCode.of(versionId, code);
	}

	public static HierarchyLevel atc(int level) {
		switch (level) {
		case 1: return ATC1;
		case 2: return ATC2;
		case 3: return ATC3;
		case 4: return ATC4;
		case 5: return ATC5;
		default: throw new IllegalArgumentException("ATC level out of range: " + level);
		}
	}

	public static HierarchyLevel parse(String s) {
		if (s == null || s.isBlank()) {
			throw new IllegalArgumentException("Hierarchy level is required");
		}
		try {
			return valueOf(s.trim().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException ex) {
			throw new IllegalArgumentException("Unknown hierarchy level: " + s, ex);
		}
	}
}
