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

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Files making up a vendor distribution, in load order: term files before the
 * relationship files that reference them.
 * <p>
 * MedDRA file names are fixed. WHO Drug distributions vary by vendor, so those
 * files are discovered by name pattern.
 */
public enum DistributionFile {

	MEDDRA_SOC(DictionaryType.MEDDRA, "soc.asc", true, false),
	MEDDRA_HLGT(DictionaryType.MEDDRA, "hlgt.asc", true, false),
	MEDDRA_HLT(DictionaryType.MEDDRA, "hlt.asc", true, false),
	MEDDRA_PT(DictionaryType.MEDDRA, "pt.asc", true, false),
	MEDDRA_LLT(DictionaryType.MEDDRA, "llt.asc", true, false),
	MEDDRA_SOC_HLGT(DictionaryType.MEDDRA, "soc_hlgt.asc", true, true),
	MEDDRA_HLGT_HLT(DictionaryType.MEDDRA, "hlgt_hlt.asc", true, true),
	MEDDRA_HLT_PT(DictionaryType.MEDDRA, "hlt_pt.asc", true, true),

	WHODRUG_ATC(DictionaryType.WHODRUG, "atc.txt", true, false, "atc|anatomical"),
	WHODRUG_INGREDIENTS(DictionaryType.WHODRUG, "ingredients.txt", true, false, "ingredient|substance"),
	WHODRUG_PRODUCTS(DictionaryType.WHODRUG, "products.txt", true, false, "product|drug|medicinal"),
	WHODRUG_PRODUCT_INGREDIENTS(DictionaryType.WHODRUG, "product_ingredients.txt", false, true,
			"product.*ingredient|drug.*ingredient|composition");

	private final DictionaryType dictionary;
	private final String defaultFileName;
	private final boolean required;
	private final boolean relationship;
	private final Pattern namePattern;

	DistributionFile(DictionaryType dictionary, String defaultFileName, boolean required, boolean relationship) {
		this(dictionary, defaultFileName, required, relationship, null);
	}

	DistributionFile(DictionaryType dictionary, String defaultFileName, boolean required, boolean relationship,
			String namePattern) {
		this.dictionary = dictionary;
		this.defaultFileName = defaultFileName;
		this.required = required;
		this.relationship = relationship;
		this.namePattern = namePattern == null
				? Pattern.compile(Pattern.quote(defaultFileName), Pattern.CASE_INSENSITIVE)
				: Pattern.compile(namePattern, Pattern.CASE_INSENSITIVE);
	}

	public DictionaryType getDictionary() {
		return dictionary;
	}

	public String getDefaultFileName() {
		return defaultFileName;
	}

	public boolean isRequired() {
		return required;
	}

	public boolean isRelationship() {
		return relationship;
	}

	/**
	 * Whether a directory entry looks like this file. MedDRA names must match
	 * exactly; WHO Drug names only need to contain one of the known words.
	 */
	public boolean matchesFileName(String fileName) {
		if (dictionary == DictionaryType.MEDDRA) {
			return defaultFileName.equalsIgnoreCase(fileName);
		}
		return namePattern.matcher(fileName).find();
	}

	public static List<DistributionFile> forDictionary(DictionaryType dictionary) {
		return Arrays.stream(values()).filter(f -> f.dictionary == dictionary).toList();
	}
}
