package org.pvcoder.dict.ingest;

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

import org.apache.commons.csv.CSVRecord;
import org.apache.commons.lang3.StringUtils;

/**
 * Column layouts of a WHO Drug distribution ({@code |}-delimited, header optional).
 *
 * <pre>
 * atc                  atc_code|atc_name
 * ingredients          ingredient_id|name
 * products             drug_code|drug_name|drug_name_english|country_code|company|atc_code|formulation|marketing_status
 * product_ingredients  drug_code|ingredient_id|strength
 * </pre>
 */
public final class WhoDrugLayouts {

	static final char DELIMITER = '|';

	/** A blank ATC name falls back to the code. */
	public static final FileLayout<AtcRecord> ATC = new FileLayout<>("atc", DELIMITER, true, 1, line -> {
		String code = StringUtils.trimToNull(line.get(0));
		int level = AtcCodes.level(code);
		if (level == 0) {
			return null;
		}
		String name = StringUtils.defaultIfBlank(column(line, 1), code);
		return new AtcRecord(code, name, level, AtcCodes.parent(code));
	});

	public static final FileLayout<IngredientRecord> INGREDIENTS = new FileLayout<>("ingredients", DELIMITER, true, 2,
			line -> {
				String id = StringUtils.trimToNull(line.get(0));
				String name = StringUtils.trimToNull(line.get(1));
				return id == null || name == null ? null : new IngredientRecord(id, name);
			});

	public static final FileLayout<ProductRecord> PRODUCTS = new FileLayout<>("products", DELIMITER, true, 2, line -> {
		String code = StringUtils.trimToNull(line.get(0));
		String name = StringUtils.trimToNull(line.get(1));
		if (code == null || name == null) {
			return null;
		}
		return new ProductRecord(code, name, column(line, 2), column(line, 3), column(line, 4), column(line, 5),
				column(line, 6), column(line, 7));
	});

	public static final FileLayout<ProductIngredientRecord> PRODUCT_INGREDIENTS = new FileLayout<>(
			"product_ingredients", DELIMITER, true, 2, line -> {
				String drug = StringUtils.trimToNull(line.get(0));
				String ingredient = StringUtils.trimToNull(line.get(1));
				if (drug == null || ingredient == null) {
					return null;
				}
				return new ProductIngredientRecord(drug, ingredient, column(line, 2));
			});

	private WhoDrugLayouts() {
	}

	/** Optional trailing column; missing and blank both read as {@code null}. */
	private static String column(CSVRecord line, int index) {
		return index < line.size() ? StringUtils.trimToNull(line.get(index)) : null;
	}
}
