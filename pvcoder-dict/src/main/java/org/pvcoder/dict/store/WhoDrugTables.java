package org.pvcoder.dict.store;

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

import org.pvcoder.dict.ingest.AtcRecord;
import org.pvcoder.dict.ingest.IngredientRecord;
import org.pvcoder.dict.ingest.ProductIngredientRecord;
import org.pvcoder.dict.ingest.ProductRecord;

/** Load targets and cascade order for the WHO Drug tables. */
public final class WhoDrugTables {

	public static final LoadTarget<AtcRecord> ATC = new LoadTarget<>("whodrug_atc",
			"INSERT INTO whodrug_atc (version_id, atc_code, atc_name, atc_level, parent_code) VALUES (?, ?, ?, ?, ?)",
			(ps, versionId, r) -> {
				ps.setLong(1, versionId);
				ps.setString(2, r.getCode());
				ps.setString(3, r.getName());
				ps.setInt(4, r.getLevel());
				ps.setString(5, r.getParentCode());
			});

	public static final LoadTarget<IngredientRecord> INGREDIENTS = new LoadTarget<>("whodrug_ingredient",
			"INSERT INTO whodrug_ingredient (version_id, ingredient_id, ingredient_name) VALUES (?, ?, ?)",
			(ps, versionId, r) -> {
				ps.setLong(1, versionId);
				ps.setString(2, r.getId());
				ps.setString(3, r.getName());
			});

	public static final LoadTarget<ProductRecord> PRODUCTS = new LoadTarget<>("whodrug_product",
			"""
			INSERT INTO whodrug_product (version_id, drug_code, drug_name, drug_name_english, country_code,
			    company, atc_code, formulation, marketing_status)
			VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)""",
			(ps, versionId, r) -> {
				ps.setLong(1, versionId);
				ps.setString(2, r.getDrugCode());
				ps.setString(3, r.getDrugName());
				ps.setString(4, r.getDrugNameEnglish());
				ps.setString(5, r.getCountryCode());
				ps.setString(6, r.getCompany());
				ps.setString(7, r.getAtcCode());
				ps.setString(8, r.getFormulation());
				ps.setString(9, r.getMarketingStatus());
			});

	public static final LoadTarget<ProductIngredientRecord> PRODUCT_INGREDIENTS = new LoadTarget<>(
			"whodrug_product_ingredient",
			"INSERT INTO whodrug_product_ingredient (version_id, drug_code, ingredient_id, strength) VALUES (?, ?, ?, ?)",
			(ps, versionId, r) -> {
				ps.setLong(1, versionId);
				ps.setString(2, r.getDrugCode());
				ps.setString(3, r.getIngredientId());
				ps.setString(4, r.getStrength());
			});

	public static final List<String> DELETE_ORDER = List.of(
			"whodrug_product_ingredient", "whodrug_product", "whodrug_ingredient", "whodrug_atc");

	public static final String LEAF_TABLE = "whodrug_product";
	public static final String TERM_TABLE = "whodrug_ingredient";

	private WhoDrugTables() {
	}
}
