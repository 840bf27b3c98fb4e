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

import lombok.Value;

/**
 * One WHO Drug product as distributed, with its ingredients and their strengths.
 * Every column other than code and name may be {@code null}.
 */
@Value
public class ProductDetail {

	long versionId;
	String drugCode;
	String drugName;
	String drugNameEnglish;
	String countryCode;
	String company;
	String atcCode;
	String formulation;
	String marketingStatus;
	/** By ingredient name. */
	List<ProductIngredient> ingredients;

	public ProductDetail(long versionId, String drugCode, String drugName, String drugNameEnglish,
			String countryCode, String company, String atcCode, String formulation, String marketingStatus,
			List<ProductIngredient> ingredients) {
		this.versionId = versionId;
		this.drugCode = drugCode;
		this.drugName = drugName;
		this.drugNameEnglish = drugNameEnglish;
		this.countryCode = countryCode;
		this.company = company;
		this.atcCode = atcCode;
		this.formulation = formulation;
		this.marketingStatus = marketingStatus;
		this.ingredients = ingredients == null ? List.of() : List.copyOf(ingredients);
	}
}
