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

/**
 * One ranked hit, denormalized so callers need no second lookup.
 * <p>
 * MedDRA: leaf is the LLT, parent its PT, top the PT's primary SOC.
 * WHO Drug: leaf is the product, parent its ATC class, top the ATC level 1 group.
 */
@Value
public class SearchResult {

	long versionId;
	HierarchyLevel level;
	String code;
	String name;
	String parentCode;
	String parentName;
	String topCode;
	String topName;
	Boolean current;
	MatchTier tier;
}
