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

import lombok.Builder;
import lombok.Value;

/**
 * Search input. A {@code null} limit means the configured default; a {@code null}
 * version means the active one. {@code countryCode} only applies to WHO Drug.
 */
@Value
@Builder
public class SearchRequest {

	String query;
	Integer limit;
	boolean includeNonCurrent;
	Long versionId;
	String countryCode;

	public static SearchRequest of(String query) {
		return builder().query(query).build();
	}
}
