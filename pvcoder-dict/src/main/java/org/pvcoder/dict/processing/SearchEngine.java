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

import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.pvcoder.dict.om.SearchRequest;
import org.pvcoder.dict.om.SearchResult;
import org.pvcoder.dict.store.HierarchyStore;
import org.pvcoder.dict.util.Logger;

/**
 * Ranked substring search.
 * <p>
 * Results are tiered: exact leaf name, leaf name prefix, leaf name substring, then
 * a hit on the related name only. Within a tier they sort by leaf name and code,
 * so the same query over the same data always yields the same list.
 */
public class SearchEngine {

	public static final int MIN_QUERY_LENGTH = 2;

	private final HierarchyStore store;
	private final VersionManager versions;
	private final int defaultLimit;
	private final int maxLimit;

	public SearchEngine(HierarchyStore store, VersionManager versions, int defaultLimit, int maxLimit) {
		this.store = store;
		this.versions = versions;
		this.defaultLimit = defaultLimit;
		this.maxLimit = Math.max(defaultLimit, maxLimit);
	}

	public List<SearchResult> search(SearchRequest request) {
		String query = StringUtils.trimToEmpty(request.getQuery());
		if (query.length() < MIN_QUERY_LENGTH) {
			return List.of();
		}
		Optional<Long> versionId = versions.effectiveVersionId(request.getVersionId());
		if (versionId.isEmpty()) {
			Logger.debug("No active {} version; search for '{}' returns nothing",
					store.getDictionary().getDisplayName(), query);
			return List.of();
		}
		int limit = effectiveLimit(request.getLimit());
		return store.search(versionId.get(), query.toLowerCase(Locale.ROOT), request.isIncludeNonCurrent(),
				request.getCountryCode(), limit);
	}

	/** A null or non-positive request gets the default; anything above the maximum is capped. */
	public int effectiveLimit(Integer requested) {
		if (requested == null || requested <= 0) {
			return defaultLimit;
		}
		return Math.min(requested, maxLimit);
	}
}
