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
import java.util.Optional;

import org.pvcoder.dict.om.DictionaryType;
import org.pvcoder.dict.om.HierarchyLevel;
import org.pvcoder.dict.om.HierarchyNode;
import org.pvcoder.dict.om.SearchResult;
import org.pvcoder.dict.om.VersionedCode;

/**
 * Read primitives over one dictionary's versioned hierarchy. Every call is
 * scoped to a single version; nothing here joins across versions.
 * <p>
 * Node lists are ordered by name (case-insensitive), then code.
 */
public interface HierarchyStore {

	DictionaryType getDictionary();

	/** SOCs or ATC level 1 groups of a version. */
	List<HierarchyNode> topLevel(long versionId);

	/** Immediate children one level below {@code parentLevel}; empty for leaves and unknown codes. */
	List<HierarchyNode> childrenOf(HierarchyLevel parentLevel, VersionedCode parent);

	Optional<HierarchyNode> byCode(HierarchyLevel level, VersionedCode code);

	/** Immediate parents; several for a multi-parent node, none at the top level. */
	List<HierarchyNode> parentsOf(HierarchyLevel level, VersionedCode child);

	/**
	 * Ranked leaf search.
	 *
	 * @param normalizedQuery trimmed, lower-cased query; LIKE wildcards in it are matched literally
	 * @param countryCode     optional country filter; ignored where the dictionary has none
	 */
	List<SearchResult> search(long versionId, String normalizedQuery, boolean includeNonCurrent,
			String countryCode, int limit);
}
