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
import java.util.Optional;

import org.pvcoder.dict.om.HierarchyLevel;
import org.pvcoder.dict.om.HierarchyNode;
import org.pvcoder.dict.om.TreeNode;
import org.pvcoder.dict.om.VersionedCode;
import org.pvcoder.dict.store.HierarchyStore;

/** Lazy, one-level-at-a-time browsing. Nothing is cached between calls. */
public class TreeBrowser {

	private final HierarchyStore store;
	private final VersionManager versions;

	public TreeBrowser(HierarchyStore store, VersionManager versions) {
		this.store = store;
		this.versions = versions;
	}

	/**
	 * Children of {@code parentCode} at {@code parentLevel}, or the top level when
	 * both are {@code null}. Returns an empty list when no version applies.
	 */
	public List<TreeNode> browse(HierarchyLevel parentLevel, String parentCode, Long versionId) {
		if ((parentLevel == null) != (parentCode == null)) {
			throw new IllegalArgumentException("Parent level and parent code must be given together");
		}
		if (parentLevel != null && parentLevel.getDictionary() != store.getDictionary()) {
			throw new IllegalArgumentException(parentLevel + " is not a "
					+ store.getDictionary().getDisplayName() + " level");
		}
		Optional<Long> version = versions.effectiveVersionId(versionId);
		if (version.isEmpty()) {
			return List.of();
		}
		List<HierarchyNode> nodes = parentLevel == null
				? store.topLevel(version.get())
				: store.childrenOf(parentLevel, VersionedCode.of(version.get(), parentCode));
		return nodes.stream().map(TreeNode::of).toList();
	}
}
