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

/** A browse result row. {@code key} is stable across calls: {@code LEVEL-code}. */
@Value
public class TreeNode {

	String key;
	HierarchyLevel level;
	String code;
	String name;
	boolean leaf;
	Boolean current;

	public static TreeNode of(HierarchyNode node) {
		HierarchyLevel level = node.getLevel();
		return new TreeNode(level.name() + "-" + node.getCode(), level, node.getCode(), node.getName(),
				level.isLeaf(), node.getCurrent());
	}
}
