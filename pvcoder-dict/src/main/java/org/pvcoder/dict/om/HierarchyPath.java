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

/** Nodes from the top level down to the coded node. */
@Value
public class HierarchyPath {

	List<HierarchyNode> nodes;
	boolean primary;

	public HierarchyPath(List<HierarchyNode> nodes, boolean primary) {
		if (nodes == null || nodes.isEmpty()) {
			throw new IllegalArgumentException("A hierarchy path needs at least one node");
		}
		this.nodes = List.copyOf(nodes);
		this.primary = primary;
	}

	public HierarchyNode top() {
		return nodes.get(0);
	}

	public HierarchyNode bottom() {
		return nodes.get(nodes.size() - 1);
	}
}
