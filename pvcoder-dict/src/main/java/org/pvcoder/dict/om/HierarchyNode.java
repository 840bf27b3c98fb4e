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
 * A node read from the hierarchy store.
 * <p>
 * {@code current} is set for LLTs only. {@code primaryParentCode} is the PT's
 * primary SOC; {@code abbreviation} is the SOC abbreviation. All three are
 * {@code null} on other levels.
 */
@Value
public class HierarchyNode {

	VersionedCode key;
	HierarchyLevel level;
	String name;
	Boolean current;
	String primaryParentCode;
	String abbreviation;

	public String getCode() {
		return key.getCode();
	}

	public long getVersionId() {
		return key.getVersionId();
	}

	public static HierarchyNode of(HierarchyLevel level, VersionedCode key, String name) {
		return new HierarchyNode(key, level, name, null, null, null);
	}
}
