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

import java.util.Objects;

import lombok.Value;

/**
 * A vendor code scoped to the dictionary version it was loaded into. Codes are
 * reused across releases, so every store lookup goes through this key.
 */
@Value
public class VersionedCode {

	long versionId;
	String code;

	public static VersionedCode of(long versionId, String code) {
		Objects.requireNonNull(code, "code must not be null");
		return new VersionedCode(versionId, code.trim());
	}

	@Override
	public String toString() {
		return versionId + ":" + code;
	}
}
