package org.pvcoder.dict.ingest;

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

import org.apache.commons.lang3.StringUtils;

/**
 * ATC level and parent are derived from the code length:
 * {@code A} (1), {@code A01} (2), {@code A01A} (3), {@code A01AA} (4),
 * {@code A01AA01} (5).
 */
public final class AtcCodes {

	private static final int[] LEVEL_LENGTHS = { 1, 3, 4, 5, 7 };

	private AtcCodes() {
	}

	/** @return 1-5, or 0 when the length matches no level (2 or 6 characters) */
	public static int level(String code) {
		if (StringUtils.isBlank(code)) {
			return 0;
		}
		int len = code.trim().length();
		if (len >= LEVEL_LENGTHS[4]) {
			return 5;
		}
		for (int i = 0; i < 4; i++) {
			if (len == LEVEL_LENGTHS[i]) {
				return i + 1;
			}
		}
		return 0;
	}

	/** @return the enclosing class code, or {@code null} for level 1 and malformed codes */
	public static String parent(String code) {
		int level = level(code);
		if (level <= 1) {
			return null;
		}
		return code.trim().substring(0, LEVEL_LENGTHS[level - 2]);
	}

	/** The level 1 anatomical group a code belongs to. */
	public static String anatomicalGroup(String code) {
		return level(code) == 0 ? null : code.trim().substring(0, 1);
	}
}
