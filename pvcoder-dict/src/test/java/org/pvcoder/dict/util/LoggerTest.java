package org.pvcoder.dict.util;

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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LoggerTest {

	@Test
	void format_replaces_placeholders_in_order() {
		assertEquals("Loaded 12 rows into meddra_llt", Logger.format("Loaded {} rows into {}", 12, "meddra_llt"));
	}

	@Test
	void format_appends_surplus_arguments_and_keeps_unfilled_placeholders() {
		assertEquals("a 1 2", Logger.format("a {}", 1, 2));
		assertEquals("x=1 y={}", Logger.format("x={} y={}", 1));
		assertEquals("no args", Logger.format("no args"));
		assertEquals("null", Logger.format(null, 1));
	}

	@Test
	void error_level_is_always_enabled() {
		assertTrue(Logger.isEnabled(Logger.Level.ERROR));
	}
}
