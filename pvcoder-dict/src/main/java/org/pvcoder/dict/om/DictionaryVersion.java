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

import java.time.Instant;
import java.time.LocalDate;

import lombok.Value;

/**
 * One imported release of a dictionary.
 * <p>
 * For MedDRA {@code leafCount} counts LLTs and {@code termCount} counts PTs. For
 * WHO Drug they count products and ingredients.
 */
@Value
public class DictionaryVersion {

	long id;
	DictionaryType dictionary;
	String label;
	LocalDate releaseDate;
	Instant importDate;
	boolean active;
	LoadState loadState;
	int leafCount;
	int termCount;
	String importedBy;
}
