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

import java.util.Objects;

import lombok.Getter;

/**
 * How one distribution file is laid out: its delimiter, whether it may start with
 * a header line, the minimum number of columns and how a line maps to a record.
 */
@Getter
public final class FileLayout<T> {

	private final String name;
	private final char delimiter;
	private final boolean optionalHeader;
	private final int minColumns;
	private final RecordMapper<T> mapper;

	public FileLayout(String name, char delimiter, boolean optionalHeader, int minColumns, RecordMapper<T> mapper) {
		this.name = Objects.requireNonNull(name, "name");
		this.delimiter = delimiter;
		this.optionalHeader = optionalHeader;
		this.minColumns = minColumns;
		this.mapper = Objects.requireNonNull(mapper, "mapper");
	}

	@Override
	public String toString() {
		return name;
	}
}
