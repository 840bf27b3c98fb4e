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

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;

import lombok.Getter;

/**
 * Where a parsed record goes: the table, its INSERT statement and how a record
 * binds to that statement.
 */
@Getter
public final class LoadTarget<T> {

	/** Binds one record; parameter 1 is always the version id. */
	@FunctionalInterface
	public interface Binder<T> {
		void bind(PreparedStatement ps, long versionId, T record) throws SQLException;
	}

	private final String table;
	private final String insertSql;
	private final Binder<T> binder;

	public LoadTarget(String table, String insertSql, Binder<T> binder) {
		this.table = Objects.requireNonNull(table, "table");
		this.insertSql = Objects.requireNonNull(insertSql, "insertSql");
		this.binder = Objects.requireNonNull(binder, "binder");
	}

	@Override
	public String toString() {
		return table;
	}
}
