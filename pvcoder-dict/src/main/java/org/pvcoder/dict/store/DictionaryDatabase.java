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

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import org.pvcoder.dict.DictionaryException;
import org.pvcoder.dict.conf.ConfigLoader;
import org.pvcoder.dict.util.Db;

/**
 * Connection settings for the embedded dictionary database.
 * <p>
 * Every unit of work opens a short-lived connection, so readers never share
 * state with an import running on another thread. SQL failures leave this class
 * as {@link DictionaryException}s of kind STORAGE; typed dictionary failures
 * raised inside a unit of work pass through unchanged.
 */
public class DictionaryDatabase {

	private static final Duration INITIAL_BACKOFF = Duration.ofMillis(250);

	/** Work executed against an open connection. */
	@FunctionalInterface
	public interface SqlWork<T> {
		T apply(Connection conn) throws Exception;
	}

	private final String url;
	private final String user;
	private final String pass;
	private final String driver;
	private final int connectRetries;

	public DictionaryDatabase(String url, String user, String pass, String driver, int connectRetries) {
		this.url = url;
		this.user = user;
		this.pass = pass;
		this.driver = driver;
		this.connectRetries = connectRetries;
	}

	public static DictionaryDatabase fromConfig(ConfigLoader cfg) {
		return new DictionaryDatabase(cfg.getDbUrl(), cfg.getDbUser(), cfg.getDbPass(), cfg.getDbDriver(),
				cfg.getDbConnectRetries());
	}

	public String getUrl() {
		return url;
	}

	public Connection open() {
		try {
			return Db.getConnection(url, user, pass, driver, connectRetries, INITIAL_BACKOFF);
		} catch (SQLException ex) {
			throw DictionaryException.storage("Cannot connect to dictionary database " + url + ": " + ex.getMessage(), ex);
		}
	}

	/**
	 * Runs {@code work} on its own auto-commit connection. Used for queries and
	 * for single-statement updates that need no transaction.
	 */
	public <T> T withConnection(SqlWork<T> work) {
		try (Connection conn = open()) {
			return work.apply(conn);
		} catch (DictionaryException ex) {
			throw ex;
		} catch (Exception ex) {
			throw DictionaryException.storage("Dictionary statement failed: " + ex.getMessage(), ex);
		}
	}

	/** Runs {@code work} in one transaction; any exception rolls it back. */
	public <T> T inTransaction(SqlWork<T> work) {
		try (Connection conn = open()) {
			AtomicReference<T> result = new AtomicReference<>();
			Db.withTransaction(conn, () -> result.set(work.apply(conn)));
			return result.get();
		} catch (DictionaryException ex) {
			throw ex;
		} catch (Exception ex) {
			throw DictionaryException.storage("Dictionary update failed: " + ex.getMessage(), ex);
		}
	}
}
