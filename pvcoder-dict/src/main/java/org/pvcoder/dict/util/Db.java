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

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Small JDBC helper shared by the dictionary stores.
 *
 * <p><b>Usage</b>:
 * <pre>
 * try (Connection c = Db.getConnection(url, "sa", "", "org.h2.Driver", 3, Duration.ofMillis(250))) {
 *   List&lt;String&gt; names = Db.runQuery(c,
 *       "SELECT soc_name FROM meddra_soc WHERE version_id = ?",
 *       ps -&gt; ps.setLong(1, versionId),
 *       rs -&gt; rs.getString(1));
 * }
 * </pre>
 *
 * <p>Callers own the {@link Connection}; nothing here closes it.
 */
public final class Db {

    private static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private Db() {}

    /* ---------------------------- Functional types ---------------------------- */

    /** Sets parameters on a PreparedStatement. */
    @FunctionalInterface
    public interface ParamSetter {
        void accept(PreparedStatement ps) throws Exception;
    }

    /** Maps the current row of a ResultSet. */
    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws Exception;
    }

    @FunctionalInterface
    public interface RunnableEx {
        void run() throws Exception;
    }

    /* ---------------------------- Connection helpers ---------------------------- */

    /**
     * Opens a connection, retrying with exponential backoff. The embedded H2 file
     * database can be briefly locked by a previous process, hence the retries.
     *
     * @throws SQLException the last failure once {@code maxRetries} is exhausted
     */
    public static Connection getConnection(String jdbcUrl,
                                           String user,
                                           String pass,
                                           String driverClass,
                                           int maxRetries,
                                           Duration initialBackoff) throws SQLException {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            initialBackoff = Duration.ofMillis(200);
        }
        loadDriver(driverClass);

        Properties props = new Properties();
        props.setProperty("user", user == null ? "" : user);
        props.setProperty("password", pass == null ? "" : pass);

        SQLException last = null;
        long sleepMs = initialBackoff.toMillis();
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            if (attempt > 0) {
                Logger.debug("Retrying connection to {} (attempt {} of {})", jdbcUrl, attempt, maxRetries);
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new SQLException("Connection retry interrupted", ie);
                }
                sleepMs = Math.min(sleepMs * 2, MAX_BACKOFF.toMillis());
            }
            try {
                return DriverManager.getConnection(jdbcUrl, props);
            } catch (SQLException ex) {
                if (last != null) ex.addSuppressed(last);
                last = ex;
            }
        }
        throw last;
    }

    private static void loadDriver(String driverClass) {
        if (driverClass == null || driverClass.isBlank()) return;
        try {
            Class.forName(driverClass.trim());
        } catch (ClassNotFoundException ex) {
            // DriverManager may still find it through the service loader
            Logger.warn("JDBC driver class not found: {}", driverClass);
        }
    }

    /* ---------------------------- Query helpers ---------------------------- */

    /** Runs a query and maps every row. */
    public static <T> List<T> runQuery(Connection conn,
                                       String sql,
                                       ParamSetter params,
                                       RowMapper<T> mapper) throws Exception {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");

        List<T> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (params != null) params.accept(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapper.map(rs));
                }
            }
        }
        return out;
    }

    /** Runs a query expected to return at most one row. */
    public static <T> Optional<T> queryOne(Connection conn,
                                           String sql,
                                           ParamSetter params,
                                           RowMapper<T> mapper) throws Exception {
        List<T> rows = runQuery(conn, sql, params, mapper);
        if (rows.size() > 1) {
            throw new SQLException("Expected at most one row but got " + rows.size() + " for: " + sql);
        }
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    /** Executes DML or DDL and returns the update count. */
    public static int execute(Connection conn, String sql, ParamSetter params) throws Exception {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (params != null) params.accept(ps);
            return ps.executeUpdate();
        }
    }

    /** Executes an INSERT and returns the generated numeric key. */
    public static long insertReturningKey(Connection conn, String sql, ParamSetter params) throws Exception {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");

        try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            if (params != null) params.accept(ps);
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                if (!keys.next()) throw new SQLException("No generated key returned for: " + sql);
                return keys.getLong(1);
            }
        }
    }

    /* ---------------------------- Transaction helpers ---------------------------- */

    /** Runs {@code body} in one transaction; any exception rolls it back and is rethrown. */
    public static void withTransaction(Connection conn, RunnableEx body) throws Exception {
        Objects.requireNonNull(conn, "conn must not be null");
        boolean prevAuto = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            body.run();
            conn.commit();
        } catch (Exception ex) {
            try {
                conn.rollback();
            } catch (SQLException rollbackFailure) {
                ex.addSuppressed(rollbackFailure);
            }
            throw ex;
        } finally {
            try {
                conn.setAutoCommit(prevAuto);
            } catch (SQLException restoreFailure) {
                Logger.warn("Could not restore auto-commit: {}", restoreFailure.getMessage());
            }
        }
    }
}
