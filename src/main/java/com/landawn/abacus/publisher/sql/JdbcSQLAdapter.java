/*
 * Copyright (C) 2015 HaiYang Li
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */

package com.landawn.abacus.publisher.sql;

import java.sql.Blob;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import javax.sql.DataSource;

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * {@link SQLAdapter} on a JDBC {@link DataSource}.
 *
 * <p>Statements are built from {@link SQLOptions} with {@code ?} placeholders for every value, and identifiers are
 * quoted the way the database product expects it (back quotes for MySQL and MariaDB, brackets for SQL Server,
 * double quotes otherwise). The product is detected from the connection metadata on first use.</p>
 *
 * <p>A connection is borrowed from the data source for each statement and released right after,
 * unless a {@link JdbcTransaction} begun by {@link #beginTransaction()} is active on the current thread.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * JdbcDataSource dataSource = new JdbcDataSource();
 * dataSource.setURL("jdbc:h2:mem:app;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE");
 *
 * SQLAdapter adapter = new JdbcSQLAdapter(dataSource);
 * SQLAdapters.register(adapter);
 * }</pre>
 */
public class JdbcSQLAdapter implements SQLAdapter {

    private static final Logger logger = LoggerFactory.getLogger(JdbcSQLAdapter.class);

    private final DataSource ds;

    private volatile DBProductInfo dbProductInfo; //NOSONAR

    public JdbcSQLAdapter(final DataSource ds) {
        this.ds = N.checkArgNotNull(ds, "ds");
    }

    /**
     * Creates an adapter writing SQL for {@code version} without querying the connection metadata.
     *
     * @param ds the data source
     * @param version the database product
     */
    public JdbcSQLAdapter(final DataSource ds, final DBVersion version) {
        this(ds);

        dbProductInfo = new DBProductInfo(version.name(), null, version);
    }

    public DataSource getDataSource() {
        return ds;
    }

    public DBProductInfo getDBProductInfo() throws UncheckedSQLException {
        if (dbProductInfo == null) {
            final Connection conn = getConnection();

            try {
                dbProductInfo = getDBProductInfo(conn);
            } finally {
                releaseConnection(conn);
            }
        }

        return dbProductInfo;
    }

    public static DBProductInfo getDBProductInfo(final Connection conn) throws UncheckedSQLException {
        try {
            final DatabaseMetaData metaData = conn.getMetaData();

            final String dbProductName = metaData.getDatabaseProductName();
            final String dbProductVersion = metaData.getDatabaseProductVersion();

            return new DBProductInfo(dbProductName, dbProductVersion, DBVersion.of(dbProductName));
        } catch (final SQLException e) {
            throw new UncheckedSQLException(e);
        }
    }

    @Override
    public List<Map<String, Object>> select(final SQLOptions options) throws UncheckedSQLException {
        final List<Object> parameters = new ArrayList<>();
        final String sql = buildSelect(options, parameters);

        final Connection conn = getConnection();
        PreparedStatement stmt = null;
        ResultSet rs = null;

        try {
            stmt = prepareStatement(conn, sql, parameters, false);

            final long startTime = System.currentTimeMillis();

            try {
                rs = stmt.executeQuery();
            } finally {
                SqlLog.logSqlPerf(sql, startTime);
            }

            return readRows(rs);
        } catch (final SQLException e) {
            throw new UncheckedSQLException("Failed to execute: " + sql, e);
        } finally {
            closeQuietly(rs, stmt, null);
            releaseConnection(conn);
        }
    }

    @Override
    public InsertResult insert(final SQLOptions options) throws UncheckedSQLException {
        final List<Object> parameters = new ArrayList<>();
        final String sql = buildInsert(options, parameters);

        final Connection conn = getConnection();
        PreparedStatement stmt = null;
        ResultSet rs = null;

        try {
            stmt = prepareStatement(conn, sql, parameters, true);

            final long startTime = System.currentTimeMillis();
            final int affectedRows;

            try {
                affectedRows = stmt.executeUpdate();
            } finally {
                SqlLog.logSqlPerf(sql, startTime);
            }

            Object lastInsertId = null;

            if (affectedRows > 0) {
                rs = stmt.getGeneratedKeys();

                if (rs != null && rs.next()) {
                    lastInsertId = rs.getObject(1);
                }
            }

            return new InsertResult(affectedRows, lastInsertId);
        } catch (final SQLException e) {
            throw new UncheckedSQLException("Failed to execute: " + sql, e);
        } finally {
            closeQuietly(rs, stmt, null);
            releaseConnection(conn);
        }
    }

    @Override
    public int update(final SQLOptions options) throws UncheckedSQLException {
        N.checkArgument(N.notEmpty(options.getValues()), "No value to update in table: " + options.getTable());

        final List<Object> parameters = new ArrayList<>();

        return executeUpdate(buildUpdate(options, parameters), parameters);
    }

    @Override
    public int delete(final SQLOptions options) throws UncheckedSQLException {
        final List<Object> parameters = new ArrayList<>();

        return executeUpdate(buildDelete(options, parameters), parameters);
    }

    @Override
    public String escapeIdentifier(final String identifier) {
        N.checkArgNotNull(identifier, "identifier");

        final DBVersion version = getDBProductInfo().version();
        final String[] parts = identifier.split("\\.");
        final StringBuilder sb = new StringBuilder(identifier.length() + 2 * parts.length + 2);

        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('.');
            }

            if ("*".equals(parts[i])) {
                sb.append('*');
            } else if (version.isMySQL()) {
                sb.append('`').append(parts[i].replace("`", "``")).append('`');
            } else if (version == DBVersion.SQL_Server) {
                sb.append('[').append(parts[i].replace("]", "]]")).append(']');
            } else {
                sb.append('"').append(parts[i].replace("\"", "\"\"")).append('"');
            }
        }

        return sb.toString();
    }

    @Override
    public String formatValue(final Object value) {
        if (value == null) {
            return "NULL";
        } else if (value instanceof Number || value instanceof Boolean) {
            return value.toString().toUpperCase();
        } else if (value instanceof Collection<?> c) {
            return "(" + formatValueList(c) + ")";
        } else {
            final String str = value instanceof java.util.Date || value instanceof TemporalAccessor ? toSqlValue(value).toString() : value.toString();

            final String escaped = getDBProductInfo().version().isMySQL() ? str.replace("\\", "\\\\").replace("'", "''") : str.replace("'", "''");

            return "'" + escaped + "'";
        }
    }

    /**
     * Begins a {@link JdbcTransaction} on the data source of this adapter, or joins the one active on the current thread.
     */
    @Override
    public Transaction beginTransaction() throws UncheckedSQLException {
        return JdbcTransaction.begin(ds);
    }

    String buildSelect(final SQLOptions options, final List<Object> parameters) {
        checkTable(options);

        final StringBuilder sb = new StringBuilder("SELECT ");
        final List<String> columns = options.getColumns();

        if (N.isEmpty(columns)) {
            sb.append('*');
        } else {
            appendIdentifiers(sb, columns);
        }

        sb.append(" FROM ").append(escapeIdentifier(options.getTable()));

        appendWhere(sb, options, parameters);

        if (Strings.isNotEmpty(options.getOrderBy())) {
            sb.append(" ORDER BY ").append(options.getOrderBy());
        }

        final int number = options.getNumber();
        final int offset = options.getOffset();

        if (number >= 0 || offset > 0) {
            final DBVersion version = getDBProductInfo().version();

            if (version.usesFetchClause()) {
                sb.append(" OFFSET ").append(Math.max(offset, 0)).append(" ROWS");

                if (number >= 0) {
                    sb.append(" FETCH NEXT ").append(number).append(" ROWS ONLY");
                }
            } else {
                if (number >= 0) {
                    sb.append(" LIMIT ").append(number);
                } else if (version.isMySQL()) {
                    // MySQL has no OFFSET without LIMIT.
                    sb.append(" LIMIT ").append(Long.MAX_VALUE);
                }

                if (offset > 0) {
                    sb.append(" OFFSET ").append(offset);
                }
            }
        }

        return sb.toString();
    }

    String buildInsert(final SQLOptions options, final List<Object> parameters) {
        checkTable(options);

        final Map<String, Object> values = options.getValues();
        final StringBuilder sb = new StringBuilder("INSERT INTO ").append(escapeIdentifier(options.getTable()));

        if (N.isEmpty(values)) {
            return sb.append(getDBProductInfo().version().isMySQL() ? " () VALUES ()" : " DEFAULT VALUES").toString();
        }

        sb.append(" (");
        appendIdentifiers(sb, values.keySet());
        sb.append(") VALUES (");

        for (int i = 0, size = values.size(); i < size; i++) {
            sb.append(i == 0 ? "?" : ", ?");
        }

        parameters.addAll(values.values());

        return sb.append(')').toString();
    }

    String buildUpdate(final SQLOptions options, final List<Object> parameters) {
        checkTable(options);

        final StringBuilder sb = new StringBuilder("UPDATE ").append(escapeIdentifier(options.getTable())).append(" SET ");
        int i = 0;

        for (final Map.Entry<String, Object> entry : options.getValues().entrySet()) {
            if (i++ > 0) {
                sb.append(", ");
            }

            sb.append(escapeIdentifier(entry.getKey())).append(" = ?");
            parameters.add(entry.getValue());
        }

        appendWhere(sb, options, parameters);
        appendRowLimit(sb, options);

        return sb.toString();
    }

    String buildDelete(final SQLOptions options, final List<Object> parameters) {
        checkTable(options);

        final StringBuilder sb = new StringBuilder("DELETE FROM ").append(escapeIdentifier(options.getTable()));

        appendWhere(sb, options, parameters);
        appendRowLimit(sb, options);

        return sb.toString();
    }

    private static void checkTable(final SQLOptions options) {
        N.checkArgNotNull(options, "options");
        N.checkArgument(Strings.isNotEmpty(options.getTable()), "Table is not specified in: " + options);
    }

    private void appendIdentifiers(final StringBuilder sb, final Collection<String> identifiers) {
        int i = 0;

        for (final String identifier : identifiers) {
            if (i++ > 0) {
                sb.append(", ");
            }

            sb.append(escapeIdentifier(identifier));
        }
    }

    private static void appendWhere(final StringBuilder sb, final SQLOptions options, final List<Object> parameters) {
        if (Strings.isNotEmpty(options.getWhere())) {
            sb.append(" WHERE ").append(options.getWhere());
            parameters.addAll(options.getParameters());
        }
    }

    // Only MySQL takes a row limit on UPDATE and DELETE.
    private void appendRowLimit(final StringBuilder sb, final SQLOptions options) {
        if (options.getNumber() > 0 && getDBProductInfo().version().isMySQL()) {
            sb.append(" LIMIT ").append(options.getNumber());
        }
    }

    private int executeUpdate(final String sql, final List<Object> parameters) throws UncheckedSQLException {
        final Connection conn = getConnection();
        PreparedStatement stmt = null;

        try {
            stmt = prepareStatement(conn, sql, parameters, false);

            final long startTime = System.currentTimeMillis();

            try {
                return stmt.executeUpdate();
            } finally {
                SqlLog.logSqlPerf(sql, startTime);
            }
        } catch (final SQLException e) {
            throw new UncheckedSQLException("Failed to execute: " + sql, e);
        } finally {
            closeQuietly(null, stmt, null);
            releaseConnection(conn);
        }
    }

    private static PreparedStatement prepareStatement(final Connection conn, final String sql, final List<Object> parameters, final boolean returnGeneratedKeys)
            throws SQLException {
        SqlLog.logSql(sql);

        final PreparedStatement stmt = returnGeneratedKeys ? conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS) : conn.prepareStatement(sql);

        try {
            for (int i = 0, size = parameters.size(); i < size; i++) {
                stmt.setObject(i + 1, toSqlValue(parameters.get(i)));
            }
        } catch (final SQLException e) {
            closeQuietly(null, stmt, null);
            throw e;
        }

        return stmt;
    }

    static Object toSqlValue(final Object value) {
        if (value instanceof java.util.Date date && !(value instanceof java.sql.Timestamp || value instanceof java.sql.Date || value instanceof java.sql.Time)) {
            return new java.sql.Timestamp(date.getTime());
        } else if (value instanceof Enum<?> e) {
            return e.name();
        } else {
            return value;
        }
    }

    static List<Map<String, Object>> readRows(final ResultSet rs) throws SQLException {
        final ResultSetMetaData metaData = rs.getMetaData();
        final int columnCount = metaData.getColumnCount();
        final List<String> labelList = new ArrayList<>(columnCount);

        for (int i = 1, n = columnCount + 1; i < n; i++) {
            final String label = metaData.getColumnLabel(i);
            labelList.add(Strings.isEmpty(label) ? metaData.getColumnName(i) : label);
        }

        final List<Map<String, Object>> rows = new ArrayList<>();

        while (rs.next()) {
            final Map<String, Object> row = new LinkedHashMap<>(columnCount * 2);

            for (int i = 0; i < columnCount; i++) {
                row.put(labelList.get(i), getColumnValue(rs, i + 1));
            }

            rows.add(row);
        }

        return rows;
    }

    static Object getColumnValue(final ResultSet rs, final int columnIndex) throws SQLException {
        final Object val = rs.getObject(columnIndex);

        if (val instanceof Blob blob) {
            try {
                return blob.getBytes(1, (int) blob.length());
            } finally {
                blob.free();
            }
        } else if (val instanceof Clob clob) {
            try {
                return clob.getSubString(1, (int) clob.length());
            } finally {
                clob.free();
            }
        } else {
            return val;
        }
    }

    private Connection getConnection() throws UncheckedSQLException {
        final Connection tranConn = JdbcTransaction.currentConnection(ds);

        if (tranConn != null) {
            return tranConn;
        }

        try {
            return ds.getConnection();
        } catch (final SQLException e) {
            throw new UncheckedSQLException(e);
        }
    }

    private void releaseConnection(final Connection conn) {
        if (conn == null) {
            return;
        }

        if (JdbcTransaction.currentConnection(ds) == conn) {
            return;
        }

        closeQuietly(null, null, conn);
    }

    static void closeQuietly(final ResultSet rs, final Statement stmt, final Connection conn) {
        if (rs != null) {
            try {
                rs.close();
            } catch (final Exception e) {
                logger.error("Failed to close ResultSet", e);
            }
        }

        if (stmt != null) {
            try {
                stmt.close();
            } catch (final Exception e) {
                logger.error("Failed to close Statement", e);
            }
        }

        if (conn != null) {
            try {
                conn.close();
            } catch (final Exception e) {
                logger.error("Failed to close Connection", e);
            }
        }
    }

    @Override
    public String toString() {
        return "JdbcSQLAdapter{dataSource=" + ds + "}";
    }
}
