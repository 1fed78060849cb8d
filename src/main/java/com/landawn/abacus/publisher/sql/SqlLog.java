/*
 * Copyright (c) 2021, Haiyang Li.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.landawn.abacus.publisher.sql;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.Strings;

/**
 * Controls the logging of the statements issued by {@link JdbcSQLAdapter}, for the current thread.
 *
 * <p>Statements are logged at debug level as {@code [SQL]: <sql>} to the logger named {@value #SQL_LOGGER_NAME}
 * once {@link #enableSqlLog()} is called. Independently, any statement slower than
 * {@link #getMinExecutionTimeForSqlPerfLog()} milliseconds is logged at info level as {@code [SQL-PERF]: <elapsed>, <sql>}.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * SqlLog.enableSqlLog();
 * try {
 *     users.load(1L);
 * } finally {
 *     SqlLog.disableSqlLog();
 * }
 *
 * SqlLog.setMinExecutionTimeForSqlPerfLog(200);
 * }</pre>
 */
public final class SqlLog {

    private static final Logger logger = LoggerFactory.getLogger(SqlLog.class);

    public static final String SQL_LOGGER_NAME = "com.landawn.abacus.publisher.SQL";

    public static final int DEFAULT_MAX_SQL_LOG_LENGTH = 1024;

    public static final long DEFAULT_MIN_EXECUTION_TIME_FOR_SQL_PERF_LOG = 1000L;

    static final Logger sqlLogger = LoggerFactory.getLogger(SQL_LOGGER_NAME);

    private static final ThreadLocal<SqlLogConfig> sqlLogConfig_TL = ThreadLocal
            .withInitial(() -> new SqlLogConfig(false, DEFAULT_MAX_SQL_LOG_LENGTH, DEFAULT_MIN_EXECUTION_TIME_FOR_SQL_PERF_LOG));

    private SqlLog() {
        // singleton
    }

    public static void enableSqlLog() {
        enableSqlLog(DEFAULT_MAX_SQL_LOG_LENGTH);
    }

    /**
     *
     * @param maxSqlLogLength longer statements are abbreviated. {@link #DEFAULT_MAX_SQL_LOG_LENGTH} is used if it's not positive
     */
    public static void enableSqlLog(final int maxSqlLogLength) {
        enableSqlLog(true, maxSqlLogLength);
    }

    public static void disableSqlLog() {
        enableSqlLog(false, sqlLogConfig_TL.get().maxSqlLogLength);
    }

    public static boolean isSqlLogEnabled() {
        return sqlLogConfig_TL.get().isEnabled;
    }

    private static void enableSqlLog(final boolean b, final int maxSqlLogLength) {
        final SqlLogConfig config = sqlLogConfig_TL.get();

        if (logger.isDebugEnabled() && config.isEnabled != b) {
            if (b) {
                logger.debug("Turn on [SQL] log");
            } else {
                logger.debug("Turn off [SQL] log");
            }
        }

        config.enable(b, maxSqlLogLength);
    }

    public static void setMinExecutionTimeForSqlPerfLog(final long minExecutionTimeForSqlPerfLog) {
        setMinExecutionTimeForSqlPerfLog(minExecutionTimeForSqlPerfLog, sqlLogConfig_TL.get().maxSqlLogLength);
    }

    /**
     *
     * @param minExecutionTimeForSqlPerfLog threshold in milliseconds. A negative value turns the performance log off
     * @param maxSqlLogLength longer statements are abbreviated
     */
    public static void setMinExecutionTimeForSqlPerfLog(final long minExecutionTimeForSqlPerfLog, final int maxSqlLogLength) {
        final SqlLogConfig config = sqlLogConfig_TL.get();

        if (logger.isDebugEnabled() && config.minExecutionTimeForSqlPerfLog != minExecutionTimeForSqlPerfLog) {
            if (minExecutionTimeForSqlPerfLog >= 0) {
                logger.debug("set 'minExecutionTimeForSqlPerfLog' to: " + minExecutionTimeForSqlPerfLog);
            } else {
                logger.debug("Turn off SQL performance log");
            }
        }

        config.setPerfLogThreshold(minExecutionTimeForSqlPerfLog, maxSqlLogLength);
    }

    public static long getMinExecutionTimeForSqlPerfLog() {
        return sqlLogConfig_TL.get().minExecutionTimeForSqlPerfLog;
    }

    static void logSql(final String sql) {
        if (!sqlLogger.isDebugEnabled()) {
            return;
        }

        final SqlLogConfig config = sqlLogConfig_TL.get();

        if (config.isEnabled) {
            sqlLogger.debug(Strings.concat("[SQL]: ", config.abbreviate(sql)));
        }
    }

    static void logSqlPerf(final String sql, final long startTime) {
        final SqlLogConfig config = sqlLogConfig_TL.get();
        final long elapsedTime = System.currentTimeMillis() - startTime;

        if (config.minExecutionTimeForSqlPerfLog >= 0 && elapsedTime >= config.minExecutionTimeForSqlPerfLog && sqlLogger.isInfoEnabled()) {
            sqlLogger.info(Strings.concat("[SQL-PERF]: ", String.valueOf(elapsedTime), ", ", config.abbreviate(sql)));
        }
    }
}
