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

import com.landawn.abacus.util.Strings;

/**
 * The database products {@link JdbcSQLAdapter} knows how to write SQL for.
 */
public enum DBVersion {

    H2,

    HSQLDB,

    MySQL,

    MariaDB,

    PostgreSQL,

    Oracle,

    DB2,

    SQL_Server,

    SQLite,

    OTHERS;

    /**
     * Detects the product from the name reported by {@code DatabaseMetaData.getDatabaseProductName()}.
     *
     * @param productName the product name
     * @return the matching version, {@link #OTHERS} if none matches
     */
    public static DBVersion of(final String productName) {
        if (Strings.containsIgnoreCase(productName, "H2")) {
            return H2;
        } else if (Strings.containsIgnoreCase(productName, "HSQL")) {
            return HSQLDB;
        } else if (Strings.containsIgnoreCase(productName, "MySQL")) {
            return MySQL;
        } else if (Strings.containsIgnoreCase(productName, "MariaDB")) {
            return MariaDB;
        } else if (Strings.containsIgnoreCase(productName, "PostgreSQL")) {
            return PostgreSQL;
        } else if (Strings.containsIgnoreCase(productName, "Oracle")) {
            return Oracle;
        } else if (Strings.containsIgnoreCase(productName, "DB2")) {
            return DB2;
        } else if (Strings.containsIgnoreCase(productName, "SQL Server")) {
            return SQL_Server;
        } else if (Strings.containsIgnoreCase(productName, "SQLite")) {
            return SQLite;
        } else {
            return OTHERS;
        }
    }

    public boolean isMySQL() {
        return this == MySQL || this == MariaDB;
    }

    public boolean isPostgreSQL() {
        return this == PostgreSQL;
    }

    /**
     * Whether the product pages with {@code OFFSET ... FETCH NEXT ...} instead of {@code LIMIT ... OFFSET ...}.
     *
     * @return {@code true} for Oracle, DB2 and SQL Server
     */
    public boolean usesFetchClause() {
        return this == Oracle || this == DB2 || this == SQL_Server;
    }
}
