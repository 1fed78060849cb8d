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

import java.util.Collection;
import java.util.List;
import java.util.Map;

import com.landawn.abacus.annotation.MayReturnNull;
import com.landawn.abacus.exception.UncheckedSQLException;

/**
 * The storage seam of the entity layer. Every read and write of a {@link com.landawn.abacus.publisher.PermanentObject}
 * goes through one {@code SQLAdapter}, shared by all entities bound to the same instance name (see {@link SQLAdapters}).
 *
 * <p>Implementations report storage failures with {@link UncheckedSQLException}.</p>
 *
 * @see JdbcSQLAdapter
 */
public interface SQLAdapter {

    /**
     *
     * @param options table, columns, where, order, number and offset
     * @return the rows, as column label to value maps. Empty if no row matches
     * @throws UncheckedSQLException
     */
    List<Map<String, Object>> select(SQLOptions options) throws UncheckedSQLException;

    /**
     *
     * @param options the select options, {@code number} is forced to 1
     * @return the first row, or {@code null} if no row matches
     * @throws UncheckedSQLException
     */
    @MayReturnNull
    default Map<String, Object> selectFirst(final SQLOptions options) throws UncheckedSQLException {
        final List<Map<String, Object>> rows = select(options.copy().number(1));

        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Inserts {@link SQLOptions#getValues()} into {@link SQLOptions#getTable()}.
     *
     * @param options table and values
     * @return the affected row count and the generated key
     * @throws UncheckedSQLException
     */
    InsertResult insert(SQLOptions options) throws UncheckedSQLException;

    /**
     *
     * @param options table, values and where
     * @return the number of updated rows
     * @throws UncheckedSQLException
     */
    int update(SQLOptions options) throws UncheckedSQLException;

    /**
     *
     * @param options table and where
     * @return the number of deleted rows
     * @throws UncheckedSQLException
     */
    int delete(SQLOptions options) throws UncheckedSQLException;

    /**
     * Quotes a table or column name for the underlying database.
     *
     * @param identifier a name, possibly qualified with dots
     * @return the quoted name
     */
    String escapeIdentifier(String identifier);

    /**
     * Renders a value as an SQL literal.
     *
     * @param value the value
     * @return the literal
     */
    String formatValue(Object value);

    default String formatValueList(final Collection<?> values) {
        final StringBuilder sb = new StringBuilder();

        for (final Object value : values) {
            if (sb.length() > 0) {
                sb.append(", ");
            }

            sb.append(formatValue(value));
        }

        return sb.toString();
    }

    /**
     * Starts a transaction bound to the current thread, or joins the one already started.
     * Adapters without transaction support return a transaction whose {@link Transaction#isRollbackSupported()} is {@code false}.
     *
     * @return the transaction
     * @throws UncheckedSQLException
     */
    default Transaction beginTransaction() throws UncheckedSQLException {
        return new NoOpTransaction();
    }
}
