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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.landawn.abacus.util.ImmutableList;
import com.landawn.abacus.util.ImmutableMap;
import com.landawn.abacus.util.N;

/**
 * The description of one statement handed to a {@link SQLAdapter}: target table, selected columns or written values,
 * a {@code where} fragment with {@code ?} placeholders, ordering and paging.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * SQLOptions options = SQLOptions.of("user")
 *         .what("id", "name")
 *         .where("\"status\" = ? AND \"age\" > ?", "active", 18)
 *         .orderBy("\"name\"")
 *         .number(10);
 *
 * List<Map<String, Object>> rows = adapter.select(options);
 * }</pre>
 *
 * Identifiers in {@code where} and {@code orderBy} are written as-is, column names in {@code what} and {@code values} are escaped by the adapter.
 */
public final class SQLOptions {

    /**
     * The shape a select result is wanted in.
     */
    public enum Output {
        /** All rows as field maps. */
        ARR_ASSOC,

        /** The first row as a field map. */
        ARR_FIRST,

        /** The first row as an entity. */
        OBJECT,

        /** All rows as entities. */
        ARR_OBJECTS
    }

    private String table;

    private List<String> columns;

    private Map<String, Object> values;

    private String where;

    private List<Object> parameters;

    private String orderBy;

    private int number = -1;

    private int offset = -1;

    private Output output = Output.ARR_ASSOC;

    public static SQLOptions of(final String table) {
        return new SQLOptions().table(table);
    }

    public SQLOptions table(final String table) {
        this.table = table;
        return this;
    }

    public SQLOptions what(final String... columns) {
        return what(Arrays.asList(columns));
    }

    public SQLOptions what(final Collection<String> columns) {
        this.columns = N.isEmpty(columns) ? null : new ArrayList<>(columns);
        return this;
    }

    public SQLOptions values(final Map<String, ?> values) {
        this.values = values == null ? null : new LinkedHashMap<>(values);
        return this;
    }

    public SQLOptions where(final String condition, final Object... parameters) {
        this.where = condition;
        this.parameters = N.isEmpty(parameters) ? null : new ArrayList<>(Arrays.asList(parameters));
        return this;
    }

    public SQLOptions orderBy(final String orderBy) {
        this.orderBy = orderBy;
        return this;
    }

    public SQLOptions number(final int number) {
        this.number = number;
        return this;
    }

    public SQLOptions offset(final int offset) {
        this.offset = offset;
        return this;
    }

    public SQLOptions output(final Output output) {
        this.output = N.checkArgNotNull(output, "output");
        return this;
    }

    public String getTable() {
        return table;
    }

    public List<String> getColumns() {
        return columns == null ? ImmutableList.empty() : ImmutableList.wrap(columns);
    }

    public Map<String, Object> getValues() {
        return values == null ? ImmutableMap.empty() : ImmutableMap.wrap(values);
    }

    public String getWhere() {
        return where;
    }

    public List<Object> getParameters() {
        return parameters == null ? ImmutableList.empty() : ImmutableList.wrap(parameters);
    }

    public String getOrderBy() {
        return orderBy;
    }

    /**
     * @return the maximum number of rows, negative for no limit
     */
    public int getNumber() {
        return number;
    }

    public int getOffset() {
        return offset;
    }

    public Output getOutput() {
        return output;
    }

    public SQLOptions copy() {
        final SQLOptions copy = new SQLOptions();
        copy.table = table;
        copy.columns = columns == null ? null : new ArrayList<>(columns);
        copy.values = values == null ? null : new LinkedHashMap<>(values);
        copy.where = where;
        copy.parameters = parameters == null ? null : new ArrayList<>(parameters);
        copy.orderBy = orderBy;
        copy.number = number;
        copy.offset = offset;
        copy.output = output;

        return copy;
    }

    @Override
    public String toString() {
        return "SQLOptions{table=" + table + ", columns=" + columns + ", values=" + values + ", where=" + where + ", parameters=" + parameters + ", orderBy="
                + orderBy + ", number=" + number + ", offset=" + offset + ", output=" + output + "}";
    }
}
