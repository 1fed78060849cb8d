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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * Registry of the shared adapters, by instance name. Entities whose schema names no instance use {@link #DEFAULT_INSTANCE}.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * SQLAdapters.register(new JdbcSQLAdapter(dataSource));                  // default instance
 * SQLAdapters.register("archive", new JdbcSQLAdapter(archiveDataSource));
 * }</pre>
 */
public final class SQLAdapters {

    private static final Logger logger = LoggerFactory.getLogger(SQLAdapters.class);

    public static final String DEFAULT_INSTANCE = "default";

    private static final Map<String, SQLAdapter> adapters = new ConcurrentHashMap<>();

    private SQLAdapters() {
        // singleton
    }

    public static void register(final SQLAdapter adapter) {
        register(DEFAULT_INSTANCE, adapter);
    }

    public static void register(final String instanceName, final SQLAdapter adapter) {
        N.checkArgNotNull(adapter, "adapter");

        final SQLAdapter previous = adapters.put(toKey(instanceName), adapter);

        if (previous != null && previous != adapter) {
            logger.warn("SQL adapter for instance '{}' is replaced", toKey(instanceName));
        }
    }

    /**
     *
     * @param instanceName the instance name, {@code null} for the default one
     * @return the registered adapter
     * @throws IllegalStateException if no adapter is registered under this name
     */
    public static SQLAdapter get(final String instanceName) throws IllegalStateException {
        final SQLAdapter adapter = adapters.get(toKey(instanceName));

        if (adapter == null) {
            throw new IllegalStateException("No SQL adapter is registered for instance: " + toKey(instanceName));
        }

        return adapter;
    }

    public static boolean contains(final String instanceName) {
        return adapters.containsKey(toKey(instanceName));
    }

    public static SQLAdapter unregister(final String instanceName) {
        return adapters.remove(toKey(instanceName));
    }

    public static void clear() {
        adapters.clear();
    }

    private static String toKey(final String instanceName) {
        return Strings.isEmpty(instanceName) ? DEFAULT_INSTANCE : instanceName;
    }
}
