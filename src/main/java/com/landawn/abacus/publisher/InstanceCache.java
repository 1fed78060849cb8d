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

package com.landawn.abacus.publisher;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import com.landawn.abacus.annotation.MayReturnNull;
import com.landawn.abacus.util.N;

/**
 * The identity map of one entity type: at most one in-memory instance per id, so that every caller loading the same row
 * shares the same object and sees the changes the others made on it.
 *
 * <p>Ids are normalized before lookup: {@code 12}, {@code 12L} and {@code "12"} are the same key.</p>
 *
 * <p>Entries are only removed by {@link #evictDeleted()}, {@link #remove(Object)} and {@link #clear()}, unless the cache
 * is created with a maximum size, in which case the least recently used entry is dropped when the maximum is exceeded.
 * A dropped instance stays usable, but a later load returns a new instance for the same row.</p>
 *
 * <p>Not thread-safe, like the rest of the entity layer.</p>
 *
 * @param <T> the entity type
 */
public final class InstanceCache<T extends PermanentObject> {

    private final int maxSize;

    private final Map<Object, T> instances;

    public InstanceCache() {
        this(-1);
    }

    /**
     *
     * @param maxSize the maximum number of cached instances, not positive for unbounded
     */
    public InstanceCache(final int maxSize) {
        this.maxSize = maxSize;

        if (maxSize > 0) {
            this.instances = new LinkedHashMap<>(16, 0.75f, true) {
                private static final long serialVersionUID = 1L;

                @Override
                protected boolean removeEldestEntry(final Map.Entry<Object, T> eldest) {
                    return size() > InstanceCache.this.maxSize;
                }
            };
        } else {
            this.instances = new LinkedHashMap<>();
        }
    }

    /**
     * Normalizes an entity id. Valid ids are positive integers, given as any integral {@code Number} or as a string of digits.
     *
     * @param id the id to normalize
     * @return the id as a {@code Long}, or {@code null} if {@code id} isn't a valid id
     */
    @MayReturnNull
    public static Long normalizeId(final Object id) {
        long value = 0;

        if (id instanceof Long || id instanceof Integer || id instanceof Short || id instanceof Byte) {
            value = ((Number) id).longValue();
        } else if (id instanceof BigInteger bi) {
            if (bi.bitLength() > 63) {
                return null;
            }

            value = bi.longValue();
        } else if (id instanceof BigDecimal bd) {
            try {
                value = bd.longValueExact();
            } catch (final ArithmeticException e) {
                return null;
            }
        } else if (id instanceof CharSequence cs) {
            final String str = cs.toString().trim();

            if (str.isEmpty() || str.length() > 18) {
                return null;
            }

            for (int i = 0, len = str.length(); i < len; i++) {
                if (str.charAt(i) < '0' || str.charAt(i) > '9') {
                    return null;
                }
            }

            value = Long.parseLong(str);
        }

        return value > 0 ? value : null;
    }

    @MayReturnNull
    public T get(final Object id) {
        final Long key = normalizeId(id);

        return key == null ? null : instances.get(key);
    }

    public boolean contains(final Object id) {
        final Long key = normalizeId(id);

        return key != null && instances.containsKey(key);
    }

    /**
     * Caches {@code entity} unless an instance with the same id is already cached.
     *
     * @param entity the entity to cache
     * @return the cached instance for the id of {@code entity}: the one already there, or {@code entity}
     */
    public T putIfAbsent(final T entity) {
        N.checkArgNotNull(entity, "entity");

        final Long key = normalizeId(entity.id());

        if (key == null) {
            return entity;
        }

        final T cached = instances.get(key);

        if (cached != null) {
            return cached;
        }

        instances.put(key, entity);

        return entity;
    }

    @MayReturnNull
    public T remove(final Object id) {
        final Long key = normalizeId(id);

        return key == null ? null : instances.remove(key);
    }

    /**
     * Removes the instances marked as deleted.
     *
     * @return the number of removed instances
     */
    public int evictDeleted() {
        int count = 0;
        final Iterator<T> iter = instances.values().iterator();

        while (iter.hasNext()) {
            if (iter.next().isDeleted()) {
                iter.remove();
                count++;
            }
        }

        return count;
    }

    public void clear() {
        instances.clear();
    }

    public int size() {
        return instances.size();
    }

    /**
     * @return the maximum size, not positive if unbounded
     */
    public int getMaxSize() {
        return maxSize;
    }

    @Override
    public String toString() {
        return "InstanceCache{size=" + instances.size() + ", maxSize=" + maxSize + "}";
    }
}
