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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.BiConsumer;

import com.landawn.abacus.annotation.MayReturnNull;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.ImmutableList;
import com.landawn.abacus.util.N;

/**
 * Saves the entities changed while it's open when it's closed.
 *
 * <p>Units are bound to the current thread and can be nested: an entity which becomes dirty registers itself with the
 * innermost open unit. Failures of the saves are passed to the error sink of the unit and never thrown.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * try (UnitOfWork uow = UnitOfWork.begin()) {
 *     User user = users.load(userId);
 *     user.setValue("name", "Bob");
 * } // user.save() is called here
 * }</pre>
 *
 * @see PermanentObject#save()
 */
public final class UnitOfWork implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(UnitOfWork.class);

    static final String FLUSH_ERROR_LABEL = "PermanentObject::flush(): Saving";

    private static final BiConsumer<Throwable, String> DEFAULT_ERROR_SINK = (e, label) -> logger.error(label, e);

    private static final ThreadLocal<Deque<UnitOfWork>> threadLocalUnits = ThreadLocal.withInitial(ArrayDeque::new); //NOSONAR

    private final List<PermanentObject> entities = new ArrayList<>();

    private final BiConsumer<Throwable, String> errorSink;

    private boolean closed = false;

    private UnitOfWork(final BiConsumer<Throwable, String> errorSink) {
        this.errorSink = errorSink;
    }

    /**
     * Opens a unit whose save failures are logged at error level.
     *
     * @return the new unit, bound to the current thread
     */
    public static UnitOfWork begin() {
        return begin(DEFAULT_ERROR_SINK);
    }

    /**
     *
     * @param errorSink receives each save failure and a context label
     * @return the new unit, bound to the current thread
     */
    public static UnitOfWork begin(final BiConsumer<Throwable, String> errorSink) {
        final UnitOfWork unit = new UnitOfWork(N.checkArgNotNull(errorSink, "errorSink"));
        threadLocalUnits.get().push(unit);

        return unit;
    }

    /**
     * @return the innermost unit open on the current thread, or {@code null}
     */
    @MayReturnNull
    public static UnitOfWork current() {
        return threadLocalUnits.get().peek();
    }

    /**
     * Registers {@code entity} with the innermost unit open on the current thread. Does nothing if there is none.
     *
     * @param entity the entity which became dirty
     */
    static void register(final PermanentObject entity) {
        final UnitOfWork unit = current();

        if (unit != null) {
            unit.add(entity);
        }
    }

    /**
     * Adds {@code entity} to this unit unless it's already there.
     *
     * @param entity the entity to save on {@link #flush()}
     */
    public void add(final PermanentObject entity) {
        N.checkArgNotNull(entity, "entity");
        N.checkState(!closed, "UnitOfWork is already closed");

        for (final PermanentObject e : entities) {
            if (e == entity) {
                return;
            }
        }

        entities.add(entity);
    }

    public List<PermanentObject> getEntities() {
        return ImmutableList.copyOf(entities);
    }

    /**
     * Saves every registered entity which still has changes and isn't deleted, then forgets them.
     *
     * @return the number of saved entities
     */
    public int flush() {
        if (entities.isEmpty()) {
            return 0;
        }

        final List<PermanentObject> toSave = new ArrayList<>(entities);
        entities.clear();

        int saved = 0;

        for (final PermanentObject entity : toSave) {
            if (!entity.hasChanges() || entity.isDeleted()) {
                continue;
            }

            try {
                if (entity.save()) {
                    saved++;
                } else {
                    errorSink.accept(new IllegalStateException("Failed to save " + entity), FLUSH_ERROR_LABEL);
                }
            } catch (final RuntimeException e) {
                errorSink.accept(e, FLUSH_ERROR_LABEL);
            }
        }

        return saved;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Flushes this unit and unbinds it from the current thread.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }

        try {
            flush();
        } finally {
            closed = true;

            final Deque<UnitOfWork> units = threadLocalUnits.get();
            units.remove(this);

            if (units.isEmpty()) {
                threadLocalUnits.remove();
            }
        }
    }
}
