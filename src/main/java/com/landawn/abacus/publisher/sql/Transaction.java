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

import com.landawn.abacus.exception.UncheckedSQLException;

/**
 * Groups the statements an {@link SQLAdapter} issues on the current thread, from {@link SQLAdapter#beginTransaction()}
 * until {@link #commit()} or {@link #rollback()}.
 *
 * <pre>{@code
 * final Transaction tran = adapter.beginTransaction();
 *
 * try {
 *     adapter.update(options);
 *     tran.commit();
 * } finally {
 *     tran.rollbackIfNotCommitted();
 * }
 * }</pre>
 */
public interface Transaction extends AutoCloseable {

    /**
     * @return an identifier for logging. Joined levels share it
     */
    String id();

    Status status();

    /**
     * @return {@code true} while statements can still be added and committed
     */
    boolean isActive();

    /**
     * @return {@code false} if {@link #rollback()} leaves the statements already issued in place
     */
    default boolean isRollbackSupported() {
        return true;
    }

    void commit() throws UncheckedSQLException;

    void rollback() throws UncheckedSQLException;

    /**
     * Does nothing after {@link #commit()} or {@link #rollback()}, rolls back otherwise.
     *
     * @throws UncheckedSQLException if the rollback failed
     */
    void rollbackIfNotCommitted() throws UncheckedSQLException;

    /**
     * Same as {@link #rollbackIfNotCommitted()}.
     */
    @Override
    default void close() throws UncheckedSQLException {
        rollbackIfNotCommitted();
    }

    enum Status {
        /** Open, nothing failed yet. */
        ACTIVE,
        /** A joined level rolled back: the transaction can only end in a rollback. */
        MARKED_ROLLBACK,
        COMMITTED,
        /** The commit failed, a rollback follows. */
        FAILED_COMMIT,
        ROLLED_BACK,
        FAILED_ROLLBACK
    }
}
