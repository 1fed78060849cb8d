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

import java.sql.Connection;
import java.sql.SQLException;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import javax.sql.DataSource;

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.util.N;

/**
 * One level of a transaction on a connection of a {@link DataSource}, bound to the thread that began it.
 * While it's open, every statement {@link JdbcSQLAdapter} issues for the same data source on this thread runs on its connection.
 *
 * <p>Beginning a transaction on a data source which already has one open on the current thread opens a new level on the same connection.
 * The connection is committed when the last open level commits. A rollback at any level makes that final step a rollback.</p>
 */
public final class JdbcTransaction implements Transaction {

    private static final Logger logger = LoggerFactory.getLogger(JdbcTransaction.class);

    private static final AtomicLong idGenerator = new AtomicLong();

    private static final ThreadLocal<Map<DataSource, Shared>> threadLocalShared = ThreadLocal.withInitial(IdentityHashMap::new);

    private final Shared shared;

    private boolean completed;

    private JdbcTransaction(final Shared shared) {
        this.shared = shared;
    }

    /**
     * Opens a transaction on {@code ds}, or a new level of the one already open on the current thread.
     *
     * @param ds the data source
     * @return the new level
     * @throws UncheckedSQLException if no connection could be set up
     * @throws IllegalStateException if the open transaction is already marked for rollback
     */
    static JdbcTransaction begin(final DataSource ds) throws UncheckedSQLException {
        N.checkArgNotNull(ds, "ds");

        final Map<DataSource, Shared> sharedMap = threadLocalShared.get();
        Shared shared = sharedMap.get(ds);

        if (shared == null) {
            shared = Shared.open(ds);
            sharedMap.put(ds, shared);

            logger.info("Transaction(id={}) started", shared.id);
        } else {
            N.checkState(shared.status == Status.ACTIVE, "Transaction(id=" + shared.id + ") can't be joined, its status is " + shared.status);

            logger.debug("Transaction(id={}) joined", shared.id);
        }

        shared.openLevels++;

        return new JdbcTransaction(shared);
    }

    /**
     * @param ds the data source
     * @return the connection of the transaction open on {@code ds} on the current thread, or {@code null}
     */
    static Connection currentConnection(final DataSource ds) {
        final Shared shared = threadLocalShared.get().get(ds);

        return shared == null ? null : shared.conn;
    }

    @Override
    public String id() {
        return shared.id;
    }

    public Connection connection() {
        return shared.conn;
    }

    @Override
    public Status status() {
        return shared.status;
    }

    /**
     * @return {@code true} if this level is still open and nothing marked the transaction for rollback
     */
    @Override
    public boolean isActive() {
        return !completed && shared.status == Status.ACTIVE;
    }

    /**
     * Completes this level. The connection is committed only if this is the last open level and no level rolled back.
     *
     * @throws UncheckedSQLException if the commit failed. The connection was rolled back
     * @throws IllegalStateException if this level is already completed
     */
    @Override
    public void commit() throws UncheckedSQLException {
        complete(true);
    }

    /**
     * Completes this level and marks the transaction for rollback. The connection is rolled back when the last open level completes.
     *
     * @throws UncheckedSQLException if the rollback failed
     * @throws IllegalStateException if this level is already completed
     */
    @Override
    public void rollback() throws UncheckedSQLException {
        complete(false);
    }

    @Override
    public void rollbackIfNotCommitted() throws UncheckedSQLException {
        if (!completed) {
            complete(false);
        }
    }

    private void complete(final boolean commit) throws UncheckedSQLException {
        N.checkState(!completed, "Transaction(id=" + shared.id + ") is already completed at this level");

        completed = true;

        if (!commit && shared.status == Status.ACTIVE) {
            shared.status = Status.MARKED_ROLLBACK;
        }

        if (--shared.openLevels > 0) {
            return;
        }

        final Map<DataSource, Shared> sharedMap = threadLocalShared.get();
        sharedMap.remove(shared.ds);

        if (sharedMap.isEmpty()) {
            threadLocalShared.remove();
        }

        try {
            if (shared.status == Status.ACTIVE) {
                shared.commit();
            } else {
                if (commit) {
                    logger.warn("Transaction(id={}) is marked for rollback, rolling it back instead of committing", shared.id);
                }

                shared.rollback();
            }
        } finally {
            shared.release();
        }
    }

    @Override
    public String toString() {
        return "JdbcTransaction={id=" + shared.id + ", status=" + shared.status + ", completed=" + completed + "}";
    }

    /**
     * The connection and status shared by all the levels of a transaction.
     */
    private static final class Shared {

        private final String id;

        private final DataSource ds;

        private final Connection conn;

        private final boolean autoCommit;

        private Status status = Status.ACTIVE;

        private int openLevels;

        private Shared(final DataSource ds, final Connection conn, final boolean autoCommit) {
            this.id = "jdbc_" + idGenerator.incrementAndGet() + "_" + Thread.currentThread().getName();
            this.ds = ds;
            this.conn = conn;
            this.autoCommit = autoCommit;
        }

        static Shared open(final DataSource ds) throws UncheckedSQLException {
            Connection conn = null;

            try {
                conn = ds.getConnection();
                final boolean autoCommit = conn.getAutoCommit();
                conn.setAutoCommit(false);

                return new Shared(ds, conn, autoCommit);
            } catch (final SQLException e) {
                JdbcSQLAdapter.closeQuietly(null, null, conn);

                throw new UncheckedSQLException("Failed to begin a transaction", e);
            }
        }

        void commit() throws UncheckedSQLException {
            try {
                conn.commit();
                status = Status.COMMITTED;

                logger.info("Transaction(id={}) committed", id);
            } catch (final SQLException e) {
                status = Status.FAILED_COMMIT;

                final UncheckedSQLException failure = new UncheckedSQLException("Failed to commit transaction(id=" + id + ")", e);

                try {
                    rollback();
                } catch (final UncheckedSQLException rollbackFailure) {
                    failure.addSuppressed(rollbackFailure);
                }

                throw failure;
            }
        }

        void rollback() throws UncheckedSQLException {
            try {
                conn.rollback();
                status = Status.ROLLED_BACK;

                logger.warn("Transaction(id={}) rolled back", id);
            } catch (final SQLException e) {
                status = Status.FAILED_ROLLBACK;

                throw new UncheckedSQLException("Failed to roll back transaction(id=" + id + ")", e);
            }
        }

        void release() {
            try {
                conn.setAutoCommit(autoCommit);
            } catch (final SQLException e) {
                logger.warn("Failed to reset auto-commit of the connection of transaction(id=" + id + ")", e);
            } finally {
                JdbcSQLAdapter.closeQuietly(null, null, conn);
            }
        }
    }
}
