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

package com.landawn.abacus.publisher.transaction;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.publisher.sql.SQLAdapter;
import com.landawn.abacus.publisher.sql.Transaction;
import com.landawn.abacus.publisher.validation.Validation;
import com.landawn.abacus.util.ImmutableList;
import com.landawn.abacus.util.N;

/**
 * Operations saved together: all of them are validated before any of them runs.
 *
 * <p>The operations run in the order they were added, inside the transaction of {@link #getSQLAdapter()}.
 * If one of them fails, the transaction is rolled back and the operations already run undo their in-memory effects.
 * With an adapter which doesn't support rollback, the writes before the failed one stay applied, and so do their in-memory effects.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * TransactionOperationSet set = new TransactionOperationSet();
 * set.add(orders.getCreateOperation(orderInput, null));
 * set.add(customer.getRepository().getUpdateOperation(customer, N.asMap("last_order", now), null));
 *
 * if (!set.save()) {
 *     List<ValidationReport> reports = set.getValidation().getReports(translator);
 * }
 * }</pre>
 */
public class TransactionOperationSet implements Iterable<TransactionOperation<?>> {

    private static final Logger logger = LoggerFactory.getLogger(TransactionOperationSet.class);

    private final List<TransactionOperation<?>> operations = new ArrayList<>();

    private final SQLAdapter sqlAdapter;

    private Validation validation = new Validation();

    /**
     * Creates a set using the adapter of its first operation.
     */
    public TransactionOperationSet() {
        this(null);
    }

    /**
     *
     * @param sqlAdapter the adapter of every operation which has none of its own, {@code null} to use the one of the first operation
     */
    public TransactionOperationSet(final SQLAdapter sqlAdapter) {
        this.sqlAdapter = sqlAdapter;
    }

    /**
     *
     * @param operation the operation to add
     * @return this set
     * @throws IllegalArgumentException if {@code operation} is {@code null} or already in this set
     */
    public TransactionOperationSet add(final TransactionOperation<?> operation) {
        N.checkArgNotNull(operation, "operation");

        for (final TransactionOperation<?> e : operations) {
            N.checkArgument(e != operation, "The operation is already in this set: " + operation);
        }

        operation.setTransactionOperationSet(this);
        operations.add(operation);

        return this;
    }

    boolean hasSQLAdapter() {
        return sqlAdapter != null;
    }

    /**
     * @return the adapter given at creation, else the one of the first operation
     * @throws IllegalStateException if the set has neither
     */
    public SQLAdapter getSQLAdapter() {
        if (sqlAdapter != null) {
            return sqlAdapter;
        }

        N.checkState(!operations.isEmpty(), "No SQLAdapter: the set is empty");

        return operations.get(0).getSQLAdapter();
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    @Override
    public Iterator<TransactionOperation<?>> iterator() {
        return ImmutableList.copyOf(operations).iterator();
    }

    /**
     * @return the errors of the last call to {@link #validate()} or {@link #save()}
     */
    public Validation getValidation() {
        return validation;
    }

    /**
     * Validates every operation, without stopping at the first invalid one.
     *
     * @return the errors of all operations
     */
    public Validation validate() {
        final Validation result = new Validation();

        for (final TransactionOperation<?> operation : operations) {
            result.merge(operation.validate());
        }

        validation = result;

        return result;
    }

    /**
     * Validates every operation, then runs them all if all are valid.
     *
     * @return {@code true} if the set is empty or every operation ran, {@code false} if one of them is invalid or failed
     */
    public boolean save() {
        if (operations.isEmpty()) {
            return true;
        }

        validate();

        for (final TransactionOperation<?> operation : operations) {
            if (!operation.isValid()) {
                logger.debug("Operation {} is invalid, none of the {} operations is run: {}", operation, operations.size(), validation);
                return false;
            }
        }

        return runOperations();
    }

    /**
     * Runs every operation, in order, inside one transaction.
     *
     * @return {@code true} if every operation ran and the transaction was committed
     */
    protected boolean runOperations() {
        final Transaction tran = getSQLAdapter().beginTransaction();
        final List<TransactionOperation<?>> ran = new ArrayList<>(operations.size());
        boolean committed = false;

        try {
            for (final TransactionOperation<?> operation : operations) {
                if (operation.run() == 0) {
                    logger.warn("Operation {} failed after {} of {} operations, rolling back", operation, ran.size(), operations.size());
                    return false;
                }

                ran.add(operation);
            }

            try {
                tran.commit();
            } catch (final UncheckedSQLException e) {
                logger.error("Failed to commit " + tran, e);
                return false;
            }

            committed = true;

            return true;
        } finally {
            if (!committed) {
                rollback(tran, ran);
            }
        }
    }

    private void rollback(final Transaction tran, final List<TransactionOperation<?>> ran) {
        try {
            tran.rollbackIfNotCommitted();
        } catch (final UncheckedSQLException e) {
            logger.error("Failed to roll back " + tran, e);
        }

        if (!tran.isRollbackSupported()) {
            if (!ran.isEmpty()) {
                logger.warn("{} does not support rollback, {} of {} operations stay applied", tran, ran.size(), operations.size());
            }

            return;
        }

        for (int i = ran.size() - 1; i >= 0; i--) {
            ran.get(i).onRolledBack();
        }
    }

    @Override
    public String toString() {
        return "TransactionOperationSet{size=" + operations.size() + "}";
    }
}
