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

import java.util.Collection;
import java.util.Map;

import com.landawn.abacus.publisher.EntityRepository;
import com.landawn.abacus.publisher.PermanentObject;
import com.landawn.abacus.publisher.exception.UserException;
import com.landawn.abacus.publisher.sql.SQLAdapter;
import com.landawn.abacus.publisher.validation.ValidatedInput;
import com.landawn.abacus.publisher.validation.Validation;
import com.landawn.abacus.util.N;

/**
 * One write to the database, validated before it's run.
 *
 * <p>{@link #validate()} checks the operation and records the result, {@link #runIfValid()} runs it only if the last
 * validation passed. {@link #run()} skips validation, callers which already trust the data may use it directly.
 * A failed write is reported by a {@code 0} result, never by an exception.</p>
 *
 * @param <T> the entity type
 * @see TransactionOperationSet
 */
public abstract class TransactionOperation<T extends PermanentObject> {

    protected final EntityRepository<T> repository;

    private TransactionOperationSet transactionOperationSet;

    private SQLAdapter sqlAdapter;

    private Boolean valid = null;

    private Validation validation;

    protected TransactionOperation(final EntityRepository<T> repository) {
        this.repository = N.checkArgNotNull(repository, "repository");
    }

    /**
     * Checks this operation. The result replaces the one of any previous call.
     *
     * @return the errors found
     */
    public final Validation validate() {
        final Validation result = new Validation();
        final boolean accepted = doValidate(result);

        validation = result;
        valid = accepted && result.isValid();

        return result;
    }

    /**
     *
     * @param validation receives the errors
     * @return {@code false} to reject the operation, even without error
     */
    protected abstract boolean doValidate(Validation validation);

    /**
     * Writes to the database, without validation.
     *
     * @return the number of affected rows, {@code 0} if the write failed
     */
    public abstract int run();

    /**
     * Runs this operation if the last call to {@link #validate()} accepted it.
     *
     * @return the result of {@link #run()}, or {@code 0} if the operation wasn't validated or was rejected
     */
    public final int runIfValid() {
        return isValid() ? run() : 0;
    }

    /**
     * @return {@code true} if the last call to {@link #validate()} accepted this operation, {@code false} if it wasn't validated
     */
    public boolean isValid() {
        return Boolean.TRUE.equals(valid);
    }

    /**
     * @return the result of the last call to {@link #validate()}, an empty one if it wasn't validated
     */
    public Validation getValidation() {
        return validation == null ? new Validation() : validation;
    }

    /**
     * Undoes the in-memory effects of a successful {@link #run()} after the transaction it ran in was rolled back.
     * Does nothing by default.
     */
    protected void onRolledBack() {
        // no-op by default
    }

    public EntityRepository<T> getRepository() {
        return repository;
    }

    /**
     * @return the adapter of this operation, else the one of its set, else the one of its repository
     */
    public SQLAdapter getSQLAdapter() {
        if (sqlAdapter != null) {
            return sqlAdapter;
        } else if (transactionOperationSet != null && transactionOperationSet.hasSQLAdapter()) {
            return transactionOperationSet.getSQLAdapter();
        } else {
            return repository.getSQLAdapter();
        }
    }

    public void setSQLAdapter(final SQLAdapter sqlAdapter) {
        this.sqlAdapter = sqlAdapter;
    }

    public TransactionOperationSet getTransactionOperationSet() {
        return transactionOperationSet;
    }

    void setTransactionOperationSet(final TransactionOperationSet transactionOperationSet) {
        this.transactionOperationSet = transactionOperationSet;
    }

    /**
     * Runs the field validator, then the whole-payload check of the repository if no field failed.
     *
     * @return the validated payload
     */
    Map<String, Object> checkInput(final Map<String, ?> input, final Collection<String> fields, final T ref, final Validation validation) {
        final ValidatedInput validated = repository.checkUserInput(input, fields, ref, false);
        validation.merge(validated.validation());

        if (validated.isValid()) {
            try {
                repository.checkForObject(validated.data(), ref);
            } catch (final UserException e) {
                validation.addError(e, repository.getDomain(), Validation.DEFAULT_SEVERITY);
            }
        }

        return validated.data();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{table=" + repository.getTable() + ", valid=" + valid + "}";
    }
}
