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

import java.util.LinkedHashMap;

import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.publisher.EntityRepository;
import com.landawn.abacus.publisher.PermanentObject;
import com.landawn.abacus.publisher.sql.SQLOptions;
import com.landawn.abacus.publisher.validation.Validation;
import com.landawn.abacus.util.N;

/**
 * Deletes the row of an entity and marks the entity as deleted.
 *
 * @param <T> the entity type
 */
public class DeleteTransactionOperation<T extends PermanentObject> extends TransactionOperation<T> {

    private static final Logger logger = LoggerFactory.getLogger(DeleteTransactionOperation.class);

    private final T object;

    public DeleteTransactionOperation(final EntityRepository<T> repository, final T object) {
        super(repository);

        this.object = N.checkArgNotNull(object, "object");
    }

    /**
     * Rejects an entity which is already deleted.
     */
    @Override
    protected boolean doValidate(final Validation validation) {
        if (object.isDeleted()) {
            validation.addError("alreadyDeleted", repository.getDomain());
            return false;
        }

        return true;
    }

    /**
     *
     * @return {@code 1} if the row was deleted, {@code 0} if it wasn't found or the delete failed
     */
    @Override
    public int run() {
        final SQLOptions options = repository.select().where(repository.escapeIdentifier(repository.getIDField()) + " = ?", object.id()).number(1);
        final int affectedRows;

        try {
            affectedRows = getSQLAdapter().delete(options);
        } catch (final UncheckedSQLException e) {
            logger.error("Failed to delete " + object, e);
            return 0;
        }

        if (affectedRows == 0) {
            logger.warn("No row deleted for {}", object);
            return 0;
        }

        object.markAsDeleted();

        repository.onSaved(new LinkedHashMap<>(), object.id(), object);

        return affectedRows;
    }

    @Override
    protected void onRolledBack() {
        object.unmarkAsDeleted();
        object.reload();
    }

    public T getObject() {
        return object;
    }
}
