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
import java.util.LinkedHashMap;
import java.util.Map;

import com.landawn.abacus.annotation.MayReturnNull;
import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.publisher.EntityRepository;
import com.landawn.abacus.publisher.PermanentObject;
import com.landawn.abacus.publisher.sql.SQLOptions;
import com.landawn.abacus.publisher.validation.Validation;
import com.landawn.abacus.util.ImmutableList;
import com.landawn.abacus.util.ImmutableMap;
import com.landawn.abacus.util.N;

/**
 * Updates an entity, then re-reads it.
 *
 * <p>Before validation the payload is the input as given, which lets {@link PermanentObject#save()} run it directly.
 * Validation replaces it with the output of the field validator, where values equal to the current ones are left out.
 * An empty payload is rejected before the audit fields are added.</p>
 *
 * @param <T> the entity type
 */
public class UpdateTransactionOperation<T extends PermanentObject> extends TransactionOperation<T> {

    private static final Logger logger = LoggerFactory.getLogger(UpdateTransactionOperation.class);

    private final Map<String, ?> input;

    private final Collection<String> fields;

    private final T object;

    private Map<String, Object> data;

    /**
     *
     * @param repository the repository of the entity type
     * @param input the raw input
     * @param fields the fields that may be written, {@code null} for the editable fields
     * @param object the entity to update
     */
    public UpdateTransactionOperation(final EntityRepository<T> repository, final Map<String, ?> input, final Collection<String> fields, final T object) {
        super(repository);

        this.input = N.checkArgNotNull(input, "input");
        this.fields = fields == null ? null : ImmutableList.copyOf(fields);
        this.object = N.checkArgNotNull(object, "object");
        this.data = new LinkedHashMap<>(input);
    }

    @Override
    protected boolean doValidate(final Validation validation) {
        if (object.isDeleted()) {
            validation.addError("alreadyDeleted", repository.getDomain());
            data = new LinkedHashMap<>();
            return false;
        }

        data = checkInput(input, fields, object, validation);

        if (data.isEmpty()) {
            return false;
        }

        return repository.onValidUpdate(data, validation);
    }

    /**
     * Writes the payload to the row of the entity, then reloads the entity.
     *
     * @return the number of updated rows, {@code 0} if there was nothing to write or the update failed
     */
    @Override
    public int run() {
        final Map<String, Object> payload = new LinkedHashMap<>(data);
        final SQLOptions options = repository.extractUpdateQuery(payload, object);

        if (payload.isEmpty()) {
            return 0;
        }

        final int affectedRows;

        try {
            affectedRows = getSQLAdapter().update(options);
        } catch (final UncheckedSQLException e) {
            logger.error("Failed to update " + object, e);
            return 0;
        }

        if (affectedRows == 0) {
            logger.warn("No row updated for {}", object);
            return 0;
        }

        object.reload();

        repository.onSaved(payload, object.id(), object);

        return affectedRows;
    }

    @Override
    protected void onRolledBack() {
        object.reload();
    }

    public T getObject() {
        return object;
    }

    /**
     * @return the payload to write
     */
    public Map<String, Object> getData() {
        return ImmutableMap.wrap(data);
    }

    public Map<String, ?> getInput() {
        return input;
    }

    @MayReturnNull
    public Collection<String> getFields() {
        return fields;
    }
}
