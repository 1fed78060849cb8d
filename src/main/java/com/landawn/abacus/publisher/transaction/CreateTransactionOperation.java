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
import com.landawn.abacus.publisher.InstanceCache;
import com.landawn.abacus.publisher.PermanentObject;
import com.landawn.abacus.publisher.sql.InsertResult;
import com.landawn.abacus.publisher.sql.SQLOptions;
import com.landawn.abacus.publisher.validation.Validation;
import com.landawn.abacus.util.ImmutableList;
import com.landawn.abacus.util.ImmutableMap;
import com.landawn.abacus.util.N;

/**
 * Inserts a new entity built from raw input.
 *
 * <p>Validation runs the field validator of the entity type on the input, then
 * {@link EntityRepository#onValidCreate(Map, Validation)}, which adds the audit fields of the create events.</p>
 *
 * @param <T> the entity type
 */
public class CreateTransactionOperation<T extends PermanentObject> extends TransactionOperation<T> {

    private static final Logger logger = LoggerFactory.getLogger(CreateTransactionOperation.class);

    private final Map<String, ?> input;

    private final Collection<String> fields;

    private Map<String, Object> data;

    private Object insertId;

    /**
     *
     * @param repository the repository of the entity type
     * @param input the raw input
     * @param fields the fields that may be written, {@code null} for the editable fields
     */
    public CreateTransactionOperation(final EntityRepository<T> repository, final Map<String, ?> input, final Collection<String> fields) {
        super(repository);

        this.input = N.checkArgNotNull(input, "input");
        this.fields = fields == null ? null : ImmutableList.copyOf(fields);
    }

    @Override
    protected boolean doValidate(final Validation validation) {
        data = checkInput(input, fields, null, validation);

        return repository.onValidCreate(data, validation);
    }

    /**
     * Inserts the validated payload.
     *
     * @return {@code 1} if the row was inserted, {@code 0} if the insert failed
     * @throws IllegalStateException if this operation wasn't validated
     */
    @Override
    public int run() {
        N.checkState(data != null, "validate() must be called before run()");

        final Map<String, Object> payload = new LinkedHashMap<>(data);
        final SQLOptions options = repository.extractCreateQuery(payload);
        final InsertResult result;

        try {
            result = getSQLAdapter().insert(options);
        } catch (final UncheckedSQLException e) {
            logger.error("Failed to insert into " + repository.getTable(), e);
            return 0;
        }

        if (!result.isSuccess()) {
            logger.error("No row inserted into {}", repository.getTable());
            return 0;
        }

        final Long id = InstanceCache.normalizeId(result.lastInsertId());
        insertId = id == null ? result.lastInsertId() : id;

        repository.onSaved(payload, insertId, null);

        return result.affectedRows();
    }

    @Override
    protected void onRolledBack() {
        insertId = null;
    }

    /**
     * @return the id of the inserted row, {@code null} until it's inserted
     */
    @MayReturnNull
    public Object getInsertId() {
        return insertId;
    }

    /**
     * @return the validated payload, empty until validated
     */
    public Map<String, Object> getData() {
        return data == null ? ImmutableMap.empty() : ImmutableMap.wrap(data);
    }

    public Map<String, ?> getInput() {
        return input;
    }

    @MayReturnNull
    public Collection<String> getFields() {
        return fields;
    }
}
