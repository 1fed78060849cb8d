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

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.landawn.abacus.annotation.Internal;
import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.publisher.exception.FieldNotFoundException;
import com.landawn.abacus.publisher.exception.ImmutableFieldException;
import com.landawn.abacus.publisher.exception.OutOfDateSchemaException;
import com.landawn.abacus.publisher.transaction.DeleteTransactionOperation;
import com.landawn.abacus.publisher.transaction.UpdateTransactionOperation;
import com.landawn.abacus.publisher.validation.Validation;
import com.landawn.abacus.util.ImmutableList;
import com.landawn.abacus.util.ImmutableMap;
import com.landawn.abacus.util.N;

/**
 * The in-memory image of one row, with controlled mutation and lazy persistence.
 *
 * <p>Field values are read with {@link #getValue(String)} and written with {@link #setValue(String, Object)}. A write does not touch
 * the database: it makes the field <i>dirty</i>, remembering the value the field had at the last load or save. Writing the remembered
 * value back makes the field clean again. {@link #save()} writes exactly the dirty fields, {@link #revert()} drops them.</p>
 *
 * <p>Untrusted input goes through {@link #update(Map, Collection)} instead, which validates it with the {@link EntitySchema#getValidator() validator}
 * of the entity type before writing. Entities are loaded and created through their {@link EntityRepository}, which guarantees there is
 * at most one cached instance per row.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * public class User extends PermanentObject {
 *
 *     public static final EntitySchema SCHEMA = EntitySchema.builder("user")
 *             .fields("id", "name", "email", "create_date", "create_ip")
 *             .editableFields("name", "email")
 *             .build();
 *
 *     public User(final EntityRepository<User> repository, final Map<String, Object> row) {
 *         super(repository, row);
 *     }
 *
 *     public String getName() {
 *         return (String) getValue("name");
 *     }
 * }
 *
 * EntityRepository<User> users = new EntityRepository<>(User.class, User.SCHEMA, User::new);
 *
 * User user = users.load(12L, false);
 * user.setValue("name", "Alice");
 * user.save();
 * }</pre>
 *
 * <p>An entity is not thread-safe. Once deleted, it can still be read and written in memory but can't be saved anymore.</p>
 *
 * @see EntityRepository
 * @see UnitOfWork
 */
public abstract class PermanentObject {

    private static final Logger logger = LoggerFactory.getLogger(PermanentObject.class);

    static final DateTimeFormatter W3C_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssxxx");

    private final EntityRepository<? extends PermanentObject> repository;

    private final Map<String, Object> data = new LinkedHashMap<>();

    // Key set is the dirty set. Values are the ones captured at the last load or save.
    private final Map<String, Object> originalData = new LinkedHashMap<>();

    private boolean deleted = false;

    private boolean onSavedInProgress = false;

    /**
     * Builds an entity from a full row.
     *
     * @param repository the repository of the entity type
     * @param row the row, every declared field should be present
     * @throws OutOfDateSchemaException if a declared field is missing from {@code row} and field integrity is checked
     */
    protected PermanentObject(final EntityRepository<? extends PermanentObject> repository, final Map<String, ?> row) throws OutOfDateSchemaException {
        N.checkArgNotNull(repository, "repository");
        N.checkArgNotNull(row, "row");

        this.repository = repository;

        fill(row);

        if (repository.getSettings().isDevMode()) {
            checkIntegrity();
        }
    }

    private void fill(final Map<String, ?> row) {
        final boolean checkFieldIntegrity = repository.getSettings().isCheckFieldIntegrity();

        for (final String field : getSchema().getFields()) {
            Object value = null;

            if (row.containsKey(field)) {
                value = row.get(field);
            } else if (checkFieldIntegrity) {
                throw new OutOfDateSchemaException(getClass().getSimpleName(), field);
            }

            data.put(field, parseFieldSqlValue(field, value));
        }

        originalData.clear();
    }

    /**
     * Converts a value read from the database before it's stored in this entity. Returns {@code value} by default.
     *
     * @param field the field name
     * @param value the value read from the database
     * @return the value to store
     */
    protected Object parseFieldSqlValue(final String field, final Object value) {
        return value;
    }

    /**
     * Checks the consistency of this entity with its type. Called after construction in dev mode, does nothing by default.
     */
    public void checkIntegrity() {
        // no-op by default
    }

    /**
     * Called once after each successful {@link #save()}, with the saved values. Does nothing by default.
     * Calling {@code save()} from here doesn't trigger this hook again.
     *
     * @param savedData the saved field values
     */
    protected void onSaved(final Map<String, Object> savedData) {
        // no-op by default
    }

    public EntityRepository<? extends PermanentObject> getRepository() {
        return repository;
    }

    public EntitySchema getSchema() {
        return repository.getSchema();
    }

    public Object id() {
        return data.get(getSchema().getIdField());
    }

    /**
     * @return {@code <table>#<id>}, unique across entity types
     */
    public String uid() {
        return getSchema().getTable() + "#" + id();
    }

    /**
     *
     * @param key a declared field, or {@code null} for all of them
     * @return the current value, or a read-only map of all current values if {@code key} is {@code null}
     * @throws FieldNotFoundException if {@code key} isn't a declared field
     */
    public Object getValue(final String key) throws FieldNotFoundException {
        if (key == null) {
            return getValue();
        }

        if (!data.containsKey(key)) {
            throw new FieldNotFoundException(key, getClass().getSimpleName());
        }

        return data.get(key);
    }

    public Map<String, Object> getValue() {
        return ImmutableMap.wrap(data);
    }

    /**
     * Changes the in-memory value of a field. Nothing is written until {@link #save()}.
     *
     * <p>The first change of a field since the last load or save remembers the previous value.
     * Setting that remembered value back cancels the change.</p>
     *
     * @param key a declared field, other than the id field
     * @param value the new value
     * @return this entity
     * @throws FieldNotFoundException if {@code key} isn't a declared field
     * @throws ImmutableFieldException if {@code key} is the id field
     */
    public PermanentObject setValue(final String key, final Object value) throws FieldNotFoundException, ImmutableFieldException {
        if (key == null) {
            throw new IllegalArgumentException("nullKey");
        } else if (!getSchema().hasField(key)) {
            throw new FieldNotFoundException(key, getClass().getSimpleName());
        } else if (key.equals(getSchema().getIdField())) {
            throw new ImmutableFieldException(key);
        }

        final Object current = data.get(key);

        if (N.equals(current, value)) {
            return this;
        }

        if (!originalData.containsKey(key)) {
            originalData.put(key, current);
        } else if (N.equals(originalData.get(key), value)) {
            originalData.remove(key);
        }

        data.put(key, value);

        // an entity made dirty before the current unit was opened still has to be saved by it
        if (hasChanges()) {
            UnitOfWork.register(this);
        }

        return this;
    }

    public boolean hasChanges() {
        return !originalData.isEmpty();
    }

    /**
     * @return the dirty fields, in the order they were first changed
     */
    public List<String> listModifiedFields() {
        return ImmutableList.copyOf(originalData.keySet());
    }

    /**
     * @return the values the dirty fields had at the last load or save
     */
    public Map<String, Object> getOriginalValues() {
        return ImmutableMap.copyOf(originalData);
    }

    /**
     * Restores every dirty field to its remembered value. Nothing is read from or written to the database.
     */
    public void revert() {
        data.putAll(originalData);
        originalData.clear();
    }

    /**
     * Writes the dirty fields.
     *
     * <p>The values are not validated again: they are already the intended state. The entity is re-read after the write,
     * then {@link #onSaved(Map)} is called.</p>
     *
     * @return {@code true} if the dirty fields were written, {@code false} if there was nothing to write, the entity is deleted
     *         or the write failed. The fields stay dirty after a failure
     */
    public boolean save() {
        if (originalData.isEmpty() || deleted) {
            return false;
        }

        final Map<String, Object> savedData = new LinkedHashMap<>();

        for (final String field : originalData.keySet()) {
            savedData.put(field, data.get(field));
        }

        final UpdateTransactionOperation<PermanentObject> operation = repository().getUpdateOperation(this, savedData, savedData.keySet());

        if (operation.run() == 0) {
            return false;
        }

        originalData.clear();

        if (!onSavedInProgress) {
            onSavedInProgress = true;

            try {
                onSaved(savedData);
            } finally {
                onSavedInProgress = false;
            }
        }

        return true;
    }

    /**
     * Validates {@code input} and writes it.
     *
     * @param input the raw input
     * @param fields the fields that may be written, {@code null} for the editable fields
     * @return {@code 1} if the entity was updated, {@code 0} if the input was invalid, had no change or the write failed
     * @see #update(Map, Collection, Validation)
     */
    public int update(final Map<String, ?> input, final Collection<String> fields) {
        return update(input, fields, null);
    }

    /**
     * Validates {@code input} and writes it.
     *
     * @param input the raw input
     * @param fields the fields that may be written, {@code null} for the editable fields
     * @param validation receives the validation errors, may be {@code null}
     * @return {@code 1} if the entity was updated, {@code 0} if the input was invalid, had no change or the write failed
     */
    public int update(final Map<String, ?> input, final Collection<String> fields, final Validation validation) {
        final UpdateTransactionOperation<PermanentObject> operation = repository().getUpdateOperation(this, input, fields);
        final Validation result = operation.validate();

        if (validation != null) {
            validation.merge(result);
        }

        return operation.runIfValid();
    }

    /**
     * Deletes the row of this entity and marks it as deleted.
     *
     * @return {@code 1} if the row was deleted, {@code 0} if the entity was already deleted or the delete failed
     */
    public int remove() {
        if (deleted) {
            return 0;
        }

        final DeleteTransactionOperation<PermanentObject> operation = repository().getDeleteOperation(this);
        operation.validate();

        return operation.runIfValid();
    }

    /**
     * Removes this entity, then drops its data.
     *
     * @return {@code true} if the row was deleted
     */
    public boolean free() {
        if (remove() > 0) {
            data.clear();
            originalData.clear();

            return true;
        }

        return false;
    }

    /**
     * Re-reads every field from the database and drops the pending changes.
     *
     * @return {@code true} if the row was found. If it wasn't, the entity is marked as deleted
     */
    public boolean reload() {
        return reload(null);
    }

    /**
     * Re-reads one field, or all of them if {@code field} is {@code null}, from the database.
     * The pending change of the re-read fields is dropped once the row is read. A storage error is handled as a missing row,
     * and the pending changes are kept so that {@link #revert()} can still restore the loaded values.
     *
     * @param field the field to re-read, {@code null} for all
     * @return {@code true} if the row was found. If it wasn't, the entity is marked as deleted
     * @throws FieldNotFoundException if {@code field} isn't a declared field
     */
    public boolean reload(final String field) throws FieldNotFoundException {
        if (field != null && !getSchema().hasField(field)) {
            throw new FieldNotFoundException(field, getClass().getSimpleName());
        }

        Map<String, Object> row = null;

        try {
            row = repository.selectRow(id(), field);
        } catch (final UncheckedSQLException e) {
            logger.warn("Failed to reload " + this + ", it's handled as deleted", e);
        }

        if (N.isEmpty(row)) {
            markAsDeleted();
            return false;
        }

        if (field != null) {
            data.put(field, parseFieldSqlValue(field, row.get(field)));
            originalData.remove(field);
        } else {
            fill(row);
        }

        return true;
    }

    public boolean isDeleted() {
        return deleted;
    }

    /**
     * @return {@code true} until this entity is deleted
     */
    public boolean isValid() {
        return !deleted;
    }

    @Internal
    public void markAsDeleted() {
        deleted = true;
    }

    /**
     * Clears the deleted mark, after the delete of this entity was rolled back.
     */
    @Internal
    public void unmarkAsDeleted() {
        deleted = false;
    }

    /**
     * Fills the audit fields of {@code event} on this entity: {@code <event>_time}, or {@code <event>_date} if there is no time field,
     * then {@code <event>_agent}, {@code <event>_referer} and {@code <event>_ip} when they are declared.
     * Does nothing if the entity has neither time nor date field for the event.
     *
     * @param event the event name, e.g. {@code "login"}
     */
    public void logEvent(final String event) {
        final EntitySchema schema = getSchema();
        final Map<String, Object> log = repository.getLogEvent(event);

        if (schema.hasField(event + "_time")) {
            setValue(event + "_time", log.get(event + "_time"));
        } else if (schema.hasField(event + "_date")) {
            setValue(event + "_date", log.get(event + "_date"));
        } else {
            return;
        }

        final RequestInfo requestInfo = RequestInfo.current();

        if (requestInfo != null) {
            if (schema.hasField(event + "_agent") && requestInfo.userAgent() != null) {
                setValue(event + "_agent", requestInfo.userAgent());
            }

            if (schema.hasField(event + "_referer") && requestInfo.referer() != null) {
                setValue(event + "_referer", requestInfo.referer());
            }
        }

        if (schema.hasField(event + "_ip")) {
            setValue(event + "_ip", log.get(event + "_ip"));
        }
    }

    /**
     * @return the label of this entity for lists and logs, {@link #toString()} by default
     */
    public String getLabel() {
        return toString();
    }

    public Map<String, Object> asMap(final OutputModel model) {
        N.checkArgNotNull(model, "model");

        if (model == OutputModel.MINIMALS) {
            final Map<String, Object> result = new LinkedHashMap<>();
            result.put("id", id());
            result.put("label", getLabel());

            return result;
        }

        return new LinkedHashMap<>(data);
    }

    /**
     * Returns the values to export, date and time values formatted as W3C date-times, e.g. {@code 2024-05-01T10:15:00+02:00}.
     *
     * @param keys the fields to export, {@code null} for all
     * @return the exported values
     */
    public Map<String, Object> getExportData(final Collection<String> keys) {
        final ZoneId zone = repository.getSettings().getClock().getZone();
        final Map<String, Object> result = new LinkedHashMap<>();

        for (final Map.Entry<String, Object> entry : data.entrySet()) {
            if (keys == null || keys.contains(entry.getKey())) {
                result.put(entry.getKey(), toExportValue(entry.getValue(), zone));
            }
        }

        return result;
    }

    static Object toExportValue(final Object value, final ZoneId zone) {
        if (value instanceof java.sql.Date date) {
            return date.toLocalDate().toString();
        } else if (value instanceof java.sql.Time time) {
            return time.toLocalTime().toString();
        } else if (value instanceof java.util.Date date) {
            return W3C_FORMATTER.format(date.toInstant().atZone(zone));
        } else if (value instanceof Instant instant) {
            return W3C_FORMATTER.format(instant.atZone(zone));
        } else if (value instanceof LocalDateTime localDateTime) {
            return W3C_FORMATTER.format(localDateTime.atZone(zone));
        } else if (value instanceof ZonedDateTime || value instanceof OffsetDateTime) {
            return W3C_FORMATTER.format((TemporalAccessor) value);
        } else {
            return value;
        }
    }

    @SuppressWarnings("unchecked")
    private EntityRepository<PermanentObject> repository() {
        return (EntityRepository<PermanentObject>) repository;
    }

    @Override
    public int hashCode() {
        final Object id = id();
        final Object key = InstanceCache.normalizeId(id);

        return 31 * getClass().hashCode() + N.hashCode(key == null ? id : key);
    }

    /**
     * Two entities are equal if they have the same class and the same id.
     */
    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }

        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }

        final Object id = id();
        final Object otherId = ((PermanentObject) obj).id();
        final Long key = InstanceCache.normalizeId(id);

        return key != null ? key.equals(InstanceCache.normalizeId(otherId)) : N.equals(id, otherId);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "#" + id();
    }
}
