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

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.landawn.abacus.annotation.MayReturnNull;
import com.landawn.abacus.exception.UncheckedSQLException;
import com.landawn.abacus.logging.Logger;
import com.landawn.abacus.logging.LoggerFactory;
import com.landawn.abacus.publisher.exception.NotFoundException;
import com.landawn.abacus.publisher.exception.UserException;
import com.landawn.abacus.publisher.sql.SQLAdapter;
import com.landawn.abacus.publisher.sql.SQLAdapters;
import com.landawn.abacus.publisher.sql.SQLOptions;
import com.landawn.abacus.publisher.transaction.CreateTransactionOperation;
import com.landawn.abacus.publisher.transaction.DeleteTransactionOperation;
import com.landawn.abacus.publisher.transaction.UpdateTransactionOperation;
import com.landawn.abacus.publisher.validation.FieldValidator;
import com.landawn.abacus.publisher.validation.ValidatedInput;
import com.landawn.abacus.publisher.validation.Validation;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * Loads, creates and caches the entities of one type, and holds the hooks of the create/update/delete pipeline.
 *
 * <p>Subclass it to customize the pipeline of an entity type:</p>
 * <ul>
 *   <li>{@link #onValidCreate(Map, Validation)} and {@link #onValidUpdate(Map, Validation)} accept or reject a validated payload and add audit fields to it</li>
 *   <li>{@link #onEdit(Map, PermanentObject)} adjusts the payload right before it's written</li>
 *   <li>{@link #checkForObject(Map, PermanentObject)} runs cross-field checks for {@link #testUserInput(Map, Collection, PermanentObject, Validation)}</li>
 *   <li>{@link #onSaved(Map, Object, PermanentObject)} is called after each successful create, update or delete</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * EntityRepository<User> users = new EntityRepository<>(User.class, User.SCHEMA, User::new, new JdbcSQLAdapter(dataSource));
 *
 * Validation validation = new Validation();
 * User user = users.createAndGet(N.asMap("name", "Alice", "email", "alice@example.com"), null, validation);
 *
 * User same = users.load(user.id());         // same instance, from the cache
 * User missing = users.load(999L);           // null
 * users.load(999L, false);                   // throws NotFoundException
 * }</pre>
 *
 * <p>Not thread-safe: the instance cache is shared by every caller of the repository.</p>
 *
 * @param <T> the entity type
 */
public class EntityRepository<T extends PermanentObject> {

    private static final Logger logger = LoggerFactory.getLogger(EntityRepository.class);

    private final Class<T> entityClass;

    private final EntitySchema schema;

    private final EntityFactory<T> factory;

    private final InstanceCache<T> cache;

    private final PublisherSettings settings;

    private SQLAdapter sqlAdapter;

    /**
     * Creates a repository using the adapter registered in {@link SQLAdapters} for the instance of {@code schema}.
     *
     * @param entityClass the entity class
     * @param schema the entity schema
     * @param factory builds entities from rows
     */
    public EntityRepository(final Class<T> entityClass, final EntitySchema schema, final EntityFactory<T> factory) {
        this(entityClass, schema, factory, null);
    }

    public EntityRepository(final Class<T> entityClass, final EntitySchema schema, final EntityFactory<T> factory, final SQLAdapter sqlAdapter) {
        this(entityClass, schema, factory, sqlAdapter, new InstanceCache<>(), PublisherSettings.getDefault());
    }

    /**
     *
     * @param entityClass the entity class
     * @param schema the entity schema
     * @param factory builds entities from rows
     * @param sqlAdapter the adapter, {@code null} to use the one registered in {@link SQLAdapters} for the instance of {@code schema}
     * @param cache the identity cache
     * @param settings the settings
     */
    public EntityRepository(final Class<T> entityClass, final EntitySchema schema, final EntityFactory<T> factory, final SQLAdapter sqlAdapter,
            final InstanceCache<T> cache, final PublisherSettings settings) {
        this.entityClass = N.checkArgNotNull(entityClass, "entityClass");
        this.schema = N.checkArgNotNull(schema, "schema");
        this.factory = N.checkArgNotNull(factory, "factory");
        this.cache = N.checkArgNotNull(cache, "cache");
        this.settings = N.checkArgNotNull(settings, "settings");
        this.sqlAdapter = sqlAdapter;
    }

    public Class<T> getEntityClass() {
        return entityClass;
    }

    public EntitySchema getSchema() {
        return schema;
    }

    public String getTable() {
        return schema.getTable();
    }

    public String getIDField() {
        return schema.getIdField();
    }

    public List<String> getFields() {
        return schema.getFields();
    }

    /**
     * @return the translation domain, the table unless the schema sets another one
     */
    public String getDomain() {
        return schema.getDomain();
    }

    public FieldValidator getValidator() {
        return schema.getValidator();
    }

    public PublisherSettings getSettings() {
        return settings;
    }

    public InstanceCache<T> getCache() {
        return cache;
    }

    public SQLAdapter getSQLAdapter() {
        if (sqlAdapter == null) {
            sqlAdapter = SQLAdapters.get(schema.getDbInstance());
        }

        return sqlAdapter;
    }

    public boolean isFieldEditable(final String field) {
        return schema.isFieldEditable(field);
    }

    /**
     * @param data field values
     * @return a copy of {@code data} where every declared field missing or {@code null} is set to an empty string
     */
    public Map<String, Object> completeFields(final Map<String, ?> data) {
        final Map<String, Object> result = new LinkedHashMap<>(data);

        for (final String field : schema.getFields()) {
            if (result.get(field) == null) {
                result.put(field, "");
            }
        }

        return result;
    }

    // ---------------------------------------------------------------- load

    /**
     * Same as {@code load(in, true, true)}.
     *
     * @param in an id, a full row or an entity
     * @return the entity, or {@code null} if not found
     */
    @MayReturnNull
    public T load(final Object in) {
        return load(in, true, true);
    }

    /**
     * Same as {@code load(in, nullable, true)}.
     *
     * @param in an id, a full row or an entity
     * @param nullable whether to return {@code null} instead of throwing when no entity is found
     * @return the entity
     * @throws NotFoundException if no entity is found and {@code nullable} is {@code false}
     */
    @MayReturnNull
    public T load(final Object in, final boolean nullable) throws NotFoundException {
        return load(in, nullable, true);
    }

    /**
     * Resolves an entity.
     *
     * <ul>
     *   <li>an entity of this type is returned as is</li>
     *   <li>a full row ({@code Map}) is turned into an entity without reading the database</li>
     *   <li>an id is looked up in the cache, then read from the database</li>
     * </ul>
     * With {@code usingCache}, a cached instance with the same id wins over a new one, and a new one is cached.
     *
     * @param in an id, a full row or an entity
     * @param nullable whether to return {@code null} instead of throwing when {@code in} is empty or no row is found
     * @param usingCache whether to read from and write to the instance cache
     * @return the entity
     * @throws NotFoundException if {@code in} is empty or no row is found, and {@code nullable} is {@code false}
     * @throws UserException with message {@code invalidID} if the id is not a positive integer
     */
    @MayReturnNull
    @SuppressWarnings("unchecked")
    public T load(final Object in, final boolean nullable, final boolean usingCache) throws NotFoundException, UserException {
        if (isEmptyInput(in)) {
            if (nullable) {
                return null;
            }

            throw notFoundException("invalidParameter_load");
        }

        if (entityClass.isInstance(in)) {
            return entityClass.cast(in);
        }

        Map<String, Object> row = null;
        final Object id;

        if (in instanceof Map) {
            row = (Map<String, Object>) in;
            id = row.get(schema.getIdField());
        } else {
            id = in;
        }

        final Long normalizedId = InstanceCache.normalizeId(id);

        if (normalizedId == null) {
            throw userException("invalidID");
        }

        if (usingCache) {
            final T cached = cache.get(normalizedId);

            if (cached != null) {
                return cached;
            }
        }

        if (row == null) {
            row = selectRow(normalizedId, null);

            if (row == null) {
                if (nullable) {
                    return null;
                }

                throw notFoundException("notFound");
            }
        }

        final T entity = instantiate(row);

        return usingCache ? cache.putIfAbsent(entity) : entity;
    }

    /**
     * Resolves {@code idOrEntity} with {@link #load(Object)}.
     *
     * @param idOrEntity an id or an entity
     * @return the entity, or {@code null} if not found
     */
    @MayReturnNull
    public T object(final Object idOrEntity) {
        return load(idOrEntity);
    }

    private static boolean isEmptyInput(final Object in) {
        if (in == null) {
            return true;
        } else if (in instanceof CharSequence cs) {
            return cs.length() == 0 || "0".contentEquals(cs);
        } else if (in instanceof Map<?, ?> m) {
            return m.isEmpty();
        } else if (in instanceof Number n) {
            return n.doubleValue() == 0;
        } else {
            return false;
        }
    }

    protected T instantiate(final Map<String, Object> row) {
        final T entity = factory.create(this, row);

        if (entity == null) {
            throw new IllegalStateException("Factory of " + entityClass.getSimpleName() + " returned null");
        }

        return entity;
    }

    @MayReturnNull
    public Map<String, Object> selectRow(final Object id) throws UncheckedSQLException {
        return selectRow(id, null);
    }

    /**
     * Reads the row of an entity.
     *
     * @param id the entity id
     * @param field the only field to read, {@code null} for all
     * @return the row, or {@code null} if there is none
     * @throws UncheckedSQLException
     */
    @MayReturnNull
    public Map<String, Object> selectRow(final Object id, final String field) throws UncheckedSQLException {
        final SQLOptions options = select().where(escapeIdentifier(schema.getIdField()) + " = ?", id).output(SQLOptions.Output.ARR_FIRST);

        if (field != null) {
            options.what(field);
        }

        return getSQLAdapter().selectFirst(options);
    }

    /**
     * @return new select options on the table of this repository
     */
    public SQLOptions select() {
        return SQLOptions.of(schema.getTable());
    }

    /**
     *
     * @param options the select options, the table is set to the table of this repository
     * @return the raw rows
     * @throws UncheckedSQLException
     */
    public List<Map<String, Object>> selectRows(final SQLOptions options) throws UncheckedSQLException {
        return getSQLAdapter().select(options.copy().table(schema.getTable()));
    }

    /**
     * Reads entities. Rows of entities already cached resolve to the cached instances.
     *
     * @param options the select options, the table is set to the table of this repository
     * @return the entities
     * @throws UncheckedSQLException
     */
    public List<T> list(final SQLOptions options) throws UncheckedSQLException {
        final List<Map<String, Object>> rows = selectRows(options.copy().output(SQLOptions.Output.ARR_OBJECTS));
        final List<T> result = new ArrayList<>(rows.size());

        for (final Map<String, Object> row : rows) {
            result.add(load(row));
        }

        return result;
    }

    /**
     * Counts the rows matched by {@code options}. Only the id column is read, but every matched id is fetched into memory,
     * so the cost is linear in the number of matched rows.
     *
     * @param options the select options, the table is set to the table of this repository
     * @return the number of matched rows
     * @throws UncheckedSQLException
     */
    public int count(final SQLOptions options) throws UncheckedSQLException {
        return selectRows(options.copy().what(schema.getIdField())).size();
    }

    @MayReturnNull
    public T findFirst(final SQLOptions options) throws UncheckedSQLException {
        final Map<String, Object> row = getSQLAdapter().selectFirst(options.copy().table(schema.getTable()).output(SQLOptions.Output.OBJECT));

        return row == null ? null : load(row);
    }

    // ---------------------------------------------------------------- write

    /**
     *
     * @param input the raw input
     * @param fields the fields that may be written, {@code null} for the editable fields
     * @return the id of the new entity, or {@code null} if the input was invalid or the insert failed
     * @see #create(Map, Collection, Validation)
     */
    @MayReturnNull
    public Object create(final Map<String, ?> input, final Collection<String> fields) {
        return create(input, fields, null);
    }

    /**
     * Validates {@code input} and inserts it.
     *
     * @param input the raw input
     * @param fields the fields that may be written, {@code null} for the editable fields
     * @param validation receives the validation errors, may be {@code null}
     * @return the id of the new entity, or {@code null} if the input was invalid or the insert failed
     */
    @MayReturnNull
    public Object create(final Map<String, ?> input, final Collection<String> fields, final Validation validation) {
        final CreateTransactionOperation<T> operation = getCreateOperation(input, fields);
        final Validation result = operation.validate();

        if (validation != null) {
            validation.merge(result);
        }

        return operation.runIfValid() > 0 ? operation.getInsertId() : null;
    }

    @MayReturnNull
    public T createAndGet(final Map<String, ?> input, final Collection<String> fields) {
        return createAndGet(input, fields, null);
    }

    /**
     * Creates an entity and loads it.
     *
     * @param input the raw input
     * @param fields the fields that may be written, {@code null} for the editable fields
     * @param validation receives the validation errors, may be {@code null}
     * @return the new entity, or {@code null} if the input was invalid or the insert failed
     */
    @MayReturnNull
    public T createAndGet(final Map<String, ?> input, final Collection<String> fields, final Validation validation) {
        final Object id = create(input, fields, validation);

        return id == null ? null : load(id);
    }

    public CreateTransactionOperation<T> getCreateOperation(final Map<String, ?> input, final Collection<String> fields) {
        final CreateTransactionOperation<T> operation = new CreateTransactionOperation<>(this, input, fields);
        operation.setSQLAdapter(getSQLAdapter());

        return operation;
    }

    public UpdateTransactionOperation<T> getUpdateOperation(final T entity, final Map<String, ?> input, final Collection<String> fields) {
        final UpdateTransactionOperation<T> operation = new UpdateTransactionOperation<>(this, input, fields, entity);
        operation.setSQLAdapter(getSQLAdapter());

        return operation;
    }

    public DeleteTransactionOperation<T> getDeleteOperation(final T entity) {
        final DeleteTransactionOperation<T> operation = new DeleteTransactionOperation<>(this, entity);
        operation.setSQLAdapter(getSQLAdapter());

        return operation;
    }

    // ---------------------------------------------------------------- validation pipeline

    /**
     * Runs the validator of the schema on {@code input}.
     *
     * @param input the raw input
     * @param fields the fields that may be written, {@code null} for the editable fields
     * @param ref the entity being updated, {@code null} on creation. Values equal to its current ones are left out
     * @param ignoreRequired passed to the validator
     * @return the validated payload and the errors found
     */
    public ValidatedInput checkUserInput(final Map<String, ?> input, final Collection<String> fields, final T ref, final boolean ignoreRequired) {
        return schema.getValidator().validate(schema, N.checkArgNotNull(input, "input"), fields, ref, ignoreRequired);
    }

    /**
     * Checks {@code input} field by field, then as a whole with {@link #checkForObject(Map, PermanentObject)}.
     *
     * @param input the raw input
     * @param fields the fields that may be written, {@code null} for the editable fields
     * @param ref the entity being updated, {@code null} on creation
     * @param validation receives the errors
     * @return {@code true} if no error was found
     */
    public boolean testUserInput(final Map<String, ?> input, final Collection<String> fields, final T ref, final Validation validation) {
        final ValidatedInput validated = checkUserInput(input, fields, ref, false);
        validation.merge(validated.validation());

        if (validated.validation().hasErrors()) {
            return false;
        }

        try {
            checkForObject(validated.data(), ref);
        } catch (final UserException e) {
            validation.addError(e, getDomain(), Validation.DEFAULT_SEVERITY);
            return false;
        }

        return true;
    }

    /**
     * Checks a validated payload as a whole. Does nothing by default.
     *
     * @param data the validated payload
     * @param ref the entity being updated, {@code null} on creation
     * @throws UserException if the payload is rejected
     */
    public void checkForObject(final Map<String, Object> data, final T ref) throws UserException {
        // no-op by default
    }

    /**
     * Accepts or rejects the validated payload of a create. By default, rejects it if {@code validation} has errors,
     * otherwise fills the audit fields of the create events of the schema.
     *
     * @param data the validated payload, may be modified
     * @param validation the errors found so far
     * @return {@code true} to accept
     */
    public boolean onValidCreate(final Map<String, Object> data, final Validation validation) {
        if (validation.hasErrors()) {
            return false;
        }

        for (final String event : schema.getCreateEvents()) {
            fillLogEvent(data, event);
        }

        return true;
    }

    /**
     * Accepts or rejects the validated payload of an update. By default, rejects it if it has no declared field or if
     * {@code validation} has errors, otherwise fills the audit fields of the update events of the schema.
     * An empty payload is rejected before any audit field is added.
     *
     * @param data the validated payload, may be modified
     * @param validation the errors found so far
     * @return {@code true} to accept
     */
    public boolean onValidUpdate(final Map<String, Object> data, final Validation validation) {
        int found = 0;

        for (final String field : data.keySet()) {
            if (schema.hasField(field)) {
                found++;
            }
        }

        if (found == 0 || validation.hasErrors()) {
            return false;
        }

        for (final String event : schema.getUpdateEvents()) {
            fillLogEvent(data, event);
        }

        return true;
    }

    /**
     * Adjusts a payload right before it's inserted or updated. Does nothing by default.
     *
     * @param data the payload, may be modified
     * @param entity the entity being updated, {@code null} on creation
     */
    public void onEdit(final Map<String, Object> data, final T entity) {
        // no-op by default
    }

    /**
     * Called after each successful create, update or delete. Does nothing by default.
     *
     * @param data the written values, empty for a delete
     * @param id the id of the entity
     * @param entity the entity, {@code null} on creation
     */
    public void onSaved(final Map<String, Object> data, final Object id, final T entity) {
        // no-op by default
    }

    /**
     * Builds the insert of a payload: {@link #onEdit(Map, PermanentObject)}, then undeclared keys are dropped.
     *
     * @param input the payload, modified in place
     * @return the insert options
     */
    public SQLOptions extractCreateQuery(final Map<String, Object> input) {
        onEdit(input, null);

        input.keySet().removeIf(field -> !schema.hasField(field));

        return select().values(input);
    }

    /**
     * Builds the update of an entity: {@link #onEdit(Map, PermanentObject)}, then undeclared keys are dropped.
     *
     * @param input the payload, modified in place
     * @param entity the entity to update
     * @return the update options
     */
    public SQLOptions extractUpdateQuery(final Map<String, Object> input, final T entity) {
        onEdit(input, entity);

        input.keySet().removeIf(field -> !schema.hasField(field));

        return select().values(input).where(escapeIdentifier(schema.getIdField()) + " = ?", entity.id()).number(1);
    }

    // ---------------------------------------------------------------- audit

    /**
     * Fills the audit fields of {@code event} in a payload, if the schema declares {@code <event>_time} or {@code <event>_date}:
     * <ul>
     *   <li>{@code <event>_time}: the current time, in seconds since the epoch</li>
     *   <li>{@code <event>_date}: the current time as a {@link Timestamp}, unless the payload already has one</li>
     *   <li>{@code <event>_ip}: the client IP of the current {@link RequestInfo}, or the default one</li>
     *   <li>{@code <event>_agent} and {@code <event>_referer}: from the current {@link RequestInfo}, if declared</li>
     * </ul>
     * Keys the schema doesn't declare are dropped when the payload is written.
     *
     * @param data the payload
     * @param event the event name, e.g. {@code "create"}
     */
    public void fillLogEvent(final Map<String, Object> data, final String event) {
        if (!schema.hasField(event + "_time") && !schema.hasField(event + "_date")) {
            return;
        }

        final Map<String, Object> log = getLogEvent(event);

        data.put(event + "_time", log.get(event + "_time"));

        if (data.get(event + "_date") == null) {
            data.put(event + "_date", log.get(event + "_date"));
        }

        data.put(event + "_ip", log.get(event + "_ip"));

        final RequestInfo requestInfo = RequestInfo.current();

        if (schema.hasField(event + "_agent")) {
            data.put(event + "_agent", requestInfo == null ? null : requestInfo.userAgent());
        }

        if (schema.hasField(event + "_referer")) {
            data.put(event + "_referer", requestInfo == null ? null : requestInfo.referer());
        }
    }

    public Map<String, Object> getLogEvent(final String event) {
        return getLogEvent(event, null, null);
    }

    /**
     *
     * @param event the event name
     * @param time the event time in seconds since the epoch, {@code null} for now
     * @param ip the client IP, {@code null} for the current one
     * @return {@code <event>_time}, {@code <event>_date} and {@code <event>_ip}
     */
    public Map<String, Object> getLogEvent(final String event, final Long time, final String ip) {
        final long seconds = time == null ? settings.getClock().millis() / 1000 : time;

        final Map<String, Object> log = new LinkedHashMap<>();
        log.put(event + "_time", seconds);
        log.put(event + "_date", new Timestamp(seconds * 1000));
        log.put(event + "_ip", ip == null ? clientIp() : ip);

        return log;
    }

    public String clientIp() {
        final RequestInfo requestInfo = RequestInfo.current();

        return requestInfo == null || Strings.isEmpty(requestInfo.clientIp()) ? settings.getDefaultClientIp() : requestInfo.clientIp();
    }

    // ---------------------------------------------------------------- cache

    /**
     * Removes the cached instances marked as deleted.
     *
     * @return the number of removed instances
     */
    public int clearDeletedInstances() {
        return cache.evictDeleted();
    }

    public void clearAllInstances() {
        cache.clear();
    }

    /**
     * @return the number of cached instances
     */
    public int getCacheStats() {
        return cache.size();
    }

    /**
     * Caches the given entities, replacing each one by the instance already cached for its id, if any.
     *
     * @param entities the entities
     * @return the cached instances, in the same order
     */
    public List<T> cacheObjects(final Collection<? extends T> entities) {
        final List<T> result = new ArrayList<>(entities.size());

        for (final T entity : entities) {
            result.add(cache.putIfAbsent(entity));
        }

        return result;
    }

    // ---------------------------------------------------------------- SQL helpers

    /**
     * @return the escaped table name
     */
    public String escapeIdentifier() {
        return escapeIdentifier(schema.getTable());
    }

    public String escapeIdentifier(final String identifier) {
        return getSQLAdapter().escapeIdentifier(identifier);
    }

    public String formatValue(final Object value) {
        return getSQLAdapter().formatValue(value);
    }

    public String formatValueList(final Collection<?> values) {
        return getSQLAdapter().formatValueList(values);
    }

    // ---------------------------------------------------------------- translation and errors

    /**
     * Translates {@code key} in the domain of this entity type.
     *
     * @param key the message key
     * @param args the substitution arguments
     * @return the text
     */
    public String text(final String key, final Object... args) {
        return settings.getTranslator().translate(key, getDomain(), args);
    }

    public void throwNotFound(final String message) throws NotFoundException {
        throw notFoundException(message);
    }

    public void throwException(final String message) throws UserException {
        throw userException(message);
    }

    protected NotFoundException notFoundException(final String message) {
        logger.debug("{} not found: {}", entityClass.getSimpleName(), message);

        return new NotFoundException(message, getDomain());
    }

    protected UserException userException(final String message) {
        return new UserException(message, getDomain());
    }

    @Override
    public String toString() {
        return "EntityRepository{entityClass=" + entityClass.getName() + ", table=" + schema.getTable() + "}";
    }
}
