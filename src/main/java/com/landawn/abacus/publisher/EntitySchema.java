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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.landawn.abacus.annotation.MayReturnNull;
import com.landawn.abacus.publisher.validation.FieldCheckValidator;
import com.landawn.abacus.publisher.validation.FieldValidator;
import com.landawn.abacus.util.ImmutableList;
import com.landawn.abacus.util.ImmutableSet;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * The immutable description of an entity type: its table, id field, declared fields, editable fields, validator,
 * translation domain, SQL adapter instance and audit events.
 *
 * <p>A schema may extend the schema of a parent entity type with {@link Builder#parent(EntitySchema)}. The merge is done
 * once, when the schema is built:</p>
 * <ul>
 *   <li>fields are the child's, followed by the parent's not declared by the child</li>
 *   <li>editable fields are the parent's if the child declares none, the union of both otherwise</li>
 *   <li>validators are merged if both are {@link FieldCheckValidator}s, the child's checks winning. Otherwise the child's validator is used, or the parent's if the child has none</li>
 *   <li>the id field, the adapter instance and the audit events are inherited when the child doesn't set them</li>
 *   <li>the domain is never inherited, it defaults to the table</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * static final EntitySchema CONTENT = EntitySchema.builder("content")
 *         .fields("id", "title", "create_date", "create_ip")
 *         .editableFields("title")
 *         .build();
 *
 * static final EntitySchema ARTICLE = EntitySchema.builder("article")
 *         .parent(CONTENT)
 *         .fields("body")
 *         .editableFields("body")
 *         .build();
 *
 * ARTICLE.getFields();         // [id, body, title, create_date, create_ip]
 * ARTICLE.getEditableFields(); // [body, title]
 * }</pre>
 */
public final class EntitySchema {

    public static final String DEFAULT_ID_FIELD = "id";

    static final List<String> DEFAULT_CREATE_EVENTS = ImmutableList.copyOf(Arrays.asList("create", "edit"));

    static final List<String> DEFAULT_UPDATE_EVENTS = ImmutableList.copyOf(Arrays.asList("edit", "update"));

    private final String table;

    private final String idField;

    private final List<String> fields;

    private final Set<String> fieldSet;

    private final List<String> declaredEditableFields;

    private final List<String> editableFields;

    private final FieldValidator validator;

    private final String domain;

    private final String dbInstance;

    private final List<String> createEvents;

    private final List<String> updateEvents;

    EntitySchema(final Builder builder) {
        final EntitySchema parent = builder.parent;

        this.table = builder.table;
        this.idField = Strings.isNotEmpty(builder.idField) ? builder.idField : (parent == null ? DEFAULT_ID_FIELD : parent.idField);

        final Set<String> mergedFields = new LinkedHashSet<>();
        mergedFields.add(idField);
        mergedFields.addAll(builder.fields);

        if (parent != null) {
            mergedFields.addAll(parent.fields);
        }

        this.fields = ImmutableList.copyOf(mergedFields);
        this.fieldSet = ImmutableSet.wrap(mergedFields);

        List<String> editable = builder.editableFields == null ? null : new ArrayList<>(new LinkedHashSet<>(builder.editableFields));

        if (parent != null && parent.declaredEditableFields != null) {
            if (editable == null) {
                editable = parent.declaredEditableFields;
            } else {
                final Set<String> union = new LinkedHashSet<>(editable);
                union.addAll(parent.declaredEditableFields);
                editable = new ArrayList<>(union);
            }
        }

        this.declaredEditableFields = editable == null ? null : ImmutableList.copyOf(editable);

        if (declaredEditableFields != null) {
            this.editableFields = declaredEditableFields;
        } else {
            final List<String> allButId = new ArrayList<>(fields);
            allButId.remove(idField);
            this.editableFields = ImmutableList.copyOf(allButId);
        }

        this.validator = mergeValidators(builder.validator, parent == null ? null : parent.validator);
        this.domain = Strings.isNotEmpty(builder.domain) ? builder.domain : table;
        this.dbInstance = builder.dbInstance != null ? builder.dbInstance : (parent == null ? null : parent.dbInstance);
        this.createEvents = builder.createEvents != null ? ImmutableList.copyOf(builder.createEvents)
                : (parent == null ? DEFAULT_CREATE_EVENTS : parent.createEvents);
        this.updateEvents = builder.updateEvents != null ? ImmutableList.copyOf(builder.updateEvents)
                : (parent == null ? DEFAULT_UPDATE_EVENTS : parent.updateEvents);
    }

    private static FieldValidator mergeValidators(final FieldValidator child, final FieldValidator parent) {
        if (child == null) {
            return parent == null ? FieldCheckValidator.create() : parent;
        } else if (parent == null) {
            return child;
        } else if (child instanceof FieldCheckValidator childChecks && parent instanceof FieldCheckValidator parentChecks) {
            return childChecks.merge(parentChecks);
        } else {
            return child;
        }
    }

    public static Builder builder(final String table) {
        return new Builder(table);
    }

    public String getTable() {
        return table;
    }

    public String getIdField() {
        return idField;
    }

    /**
     * @return the declared fields, the id field first
     */
    public List<String> getFields() {
        return fields;
    }

    public boolean hasField(final String field) {
        return field != null && fieldSet.contains(field);
    }

    /**
     * Returns the fields an update or a create may write when the caller doesn't restrict them:
     * the declared editable fields, or every field but the id if none are declared.
     *
     * @return the editable fields
     */
    public List<String> getEditableFields() {
        return editableFields;
    }

    /**
     * @return the editable fields as declared, {@code null} if the schema and its parent declare none
     */
    @MayReturnNull
    public List<String> getDeclaredEditableFields() {
        return declaredEditableFields;
    }

    public boolean isFieldEditable(final String field) {
        if (field == null || field.equals(idField)) {
            return false;
        }

        return declaredEditableFields != null ? declaredEditableFields.contains(field) : fieldSet.contains(field);
    }

    public FieldValidator getValidator() {
        return validator;
    }

    public String getDomain() {
        return domain;
    }

    /**
     * @return the name of the SQL adapter instance, {@code null} for the default one
     */
    @MayReturnNull
    public String getDbInstance() {
        return dbInstance;
    }

    /**
     * @return the audit events filled on creation, {@code [create, edit]} by default
     */
    public List<String> getCreateEvents() {
        return createEvents;
    }

    /**
     * @return the audit events filled on update, {@code [edit, update]} by default
     */
    public List<String> getUpdateEvents() {
        return updateEvents;
    }

    @Override
    public String toString() {
        return "EntitySchema{table=" + table + ", idField=" + idField + ", fields=" + fields + ", editableFields=" + declaredEditableFields + ", domain="
                + domain + ", dbInstance=" + dbInstance + "}";
    }

    public static final class Builder {

        private final String table;

        private String idField;

        private final List<String> fields = new ArrayList<>();

        private List<String> editableFields;

        private FieldValidator validator;

        private String domain;

        private String dbInstance;

        private List<String> createEvents;

        private List<String> updateEvents;

        private EntitySchema parent;

        Builder(final String table) {
            N.checkArgument(Strings.isNotEmpty(table), "table can not be null or empty");

            this.table = table;
        }

        public Builder idField(final String idField) {
            this.idField = idField;
            return this;
        }

        public Builder fields(final String... fields) {
            return fields(Arrays.asList(fields));
        }

        public Builder fields(final Collection<String> fields) {
            for (final String field : fields) {
                N.checkArgument(Strings.isNotEmpty(field), "field name can not be null or empty");

                this.fields.add(field);
            }

            return this;
        }

        public Builder editableFields(final String... editableFields) {
            return editableFields(Arrays.asList(editableFields));
        }

        public Builder editableFields(final Collection<String> editableFields) {
            this.editableFields = new ArrayList<>(editableFields);
            return this;
        }

        public Builder validator(final FieldValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder domain(final String domain) {
            this.domain = domain;
            return this;
        }

        public Builder dbInstance(final String dbInstance) {
            this.dbInstance = dbInstance;
            return this;
        }

        public Builder createEvents(final String... createEvents) {
            this.createEvents = Arrays.asList(createEvents);
            return this;
        }

        public Builder updateEvents(final String... updateEvents) {
            this.updateEvents = Arrays.asList(updateEvents);
            return this;
        }

        public Builder parent(final EntitySchema parent) {
            this.parent = parent;
            return this;
        }

        public EntitySchema build() {
            final EntitySchema schema = new EntitySchema(this);

            if (editableFields != null) {
                for (final String field : schema.declaredEditableFields) {
                    N.checkArgument(schema.hasField(field), "Editable field '" + field + "' is not declared in table: " + table);
                }
            }

            return schema;
        }
    }
}
