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

package com.landawn.abacus.publisher.exception;

/**
 * Thrown when a row fetched from the database lacks a field the entity class declares.
 * The in-memory definition and the stored schema have diverged; this is never recoverable at runtime.
 */
public class OutOfDateSchemaException extends IllegalStateException {

    private static final long serialVersionUID = -8419276403318895126L;

    private final String entityName;

    private final String fieldName;

    public OutOfDateSchemaException(final String entityName, final String fieldName) {
        super("The class " + entityName + " is out of date, the field \"" + fieldName + "\" is unknown in database.");
        this.entityName = entityName;
        this.fieldName = fieldName;
    }

    public String getEntityName() {
        return entityName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
