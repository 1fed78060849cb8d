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
 * Thrown when an undeclared field name is read, written or reloaded.
 */
public class FieldNotFoundException extends IllegalArgumentException {

    private static final long serialVersionUID = -2281436153290471155L;

    /** Error code kept for callers mapping structural errors to numeric codes. */
    public static final int CODE = 1001;

    private final String fieldName;

    private final String source;

    public FieldNotFoundException(final String fieldName, final String source) {
        super("fieldNotFound[" + source + "-" + fieldName + "]");
        this.fieldName = fieldName;
        this.source = source;
    }

    public String getFieldName() {
        return fieldName;
    }

    /**
     * @return the simple name of the entity class the field was looked up in
     */
    public String getSource() {
        return source;
    }
}
