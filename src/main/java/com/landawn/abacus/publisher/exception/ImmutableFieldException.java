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
 * Thrown on any attempt to write the identifier field of a loaded entity.
 */
public class ImmutableFieldException extends IllegalStateException {

    private static final long serialVersionUID = 4726519058312347790L;

    private final String fieldName;

    public ImmutableFieldException(final String fieldName) {
        super("idNotEditable");
        this.fieldName = fieldName;
    }

    public String getFieldName() {
        return fieldName;
    }
}
