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

package com.landawn.abacus.publisher.validation;

import java.util.Collection;
import java.util.Map;

import com.landawn.abacus.publisher.EntitySchema;
import com.landawn.abacus.publisher.PermanentObject;

/**
 * Turns untrusted input into the payload of a create or update.
 *
 * <p>Implementations must not throw for rejected values: every failure is added to the returned {@link Validation}
 * so all of them can be reported together.</p>
 *
 * @see FieldCheckValidator
 */
public interface FieldValidator {

    /**
     *
     * @param schema the schema of the entity being written
     * @param input the raw input
     * @param fields the fields allowed to be written, or {@code null} for the editable fields of {@code schema}
     * @param ref the entity being updated, or {@code null} on creation
     * @param ignoreRequired whether missing required fields should be tolerated
     * @return the validated payload and the failures found
     */
    ValidatedInput validate(EntitySchema schema, Map<String, ?> input, Collection<String> fields, PermanentObject ref, boolean ignoreRequired);
}
