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

import java.util.Map;

import com.landawn.abacus.publisher.PermanentObject;
import com.landawn.abacus.publisher.exception.UserException;

/**
 * Checks and normalizes the value of one field from raw input.
 */
@FunctionalInterface
public interface FieldCheck {

    /**
     *
     * @param input the raw input, not yet trusted
     * @param ref the entity being updated, or {@code null} on creation
     * @return the value to store
     * @throws UserException if the input is rejected
     */
    Object check(Map<String, ?> input, PermanentObject ref) throws UserException;
}
