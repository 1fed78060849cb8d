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

/**
 * The output of a {@link FieldValidator}: the checked payload and the failures found while building it.
 *
 * @param data the validated field values, in check order. Mutable: create/update hooks add audit fields to it
 * @param validation the accumulated failures
 */
public record ValidatedInput(Map<String, Object> data, Validation validation) { // NOSONAR

    public boolean isValid() {
        return validation.isValid();
    }
}
