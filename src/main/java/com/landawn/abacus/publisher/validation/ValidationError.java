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

import java.util.LinkedHashMap;
import java.util.Map;

import com.landawn.abacus.util.ImmutableMap;
import com.landawn.abacus.util.N;

/**
 * One accumulated validation failure.
 *
 * @param message the message key
 * @param extra structured data such as the field, the rejected value and the validator arguments
 * @param domain the translation domain, may be {@code null}
 * @param severity the severity, {@link Validation#DEFAULT_SEVERITY} unless stated otherwise
 */
public record ValidationError(String message, Map<String, Object> extra, String domain, int severity) { // NOSONAR

    public ValidationError {
        N.checkArgNotNull(message, "message");

        extra = N.isEmpty(extra) ? ImmutableMap.empty() : ImmutableMap.wrap(new LinkedHashMap<>(extra));
    }

    public ValidationError(final String message, final String domain) {
        this(message, null, domain, Validation.DEFAULT_SEVERITY);
    }

    /**
     * @return the field this error is bound to, or {@code null} if it's not field-scoped
     */
    public String field() {
        final Object field = extra.get("field");

        return field == null ? null : field.toString();
    }
}
