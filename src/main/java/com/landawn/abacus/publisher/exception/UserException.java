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

import java.util.LinkedHashMap;
import java.util.Map;

import com.landawn.abacus.annotation.MayReturnNull;
import com.landawn.abacus.util.ImmutableMap;
import com.landawn.abacus.util.N;

/**
 * Base class of the errors meant to be shown to an end user.
 * The message is a translation key, resolved against {@link #getDomain()} when rendered.
 *
 * <p>Unlike structural errors (unknown field, immutable id, stale schema), a {@code UserException} raised while checking
 * input is never propagated by the validation pipeline: it is converted into a
 * {@link com.landawn.abacus.publisher.validation.ValidationError} and accumulated.</p>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * FieldCheck nameCheck = (input, ref) -> {
 *     String name = (String) input.get("name");
 *     if (Strings.isEmpty(name)) {
 *         throw new UserException("requiredField", "user");
 *     }
 *     return name;
 * };
 * }</pre>
 */
public class UserException extends RuntimeException {

    private static final long serialVersionUID = -1395027373637716458L;

    private final String domain;

    private final Map<String, Object> extraData;

    public UserException(final String message) {
        this(message, null);
    }

    public UserException(final String message, final String domain) {
        this(message, domain, (Map<String, Object>) null);
    }

    public UserException(final String message, final String domain, final Map<String, Object> extraData) {
        super(message);
        this.domain = domain;
        this.extraData = N.isEmpty(extraData) ? null : new LinkedHashMap<>(extraData);
    }

    public UserException(final String message, final String domain, final Throwable cause) {
        super(message, cause);
        this.domain = domain;
        this.extraData = null;
    }

    /**
     * Returns the translation domain of this error, if any.
     *
     * @return the domain, or {@code null}
     */
    @MayReturnNull
    public String getDomain() {
        return domain;
    }

    /**
     * Returns the structured data carried by this error, for reporting and translation.
     *
     * @return a read-only map, never {@code null}
     */
    public Map<String, Object> getExtraData() {
        return extraData == null ? ImmutableMap.empty() : ImmutableMap.wrap(extraData);
    }
}
