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
 * Thrown when an entity is requested as non-nullable and no matching row exists.
 * Kept distinct from validation errors so callers can render a "not found" response.
 */
public class NotFoundException extends UserException {

    private static final long serialVersionUID = 6118926437283052743L;

    public NotFoundException(final String message) {
        super(message);
    }

    public NotFoundException(final String message, final String domain) {
        super(message, domain);
    }
}
