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

import java.util.ArrayList;
import java.util.List;

import com.landawn.abacus.publisher.exception.UserException;
import com.landawn.abacus.util.ImmutableList;
import com.landawn.abacus.util.N;

/**
 * Accumulates validation failures without stopping at the first one, so that every problem of an input can be reported at once.
 * A {@code Validation} is valid if and only if it holds no error.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * Validation validation = new Validation();
 * Long id = users.create(input, N.asList("name", "email"), validation);
 *
 * if (validation.hasErrors()) {
 *     validation.getReports(translator).forEach(r -> form.addError(r.code(), r.report()));
 * }
 * }</pre>
 *
 * <p>Not thread-safe.</p>
 */
public class Validation {

    public static final int DEFAULT_SEVERITY = 1;

    private final List<ValidationError> errors = new ArrayList<>();

    /**
     * Appends every error of {@code other} to this validation.
     *
     * @param other the validation to merge
     * @return this validation
     */
    public Validation merge(final Validation other) {
        N.checkArgNotNull(other, "other");

        if (other != this) {
            errors.addAll(other.errors);
        }

        return this;
    }

    public Validation addValidationError(final ValidationError error) {
        N.checkArgNotNull(error, "error");

        errors.add(error);

        return this;
    }

    public Validation addError(final String message) {
        return addError(message, null, DEFAULT_SEVERITY);
    }

    public Validation addError(final String message, final String domain) {
        return addError(message, domain, DEFAULT_SEVERITY);
    }

    public Validation addError(final String message, final String domain, final int severity) {
        return addValidationError(new ValidationError(message, null, domain, severity));
    }

    public Validation addError(final UserException e) {
        return addError(e, null, DEFAULT_SEVERITY);
    }

    /**
     * Records {@code e} as an error, keeping the structured data it carries.
     * The exception's own domain is used when {@code domain} is {@code null}.
     *
     * @param e the user-facing failure
     * @param domain the translation domain, may be {@code null}
     * @param severity the severity
     * @return this validation
     */
    public Validation addError(final UserException e, final String domain, final int severity) {
        N.checkArgNotNull(e, "e");

        return addValidationError(new ValidationError(e.getMessage(), e.getExtraData(), domain == null ? e.getDomain() : domain, severity));
    }

    /**
     * Renders every error with {@code translator}, in the order they were added.
     *
     * @param translator the translation function
     * @return the reports
     */
    public List<ValidationReport> getReports(final Translator translator) {
        N.checkArgNotNull(translator, "translator");

        final List<ValidationReport> reports = new ArrayList<>(errors.size());

        for (final ValidationError error : errors) {
            reports.add(new ValidationReport(error.message(), translator.translate(error.message(), error.domain()), error.domain(), error.severity()));
        }

        return reports;
    }

    public List<ValidationError> getErrors() {
        return ImmutableList.copyOf(errors);
    }

    public int size() {
        return errors.size();
    }

    public boolean isValid() {
        return !hasErrors();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "Validation{errors=" + errors + "}";
    }
}
