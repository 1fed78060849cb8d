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
import java.util.LinkedHashMap;
import java.util.Map;

import com.landawn.abacus.publisher.EntitySchema;
import com.landawn.abacus.publisher.PermanentObject;
import com.landawn.abacus.publisher.exception.InvalidFieldException;
import com.landawn.abacus.publisher.exception.UserException;
import com.landawn.abacus.util.ImmutableMap;
import com.landawn.abacus.util.N;

/**
 * A {@link FieldValidator} made of one {@link FieldCheck} per field.
 *
 * <p>For each allowed field, except the id field:</p>
 * <ul>
 *   <li>a field with a check gets the value returned by the check</li>
 *   <li>a field without a check gets the raw input value, if the input has one</li>
 *   <li>a value equal to the current value of the reference entity is left out of the payload</li>
 *   <li>a {@link UserException} thrown by a check is recorded as an {@link InvalidFieldException} and the next field is checked</li>
 * </ul>
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * FieldCheckValidator validator = FieldCheckValidator.create()
 *         .add("name", (input, ref) -> {
 *             String name = Strings.trim((String) input.get("name"));
 *             if (Strings.isEmpty(name)) {
 *                 throw new UserException("requiredField");
 *             }
 *             return name;
 *         });
 * }</pre>
 *
 * Required-ness is the business of each check, {@code ignoreRequired} is not used here.
 */
public final class FieldCheckValidator implements FieldValidator {

    private final Map<String, FieldCheck> checks;

    FieldCheckValidator(final Map<String, FieldCheck> checks) {
        this.checks = checks;
    }

    public static FieldCheckValidator create() {
        return new FieldCheckValidator(new LinkedHashMap<>());
    }

    public static FieldCheckValidator of(final Map<String, FieldCheck> checks) {
        N.checkArgNotNull(checks, "checks");

        return new FieldCheckValidator(new LinkedHashMap<>(checks));
    }

    public FieldCheckValidator add(final String field, final FieldCheck check) {
        N.checkArgNotNull(field, "field");
        N.checkArgNotNull(check, "check");

        checks.put(field, check);

        return this;
    }

    public Map<String, FieldCheck> getChecks() {
        return ImmutableMap.wrap(checks);
    }

    /**
     * Combines this validator with the one of a parent schema. Checks of this validator win over the parent's.
     *
     * @param parent the parent validator
     * @return a new validator
     */
    public FieldCheckValidator merge(final FieldCheckValidator parent) {
        final Map<String, FieldCheck> merged = new LinkedHashMap<>(parent.checks);
        merged.putAll(checks);

        return new FieldCheckValidator(merged);
    }

    @Override
    public ValidatedInput validate(final EntitySchema schema, final Map<String, ?> input, final Collection<String> fields, final PermanentObject ref,
            final boolean ignoreRequired) {
        final Validation validation = new Validation();
        final Map<String, Object> data = new LinkedHashMap<>();
        final Collection<String> fieldsToCheck = fields == null ? schema.getEditableFields() : fields;

        if (N.isEmpty(fieldsToCheck)) {
            return new ValidatedInput(data, validation);
        }

        for (final String field : fieldsToCheck) {
            if (field.equals(schema.getIdField())) {
                continue;
            }

            final FieldCheck check = checks.get(field);
            Object value = null;

            try {
                if (check != null) {
                    value = check.check(input, ref);
                } else if (input.containsKey(field)) {
                    value = input.get(field);
                } else {
                    continue;
                }
            } catch (final UserException e) {
                validation.addError(InvalidFieldException.from(e, field, input.get(field)), schema.getDomain(), Validation.DEFAULT_SEVERITY);
                continue;
            }

            if (ref == null || !isCurrentValue(ref, field, value)) {
                data.put(field, value);
            }
        }

        return new ValidatedInput(data, validation);
    }

    // Input usually comes as text, so "12" matches a stored 12.
    private static boolean isCurrentValue(final PermanentObject ref, final String field, final Object value) {
        if (!ref.getSchema().hasField(field)) {
            return false;
        }

        final Object current = ref.getValue(field);

        if (N.equals(value, current)) {
            return true;
        }

        return value != null && current != null && !(value instanceof byte[]) && value.toString().equals(current.toString());
    }

    @Override
    public String toString() {
        return "FieldCheckValidator{fields=" + checks.keySet() + "}";
    }
}
