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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.landawn.abacus.publisher.validation.Translator;
import com.landawn.abacus.util.ImmutableList;
import com.landawn.abacus.util.N;

/**
 * A field-scoped input error. The message is {@code <field>_<key>}, e.g. {@code name_requiredField},
 * and the offending value, the field type and the validator arguments travel with it as extra data.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * try {
 *     checkEmail(input);
 * } catch (UserException e) {
 *     validation.addError(InvalidFieldException.from(e, "email", input.get("email")), "user", 1);
 * }
 * }</pre>
 */
public class InvalidFieldException extends UserException {

    private static final long serialVersionUID = 2309618730281451067L;

    private final String key;

    private final String field;

    private final transient Object value;

    private final String type;

    private final List<Object> args;

    public InvalidFieldException(final String key, final String field, final Object value) {
        this(key, field, value, null, null);
    }

    public InvalidFieldException(final String key, final String field, final Object value, final String type, final String domain, final Object... args) {
        super(field + "_" + key, domain);
        this.key = key;
        this.field = field;
        this.value = value;
        this.type = type;
        this.args = N.isEmpty(args) ? new ArrayList<>() : new ArrayList<>(Arrays.asList(args));
    }

    /**
     * Wraps a check failure into an error bound to {@code field}, keeping the original message as key and its domain.
     * The type and arguments of {@code e} are kept when it's an {@code InvalidFieldException} and none are given.
     *
     * @param e the failure raised by a field check
     * @param field the field being checked
     * @param value the rejected value
     * @param args the validator arguments
     * @return a new field-scoped error
     */
    public static InvalidFieldException from(final UserException e, final String field, final Object value, final Object... args) {
        return from(e, field, value, null, args);
    }

    public static InvalidFieldException from(final UserException e, final String field, final Object value, final String type, final Object... args) {
        if (e instanceof InvalidFieldException ife) {
            return new InvalidFieldException(ife.getKey(), field, value, type == null ? ife.getType() : type, e.getDomain(),
                    N.isEmpty(args) ? ife.args.toArray() : args);
        }

        return new InvalidFieldException(e.getMessage(), field, value, type, e.getDomain(), args);
    }

    public String getKey() {
        return key;
    }

    public String getField() {
        return field;
    }

    public Object getValue() {
        return value;
    }

    public String getType() {
        return type;
    }

    public List<Object> getArgs() {
        return ImmutableList.copyOf(args);
    }

    public void removeArgs() {
        args.clear();
    }

    /**
     * Renders this error for an end user.
     *
     * @param translator the translation function
     * @return the translated text
     */
    public String getText(final Translator translator) {
        return translator.translate(getMessage(), getDomain(), args.toArray());
    }

    @Override
    public Map<String, Object> getExtraData() {
        final Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("key", key);
        extra.put("field", field);
        extra.put("value", value);
        extra.put("type", type);
        extra.put("args", getArgs());

        return extra;
    }
}
