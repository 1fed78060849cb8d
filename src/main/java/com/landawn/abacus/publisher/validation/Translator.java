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

/**
 * Maps a message key in a translation domain to the text shown to end users.
 * Only used to render errors, never to decide control flow.
 */
@FunctionalInterface
public interface Translator {

    /**
     * Returns the key itself, with arguments appended in parentheses when there are any.
     */
    Translator IDENTITY = (key, domain, args) -> {
        if (args == null || args.length == 0) {
            return key;
        }

        final StringBuilder sb = new StringBuilder(key).append('(');

        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                sb.append(", ");
            }

            sb.append(args[i]);
        }

        return sb.append(')').toString();
    };

    /**
     *
     * @param key the message key
     * @param domain the translation domain, may be {@code null}
     * @param args the substitution arguments
     * @return the translated text
     */
    String translate(String key, String domain, Object... args);
}
