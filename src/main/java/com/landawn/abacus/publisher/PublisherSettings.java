/*
 * Copyright (c) 2021, Haiyang Li.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.landawn.abacus.publisher;

import java.time.Clock;

import com.landawn.abacus.publisher.validation.Translator;
import com.landawn.abacus.util.N;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Runtime settings of the entity layer. Each {@link EntityRepository} holds one, {@link #getDefault()} unless given another.
 *
 * <p><b>Usage Examples:</b></p>
 * <pre>{@code
 * PublisherSettings.setDefault(PublisherSettings.builder()
 *         .devMode(true)
 *         .translator(messages::get)
 *         .build());
 * }</pre>
 */
@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PublisherSettings {

    private static volatile PublisherSettings defaultSettings = PublisherSettings.builder().build(); //NOSONAR

    /** Whether a row missing a declared field is rejected with {@link com.landawn.abacus.publisher.exception.OutOfDateSchemaException}. */
    @Builder.Default
    private boolean checkFieldIntegrity = true;

    /** Whether {@link PermanentObject#checkIntegrity()} runs after each entity is built. */
    @Builder.Default
    private boolean devMode = false;

    @Builder.Default
    private Translator translator = Translator.IDENTITY;

    /** Source of the audit timestamps. */
    @Builder.Default
    private Clock clock = Clock.systemDefaultZone();

    /** Audit IP used when no {@link RequestInfo} is bound to the current thread. */
    @Builder.Default
    private String defaultClientIp = "127.0.0.1";

    public static PublisherSettings getDefault() {
        return defaultSettings;
    }

    public static void setDefault(final PublisherSettings settings) {
        defaultSettings = N.checkArgNotNull(settings, "settings");
    }
}
