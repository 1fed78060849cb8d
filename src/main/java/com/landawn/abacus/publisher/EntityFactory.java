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

package com.landawn.abacus.publisher;

import java.util.Map;

/**
 * Builds an entity from a full row, usually the constructor of the entity class.
 *
 * <pre>{@code
 * EntityRepository<User> users = new EntityRepository<>(User.class, User.SCHEMA, User::new);
 * }</pre>
 *
 * @param <T> the entity type
 */
@FunctionalInterface
public interface EntityFactory<T extends PermanentObject> {

    T create(EntityRepository<T> repository, Map<String, Object> row);
}
