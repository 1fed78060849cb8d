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

package com.landawn.abacus.publisher.sql;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Returned by adapters that can't group statements. Only tracks the status.
 */
final class NoOpTransaction implements Transaction {

    private static final AtomicLong idGenerator = new AtomicLong();

    private final String id = "noop_" + idGenerator.incrementAndGet();

    private Status status = Status.ACTIVE;

    @Override
    public String id() {
        return id;
    }

    @Override
    public Status status() {
        return status;
    }

    @Override
    public boolean isActive() {
        return status == Status.ACTIVE;
    }

    @Override
    public boolean isRollbackSupported() {
        return false;
    }

    @Override
    public void commit() {
        if (status == Status.ACTIVE) {
            status = Status.COMMITTED;
        }
    }

    @Override
    public void rollback() {
        if (status == Status.ACTIVE) {
            status = Status.ROLLED_BACK;
        }
    }

    @Override
    public void rollbackIfNotCommitted() {
        rollback();
    }

    @Override
    public String toString() {
        return "NoOpTransaction={id=" + id + "}";
    }
}
