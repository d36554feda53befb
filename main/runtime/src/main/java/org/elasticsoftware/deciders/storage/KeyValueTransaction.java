/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.deciders.storage;

import jakarta.validation.constraints.NotNull;

import java.util.Optional;

/**
 * A unit of atomic work against a {@link KeyValueStore}. Writes become visible on {@link #commit()} only. Keys
 * read with {@link #getForUpdate(Key)} stay locked until the transaction ends, a concurrent transaction locking
 * the same key blocks until then. A transaction belongs to the thread that began it. Closing a transaction that
 * was not committed rolls it back.
 */
public interface KeyValueTransaction extends AutoCloseable {
    Optional<byte[]> get(@NotNull Key key);

    Optional<byte[]> getForUpdate(@NotNull Key key);

    void put(@NotNull Key key, @NotNull byte[] value);

    void delete(@NotNull Key key);

    void commit();

    void rollback();

    @Override
    void close();
}
