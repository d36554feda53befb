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

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;

import java.io.Closeable;
import java.util.List;
import java.util.Optional;

/**
 * Ordered, transactional key value storage. Reads outside a transaction see committed data only.
 */
public interface KeyValueStore extends Closeable {
    Optional<byte[]> get(@NotNull Key key);

    /**
     * Returns the entries whose key extends {@code prefix}, in key order, starting after {@code startAfter}
     * when given.
     */
    List<KeyValueEntry> scan(@NotNull Key prefix, @Nullable Key startAfter, int limit);

    default List<KeyValueEntry> scan(@NotNull Key prefix) {
        return scan(prefix, null, Integer.MAX_VALUE);
    }

    KeyValueTransaction beginTransaction();

    @Override
    void close();
}
