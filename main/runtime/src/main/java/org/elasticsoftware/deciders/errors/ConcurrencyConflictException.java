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

package org.elasticsoftware.deciders.errors;

import jakarta.annotation.Nullable;
import org.elasticsoftware.deciders.DecidersException;

/**
 * Thrown when a write was based on a version token that is no longer current. Nothing was persisted, the caller
 * may reload and try again.
 */
public class ConcurrencyConflictException extends DecidersException {
    private final String expectedVersion;
    private final String actualVersion;

    public ConcurrencyConflictException(String streamId, @Nullable String expectedVersion, @Nullable String actualVersion) {
        super("Optimistic locking failure for stream " + streamId + ": expected version " + expectedVersion +
                " but found " + actualVersion, streamId);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    @Nullable
    public String getExpectedVersion() {
        return expectedVersion;
    }

    @Nullable
    public String getActualVersion() {
        return actualVersion;
    }
}
