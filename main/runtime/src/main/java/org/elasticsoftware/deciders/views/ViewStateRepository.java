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

package org.elasticsoftware.deciders.views;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.deciders.protocol.ViewStateRecord;

import java.util.Optional;

public interface ViewStateRepository {
    String getViewName();

    Optional<ViewStateRecord> fetch(@NotNull String streamId);

    /**
     * Stores the new view state if the stored version still equals {@code priorVersion}, {@code null} meaning no
     * state may exist yet. The new version is derived from {@code appliedEventId}.
     *
     * @throws org.elasticsoftware.deciders.errors.ConcurrencyConflictException when the stored version differs
     */
    ViewStateRecord save(@NotNull String streamId,
                         @NotNull byte[] state,
                         @NotNull String appliedEventId,
                         @Nullable ViewVersion priorVersion);

    static ViewVersion versionOf(ViewStateRecord record) {
        return new ViewVersion(record.lastEventId());
    }
}
