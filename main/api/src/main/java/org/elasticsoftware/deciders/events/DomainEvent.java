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

package org.elasticsoftware.deciders.events;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotNull;

public interface DomainEvent {
    /**
     * Schema version of the event payload.
     */
    int version();

    @JsonIgnore
    @NotNull String getStreamId();

    @JsonIgnore
    @NotNull String getDecider();

    @JsonIgnore
    default String getKind() {
        return getClass().getSimpleName();
    }

    /**
     * Marks the last event of a stream's lifecycle. Carried for consumers, not enforced by the runtime.
     */
    boolean finalEvent();
}
