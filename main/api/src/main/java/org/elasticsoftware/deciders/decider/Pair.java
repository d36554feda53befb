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

package org.elasticsoftware.deciders.decider;

import jakarta.annotation.Nullable;

/**
 * State of two combined machines. Either slice may be {@code null}.
 */
public record Pair<A, B>(@Nullable A first, @Nullable B second) {
    public static <A, B> Pair<A, B> of(@Nullable A first, @Nullable B second) {
        return new Pair<>(first, second);
    }

    public Pair<A, B> withFirst(@Nullable A first) {
        return new Pair<>(first, this.second);
    }

    public Pair<A, B> withSecond(@Nullable B second) {
        return new Pair<>(this.first, second);
    }
}
