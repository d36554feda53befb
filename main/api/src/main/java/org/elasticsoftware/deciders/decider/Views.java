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

import jakarta.validation.constraints.NotNull;

public final class Views {
    private Views() {
    }

    /**
     * Combines two views over the union of their events. Each event only changes the slice of the view that owns it.
     */
    public static <S1, E1, S2, E2> View<Pair<S1, S2>, Either<E1, E2>> combine(@NotNull View<S1, E1> first,
                                                                             @NotNull View<S2, E2> second) {
        return View.of(
                (Pair<S1, S2> state, Either<E1, E2> event) -> event.<Pair<S1, S2>>fold(
                        e1 -> state.withFirst(first.evolve(state.first(), e1)),
                        e2 -> state.withSecond(second.evolve(state.second(), e2))),
                Pair.of(first.initialState(), second.initialState()));
    }
}
