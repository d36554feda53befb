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

import java.util.stream.Stream;

public final class Deciders {
    private Deciders() {
    }

    /**
     * Combines two deciders into one over the union of their commands and events and the product of their states.
     * A {@link Either.Left} command is decided by {@code first} against the first slice, a {@link Either.Right}
     * command by {@code second} against the second slice. Events only change the slice of the decider that owns
     * them, the other slice is returned as is.
     */
    public static <C1, S1, E1, C2, S2, E2> Decider<Either<C1, C2>, Pair<S1, S2>, Either<E1, E2>> combine(
            @NotNull Decider<C1, S1, E1> first,
            @NotNull Decider<C2, S2, E2> second) {
        return Decider.of(
                (Either<C1, C2> command, Pair<S1, S2> state) -> command.<Stream<Either<E1, E2>>>fold(
                        c1 -> first.decide(c1, state.first()).map(Either::<E1, E2>left),
                        c2 -> second.decide(c2, state.second()).map(Either::<E1, E2>right)),
                (Pair<S1, S2> state, Either<E1, E2> event) -> event.<Pair<S1, S2>>fold(
                        e1 -> state.withFirst(first.evolve(state.first(), e1)),
                        e2 -> state.withSecond(second.evolve(state.second(), e2))),
                Pair.of(first.initialState(), second.initialState()));
    }
}
