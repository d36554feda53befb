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
import jakarta.validation.constraints.NotNull;

import java.util.function.Function;

/**
 * Pure projection of events into a read model state.
 *
 * @param <S> view state type
 * @param <E> event type
 */
public interface View<S, E> {
    S evolve(@Nullable S state, @NotNull E event);

    @Nullable S initialState();

    static <S, E> View<S, E> of(@NotNull EvolveFunction<S, E> evolve, @Nullable S initialState) {
        return new SimpleView<>(evolve, initialState);
    }

    default S fold(@NotNull Iterable<? extends E> events) {
        S state = initialState();
        for (E event : events) {
            state = evolve(state, event);
        }
        return state;
    }

    default <En> View<S, En> dimapOnEvent(@NotNull Function<? super En, ? extends E> f) {
        return View.of((S state, En event) -> evolve(state, f.apply(event)), initialState());
    }

    default <Sn> View<Sn, E> dimapOnState(@NotNull Function<? super Sn, ? extends S> fl,
                                          @NotNull Function<? super S, ? extends Sn> fr) {
        return View.of(
                (Sn state, E event) -> fr.apply(evolve(fl.apply(state), event)),
                fr.apply(initialState()));
    }
}
