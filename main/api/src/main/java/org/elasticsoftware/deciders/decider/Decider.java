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
import java.util.stream.Stream;

/**
 * Pure state machine that turns a command and the current state into new events, and folds events into state.
 * Implementations must not perform I/O and must return equal results for equal inputs.
 *
 * @param <C> command type
 * @param <S> state type, the initial state is commonly {@code null}
 * @param <E> event type
 */
public interface Decider<C, S, E> {
    @NotNull Stream<E> decide(@NotNull C command, @Nullable S state);

    S evolve(@Nullable S state, @NotNull E event);

    @Nullable S initialState();

    static <C, S, E> Decider<C, S, E> of(@NotNull DecideFunction<C, S, E> decide,
                                         @NotNull EvolveFunction<S, E> evolve,
                                         @Nullable S initialState) {
        return new SimpleDecider<>(decide, evolve, initialState);
    }

    default S fold(@NotNull Iterable<? extends E> events) {
        S state = initialState();
        for (E event : events) {
            state = evolve(state, event);
        }
        return state;
    }

    default <Cn> Decider<Cn, S, E> mapOnCommand(@NotNull Function<? super Cn, ? extends C> f) {
        return Decider.of(
                (Cn command, S state) -> decide(f.apply(command), state),
                this::evolve,
                initialState());
    }

    default <En> Decider<C, S, En> dimapOnEvent(@NotNull Function<? super En, ? extends E> fl,
                                                @NotNull Function<? super E, ? extends En> fr) {
        return Decider.of(
                (C command, S state) -> decide(command, state).<En>map(fr),
                (S state, En event) -> evolve(state, fl.apply(event)),
                initialState());
    }

    default <Sn> Decider<C, Sn, E> dimapOnState(@NotNull Function<? super Sn, ? extends S> fl,
                                                @NotNull Function<? super S, ? extends Sn> fr) {
        return Decider.of(
                (C command, Sn state) -> decide(command, fl.apply(state)),
                (Sn state, E event) -> fr.apply(evolve(fl.apply(state), event)),
                fr.apply(initialState()));
    }
}
