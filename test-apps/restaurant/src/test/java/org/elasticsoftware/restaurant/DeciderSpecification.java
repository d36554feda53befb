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

package org.elasticsoftware.restaurant;

import org.elasticsoftware.deciders.decider.Decider;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Given/when/then for deciders: the given events are folded into the state the command is decided against.
 */
public final class DeciderSpecification<C, S, E> {
    private final Decider<C, S, E> decider;
    private final List<E> given;

    private DeciderSpecification(Decider<C, S, E> decider, List<E> given) {
        this.decider = decider;
        this.given = given;
    }

    public static <C, S, E> DeciderSpecification<C, S, E> forDecider(Decider<C, S, E> decider) {
        return new DeciderSpecification<>(decider, List.of());
    }

    @SafeVarargs
    public final DeciderSpecification<C, S, E> given(E... events) {
        return new DeciderSpecification<>(decider, List.of(events));
    }

    public When when(C command) {
        return new When(command);
    }

    public final class When {
        private final C command;

        private When(C command) {
            this.command = command;
        }

        @SafeVarargs
        public final void then(E... expected) {
            S state = decider.fold(given);
            assertEquals(Arrays.asList(expected), decider.decide(command, state).toList());
        }

        public void thenNothing() {
            then();
        }
    }
}
