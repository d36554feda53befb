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

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class DecidersTests {
    // adds the command value to a running total
    private final Decider<Integer, Integer, Integer> counter = Decider.of(
            (command, state) -> Stream.of(command),
            (state, event) -> state + event,
            0);

    // appends the command to a list, rejects empty strings
    private final Decider<String, List<String>, String> recorder = Decider.of(
            (command, state) -> command.isEmpty() ? Stream.empty() : Stream.of(command.toUpperCase()),
            (state, event) -> Stream.concat(state.stream(), Stream.of(event)).toList(),
            List.of());

    @Test
    void testInitialStateIsPairOfInitialStates() {
        Decider<Either<Integer, String>, Pair<Integer, List<String>>, Either<Integer, String>> combined =
                Deciders.combine(counter, recorder);
        assertEquals(Pair.of(0, List.of()), combined.initialState());
    }

    @Test
    void testLeftCommandIsDecidedByFirst() {
        Decider<Either<Integer, String>, Pair<Integer, List<String>>, Either<Integer, String>> combined =
                Deciders.combine(counter, recorder);
        List<Either<Integer, String>> events = combined.decide(Either.left(5), combined.initialState()).toList();
        assertEquals(List.of(Either.<Integer, String>left(5)), events);
    }

    @Test
    void testRightCommandIsDecidedByFirstSliceOfSecond() {
        Decider<Either<Integer, String>, Pair<Integer, List<String>>, Either<Integer, String>> combined =
                Deciders.combine(counter, recorder);
        Pair<Integer, List<String>> state = Pair.of(3, List.of("A"));
        List<Either<Integer, String>> events = combined.decide(Either.right("b"), state).toList();
        assertEquals(List.of(Either.<Integer, String>right("B")), events);
        assertTrue(combined.decide(Either.right(""), state).toList().isEmpty());
    }

    @Test
    void testEvolveLeavesForeignSliceUntouched() {
        Decider<Either<Integer, String>, Pair<Integer, List<String>>, Either<Integer, String>> combined =
                Deciders.combine(counter, recorder);
        List<String> recorded = List.of("A");
        Pair<Integer, List<String>> state = Pair.of(1, recorded);

        Pair<Integer, List<String>> afterLeft = combined.evolve(state, Either.left(4));
        assertEquals(5, afterLeft.first());
        assertSame(recorded, afterLeft.second());

        Pair<Integer, List<String>> afterRight = combined.evolve(afterLeft, Either.right("B"));
        assertEquals(5, afterRight.first());
        assertEquals(List.of("A", "B"), afterRight.second());
    }

    @Test
    void testFoldOverMixedEvents() {
        Decider<Either<Integer, String>, Pair<Integer, List<String>>, Either<Integer, String>> combined =
                Deciders.combine(counter, recorder);
        Pair<Integer, List<String>> state = combined.fold(List.of(
                Either.left(1),
                Either.right("X"),
                Either.left(2),
                Either.right("Y")));
        assertEquals(Pair.of(3, List.of("X", "Y")), state);
    }

    @Test
    void testCombineIsAssociativeUpToRegrouping() {
        Decider<Boolean, Boolean, Boolean> toggle = Decider.of(
                (command, state) -> command.equals(state) ? Stream.empty() : Stream.of(command),
                (state, event) -> event,
                false);

        Decider<Either<Either<Integer, String>, Boolean>, Pair<Pair<Integer, List<String>>, Boolean>,
                Either<Either<Integer, String>, Boolean>> leftNested =
                Deciders.combine(Deciders.combine(counter, recorder), toggle);
        Decider<Either<Integer, Either<String, Boolean>>, Pair<Integer, Pair<List<String>, Boolean>>,
                Either<Integer, Either<String, Boolean>>> rightNested =
                Deciders.combine(counter, Deciders.combine(recorder, toggle));

        List<Either<Either<Integer, String>, Boolean>> leftEvents = List.of(
                Either.left(Either.left(2)),
                Either.right(true),
                Either.left(Either.right("q")));
        List<Either<Integer, Either<String, Boolean>>> rightEvents = List.of(
                Either.left(2),
                Either.right(Either.right(true)),
                Either.right(Either.left("q")));

        Pair<Pair<Integer, List<String>>, Boolean> leftState = leftNested.fold(leftEvents);
        Pair<Integer, Pair<List<String>, Boolean>> rightState = rightNested.fold(rightEvents);

        assertEquals(leftState.first().first(), rightState.first());
        assertEquals(leftState.first().second(), rightState.second().first());
        assertEquals(leftState.second(), rightState.second().second());
        assertEquals(List.of("q"), rightState.second().first());
    }

    @Test
    void testDecideIsDeterministic() {
        Decider<Either<Integer, String>, Pair<Integer, List<String>>, Either<Integer, String>> combined =
                Deciders.combine(counter, recorder);
        Pair<Integer, List<String>> state = Pair.of(7, List.of("Z"));
        assertEquals(
                combined.decide(Either.right("abc"), state).toList(),
                combined.decide(Either.right("abc"), state).toList());
    }
}
