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

import org.elasticsoftware.deciders.decider.View;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public final class ViewSpecification<S, E> {
    private final View<S, E> view;
    private final List<E> given;

    private ViewSpecification(View<S, E> view, List<E> given) {
        this.view = view;
        this.given = given;
    }

    public static <S, E> ViewSpecification<S, E> forView(View<S, E> view) {
        return new ViewSpecification<>(view, List.of());
    }

    @SafeVarargs
    public final ViewSpecification<S, E> given(E... events) {
        return new ViewSpecification<>(view, List.of(events));
    }

    public void then(S expected) {
        assertEquals(expected, view.fold(given));
    }
}
