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

import java.util.Objects;
import java.util.function.Function;

/**
 * A value that is either a {@link Left} or a {@link Right}. Consumers branch with {@link #fold(Function, Function)}
 * so that both cases are always handled.
 *
 * @param <L> the type of the left value
 * @param <R> the type of the right value
 */
public sealed interface Either<L, R> permits Either.Left, Either.Right {
    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    <T> T fold(Function<? super L, ? extends T> ifLeft, Function<? super R, ? extends T> ifRight);

    default <L2> Either<L2, R> mapLeft(Function<? super L, ? extends L2> mapper) {
        return fold(l -> Either.left(mapper.apply(l)), Either::right);
    }

    default <R2> Either<L, R2> mapRight(Function<? super R, ? extends R2> mapper) {
        return fold(Either::left, r -> Either.right(mapper.apply(r)));
    }

    record Left<L, R>(L value) implements Either<L, R> {
        public Left {
            Objects.requireNonNull(value, "left value");
        }

        @Override
        public <T> T fold(Function<? super L, ? extends T> ifLeft, Function<? super R, ? extends T> ifRight) {
            return ifLeft.apply(value);
        }
    }

    record Right<L, R>(R value) implements Either<L, R> {
        public Right {
            Objects.requireNonNull(value, "right value");
        }

        @Override
        public <T> T fold(Function<? super L, ? extends T> ifLeft, Function<? super R, ? extends T> ifRight) {
            return ifRight.apply(value);
        }
    }
}
