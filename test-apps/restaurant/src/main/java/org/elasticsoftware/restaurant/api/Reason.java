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

package org.elasticsoftware.restaurant.api;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a command was rejected. Serialized as its human readable text.
 */
public enum Reason {
    RESTAURANT_ALREADY_EXISTS("Restaurant already exist!"),
    RESTAURANT_DOES_NOT_EXIST("Restaurant does not exist!"),
    ORDER_ALREADY_EXISTS("Order already exist!"),
    ORDER_DOES_NOT_EXIST("Order does not exist!");

    private final String text;

    Reason(String text) {
        this.text = text;
    }

    @JsonValue
    public String getText() {
        return text;
    }
}
