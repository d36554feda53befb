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

package org.elasticsoftware.deciders.views;

public enum ProjectionResult {
    /**
     * The event was folded into the view and the view was saved.
     */
    APPLIED,
    /**
     * The view already reflects this event (or a later one), nothing was written.
     */
    DUPLICATE,
    /**
     * Another writer updated the view concurrently, the update was dropped.
     */
    CONFLICT
}
