/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.railway.core;

import java.util.Objects;

/**
 * Value returned by a regular node: the new context and the outcome that selects the
 * next transition. The context may be {@code null}; the outcome may not.
 */
public record NodeResult<C>(C context, Outcome outcome) {

    public NodeResult {
        Objects.requireNonNull(outcome, "Outcome cannot be null");
    }

    public static <C> NodeResult<C> of(C context, Outcome outcome) {
        return new NodeResult<>(context, outcome);
    }

    public static <C> NodeResult<C> success(C context, String detail) {
        return new NodeResult<>(context, Outcome.success(detail));
    }

    public static <C> NodeResult<C> failure(C context, String detail) {
        return new NodeResult<>(context, Outcome.failure(detail));
    }
}
