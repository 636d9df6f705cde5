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
 * Result classification returned by a node: success or failure plus a free-text detail.
 * <p>
 * Nodes never build state strings themselves. The runner combines the node name with
 * the outcome through {@link #toStateString(String)}, so the routing mechanism stays
 * independent from node implementations.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-18
 * @version 1.0
 */
public record Outcome(OutcomeType type, String detail) {

    public static final String DEFAULT_SUCCESS_DETAIL = "done";
    public static final String DEFAULT_FAILURE_DETAIL = "error";

    public Outcome {
        Objects.requireNonNull(type, "Outcome type cannot be null");
        Objects.requireNonNull(detail, "Outcome detail cannot be null");
        if (detail.isEmpty()) {
            throw new IllegalArgumentException("Outcome detail cannot be empty");
        }
    }

    public static Outcome success() {
        return success(DEFAULT_SUCCESS_DETAIL);
    }

    public static Outcome success(String detail) {
        return new Outcome(OutcomeType.SUCCESS, detail);
    }

    public static Outcome failure() {
        return failure(DEFAULT_FAILURE_DETAIL);
    }

    public static Outcome failure(String detail) {
        return new Outcome(OutcomeType.FAILURE, detail);
    }

    public boolean isSuccess() {
        return type == OutcomeType.SUCCESS;
    }

    public boolean isFailure() {
        return type == OutcomeType.FAILURE;
    }

    /**
     * Builds the {@code node::outcome::detail} lookup key for the given node.
     */
    public String toStateString(String nodeName) {
        return StateStrings.makeState(nodeName, type.label(), detail);
    }

    @Override
    public String toString() {
        return "Outcome{" + type.label() + "::" + detail + "}";
    }
}
