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

/**
 * Classification of a node invocation result.
 */
public enum OutcomeType {
    SUCCESS("success"),
    FAILURE("failure");

    private final String label;

    OutcomeType(String label) {
        this.label = label;
    }

    /**
     * The lower-case label used inside state strings.
     */
    public String label() {
        return label;
    }

    public static OutcomeType fromLabel(String label) {
        for (OutcomeType type : values()) {
            if (type.label.equals(label)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown outcome type: " + label);
    }
}
