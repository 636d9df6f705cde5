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

package dev.mars.railway.workflow.validation;

import java.util.Objects;

/**
 * Outcome of checking a user-supplied entry or node name.
 *
 * @param valid        whether the name can be used as is
 * @param normalized   the name as it will be used; equal to the input when valid
 * @param errorMessage empty when valid
 * @param suggestion   a corrected name, empty when valid
 */
public record NameValidation(boolean valid, String normalized, String errorMessage, String suggestion) {

    public NameValidation {
        Objects.requireNonNull(normalized, "Normalized name cannot be null");
        Objects.requireNonNull(errorMessage, "Error message cannot be null");
        Objects.requireNonNull(suggestion, "Suggestion cannot be null");
    }

    public static NameValidation ok(String name) {
        return new NameValidation(true, name, "", "");
    }

    public static NameValidation invalid(String name, String errorMessage, String suggestion) {
        return new NameValidation(false, name, errorMessage, suggestion);
    }
}
